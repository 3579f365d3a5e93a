package it.netdicom.dimse;

/**
 * Seam to the data-model library that encodes and decodes data sets. The message layer never inspects data set contents.
 *
 * @param <D> the library's data set type
 */
public interface DatasetCodec<D> {

    /**
     * @throws DatasetDecodeException when the bytes are not a valid data set in the given transfer syntax
     */
    D decode(byte[] encoded, String transferSyntax);

    byte[] encode(D dataSet, String transferSyntax);
}
