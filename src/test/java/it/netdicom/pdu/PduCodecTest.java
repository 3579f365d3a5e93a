package it.netdicom.pdu;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import it.netdicom.pdu.UserInformation.AsyncOperationsWindow;
import it.netdicom.pdu.UserInformation.RoleSelection;
import it.netdicom.pdu.UserInformation.SopClassCommonExtended;
import it.netdicom.pdu.UserInformation.SopClassExtended;
import it.netdicom.pdu.UserInformation.UserIdentity;
import it.netdicom.pdu.UserInformation.UserIdentityResponse;

class PduCodecTest {

    private static final String APP_CONTEXT = "1.2.840.10008.3.1.1.1";
    private static final String VERIFICATION = "1.2.840.10008.1.1";
    private static final String CT = "1.2.840.10008.5.1.4.1.1.2";
    private static final String IMPLICIT = "1.2.840.10008.1.2";
    private static final String EXPLICIT = "1.2.840.10008.1.2.1";

    @Test
    void shouldEncodeReleaseRqAsTenBytes() {
        byte[] encoded = PduCodec.encode(new Pdu.ReleaseRq());
        assertArrayEquals(new byte[]{0x05, 0, 0, 0, 0, 4, 0, 0, 0, 0}, encoded);
        assertInstanceOf(Pdu.ReleaseRq.class, PduCodec.decode(encoded));
    }

    @Test
    void shouldEncodeAbortSourceAndReason() {
        byte[] encoded = PduCodec.encode(new Pdu.Abort(2, 6));
        assertArrayEquals(new byte[]{0x07, 0, 0, 0, 0, 4, 0, 0, 2, 6}, encoded);
        assertEquals(new Pdu.Abort(2, 6), PduCodec.decode(encoded));
    }

    @Test
    void shouldEncodeAssociateRjFields() {
        byte[] encoded = PduCodec.encode(new Pdu.AssociateRj(1, 1, 7));
        assertArrayEquals(new byte[]{0x03, 0, 0, 0, 0, 4, 0, 1, 1, 7}, encoded);
        assertEquals(new Pdu.AssociateRj(1, 1, 7), PduCodec.decode(encoded));
    }

    @Test
    void shouldRoundTripAssociateRqWithEveryUserInformationSubItem() {
        UserInformation info = new UserInformation(
            16382,
            Optional.of("1.2.3.4"),
            Optional.of("NETDICOM_100"),
            Optional.of(new AsyncOperationsWindow(5, 3)),
            List.of(new RoleSelection(CT, true, true)),
            List.of(new SopClassExtended(CT, new byte[]{1, 0, 1})),
            List.of(new SopClassCommonExtended(CT, "1.2.840.10008.4.2", List.of("1.2.3.5", "1.2.3.6"))),
            Optional.of(UserIdentity.usernameAndPasscode("alice", "secret", true)),
            Optional.empty()
        );
        Pdu.AssociateRq rq = new Pdu.AssociateRq(1, "ANY-SCP", "ECHOSCU", APP_CONTEXT, List.of(
            new PresentationContextRqItem(1, VERIFICATION, List.of(IMPLICIT)),
            new PresentationContextRqItem(3, CT, List.of(EXPLICIT, IMPLICIT))
        ), info);

        Pdu decoded = PduCodec.decode(PduCodec.encode(rq));

        assertEquals(rq, decoded);
    }

    @Test
    void shouldPadAeTitlesWithSpacesOnTheWire() {
        Pdu.AssociateRq rq = new Pdu.AssociateRq(1, "SCP", "SCU", APP_CONTEXT,
            List.of(new PresentationContextRqItem(1, VERIFICATION, List.of(IMPLICIT))),
            UserInformation.of(0, null, null));

        byte[] encoded = PduCodec.encode(rq);

        byte[] called = Arrays.copyOfRange(encoded, 10, 26);
        assertEquals("SCP             ", new String(called, StandardCharsets.US_ASCII));
        assertEquals(encoded.length - PduCodec.HEADER_LENGTH, ((encoded[2] & 0xFF) << 24) | ((encoded[3] & 0xFF) << 16)
            | ((encoded[4] & 0xFF) << 8) | (encoded[5] & 0xFF));
    }

    @Test
    void shouldRoundTripAssociateAcWithRejectedContextAndIdentityResponse() {
        UserInformation info = new UserInformation(
            0,
            Optional.of("1.2.3.4"),
            Optional.empty(),
            Optional.empty(),
            List.of(),
            List.of(),
            List.of(),
            Optional.empty(),
            Optional.of(new UserIdentityResponse("token".getBytes(StandardCharsets.US_ASCII)))
        );
        Pdu.AssociateAc ac = new Pdu.AssociateAc(1, "ANY-SCP", "ECHOSCU", APP_CONTEXT, List.of(
            new PresentationContextAcItem(1, 0, Optional.of(IMPLICIT)),
            new PresentationContextAcItem(3, 3, Optional.of(EXPLICIT))
        ), info);

        assertEquals(ac, PduCodec.decode(PduCodec.encode(ac)));
    }

    @Test
    void shouldKeepPresentationDataValuesInOrder() {
        Pdu.PDataTf data = new Pdu.PDataTf(List.of(
            PresentationDataValue.of(1, true, true, new byte[]{1, 2, 3}),
            PresentationDataValue.of(1, false, false, new byte[0]),
            PresentationDataValue.of(3, false, true, new byte[]{9})
        ));

        byte[] encoded = PduCodec.encode(data);

        assertEquals(PduCodec.HEADER_LENGTH + 9 + 6 + 7, encoded.length);
        assertEquals(data, PduCodec.decode(encoded));
    }

    @Test
    void rejectsUnknownPduType() {
        byte[] encoded = {0x09, 0, 0, 0, 0, 4, 0, 0, 0, 0};
        assertThrows(MalformedPduException.class, () -> PduCodec.decode(encoded));
    }

    @Test
    void rejectsLengthMismatch() {
        byte[] encoded = {0x05, 0, 0, 0, 0, 6, 0, 0, 0, 0};
        assertThrows(MalformedPduException.class, () -> PduCodec.decode(encoded));
    }

    @Test
    void rejectsPdvWithLengthBeyondThePdu() {
        byte[] encoded = {0x04, 0, 0, 0, 0, 6, 0, 0, 0, 9, 1, 3};
        assertThrows(MalformedPduException.class, () -> PduCodec.decode(encoded));
    }

    @Test
    void rejectsAssociateRjWithInvalidResult() {
        byte[] encoded = {0x03, 0, 0, 0, 0, 4, 0, 3, 1, 1};
        assertThrows(MalformedPduException.class, () -> PduCodec.decode(encoded));
    }

    @Test
    void rejectsAssociateRqWithoutUserInformation() {
        Pdu.AssociateRq rq = new Pdu.AssociateRq(1, "SCP", "SCU", APP_CONTEXT,
            List.of(new PresentationContextRqItem(1, VERIFICATION, List.of(IMPLICIT))),
            UserInformation.of(16384, null, null));
        byte[] encoded = PduCodec.encode(rq);
        // user information is the last item: 4-byte header plus the 8-byte maximum length sub-item
        byte[] truncated = Arrays.copyOf(encoded, encoded.length - 12);
        int length = truncated.length - PduCodec.HEADER_LENGTH;
        truncated[2] = (byte) (length >>> 24);
        truncated[3] = (byte) (length >>> 16);
        truncated[4] = (byte) (length >>> 8);
        truncated[5] = (byte) length;

        assertThrows(MalformedPduException.class, () -> PduCodec.decode(truncated));
    }

    @Test
    void shouldReadConsecutivePdusFromStream() throws IOException {
        byte[] first = PduCodec.encode(new Pdu.ReleaseRq());
        byte[] second = PduCodec.encode(new Pdu.Abort(0, 0));
        byte[] stream = new byte[first.length + second.length];
        System.arraycopy(first, 0, stream, 0, first.length);
        System.arraycopy(second, 0, stream, first.length, second.length);
        ByteArrayInputStream in = new ByteArrayInputStream(stream);

        assertInstanceOf(Pdu.ReleaseRq.class, PduCodec.read(in));
        assertEquals(new Pdu.Abort(0, 0), PduCodec.read(in));
        assertNull(PduCodec.read(in));
    }

    @Test
    void shouldFailOnStreamEndingInsideAPdu() {
        byte[] encoded = PduCodec.encode(new Pdu.ReleaseRp());
        ByteArrayInputStream in = new ByteArrayInputStream(Arrays.copyOf(encoded, 7));
        IOException error = assertThrows(IOException.class, () -> PduCodec.read(in));
        assertTrue(error instanceof EOFException);
    }

    @Test
    void rejectsPDataDeclaringMoreThanTheLocalMaximum() {
        byte[] header = {0x04, 0, 0x7F, (byte) 0xFF, (byte) 0xFF, 0};
        PduTooLargeException error = assertThrows(PduTooLargeException.class,
            () -> PduCodec.read(new ByteArrayInputStream(header), 16384));
        assertEquals(0x7FFFFF00L, error.declaredLength());
    }

    @Test
    void acceptsPDataWithinTheToleranceOverTheLocalMaximum() throws IOException {
        byte[] payload = new byte[16384];
        byte[] encoded = PduCodec.encode(new Pdu.PDataTf(List.of(PresentationDataValue.of(1, true, true, payload))));

        Pdu pdu = PduCodec.read(new ByteArrayInputStream(encoded), 16384);

        assertArrayEquals(payload, ((Pdu.PDataTf) pdu).values().get(0).data());
    }

    @Test
    void hugeDeclaredLengthWithoutLimitFailsOnMissingBytesInsteadOfAllocating() {
        byte[] header = {0x04, 0, 0x7F, (byte) 0xFF, (byte) 0xFF, 0};
        assertThrows(EOFException.class, () -> PduCodec.read(new ByteArrayInputStream(header)));
    }

    @Test
    void rejectsAssociateRqLargerThanTheAssociationLimit() {
        long declared = PduCodec.MAX_ASSOCIATION_PDU_LENGTH + 1;
        byte[] header = {0x01, 0, (byte) (declared >>> 24), (byte) (declared >>> 16), (byte) (declared >>> 8), (byte) declared};
        assertThrows(PduTooLargeException.class, () -> PduCodec.read(new ByteArrayInputStream(header), 0));
    }

    @Test
    void shouldReadLargePDataArrivingInChunks() throws IOException {
        byte[] payload = new byte[200_000];
        for (int i = 0; i < payload.length; i++) {
            payload[i] = (byte) (i * 31);
        }
        byte[] encoded = PduCodec.encode(new Pdu.PDataTf(List.of(PresentationDataValue.of(3, false, true, payload))));

        Pdu pdu = PduCodec.read(new ByteArrayInputStream(encoded), 0);

        assertEquals(PduCodec.decode(encoded), pdu);
    }

    @Test
    void timeoutBeforeAPduStartsIsReportedAsTimeout() {
        assertThrows(SocketTimeoutException.class, () -> PduCodec.read(new StallingInputStream(new byte[0])));
    }

    @Test
    void timeoutInsideAPduIsATransportFailure() {
        byte[] encoded = PduCodec.encode(new Pdu.ReleaseRq());
        IOException error = assertThrows(IOException.class,
            () -> PduCodec.read(new StallingInputStream(Arrays.copyOf(encoded, 8))));
        assertFalse(error instanceof SocketTimeoutException);
        assertInstanceOf(SocketTimeoutException.class, error.getCause());
    }

    /** Serves the given bytes, then times out as a socket with SO_TIMEOUT would. */
    private static final class StallingInputStream extends InputStream {

        private final ByteArrayInputStream delegate;

        StallingInputStream(byte[] available) {
            this.delegate = new ByteArrayInputStream(available);
        }

        @Override
        public int read() throws IOException {
            if (delegate.available() == 0) {
                throw new SocketTimeoutException("Read timed out");
            }
            return delegate.read();
        }

        @Override
        public int read(byte[] target, int offset, int length) throws IOException {
            if (delegate.available() == 0) {
                throw new SocketTimeoutException("Read timed out");
            }
            return delegate.read(target, offset, length);
        }
    }
}
