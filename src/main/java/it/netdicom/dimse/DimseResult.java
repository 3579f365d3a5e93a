package it.netdicom.dimse;

import java.util.Optional;

/**
 * Status plus optional encoded data set returned by a service handler for one response.
 */
public record DimseResult(int status, byte[] dataSet, Optional<String> errorComment) {

    public DimseResult {
        if (status < 0 || status > 0xFFFF) {
            throw new IllegalArgumentException("Status out of range: " + status);
        }
        errorComment = errorComment == null ? Optional.empty() : errorComment;
    }

    public static DimseResult of(int status) {
        return new DimseResult(status, null, Optional.empty());
    }

    public static DimseResult of(int status, byte[] dataSet) {
        return new DimseResult(status, dataSet, Optional.empty());
    }

    public static DimseResult failure(int status, String errorComment) {
        return new DimseResult(status, null, Optional.ofNullable(errorComment));
    }

    public static DimseResult pending(byte[] identifier) {
        return of(Status.PENDING, identifier);
    }

    public StatusCategory category() {
        return StatusCategory.of(status);
    }

    public boolean hasDataSet() {
        return dataSet != null;
    }
}
