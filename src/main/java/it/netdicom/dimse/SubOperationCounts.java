package it.netdicom.dimse;

/** C-GET / C-MOVE sub-operation counters reported in each response. */
public record SubOperationCounts(int remaining, int completed, int failed, int warning) {

    public SubOperationCounts {
        if (remaining < 0 || completed < 0 || failed < 0 || warning < 0) {
            throw new IllegalArgumentException("Sub-operation counters must not be negative");
        }
    }

    public static SubOperationCounts of(int total) {
        return new SubOperationCounts(total, 0, 0, 0);
    }

    public SubOperationCounts record(StatusCategory outcome) {
        return switch (outcome) {
            case SUCCESS -> new SubOperationCounts(remaining - 1, completed + 1, failed, warning);
            case WARNING -> new SubOperationCounts(remaining - 1, completed, failed, warning + 1);
            default -> new SubOperationCounts(remaining - 1, completed, failed + 1, warning);
        };
    }

    /** Marks every remaining sub-operation as failed, e.g. after cancellation or a lost destination. */
    public SubOperationCounts failRemaining() {
        return new SubOperationCounts(0, completed, failed + remaining, warning);
    }

    public int total() {
        return remaining + completed + failed + warning;
    }
}
