package it.netdicom.event;

import java.util.Iterator;
import java.util.Optional;

/**
 * What a C-GET or C-MOVE handler returns: the move destination (C-MOVE only), the number of
 * sub-operations and one result per sub-operation.
 */
public record RetrieveResponse(Optional<Destination> destination, int subOperations, Iterator<RetrieveResult> results) {

    public RetrieveResponse {
        destination = destination == null ? Optional.empty() : destination;
    }

    public static RetrieveResponse get(int subOperations, Iterator<RetrieveResult> results) {
        return new RetrieveResponse(Optional.empty(), subOperations, results);
    }

    public static RetrieveResponse move(Destination destination, int subOperations, Iterator<RetrieveResult> results) {
        return new RetrieveResponse(Optional.ofNullable(destination), subOperations, results);
    }

    /** Address of a known move destination. */
    public record Destination(String host, int port) {

        public Destination {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("Move destination host is required");
            }
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("Move destination port out of range: " + port);
            }
        }
    }
}
