package it.netdicom.event;

import java.util.Optional;

import it.netdicom.dimse.Status;

/**
 * One step of a retrieve: either an instance to send as a C-STORE sub-operation (pending), or a status that ends the retrieve.
 */
public record RetrieveResult(int status, Optional<Instance> instance) {

    public static RetrieveResult of(Instance instance) {
        return new RetrieveResult(Status.PENDING, Optional.of(instance));
    }

    public static RetrieveResult status(int status) {
        return new RetrieveResult(status, Optional.empty());
    }

    /** A composite instance already encoded in its transfer syntax. */
    public record Instance(String sopClassUid, String sopInstanceUid, String transferSyntax, byte[] dataSet) {

        public Instance {
            if (dataSet == null) {
                throw new IllegalArgumentException("Instance " + sopInstanceUid + " has no data set");
            }
        }
    }
}
