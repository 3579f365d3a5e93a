package it.netdicom.dimse;

/** The association was aborted while a caller was waiting on it. */
public class AssociationAbortedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public AssociationAbortedException(String message) {
        super(message);
    }
}
