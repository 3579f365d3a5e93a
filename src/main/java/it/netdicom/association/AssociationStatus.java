package it.netdicom.association;

public enum AssociationStatus {
    PENDING,
    ESTABLISHED,
    REJECTED,
    RELEASED,
    ABORTED;

    public boolean isTerminal() {
        return this == REJECTED || this == RELEASED || this == ABORTED;
    }
}
