package it.netdicom.presentation;

/** Role capability for one abstract syntax, from the point of view of the association requestor. */
public record ScpScuRole(boolean scu, boolean scp) {
}
