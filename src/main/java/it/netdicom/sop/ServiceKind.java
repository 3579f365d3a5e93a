package it.netdicom.sop;

public enum ServiceKind {
    VERIFICATION,
    STORAGE,
    QUERY_RETRIEVE,
    NORMALIZED
}
