package it.netdicom.sop;

public record SopClass(String name, String uid, ServiceKind serviceKind) {

    public SopClass {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("SOP class name is required");
        }
        Uids.require(uid, "SOP class");
        if (serviceKind == null) {
            throw new IllegalArgumentException("SOP class service kind is required");
        }
    }
}
