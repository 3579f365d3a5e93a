package it.netdicom.sop;

import java.util.regex.Pattern;

public final class Uids {

    public static final int MAX_LENGTH = 64;

    public static final String APPLICATION_CONTEXT = "1.2.840.10008.3.1.1.1";
    public static final String IMPLEMENTATION_CLASS = "1.2.826.0.1.3680043.9.3811.1.0";
    public static final String IMPLEMENTATION_VERSION = "NETDICOM_100";

    private static final Pattern COMPONENTS = Pattern.compile("(0|[1-9][0-9]*)(\\.(0|[1-9][0-9]*))*");

    private Uids() {
    }

    public static boolean isValid(String uid) {
        return uid != null && !uid.isEmpty() && uid.length() <= MAX_LENGTH && COMPONENTS.matcher(uid).matches();
    }

    public static String require(String uid, String what) {
        if (!isValid(uid)) {
            throw new IllegalArgumentException("Invalid " + what + " UID [" + uid + "]");
        }
        return uid;
    }
}
