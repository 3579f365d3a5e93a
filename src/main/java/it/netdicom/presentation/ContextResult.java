package it.netdicom.presentation;

public enum ContextResult {
    ACCEPTANCE(0, "Accepted"),
    USER_REJECTION(1, "User rejection"),
    NO_REASON(2, "Provider rejection, no reason given"),
    ABSTRACT_SYNTAX_NOT_SUPPORTED(3, "Abstract syntax not supported"),
    TRANSFER_SYNTAXES_NOT_SUPPORTED(4, "Transfer syntaxes not supported");

    private final int code;
    private final String description;

    ContextResult(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }

    public static ContextResult fromCode(int code) {
        for (ContextResult result : values()) {
            if (result.code == code) {
                return result;
            }
        }
        throw new IllegalArgumentException("Unknown presentation context result " + code);
    }
}
