package it.netdicom.acse;

import it.netdicom.pdu.Pdu;

/**
 * A-ASSOCIATE-RJ result, source and reason/diagnostic (PS3.8 9.3.4).
 */
public record Rejection(int result, int source, int reason) {

    public static final int PERMANENT = 1;
    public static final int TRANSIENT = 2;

    public static final int SOURCE_SERVICE_USER = 1;
    public static final int SOURCE_SERVICE_PROVIDER_ACSE = 2;
    public static final int SOURCE_SERVICE_PROVIDER_PRESENTATION = 3;

    public static final Rejection NO_REASON_GIVEN = new Rejection(PERMANENT, SOURCE_SERVICE_USER, 1);
    public static final Rejection APPLICATION_CONTEXT_NOT_SUPPORTED = new Rejection(PERMANENT, SOURCE_SERVICE_USER, 2);
    public static final Rejection CALLING_AE_NOT_RECOGNIZED = new Rejection(PERMANENT, SOURCE_SERVICE_USER, 3);
    public static final Rejection CALLED_AE_NOT_RECOGNIZED = new Rejection(PERMANENT, SOURCE_SERVICE_USER, 7);
    public static final Rejection PROTOCOL_VERSION_NOT_SUPPORTED = new Rejection(PERMANENT, SOURCE_SERVICE_PROVIDER_ACSE, 2);
    public static final Rejection USER_IDENTITY_FAILED = new Rejection(TRANSIENT, SOURCE_SERVICE_PROVIDER_ACSE, 1);
    public static final Rejection LOCAL_LIMIT_EXCEEDED = new Rejection(TRANSIENT, SOURCE_SERVICE_PROVIDER_PRESENTATION, 2);

    public static Rejection of(Pdu.AssociateRj pdu) {
        return new Rejection(pdu.result(), pdu.source(), pdu.reason());
    }

    public Pdu.AssociateRj toPdu() {
        return new Pdu.AssociateRj(result, source, reason);
    }

    public String describe() {
        String kind = result == PERMANENT ? "Rejected (Permanent)" : "Rejected (Transient)";
        return kind + ", " + sourceDescription() + ", " + reasonDescription();
    }

    private String sourceDescription() {
        return switch (source) {
            case SOURCE_SERVICE_USER -> "Service User";
            case SOURCE_SERVICE_PROVIDER_ACSE -> "Service Provider (ACSE)";
            case SOURCE_SERVICE_PROVIDER_PRESENTATION -> "Service Provider (Presentation)";
            default -> "Unknown source " + source;
        };
    }

    private String reasonDescription() {
        if (source == SOURCE_SERVICE_USER) {
            return switch (reason) {
                case 1 -> "No reason given";
                case 2 -> "Application context name not supported";
                case 3 -> "Calling AE title not recognised";
                case 7 -> "Called AE title not recognised";
                default -> "Reserved reason " + reason;
            };
        }
        if (source == SOURCE_SERVICE_PROVIDER_ACSE) {
            return switch (reason) {
                case 1 -> "No reason given";
                case 2 -> "Protocol version not supported";
                default -> "Reserved reason " + reason;
            };
        }
        return switch (reason) {
            case 1 -> "Temporary congestion";
            case 2 -> "Local limit exceeded";
            default -> "Reserved reason " + reason;
        };
    }
}
