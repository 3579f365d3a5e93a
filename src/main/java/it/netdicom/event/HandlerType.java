package it.netdicom.event;

import java.util.List;

import it.netdicom.dimse.CommandField;

/**
 * Typed key for an intervention handler: the handler decides the outcome of the event it is bound to.
 *
 * @param <H> the handler contract
 */
public final class HandlerType<H> {

    public static final HandlerType<Handlers.StatusHandler> C_ECHO = new HandlerType<>("C-ECHO", Handlers.StatusHandler.class);
    public static final HandlerType<Handlers.StatusHandler> C_STORE = new HandlerType<>("C-STORE", Handlers.StatusHandler.class);
    public static final HandlerType<Handlers.FindHandler> C_FIND = new HandlerType<>("C-FIND", Handlers.FindHandler.class);
    public static final HandlerType<Handlers.RetrieveHandler> C_GET = new HandlerType<>("C-GET", Handlers.RetrieveHandler.class);
    public static final HandlerType<Handlers.RetrieveHandler> C_MOVE = new HandlerType<>("C-MOVE", Handlers.RetrieveHandler.class);
    public static final HandlerType<Handlers.NormalizedHandler> N_EVENT_REPORT = new HandlerType<>("N-EVENT-REPORT", Handlers.NormalizedHandler.class);
    public static final HandlerType<Handlers.NormalizedHandler> N_GET = new HandlerType<>("N-GET", Handlers.NormalizedHandler.class);
    public static final HandlerType<Handlers.NormalizedHandler> N_SET = new HandlerType<>("N-SET", Handlers.NormalizedHandler.class);
    public static final HandlerType<Handlers.NormalizedHandler> N_ACTION = new HandlerType<>("N-ACTION", Handlers.NormalizedHandler.class);
    public static final HandlerType<Handlers.NormalizedHandler> N_CREATE = new HandlerType<>("N-CREATE", Handlers.NormalizedHandler.class);
    public static final HandlerType<Handlers.NormalizedHandler> N_DELETE = new HandlerType<>("N-DELETE", Handlers.NormalizedHandler.class);
    public static final HandlerType<Handlers.UserIdentityHandler> USER_IDENTITY = new HandlerType<>("USER-IDENTITY", Handlers.UserIdentityHandler.class);
    public static final HandlerType<Handlers.AsyncOperationsHandler> ASYNC_OPERATIONS = new HandlerType<>("ASYNC-OPERATIONS", Handlers.AsyncOperationsHandler.class);
    public static final HandlerType<Handlers.SopClassExtendedHandler> SOP_CLASS_EXTENDED = new HandlerType<>("SOP-CLASS-EXTENDED", Handlers.SopClassExtendedHandler.class);
    public static final HandlerType<Handlers.SopClassCommonExtendedHandler> SOP_CLASS_COMMON_EXTENDED = new HandlerType<>("SOP-CLASS-COMMON-EXTENDED", Handlers.SopClassCommonExtendedHandler.class);

    private static final List<HandlerType<Handlers.NormalizedHandler>> NORMALIZED = List.of(
        N_EVENT_REPORT, N_GET, N_SET, N_ACTION, N_CREATE, N_DELETE
    );

    private final String name;
    private final Class<H> contract;

    private HandlerType(String name, Class<H> contract) {
        this.name = name;
        this.contract = contract;
    }

    public String name() {
        return name;
    }

    H cast(Object handler) {
        return contract.cast(handler);
    }

    /** Handler type for an N-* request. */
    public static HandlerType<Handlers.NormalizedHandler> normalized(CommandField request) {
        String operation = request.operation();
        return NORMALIZED.stream()
            .filter(type -> type.name.equals(operation))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(request + " is not a normalized request"));
    }

    @Override
    public String toString() {
        return name;
    }
}
