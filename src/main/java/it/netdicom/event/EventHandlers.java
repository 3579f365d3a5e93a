package it.netdicom.event;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.netdicom.acse.IdentityVerdict;
import it.netdicom.acse.NegotiationCallbacks;
import it.netdicom.pdu.UserInformation.AsyncOperationsWindow;
import it.netdicom.pdu.UserInformation.SopClassCommonExtended;
import it.netdicom.pdu.UserInformation.SopClassExtended;
import it.netdicom.pdu.UserInformation.UserIdentity;

/**
 * Handler bindings and notification subscriptions of an application entity or a single association.
 */
public class EventHandlers {

    private static final Logger logger = LoggerFactory.getLogger(EventHandlers.class);

    private final Map<HandlerType<?>, Object> handlers = new ConcurrentHashMap<>();
    private final Map<EventType, List<NotificationListener>> listeners = new ConcurrentHashMap<>();

    public <H> void bind(HandlerType<H> type, H handler) {
        if (handler == null) {
            throw new IllegalArgumentException("Handler for " + type + " is required");
        }
        handlers.put(type, handler);
    }

    public void unbind(HandlerType<?> type) {
        handlers.remove(type);
    }

    public <H> Optional<H> handler(HandlerType<H> type) {
        return Optional.ofNullable(handlers.get(type)).map(type::cast);
    }

    public void subscribe(EventType type, NotificationListener listener) {
        listeners.computeIfAbsent(type, key -> new CopyOnWriteArrayList<>()).add(listener);
    }

    public void unsubscribe(EventType type, NotificationListener listener) {
        listeners.getOrDefault(type, List.of()).remove(listener);
    }

    /** Delivers a notification synchronously. Listener failures are logged and do not affect the association. */
    public void publish(Notification notification) {
        for (NotificationListener listener : listeners.getOrDefault(notification.type(), List.of())) {
            try {
                listener.onEvent(notification);
            } catch (RuntimeException e) {
                logger.error("Listener for {} failed: {}", notification.type(), e.getMessage(), e);
            }
        }
    }

    /** Copy whose later changes do not affect this instance. */
    public EventHandlers copy() {
        EventHandlers copy = new EventHandlers();
        copy.handlers.putAll(handlers);
        listeners.forEach((type, list) -> copy.listeners.put(type, new CopyOnWriteArrayList<>(list)));
        return copy;
    }

    /** Extended negotiation callbacks backed by the bound intervention handlers. */
    public NegotiationCallbacks negotiationCallbacks() {
        return new NegotiationCallbacks() {
            @Override
            public IdentityVerdict verifyUserIdentity(UserIdentity identity) {
                return handler(HandlerType.USER_IDENTITY)
                    .map(handler -> handler.verify(identity))
                    .orElseGet(() -> NegotiationCallbacks.DEFAULTS.verifyUserIdentity(identity));
            }

            @Override
            public AsyncOperationsWindow asyncOperations(AsyncOperationsWindow requested) {
                return handler(HandlerType.ASYNC_OPERATIONS)
                    .map(handler -> handler.reply(requested))
                    .orElseGet(() -> NegotiationCallbacks.DEFAULTS.asyncOperations(requested));
            }

            @Override
            public List<SopClassExtended> sopClassExtended(List<SopClassExtended> requested) {
                return handler(HandlerType.SOP_CLASS_EXTENDED)
                    .map(handler -> handler.reply(requested))
                    .orElseGet(() -> NegotiationCallbacks.DEFAULTS.sopClassExtended(requested));
            }

            @Override
            public List<SopClassCommonExtended> sopClassCommonExtended(List<SopClassCommonExtended> requested) {
                return handler(HandlerType.SOP_CLASS_COMMON_EXTENDED)
                    .map(handler -> handler.accept(requested))
                    .orElseGet(() -> NegotiationCallbacks.DEFAULTS.sopClassCommonExtended(requested));
            }
        };
    }
}
