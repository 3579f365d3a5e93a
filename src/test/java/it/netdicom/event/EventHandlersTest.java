package it.netdicom.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import it.netdicom.acse.IdentityVerdict;
import it.netdicom.acse.NegotiationCallbacks;
import it.netdicom.dimse.CommandField;
import it.netdicom.dimse.Status;
import it.netdicom.pdu.UserInformation.AsyncOperationsWindow;
import it.netdicom.pdu.UserInformation.SopClassExtended;
import it.netdicom.pdu.UserInformation.UserIdentity;

class EventHandlersTest {

    @Test
    void boundHandlerIsReturnedUntilUnbound() {
        EventHandlers handlers = new EventHandlers();
        Handlers.StatusHandler echo = event -> Status.SUCCESS;

        handlers.bind(HandlerType.C_ECHO, echo);

        assertSame(echo, handlers.handler(HandlerType.C_ECHO).orElseThrow());
        assertTrue(handlers.handler(HandlerType.C_STORE).isEmpty());

        handlers.unbind(HandlerType.C_ECHO);
        assertTrue(handlers.handler(HandlerType.C_ECHO).isEmpty());
    }

    @Test
    void nullHandlerIsRejected() {
        EventHandlers handlers = new EventHandlers();

        assertThrows(IllegalArgumentException.class, () -> handlers.bind(HandlerType.C_FIND, null));
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        EventHandlers handlers = new EventHandlers();
        List<EventType> received = new ArrayList<>();
        handlers.subscribe(EventType.ASSOCIATION_ACCEPTED, notification -> {
            throw new IllegalStateException("listener bug");
        });
        handlers.subscribe(EventType.ASSOCIATION_ACCEPTED, notification -> received.add(notification.type()));
        handlers.subscribe(EventType.ASSOCIATION_RELEASED, notification -> received.add(notification.type()));

        handlers.publish(Notification.of(EventType.ASSOCIATION_ACCEPTED, null, null));

        assertEquals(List.of(EventType.ASSOCIATION_ACCEPTED), received);
    }

    @Test
    void unsubscribedListenerIsNotCalled() {
        EventHandlers handlers = new EventHandlers();
        List<Notification> received = new ArrayList<>();
        NotificationListener listener = received::add;
        handlers.subscribe(EventType.PDU_SENT, listener);
        handlers.unsubscribe(EventType.PDU_SENT, listener);

        handlers.publish(Notification.of(EventType.PDU_SENT, null, "pdu"));

        assertTrue(received.isEmpty());
    }

    @Test
    void copyIsIndependentOfOriginal() {
        EventHandlers original = new EventHandlers();
        original.bind(HandlerType.C_ECHO, event -> Status.SUCCESS);
        List<Notification> received = new ArrayList<>();

        EventHandlers copy = original.copy();
        copy.unbind(HandlerType.C_ECHO);
        copy.subscribe(EventType.DIMSE_SENT, received::add);
        original.publish(Notification.of(EventType.DIMSE_SENT, null, null));

        assertTrue(original.handler(HandlerType.C_ECHO).isPresent());
        assertFalse(copy.handler(HandlerType.C_ECHO).isPresent());
        assertTrue(received.isEmpty());
    }

    @Test
    void negotiationCallbacksFallBackToDefaults() {
        NegotiationCallbacks callbacks = new EventHandlers().negotiationCallbacks();
        UserIdentity identity = UserIdentity.username("alice", false);

        assertTrue(callbacks.verifyUserIdentity(identity).verified());
        assertEquals(AsyncOperationsWindow.SYNCHRONOUS, callbacks.asyncOperations(new AsyncOperationsWindow(4, 4)));
        assertTrue(callbacks.sopClassExtended(List.of(new SopClassExtended("1.2.3", new byte[] {1}))).isEmpty());
    }

    @Test
    void negotiationCallbacksUseBoundHandlers() {
        EventHandlers handlers = new EventHandlers();
        handlers.bind(HandlerType.USER_IDENTITY, identity -> IdentityVerdict.refused());
        handlers.bind(HandlerType.ASYNC_OPERATIONS, requested -> new AsyncOperationsWindow(2, 1));

        NegotiationCallbacks callbacks = handlers.negotiationCallbacks();

        assertFalse(callbacks.verifyUserIdentity(UserIdentity.username("bob", true)).verified());
        assertEquals(new AsyncOperationsWindow(2, 1), callbacks.asyncOperations(new AsyncOperationsWindow(8, 8)));
    }

    @Test
    void normalizedHandlerTypeMatchesRequest() {
        assertSame(HandlerType.N_ACTION, HandlerType.normalized(CommandField.N_ACTION_RQ));
        assertSame(HandlerType.N_EVENT_REPORT, HandlerType.normalized(CommandField.N_EVENT_REPORT_RQ));
        assertThrows(IllegalArgumentException.class, () -> HandlerType.normalized(CommandField.C_FIND_RQ));
    }
}
