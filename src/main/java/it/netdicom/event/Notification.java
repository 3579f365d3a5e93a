package it.netdicom.event;

import java.time.Instant;

import it.netdicom.association.Association;

/**
 * A notification event. The detail is the PDU, DIMSE message, rejection or transition the event is about,
 * or {@code null} for lifecycle events that carry nothing.
 */
public record Notification(EventType type, Association association, Object detail, Instant timestamp) {

    public static Notification of(EventType type, Association association, Object detail) {
        return new Notification(type, association, detail, Instant.now());
    }
}
