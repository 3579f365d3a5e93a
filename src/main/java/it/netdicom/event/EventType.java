package it.netdicom.event;

/** Notification events published to subscribers; listeners cannot change the outcome. */
public enum EventType {
    CONNECTION_OPEN,
    CONNECTION_CLOSE,
    ASSOCIATION_REQUESTED,
    ASSOCIATION_ACCEPTED,
    ASSOCIATION_REJECTED,
    ASSOCIATION_ESTABLISHED,
    ASSOCIATION_RELEASED,
    ASSOCIATION_ABORTED,
    PDU_SENT,
    PDU_RECEIVED,
    DIMSE_SENT,
    DIMSE_RECEIVED,
    FSM_TRANSITION
}
