package it.netdicom.service;

import java.util.Set;

import it.netdicom.dimse.CommandField;
import it.netdicom.event.Event;

/**
 * SCP behaviour for one family of SOP classes. Implementations answer the request carried by the event,
 * sending every response themselves.
 */
public interface ServiceClass {

    String name();

    Set<CommandField> requests();

    void handle(Event event);
}
