package it.netdicom.service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import it.netdicom.dimse.CommandField;
import it.netdicom.dimse.Status;
import it.netdicom.event.Event;
import it.netdicom.sop.ServiceKind;
import it.netdicom.sop.SopClass;
import it.netdicom.sop.SopClassRegistry;

/**
 * Routes incoming DIMSE requests to the service class implementing the requested SOP class.
 * <p>
 * A UID registered explicitly wins over the service kind of a known SOP class. Requests for SOP classes
 * the registry does not know go to the first service class that accepts the command.
 */
public class ServiceClassRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ServiceClassRegistry.class);

    private final Map<ServiceKind, ServiceClass> byKind = new EnumMap<>(ServiceKind.class);
    private final Map<String, ServiceClass> byUid = new ConcurrentHashMap<>();

    /** Verification, Storage, Query/Retrieve and Normalized service classes. */
    public static ServiceClassRegistry defaults() {
        ServiceClassRegistry registry = new ServiceClassRegistry();
        registry.register(ServiceKind.VERIFICATION, new VerificationService());
        registry.register(ServiceKind.STORAGE, new StorageService());
        registry.register(ServiceKind.QUERY_RETRIEVE, new QueryRetrieveService());
        registry.register(ServiceKind.NORMALIZED, new NormalizedService());
        return registry;
    }

    public synchronized void register(ServiceKind kind, ServiceClass service) {
        if (kind == null || service == null) {
            throw new IllegalArgumentException("Service kind and service class are required");
        }
        byKind.put(kind, service);
    }

    public void register(String sopClassUid, ServiceClass service) {
        if (!StringUtils.hasText(sopClassUid) || service == null) {
            throw new IllegalArgumentException("SOP class UID and service class are required");
        }
        byUid.put(sopClassUid, service);
    }

    public synchronized Optional<ServiceClass> forSopClass(String sopClassUid) {
        ServiceClass explicit = sopClassUid == null ? null : byUid.get(sopClassUid);
        if (explicit != null) {
            return Optional.of(explicit);
        }
        return SopClassRegistry.byUid(sopClassUid)
            .map(SopClass::serviceKind)
            .map(byKind::get);
    }

    /** Hands the request to its service class, or answers 0x0122 when no service class supports it. */
    public void dispatch(Event event) {
        CommandField field = event.request().commandField();
        String sopClassUid = event.command().sopClassUid().orElse(null);
        Optional<ServiceClass> service = forSopClass(sopClassUid);
        if (service.isEmpty()) {
            service = forCommand(field);
        }
        if (service.isEmpty() || !service.get().requests().contains(field)) {
            logger.warn("{} for SOP class {} is not supported", field.operation(), SopClassRegistry.nameOf(sopClassUid));
            ServiceResponses.failure(event, Status.SOP_CLASS_NOT_SUPPORTED,
                field.operation() + " not supported for " + SopClassRegistry.nameOf(sopClassUid));
            return;
        }
        logger.debug("{} for {} handled by the {} service", field.operation(), SopClassRegistry.nameOf(sopClassUid), service.get().name());
        service.get().handle(event);
    }

    /** Names of the registered service classes and the requests each accepts, in registration order. */
    public synchronized Map<String, Set<CommandField>> capabilities() {
        Map<String, Set<CommandField>> capabilities = new LinkedHashMap<>();
        List<ServiceClass> services = new ArrayList<>(byKind.values());
        services.addAll(byUid.values());
        for (ServiceClass service : services) {
            capabilities.computeIfAbsent(service.name(), name -> new LinkedHashSet<>()).addAll(service.requests());
        }
        return capabilities;
    }

    private synchronized Optional<ServiceClass> forCommand(CommandField field) {
        return byKind.values().stream().filter(service -> service.requests().contains(field)).findFirst();
    }
}
