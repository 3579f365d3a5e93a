package it.netdicom.association;

import java.net.Socket;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import javax.net.SocketFactory;
import javax.net.ssl.SSLContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.netdicom.acse.AcceptorPolicy;
import it.netdicom.acse.ExtendedNegotiation;
import it.netdicom.event.EventHandlers;
import it.netdicom.event.EventType;
import it.netdicom.event.HandlerType;
import it.netdicom.event.NotificationListener;
import it.netdicom.network.TransportSettings;
import it.netdicom.pdu.AeTitles;
import it.netdicom.presentation.PresentationContext;
import it.netdicom.presentation.SupportedContext;
import it.netdicom.service.ServiceClassRegistry;

/**
 * A local DICOM application entity: its title, the contexts it supports as acceptor and requests as
 * requestor, its bound handlers and the associations currently open.
 */
public class ApplicationEntity {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationEntity.class);

    private final AeSettings settings;
    private final String aeTitle;
    private final List<SupportedContext> supportedContexts = new CopyOnWriteArrayList<>();
    private final List<SupportedContext> requestedContexts = new CopyOnWriteArrayList<>();
    private final EventHandlers handlers = new EventHandlers();
    private final ServiceClassRegistry services;
    private final Set<Association> active = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService scheduler;
    private volatile SSLContext sslContext;

    public ApplicationEntity(AeSettings settings) {
        this(settings, ServiceClassRegistry.defaults());
    }

    public ApplicationEntity(AeSettings settings, ServiceClassRegistry services) {
        this.settings = settings;
        this.aeTitle = AeTitles.normalize(settings.getAeTitle());
        this.services = services;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "netdicom-artim-" + aeTitle);
            thread.setDaemon(true);
            return thread;
        });
    }

    public String aeTitle() {
        return aeTitle;
    }

    public AeSettings settings() {
        return settings;
    }

    public ServiceClassRegistry services() {
        return services;
    }

    public EventHandlers handlers() {
        return handlers;
    }

    public void addSupportedContext(SupportedContext context) {
        boolean duplicate = supportedContexts.stream().anyMatch(existing -> existing.abstractSyntax().equals(context.abstractSyntax()));
        if (duplicate) {
            throw new IllegalArgumentException("Abstract syntax " + context.abstractSyntax() + " is already supported");
        }
        supportedContexts.add(context);
    }

    public void addSupportedContext(String abstractSyntax, List<String> transferSyntaxes) {
        addSupportedContext(SupportedContext.of(abstractSyntax, transferSyntaxes));
    }

    public void removeSupportedContext(String abstractSyntax) {
        supportedContexts.removeIf(context -> context.abstractSyntax().equals(abstractSyntax));
    }

    public List<SupportedContext> supportedContexts() {
        return List.copyOf(supportedContexts);
    }

    public void addRequestedContext(String abstractSyntax, List<String> transferSyntaxes) {
        if (requestedContexts.size() >= PresentationContext.MAX_CONTEXTS) {
            throw new IllegalArgumentException("At most " + PresentationContext.MAX_CONTEXTS + " presentation contexts may be requested");
        }
        requestedContexts.add(SupportedContext.of(abstractSyntax, transferSyntaxes));
    }

    public List<SupportedContext> requestedContexts() {
        return List.copyOf(requestedContexts);
    }

    public <H> void bind(HandlerType<H> type, H handler) {
        handlers.bind(type, handler);
    }

    public void unbind(HandlerType<?> type) {
        handlers.unbind(type);
    }

    public void subscribe(EventType type, NotificationListener listener) {
        handlers.subscribe(type, listener);
    }

    public void setSslContext(SSLContext sslContext) {
        this.sslContext = sslContext;
    }

    public Optional<SSLContext> sslContext() {
        return Optional.ofNullable(sslContext);
    }

    /** Requests an association proposing the requested contexts, numbered 1, 3, 5, ... */
    public Association associate(String host, int port, String calledAeTitle) {
        return associate(host, port, calledAeTitle, PresentationContext.numbered(requestedContexts), ExtendedNegotiation.NONE);
    }

    /**
     * Requests an association and waits for the outcome. The returned association may be rejected or
     * aborted; check {@link Association#isEstablished()}.
     */
    public Association associate(
        String host,
        int port,
        String calledAeTitle,
        List<PresentationContext> contexts,
        ExtendedNegotiation extended
    ) {
        return Association.request(this, host, port, AeTitles.normalize(calledAeTitle), contexts, extended);
    }

    /** Takes over an accepted transport connection and negotiates as acceptor. */
    public Association accept(Socket socket) {
        return Association.accept(this, socket);
    }

    public List<Association> activeAssociations() {
        return List.copyOf(active);
    }

    public AcceptorPolicy acceptorPolicy() {
        return new AcceptorPolicy(
            aeTitle,
            settings.isRequireCalledAeTitle(),
            settings.getRequiredCallingAeTitles(),
            supportedContexts,
            settings.getMaxPduLength(),
            settings.getImplementationClassUid(),
            settings.getImplementationVersionName()
        );
    }

    public TransportSettings transportSettings() {
        return new TransportSettings(
            settings.getConnectTimeout(),
            settings.getNetworkTimeout(),
            settings.getArtimTimeout(),
            settings.getMaxPduLength()
        );
    }

    /** Aborts every open association and stops the timer thread. */
    public void shutdown() {
        logger.info("Shutting down AE {} with {} open association(s)", aeTitle, active.size());
        for (Association association : List.copyOf(active)) {
            association.abort();
        }
        scheduler.shutdownNow();
    }

    SocketFactory socketFactory() {
        SSLContext context = sslContext;
        return context == null ? SocketFactory.getDefault() : context.getSocketFactory();
    }

    ScheduledExecutorService scheduler() {
        return scheduler;
    }

    int activeAcceptorCount() {
        return (int) active.stream().filter(association -> !association.isRequestor()).count();
    }

    void register(Association association) {
        active.add(association);
    }

    void unregister(Association association) {
        active.remove(association);
    }
}
