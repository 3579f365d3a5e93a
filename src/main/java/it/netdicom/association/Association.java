package it.netdicom.association;

import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.netdicom.acse.AbortSource;
import it.netdicom.acse.AcseDecision;
import it.netdicom.acse.AcseService;
import it.netdicom.acse.ExtendedNegotiation;
import it.netdicom.acse.Rejection;
import it.netdicom.dimse.AssociationAbortedException;
import it.netdicom.dimse.CommandElement;
import it.netdicom.dimse.CommandField;
import it.netdicom.dimse.CommandSet;
import it.netdicom.dimse.DimseCommands;
import it.netdicom.dimse.DimseMessage;
import it.netdicom.dimse.DimseTimeoutException;
import it.netdicom.dimse.MalformedCommandException;
import it.netdicom.dimse.MessageAssembler;
import it.netdicom.dimse.MessageFragmenter;
import it.netdicom.event.Event;
import it.netdicom.event.EventHandlers;
import it.netdicom.event.EventType;
import it.netdicom.event.Notification;
import it.netdicom.event.RetrieveResult;
import it.netdicom.fsm.Indication;
import it.netdicom.fsm.UpperLayerEvent;
import it.netdicom.fsm.UpperLayerState;
import it.netdicom.network.ProviderListener;
import it.netdicom.network.UpperLayerProvider;
import it.netdicom.pdu.Pdu;
import it.netdicom.pdu.PresentationDataValue;
import it.netdicom.pdu.UserInformation;
import it.netdicom.pdu.UserInformation.SopClassCommonExtended;
import it.netdicom.presentation.NegotiatedContext;
import it.netdicom.presentation.PresentationContext;
import it.netdicom.sop.SopClassRegistry;

/**
 * One DICOM association, from either side.
 * <p>
 * Threads: the provider's reader thread reassembles DIMSE messages and routes them; a worker thread per
 * association answers the peer's requests and release primitives; callers of the {@code send*} helpers
 * block on their own thread until the response arrives or the DIMSE timeout expires.
 */
public class Association implements ProviderListener {

    private static final Logger logger = LoggerFactory.getLogger(Association.class);

    private static final AtomicLong SEQUENCE = new AtomicLong();
    private static final Object TERMINATED = new Object();

    private final long id = SEQUENCE.incrementAndGet();
    private final ApplicationEntity ae;
    private final EventHandlers handlers;
    private final boolean requestor;
    private final MessageAssembler assembler = new MessageAssembler();
    private final BlockingQueue<Object> inbox = new LinkedBlockingQueue<>();
    private final BlockingQueue<Object> responses = new LinkedBlockingQueue<>();
    private final Map<Integer, AtomicBoolean> requestsInFlight = new ConcurrentHashMap<>();
    private final Semaphore operation = new Semaphore(1);
    private final AtomicInteger messageIds = new AtomicInteger();
    private final Object sendLock = new Object();
    private final CompletableFuture<AssociationStatus> terminated = new CompletableFuture<>();

    private UpperLayerProvider provider;
    private Thread worker;
    private volatile AssociationStatus status = AssociationStatus.PENDING;
    private volatile List<NegotiatedContext> contexts = List.of();
    private volatile List<PresentationContext> proposed = List.of();
    private volatile ExtendedNegotiation extended = ExtendedNegotiation.NONE;
    private volatile Pdu.AssociateRq associateRequest;
    private volatile Pdu.AssociateAc associateAccept;
    private volatile Rejection rejection;
    private volatile List<SopClassCommonExtended> acceptedCommonExtended = List.of();
    private volatile long peerMaxPduLength;

    private Association(ApplicationEntity ae, boolean requestor) {
        this.ae = ae;
        this.requestor = requestor;
        this.handlers = ae.handlers().copy();
    }

    static Association request(
        ApplicationEntity ae,
        String host,
        int port,
        String calledAeTitle,
        List<PresentationContext> contexts,
        ExtendedNegotiation extended
    ) {
        Association association = new Association(ae, true);
        AeSettings settings = ae.settings();
        Pdu.AssociateRq rq = AcseService.request(
            ae.aeTitle(),
            calledAeTitle,
            contexts,
            settings.getMaxPduLength(),
            settings.getImplementationClassUid(),
            settings.getImplementationVersionName(),
            extended
        );
        association.proposed = List.copyOf(contexts);
        association.extended = extended;
        association.associateRequest = rq;
        association.provider = UpperLayerProvider.requestor(
            association.name(),
            new InetSocketAddress(host, port),
            ae.socketFactory(),
            ae.transportSettings(),
            ae.scheduler(),
            association
        );
        ae.register(association);
        logger.info("{}: requesting association with {} at {}:{}", association.name(), calledAeTitle, host, port);
        association.publish(EventType.ASSOCIATION_REQUESTED, rq);
        association.provider.requestAssociation(rq);
        association.awaitEstablishment();
        return association;
    }

    static Association accept(ApplicationEntity ae, Socket socket) {
        Association association = new Association(ae, false);
        association.provider = UpperLayerProvider.acceptor(association.name(), socket, ae.transportSettings(), ae.scheduler(), association);
        ae.register(association);
        association.startWorker();
        association.provider.start();
        return association;
    }

    public long id() {
        return id;
    }

    public String name() {
        return (requestor ? "requestor-" : "acceptor-") + id;
    }

    public boolean isRequestor() {
        return requestor;
    }

    public AssociationStatus status() {
        return status;
    }

    public boolean isEstablished() {
        return status == AssociationStatus.ESTABLISHED;
    }

    public boolean isAborted() {
        return status == AssociationStatus.ABORTED;
    }

    public boolean isReleased() {
        return status == AssociationStatus.RELEASED;
    }

    public boolean isRejected() {
        return status == AssociationStatus.REJECTED;
    }

    public Optional<Rejection> rejection() {
        return Optional.ofNullable(rejection);
    }

    public UpperLayerState state() {
        return provider.state();
    }

    public ApplicationEntity applicationEntity() {
        return ae;
    }

    public String localAeTitle() {
        return ae.aeTitle();
    }

    /** Calling AE title of the requestor when acting as acceptor, called AE title otherwise. */
    public String peerAeTitle() {
        Pdu.AssociateRq rq = associateRequest;
        if (rq == null) {
            return "";
        }
        return requestor ? rq.calledAeTitle() : rq.callingAeTitle();
    }

    public InetSocketAddress peerAddress() {
        return provider.remoteAddress();
    }

    public List<NegotiatedContext> presentationContexts() {
        return contexts;
    }

    public List<NegotiatedContext> acceptedContexts() {
        return contexts.stream().filter(NegotiatedContext::isAccepted).toList();
    }

    public List<NegotiatedContext> rejectedContexts() {
        return contexts.stream().filter(context -> !context.isAccepted()).toList();
    }

    public long peerMaxPduLength() {
        return peerMaxPduLength;
    }

    /** User information the peer sent in its A-ASSOCIATE-RQ or A-ASSOCIATE-AC. */
    public Optional<UserInformation> peerUserInformation() {
        if (requestor) {
            return Optional.ofNullable(associateAccept).map(Pdu.AssociateAc::userInformation);
        }
        return Optional.ofNullable(associateRequest).map(Pdu.AssociateRq::userInformation);
    }

    public List<SopClassCommonExtended> acceptedCommonExtended() {
        return acceptedCommonExtended;
    }

    public EventHandlers handlers() {
        return handlers;
    }

    /** Completes with the final status once the transport connection is closed. */
    public CompletableFuture<AssociationStatus> terminated() {
        return terminated;
    }

    public DimseMessage sendEcho() {
        NegotiatedContext context = contextFor(SopClassRegistry.VERIFICATION, Optional.empty());
        return exchange(DimseMessage.of(context.contextId(), DimseCommands.echoRequest(nextMessageId(), SopClassRegistry.VERIFICATION)));
    }

    /**
     * Sends a C-STORE. The data set must already be encoded in the given transfer syntax, which an accepted
     * context for the SOP class must have negotiated.
     */
    public DimseMessage sendStore(String sopClassUid, String sopInstanceUid, String transferSyntax, byte[] dataSet, int priority) {
        NegotiatedContext context = contextFor(sopClassUid, Optional.ofNullable(transferSyntax));
        CommandSet command = DimseCommands.storeRequest(nextMessageId(), sopClassUid, sopInstanceUid, priority);
        return exchange(new DimseMessage(context.contextId(), command, dataSet));
    }

    /** C-STORE sub-operation of a C-GET or C-MOVE. */
    public DimseMessage sendStore(RetrieveResult.Instance instance, int priority, String moveOriginatorAeTitle, Integer moveOriginatorMessageId) {
        NegotiatedContext context = contextFor(instance.sopClassUid(), Optional.ofNullable(instance.transferSyntax()));
        int messageId = nextMessageId();
        CommandSet command = moveOriginatorAeTitle == null
            ? DimseCommands.storeRequest(messageId, instance.sopClassUid(), instance.sopInstanceUid(), priority)
            : DimseCommands.storeRequest(messageId, instance.sopClassUid(), instance.sopInstanceUid(), priority,
                moveOriginatorAeTitle, moveOriginatorMessageId);
        return exchange(new DimseMessage(context.contextId(), command, instance.dataSet()));
    }

    public DimseResponses sendFind(String sopClassUid, byte[] identifier, int priority) {
        NegotiatedContext context = contextFor(sopClassUid, Optional.empty());
        return start(new DimseMessage(context.contextId(), DimseCommands.findRequest(nextMessageId(), sopClassUid, priority), identifier));
    }

    /** C-GET. C-STORE requests the peer sends meanwhile go to the bound C-STORE handler. */
    public DimseResponses sendGet(String sopClassUid, byte[] identifier, int priority) {
        NegotiatedContext context = contextFor(sopClassUid, Optional.empty());
        return start(new DimseMessage(context.contextId(), DimseCommands.getRequest(nextMessageId(), sopClassUid, priority), identifier));
    }

    public DimseResponses sendMove(String sopClassUid, String moveDestination, byte[] identifier, int priority) {
        NegotiatedContext context = contextFor(sopClassUid, Optional.empty());
        CommandSet command = DimseCommands.moveRequest(nextMessageId(), sopClassUid, priority, moveDestination);
        return start(new DimseMessage(context.contextId(), command, identifier));
    }

    public DimseMessage sendNEventReport(String sopClassUid, String sopInstanceUid, int eventTypeId, byte[] eventInformation) {
        NegotiatedContext context = contextFor(sopClassUid, Optional.empty());
        CommandSet command = DimseCommands.nEventReportRequest(nextMessageId(), sopClassUid, sopInstanceUid, eventTypeId);
        return exchange(new DimseMessage(context.contextId(), command, eventInformation));
    }

    public DimseMessage sendNGet(String sopClassUid, String sopInstanceUid, int[] attributeIdentifiers) {
        NegotiatedContext context = contextFor(sopClassUid, Optional.empty());
        CommandSet command = DimseCommands.nGetRequest(nextMessageId(), sopClassUid, sopInstanceUid, attributeIdentifiers);
        return exchange(DimseMessage.of(context.contextId(), command));
    }

    public DimseMessage sendNSet(String sopClassUid, String sopInstanceUid, byte[] modificationList) {
        NegotiatedContext context = contextFor(sopClassUid, Optional.empty());
        CommandSet command = DimseCommands.nSetRequest(nextMessageId(), sopClassUid, sopInstanceUid);
        return exchange(new DimseMessage(context.contextId(), command, modificationList));
    }

    public DimseMessage sendNAction(String sopClassUid, String sopInstanceUid, int actionTypeId, byte[] actionInformation) {
        NegotiatedContext context = contextFor(sopClassUid, Optional.empty());
        CommandSet command = DimseCommands.nActionRequest(nextMessageId(), sopClassUid, sopInstanceUid, actionTypeId);
        return exchange(new DimseMessage(context.contextId(), command, actionInformation));
    }

    public DimseMessage sendNCreate(String sopClassUid, String sopInstanceUid, byte[] attributeList) {
        NegotiatedContext context = contextFor(sopClassUid, Optional.empty());
        CommandSet command = DimseCommands.nCreateRequest(nextMessageId(), sopClassUid, sopInstanceUid);
        return exchange(new DimseMessage(context.contextId(), command, attributeList));
    }

    public DimseMessage sendNDelete(String sopClassUid, String sopInstanceUid) {
        NegotiatedContext context = contextFor(sopClassUid, Optional.empty());
        return exchange(DimseMessage.of(context.contextId(), DimseCommands.nDeleteRequest(nextMessageId(), sopClassUid, sopInstanceUid)));
    }

    /** Answers a request received through a handler event. */
    public void sendResponse(Event request, CommandSet response, byte[] dataSet) {
        send(new DimseMessage(request.context().contextId(), response, dataSet));
    }

    void sendCancel(int contextId, int messageId) {
        send(DimseMessage.of(contextId, DimseCommands.cancelRequest(messageId)));
    }

    /** Fragments and sends one message; its PDUs are never interleaved with another message's. */
    public void send(DimseMessage message) {
        List<Pdu.PDataTf> pdus = MessageFragmenter.fragment(message, peerMaxPduLength);
        synchronized (sendLock) {
            for (Pdu.PDataTf pdu : pdus) {
                provider.sendData(pdu);
            }
        }
        logger.debug("{}: sent {} in {} PDU(s)", name(), message, pdus.size());
        publish(EventType.DIMSE_SENT, message);
    }

    /**
     * A-RELEASE request. Blocks until the peer confirms or the ACSE timeout expires, in which case the
     * association is aborted.
     */
    public void release() {
        if (status.isTerminal()) {
            return;
        }
        if (!provider.fireIfIn(EnumSet.of(UpperLayerState.STA6), UpperLayerEvent.EVT11, AcseService.release())) {
            throw new IllegalStateException("Cannot release " + name() + " in " + provider.state().label());
        }
        logger.info("{}: release requested", name());
        if (Thread.currentThread() == worker) {
            return;
        }
        try {
            terminated.get(ae.settings().getAcseTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("{}: no release response within {}, aborting", name(), ae.settings().getAcseTimeout());
            abort();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Release of " + name() + " failed", e.getCause());
        }
    }

    /** A-ABORT request from the service user. Returns without waiting for the peer. */
    public void abort() {
        abort(AbortSource.SERVICE_USER, AbortSource.REASON_NOT_SPECIFIED);
    }

    /**
     * A-ABORT request with an explicit source. The reason is only carried for a service-provider source.
     * Returns without waiting for the peer.
     */
    public void abort(AbortSource source, int reason) {
        if (status.isTerminal() && provider.state() == UpperLayerState.STA1) {
            return;
        }
        Pdu.Abort pdu = AcseService.abort(source, reason);
        logger.info("{}: aborting ({}, {})", name(), source, AbortSource.describeReason(pdu.reason()));
        provider.abort(pdu);
    }

    @Override
    public void onIndication(Indication indication) {
        if (indication instanceof Indication.Received received && received.pdu() instanceof Pdu.PDataTf data) {
            onData(data);
        } else if (indication instanceof Indication.Received received && received.pdu() instanceof Pdu.AssociateRj rj) {
            onRejected(rj);
        } else if (indication instanceof Indication.Closed) {
            onClosed();
        } else {
            inbox.add(indication);
        }
    }

    @Override
    public void onConnectionOpen(Socket socket) {
        publish(EventType.CONNECTION_OPEN, socket.getRemoteSocketAddress());
    }

    @Override
    public void onConnectionClose() {
        publish(EventType.CONNECTION_CLOSE, null);
    }

    @Override
    public void onPduSent(Pdu pdu) {
        logger.trace("{}: PDU sent {}", name(), pdu);
        publish(EventType.PDU_SENT, pdu);
    }

    @Override
    public void onPduReceived(Pdu pdu) {
        logger.trace("{}: PDU received {}", name(), pdu);
        publish(EventType.PDU_RECEIVED, pdu);
    }

    @Override
    public void onTransition(UpperLayerState from, UpperLayerEvent event, String action, UpperLayerState to) {
        publish(EventType.FSM_TRANSITION, from.label() + " + " + event.label() + " -> " + action + " -> " + to.label());
    }

    DimseMessage awaitResponse(int messageId) {
        long timeoutMillis = ae.settings().getDimseTimeout().toMillis();
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (true) {
            Object item;
            try {
                if (timeoutMillis <= 0) {
                    item = responses.take();
                } else {
                    long remaining = deadline - System.currentTimeMillis();
                    item = remaining > 0 ? responses.poll(remaining, TimeUnit.MILLISECONDS) : null;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abort();
                throw new AssociationAbortedException("Interrupted while waiting for the response to message " + messageId);
            }
            if (item == null) {
                logger.warn("{}: no response to message {} within {}, aborting", name(), messageId, ae.settings().getDimseTimeout());
                abort();
                throw new DimseTimeoutException("No response to message " + messageId + " within " + ae.settings().getDimseTimeout());
            }
            if (item == TERMINATED) {
                responses.add(TERMINATED);
                throw new AssociationAbortedException(name() + " ended while waiting for the response to message " + messageId);
            }
            DimseMessage response = (DimseMessage) item;
            int respondedTo = response.command().optionalInt(CommandElement.MESSAGE_ID_BEING_RESPONDED_TO).orElse(-1);
            if (respondedTo != messageId) {
                logger.warn("{}: ignoring {} for message {} while waiting for message {}", name(), response, respondedTo, messageId);
                continue;
            }
            return response;
        }
    }

    void endOperation() {
        operation.release();
    }

    private DimseMessage exchange(DimseMessage request) {
        beginOperation();
        try {
            send(request);
            return awaitResponse(request.command().messageId());
        } finally {
            endOperation();
        }
    }

    private DimseResponses start(DimseMessage request) {
        beginOperation();
        try {
            send(request);
        } catch (RuntimeException e) {
            endOperation();
            throw e;
        }
        return new DimseResponses(this, request.contextId(), request.command().messageId());
    }

    private void beginOperation() {
        if (!isEstablished()) {
            throw new IllegalStateException(name() + " is not established (" + status + ")");
        }
        if (!operation.tryAcquire()) {
            throw new IllegalStateException(name() + " is still waiting for the response to a previous request");
        }
    }

    private int nextMessageId() {
        return messageIds.updateAndGet(current -> current >= 0xFFFF ? 1 : current + 1);
    }

    NegotiatedContext contextFor(String sopClassUid, Optional<String> transferSyntax) {
        return contexts.stream()
            .filter(NegotiatedContext::isAccepted)
            .filter(context -> context.abstractSyntax().equals(sopClassUid))
            .filter(context -> context.localScu(requestor))
            .filter(context -> transferSyntax.isEmpty() || transferSyntax.get().equals(context.negotiatedTransferSyntax()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No accepted presentation context for " + sopClassUid
                + transferSyntax.map(ts -> " with transfer syntax " + ts).orElse("") + " where the local AE is SCU"));
    }

    private Optional<NegotiatedContext> acceptedContext(int contextId) {
        return contexts.stream().filter(context -> context.contextId() == contextId && context.isAccepted()).findFirst();
    }

    private void awaitEstablishment() {
        long timeoutMillis = ae.settings().getAcseTimeout().toMillis();
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (status == AssociationStatus.PENDING) {
            Object item;
            try {
                long remaining = deadline - System.currentTimeMillis();
                item = remaining > 0 ? inbox.poll(remaining, TimeUnit.MILLISECONDS) : null;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abort();
                return;
            }
            if (item == null) {
                logger.warn("{}: no association response within {}, aborting", name(), ae.settings().getAcseTimeout());
                abort();
                return;
            }
            if (item == TERMINATED) {
                return;
            }
            if (item instanceof Indication.Received received && received.pdu() instanceof Pdu.AssociateAc ac) {
                onAccepted(ac);
            }
        }
    }

    // handled on the reader thread: the transport closes right after the rejection is indicated
    private void onRejected(Pdu.AssociateRj rj) {
        rejection = Rejection.of(rj);
        status = AssociationStatus.REJECTED;
        logger.info("{}: association rejected: {}", name(), rejection.describe());
        publish(EventType.ASSOCIATION_REJECTED, rejection);
    }

    private void onAccepted(Pdu.AssociateAc ac) {
        associateAccept = ac;
        peerMaxPduLength = ac.userInformation().maxPduLength();
        contexts = AcseService.interpretAccept(proposed, extended, ac);
        publish(EventType.ASSOCIATION_ACCEPTED, ac);
        if (acceptedContexts().isEmpty()) {
            logger.warn("{}: peer accepted the association but no presentation context, aborting", name());
            abort();
            return;
        }
        status = AssociationStatus.ESTABLISHED;
        logger.info("{}: established with {}, {} of {} presentation contexts accepted",
            name(), peerAeTitle(), acceptedContexts().size(), contexts.size());
        publish(EventType.ASSOCIATION_ESTABLISHED, contexts);
        startWorker();
    }

    private void startWorker() {
        worker = new Thread(this::serve, "netdicom-" + name());
        worker.setDaemon(true);
        worker.start();
    }

    private void serve() {
        try {
            while (true) {
                Object item = inbox.take();
                if (item == TERMINATED) {
                    return;
                }
                if (item instanceof DimseMessage request) {
                    dispatch(request);
                } else if (item instanceof Indication.Received received) {
                    onPrimitive(received.pdu());
                } else if (item instanceof Indication.ProviderAbort providerAbort) {
                    logger.info("{}: provider abort: {}", name(), AbortSource.describeReason(providerAbort.reason()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("{}: worker interrupted", name());
        }
    }

    private void onPrimitive(Pdu pdu) {
        if (pdu instanceof Pdu.AssociateRq rq) {
            evaluate(rq);
        } else if (pdu instanceof Pdu.ReleaseRq) {
            logger.info("{}: release requested by peer", name());
            // Sta10 waits for the peer's A-RELEASE-RP before answering
            provider.fireIfIn(EnumSet.of(UpperLayerState.STA8, UpperLayerState.STA9), UpperLayerEvent.EVT14, AcseService.releaseResponse());
        } else if (pdu instanceof Pdu.ReleaseRp) {
            provider.fireIfIn(EnumSet.of(UpperLayerState.STA12), UpperLayerEvent.EVT14, AcseService.releaseResponse());
        } else if (pdu instanceof Pdu.Abort abortPdu) {
            logger.info("{}: aborted by peer, source {}: {}", name(), AbortSource.fromCode(abortPdu.source()), AbortSource.describeReason(abortPdu.reason()));
        }
    }

    private void evaluate(Pdu.AssociateRq rq) {
        associateRequest = rq;
        peerMaxPduLength = rq.userInformation().maxPduLength();
        publish(EventType.ASSOCIATION_REQUESTED, rq);
        boolean overLimit = ae.activeAcceptorCount() > ae.settings().getMaxAssociations();
        AcseDecision decision = AcseService.evaluate(rq, ae.acceptorPolicy(), handlers.negotiationCallbacks(), overLimit);
        if (decision instanceof AcseDecision.Accept accept) {
            contexts = accept.contexts();
            acceptedCommonExtended = accept.acceptedCommonExtended();
            associateAccept = accept.pdu();
            status = AssociationStatus.ESTABLISHED;
            publish(EventType.ASSOCIATION_ACCEPTED, accept.pdu());
            provider.fireIfIn(EnumSet.of(UpperLayerState.STA3), UpperLayerEvent.EVT7, accept.pdu());
            logger.info("{}: accepted association from {} at {}, {} of {} presentation contexts accepted",
                name(), rq.callingAeTitle(), provider.remoteAddress(), acceptedContexts().size(), contexts.size());
            publish(EventType.ASSOCIATION_ESTABLISHED, contexts);
        } else if (decision instanceof AcseDecision.Reject reject) {
            rejection = reject.rejection();
            status = AssociationStatus.REJECTED;
            publish(EventType.ASSOCIATION_REJECTED, rejection);
            provider.fireIfIn(EnumSet.of(UpperLayerState.STA3), UpperLayerEvent.EVT8, reject.pdu());
        }
    }

    private void dispatch(DimseMessage request) {
        int messageId = request.command().messageId();
        AtomicBoolean cancelled = requestsInFlight.getOrDefault(messageId, new AtomicBoolean());
        Optional<NegotiatedContext> context = acceptedContext(request.contextId());
        if (context.isEmpty()) {
            requestsInFlight.remove(messageId, cancelled);
            logger.error("{}: {} arrived on presentation context {} which was not accepted, aborting", name(), request, request.contextId());
            abort(AbortSource.SERVICE_PROVIDER, AbortSource.REASON_UNEXPECTED_PDU_PARAMETER);
            return;
        }
        Event event = new Event(this, context.get(), request, cancelled::get);
        try {
            ae.services().dispatch(event);
        } catch (DimseTimeoutException | AssociationAbortedException e) {
            logger.warn("{}: {} interrupted: {}", name(), request.commandField(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("{}: failed to handle {}: {}", name(), request, e.getMessage(), e);
        } finally {
            requestsInFlight.remove(messageId, cancelled);
        }
    }

    private void onData(Pdu.PDataTf data) {
        if (provider.state() == UpperLayerState.STA7) {
            logger.warn("{}: ignoring P-DATA received after the release request", name());
            return;
        }
        for (PresentationDataValue pdv : data.values()) {
            Optional<DimseMessage> message;
            try {
                message = assembler.accept(pdv);
            } catch (MalformedCommandException e) {
                logger.error("{}: invalid DIMSE message: {}, aborting", name(), e.getMessage());
                abort();
                return;
            }
            message.ifPresent(this::route);
        }
    }

    private void route(DimseMessage message) {
        logger.debug("{}: received {}", name(), message);
        publish(EventType.DIMSE_RECEIVED, message);
        CommandField field = message.commandField();
        if (field.isCancel()) {
            int cancelled = message.command().messageIdBeingRespondedTo();
            AtomicBoolean flag = requestsInFlight.get(cancelled);
            if (flag == null) {
                logger.debug("{}: ignoring C-CANCEL for message {} which is not in progress", name(), cancelled);
            } else {
                logger.debug("{}: C-CANCEL for message {}", name(), cancelled);
                flag.set(true);
            }
        } else if (field.isResponse()) {
            responses.add(message);
        } else {
            // registered before queueing so a C-CANCEL that overtakes the worker still applies
            requestsInFlight.put(message.command().messageId(), new AtomicBoolean());
            inbox.add(message);
        }
    }

    private void onClosed() {
        AssociationStatus previous = status;
        AssociationStatus finalStatus;
        if (provider.isAborted()) {
            finalStatus = previous == AssociationStatus.REJECTED ? AssociationStatus.REJECTED : AssociationStatus.ABORTED;
        } else if (previous == AssociationStatus.ESTABLISHED) {
            finalStatus = AssociationStatus.RELEASED;
        } else if (previous == AssociationStatus.PENDING) {
            finalStatus = AssociationStatus.REJECTED;
        } else {
            finalStatus = previous;
        }
        status = finalStatus;
        if (finalStatus == AssociationStatus.ABORTED) {
            logger.info("{}: association aborted", name());
            publish(EventType.ASSOCIATION_ABORTED, null);
        } else if (finalStatus == AssociationStatus.RELEASED) {
            logger.info("{}: association released", name());
            publish(EventType.ASSOCIATION_RELEASED, null);
        }
        ae.unregister(this);
        inbox.add(TERMINATED);
        responses.add(TERMINATED);
        terminated.complete(finalStatus);
    }

    private void publish(EventType type, Object detail) {
        handlers.publish(Notification.of(type, this, detail));
    }

    @Override
    public String toString() {
        return "Association[" + name() + ", " + localAeTitle() + " <-> " + peerAeTitle() + ", " + status + "]";
    }
}
