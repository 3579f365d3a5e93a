package it.netdicom.network;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import javax.net.SocketFactory;
import javax.net.ssl.SSLSocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.netdicom.acse.AbortSource;
import it.netdicom.fsm.Indication;
import it.netdicom.fsm.UpperLayerContext;
import it.netdicom.fsm.UpperLayerEvent;
import it.netdicom.fsm.UpperLayerState;
import it.netdicom.fsm.UpperLayerStateMachine;
import it.netdicom.pdu.MalformedPduException;
import it.netdicom.pdu.Pdu;
import it.netdicom.pdu.PduCodec;
import it.netdicom.pdu.PduTooLargeException;

/**
 * DICOM Upper Layer service provider for one transport connection.
 * <p>
 * A dedicated reader thread turns incoming PDUs into state machine events. Local primitives are fired
 * by the calling thread. Indications are collected while the state machine lock is held and handed to
 * the {@link ProviderListener} once it is released.
 */
public class UpperLayerProvider implements UpperLayerContext {

    private static final Logger logger = LoggerFactory.getLogger(UpperLayerProvider.class);

    private static final Set<UpperLayerState> DATA_TRANSFER = EnumSet.of(UpperLayerState.STA6, UpperLayerState.STA8);

    private final String name;
    private final boolean requestor;
    private final TransportSettings settings;
    private final ProviderListener listener;
    private final UpperLayerStateMachine fsm;
    private final ArtimTimer artim;
    private final List<Indication> pendingIndications = new ArrayList<>();
    private final Object writeLock = new Object();
    private final AtomicBoolean closeNotified = new AtomicBoolean();

    private final InetSocketAddress remote;
    private final SocketFactory socketFactory;
    private volatile Socket socket;
    private volatile OutputStream out;
    private volatile boolean closedLocally;

    private UpperLayerProvider(
        String name,
        boolean requestor,
        Socket socket,
        InetSocketAddress remote,
        SocketFactory socketFactory,
        TransportSettings settings,
        ScheduledExecutorService scheduler,
        ProviderListener listener
    ) {
        this.name = name;
        this.requestor = requestor;
        this.socket = socket;
        this.remote = remote;
        this.socketFactory = socketFactory;
        this.settings = settings;
        this.listener = listener;
        this.fsm = new UpperLayerStateMachine(this);
        this.artim = new ArtimTimer(scheduler, settings.artimTimeout());
    }

    public static UpperLayerProvider requestor(
        String name,
        InetSocketAddress remote,
        SocketFactory socketFactory,
        TransportSettings settings,
        ScheduledExecutorService scheduler,
        ProviderListener listener
    ) {
        return new UpperLayerProvider(name, true, null, remote, socketFactory, settings, scheduler, listener);
    }

    public static UpperLayerProvider acceptor(
        String name,
        Socket socket,
        TransportSettings settings,
        ScheduledExecutorService scheduler,
        ProviderListener listener
    ) {
        return new UpperLayerProvider(
            name,
            false,
            socket,
            (InetSocketAddress) socket.getRemoteSocketAddress(),
            null,
            settings,
            scheduler,
            listener
        );
    }

    /** Acceptor side: signals the transport connection indication and starts reading. */
    public void start() {
        if (requestor) {
            throw new IllegalStateException("A requestor starts with an A-ASSOCIATE request");
        }
        try {
            configure(socket);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot configure connection from " + remote, e);
        }
        listener.onConnectionOpen(socket);
        fire(UpperLayerEvent.EVT5, null);
        startReader(false);
    }

    /** Requestor side: A-ASSOCIATE request primitive. The connection is opened asynchronously. */
    public void requestAssociation(Pdu.AssociateRq rq) {
        if (!requestor) {
            throw new IllegalStateException("Only the requestor sends an A-ASSOCIATE-RQ");
        }
        fire(UpperLayerEvent.EVT1, rq);
    }

    /**
     * Sends a P-DATA-TF while the association is in a data transfer state.
     *
     * @throws IllegalStateException when the association cannot carry data
     */
    public void sendData(Pdu.PDataTf pdu) {
        boolean sent = fireGuarded(() -> DATA_TRANSFER.contains(fsm.state()), UpperLayerEvent.EVT9, pdu).isPresent();
        if (!sent) {
            throw new IllegalStateException("Cannot send P-DATA in " + state().label() + " (" + state().description() + ")");
        }
    }

    /** Fires a local primitive only if the machine is in one of the given states. */
    public boolean fireIfIn(Set<UpperLayerState> states, UpperLayerEvent event, Pdu pdu) {
        return fireGuarded(() -> states.contains(fsm.state()), event, pdu).isPresent();
    }

    public UpperLayerState fire(UpperLayerEvent event, Pdu pdu) {
        return fireGuarded(() -> true, event, pdu).orElseThrow();
    }

    /**
     * A-ABORT request from the service user. Does not wait for the peer: the transport is dropped right after
     * the A-ABORT is written.
     */
    public void abort() {
        abort(new Pdu.Abort(AbortSource.SERVICE_USER.code(), AbortSource.REASON_NOT_SPECIFIED));
    }

    /** A-ABORT request sending the given PDU as is, when the state still has a peer to tell. */
    public void abort(Pdu.Abort pdu) {
        UpperLayerState current = state();
        if (current == UpperLayerState.STA1) {
            return;
        }
        if (current != UpperLayerState.STA2 && current != UpperLayerState.STA13) {
            fireGuarded(() -> fsm.state() != UpperLayerState.STA2 && fsm.state() != UpperLayerState.STA13 && fsm.state() != UpperLayerState.STA1,
                UpperLayerEvent.EVT15,
                pdu);
        }
        closeSocket();
        fireGuarded(() -> fsm.state() != UpperLayerState.STA1, UpperLayerEvent.EVT17, null);
    }

    public UpperLayerState state() {
        return fsm.state();
    }

    public boolean isAborted() {
        return fsm.isAborted();
    }

    public boolean isEstablished() {
        return DATA_TRANSFER.contains(fsm.state());
    }

    public InetSocketAddress remoteAddress() {
        return remote;
    }

    public String name() {
        return name;
    }

    @Override
    public boolean isRequestor() {
        return requestor;
    }

    @Override
    public void openTransport() {
        startReader(true);
    }

    @Override
    public void send(Pdu pdu) {
        OutputStream stream = out;
        if (stream == null) {
            logger.debug("{}: no transport connection, {} not sent", name, pdu.getClass().getSimpleName());
            return;
        }
        byte[] encoded = PduCodec.encode(pdu);
        try {
            synchronized (writeLock) {
                stream.write(encoded);
                stream.flush();
            }
        } catch (IOException e) {
            // the reader sees the closed socket and raises the transport closed event
            logger.warn("{}: failed to send {}: {}", name, pdu.getClass().getSimpleName(), e.getMessage());
            closeSocketQuietly();
            return;
        }
        listener.onPduSent(pdu);
    }

    @Override
    public void indicate(Indication indication) {
        pendingIndications.add(indication);
        if (indication instanceof Indication.Closed) {
            artim.stop();
            closeSocket();
        }
    }

    @Override
    public void closeTransport() {
        closeSocket();
    }

    @Override
    public void startArtim() {
        artim.start(this::onArtimExpired);
    }

    @Override
    public void stopArtim() {
        artim.stop();
    }

    @Override
    public void onTransition(UpperLayerState from, UpperLayerEvent event, String action, UpperLayerState to) {
        listener.onTransition(from, event, action, to);
    }

    private Optional<UpperLayerState> fireGuarded(BooleanSupplier guard, UpperLayerEvent event, Pdu pdu) {
        List<Indication> delivered;
        UpperLayerState next;
        synchronized (fsm) {
            if (!guard.getAsBoolean()) {
                return Optional.empty();
            }
            next = fsm.fire(event, pdu);
            delivered = new ArrayList<>(pendingIndications);
            pendingIndications.clear();
        }
        delivered.forEach(listener::onIndication);
        return Optional.of(next);
    }

    private void onArtimExpired(long generation) {
        if (fireGuarded(() -> artim.isCurrent(generation), UpperLayerEvent.EVT18, null).isPresent()) {
            logger.info("{}: ARTIM timer expired after {}", name, settings.artimTimeout());
        }
    }

    private void startReader(boolean connectFirst) {
        Thread reader = new Thread(() -> readLoop(connectFirst), "netdicom-reader-" + name);
        reader.setDaemon(true);
        reader.start();
    }

    private void readLoop(boolean connectFirst) {
        if (connectFirst && !connect()) {
            return;
        }
        InputStream in;
        try {
            in = new BufferedInputStream(socket.getInputStream());
        } catch (IOException e) {
            logger.warn("{}: cannot read from {}: {}", name, remote, e.getMessage());
            transportClosed();
            return;
        }
        while (true) {
            Pdu pdu;
            try {
                pdu = PduCodec.read(in, settings.maxPduLength());
            } catch (PduTooLargeException e) {
                logger.warn("{}: invalid PDU from {}: {}", name, remote, e.getMessage());
                fire(UpperLayerEvent.EVT19, null);
                // the rest of the oversized body would be read as PDU headers
                transportClosed();
                return;
            } catch (MalformedPduException e) {
                logger.warn("{}: invalid PDU from {}: {}", name, remote, e.getMessage());
                fire(UpperLayerEvent.EVT19, null);
                continue;
            } catch (SocketTimeoutException e) {
                onIdleTimeout();
                continue;
            } catch (IOException e) {
                if (!closedLocally) {
                    logger.info("{}: transport connection to {} lost: {}", name, remote, e.getMessage());
                }
                transportClosed();
                return;
            }
            if (pdu == null) {
                transportClosed();
                return;
            }
            listener.onPduReceived(pdu);
            fire(UpperLayerEvent.received(pdu), pdu);
        }
    }

    private boolean connect() {
        Socket candidate = null;
        try {
            candidate = socketFactory.createSocket();
            candidate.connect(remote, (int) settings.connectTimeout().toMillis());
            if (candidate instanceof SSLSocket ssl) {
                ssl.startHandshake();
            }
            configure(candidate);
        } catch (IOException e) {
            logger.info("{}: connection to {} failed: {}", name, remote, e.getMessage());
            if (candidate != null) {
                closeQuietly(candidate);
            }
            fireGuarded(() -> fsm.state() == UpperLayerState.STA4, UpperLayerEvent.EVT17, null);
            return false;
        }
        socket = candidate;
        listener.onConnectionOpen(candidate);
        if (fireGuarded(() -> fsm.state() == UpperLayerState.STA4, UpperLayerEvent.EVT2, null).isEmpty()) {
            // aborted while connecting
            closeSocket();
            return false;
        }
        return true;
    }

    private void configure(Socket target) throws IOException {
        target.setTcpNoDelay(true);
        target.setSoTimeout((int) settings.networkTimeout().toMillis());
        out = new BufferedOutputStream(target.getOutputStream());
    }

    private void onIdleTimeout() {
        UpperLayerState current = state();
        if (current == UpperLayerState.STA2 || current == UpperLayerState.STA13 || current == UpperLayerState.STA1) {
            return;
        }
        logger.warn("{}: no data from {} within the network timeout of {}, aborting", name, remote, settings.networkTimeout());
        fireGuarded(
            () -> fsm.state() != UpperLayerState.STA2 && fsm.state() != UpperLayerState.STA13 && fsm.state() != UpperLayerState.STA1,
            UpperLayerEvent.EVT15,
            new Pdu.Abort(AbortSource.SERVICE_USER.code(), AbortSource.REASON_NOT_SPECIFIED)
        );
    }

    private void transportClosed() {
        if (closedLocally) {
            return;
        }
        closeSocket();
        fireGuarded(() -> fsm.state() != UpperLayerState.STA1, UpperLayerEvent.EVT17, null);
    }

    private void closeSocket() {
        closedLocally = true;
        closeSocketQuietly();
    }

    private void closeSocketQuietly() {
        Socket current = socket;
        if (current == null) {
            return;
        }
        closeQuietly(current);
        if (closeNotified.compareAndSet(false, true)) {
            listener.onConnectionClose();
        }
    }

    private void closeQuietly(Socket target) {
        try {
            target.close();
        } catch (IOException e) {
            logger.debug("{}: error closing socket: {}", name, e.getMessage());
        }
    }
}
