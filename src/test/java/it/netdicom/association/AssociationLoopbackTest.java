package it.netdicom.association;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import it.netdicom.acse.AbortSource;
import it.netdicom.acse.Rejection;
import it.netdicom.dimse.DimseCommands;
import it.netdicom.dimse.DimseMessage;
import it.netdicom.dimse.DimseResult;
import it.netdicom.dimse.DimseTimeoutException;
import it.netdicom.dimse.Status;
import it.netdicom.event.EventType;
import it.netdicom.event.HandlerType;
import it.netdicom.network.AssociationServer;
import it.netdicom.pdu.Pdu;
import it.netdicom.pdu.PduCodec;
import it.netdicom.sop.SopClassRegistry;
import it.netdicom.sop.TransferSyntax;

class AssociationLoopbackTest {

    private static final List<String> TRANSFER_SYNTAXES = List.of(TransferSyntax.IMPLICIT_VR_LITTLE_ENDIAN, TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN);
    private static final byte[] IDENTIFIER = {0x10, 0x00, 0x20, 0x00, 2, 0, 0, 0, 'A', ' '};

    private ApplicationEntity scp;
    private ApplicationEntity scu;
    private AssociationServer server;
    private Thread serverThread;

    @BeforeEach
    void setUp() {
        AeSettings scpSettings = new AeSettings();
        scpSettings.setAeTitle("LOOP_SCP");
        scpSettings.setMaxPduLength(4096);
        scp = new ApplicationEntity(scpSettings);
        scp.addSupportedContext(SopClassRegistry.VERIFICATION, TRANSFER_SYNTAXES);
        scp.addSupportedContext(SopClassRegistry.STUDY_ROOT_FIND, TRANSFER_SYNTAXES);
        scp.addSupportedContext(SopClassRegistry.CT_IMAGE_STORAGE, TRANSFER_SYNTAXES);

        AeSettings scuSettings = new AeSettings();
        scuSettings.setAeTitle("LOOP_SCU");
        scuSettings.setDimseTimeout(Duration.ofSeconds(5));
        scu = new ApplicationEntity(scuSettings);
        scu.addRequestedContext(SopClassRegistry.VERIFICATION, TRANSFER_SYNTAXES);
        scu.addRequestedContext(SopClassRegistry.STUDY_ROOT_FIND, TRANSFER_SYNTAXES);
        scu.addRequestedContext(SopClassRegistry.CT_IMAGE_STORAGE, List.of(TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN));
    }

    private void startServer() throws IOException {
        server = new AssociationServer(scp, "127.0.0.1", 0);
        server.bind();
        serverThread = new Thread(() -> {
            try {
                server.start();
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }, "loopback-server");
        serverThread.setDaemon(true);
        serverThread.start();
    }

    private Association associate(String calledAeTitle) {
        return scu.associate("127.0.0.1", server.localPort(), calledAeTitle);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        scu.shutdown();
        if (server != null) {
            server.stop();
            serverThread.join(2000);
        }
        scp.shutdown();
    }

    @Test
    void echoThenReleaseEndsReleased() throws Exception {
        startServer();
        Association association = associate("LOOP_SCP");

        assertTrue(association.isEstablished());
        assertEquals(3, association.acceptedContexts().size());
        DimseMessage response = association.sendEcho();
        association.release();

        assertEquals(Status.SUCCESS, response.command().status());
        assertEquals(AssociationStatus.RELEASED, association.terminated().get(5, TimeUnit.SECONDS));
        assertTrue(association.isReleased());
    }

    @Test
    void findDeliversPendingMatchesThenFinalSuccess() throws Exception {
        scp.bind(HandlerType.C_FIND, event -> List.of(
            DimseResult.pending(event.dataSet()),
            DimseResult.pending(event.dataSet()),
            DimseResult.pending(event.dataSet())
        ).iterator());
        startServer();
        Association association = associate("LOOP_SCP");

        List<DimseMessage> responses = new ArrayList<>();
        try (DimseResponses find = association.sendFind(SopClassRegistry.STUDY_ROOT_FIND, IDENTIFIER, DimseCommands.PRIORITY_MEDIUM)) {
            while (find.hasNext()) {
                responses.add(find.next());
            }
        }
        association.release();

        assertEquals(4, responses.size());
        for (int i = 0; i < 3; i++) {
            assertEquals(Status.PENDING, responses.get(i).command().status());
            assertArrayEquals(IDENTIFIER, responses.get(i).dataSet());
        }
        assertEquals(Status.SUCCESS, responses.get(3).command().status());
        assertFalse(responses.get(3).hasDataSet());
    }

    @Test
    void storeFragmentsToThePeerMaximumAndArrivesWhole() throws Exception {
        AtomicReference<byte[]> stored = new AtomicReference<>();
        scp.bind(HandlerType.C_STORE, event -> {
            stored.set(event.dataSet());
            return Status.SUCCESS;
        });
        startServer();
        Association association = associate("LOOP_SCP");
        byte[] dataSet = new byte[50_000];
        for (int i = 0; i < dataSet.length; i++) {
            dataSet[i] = (byte) i;
        }

        DimseMessage response = association.sendStore(SopClassRegistry.CT_IMAGE_STORAGE, "1.2.3.4",
            TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN, dataSet, DimseCommands.PRIORITY_MEDIUM);
        association.release();

        assertEquals(Status.SUCCESS, response.command().status());
        assertArrayEquals(dataSet, stored.get());
        assertEquals(4096, association.peerMaxPduLength());
    }

    @Test
    void unansweredRequestTimesOutAndAborts() throws Exception {
        scu.settings().setDimseTimeout(Duration.ofMillis(300));
        scp.bind(HandlerType.C_ECHO, event -> {
            Thread.sleep(3000);
            return Status.SUCCESS;
        });
        startServer();
        Association association = associate("LOOP_SCP");

        assertThrows(DimseTimeoutException.class, association::sendEcho);

        assertEquals(AssociationStatus.ABORTED, association.terminated().get(5, TimeUnit.SECONDS));
        assertTrue(association.isAborted());
    }

    @Test
    void wrongCalledAeTitleIsRejected() throws Exception {
        scp.settings().setRequireCalledAeTitle(true);
        startServer();

        Association association = associate("SOMEONE_ELSE");

        assertTrue(association.isRejected());
        assertEquals(Rejection.CALLED_AE_NOT_RECOGNIZED, association.rejection().orElseThrow());
        assertEquals(AssociationStatus.REJECTED, association.terminated().get(5, TimeUnit.SECONDS));
    }

    @Test
    void notificationsFollowTheAssociationLifecycle() throws Exception {
        List<EventType> seen = new CopyOnWriteArrayList<>();
        scu.subscribe(EventType.ASSOCIATION_ESTABLISHED, notification -> seen.add(notification.type()));
        scu.subscribe(EventType.DIMSE_SENT, notification -> seen.add(notification.type()));
        scu.subscribe(EventType.ASSOCIATION_RELEASED, notification -> seen.add(notification.type()));
        startServer();

        Association association = associate("LOOP_SCP");
        association.sendEcho();
        association.release();
        association.terminated().get(5, TimeUnit.SECONDS);

        assertEquals(List.of(EventType.ASSOCIATION_ESTABLISHED, EventType.DIMSE_SENT, EventType.ASSOCIATION_RELEASED), seen);
    }

    @Test
    void cancelForAMessageNotInProgressIsIgnored() throws Exception {
        scp.bind(HandlerType.C_FIND, event -> List.of(
            DimseResult.pending(event.dataSet()),
            DimseResult.pending(event.dataSet())
        ).iterator());
        startServer();
        Association association = associate("LOOP_SCP");
        int contextId = association.contextFor(SopClassRegistry.STUDY_ROOT_FIND, Optional.empty()).contextId();

        association.sendCancel(contextId, 1);
        List<Integer> statuses = new ArrayList<>();
        try (DimseResponses find = association.sendFind(SopClassRegistry.STUDY_ROOT_FIND, IDENTIFIER, DimseCommands.PRIORITY_MEDIUM)) {
            assertEquals(1, find.messageId());
            while (find.hasNext()) {
                statuses.add(find.next().command().status());
            }
        }
        association.release();

        assertEquals(List.of(Status.PENDING, Status.PENDING, Status.SUCCESS), statuses);
    }

    @Test
    void cancelDuringFindEndsWithCancelStatus() throws Exception {
        scp.bind(HandlerType.C_FIND, event -> new Iterator<DimseResult>() {
            private int remaining = 50;

            @Override
            public boolean hasNext() {
                return remaining > 0;
            }

            @Override
            public DimseResult next() {
                remaining--;
                try {
                    Thread.sleep(20);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return DimseResult.pending(IDENTIFIER);
            }
        });
        startServer();
        Association association = associate("LOOP_SCP");

        List<Integer> statuses = new ArrayList<>();
        try (DimseResponses find = association.sendFind(SopClassRegistry.STUDY_ROOT_FIND, IDENTIFIER, DimseCommands.PRIORITY_MEDIUM)) {
            statuses.add(find.next().command().status());
            find.cancel();
            while (find.hasNext()) {
                statuses.add(find.next().command().status());
            }
        }
        association.release();

        assertEquals(Status.CANCEL, statuses.get(statuses.size() - 1));
        assertTrue(statuses.size() < 51);
    }

    @Test
    void abortCarriesTheRequestedSourceAndReason() throws Exception {
        CountDownLatch received = new CountDownLatch(1);
        AtomicReference<Pdu.Abort> abort = new AtomicReference<>();
        scp.subscribe(EventType.PDU_RECEIVED, notification -> {
            if (notification.detail() instanceof Pdu.Abort pdu) {
                abort.set(pdu);
                received.countDown();
            }
        });
        startServer();
        Association association = associate("LOOP_SCP");

        association.abort(AbortSource.SERVICE_PROVIDER, AbortSource.REASON_INVALID_PDU_PARAMETER);

        assertTrue(received.await(5, TimeUnit.SECONDS));
        assertEquals(new Pdu.Abort(AbortSource.SERVICE_PROVIDER.code(), AbortSource.REASON_INVALID_PDU_PARAMETER), abort.get());
        assertEquals(AssociationStatus.ABORTED, association.terminated().get(5, TimeUnit.SECONDS));
    }

    @Test
    void userAbortSendsNoReason() throws Exception {
        CountDownLatch received = new CountDownLatch(1);
        AtomicReference<Pdu.Abort> abort = new AtomicReference<>();
        scp.subscribe(EventType.PDU_RECEIVED, notification -> {
            if (notification.detail() instanceof Pdu.Abort pdu) {
                abort.set(pdu);
                received.countDown();
            }
        });
        startServer();
        Association association = associate("LOOP_SCP");

        association.abort();

        assertTrue(received.await(5, TimeUnit.SECONDS));
        assertEquals(new Pdu.Abort(AbortSource.SERVICE_USER.code(), AbortSource.REASON_NOT_SPECIFIED), abort.get());
    }

    @Test
    void oversizedPduHeaderIsAbortedWithoutBufferingTheBody() throws Exception {
        startServer();

        try (Socket socket = new Socket("127.0.0.1", server.localPort())) {
            socket.setSoTimeout(5000);
            OutputStream out = socket.getOutputStream();
            out.write(new byte[] {0x01, 0, 0x7F, (byte) 0xFF, (byte) 0xFF, 0});
            out.flush();

            InputStream in = socket.getInputStream();
            assertInstanceOf(Pdu.Abort.class, PduCodec.read(in));
            assertNull(PduCodec.read(in));
        }
    }
}
