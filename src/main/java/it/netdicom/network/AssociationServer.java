package it.netdicom.network;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Optional;

import javax.net.ServerSocketFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLServerSocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import it.netdicom.association.ApplicationEntity;

/**
 * Listening side of an application entity. Each accepted connection becomes an acceptor association with
 * its own reader thread.
 */
public class AssociationServer {

    private static final Logger logger = LoggerFactory.getLogger(AssociationServer.class);
    private static final int BACKLOG = 50;

    private final ApplicationEntity ae;
    private final String bindAddress;
    private final int port;
    private volatile ServerSocket server;
    private volatile boolean running;

    public AssociationServer(ApplicationEntity ae, String bindAddress, int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        this.ae = ae;
        this.bindAddress = bindAddress;
        this.port = port;
    }

    /** Binds the listening socket. Port 0 picks an ephemeral port, see {@link #localPort()}. */
    public synchronized void bind() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Server for " + ae.aeTitle() + " is already bound");
        }
        Optional<SSLContext> tls = ae.sslContext();
        ServerSocketFactory factory = tls.isPresent() ? tls.get().getServerSocketFactory() : ServerSocketFactory.getDefault();
        ServerSocket socket = factory.createServerSocket();
        if (socket instanceof SSLServerSocket sslServer) {
            sslServer.setEnabledProtocols(new String[]{"TLSv1.3", "TLSv1.2"});
            sslServer.setWantClientAuth(true);
        }
        socket.setReuseAddress(true);
        InetAddress address = !StringUtils.hasText(bindAddress) ? null : InetAddress.getByName(bindAddress);
        socket.bind(new InetSocketAddress(address, port), BACKLOG);
        server = socket;
        logger.info("DICOM {}server for AE {} listening on {}:{}", tls.isPresent() ? "TLS " : "", ae.aeTitle(),
            socket.getInetAddress().getHostAddress(), socket.getLocalPort());
    }

    /** Binds if needed and runs the accept loop on the calling thread until {@link #stop()}. */
    public void start() throws IOException {
        if (server == null) {
            bind();
        }
        running = true;
        ServerSocket listening = server;
        while (running) {
            Socket socket;
            try {
                socket = listening.accept();
            } catch (IOException e) {
                if (!running) {
                    break;
                }
                logger.error("Accept failed on port {}: {}", localPort(), e.getMessage(), e);
                continue;
            }
            logger.info("DICOM connection from {}", socket.getRemoteSocketAddress());
            try {
                ae.accept(socket);
            } catch (RuntimeException e) {
                logger.error("Cannot start association for {}: {}", socket.getRemoteSocketAddress(), e.getMessage(), e);
                closeQuietly(socket);
            }
        }
        logger.info("DICOM server for AE {} stopped", ae.aeTitle());
    }

    public synchronized void stop() {
        running = false;
        ServerSocket listening = server;
        server = null;
        if (listening != null) {
            closeQuietly(listening);
        }
    }

    public boolean isRunning() {
        return running;
    }

    public int localPort() {
        ServerSocket listening = server;
        return listening == null ? port : listening.getLocalPort();
    }

    private static void closeQuietly(AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            logger.debug("Close failed: {}", e.getMessage());
        }
    }
}
