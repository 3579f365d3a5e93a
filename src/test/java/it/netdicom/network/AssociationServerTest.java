package it.netdicom.network;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;

import org.junit.jupiter.api.Test;

import it.netdicom.association.AeSettings;
import it.netdicom.association.ApplicationEntity;

class AssociationServerTest {

    @Test
    void portZeroBindsAnEphemeralPort() throws IOException {
        ApplicationEntity ae = new ApplicationEntity(new AeSettings());
        AssociationServer server = new AssociationServer(ae, "127.0.0.1", 0);
        try {
            server.bind();
            assertTrue(server.localPort() > 0);
            assertThrows(IllegalStateException.class, server::bind);
        } finally {
            server.stop();
            ae.shutdown();
        }
        assertFalse(server.isRunning());
    }

    @Test
    void portOutOfRangeIsRejected() {
        ApplicationEntity ae = new ApplicationEntity(new AeSettings());
        try {
            assertThrows(IllegalArgumentException.class, () -> new AssociationServer(ae, null, 70000));
        } finally {
            ae.shutdown();
        }
    }
}
