package it.netdicom.network;

import java.time.Duration;

/**
 * Socket level timeouts and the local maximum PDU length. A zero network timeout disables the idle check;
 * a zero maximum PDU length accepts P-DATA-TF of any length.
 */
public record TransportSettings(Duration connectTimeout, Duration networkTimeout, Duration artimTimeout, long maxPduLength) {

    public TransportSettings {
        if (connectTimeout.isNegative() || networkTimeout.isNegative() || artimTimeout.isNegative() || artimTimeout.isZero()) {
            throw new IllegalArgumentException("Transport timeouts must be positive");
        }
        if (maxPduLength < 0) {
            throw new IllegalArgumentException("Maximum PDU length must not be negative");
        }
    }
}
