package it.netdicom.acse;

import java.util.Optional;

/**
 * Result of verifying a requestor's user identity. The server response is only sent when the
 * requestor asked for a positive response.
 */
public record IdentityVerdict(boolean verified, Optional<byte[]> serverResponse) {

    public static IdentityVerdict accepted() {
        return new IdentityVerdict(true, Optional.empty());
    }

    public static IdentityVerdict accepted(byte[] serverResponse) {
        return new IdentityVerdict(true, Optional.of(serverResponse));
    }

    public static IdentityVerdict refused() {
        return new IdentityVerdict(false, Optional.empty());
    }
}
