package it.netdicom.presentation;

import java.util.Optional;

/**
 * Outcome of negotiating one proposed presentation context. The context id is always the requestor's.
 * Role flags are the requestor's; the acceptor takes the opposite side of each.
 */
public record NegotiatedContext(
    int contextId,
    String abstractSyntax,
    ContextResult result,
    Optional<String> transferSyntax,
    boolean requestorScu,
    boolean requestorScp
) {

    public boolean isAccepted() {
        return result == ContextResult.ACCEPTANCE;
    }

    public boolean acceptorScu() {
        return requestorScp;
    }

    public boolean acceptorScp() {
        return requestorScu;
    }

    public boolean localScu(boolean localIsRequestor) {
        return localIsRequestor ? requestorScu : acceptorScu();
    }

    public boolean localScp(boolean localIsRequestor) {
        return localIsRequestor ? requestorScp : acceptorScp();
    }

    public String negotiatedTransferSyntax() {
        return transferSyntax.orElseThrow(() -> new IllegalStateException("Presentation context " + contextId + " was not accepted"));
    }
}
