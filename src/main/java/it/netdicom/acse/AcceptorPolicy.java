package it.netdicom.acse;

import java.util.List;
import java.util.Set;

import it.netdicom.presentation.SupportedContext;

/**
 * Read-only acceptor configuration used to evaluate an association request.
 */
public record AcceptorPolicy(
    String aeTitle,
    boolean requireCalledAeTitle,
    Set<String> requiredCallingAeTitles,
    List<SupportedContext> supportedContexts,
    long maxPduLength,
    String implementationClassUid,
    String implementationVersionName
) {

    public AcceptorPolicy {
        requiredCallingAeTitles = Set.copyOf(requiredCallingAeTitles);
        supportedContexts = List.copyOf(supportedContexts);
    }
}
