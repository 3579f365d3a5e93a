package it.netdicom.presentation;

import java.util.List;
import java.util.Optional;

import it.netdicom.sop.Uids;

/**
 * An abstract syntax the local AE is prepared to negotiate, with the transfer syntaxes it accepts
 * and, optionally, the SCP/SCU roles it allows the peer to select.
 */
public record SupportedContext(String abstractSyntax, List<String> transferSyntaxes, Optional<ScpScuRole> roles) {

    public SupportedContext {
        Uids.require(abstractSyntax, "abstract syntax");
        if (transferSyntaxes == null || transferSyntaxes.isEmpty()) {
            throw new IllegalArgumentException("Supported context " + abstractSyntax + " needs at least one transfer syntax");
        }
        transferSyntaxes.forEach(uid -> Uids.require(uid, "transfer syntax"));
        transferSyntaxes = List.copyOf(transferSyntaxes);
        roles = roles == null ? Optional.empty() : roles;
    }

    public static SupportedContext of(String abstractSyntax, List<String> transferSyntaxes) {
        return new SupportedContext(abstractSyntax, transferSyntaxes, Optional.empty());
    }

    public static SupportedContext withRoles(String abstractSyntax, List<String> transferSyntaxes, boolean scu, boolean scp) {
        return new SupportedContext(abstractSyntax, transferSyntaxes, Optional.of(new ScpScuRole(scu, scp)));
    }
}
