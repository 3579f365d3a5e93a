package it.netdicom.presentation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches proposed presentation contexts against local capabilities. Stateless and free of I/O.
 */
public final class PresentationNegotiator {

    private static final Logger logger = LoggerFactory.getLogger(PresentationNegotiator.class);

    private PresentationNegotiator() {
    }

    /**
     * Acceptor side negotiation.
     *
     * @param proposed contexts from the A-ASSOCIATE-RQ, in the requestor's order
     * @param supported local capabilities, unique per abstract syntax
     * @param proposedRoles role selection items from the request keyed by SOP class UID
     * @return one result per proposed context, same order and ids, plus role selection replies
     */
    public static AcceptorOutcome negotiateAsAcceptor(
        List<PresentationContext> proposed,
        List<SupportedContext> supported,
        Map<String, ScpScuRole> proposedRoles
    ) {
        if (proposed.size() > PresentationContext.MAX_CONTEXTS) {
            throw new IllegalArgumentException("More than " + PresentationContext.MAX_CONTEXTS + " presentation contexts proposed");
        }
        Map<String, SupportedContext> byAbstractSyntax = new LinkedHashMap<>();
        for (SupportedContext context : supported) {
            if (byAbstractSyntax.putIfAbsent(context.abstractSyntax(), context) != null) {
                throw new IllegalArgumentException("Abstract syntax supported more than once: " + context.abstractSyntax());
            }
        }

        List<NegotiatedContext> results = new ArrayList<>(proposed.size());
        Map<String, ScpScuRole> replies = new TreeMap<>();
        for (PresentationContext context : proposed) {
            SupportedContext match = byAbstractSyntax.get(context.abstractSyntax());
            if (match == null) {
                results.add(rejected(context, ContextResult.ABSTRACT_SYNTAX_NOT_SUPPORTED));
                continue;
            }

            Optional<String> transferSyntax = context.transferSyntaxes().stream()
                .filter(match.transferSyntaxes()::contains)
                .findFirst();
            if (transferSyntax.isEmpty()) {
                results.add(rejected(context, ContextResult.TRANSFER_SYNTAXES_NOT_SUPPORTED));
                continue;
            }

            Optional<ScpScuRole> requested = Optional.ofNullable(proposedRoles.get(context.abstractSyntax()));
            RoleOutcome outcome = RoleOutcome.of(requested, match.roles());
            if (outcome == RoleOutcome.REJECTED) {
                results.add(rejected(context, ContextResult.USER_REJECTION));
                continue;
            }

            results.add(new NegotiatedContext(
                context.identifier(),
                context.abstractSyntax(),
                ContextResult.ACCEPTANCE,
                transferSyntax,
                outcome.requestorScu(),
                outcome.requestorScp()
            ));
            if (requested.isPresent() && match.roles().isPresent()) {
                ScpScuRole offered = match.roles().get();
                // a role the requestor did not propose can never be granted
                replies.put(context.abstractSyntax(), new ScpScuRole(
                    requested.get().scu() && offered.scu(),
                    requested.get().scp() && offered.scp()
                ));
            }
        }
        return new AcceptorOutcome(results, replies);
    }

    /**
     * Requestor side interpretation of the acceptor's presentation context results.
     * Contexts the acceptor left out of its reply are treated as provider rejections.
     */
    public static List<NegotiatedContext> negotiateAsRequestor(
        List<PresentationContext> proposed,
        List<ContextReply> replies,
        Map<String, ScpScuRole> proposedRoles,
        Map<String, ScpScuRole> acceptorRoles
    ) {
        if (proposed.isEmpty()) {
            throw new IllegalArgumentException("Requestor presentation contexts are required");
        }
        Map<Integer, ContextReply> byId = new HashMap<>();
        for (ContextReply reply : replies) {
            byId.put(reply.contextId(), reply);
        }

        List<NegotiatedContext> results = new ArrayList<>(proposed.size());
        for (PresentationContext context : proposed) {
            ContextReply reply = byId.remove(context.identifier());
            if (reply == null) {
                logger.warn("Presentation context {} missing from the acceptor's reply", context.identifier());
                results.add(rejected(context, ContextResult.NO_REASON));
                continue;
            }
            if (reply.result() != ContextResult.ACCEPTANCE) {
                results.add(rejected(context, reply.result()));
                continue;
            }
            String transferSyntax = reply.transferSyntax().orElse(null);
            if (transferSyntax == null || !context.transferSyntaxes().contains(transferSyntax)) {
                logger.warn("Presentation context {} accepted with transfer syntax {} that was never proposed", context.identifier(), transferSyntax);
                results.add(rejected(context, ContextResult.NO_REASON));
                continue;
            }

            Optional<ScpScuRole> acceptorRole = Optional.ofNullable(acceptorRoles.get(context.abstractSyntax()));
            RoleOutcome outcome = RoleOutcome.of(Optional.ofNullable(proposedRoles.get(context.abstractSyntax())), acceptorRole);
            results.add(new NegotiatedContext(
                context.identifier(),
                context.abstractSyntax(),
                outcome == RoleOutcome.REJECTED ? ContextResult.USER_REJECTION : ContextResult.ACCEPTANCE,
                outcome == RoleOutcome.REJECTED ? Optional.empty() : Optional.of(transferSyntax),
                outcome.requestorScu(),
                outcome.requestorScp()
            ));
        }
        if (!byId.isEmpty()) {
            logger.warn("Acceptor replied to presentation contexts that were never proposed: {}", byId.keySet());
        }
        return results;
    }

    private static NegotiatedContext rejected(PresentationContext context, ContextResult result) {
        return new NegotiatedContext(context.identifier(), context.abstractSyntax(), result, Optional.empty(), false, false);
    }

    /** A presentation context result as received in an A-ASSOCIATE-AC. */
    public record ContextReply(int contextId, ContextResult result, Optional<String> transferSyntax) {
    }

    public record AcceptorOutcome(List<NegotiatedContext> contexts, Map<String, ScpScuRole> roleReplies) {

        public AcceptorOutcome {
            contexts = List.copyOf(contexts);
            roleReplies = Map.copyOf(roleReplies);
        }

        public List<NegotiatedContext> accepted() {
            return contexts.stream().filter(NegotiatedContext::isAccepted).toList();
        }

        public List<Map.Entry<String, ScpScuRole>> sortedRoleReplies() {
            return roleReplies.entrySet().stream().sorted(Map.Entry.comparingByKey(Comparator.naturalOrder())).toList();
        }
    }
}
