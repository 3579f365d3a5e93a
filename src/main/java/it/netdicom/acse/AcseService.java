package it.netdicom.acse;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.netdicom.pdu.Pdu;
import it.netdicom.pdu.PresentationContextAcItem;
import it.netdicom.pdu.PresentationContextRqItem;
import it.netdicom.pdu.UserInformation;
import it.netdicom.pdu.UserInformation.AsyncOperationsWindow;
import it.netdicom.pdu.UserInformation.RoleSelection;
import it.netdicom.pdu.UserInformation.SopClassCommonExtended;
import it.netdicom.pdu.UserInformation.SopClassExtended;
import it.netdicom.pdu.UserInformation.UserIdentity;
import it.netdicom.pdu.UserInformation.UserIdentityResponse;
import it.netdicom.presentation.ContextResult;
import it.netdicom.presentation.NegotiatedContext;
import it.netdicom.presentation.PresentationContext;
import it.netdicom.presentation.PresentationNegotiator;
import it.netdicom.presentation.ScpScuRole;
import it.netdicom.sop.Uids;

/**
 * Association Control Service Element: builds and interprets the association PDUs.
 */
public final class AcseService {

    private static final Logger logger = LoggerFactory.getLogger(AcseService.class);

    private AcseService() {
    }

    public static Pdu.AssociateRq request(
        String callingAeTitle,
        String calledAeTitle,
        List<PresentationContext> contexts,
        long maxPduLength,
        String implementationClassUid,
        String implementationVersionName,
        ExtendedNegotiation extended
    ) {
        PresentationContext.validateProposal(contexts);
        List<PresentationContextRqItem> items = contexts.stream()
            .map(context -> new PresentationContextRqItem(context.identifier(), context.abstractSyntax(), context.transferSyntaxes()))
            .toList();

        List<RoleSelection> roles = extended.roleSelections().entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .map(entry -> new RoleSelection(entry.getKey(), entry.getValue().scu(), entry.getValue().scp()))
            .toList();
        UserInformation userInformation = new UserInformation(
            maxPduLength,
            Optional.of(Uids.require(implementationClassUid, "implementation class")),
            Optional.ofNullable(implementationVersionName),
            extended.asyncOperationsWindow(),
            roles,
            extended.sopClassExtended(),
            extended.sopClassCommonExtended(),
            extended.userIdentity(),
            Optional.empty()
        );
        return new Pdu.AssociateRq(Pdu.PROTOCOL_VERSION, calledAeTitle, callingAeTitle, Uids.APPLICATION_CONTEXT, items, userInformation);
    }

    /**
     * Acceptor side evaluation of an A-ASSOCIATE-RQ whose protocol version has already been checked.
     *
     * @param overAssociationLimit whether accepting would exceed the maximum number of associations
     */
    public static AcseDecision evaluate(
        Pdu.AssociateRq rq,
        AcceptorPolicy policy,
        NegotiationCallbacks callbacks,
        boolean overAssociationLimit
    ) {
        UserInformation requested = rq.userInformation();
        Optional<UserIdentityResponse> identityResponse = Optional.empty();
        boolean identityFailed = false;
        if (requested.userIdentity().isPresent()) {
            UserIdentity identity = requested.userIdentity().get();
            IdentityVerdict verdict = callbacks.verifyUserIdentity(identity);
            if (!verdict.verified()) {
                logger.info("User identity type {} failed verification", identity.identityType());
                identityFailed = true;
            } else if (identity.positiveResponseRequested()) {
                byte[] response = identity.identityType() <= UserIdentity.USERNAME_AND_PASSCODE
                    ? new byte[0]
                    : verdict.serverResponse().orElse(new byte[0]);
                identityResponse = Optional.of(new UserIdentityResponse(response));
            }
        }

        Optional<Rejection> rejection = firstRejection(rq, policy, overAssociationLimit, identityFailed);
        if (rejection.isPresent()) {
            logger.info("Rejecting association from {}: {}", rq.callingAeTitle(), rejection.get().describe());
            return new AcseDecision.Reject(rejection.get());
        }

        List<PresentationContext> proposed = rq.presentationContexts().stream()
            .map(item -> new PresentationContext(item.contextId(), item.abstractSyntax(), item.transferSyntaxes()))
            .toList();
        Map<String, ScpScuRole> proposedRoles = new HashMap<>();
        for (RoleSelection role : requested.roleSelections()) {
            proposedRoles.put(role.sopClassUid(), new ScpScuRole(role.scuRole(), role.scpRole()));
        }
        PresentationNegotiator.AcceptorOutcome outcome = PresentationNegotiator.negotiateAsAcceptor(
            proposed,
            policy.supportedContexts(),
            proposedRoles
        );
        if (outcome.accepted().isEmpty()) {
            logger.info("Rejecting association from {}: no presentation context could be accepted", rq.callingAeTitle());
            return new AcseDecision.Reject(Rejection.NO_REASON_GIVEN);
        }

        List<PresentationContextAcItem> results = new ArrayList<>();
        for (int i = 0; i < proposed.size(); i++) {
            NegotiatedContext context = outcome.contexts().get(i);
            // rejected contexts still carry a transfer syntax sub-item; the requestor ignores its value
            String transferSyntax = context.transferSyntax().orElse(proposed.get(i).transferSyntaxes().get(0));
            results.add(new PresentationContextAcItem(context.contextId(), context.result().code(), Optional.of(transferSyntax)));
        }

        List<RoleSelection> roleReplies = outcome.sortedRoleReplies().stream()
            .map(entry -> new RoleSelection(entry.getKey(), entry.getValue().scu(), entry.getValue().scp()))
            .toList();
        Optional<AsyncOperationsWindow> asyncReply = requested.asyncOperationsWindow().map(callbacks::asyncOperations);
        List<SopClassExtended> extendedReplies = requested.sopClassExtended().isEmpty()
            ? List.of()
            : onlyRequested(requested.sopClassExtended(), callbacks.sopClassExtended(requested.sopClassExtended()));
        List<SopClassCommonExtended> commonAccepted = requested.sopClassCommonExtended().isEmpty()
            ? List.of()
            : callbacks.sopClassCommonExtended(requested.sopClassCommonExtended());

        UserInformation userInformation = new UserInformation(
            policy.maxPduLength(),
            Optional.of(policy.implementationClassUid()),
            Optional.ofNullable(policy.implementationVersionName()),
            asyncReply,
            roleReplies,
            extendedReplies,
            List.of(),
            Optional.empty(),
            identityResponse
        );
        Pdu.AssociateAc ac = new Pdu.AssociateAc(
            Pdu.PROTOCOL_VERSION,
            rq.calledAeTitle(),
            rq.callingAeTitle(),
            rq.applicationContext(),
            results,
            userInformation
        );
        return new AcseDecision.Accept(ac, outcome.contexts(), commonAccepted);
    }

    /**
     * Requestor side interpretation of an A-ASSOCIATE-AC.
     */
    public static List<NegotiatedContext> interpretAccept(
        List<PresentationContext> proposed,
        ExtendedNegotiation extended,
        Pdu.AssociateAc ac
    ) {
        List<PresentationNegotiator.ContextReply> replies = ac.presentationContexts().stream()
            .map(item -> new PresentationNegotiator.ContextReply(item.contextId(), ContextResult.fromCode(item.result()), item.transferSyntax()))
            .toList();
        Map<String, ScpScuRole> acceptorRoles = new HashMap<>();
        for (RoleSelection role : ac.userInformation().roleSelections()) {
            acceptorRoles.put(role.sopClassUid(), new ScpScuRole(role.scuRole(), role.scpRole()));
        }
        return PresentationNegotiator.negotiateAsRequestor(proposed, replies, extended.roleSelections(), acceptorRoles);
    }

    public static Pdu.ReleaseRq release() {
        return new Pdu.ReleaseRq();
    }

    public static Pdu.ReleaseRp releaseResponse() {
        return new Pdu.ReleaseRp();
    }

    public static Pdu.Abort abort(AbortSource source, int reason) {
        return new Pdu.Abort(source.code(), source == AbortSource.SERVICE_PROVIDER ? reason : AbortSource.REASON_NOT_SPECIFIED);
    }

    private static Optional<Rejection> firstRejection(
        Pdu.AssociateRq rq,
        AcceptorPolicy policy,
        boolean overAssociationLimit,
        boolean identityFailed
    ) {
        if (overAssociationLimit) {
            return Optional.of(Rejection.LOCAL_LIMIT_EXCEEDED);
        }
        if (identityFailed) {
            return Optional.of(Rejection.USER_IDENTITY_FAILED);
        }
        if (policy.requireCalledAeTitle() && !policy.aeTitle().equals(rq.calledAeTitle())) {
            return Optional.of(Rejection.CALLED_AE_NOT_RECOGNIZED);
        }
        Set<String> allowedCalling = policy.requiredCallingAeTitles();
        if (!allowedCalling.isEmpty() && !allowedCalling.contains(rq.callingAeTitle())) {
            return Optional.of(Rejection.CALLING_AE_NOT_RECOGNIZED);
        }
        if (!Uids.APPLICATION_CONTEXT.equals(rq.applicationContext())) {
            return Optional.of(Rejection.APPLICATION_CONTEXT_NOT_SUPPORTED);
        }
        if (rq.presentationContexts().size() > PresentationContext.MAX_CONTEXTS) {
            return Optional.of(Rejection.NO_REASON_GIVEN);
        }
        return Optional.empty();
    }

    private static List<SopClassExtended> onlyRequested(List<SopClassExtended> requested, List<SopClassExtended> replies) {
        Set<String> requestedUids = new HashSet<>();
        requested.forEach(item -> requestedUids.add(item.sopClassUid()));
        List<SopClassExtended> filtered = new ArrayList<>();
        for (SopClassExtended reply : replies) {
            if (requestedUids.contains(reply.sopClassUid())) {
                filtered.add(reply);
            } else {
                logger.warn("Dropping SOP class extended reply for {} which was not requested", reply.sopClassUid());
            }
        }
        return filtered;
    }
}
