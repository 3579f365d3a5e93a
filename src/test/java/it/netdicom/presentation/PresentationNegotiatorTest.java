package it.netdicom.presentation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class PresentationNegotiatorTest {

    private static final String VERIFICATION = "1.2.840.10008.1.1";
    private static final String CT = "1.2.840.10008.5.1.4.1.1.2";
    private static final String MR = "1.2.840.10008.5.1.4.1.1.4";
    private static final String A = "1.2.840.10008.1.2";
    private static final String B = "1.2.840.10008.1.2.1";
    private static final String C = "1.2.840.10008.1.2.2";

    @Test
    void shouldPickFirstCommonTransferSyntaxInRequestorOrder() {
        PresentationNegotiator.AcceptorOutcome outcome = PresentationNegotiator.negotiateAsAcceptor(
            List.of(new PresentationContext(1, VERIFICATION, List.of(A, B))),
            List.of(SupportedContext.of(VERIFICATION, List.of(B, C))),
            Map.of()
        );

        NegotiatedContext context = outcome.contexts().get(0);
        assertEquals(ContextResult.ACCEPTANCE, context.result());
        assertEquals(B, context.negotiatedTransferSyntax());
    }

    @Test
    void shouldPreferRequestorOrderOverAcceptorOrder() {
        PresentationNegotiator.AcceptorOutcome outcome = PresentationNegotiator.negotiateAsAcceptor(
            List.of(new PresentationContext(1, CT, List.of(C, B))),
            List.of(SupportedContext.of(CT, List.of(B, C))),
            Map.of()
        );

        assertEquals(C, outcome.contexts().get(0).negotiatedTransferSyntax());
    }

    @Test
    void shouldRejectUnsupportedAbstractSyntaxWhileAcceptingOthers() {
        PresentationNegotiator.AcceptorOutcome outcome = PresentationNegotiator.negotiateAsAcceptor(
            List.of(new PresentationContext(1, MR, List.of(A)), new PresentationContext(3, VERIFICATION, List.of(A))),
            List.of(SupportedContext.of(VERIFICATION, List.of(A))),
            Map.of()
        );

        assertEquals(ContextResult.ABSTRACT_SYNTAX_NOT_SUPPORTED, outcome.contexts().get(0).result());
        assertEquals(1, outcome.accepted().size());
        assertEquals(3, outcome.accepted().get(0).contextId());
    }

    @Test
    void shouldRejectWhenNoTransferSyntaxMatches() {
        PresentationNegotiator.AcceptorOutcome outcome = PresentationNegotiator.negotiateAsAcceptor(
            List.of(new PresentationContext(1, CT, List.of(C))),
            List.of(SupportedContext.of(CT, List.of(A, B))),
            Map.of()
        );

        assertEquals(ContextResult.TRANSFER_SYNTAXES_NOT_SUPPORTED, outcome.contexts().get(0).result());
        assertTrue(outcome.accepted().isEmpty());
    }

    @Test
    void shouldKeepRequestorIdsAndOrder() {
        List<PresentationContext> proposed = List.of(
            new PresentationContext(7, CT, List.of(A)),
            new PresentationContext(3, MR, List.of(A)),
            new PresentationContext(5, VERIFICATION, List.of(A))
        );

        PresentationNegotiator.AcceptorOutcome outcome = PresentationNegotiator.negotiateAsAcceptor(
            proposed,
            List.of(SupportedContext.of(VERIFICATION, List.of(A)), SupportedContext.of(CT, List.of(A))),
            Map.of()
        );

        assertEquals(List.of(7, 3, 5), outcome.contexts().stream().map(NegotiatedContext::contextId).toList());
    }

    @Test
    void shouldBeDeterministic() {
        List<PresentationContext> proposed = List.of(new PresentationContext(1, CT, List.of(C, A, B)));
        List<SupportedContext> supported = List.of(SupportedContext.of(CT, List.of(B, A)));

        PresentationNegotiator.AcceptorOutcome first = PresentationNegotiator.negotiateAsAcceptor(proposed, supported, Map.of());
        PresentationNegotiator.AcceptorOutcome second = PresentationNegotiator.negotiateAsAcceptor(proposed, supported, Map.of());

        assertEquals(first, second);
        assertEquals(A, first.contexts().get(0).negotiatedTransferSyntax());
    }

    @Test
    void rejectsMoreThan128ProposedContexts() {
        List<PresentationContext> proposed = new ArrayList<>();
        for (int i = 0; i < 129; i++) {
            proposed.add(new PresentationContext(1, CT, List.of(A)));
        }
        assertThrows(IllegalArgumentException.class,
            () -> PresentationNegotiator.negotiateAsAcceptor(proposed, List.of(), Map.of()));
    }

    @Test
    void shouldGrantBothRolesAndReplyWithGrantedRoles() {
        PresentationNegotiator.AcceptorOutcome outcome = PresentationNegotiator.negotiateAsAcceptor(
            List.of(new PresentationContext(1, CT, List.of(A))),
            List.of(SupportedContext.withRoles(CT, List.of(A), true, true)),
            Map.of(CT, new ScpScuRole(true, true))
        );

        NegotiatedContext context = outcome.contexts().get(0);
        assertTrue(context.requestorScu());
        assertTrue(context.requestorScp());
        assertEquals(new ScpScuRole(true, true), outcome.roleReplies().get(CT));
    }

    @Test
    void shouldRejectContextWhenRolesCannotBeAgreed() {
        PresentationNegotiator.AcceptorOutcome outcome = PresentationNegotiator.negotiateAsAcceptor(
            List.of(new PresentationContext(1, CT, List.of(A))),
            List.of(SupportedContext.withRoles(CT, List.of(A), false, false)),
            Map.of(CT, new ScpScuRole(true, true))
        );

        assertEquals(ContextResult.USER_REJECTION, outcome.contexts().get(0).result());
        assertTrue(outcome.roleReplies().isEmpty());
    }

    @Test
    void requestorShouldTreatMissingRepliesAsProviderRejection() {
        List<PresentationContext> proposed = List.of(
            new PresentationContext(1, VERIFICATION, List.of(A)),
            new PresentationContext(3, CT, List.of(A, B))
        );
        List<PresentationNegotiator.ContextReply> replies = List.of(
            new PresentationNegotiator.ContextReply(3, ContextResult.ACCEPTANCE, Optional.of(B))
        );

        List<NegotiatedContext> results = PresentationNegotiator.negotiateAsRequestor(proposed, replies, Map.of(), Map.of());

        assertEquals(ContextResult.NO_REASON, results.get(0).result());
        assertEquals(ContextResult.ACCEPTANCE, results.get(1).result());
        assertEquals(B, results.get(1).negotiatedTransferSyntax());
        assertTrue(results.get(1).localScu(true));
        assertFalse(results.get(1).localScp(true));
    }

    @Test
    void requestorShouldRefuseTransferSyntaxItNeverProposed() {
        List<NegotiatedContext> results = PresentationNegotiator.negotiateAsRequestor(
            List.of(new PresentationContext(1, CT, List.of(A))),
            List.of(new PresentationNegotiator.ContextReply(1, ContextResult.ACCEPTANCE, Optional.of(C))),
            Map.of(),
            Map.of()
        );

        assertFalse(results.get(0).isAccepted());
    }

    @Test
    void requestorShouldApplyInvertedRoles() {
        List<NegotiatedContext> results = PresentationNegotiator.negotiateAsRequestor(
            List.of(new PresentationContext(1, CT, List.of(A))),
            List.of(new PresentationNegotiator.ContextReply(1, ContextResult.ACCEPTANCE, Optional.of(A))),
            Map.of(CT, new ScpScuRole(false, true)),
            Map.of(CT, new ScpScuRole(false, true))
        );

        NegotiatedContext context = results.get(0);
        assertTrue(context.isAccepted());
        assertTrue(context.localScp(true));
        assertFalse(context.localScu(true));
        assertTrue(context.localScu(false));
    }
}
