package it.netdicom.presentation;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Optional;

import org.junit.jupiter.api.Test;

class RoleOutcomeTest {

    @Test
    void shouldDefaultWhenEitherSideOmitsRoleSelection() {
        assertEquals(RoleOutcome.DEFAULT, RoleOutcome.of(Optional.empty(), Optional.of(new ScpScuRole(true, true))));
        assertEquals(RoleOutcome.DEFAULT, RoleOutcome.of(Optional.of(new ScpScuRole(false, true)), Optional.empty()));
    }

    @Test
    void shouldFollowRoleSelectionTable() {
        assertEquals(RoleOutcome.BOTH, outcome(true, true, true, true));
        assertEquals(RoleOutcome.DEFAULT, outcome(true, true, true, false));
        assertEquals(RoleOutcome.INVERTED, outcome(true, true, false, true));
        assertEquals(RoleOutcome.REJECTED, outcome(true, true, false, false));
        assertEquals(RoleOutcome.DEFAULT, outcome(true, false, true, true));
        assertEquals(RoleOutcome.REJECTED, outcome(true, false, false, true));
        assertEquals(RoleOutcome.INVERTED, outcome(false, true, true, true));
        assertEquals(RoleOutcome.REJECTED, outcome(false, true, true, false));
        assertEquals(RoleOutcome.REJECTED, outcome(false, false, true, true));
    }

    @Test
    void invertedOutcomeMakesAcceptorTheScu() {
        assertEquals(true, RoleOutcome.INVERTED.acceptorScu());
        assertEquals(false, RoleOutcome.INVERTED.acceptorScp());
        assertEquals(true, RoleOutcome.INVERTED.requestorScp());
    }

    private static RoleOutcome outcome(boolean proposedScu, boolean proposedScp, boolean acceptorScu, boolean acceptorScp) {
        return RoleOutcome.of(Optional.of(new ScpScuRole(proposedScu, proposedScp)), Optional.of(new ScpScuRole(acceptorScu, acceptorScp)));
    }
}
