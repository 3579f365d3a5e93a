package it.netdicom.presentation;

import java.util.Optional;

/**
 * SCP/SCU role selection outcomes (PS3.7 D.3.3.4). Flags are requestor SCU, requestor SCP,
 * acceptor SCU, acceptor SCP.
 */
public enum RoleOutcome {
    DEFAULT(true, false, false, true),
    BOTH(true, true, true, true),
    INVERTED(false, true, true, false),
    REJECTED(false, false, false, false);

    // rows: proposed (scu, scp); columns: acceptor (scu, scp); index = scu * 2 + scp
    private static final RoleOutcome[][] TABLE = {
        // proposed (F, F)
        {REJECTED, REJECTED, REJECTED, REJECTED},
        // proposed (F, T)
        {REJECTED, INVERTED, REJECTED, INVERTED},
        // proposed (T, F)
        {REJECTED, REJECTED, DEFAULT, DEFAULT},
        // proposed (T, T)
        {REJECTED, INVERTED, DEFAULT, BOTH}
    };

    private final boolean requestorScu;
    private final boolean requestorScp;
    private final boolean acceptorScu;
    private final boolean acceptorScp;

    RoleOutcome(boolean requestorScu, boolean requestorScp, boolean acceptorScu, boolean acceptorScp) {
        this.requestorScu = requestorScu;
        this.requestorScp = requestorScp;
        this.acceptorScu = acceptorScu;
        this.acceptorScp = acceptorScp;
    }

    public static RoleOutcome of(Optional<ScpScuRole> proposed, Optional<ScpScuRole> acceptor) {
        if (proposed.isEmpty() || acceptor.isEmpty()) {
            return DEFAULT;
        }
        return TABLE[index(proposed.get())][index(acceptor.get())];
    }

    private static int index(ScpScuRole role) {
        return (role.scu() ? 2 : 0) + (role.scp() ? 1 : 0);
    }

    public boolean requestorScu() {
        return requestorScu;
    }

    public boolean requestorScp() {
        return requestorScp;
    }

    public boolean acceptorScu() {
        return acceptorScu;
    }

    public boolean acceptorScp() {
        return acceptorScp;
    }
}
