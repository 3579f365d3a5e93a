package it.netdicom.acse;

import java.util.List;

import it.netdicom.pdu.UserInformation.AsyncOperationsWindow;
import it.netdicom.pdu.UserInformation.SopClassCommonExtended;
import it.netdicom.pdu.UserInformation.SopClassExtended;
import it.netdicom.pdu.UserInformation.UserIdentity;

/**
 * Acceptor decisions on extended negotiation items. Defaults accept any identity, reply with a
 * synchronous operations window and accept no extended SOP class items.
 */
public interface NegotiationCallbacks {

    NegotiationCallbacks DEFAULTS = new NegotiationCallbacks() {
    };

    default IdentityVerdict verifyUserIdentity(UserIdentity identity) {
        return IdentityVerdict.accepted();
    }

    default AsyncOperationsWindow asyncOperations(AsyncOperationsWindow requested) {
        return AsyncOperationsWindow.SYNCHRONOUS;
    }

    /** Returns the reply items; only UIDs that were requested are sent back. */
    default List<SopClassExtended> sopClassExtended(List<SopClassExtended> requested) {
        return List.of();
    }

    /** Returns the items the acceptor agrees to; they are never sent back to the requestor. */
    default List<SopClassCommonExtended> sopClassCommonExtended(List<SopClassCommonExtended> requested) {
        return List.of();
    }
}
