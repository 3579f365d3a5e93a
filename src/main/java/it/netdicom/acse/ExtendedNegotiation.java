package it.netdicom.acse;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import it.netdicom.pdu.UserInformation.AsyncOperationsWindow;
import it.netdicom.pdu.UserInformation.SopClassCommonExtended;
import it.netdicom.pdu.UserInformation.SopClassExtended;
import it.netdicom.pdu.UserInformation.UserIdentity;
import it.netdicom.presentation.ScpScuRole;

/**
 * Optional negotiation items a requestor adds to its A-ASSOCIATE-RQ user information.
 */
public record ExtendedNegotiation(
    Map<String, ScpScuRole> roleSelections,
    List<SopClassExtended> sopClassExtended,
    List<SopClassCommonExtended> sopClassCommonExtended,
    Optional<UserIdentity> userIdentity,
    Optional<AsyncOperationsWindow> asyncOperationsWindow
) {

    public static final ExtendedNegotiation NONE = new ExtendedNegotiation(Map.of(), List.of(), List.of(), Optional.empty(), Optional.empty());

    public ExtendedNegotiation {
        roleSelections = Map.copyOf(roleSelections);
        sopClassExtended = List.copyOf(sopClassExtended);
        sopClassCommonExtended = List.copyOf(sopClassCommonExtended);
    }

    public ExtendedNegotiation withRole(String sopClassUid, boolean scu, boolean scp) {
        Map<String, ScpScuRole> roles = new java.util.HashMap<>(roleSelections);
        roles.put(sopClassUid, new ScpScuRole(scu, scp));
        return new ExtendedNegotiation(roles, sopClassExtended, sopClassCommonExtended, userIdentity, asyncOperationsWindow);
    }

    public ExtendedNegotiation withUserIdentity(UserIdentity identity) {
        return new ExtendedNegotiation(roleSelections, sopClassExtended, sopClassCommonExtended, Optional.of(identity), asyncOperationsWindow);
    }

    public ExtendedNegotiation withAsyncOperations(int invoked, int performed) {
        return new ExtendedNegotiation(
            roleSelections,
            sopClassExtended,
            sopClassCommonExtended,
            userIdentity,
            Optional.of(new AsyncOperationsWindow(invoked, performed))
        );
    }

    public ExtendedNegotiation withSopClassExtended(SopClassExtended item) {
        List<SopClassExtended> items = new java.util.ArrayList<>(sopClassExtended);
        items.add(item);
        return new ExtendedNegotiation(roleSelections, items, sopClassCommonExtended, userIdentity, asyncOperationsWindow);
    }

    public ExtendedNegotiation withSopClassCommonExtended(SopClassCommonExtended item) {
        List<SopClassCommonExtended> items = new java.util.ArrayList<>(sopClassCommonExtended);
        items.add(item);
        return new ExtendedNegotiation(roleSelections, sopClassExtended, items, userIdentity, asyncOperationsWindow);
    }
}
