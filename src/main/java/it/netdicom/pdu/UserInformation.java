package it.netdicom.pdu;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * User Information item (0x50) and its sub-items.
 */
public record UserInformation(
    long maxPduLength,
    Optional<String> implementationClassUid,
    Optional<String> implementationVersionName,
    Optional<AsyncOperationsWindow> asyncOperationsWindow,
    List<RoleSelection> roleSelections,
    List<SopClassExtended> sopClassExtended,
    List<SopClassCommonExtended> sopClassCommonExtended,
    Optional<UserIdentity> userIdentity,
    Optional<UserIdentityResponse> userIdentityResponse
) {

    public UserInformation {
        if (maxPduLength < 0 || maxPduLength > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("Maximum PDU length out of range: " + maxPduLength);
        }
        roleSelections = List.copyOf(roleSelections);
        sopClassExtended = List.copyOf(sopClassExtended);
        sopClassCommonExtended = List.copyOf(sopClassCommonExtended);
    }

    public static UserInformation of(long maxPduLength, String implementationClassUid, String implementationVersionName) {
        return new UserInformation(
            maxPduLength,
            Optional.ofNullable(implementationClassUid),
            Optional.ofNullable(implementationVersionName),
            Optional.empty(),
            List.of(),
            List.of(),
            List.of(),
            Optional.empty(),
            Optional.empty()
        );
    }

    public Optional<RoleSelection> roleSelectionFor(String sopClassUid) {
        return roleSelections.stream().filter(item -> item.sopClassUid().equals(sopClassUid)).findFirst();
    }

    /** Sub-item 0x53. A value of zero means unlimited outstanding operations. */
    public record AsyncOperationsWindow(int maxOperationsInvoked, int maxOperationsPerformed) {

        public static final AsyncOperationsWindow SYNCHRONOUS = new AsyncOperationsWindow(1, 1);
    }

    /** Sub-item 0x54. */
    public record RoleSelection(String sopClassUid, boolean scuRole, boolean scpRole) {
    }

    /** Sub-item 0x56. The application information is service-class specific and opaque here. */
    public record SopClassExtended(String sopClassUid, byte[] applicationInformation) {

        @Override
        public boolean equals(Object other) {
            return other instanceof SopClassExtended item
                && sopClassUid.equals(item.sopClassUid)
                && Arrays.equals(applicationInformation, item.applicationInformation);
        }

        @Override
        public int hashCode() {
            return 31 * sopClassUid.hashCode() + Arrays.hashCode(applicationInformation);
        }

        @Override
        public String toString() {
            return "SopClassExtended[" + sopClassUid + ", " + applicationInformation.length + " bytes]";
        }
    }

    /** Sub-item 0x57, request only. */
    public record SopClassCommonExtended(String sopClassUid, String serviceClassUid, List<String> relatedGeneralSopClasses) {

        public SopClassCommonExtended {
            relatedGeneralSopClasses = List.copyOf(relatedGeneralSopClasses);
        }
    }

    /** Sub-item 0x58. */
    public record UserIdentity(int identityType, boolean positiveResponseRequested, byte[] primaryField, byte[] secondaryField) {

        public static final int USERNAME = 1;
        public static final int USERNAME_AND_PASSCODE = 2;
        public static final int KERBEROS = 3;
        public static final int SAML = 4;
        public static final int JWT = 5;

        public UserIdentity {
            if (identityType < USERNAME || identityType > JWT) {
                throw new IllegalArgumentException("Unknown user identity type " + identityType);
            }
            if (primaryField == null || primaryField.length == 0) {
                throw new IllegalArgumentException("User identity primary field is required");
            }
            secondaryField = secondaryField == null ? new byte[0] : secondaryField;
            if (identityType == USERNAME_AND_PASSCODE && secondaryField.length == 0) {
                throw new IllegalArgumentException("User identity type 2 requires a passcode");
            }
        }

        public static UserIdentity username(String username, boolean positiveResponseRequested) {
            return new UserIdentity(USERNAME, positiveResponseRequested, username.getBytes(StandardCharsets.UTF_8), new byte[0]);
        }

        public static UserIdentity usernameAndPasscode(String username, String passcode, boolean positiveResponseRequested) {
            return new UserIdentity(
                USERNAME_AND_PASSCODE,
                positiveResponseRequested,
                username.getBytes(StandardCharsets.UTF_8),
                passcode.getBytes(StandardCharsets.UTF_8)
            );
        }

        public String primaryAsString() {
            return new String(primaryField, StandardCharsets.UTF_8);
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof UserIdentity item
                && identityType == item.identityType
                && positiveResponseRequested == item.positiveResponseRequested
                && Arrays.equals(primaryField, item.primaryField)
                && Arrays.equals(secondaryField, item.secondaryField);
        }

        @Override
        public int hashCode() {
            int result = 31 * identityType + (positiveResponseRequested ? 1 : 0);
            result = 31 * result + Arrays.hashCode(primaryField);
            return 31 * result + Arrays.hashCode(secondaryField);
        }

        @Override
        public String toString() {
            return "UserIdentity[type=" + identityType + ", positiveResponseRequested=" + positiveResponseRequested + "]";
        }
    }

    /** Sub-item 0x59. */
    public record UserIdentityResponse(byte[] serverResponse) {

        @Override
        public boolean equals(Object other) {
            return other instanceof UserIdentityResponse item && Arrays.equals(serverResponse, item.serverResponse);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(serverResponse);
        }

        @Override
        public String toString() {
            return "UserIdentityResponse[" + serverResponse.length + " bytes]";
        }
    }
}
