package it.netdicom.pdu;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import it.netdicom.pdu.Pdu.Abort;
import it.netdicom.pdu.Pdu.AssociateAc;
import it.netdicom.pdu.Pdu.AssociateRj;
import it.netdicom.pdu.Pdu.AssociateRq;
import it.netdicom.pdu.Pdu.PDataTf;
import it.netdicom.pdu.Pdu.ReleaseRp;
import it.netdicom.pdu.Pdu.ReleaseRq;
import it.netdicom.pdu.UserInformation.AsyncOperationsWindow;
import it.netdicom.pdu.UserInformation.RoleSelection;
import it.netdicom.pdu.UserInformation.SopClassCommonExtended;
import it.netdicom.pdu.UserInformation.SopClassExtended;
import it.netdicom.pdu.UserInformation.UserIdentity;
import it.netdicom.pdu.UserInformation.UserIdentityResponse;

/**
 * Binary codec for Upper Layer PDUs (PS3.8 section 9.3).
 * <p>
 * Every PDU is {@code {type:1}{reserved:1}{length:4}{body}}; variable items are
 * {@code {type:1}{reserved:1}{length:2}{body}}. All integers are big-endian.
 */
public final class PduCodec {

    public static final int HEADER_LENGTH = 6;
    public static final int ITEM_HEADER_LENGTH = 4;
    public static final int PDV_HEADER_LENGTH = 6;

    static final int APPLICATION_CONTEXT_ITEM = 0x10;
    static final int PRESENTATION_CONTEXT_RQ_ITEM = 0x20;
    static final int PRESENTATION_CONTEXT_AC_ITEM = 0x21;
    static final int ABSTRACT_SYNTAX_ITEM = 0x30;
    static final int TRANSFER_SYNTAX_ITEM = 0x40;
    static final int USER_INFORMATION_ITEM = 0x50;
    static final int MAXIMUM_LENGTH_ITEM = 0x51;
    static final int IMPLEMENTATION_CLASS_UID_ITEM = 0x52;
    static final int ASYNC_OPERATIONS_ITEM = 0x53;
    static final int ROLE_SELECTION_ITEM = 0x54;
    static final int IMPLEMENTATION_VERSION_NAME_ITEM = 0x55;
    static final int SOP_CLASS_EXTENDED_ITEM = 0x56;
    static final int SOP_CLASS_COMMON_EXTENDED_ITEM = 0x57;
    static final int USER_IDENTITY_RQ_ITEM = 0x58;
    static final int USER_IDENTITY_AC_ITEM = 0x59;

    /** Upper bound on the declared length of any PDU other than P-DATA-TF. */
    public static final long MAX_ASSOCIATION_PDU_LENGTH = 1L << 20;

    /** Tolerated excess over the local maximum PDU length for P-DATA-TF from lax peers. */
    public static final long P_DATA_LENGTH_TOLERANCE = 4096;

    private static final long MAX_READ_LENGTH = Integer.MAX_VALUE - 64L;
    private static final int READ_CHUNK = 64 * 1024;

    private PduCodec() {
    }

    public static byte[] encode(Pdu pdu) {
        byte[] body = switch (pdu.type()) {
            case Pdu.ASSOCIATE_RQ -> encodeAssociateRq((AssociateRq) pdu);
            case Pdu.ASSOCIATE_AC -> encodeAssociateAc((AssociateAc) pdu);
            case Pdu.ASSOCIATE_RJ -> encodeAssociateRj((AssociateRj) pdu);
            case Pdu.P_DATA_TF -> encodePDataTf((PDataTf) pdu);
            case Pdu.RELEASE_RQ, Pdu.RELEASE_RP -> new byte[4];
            case Pdu.ABORT -> encodeAbort((Abort) pdu);
            default -> throw new IllegalArgumentException("Unsupported PDU type " + pdu.type());
        };
        PduWriter writer = new PduWriter().u8(pdu.type()).u8(0).u32(body.length).bytes(body);
        byte[] encoded = writer.toByteArray();
        if (encoded.length != HEADER_LENGTH + body.length) {
            throw new IllegalStateException("Encoded PDU length does not match its declared length");
        }
        return encoded;
    }

    /** Decodes one complete PDU, header included. */
    public static Pdu decode(byte[] bytes) {
        PduReader reader = new PduReader(bytes);
        if (reader.remaining() < HEADER_LENGTH) {
            throw new MalformedPduException("PDU shorter than its " + HEADER_LENGTH + "-byte header");
        }
        int type = reader.u8();
        reader.skip(1);
        long length = reader.u32();
        if (length != reader.remaining()) {
            throw new MalformedPduException("PDU declared length " + length + " but " + reader.remaining() + " bytes follow");
        }
        return decodeBody(type, reader);
    }

    /**
     * Reads exactly one PDU from the stream with no local maximum PDU length.
     *
     * @see #read(InputStream, long)
     */
    public static Pdu read(InputStream in) throws IOException {
        return read(in, 0);
    }

    /**
     * Reads exactly one PDU from the stream: the header first, then the declared number of body bytes.
     * The body is buffered as it arrives, so a declared length never allocates more than was received.
     *
     * @param maxPduLength local maximum PDU length bounding P-DATA-TF, 0 for unlimited
     * @return the decoded PDU, or {@code null} when the stream ends cleanly before a new PDU starts
     * @throws PduTooLargeException when the declared length exceeds the bound for its type
     * @throws MalformedPduException when the PDU is complete on the wire but its content is invalid
     * @throws java.net.SocketTimeoutException only when no byte of a new PDU arrived in time; a timeout
     *         after the first byte is reported as a plain {@link IOException}
     */
    public static Pdu read(InputStream in, long maxPduLength) throws IOException {
        int first = in.read();
        if (first == -1) {
            return null;
        }
        byte[] header = new byte[HEADER_LENGTH];
        header[0] = (byte) first;
        int type;
        byte[] body;
        try {
            readFully(in, header, 1, HEADER_LENGTH - 1);

            PduReader headerReader = new PduReader(header);
            type = headerReader.u8();
            headerReader.skip(1);
            long length = headerReader.u32();
            long limit = lengthLimit(type, maxPduLength);
            if (length > limit) {
                throw new PduTooLargeException(type, length, limit);
            }
            body = readBody(in, (int) length);
        } catch (SocketTimeoutException e) {
            // the stream cannot be resynchronised once a PDU is partly consumed
            throw new IOException("Read timed out inside a PDU", e);
        }
        return decodeBody(type, new PduReader(body));
    }

    static long lengthLimit(int type, long maxPduLength) {
        if (type != Pdu.P_DATA_TF) {
            return MAX_ASSOCIATION_PDU_LENGTH;
        }
        if (maxPduLength <= 0) {
            return MAX_READ_LENGTH;
        }
        return Math.min(maxPduLength + P_DATA_LENGTH_TOLERANCE, MAX_READ_LENGTH);
    }

    private static byte[] readBody(InputStream in, int length) throws IOException {
        if (length <= READ_CHUNK) {
            byte[] body = new byte[length];
            readFully(in, body, 0, length);
            return body;
        }
        ByteArrayOutputStream body = new ByteArrayOutputStream(READ_CHUNK);
        byte[] chunk = new byte[READ_CHUNK];
        int remaining = length;
        while (remaining > 0) {
            int n = Math.min(remaining, chunk.length);
            readFully(in, chunk, 0, n);
            body.write(chunk, 0, n);
            remaining -= n;
        }
        return body.toByteArray();
    }

    private static Pdu decodeBody(int type, PduReader body) {
        Pdu pdu = switch (type) {
            case Pdu.ASSOCIATE_RQ -> decodeAssociateRq(body);
            case Pdu.ASSOCIATE_AC -> decodeAssociateAc(body);
            case Pdu.ASSOCIATE_RJ -> decodeAssociateRj(body);
            case Pdu.P_DATA_TF -> decodePDataTf(body);
            case Pdu.RELEASE_RQ -> {
                body.skip(4);
                yield new ReleaseRq();
            }
            case Pdu.RELEASE_RP -> {
                body.skip(4);
                yield new ReleaseRp();
            }
            case Pdu.ABORT -> decodeAbort(body);
            default -> throw new MalformedPduException(String.format("Unknown PDU type 0x%02X", type));
        };
        body.requireConsumed(pdu.getClass().getSimpleName());
        return pdu;
    }

    private static byte[] encodeAssociateRq(AssociateRq pdu) {
        if (pdu.presentationContexts().isEmpty()) {
            throw new IllegalArgumentException("A-ASSOCIATE-RQ requires at least one presentation context");
        }
        PduWriter writer = associateHeader(pdu.protocolVersion(), pdu.calledAeTitle(), pdu.callingAeTitle(), pdu.applicationContext());
        for (PresentationContextRqItem item : pdu.presentationContexts()) {
            PduWriter context = new PduWriter().u8(item.contextId()).zeros(3);
            context.item(ABSTRACT_SYNTAX_ITEM, asciiBytes(item.abstractSyntax()));
            if (item.transferSyntaxes().isEmpty()) {
                throw new IllegalArgumentException("Presentation context " + item.contextId() + " has no transfer syntax");
            }
            for (String transferSyntax : item.transferSyntaxes()) {
                context.item(TRANSFER_SYNTAX_ITEM, asciiBytes(transferSyntax));
            }
            writer.item(PRESENTATION_CONTEXT_RQ_ITEM, context.toByteArray());
        }
        writer.item(USER_INFORMATION_ITEM, encodeUserInformation(pdu.userInformation()));
        return writer.toByteArray();
    }

    private static byte[] encodeAssociateAc(AssociateAc pdu) {
        PduWriter writer = associateHeader(pdu.protocolVersion(), pdu.calledAeTitle(), pdu.callingAeTitle(), pdu.applicationContext());
        for (PresentationContextAcItem item : pdu.presentationContexts()) {
            PduWriter context = new PduWriter().u8(item.contextId()).u8(0).u8(item.result()).u8(0);
            context.item(TRANSFER_SYNTAX_ITEM, item.transferSyntax().map(PduCodec::asciiBytes).orElse(new byte[0]));
            writer.item(PRESENTATION_CONTEXT_AC_ITEM, context.toByteArray());
        }
        writer.item(USER_INFORMATION_ITEM, encodeUserInformation(pdu.userInformation()));
        return writer.toByteArray();
    }

    private static PduWriter associateHeader(int protocolVersion, String called, String calling, String applicationContext) {
        return new PduWriter()
            .u16(protocolVersion)
            .zeros(2)
            .bytes(AeTitles.encode(called))
            .bytes(AeTitles.encode(calling))
            .zeros(32)
            .item(APPLICATION_CONTEXT_ITEM, asciiBytes(applicationContext));
    }

    private static byte[] encodeUserInformation(UserInformation info) {
        PduWriter writer = new PduWriter();
        writer.item(MAXIMUM_LENGTH_ITEM, new PduWriter().u32(info.maxPduLength()).toByteArray());
        info.implementationClassUid().ifPresent(uid -> writer.item(IMPLEMENTATION_CLASS_UID_ITEM, asciiBytes(uid)));
        info.asyncOperationsWindow().ifPresent(window -> writer.item(
            ASYNC_OPERATIONS_ITEM,
            new PduWriter().u16(window.maxOperationsInvoked()).u16(window.maxOperationsPerformed()).toByteArray()
        ));
        for (RoleSelection role : info.roleSelections()) {
            writer.item(ROLE_SELECTION_ITEM, new PduWriter()
                .lengthPrefixed(asciiBytes(role.sopClassUid()))
                .u8(role.scuRole() ? 1 : 0)
                .u8(role.scpRole() ? 1 : 0)
                .toByteArray());
        }
        info.implementationVersionName().ifPresent(name -> {
            if (name.isEmpty() || name.length() > 16) {
                throw new IllegalArgumentException("Implementation version name must be 1 to 16 characters");
            }
            writer.item(IMPLEMENTATION_VERSION_NAME_ITEM, asciiBytes(name));
        });
        for (SopClassExtended item : info.sopClassExtended()) {
            writer.item(SOP_CLASS_EXTENDED_ITEM, new PduWriter()
                .lengthPrefixed(asciiBytes(item.sopClassUid()))
                .bytes(item.applicationInformation())
                .toByteArray());
        }
        for (SopClassCommonExtended item : info.sopClassCommonExtended()) {
            PduWriter related = new PduWriter();
            for (String uid : item.relatedGeneralSopClasses()) {
                related.lengthPrefixed(asciiBytes(uid));
            }
            byte[] body = new PduWriter()
                .lengthPrefixed(asciiBytes(item.sopClassUid()))
                .lengthPrefixed(asciiBytes(item.serviceClassUid()))
                .lengthPrefixed(related.toByteArray())
                .toByteArray();
            // sub-item version 0 lives in the reserved header byte
            writer.u8(SOP_CLASS_COMMON_EXTENDED_ITEM).u8(0).u16(body.length).bytes(body);
        }
        info.userIdentity().ifPresent(identity -> writer.item(USER_IDENTITY_RQ_ITEM, new PduWriter()
            .u8(identity.identityType())
            .u8(identity.positiveResponseRequested() ? 1 : 0)
            .lengthPrefixed(identity.primaryField())
            .lengthPrefixed(identity.secondaryField())
            .toByteArray()));
        info.userIdentityResponse().ifPresent(response -> writer.item(
            USER_IDENTITY_AC_ITEM,
            new PduWriter().lengthPrefixed(response.serverResponse()).toByteArray()
        ));
        return writer.toByteArray();
    }

    private static byte[] encodeAssociateRj(AssociateRj pdu) {
        return new PduWriter().u8(0).u8(pdu.result()).u8(pdu.source()).u8(pdu.reason()).toByteArray();
    }

    private static byte[] encodeAbort(Abort pdu) {
        return new PduWriter().u8(0).u8(0).u8(pdu.source()).u8(pdu.reason()).toByteArray();
    }

    private static byte[] encodePDataTf(PDataTf pdu) {
        PduWriter writer = new PduWriter();
        for (PresentationDataValue pdv : pdu.values()) {
            writer.u32(2L + pdv.data().length).u8(pdv.contextId()).u8(pdv.controlHeader()).bytes(pdv.data());
        }
        return writer.toByteArray();
    }

    private static AssociateRq decodeAssociateRq(PduReader body) {
        AssociateFields fields = decodeAssociateFields(body, PRESENTATION_CONTEXT_RQ_ITEM);
        List<PresentationContextRqItem> contexts = new ArrayList<>();
        for (PduReader item : fields.contextItems) {
            contexts.add(decodeContextRq(item));
        }
        if (contexts.isEmpty()) {
            throw new MalformedPduException("A-ASSOCIATE-RQ without presentation context items");
        }
        return new AssociateRq(fields.protocolVersion, fields.called, fields.calling, fields.applicationContext, contexts, fields.userInformation);
    }

    private static AssociateAc decodeAssociateAc(PduReader body) {
        AssociateFields fields = decodeAssociateFields(body, PRESENTATION_CONTEXT_AC_ITEM);
        List<PresentationContextAcItem> contexts = new ArrayList<>();
        for (PduReader item : fields.contextItems) {
            contexts.add(decodeContextAc(item));
        }
        return new AssociateAc(fields.protocolVersion, fields.called, fields.calling, fields.applicationContext, contexts, fields.userInformation);
    }

    private static AssociateFields decodeAssociateFields(PduReader body, int contextItemType) {
        int protocolVersion = body.u16();
        body.skip(2);
        String called = AeTitles.decode(body.bytes(AeTitles.LENGTH));
        String calling = AeTitles.decode(body.bytes(AeTitles.LENGTH));
        body.skip(32);

        String applicationContext = null;
        UserInformation userInformation = null;
        List<PduReader> contextItems = new ArrayList<>();
        while (body.hasRemaining()) {
            int type = body.u8();
            body.skip(1);
            PduReader item = body.slice(body.u16());
            if (type == APPLICATION_CONTEXT_ITEM) {
                if (applicationContext != null) {
                    throw new MalformedPduException("Duplicate application context item");
                }
                applicationContext = uid(item, item.remaining());
            } else if (type == contextItemType) {
                contextItems.add(item);
            } else if (type == USER_INFORMATION_ITEM) {
                if (userInformation != null) {
                    throw new MalformedPduException("Duplicate user information item");
                }
                userInformation = decodeUserInformation(item);
            } else {
                throw new MalformedPduException(String.format("Unexpected item type 0x%02X in association PDU", type));
            }
        }
        if (applicationContext == null) {
            throw new MalformedPduException("Association PDU without application context item");
        }
        if (userInformation == null) {
            throw new MalformedPduException("Association PDU without user information item");
        }
        return new AssociateFields(protocolVersion, called, calling, applicationContext, contextItems, userInformation);
    }

    private static PresentationContextRqItem decodeContextRq(PduReader item) {
        int contextId = item.u8();
        item.skip(3);
        String abstractSyntax = null;
        List<String> transferSyntaxes = new ArrayList<>();
        while (item.hasRemaining()) {
            int type = item.u8();
            item.skip(1);
            int length = item.u16();
            if (type == ABSTRACT_SYNTAX_ITEM) {
                if (abstractSyntax != null) {
                    throw new MalformedPduException("Presentation context " + contextId + " has more than one abstract syntax");
                }
                abstractSyntax = uid(item, length);
            } else if (type == TRANSFER_SYNTAX_ITEM) {
                transferSyntaxes.add(uid(item, length));
            } else {
                throw new MalformedPduException(String.format("Unexpected sub-item type 0x%02X in presentation context", type));
            }
        }
        if (abstractSyntax == null) {
            throw new MalformedPduException("Presentation context " + contextId + " without abstract syntax");
        }
        if (transferSyntaxes.isEmpty()) {
            throw new MalformedPduException("Presentation context " + contextId + " without transfer syntax");
        }
        return new PresentationContextRqItem(contextId, abstractSyntax, transferSyntaxes);
    }

    private static PresentationContextAcItem decodeContextAc(PduReader item) {
        int contextId = item.u8();
        item.skip(1);
        int result = item.u8();
        item.skip(1);
        if (result > 4) {
            throw new MalformedPduException("Presentation context " + contextId + " has invalid result " + result);
        }
        Optional<String> transferSyntax = Optional.empty();
        int seen = 0;
        while (item.hasRemaining()) {
            int type = item.u8();
            item.skip(1);
            int length = item.u16();
            if (type != TRANSFER_SYNTAX_ITEM) {
                throw new MalformedPduException(String.format("Unexpected sub-item type 0x%02X in presentation context result", type));
            }
            String value = uid(item, length);
            transferSyntax = value.isEmpty() ? Optional.empty() : Optional.of(value);
            seen++;
        }
        if (seen > 1) {
            throw new MalformedPduException("Presentation context result " + contextId + " has more than one transfer syntax");
        }
        if (result == 0 && transferSyntax.isEmpty()) {
            throw new MalformedPduException("Accepted presentation context " + contextId + " without transfer syntax");
        }
        return new PresentationContextAcItem(contextId, result, transferSyntax);
    }

    private static UserInformation decodeUserInformation(PduReader body) {
        Long maxLength = null;
        Optional<String> implementationClassUid = Optional.empty();
        Optional<String> implementationVersionName = Optional.empty();
        Optional<AsyncOperationsWindow> asyncOperations = Optional.empty();
        List<RoleSelection> roles = new ArrayList<>();
        List<SopClassExtended> sopClassExtended = new ArrayList<>();
        List<SopClassCommonExtended> sopClassCommonExtended = new ArrayList<>();
        Optional<UserIdentity> identity = Optional.empty();
        Optional<UserIdentityResponse> identityResponse = Optional.empty();

        while (body.hasRemaining()) {
            int type = body.u8();
            body.skip(1);
            PduReader item = body.slice(body.u16());
            switch (type) {
                case MAXIMUM_LENGTH_ITEM -> maxLength = item.u32();
                case IMPLEMENTATION_CLASS_UID_ITEM -> implementationClassUid = Optional.of(uid(item, item.remaining()));
                case ASYNC_OPERATIONS_ITEM -> asyncOperations = Optional.of(new AsyncOperationsWindow(item.u16(), item.u16()));
                case ROLE_SELECTION_ITEM -> roles.add(new RoleSelection(uid(item, item.u16()), flag(item), flag(item)));
                case IMPLEMENTATION_VERSION_NAME_ITEM -> implementationVersionName = Optional.of(item.ascii(item.remaining()).strip());
                case SOP_CLASS_EXTENDED_ITEM -> sopClassExtended.add(new SopClassExtended(uid(item, item.u16()), item.bytes(item.remaining())));
                case SOP_CLASS_COMMON_EXTENDED_ITEM -> sopClassCommonExtended.add(decodeCommonExtended(item));
                case USER_IDENTITY_RQ_ITEM -> identity = Optional.of(decodeUserIdentity(item));
                case USER_IDENTITY_AC_ITEM -> identityResponse = Optional.of(new UserIdentityResponse(item.bytes(item.u16())));
                default -> throw new MalformedPduException(String.format("Unknown user information sub-item 0x%02X", type));
            }
            item.requireConsumed(String.format("User information sub-item 0x%02X", type));
        }
        if (maxLength == null) {
            throw new MalformedPduException("User information without maximum length sub-item");
        }
        return new UserInformation(
            maxLength,
            implementationClassUid,
            implementationVersionName,
            asyncOperations,
            roles,
            sopClassExtended,
            sopClassCommonExtended,
            identity,
            identityResponse
        );
    }

    private static SopClassCommonExtended decodeCommonExtended(PduReader item) {
        String sopClassUid = uid(item, item.u16());
        String serviceClassUid = uid(item, item.u16());
        PduReader related = item.slice(item.u16());
        List<String> relatedUids = new ArrayList<>();
        while (related.hasRemaining()) {
            relatedUids.add(uid(related, related.u16()));
        }
        return new SopClassCommonExtended(sopClassUid, serviceClassUid, relatedUids);
    }

    private static UserIdentity decodeUserIdentity(PduReader item) {
        int identityType = item.u8();
        boolean positiveResponse = item.u8() == 1;
        byte[] primary = item.bytes(item.u16());
        byte[] secondary = item.bytes(item.u16());
        try {
            return new UserIdentity(identityType, positiveResponse, primary, secondary);
        } catch (IllegalArgumentException ex) {
            throw new MalformedPduException("Invalid user identity sub-item: " + ex.getMessage(), ex);
        }
    }

    private static AssociateRj decodeAssociateRj(PduReader body) {
        body.skip(1);
        int result = body.u8();
        int source = body.u8();
        int reason = body.u8();
        if (result != 1 && result != 2) {
            throw new MalformedPduException("A-ASSOCIATE-RJ has invalid result " + result);
        }
        if (source < 1 || source > 3) {
            throw new MalformedPduException("A-ASSOCIATE-RJ has invalid source " + source);
        }
        return new AssociateRj(result, source, reason);
    }

    private static Abort decodeAbort(PduReader body) {
        body.skip(2);
        int source = body.u8();
        int reason = body.u8();
        if (source > 2) {
            throw new MalformedPduException("A-ABORT has invalid source " + source);
        }
        return new Abort(source, reason);
    }

    private static PDataTf decodePDataTf(PduReader body) {
        List<PresentationDataValue> values = new ArrayList<>();
        while (body.hasRemaining()) {
            long length = body.u32();
            if (length < 2 || length > body.remaining()) {
                throw new MalformedPduException("PDV item declared length " + length + " with " + body.remaining() + " bytes available");
            }
            int contextId = body.u8();
            int header = body.u8();
            byte[] data = body.bytes((int) length - 2);
            try {
                values.add(new PresentationDataValue(contextId, header, data));
            } catch (IllegalArgumentException ex) {
                throw new MalformedPduException("Invalid PDV item: " + ex.getMessage(), ex);
            }
        }
        if (values.isEmpty()) {
            throw new MalformedPduException("P-DATA-TF without presentation data values");
        }
        return new PDataTf(values);
    }

    private static boolean flag(PduReader item) {
        return item.u8() == 1;
    }

    private static String uid(PduReader reader, int length) {
        String value = reader.ascii(length);
        int end = value.length();
        while (end > 0 && (value.charAt(end - 1) == '\0' || value.charAt(end - 1) == ' ')) {
            end--;
        }
        return value.substring(0, end);
    }

    private static byte[] asciiBytes(String value) {
        return new PduWriter().ascii(value).toByteArray();
    }

    private static void readFully(InputStream in, byte[] target, int offset, int length) throws IOException {
        int read = 0;
        while (read < length) {
            int r = in.read(target, offset + read, length - read);
            if (r == -1) {
                throw new EOFException("Stream closed while reading PDU, " + (length - read) + " bytes missing");
            }
            read += r;
        }
    }

    private record AssociateFields(
        int protocolVersion,
        String called,
        String calling,
        String applicationContext,
        List<PduReader> contextItems,
        UserInformation userInformation
    ) {
    }
}
