package it.netdicom.dimse;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A DIMSE command set. Always encoded as Implicit VR Little Endian with a leading group length.
 */
public final class CommandSet {

    private static final Logger logger = LoggerFactory.getLogger(CommandSet.class);

    public static final int NO_DATA_SET = 0x0101;
    public static final int DATA_SET_PRESENT = 0x0001;

    private final Map<CommandElement, Object> elements = new EnumMap<>(CommandElement.class);

    public CommandSet(CommandField field) {
        put(CommandElement.COMMAND_FIELD, field.code());
        put(CommandElement.COMMAND_DATA_SET_TYPE, NO_DATA_SET);
    }

    private CommandSet() {
    }

    /** Independent copy; element values are immutable or never modified after {@link #put}. */
    public CommandSet copy() {
        CommandSet copy = new CommandSet();
        copy.elements.putAll(elements);
        return copy;
    }

    public CommandSet put(CommandElement element, Object value) {
        if (element == CommandElement.COMMAND_GROUP_LENGTH) {
            throw new IllegalArgumentException("Command group length is computed on encode");
        }
        if (value == null) {
            elements.remove(element);
            return this;
        }
        switch (element.vr()) {
            case US -> {
                int number = requireInteger(element, value);
                if (number < 0 || number > 0xFFFF) {
                    throw new IllegalArgumentException(element + " out of range: " + number);
                }
            }
            case UL -> requireInteger(element, value);
            case UI, AE, LO -> {
                if (!(value instanceof String)) {
                    throw new IllegalArgumentException(element + " requires a string value");
                }
            }
            case AT -> {
                if (!(value instanceof int[])) {
                    throw new IllegalArgumentException(element + " requires an attribute tag list");
                }
            }
        }
        elements.put(element, value);
        return this;
    }

    public boolean contains(CommandElement element) {
        return elements.containsKey(element);
    }

    public Optional<Integer> optionalInt(CommandElement element) {
        return Optional.ofNullable((Integer) elements.get(element));
    }

    public int getInt(CommandElement element) {
        return optionalInt(element).orElseThrow(() -> missing(element));
    }

    public Optional<String> optionalString(CommandElement element) {
        return Optional.ofNullable((String) elements.get(element));
    }

    public String getString(CommandElement element) {
        return optionalString(element).orElseThrow(() -> missing(element));
    }

    public Optional<int[]> optionalTags(CommandElement element) {
        return Optional.ofNullable((int[]) elements.get(element)).map(int[]::clone);
    }

    public CommandField commandField() {
        return CommandField.fromCode(getInt(CommandElement.COMMAND_FIELD));
    }

    public int messageId() {
        return getInt(CommandElement.MESSAGE_ID);
    }

    public int messageIdBeingRespondedTo() {
        return getInt(CommandElement.MESSAGE_ID_BEING_RESPONDED_TO);
    }

    public int status() {
        return getInt(CommandElement.STATUS);
    }

    public boolean hasDataSet() {
        return optionalInt(CommandElement.COMMAND_DATA_SET_TYPE).orElse(NO_DATA_SET) != NO_DATA_SET;
    }

    /** SOP class of the request or response: affected if present, else requested. */
    public Optional<String> sopClassUid() {
        return optionalString(CommandElement.AFFECTED_SOP_CLASS_UID)
            .or(() -> optionalString(CommandElement.REQUESTED_SOP_CLASS_UID));
    }

    public Optional<String> sopInstanceUid() {
        return optionalString(CommandElement.AFFECTED_SOP_INSTANCE_UID)
            .or(() -> optionalString(CommandElement.REQUESTED_SOP_INSTANCE_UID));
    }

    public byte[] encode() {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        for (Map.Entry<CommandElement, Object> entry : elements.entrySet()) {
            writeElement(body, entry.getKey().element(), valueBytes(entry.getKey(), entry.getValue()));
        }
        byte[] bodyBytes = body.toByteArray();
        ByteArrayOutputStream out = new ByteArrayOutputStream(bodyBytes.length + 12);
        writeElement(out, CommandElement.COMMAND_GROUP_LENGTH.element(), le32(bodyBytes.length));
        out.writeBytes(bodyBytes);
        return out.toByteArray();
    }

    public static CommandSet decode(byte[] encoded) {
        CommandSet command = new CommandSet();
        ByteBuffer buffer = ByteBuffer.wrap(encoded).order(ByteOrder.LITTLE_ENDIAN);
        while (buffer.hasRemaining()) {
            if (buffer.remaining() < 8) {
                throw new MalformedCommandException("Truncated command element header");
            }
            int group = Short.toUnsignedInt(buffer.getShort());
            int elementNumber = Short.toUnsignedInt(buffer.getShort());
            long length = Integer.toUnsignedLong(buffer.getInt());
            if (group != 0x0000) {
                throw new MalformedCommandException(String.format("Element (%04X,%04X) is not in the command group", group, elementNumber));
            }
            if (length > buffer.remaining()) {
                throw new MalformedCommandException(String.format("Element (0000,%04X) length %d exceeds the command set", elementNumber, length));
            }
            byte[] value = new byte[(int) length];
            buffer.get(value);
            Optional<CommandElement> element = CommandElement.byElement(elementNumber);
            if (element.isEmpty()) {
                logger.debug("Ignoring unknown command element (0000,{})", String.format("%04X", elementNumber));
                continue;
            }
            if (element.get() != CommandElement.COMMAND_GROUP_LENGTH) {
                command.elements.put(element.get(), parseValue(element.get(), value));
            }
        }
        if (!command.contains(CommandElement.COMMAND_FIELD)) {
            throw new MalformedCommandException("Command set has no command field");
        }
        return command;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof CommandSet command && Arrays.equals(encode(), command.encode());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(encode());
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder("CommandSet[");
        elements.forEach((element, value) -> {
            text.append(element.name()).append('=');
            text.append(value instanceof int[] tags ? Arrays.toString(tags) : value).append(' ');
        });
        return text.toString().stripTrailing() + "]";
    }

    private static byte[] valueBytes(CommandElement element, Object value) {
        return switch (element.vr()) {
            case US -> new byte[] {(byte) (int) (Integer) value, (byte) ((Integer) value >> 8)};
            case UL -> le32((Integer) value);
            case UI -> padded((String) value, (byte) 0x00);
            case AE, LO -> padded((String) value, (byte) ' ');
            case AT -> {
                int[] tags = (int[]) value;
                ByteBuffer buffer = ByteBuffer.allocate(tags.length * 4).order(ByteOrder.LITTLE_ENDIAN);
                for (int tag : tags) {
                    buffer.putShort((short) (tag >>> 16));
                    buffer.putShort((short) tag);
                }
                yield buffer.array();
            }
        };
    }

    private static Object parseValue(CommandElement element, byte[] value) {
        ByteBuffer buffer = ByteBuffer.wrap(value).order(ByteOrder.LITTLE_ENDIAN);
        return switch (element.vr()) {
            case US -> {
                requireLength(element, value, 2);
                yield Short.toUnsignedInt(buffer.getShort());
            }
            case UL -> {
                requireLength(element, value, 4);
                yield buffer.getInt();
            }
            case UI -> trimmed(value);
            case AE, LO -> new String(value, StandardCharsets.US_ASCII).strip();
            case AT -> {
                if (value.length % 4 != 0) {
                    throw new MalformedCommandException(element + " length " + value.length + " is not a multiple of 4");
                }
                int[] tags = new int[value.length / 4];
                for (int i = 0; i < tags.length; i++) {
                    int group = Short.toUnsignedInt(buffer.getShort());
                    int number = Short.toUnsignedInt(buffer.getShort());
                    tags[i] = group << 16 | number;
                }
                yield tags;
            }
        };
    }

    private static void writeElement(ByteArrayOutputStream out, int element, byte[] value) {
        out.write(0x00);
        out.write(0x00);
        out.write(element & 0xFF);
        out.write((element >> 8) & 0xFF);
        out.writeBytes(le32(value.length));
        out.writeBytes(value);
    }

    private static byte[] le32(int value) {
        return new byte[] {(byte) value, (byte) (value >> 8), (byte) (value >> 16), (byte) (value >> 24)};
    }

    private static byte[] padded(String value, byte pad) {
        byte[] raw = value.getBytes(StandardCharsets.US_ASCII);
        if (raw.length % 2 == 0) {
            return raw;
        }
        byte[] even = Arrays.copyOf(raw, raw.length + 1);
        even[raw.length] = pad;
        return even;
    }

    private static String trimmed(byte[] value) {
        int end = value.length;
        while (end > 0 && (value[end - 1] == 0 || value[end - 1] == ' ')) {
            end--;
        }
        return new String(value, 0, end, StandardCharsets.US_ASCII);
    }

    private static void requireLength(CommandElement element, byte[] value, int expected) {
        if (value.length != expected) {
            throw new MalformedCommandException(element + " has length " + value.length + ", expected " + expected);
        }
    }

    private static int requireInteger(CommandElement element, Object value) {
        if (!(value instanceof Integer number)) {
            throw new IllegalArgumentException(element + " requires an integer value");
        }
        return number;
    }

    private static MalformedCommandException missing(CommandElement element) {
        return new MalformedCommandException("Command set has no " + element + " " + element.tag());
    }
}
