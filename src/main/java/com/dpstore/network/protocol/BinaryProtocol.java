package com.dpstore.network.protocol;

import java.io.DataInput;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Frame codec for the dps-server wire protocol.
 *
 * <pre>
 * request  = magic:4 type:1 ttl:4 keyLen:4 fieldLen:4 valueLen:4 key field value
 * response = magic:4 status:1 valueLen:4 value
 * </pre>
 *
 * Integers are big-endian, keys and fields UTF-8. An empty key or field decodes as null.
 */
public final class BinaryProtocol {

    /** ASCII "DPST". */
    public static final int MAGIC = 0x44505354;

    public static final int REQUEST_HEADER_SIZE = 21;
    public static final int RESPONSE_HEADER_SIZE = 9;

    public static final int MAX_KEY_LENGTH = 64 * 1024;
    public static final int MAX_VALUE_LENGTH = 16 * 1024 * 1024;

    // offsets of the length words inside a header
    private static final int KEY_LEN_OFFSET = 9;
    private static final int FIELD_LEN_OFFSET = 13;
    private static final int VALUE_LEN_OFFSET = 17;
    private static final int RESPONSE_LEN_OFFSET = 5;

    private static final byte[] NONE = new byte[0];

    private BinaryProtocol() {
    }

    /**
     * @return a heap buffer holding exactly the frame, positioned at 0
     */
    public static ByteBuffer encode(Command command) {
        ByteBuffer frame = ByteBuffer.allocate(encodedSize(command));
        encode(command, frame);
        frame.flip();
        return frame;
    }

    /**
     * Append a command frame to {@code out}, which needs {@link #encodedSize(Command)} bytes free.
     *
     * @throws ProtocolException if the key, field or value exceeds the protocol limits
     */
    public static void encode(Command command, ByteBuffer out) {
        byte[] key = utf8(command.getKey());
        byte[] field = utf8(command.getField());
        byte[] value = orNone(command.getValueUnsafe());
        checkLengths(key.length, field.length, value.length);

        out.putInt(MAGIC)
            .put(command.getType())
            .putInt(command.getTtlSeconds())
            .putInt(key.length)
            .putInt(field.length)
            .putInt(value.length)
            .put(key)
            .put(field)
            .put(value);
    }

    public static ByteBuffer encode(Response response) {
        ByteBuffer frame = ByteBuffer.allocate(encodedSize(response));
        encode(response, frame);
        frame.flip();
        return frame;
    }

    public static void encode(Response response, ByteBuffer out) {
        byte[] value = orNone(response.getValueUnsafe());
        out.putInt(MAGIC).put(response.getStatus()).putInt(value.length).put(value);
    }

    /**
     * Decode the command frame at the buffer's position and move past it.
     *
     * @throws ProtocolException on a bad header or a frame not fully present
     */
    public static Command decodeCommand(ByteBuffer in) {
        require(in, REQUEST_HEADER_SIZE, "header");
        checkMagic(in.getInt());
        byte type = in.get();
        int ttl = in.getInt();
        int keyLength = in.getInt();
        int fieldLength = in.getInt();
        int valueLength = in.getInt();
        checkLengths(keyLength, fieldLength, valueLength);
        if (ttl < 0) {
            throw new ProtocolException("Invalid ttl: " + ttl);
        }
        require(in, (long) keyLength + fieldLength + valueLength, "payload");

        String key = text(take(in, keyLength));
        String field = text(take(in, fieldLength));
        byte[] value = valueLength == 0 ? null : take(in, valueLength);
        return new Command(type, key, field, value, ttl);
    }

    /**
     * Decode the response frame at the buffer's position and move past it.
     *
     * @throws ProtocolException on a bad header or a frame not fully present
     */
    public static Response decodeResponse(ByteBuffer in) {
        require(in, RESPONSE_HEADER_SIZE, "header");
        checkMagic(in.getInt());
        byte status = in.get();
        int valueLength = checkValueLength(in.getInt());
        require(in, valueLength, "payload");
        return new Response(status, valueLength == 0 ? null : take(in, valueLength));
    }

    /**
     * Blocking counterpart of {@link #decodeResponse(ByteBuffer)} for socket streams.
     *
     * @throws java.io.EOFException if the stream ends inside a frame
     */
    public static Response readResponse(DataInput in) throws IOException {
        checkMagic(in.readInt());
        byte status = in.readByte();
        int valueLength = checkValueLength(in.readInt());
        byte[] value = null;
        if (valueLength > 0) {
            value = new byte[valueLength];
            in.readFully(value);
        }
        return new Response(status, value);
    }

    /**
     * Whether a whole request frame sits at the buffer's position. Does not move the buffer.
     * A negative length reports true so the decoder gets to reject the frame.
     */
    public static boolean hasCompleteRequest(ByteBuffer in) {
        if (in.remaining() < REQUEST_HEADER_SIZE) {
            return false;
        }
        int base = in.position();
        long body = 0;
        for (int offset : new int[] {KEY_LEN_OFFSET, FIELD_LEN_OFFSET, VALUE_LEN_OFFSET}) {
            int length = in.getInt(base + offset);
            if (length < 0) {
                return true;
            }
            body += length;
        }
        return in.remaining() - REQUEST_HEADER_SIZE >= body;
    }

    public static boolean hasCompleteResponse(ByteBuffer in) {
        if (in.remaining() < RESPONSE_HEADER_SIZE) {
            return false;
        }
        int length = in.getInt(in.position() + RESPONSE_LEN_OFFSET);
        return length < 0 || in.remaining() - RESPONSE_HEADER_SIZE >= length;
    }

    public static int encodedSize(Command command) {
        return REQUEST_HEADER_SIZE
            + utf8(command.getKey()).length
            + utf8(command.getField()).length
            + orNone(command.getValueUnsafe()).length;
    }

    public static int encodedSize(Response response) {
        return RESPONSE_HEADER_SIZE + orNone(response.getValueUnsafe()).length;
    }

    private static void require(ByteBuffer in, long needed, String part) {
        if (in.remaining() < needed) {
            throw new ProtocolException("Incomplete " + part + ": need " + needed
                + " bytes, have " + in.remaining());
        }
    }

    private static byte[] take(ByteBuffer in, int length) {
        byte[] bytes = new byte[length];
        in.get(bytes);
        return bytes;
    }

    private static String text(byte[] bytes) {
        return bytes.length == 0 ? null : new String(bytes, StandardCharsets.UTF_8);
    }

    private static byte[] utf8(String text) {
        return text == null ? NONE : text.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] orNone(byte[] bytes) {
        return bytes == null ? NONE : bytes;
    }

    private static void checkMagic(int magic) {
        if (magic != MAGIC) {
            throw new ProtocolException(String.format("Bad magic 0x%08X, expected 0x%08X", magic, MAGIC));
        }
    }

    private static void checkLengths(int keyLength, int fieldLength, int valueLength) {
        if (keyLength < 0 || keyLength > MAX_KEY_LENGTH) {
            throw new ProtocolException("Invalid key length: " + keyLength);
        }
        if (fieldLength < 0 || fieldLength > MAX_KEY_LENGTH) {
            throw new ProtocolException("Invalid field length: " + fieldLength);
        }
        checkValueLength(valueLength);
    }

    private static int checkValueLength(int valueLength) {
        if (valueLength < 0 || valueLength > MAX_VALUE_LENGTH) {
            throw new ProtocolException("Invalid value length: " + valueLength);
        }
        return valueLength;
    }
}
