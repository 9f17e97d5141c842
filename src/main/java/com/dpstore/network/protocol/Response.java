package com.dpstore.network.protocol;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Server reply: one status byte plus an optional payload.
 *
 * Payload shapes by producer: raw bytes for GET/HGET, an 8-byte big-endian
 * long for INCR/HDEL/HLEN, a counted UTF-8 list for HKEYS, and the UTF-8
 * message for ERROR.
 */
public final class Response {

    public static final byte OK = 0x00;
    public static final byte NOT_FOUND = 0x01;
    public static final byte ERROR = 0x02;
    public static final byte PONG = 0x03;
    public static final byte TRUE = 0x04;
    public static final byte FALSE = 0x05;

    private static final String[] STATUS_NAMES = {"OK", "NOT_FOUND", "ERROR", "PONG", "TRUE", "FALSE"};

    private static final Response EMPTY_OK = new Response(OK, null);
    private static final Response MISSING = new Response(NOT_FOUND, null);
    private static final Response PONG_REPLY = new Response(PONG, null);

    private final byte status;
    private final byte[] payload;

    public Response(byte status, byte[] payload) {
        this.status = status;
        this.payload = payload == null ? null : payload.clone();
    }

    public static Response ok() {
        return EMPTY_OK;
    }

    public static Response ok(byte[] value) {
        return new Response(OK, value);
    }

    public static Response ok(long number) {
        byte[] encoded = new byte[Long.BYTES];
        ByteBuffer.wrap(encoded).putLong(number);
        return new Response(OK, encoded);
    }

    /**
     * Reply carrying field names, laid out as {@code count:int (len:int utf8)*}.
     */
    public static Response ok(List<String> names) {
        byte[][] parts = new byte[names.size()][];
        int total = Integer.BYTES;
        for (int i = 0; i < parts.length; i++) {
            parts[i] = names.get(i).getBytes(StandardCharsets.UTF_8);
            total += Integer.BYTES + parts[i].length;
        }
        ByteBuffer out = ByteBuffer.allocate(total).putInt(parts.length);
        for (byte[] part : parts) {
            out.putInt(part.length).put(part);
        }
        return new Response(OK, out.array());
    }

    public static Response notFound() {
        return MISSING;
    }

    public static Response error(String message) {
        return new Response(ERROR, message == null ? null : message.getBytes(StandardCharsets.UTF_8));
    }

    public static Response pong() {
        return PONG_REPLY;
    }

    public static Response bool(boolean result) {
        return new Response(result ? TRUE : FALSE, null);
    }

    public byte getStatus() {
        return status;
    }

    public String getStatusName() {
        return status >= 0 && status < STATUS_NAMES.length ? STATUS_NAMES[status] : "UNKNOWN(" + status + ")";
    }

    /**
     * @return a copy of the payload, or null
     */
    public byte[] getValue() {
        return payload == null ? null : payload.clone();
    }

    /**
     * The payload array itself; callers must not modify it.
     */
    public byte[] getValueUnsafe() {
        return payload;
    }

    public boolean hasValue() {
        return payload != null;
    }

    /**
     * Decode a payload written by {@link #ok(long)}.
     *
     * @throws ProtocolException if the payload is not exactly 8 bytes
     */
    public long getNumber() {
        int length = payload == null ? 0 : payload.length;
        if (length != Long.BYTES) {
            throw new ProtocolException("Expected numeric reply, got " + length + " bytes");
        }
        return ByteBuffer.wrap(payload).getLong();
    }

    /**
     * Decode a payload written by {@link #ok(List)}. A missing payload is an empty list.
     *
     * @throws ProtocolException on a malformed layout
     */
    public List<String> getNames() {
        if (payload == null || payload.length == 0) {
            return Collections.emptyList();
        }
        ByteBuffer in = ByteBuffer.wrap(payload);
        try {
            int count = in.getInt();
            if (count < 0) {
                throw new ProtocolException("Invalid name count: " + count);
            }
            List<String> names = new ArrayList<>(Math.min(count, 1024));
            while (names.size() < count) {
                int length = in.getInt();
                if (length < 0 || length > in.remaining()) {
                    throw new ProtocolException("Invalid name length: " + length);
                }
                names.add(new String(payload, in.position(), length, StandardCharsets.UTF_8));
                in.position(in.position() + length);
            }
            return names;
        } catch (BufferUnderflowException e) {
            throw new ProtocolException("Truncated name list", e);
        }
    }

    /**
     * @return the server's message for an ERROR reply, otherwise null
     */
    public String getErrorMessage() {
        return status == ERROR && payload != null ? new String(payload, StandardCharsets.UTF_8) : null;
    }

    public boolean isOk() {
        return status == OK || status == PONG || status == TRUE;
    }

    public boolean isError() {
        return status == ERROR;
    }

    public boolean isNotFound() {
        return status == NOT_FOUND;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof Response)) {
            return false;
        }
        Response that = (Response) other;
        return status == that.status && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return 31 * status + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder("Response[").append(getStatusName());
        if (isError()) {
            text.append(": ").append(getErrorMessage());
        } else if (payload != null) {
            text.append(", ").append(payload.length).append(" bytes");
        }
        return text.append(']').toString();
    }
}
