package com.dpstore.network.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One request to a dps-server backend.
 *
 * Plain-key commands use key, value and ttl; container commands (the H*
 * family) address a field inside the container stored at key.
 */
public final class Command {

    public static final byte GET = 0x01;
    public static final byte SET = 0x02;
    public static final byte DELETE = 0x03;
    public static final byte PING = 0x04;
    public static final byte SETNX = 0x05;
    public static final byte INCR = 0x06;
    public static final byte AUTH = 0x07;

    public static final byte HSET = 0x11;
    public static final byte HGET = 0x12;
    public static final byte HEXISTS = 0x13;
    public static final byte HDEL = 0x14;
    public static final byte HLEN = 0x15;
    public static final byte HKEYS = 0x16;

    private final byte type;
    private final String key;
    private final String field;
    private final byte[] value;
    private final int ttlSeconds;

    /**
     * @param key        null only for PING and AUTH
     * @param field      container field, null for plain-key commands
     * @param ttlSeconds lifetime for SET and SETNX, 0 for none
     */
    public Command(byte type, String key, String field, byte[] value, int ttlSeconds) {
        this.type = type;
        this.key = key;
        this.field = field;
        this.value = value == null ? null : value.clone();
        this.ttlSeconds = ttlSeconds;
    }

    public Command(byte type, String key, byte[] value) {
        this(type, key, null, value, 0);
    }

    public static Command ping() {
        return new Command(PING, null, null);
    }

    /**
     * AUTH carries the token as its value.
     */
    public static Command auth(String token) {
        return new Command(AUTH, null, token == null ? null : token.getBytes(StandardCharsets.UTF_8));
    }

    public static Command get(String key) {
        return new Command(GET, key, null);
    }

    public static Command set(String key, byte[] value, int ttlSeconds) {
        return new Command(SET, key, null, value, ttlSeconds);
    }

    public static Command setIfAbsent(String key, byte[] value, int ttlSeconds) {
        return new Command(SETNX, key, null, value, ttlSeconds);
    }

    public static Command delete(String key) {
        return new Command(DELETE, key, null);
    }

    public static Command increment(String key) {
        return new Command(INCR, key, null);
    }

    public static Command setField(String container, String field, byte[] value) {
        return new Command(HSET, container, field, value, 0);
    }

    public static Command getField(String container, String field) {
        return new Command(HGET, container, field, null, 0);
    }

    public static Command fieldExists(String container, String field) {
        return new Command(HEXISTS, container, field, null, 0);
    }

    public static Command deleteField(String container, String field) {
        return new Command(HDEL, container, field, null, 0);
    }

    public static Command fieldCount(String container) {
        return new Command(HLEN, container, null);
    }

    public static Command fieldNames(String container) {
        return new Command(HKEYS, container, null);
    }

    public byte getType() {
        return type;
    }

    public String getKey() {
        return key;
    }

    public String getField() {
        return field;
    }

    /**
     * @return a copy of the value, or null
     */
    public byte[] getValue() {
        return value == null ? null : value.clone();
    }

    /**
     * The value array itself; callers must not modify it.
     */
    public byte[] getValueUnsafe() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    public int getTtlSeconds() {
        return ttlSeconds;
    }

    public String getTypeName() {
        switch (type) {
            case GET: return "GET";
            case SET: return "SET";
            case DELETE: return "DELETE";
            case PING: return "PING";
            case SETNX: return "SETNX";
            case INCR: return "INCR";
            case AUTH: return "AUTH";
            case HSET: return "HSET";
            case HGET: return "HGET";
            case HEXISTS: return "HEXISTS";
            case HDEL: return "HDEL";
            case HLEN: return "HLEN";
            case HKEYS: return "HKEYS";
            default: return "UNKNOWN(" + type + ")";
        }
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof Command)) {
            return false;
        }
        Command that = (Command) other;
        return type == that.type
            && ttlSeconds == that.ttlSeconds
            && Objects.equals(key, that.key)
            && Objects.equals(field, that.field)
            && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(type, key, field, ttlSeconds) + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder(getTypeName());
        if (key != null) {
            text.append(' ').append(key);
        }
        if (field != null) {
            text.append(" [").append(field).append(']');
        }
        if (value != null) {
            text.append(" (").append(value.length).append(" bytes)");
        }
        if (ttlSeconds > 0) {
            text.append(" ttl=").append(ttlSeconds);
        }
        return text.toString();
    }
}
