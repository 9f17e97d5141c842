package com.dpstore.backend.memory;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry of the in-memory engine: a plain byte value or a container of fields.
 * Only plain values carry a deadline; containers live until their last field goes.
 */
final class StoredValue {

    private static final byte[] EMPTY = new byte[0];

    private final byte[] bytes;
    private final ConcurrentHashMap<String, byte[]> fields;
    private final long deadlineMillis;

    private StoredValue(byte[] bytes, ConcurrentHashMap<String, byte[]> fields, long deadlineMillis) {
        this.bytes = bytes;
        this.fields = fields;
        this.deadlineMillis = deadlineMillis;
    }

    /**
     * @param ttlMillis lifetime, 0 or less for none
     */
    static StoredValue plain(byte[] value, long ttlMillis) {
        long deadline = ttlMillis > 0 ? System.currentTimeMillis() + ttlMillis : 0;
        return new StoredValue(value == null ? EMPTY : value.clone(), null, deadline);
    }

    static StoredValue container() {
        return new StoredValue(null, new ConcurrentHashMap<>(), 0);
    }

    boolean isContainer() {
        return fields != null;
    }

    boolean isExpired() {
        return deadlineMillis != 0 && System.currentTimeMillis() > deadlineMillis;
    }

    byte[] getValue() {
        return bytes == null ? null : bytes.clone();
    }

    byte[] getValueUnsafe() {
        return bytes;
    }

    /**
     * Live field map; only mutated inside the engine's per-key compute.
     */
    ConcurrentHashMap<String, byte[]> fields() {
        return fields;
    }

    @Override
    public String toString() {
        String shape = isContainer() ? fields.size() + " fields" : bytes.length + " bytes";
        return deadlineMillis == 0 ? shape : shape + " until " + deadlineMillis;
    }
}
