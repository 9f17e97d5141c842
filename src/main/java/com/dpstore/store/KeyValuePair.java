package com.dpstore.store;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * An item as handed back by {@link StoreIterator}: the caller's original key bytes and the value.
 */
public final class KeyValuePair {

    private final byte[] key;
    private final byte[] value;

    /**
     * @param value null is stored as an empty value
     */
    public KeyValuePair(byte[] key, byte[] value) {
        this.key = key.clone();
        this.value = value == null ? new byte[0] : value.clone();
    }

    public byte[] getKey() {
        return key.clone();
    }

    public byte[] getValue() {
        return value.clone();
    }

    public String getKeyAsString() {
        return new String(key, StandardCharsets.UTF_8);
    }

    public String getValueAsString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof KeyValuePair)) {
            return false;
        }
        KeyValuePair that = (KeyValuePair) other;
        return Arrays.equals(key, that.key) && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(key) + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return getKeyAsString() + "=" + value.length + " bytes";
    }
}
