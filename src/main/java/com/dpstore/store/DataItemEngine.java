package com.dpstore.store;

import com.dpstore.backend.BackendAdapter;
import com.dpstore.error.DpsException;
import com.dpstore.error.ErrorCode;
import com.dpstore.keys.KeySchema;
import com.dpstore.lock.LockManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;

/**
 * Item reads and writes inside store containers, plus the store-independent
 * TTL namespace.
 *
 * The fast variants ({@link #put}, {@link #get}) skip the existence check and
 * the store lock. Calling {@link #put} against a store id that does not exist
 * creates a container with no reserved fields, which no store lookup will find.
 */
public class DataItemEngine {

    private static final Logger logger = LoggerFactory.getLogger(DataItemEngine.class);

    // Framed lengths below this marker fit in one byte, otherwise a marker plus 4 bytes
    private static final int SHORT_LENGTH_LIMIT = 0x80;
    private static final int LONG_LENGTH_PREFIX = 5;

    private final BackendAdapter backend;
    private final StoreManager storeManager;
    private final LockManager lockManager;

    public DataItemEngine(BackendAdapter backend, StoreManager storeManager, LockManager lockManager) {
        this.backend = backend;
        this.storeManager = storeManager;
        this.lockManager = lockManager;
    }

    // ==================== Store items ====================

    /**
     * Write an item without checking the store.
     *
     * @throws IllegalArgumentException if the key is null or empty, since an empty key has no field name
     */
    public void put(long storeId, byte[] key, byte[] value) throws DpsException {
        validateKey(key);
        try {
            backend.setField(KeySchema.storeContentsKey(storeId), KeySchema.itemField(key), nonNull(value));
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DPS_DATA_ITEM_WRITE_ERROR,
                    "Unable to write an item to store " + storeId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Write an item after confirming the store exists, holding the store lock.
     *
     * @throws DpsException DPS_INVALID_STORE_ID_ERROR if the store does not exist
     */
    public void putSafe(long storeId, byte[] key, byte[] value) throws DpsException {
        validateKey(key);
        lockManager.acquireStoreLock(storeId);
        try {
            storeManager.requireStore(storeId);
            put(storeId, key, value);
        } finally {
            lockManager.releaseStoreLock(storeId);
        }
    }

    public Optional<byte[]> get(long storeId, byte[] key) throws DpsException {
        validateKey(key);
        return fetch(storeId, key, true);
    }

    /**
     * Read an item after confirming the store exists.
     *
     * @throws DpsException DPS_INVALID_STORE_ID_ERROR if the store does not exist
     */
    public Optional<byte[]> getSafe(long storeId, byte[] key) throws DpsException {
        validateKey(key);
        lockManager.acquireStoreLock(storeId);
        try {
            storeManager.requireStore(storeId);
            return fetch(storeId, key, true);
        } finally {
            lockManager.releaseStoreLock(storeId);
        }
    }

    /**
     * Remove an item.
     *
     * @return true if the backend reported a field was removed
     */
    public boolean remove(long storeId, byte[] key) throws DpsException {
        validateKey(key);
        lockManager.acquireStoreLock(storeId);
        try {
            storeManager.requireStore(storeId);
            return backend.deleteField(KeySchema.storeContentsKey(storeId), KeySchema.itemField(key)) > 0;
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DPS_DATA_ITEM_DELETE_ERROR,
                    "Unable to remove an item from store " + storeId + ": " + e.getMessage(), e);
        } finally {
            lockManager.releaseStoreLock(storeId);
        }
    }

    public boolean has(long storeId, byte[] key) throws DpsException {
        validateKey(key);
        return fetch(storeId, key, false).isPresent();
    }

    /**
     * Shared read path. When the value is not needed only existence is checked
     * and a present item comes back as an empty array.
     */
    private Optional<byte[]> fetch(long storeId, byte[] key, boolean valueNeeded) throws DpsException {
        String contentsKey = KeySchema.storeContentsKey(storeId);
        String field = KeySchema.itemField(key);
        try {
            if (!valueNeeded) {
                return backend.fieldExists(contentsKey, field) ? Optional.of(new byte[0]) : Optional.empty();
            }
            return backend.getField(contentsKey, field);
        } catch (IOException | IllegalStateException e) {
            ErrorCode code = valueNeeded ? ErrorCode.DPS_DATA_ITEM_READ_ERROR : ErrorCode.DPS_KEY_EXISTENCE_CHECK_ERROR;
            throw new DpsException(code, "Unable to read an item of store " + storeId + ": " + e.getMessage(), e);
        }
    }

    // ==================== TTL namespace ====================

    /**
     * Write into the TTL namespace.
     *
     * @param ttlSeconds  expiry in seconds, 0 for none
     * @param encodeKey   false if the key carries a length-prefix frame to strip
     * @param encodeValue false if the value carries a length-prefix frame to strip
     * @throws IllegalArgumentException if the key is empty, or unframes to nothing
     */
    public void putTTL(byte[] key, byte[] value, int ttlSeconds, boolean encodeKey, boolean encodeValue)
            throws DpsException {
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("TTL cannot be negative: " + ttlSeconds);
        }
        String backendKey = ttlKey(key, encodeKey);
        byte[] stored = encodeValue ? nonNull(value) : unframe(nonNull(value));
        try {
            backend.write(backendKey, stored, ttlSeconds);
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DPS_DATA_ITEM_WRITE_ERROR,
                    "Unable to write a TTL item: " + e.getMessage(), e);
        }
        logger.trace("Wrote TTL item {} ({}s)", backendKey, ttlSeconds);
    }

    public Optional<byte[]> getTTL(byte[] key, boolean encodeKey) throws DpsException {
        String backendKey = ttlKey(key, encodeKey);
        try {
            return backend.read(backendKey);
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DPS_DATA_ITEM_READ_ERROR,
                    "Unable to read a TTL item: " + e.getMessage(), e);
        }
    }

    public boolean removeTTL(byte[] key, boolean encodeKey) throws DpsException {
        String backendKey = ttlKey(key, encodeKey);
        try {
            return backend.delete(backendKey);
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DPS_DATA_ITEM_DELETE_ERROR,
                    "Unable to remove a TTL item: " + e.getMessage(), e);
        }
    }

    public boolean hasTTL(byte[] key, boolean encodeKey) throws DpsException {
        String backendKey = ttlKey(key, encodeKey);
        try {
            return backend.read(backendKey).isPresent();
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DPS_KEY_EXISTENCE_CHECK_ERROR,
                    "Unable to check a TTL item: " + e.getMessage(), e);
        }
    }

    private static String ttlKey(byte[] key, boolean encodeKey) {
        validateKey(key);
        if (encodeKey) {
            return KeySchema.ttlItemKey(Base64.getEncoder().encodeToString(key));
        }
        byte[] raw = unframe(key);
        if (raw.length == 0) {
            throw new IllegalArgumentException("Framed key has no content");
        }
        return KeySchema.ttlItemKey(new String(raw, StandardCharsets.ISO_8859_1));
    }

    /**
     * Strip the length prefix of a framed buffer: one byte when the first byte
     * is below 0x80, five bytes otherwise.
     */
    static byte[] unframe(byte[] framed) {
        if (framed.length == 0) {
            return framed;
        }
        int skip = (framed[0] & 0xFF) < SHORT_LENGTH_LIMIT ? 1 : LONG_LENGTH_PREFIX;
        if (framed.length < skip) {
            throw new IllegalArgumentException("Framed buffer shorter than its length prefix");
        }
        return Arrays.copyOfRange(framed, skip, framed.length);
    }

    private static void validateKey(byte[] key) {
        if (key == null || key.length == 0) {
            throw new IllegalArgumentException("Item keys must hold at least one byte");
        }
    }

    private static byte[] nonNull(byte[] value) {
        return value != null ? value : new byte[0];
    }
}
