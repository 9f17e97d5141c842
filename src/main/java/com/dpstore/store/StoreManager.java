package com.dpstore.store;

import com.dpstore.backend.BackendAdapter;
import com.dpstore.error.DpsException;
import com.dpstore.error.ErrorCode;
import com.dpstore.keys.KeySchema;
import com.dpstore.lock.LockManager;
import com.dpstore.lock.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * Store lifecycle: create, find, remove, clear and size.
 *
 * A store is a name mapping ({@code 0<base64 name> -> id}) plus a container
 * ({@code 1<id>}) whose three reserved fields hold the base64 store name and the
 * key and value type names. Every other field is a user item.
 */
public class StoreManager {

    private static final Logger logger = LoggerFactory.getLogger(StoreManager.class);

    static final int METADATA_WRITE_ATTEMPTS = 5;
    private static final long METADATA_RETRY_PAUSE_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    private final BackendAdapter backend;
    private final LockManager lockManager;
    private final Sleeper sleeper;

    public StoreManager(BackendAdapter backend, LockManager lockManager) {
        this(backend, lockManager, Sleeper.parking());
    }

    public StoreManager(BackendAdapter backend, LockManager lockManager, Sleeper sleeper) {
        this.backend = backend;
        this.lockManager = lockManager;
        this.sleeper = sleeper;
    }

    /**
     * Create a store.
     *
     * @return the new store id
     * @throws DpsException DPS_STORE_EXISTS if a store with this name exists
     */
    public long createStore(String name, String keyTypeName, String valueTypeName) throws DpsException {
        validateName(name);
        String keyType = keyTypeName != null ? keyTypeName : "";
        String valueType = valueTypeName != null ? valueTypeName : "";

        lockManager.acquireGeneralPurposeLock(name);
        try {
            if (findStoreId(name).isPresent()) {
                throw new DpsException(ErrorCode.DPS_STORE_EXISTS, "A store named " + name + " already exists");
            }

            long storeId;
            try {
                storeId = backend.increment(KeySchema.GUID_KEY);
            } catch (IOException | RuntimeException e) {
                throw new DpsException(ErrorCode.DPS_GUID_CREATION_ERROR,
                        "Unable to allocate an id for store " + name + ": " + e.getMessage(), e);
            }

            String nameKey = KeySchema.storeNameKey(name);
            String contentsKey = KeySchema.storeContentsKey(storeId);
            CompensationLog undo = new CompensationLog("createStore(" + name + ")");

            write(undo, ErrorCode.DPS_STORE_NAME_CREATION_ERROR, "name mapping",
                    () -> backend.write(nameKey, Long.toString(storeId).getBytes(StandardCharsets.UTF_8), 0),
                    () -> backend.delete(nameKey));
            write(undo, ErrorCode.DPS_STORE_HASH_METADATA1_CREATION_ERROR, "store name field",
                    () -> setMetadata(contentsKey, KeySchema.FIELD_STORE_NAME, name),
                    () -> backend.delete(contentsKey));
            write(undo, ErrorCode.DPS_STORE_HASH_METADATA2_CREATION_ERROR, "key type field",
                    () -> setMetadata(contentsKey, KeySchema.FIELD_KEY_TYPE, keyType),
                    null);
            write(undo, ErrorCode.DPS_STORE_HASH_METADATA3_CREATION_ERROR, "value type field",
                    () -> setMetadata(contentsKey, KeySchema.FIELD_VALUE_TYPE, valueType),
                    null);
            undo.commit();

            logger.debug("Created store {} with id {}", name, storeId);
            return storeId;
        } finally {
            lockManager.releaseGeneralPurposeLock(name);
        }
    }

    private static void write(CompensationLog undo, ErrorCode failureCode, String description,
                              CompensationLog.Undo action, CompensationLog.Undo compensation) throws DpsException {
        try {
            action.run();
        } catch (IOException | RuntimeException e) {
            int residue = undo.compensate();
            throw new DpsException(residue == 0 ? failureCode : ErrorCode.DPS_STORE_FATAL_ERROR,
                    "Unable to write the " + description + ": " + e.getMessage()
                    + (residue == 0 ? "" : " (" + residue + " compensating deletes failed)"), e);
        }
        if (compensation != null) {
            undo.record(description, compensation);
        }
    }

    /**
     * Create a store, or find it if the name is taken.
     *
     * @return the id of the new or existing store
     */
    public long createOrGetStore(String name, String keyTypeName, String valueTypeName) throws DpsException {
        try {
            return createStore(name, keyTypeName, valueTypeName);
        } catch (DpsException e) {
            if (e.getCode() != ErrorCode.DPS_STORE_EXISTS) {
                throw e;
            }
            return findStore(name);
        }
    }

    /**
     * Look up a store id by name.
     *
     * @throws DpsException DPS_STORE_DOES_NOT_EXIST if there is no such store
     */
    public long findStore(String name) throws DpsException {
        OptionalLong storeId = findStoreId(name);
        if (!storeId.isPresent()) {
            throw new DpsException(ErrorCode.DPS_STORE_DOES_NOT_EXIST, "No store named " + name);
        }
        return storeId.getAsLong();
    }

    OptionalLong findStoreId(String name) throws DpsException {
        validateName(name);
        try {
            Optional<byte[]> value = backend.read(KeySchema.storeNameKey(name));
            if (!value.isPresent()) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(Long.parseLong(new String(value.get(), StandardCharsets.UTF_8)));
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DPS_CONNECTION_ERROR,
                    "Unable to look up store " + name + ": " + e.getMessage(), e);
        } catch (NumberFormatException e) {
            throw new DpsException(ErrorCode.DPS_GET_STORE_ID_ERROR, "Corrupt id for store " + name, e);
        }
    }

    /**
     * Check whether a store id refers to a live store.
     */
    public boolean storeExists(long storeId) throws DpsException {
        try {
            return backend.fieldExists(KeySchema.storeContentsKey(storeId), KeySchema.FIELD_STORE_NAME);
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DPS_STORE_EXISTENCE_CHECK_ERROR,
                    "Unable to check existence of store " + storeId + ": " + e.getMessage(), e);
        }
    }

    void requireStore(long storeId) throws DpsException {
        if (!storeExists(storeId)) {
            throw new DpsException(ErrorCode.DPS_INVALID_STORE_ID_ERROR, "No store exists with id " + storeId);
        }
    }

    /**
     * Delete a store and its name mapping. Not atomic: a failure between the
     * two deletes leaves the name mapping behind.
     */
    public void removeStore(long storeId) throws DpsException {
        lockManager.acquireStoreLock(storeId);
        try {
            requireStore(storeId);
            String name = getStoreName(storeId);
            logger.debug("Removing store {} (id {}, {} items)", name, storeId, sizeUnchecked(storeId));
            try {
                backend.delete(KeySchema.storeContentsKey(storeId));
                backend.delete(KeySchema.storeNameKey(name));
            } catch (IOException | IllegalStateException e) {
                throw new DpsException(ErrorCode.DPS_CONNECTION_ERROR,
                        "Unable to delete store " + storeId + ": " + e.getMessage(), e);
            }
        } finally {
            lockManager.releaseStoreLock(storeId);
        }
    }

    /**
     * Remove every item from a store, keeping its identity.
     * The container is dropped and rebuilt with its reserved fields; each field
     * write is verified and retried because a replicated backend may not yet see
     * a write issued right after a delete of the same key.
     *
     * @throws DpsException DPS_STORE_FATAL_ERROR if the reserved fields cannot be restored
     */
    public void clear(long storeId) throws DpsException {
        lockManager.acquireStoreLock(storeId);
        try {
            requireStore(storeId);
            String contentsKey = KeySchema.storeContentsKey(storeId);
            String[] fields = { KeySchema.FIELD_STORE_NAME, KeySchema.FIELD_KEY_TYPE, KeySchema.FIELD_VALUE_TYPE };
            byte[][] values = new byte[fields.length][];
            try {
                for (int i = 0; i < fields.length; i++) {
                    values[i] = backend.getField(contentsKey, fields[i]).orElse(new byte[0]);
                }
                backend.delete(contentsKey);
            } catch (IOException | IllegalStateException e) {
                throw new DpsException(ErrorCode.DPS_STORE_CLEARING_ERROR,
                        "Unable to clear store " + storeId + ": " + e.getMessage(), e);
            }

            for (int i = 0; i < fields.length; i++) {
                restoreMetadata(storeId, contentsKey, fields[i], values[i]);
            }
            logger.debug("Cleared store {}", storeId);
        } finally {
            lockManager.releaseStoreLock(storeId);
        }
    }

    private void restoreMetadata(long storeId, String contentsKey, String field, byte[] value) throws DpsException {
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= METADATA_WRITE_ATTEMPTS; attempt++) {
            try {
                backend.setField(contentsKey, field, value);
                if (backend.fieldExists(contentsKey, field)) {
                    return;
                }
            } catch (IOException | RuntimeException e) {
                lastFailure = e;
            }
            logger.debug("Reserved field {} of store {} not visible after attempt {}", field, storeId, attempt);
            try {
                sleeper.sleep(METADATA_RETRY_PAUSE_NANOS * attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastFailure = e;
                break;
            }
        }
        logger.error("Store {} is inconsistent: reserved field {} could not be restored after clear", storeId, field);
        throw new DpsException(ErrorCode.DPS_STORE_FATAL_ERROR,
                "Store " + storeId + " lost its reserved field " + field + " while clearing", lastFailure);
    }

    /**
     * Number of user items in a store.
     */
    public long size(long storeId) throws DpsException {
        requireStore(storeId);
        return sizeUnchecked(storeId);
    }

    private long sizeUnchecked(long storeId) throws DpsException {
        try {
            long count = backend.fieldCount(KeySchema.storeContentsKey(storeId)) - KeySchema.RESERVED_FIELD_COUNT;
            return Math.max(0, count);
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DPS_CONNECTION_ERROR,
                    "Unable to count items of store " + storeId + ": " + e.getMessage(), e);
        }
    }

    public String getStoreName(long storeId) throws DpsException {
        return readMetadata(storeId, KeySchema.FIELD_STORE_NAME, ErrorCode.DPS_GET_STORE_NAME_ERROR);
    }

    public String getKeyTypeName(long storeId) throws DpsException {
        return readMetadata(storeId, KeySchema.FIELD_KEY_TYPE, ErrorCode.DPS_GET_KEY_SPL_TYPE_NAME_ERROR);
    }

    public String getValueTypeName(long storeId) throws DpsException {
        return readMetadata(storeId, KeySchema.FIELD_VALUE_TYPE, ErrorCode.DPS_GET_VALUE_SPL_TYPE_NAME_ERROR);
    }

    /**
     * Snapshot the user item keys of a store, decoded, in backend order.
     */
    public List<byte[]> getItemKeys(long storeId) throws DpsException {
        List<String> fields;
        try {
            fields = backend.fieldNames(KeySchema.storeContentsKey(storeId));
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DPS_GET_STORE_DATA_ITEM_KEYS_ERROR,
                    "Unable to list items of store " + storeId + ": " + e.getMessage(), e);
        }
        List<byte[]> keys = new ArrayList<>(Math.max(0, fields.size() - KeySchema.RESERVED_FIELD_COUNT));
        for (String field : fields) {
            if (KeySchema.isReservedField(field)) {
                continue;
            }
            try {
                keys.add(KeySchema.itemKey(field));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping undecodable field {} in store {}", field, storeId);
            }
        }
        return keys;
    }

    private String readMetadata(long storeId, String field, ErrorCode missingCode) throws DpsException {
        Optional<byte[]> value;
        try {
            value = backend.getField(KeySchema.storeContentsKey(storeId), field);
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DPS_CONNECTION_ERROR,
                    "Unable to read " + field + " of store " + storeId + ": " + e.getMessage(), e);
        }
        if (!value.isPresent()) {
            throw new DpsException(missingCode, "Store " + storeId + " has no " + field);
        }
        try {
            return KeySchema.decode(new String(value.get(), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            throw new DpsException(missingCode, "Corrupt " + field + " in store " + storeId, e);
        }
    }

    private void setMetadata(String contentsKey, String field, String text) throws IOException {
        backend.setField(contentsKey, field, KeySchema.encode(text).getBytes(StandardCharsets.UTF_8));
    }

    private static void validateName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Store name cannot be null or empty");
        }
    }
}
