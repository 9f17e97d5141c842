package com.dpstore.store;

import com.dpstore.error.DpsException;
import com.dpstore.error.ErrorCode;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Optional;

/**
 * Handle to a named store.
 *
 * Keys and values are raw bytes. The String overloads use UTF-8.
 */
public class Store implements Iterable<KeyValuePair> {

    private final long id;
    private final StoreManager storeManager;
    private final DataItemEngine items;

    public Store(long id, StoreManager storeManager, DataItemEngine items) {
        this.id = id;
        this.storeManager = storeManager;
        this.items = items;
    }

    public long getId() {
        return id;
    }

    // ==================== Items ====================

    /**
     * Write an item without checking that the store exists.
     */
    public void put(byte[] key, byte[] value) throws DpsException {
        items.put(id, key, value);
    }

    public void put(String key, String value) throws DpsException {
        put(utf8(key), utf8(value));
    }

    public void putSafe(byte[] key, byte[] value) throws DpsException {
        items.putSafe(id, key, value);
    }

    public void putSafe(String key, String value) throws DpsException {
        putSafe(utf8(key), utf8(value));
    }

    public Optional<byte[]> get(byte[] key) throws DpsException {
        return items.get(id, key);
    }

    public Optional<String> get(String key) throws DpsException {
        return get(utf8(key)).map(Store::text);
    }

    public Optional<byte[]> getSafe(byte[] key) throws DpsException {
        return items.getSafe(id, key);
    }

    public Optional<String> getSafe(String key) throws DpsException {
        return getSafe(utf8(key)).map(Store::text);
    }

    public boolean remove(byte[] key) throws DpsException {
        return items.remove(id, key);
    }

    public boolean remove(String key) throws DpsException {
        return remove(utf8(key));
    }

    public boolean has(byte[] key) throws DpsException {
        return items.has(id, key);
    }

    public boolean has(String key) throws DpsException {
        return has(utf8(key));
    }

    // ==================== Store ====================

    public void clear() throws DpsException {
        storeManager.clear(id);
    }

    public long size() throws DpsException {
        return storeManager.size(id);
    }

    public String getStoreName() throws DpsException {
        return storeManager.getStoreName(id);
    }

    public String getKeyTypeName() throws DpsException {
        return storeManager.getKeyTypeName(id);
    }

    public String getValueTypeName() throws DpsException {
        return storeManager.getValueTypeName(id);
    }

    /**
     * Items are written through on every call, so there is nothing to flush.
     */
    public void persist() {
    }

    // ==================== Iteration ====================

    /**
     * Open a cursor over the current items.
     *
     * @throws DpsException DPS_INVALID_STORE_ID_ERROR if the store does not exist
     */
    public StoreIterator newIterator() throws DpsException {
        storeManager.requireStore(id);
        return new StoreIterator(id, storeManager.getStoreName(id), storeManager, items);
    }

    /**
     * Close a cursor opened on this store.
     *
     * @throws DpsException DPS_INVALID_STORE_ID_ERROR if the cursor belongs to another store
     */
    public void deleteIterator(StoreIterator iterator) throws DpsException {
        if (iterator.getStoreId() != id) {
            throw new DpsException(ErrorCode.DPS_INVALID_STORE_ID_ERROR,
                    "Iterator belongs to store " + iterator.getStoreId() + ", not " + id);
        }
        iterator.close();
    }

    /**
     * @throws IllegalStateException if the store does not exist or cannot be read
     */
    @Override
    public Iterator<KeyValuePair> iterator() {
        try {
            return newIterator();
        } catch (DpsException e) {
            throw new IllegalStateException("Cannot iterate store " + id + ": " + e.getMessage(), e);
        }
    }

    private static byte[] utf8(String text) {
        return text != null ? text.getBytes(StandardCharsets.UTF_8) : null;
    }

    private static String text(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id == ((Store) o).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Store{id=" + id + '}';
    }
}
