package com.dpstore.store;

import com.dpstore.error.DpsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Cursor over the items of one store.
 *
 * The item key list is fetched once, on the first call, and the cursor walks
 * that snapshot fetching one value at a time. Items added by others after the
 * snapshot are not seen; items removed after it are skipped. Order is whatever
 * order the backend lists container fields in.
 *
 * The {@link Iterator} methods wrap failures in {@link IllegalStateException};
 * use {@link #getNext()} to receive them as {@link DpsException}.
 */
public class StoreIterator implements Iterator<KeyValuePair>, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(StoreIterator.class);

    private final long storeId;
    private final String storeName;
    private final StoreManager storeManager;
    private final DataItemEngine items;

    private List<byte[]> keys;
    private int position;
    private KeyValuePair pending;
    private boolean closed;

    public StoreIterator(long storeId, String storeName, StoreManager storeManager, DataItemEngine items) {
        this.storeId = storeId;
        this.storeName = storeName;
        this.storeManager = storeManager;
        this.items = items;
    }

    public long getStoreId() {
        return storeId;
    }

    public String getStoreName() {
        return storeName;
    }

    /**
     * Advance to the next item.
     *
     * @return the item, or empty once the snapshot is exhausted, the store no
     *         longer exists or the iterator is closed
     */
    public Optional<KeyValuePair> getNext() throws DpsException {
        if (pending != null) {
            KeyValuePair next = pending;
            pending = null;
            return Optional.of(next);
        }
        if (closed || !storeManager.storeExists(storeId)) {
            return Optional.empty();
        }
        if (keys == null) {
            keys = storeManager.getItemKeys(storeId);
            logger.debug("Iterator over store {} took a snapshot of {} keys", storeId, keys.size());
        }
        while (position < keys.size()) {
            byte[] key = keys.get(position++);
            Optional<byte[]> value = items.get(storeId, key);
            if (value.isPresent()) {
                return Optional.of(new KeyValuePair(key, value.get()));
            }
            logger.trace("Item removed after the snapshot of store {}", storeId);
        }
        return Optional.empty();
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        try {
            pending = getNext().orElse(null);
        } catch (DpsException e) {
            throw new IllegalStateException("Iteration over store " + storeId + " failed: " + e.getMessage(), e);
        }
        return pending != null;
    }

    @Override
    public KeyValuePair next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        KeyValuePair next = pending;
        pending = null;
        return next;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Drop the snapshot. Later calls report no more items.
     */
    @Override
    public void close() {
        closed = true;
        keys = null;
        pending = null;
    }

    @Override
    public String toString() {
        return "StoreIterator{" +
               "storeId=" + storeId +
               ", storeName='" + storeName + '\'' +
               ", position=" + position +
               (closed ? ", closed" : "") +
               '}';
    }
}
