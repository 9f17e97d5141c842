package com.dpstore;

import com.dpstore.backend.AuthenticationException;
import com.dpstore.backend.BackendAdapter;
import com.dpstore.backend.BackendRegistry;
import com.dpstore.config.DpsConfig;
import com.dpstore.error.DpsException;
import com.dpstore.error.ErrorCode;
import com.dpstore.keys.KeySchema;
import com.dpstore.lock.Lock;
import com.dpstore.lock.LockManager;
import com.dpstore.lock.RetryPolicy;
import com.dpstore.lock.Sleeper;
import com.dpstore.store.DataItemEngine;
import com.dpstore.store.Store;
import com.dpstore.store.StoreIterator;
import com.dpstore.store.StoreManager;
import com.dpstore.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Entry point for stores and distributed locks.
 *
 * A context wraps one backend connection. It is thread-safe and every call blocks
 * for its backend round trips. Contexts in different processes, or on different
 * machines, coordinate only through the shared backend.
 *
 * <pre>
 * try (DistributedProcessStore dps = DistributedProcessStore.open(DpsConfig.load())) {
 *     Store orders = dps.createOrGetStore("orders", "int64", "rstring");
 *     orders.put("42", "shipped");
 *     Lock lock = dps.createOrGetLock("batch-job");
 *     lock.acquireLock(5, 3);
 *     try {
 *         // critical section
 *     } finally {
 *         lock.releaseLock();
 *     }
 * }
 * </pre>
 */
public class DistributedProcessStore implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DistributedProcessStore.class);

    private final BackendAdapter backend;
    private final MetricsCollector metrics;
    private final LockManager lockManager;
    private final StoreManager storeManager;
    private final DataItemEngine items;
    private volatile boolean closed;

    @FunctionalInterface
    private interface Operation<T> {
        T call() throws DpsException;
    }

    /**
     * Wrap an adapter that is already connected.
     */
    public DistributedProcessStore(BackendAdapter backend) {
        this(backend, new MetricsCollector());
    }

    public DistributedProcessStore(BackendAdapter backend, MetricsCollector metrics) {
        this(backend, metrics, RetryPolicy.defaults(), Sleeper.parking());
    }

    /**
     * Wrap an adapter with a custom lock retry policy and wait strategy.
     */
    public DistributedProcessStore(BackendAdapter backend, MetricsCollector metrics,
                                   RetryPolicy retryPolicy, Sleeper sleeper) {
        if (backend == null) {
            throw new IllegalArgumentException("Backend cannot be null");
        }
        this.backend = backend;
        this.metrics = metrics;
        this.lockManager = new LockManager(backend, metrics, retryPolicy, sleeper);
        this.storeManager = new StoreManager(backend, lockManager, sleeper);
        this.items = new DataItemEngine(backend, storeManager, lockManager);
    }

    /**
     * Open a context from the configuration named by DPSTORE_CONFIG_FILE,
     * or the in-process backend if none is set.
     */
    public static DistributedProcessStore open() throws DpsException {
        try {
            return open(DpsConfig.load());
        } catch (IOException e) {
            throw new DpsException(ErrorCode.DPS_INITIALIZE_ERROR,
                    "Unable to read the configuration: " + e.getMessage(), e);
        }
    }

    public static DistributedProcessStore open(DpsConfig config) throws DpsException {
        return open(config, BackendRegistry.withDefaults());
    }

    /**
     * Create the configured backend adapter and connect it.
     *
     * @throws DpsException DPS_INITIALIZE_ERROR for an unknown or unsupported backend,
     *                      DPS_AUTHENTICATION_ERROR if a server rejects the password,
     *                      DPS_CONNECTION_ERROR if the servers cannot be reached
     */
    public static DistributedProcessStore open(DpsConfig config, BackendRegistry registry) throws DpsException {
        BackendAdapter backend = registry.create(config.getBackendName());
        try {
            backend.connect(config.getServers());
        } catch (AuthenticationException e) {
            backend.close();
            throw new DpsException(ErrorCode.DPS_AUTHENTICATION_ERROR, e.getMessage(), e);
        } catch (IOException e) {
            backend.close();
            throw new DpsException(ErrorCode.DPS_CONNECTION_ERROR,
                    "Unable to connect to the " + config.getBackendName() + " backend: " + e.getMessage(), e);
        }
        logger.info("Opened {} backend with {} server(s)", backend.getName(), config.getServers().size());
        return new DistributedProcessStore(backend);
    }

    // ==================== Stores ====================

    /**
     * @throws DpsException DPS_STORE_EXISTS if the name is taken
     */
    public Store createStore(String name, String keyTypeName, String valueTypeName) throws DpsException {
        return timed("createStore", () -> handle(storeManager.createStore(name, keyTypeName, valueTypeName)));
    }

    public Store createOrGetStore(String name, String keyTypeName, String valueTypeName) throws DpsException {
        return timed("createOrGetStore",
                () -> handle(storeManager.createOrGetStore(name, keyTypeName, valueTypeName)));
    }

    /**
     * @throws DpsException DPS_STORE_DOES_NOT_EXIST if there is no such store
     */
    public Store findStore(String name) throws DpsException {
        return timed("findStore", () -> handle(storeManager.findStore(name)));
    }

    /**
     * Handle for a store id obtained elsewhere, for example from another process.
     *
     * @throws DpsException DPS_INVALID_STORE_ID_ERROR if no store has this id
     */
    public Store getStore(long storeId) throws DpsException {
        return timed("getStore", () -> {
            if (!storeManager.storeExists(storeId)) {
                throw new DpsException(ErrorCode.DPS_INVALID_STORE_ID_ERROR, "No store exists with id " + storeId);
            }
            return handle(storeId);
        });
    }

    public void removeStore(Store store) throws DpsException {
        removeStore(store.getId());
    }

    public void removeStore(long storeId) throws DpsException {
        timed("removeStore", () -> {
            storeManager.removeStore(storeId);
            return null;
        });
    }

    /**
     * Close an iterator opened on a store.
     *
     * @throws DpsException DPS_INVALID_STORE_ID_ERROR if the iterator belongs to another store
     */
    public void deleteIterator(long storeId, StoreIterator iterator) throws DpsException {
        handle(storeId).deleteIterator(iterator);
    }

    private Store handle(long storeId) {
        return new Store(storeId, storeManager, items);
    }

    // ==================== TTL namespace ====================

    public void putTTL(byte[] key, byte[] value, int ttlSeconds) throws DpsException {
        putTTL(key, value, ttlSeconds, true, true);
    }

    public void putTTL(String key, String value, int ttlSeconds) throws DpsException {
        putTTL(utf8(key), utf8(value), ttlSeconds);
    }

    /**
     * Write into the store-independent TTL namespace.
     *
     * @param ttlSeconds  expiry in seconds, 0 for none
     * @param encodeKey   true to base64 the key, false if the key is length-prefix framed
     * @param encodeValue true to store the value as given, false if it is length-prefix framed
     */
    public void putTTL(byte[] key, byte[] value, int ttlSeconds, boolean encodeKey, boolean encodeValue)
            throws DpsException {
        timed("putTTL", () -> {
            items.putTTL(key, value, ttlSeconds, encodeKey, encodeValue);
            return null;
        });
    }

    public Optional<byte[]> getTTL(byte[] key) throws DpsException {
        return getTTL(key, true);
    }

    public Optional<byte[]> getTTL(byte[] key, boolean encodeKey) throws DpsException {
        return timed("getTTL", () -> items.getTTL(key, encodeKey));
    }

    public Optional<String> getTTL(String key) throws DpsException {
        return getTTL(utf8(key)).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    public boolean removeTTL(byte[] key) throws DpsException {
        return removeTTL(key, true);
    }

    public boolean removeTTL(byte[] key, boolean encodeKey) throws DpsException {
        return timed("removeTTL", () -> items.removeTTL(key, encodeKey));
    }

    public boolean removeTTL(String key) throws DpsException {
        return removeTTL(utf8(key));
    }

    public boolean hasTTL(byte[] key) throws DpsException {
        return hasTTL(key, true);
    }

    public boolean hasTTL(byte[] key, boolean encodeKey) throws DpsException {
        return timed("hasTTL", () -> items.hasTTL(key, encodeKey));
    }

    public boolean hasTTL(String key) throws DpsException {
        return hasTTL(utf8(key));
    }

    // ==================== Locks ====================

    public Lock createOrGetLock(String name) throws DpsException {
        return timed("createOrGetLock", () -> new Lock(lockManager, lockManager.createOrGetLock(name), name));
    }

    public void removeLock(Lock lock) throws DpsException {
        removeLock(lock.getId());
    }

    /**
     * Delete a lock. The lock is acquired first, so a lock held by someone else
     * fails to be removed.
     */
    public void removeLock(long lockId) throws DpsException {
        timed("removeLock", () -> {
            lockManager.removeLock(lockId);
            return null;
        });
    }

    /**
     * Process id recorded by the current holder of a lock.
     *
     * @return the pid, or 0 if the lock is free or unknown
     */
    public long getPidForLock(String name) throws DpsException {
        return timed("getPidForLock", () -> lockManager.getPidForLock(name));
    }

    // ==================== Backend ====================

    public String getNoSqlDbProductName() {
        return backend.getName();
    }

    /**
     * Pass a command through to the backend.
     *
     * @throws DpsException DPS_RUN_DATA_STORE_COMMAND_ERROR if the backend does not support it
     */
    public String runDataStoreCommand(String command) throws DpsException {
        return timed("runDataStoreCommand", () -> {
            try {
                return backend.runCommand(command);
            } catch (UnsupportedOperationException e) {
                throw new DpsException(ErrorCode.DPS_RUN_DATA_STORE_COMMAND_ERROR, e.getMessage(), e);
            } catch (IOException e) {
                throw new DpsException(ErrorCode.DPS_CONNECTION_ERROR,
                        "Unable to run a backend command: " + e.getMessage(), e);
            }
        });
    }

    public boolean isConnected() {
        return !closed && backend.isConnected();
    }

    /**
     * Re-establish the backend connections.
     */
    public void reconnect() throws DpsException {
        try {
            backend.reconnect();
        } catch (AuthenticationException e) {
            throw new DpsException(ErrorCode.DPS_AUTHENTICATION_ERROR, e.getMessage(), e);
        } catch (IOException e) {
            throw new DpsException(ErrorCode.DPS_CONNECTION_ERROR, "Reconnect failed: " + e.getMessage(), e);
        }
        logger.info("Reconnected to the {} backend", backend.getName());
    }

    public static String base64Encode(String text) {
        return KeySchema.encode(text);
    }

    /**
     * @throws IllegalArgumentException if the text is not valid base64
     */
    public static String base64Decode(String base64) {
        return KeySchema.decode(base64);
    }

    public MetricsCollector getMetrics() {
        return metrics;
    }

    /**
     * Close the backend connection.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        backend.close();
        logger.debug("Closed context ({})", metrics.summary());
    }

    private <T> T timed(String operation, Operation<T> call) throws DpsException {
        long start = System.nanoTime();
        try {
            return call.call();
        } catch (DpsException e) {
            metrics.recordError(e.getCode());
            throw e;
        } finally {
            metrics.recordOperation(operation, System.nanoTime() - start);
        }
    }

    private static byte[] utf8(String text) {
        return text != null ? text.getBytes(StandardCharsets.UTF_8) : null;
    }
}
