package com.dpstore.backend.memory;

import com.dpstore.backend.BackendAdapter;
import com.dpstore.config.DpsConfig;
import com.dpstore.config.ServerEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Thread-safe in-process storage engine using ConcurrentHashMap.
 * Supports plain values and field containers in one keyspace, with TTL expiry
 * applied lazily on access and by a periodic cleanup task.
 *
 * Used directly as the "memory" backend and as the engine behind a DpsServer.
 */
public class InMemoryBackend implements BackendAdapter {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryBackend.class);

    public static final String NAME = "memory";
    private static final long DEFAULT_CLEANUP_INTERVAL_MS = 1_000;

    private final ConcurrentHashMap<String, StoredValue> store;
    private final ScheduledExecutorService cleanupExecutor;
    private final long cleanupIntervalMs;
    private volatile boolean connected;
    private volatile boolean shutdown;

    /**
     * Create an engine with the cleanup interval from
     * DPSTORE_CLEANUP_INTERVAL_MS / dpstore.cleanup.interval.ms (default 1 second).
     */
    public InMemoryBackend() {
        this(DpsConfig.readIntSetting("DPSTORE_CLEANUP_INTERVAL_MS", "dpstore.cleanup.interval.ms",
            (int) DEFAULT_CLEANUP_INTERVAL_MS));
    }

    /**
     * Create an engine with a custom cleanup interval.
     *
     * @param cleanupIntervalMs interval between cleanup runs in milliseconds
     */
    public InMemoryBackend(long cleanupIntervalMs) {
        if (cleanupIntervalMs <= 0) {
            throw new IllegalArgumentException("cleanupIntervalMs must be positive");
        }
        this.store = new ConcurrentHashMap<>();
        this.cleanupIntervalMs = cleanupIntervalMs;
        this.connected = true;
        this.shutdown = false;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dpstore-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired,
                cleanupIntervalMs, cleanupIntervalMs, TimeUnit.MILLISECONDS);
        logger.debug("Started TTL cleanup task with interval {}ms", cleanupIntervalMs);
    }

    /**
     * Remove all expired entries.
     * Uses conditional remove so an entry replaced after the check survives.
     */
    private void cleanupExpired() {
        int removed = 0;
        for (Map.Entry<String, StoredValue> entry : store.entrySet()) {
            StoredValue value = entry.getValue();
            if (value.isExpired() && store.remove(entry.getKey(), value)) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.debug("Cleaned up {} expired entries", removed);
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void connect(List<ServerEndpoint> servers) {
        if (servers != null && !servers.isEmpty()) {
            logger.info("In-process backend ignores {} configured server(s)", servers.size());
        }
        ensureOpen();
        connected = true;
    }

    @Override
    public void reconnect() {
        ensureOpen();
        connected = true;
    }

    @Override
    public boolean isConnected() {
        return connected && !shutdown;
    }

    @Override
    public boolean writeIfAbsent(String key, byte[] value, int ttlSeconds) {
        validateKey(key);
        validateTtl(ttlSeconds);
        boolean[] created = { false };
        store.compute(key, (k, old) -> {
            if (old != null && !old.isExpired()) {
                return old;
            }
            created[0] = true;
            return StoredValue.plain(value, ttlSeconds * 1000L);
        });
        logger.trace("SETNX key={}, ttl={}s -> {}", key, ttlSeconds, created[0]);
        return created[0];
    }

    @Override
    public Optional<byte[]> read(String key) {
        validateKey(key);
        StoredValue entry = live(key);
        if (entry == null) {
            logger.trace("GET key={} -> NOT_FOUND", key);
            return Optional.empty();
        }
        requirePlain(key, entry);
        logger.trace("GET key={} -> FOUND", key);
        return Optional.of(entry.getValue());
    }

    @Override
    public void write(String key, byte[] value, int ttlSeconds) {
        validateKey(key);
        validateTtl(ttlSeconds);
        store.put(key, StoredValue.plain(value, ttlSeconds * 1000L));
        logger.trace("SET key={}, valueSize={}, ttl={}s", key, value != null ? value.length : 0, ttlSeconds);
    }

    @Override
    public boolean delete(String key) {
        validateKey(key);
        StoredValue removed = store.remove(key);
        boolean existed = removed != null && !removed.isExpired();
        logger.trace("DELETE key={} -> {}", key, existed ? "DELETED" : "NOT_FOUND");
        return existed;
    }

    @Override
    public long increment(String counterKey) {
        validateKey(counterKey);
        long[] result = new long[1];
        store.compute(counterKey, (k, old) -> {
            long current = 0;
            if (old != null && !old.isExpired()) {
                requirePlain(k, old);
                current = parseCounter(k, old.getValueUnsafe());
            }
            result[0] = current + 1;
            return StoredValue.plain(Long.toString(result[0]).getBytes(StandardCharsets.UTF_8), 0);
        });
        return result[0];
    }

    private static long parseCounter(String key, byte[] value) {
        try {
            return Long.parseLong(new String(value, StandardCharsets.UTF_8));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Value at " + key + " is not an integer");
        }
    }

    @Override
    public void setField(String containerKey, String field, byte[] value) {
        validateKey(containerKey);
        validateField(field);
        byte[] copy = value != null ? value.clone() : new byte[0];
        store.compute(containerKey, (k, old) -> {
            StoredValue container = old;
            if (container == null || container.isExpired()) {
                container = StoredValue.container();
            }
            requireContainer(k, container);
            container.fields().put(field, copy);
            return container;
        });
        logger.trace("HSET key={}, field={}", containerKey, field);
    }

    @Override
    public Optional<byte[]> getField(String containerKey, String field) {
        validateKey(containerKey);
        validateField(field);
        StoredValue container = live(containerKey);
        if (container == null) {
            return Optional.empty();
        }
        requireContainer(containerKey, container);
        byte[] value = container.fields().get(field);
        return value != null ? Optional.of(value.clone()) : Optional.empty();
    }

    @Override
    public boolean fieldExists(String containerKey, String field) {
        validateKey(containerKey);
        validateField(field);
        StoredValue container = live(containerKey);
        if (container == null) {
            return false;
        }
        requireContainer(containerKey, container);
        return container.fields().containsKey(field);
    }

    @Override
    public long deleteField(String containerKey, String field) {
        validateKey(containerKey);
        validateField(field);
        long[] removed = new long[1];
        store.computeIfPresent(containerKey, (k, container) -> {
            if (container.isExpired()) {
                return null;
            }
            requireContainer(k, container);
            if (container.fields().remove(field) != null) {
                removed[0] = 1;
            }
            // An emptied container disappears, like a hash in most engines
            return container.fields().isEmpty() ? null : container;
        });
        logger.trace("HDEL key={}, field={} -> {}", containerKey, field, removed[0]);
        return removed[0];
    }

    @Override
    public long fieldCount(String containerKey) {
        validateKey(containerKey);
        StoredValue container = live(containerKey);
        if (container == null) {
            return 0;
        }
        requireContainer(containerKey, container);
        return container.fields().size();
    }

    @Override
    public List<String> fieldNames(String containerKey) {
        validateKey(containerKey);
        StoredValue container = live(containerKey);
        if (container == null) {
            return Collections.emptyList();
        }
        requireContainer(containerKey, container);
        return new ArrayList<>(container.fields().keySet());
    }

    @Override
    public String runCommand(String command) {
        if (command != null && "PING".equalsIgnoreCase(command.trim())) {
            return "PONG";
        }
        throw new UnsupportedOperationException("Command not supported by the " + NAME + " backend: " + command);
    }

    /**
     * Number of live keys of either kind.
     */
    public int size() {
        return (int) store.values().stream()
                .filter(v -> !v.isExpired())
                .count();
    }

    /**
     * Remove every key.
     */
    public void clear() {
        store.clear();
        logger.debug("Backend cleared");
    }

    /**
     * Get the configured cleanup interval.
     */
    public long getCleanupIntervalMs() {
        return cleanupIntervalMs;
    }

    @Override
    public void close() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        connected = false;
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("InMemoryBackend shutdown complete");
    }

    /**
     * Get a non-expired entry, lazily removing an expired one.
     */
    private StoredValue live(String key) {
        StoredValue entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired()) {
            store.remove(key, entry);
            return null;
        }
        return entry;
    }

    private static void requirePlain(String key, StoredValue entry) {
        if (entry.isContainer()) {
            throw new IllegalStateException("WRONGTYPE key " + key + " holds a container");
        }
    }

    private static void requireContainer(String key, StoredValue entry) {
        if (!entry.isContainer()) {
            throw new IllegalStateException("WRONGTYPE key " + key + " holds a plain value");
        }
    }

    private void ensureOpen() {
        if (shutdown) {
            throw new IllegalStateException("Backend is closed");
        }
    }

    private static void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key cannot be null or empty");
        }
    }

    private static void validateField(String field) {
        if (field == null || field.isEmpty()) {
            throw new IllegalArgumentException("Field cannot be null or empty");
        }
    }

    private static void validateTtl(int ttlSeconds) {
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("ttlSeconds must be non-negative, got: " + ttlSeconds);
        }
    }
}
