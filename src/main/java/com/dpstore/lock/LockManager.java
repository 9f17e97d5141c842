package com.dpstore.lock;

import com.dpstore.backend.BackendAdapter;
import com.dpstore.error.DpsException;
import com.dpstore.error.ErrorCode;
import com.dpstore.keys.KeySchema;
import com.dpstore.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Distributed locks built on the backend's conditional insert with expiry.
 *
 * <p>A lock is held by whoever manages to insert its token key. The token's
 * value is a signature unique to one acquisition attempt, and ownership is
 * confirmed by reading it back. Three kinds of lock share this mechanism:
 * <ul>
 *   <li>general-purpose locks, held for a few seconds around multi-step
 *       creation of a store or lock;</li>
 *   <li>store locks, held around structural changes to one store;</li>
 *   <li>named locks with a caller-chosen lease, plus a lock-info record that lets
 *       a contender take over a lock whose lease ran out.</li>
 * </ul>
 */
public class LockManager {

    private static final Logger logger = LoggerFactory.getLogger(LockManager.class);

    /** Token expiry for general-purpose and store locks. */
    public static final int INTERNAL_LOCK_TTL_SECONDS = 5;
    public static final double DEFAULT_LEASE_SECONDS = 315360000;
    public static final double DEFAULT_MAX_WAIT_SECONDS = 15;
    static final double REMOVAL_LEASE_SECONDS = 5;
    static final double REMOVAL_MAX_WAIT_SECONDS = 3;

    private static final AtomicLong CONTEXT_SERIALS = new AtomicLong();

    private enum Outcome { ACQUIRED, RETRIES_EXHAUSTED, TIMED_OUT, INTERRUPTED }

    private final BackendAdapter backend;
    private final MetricsCollector metrics;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final long pid;
    private final String ownerPrefix;
    private final AtomicLong lastStamp = new AtomicLong();

    public LockManager(BackendAdapter backend, MetricsCollector metrics) {
        this(backend, metrics, RetryPolicy.defaults(), Sleeper.parking());
    }

    public LockManager(BackendAdapter backend, MetricsCollector metrics, RetryPolicy policy, Sleeper sleeper) {
        this.backend = backend;
        this.metrics = metrics;
        this.policy = policy;
        this.sleeper = sleeper;
        this.pid = ProcessHandle.current().pid();
        this.ownerPrefix = pid + "@" + localHostName() + "#" + CONTEXT_SERIALS.incrementAndGet() + "#";
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            logger.warn("Cannot resolve local host name, using 'localhost' in lock signatures: {}", e.getMessage());
            return "localhost";
        }
    }

    // ==================== Internal locks ====================

    /**
     * Take the short-lived lock serializing creation of the named entity.
     *
     * @throws DpsException DPS_GET_GENERIC_LOCK_ERROR if the lock stays busy
     */
    public void acquireGeneralPurposeLock(String entityName) throws DpsException {
        String key = KeySchema.genericLockKey(KeySchema.encode(entityName));
        Outcome outcome;
        try {
            outcome = acquireToken(key, nextSignature(), INTERNAL_LOCK_TTL_SECONDS, Long.MAX_VALUE, -1);
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DPS_CONNECTION_ERROR,
                    "Unable to reach the backend for the general-purpose lock of " + entityName, e);
        }
        if (outcome != Outcome.ACQUIRED) {
            throw new DpsException(ErrorCode.DPS_GET_GENERIC_LOCK_ERROR,
                    "Unable to get the general-purpose lock for " + entityName + " (" + outcome + ")");
        }
        logger.debug("Acquired general-purpose lock for {}", entityName);
    }

    public void releaseGeneralPurposeLock(String entityName) {
        releaseToken(KeySchema.genericLockKey(KeySchema.encode(entityName)));
    }

    /**
     * Take the lock serializing structural changes to one store.
     *
     * @throws DpsException DPS_GET_STORE_LOCK_ERROR if the lock stays busy
     */
    public void acquireStoreLock(long storeId) throws DpsException {
        Outcome outcome;
        try {
            outcome = acquireToken(KeySchema.storeLockKey(storeId), nextSignature(),
                    INTERNAL_LOCK_TTL_SECONDS, Long.MAX_VALUE, -1);
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DPS_CONNECTION_ERROR,
                    "Unable to reach the backend for the lock of store " + storeId, e);
        }
        if (outcome != Outcome.ACQUIRED) {
            throw new DpsException(ErrorCode.DPS_GET_STORE_LOCK_ERROR,
                    "Unable to get the lock for store " + storeId + " (" + outcome + ")");
        }
        logger.trace("Acquired store lock for {}", storeId);
    }

    public void releaseStoreLock(long storeId) {
        releaseToken(KeySchema.storeLockKey(storeId));
    }

    private void releaseToken(String tokenKey) {
        try {
            backend.delete(tokenKey);
        } catch (IOException | IllegalStateException e) {
            logger.warn("Failed to release lock token {}, it expires in {}s: {}",
                    tokenKey, INTERNAL_LOCK_TTL_SECONDS, e.getMessage());
        }
    }

    // ==================== Named locks ====================

    /**
     * Create a named lock, or find it if it already exists.
     *
     * @return the lock id
     */
    public long createOrGetLock(String name) throws DpsException {
        validateName(name);
        try {
            acquireGeneralPurposeLock(name);
        } catch (DpsException e) {
            throw new DpsException(ErrorCode.DL_GET_LOCK_ID_ERROR,
                    "Unable to serialize creation of lock " + name + ": " + e.getMessage(), e);
        }
        try {
            OptionalLong existing = findLockId(name);
            if (existing.isPresent()) {
                logger.debug("Found existing lock {} with id {}", name, existing.getAsLong());
                return existing.getAsLong();
            }
            return createLock(name);
        } finally {
            releaseGeneralPurposeLock(name);
        }
    }

    private long createLock(String name) throws DpsException {
        long lockId;
        try {
            lockId = backend.increment(KeySchema.GUID_KEY);
        } catch (IOException | RuntimeException e) {
            throw new DpsException(ErrorCode.DL_GUID_CREATION_ERROR,
                    "Unable to allocate an id for lock " + name + ": " + e.getMessage(), e);
        }

        String nameKey = KeySchema.lockNameKey(name);
        try {
            backend.write(nameKey, Long.toString(lockId).getBytes(StandardCharsets.UTF_8), 0);
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DL_LOCK_NAME_CREATION_ERROR,
                    "Unable to record the name of lock " + name + ": " + e.getMessage(), e);
        }

        try {
            writeLockInfo(lockId, LockInfo.free(name));
        } catch (IOException | IllegalStateException e) {
            try {
                backend.delete(nameKey);
            } catch (IOException | IllegalStateException compensationFailure) {
                logger.warn("Could not undo name mapping {} of half-created lock {}: {}",
                        nameKey, lockId, compensationFailure.getMessage());
            }
            throw new DpsException(ErrorCode.DL_LOCK_INFO_CREATION_ERROR,
                    "Unable to create the info record of lock " + name + ": " + e.getMessage(), e);
        }
        logger.debug("Created lock {} with id {}", name, lockId);
        return lockId;
    }

    /**
     * Look up the id of a named lock.
     */
    public OptionalLong findLockId(String name) throws DpsException {
        validateName(name);
        try {
            Optional<byte[]> value = backend.read(KeySchema.lockNameKey(name));
            if (!value.isPresent()) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(Long.parseLong(new String(value.get(), StandardCharsets.UTF_8)));
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DL_CONNECTION_ERROR,
                    "Unable to look up lock " + name + ": " + e.getMessage(), e);
        } catch (NumberFormatException e) {
            throw new DpsException(ErrorCode.DL_GET_LOCK_ID_ERROR, "Corrupt id for lock " + name, e);
        }
    }

    /**
     * Read the info record of a lock.
     *
     * @return the record, or empty if the lock does not exist
     */
    public Optional<LockInfo> getLockInfo(long lockId) throws DpsException {
        try {
            return readLockInfo(lockId);
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DL_CONNECTION_ERROR,
                    "Unable to read info of lock " + lockId + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new DpsException(ErrorCode.DL_GET_LOCK_INFO_ERROR,
                    "Corrupt info record for lock " + lockId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Acquire a named lock.
     *
     * @param lockId         the lock id
     * @param leaseSeconds   how long the lock stays held without release
     * @param maxWaitSeconds how long to keep trying
     * @throws DpsException DL_GET_LOCK_TIMEOUT_ERROR when maxWait runs out,
     *                      DL_GET_LOCK_ERROR when the retry limit is reached,
     *                      DL_INVALID_LOCK_ID_ERROR if the lock does not exist
     */
    public void acquireLock(long lockId, double leaseSeconds, double maxWaitSeconds) throws DpsException {
        if (!(leaseSeconds > 0)) {
            throw new IllegalArgumentException("leaseSeconds must be positive, got: " + leaseSeconds);
        }
        if (!(maxWaitSeconds >= 0)) {
            throw new IllegalArgumentException("maxWaitSeconds must be non-negative, got: " + maxWaitSeconds);
        }
        Optional<LockInfo> info = getLockInfo(lockId);
        if (!info.isPresent()) {
            throw new DpsException(ErrorCode.DL_INVALID_LOCK_ID_ERROR, "No lock exists with id " + lockId);
        }

        int tokenTtl = (int) Math.min(Integer.MAX_VALUE, Math.ceil(leaseSeconds));
        long maxWaitNanos = (long) Math.min(Long.MAX_VALUE, maxWaitSeconds * TimeUnit.SECONDS.toNanos(1));
        String signature = nextSignature();
        Outcome outcome;
        try {
            outcome = acquireToken(KeySchema.lockTokenKey(lockId), signature, tokenTtl, maxWaitNanos, lockId);
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DL_CONNECTION_ERROR,
                    "Unable to reach the backend while acquiring lock " + lockId + ": " + e.getMessage(), e);
        }

        switch (outcome) {
            case ACQUIRED:
                break;
            case RETRIES_EXHAUSTED:
                throw new DpsException(ErrorCode.DL_GET_LOCK_ERROR,
                        "Unable to acquire lock " + lockId + " after " + policy.getMaxRetries() + " attempts");
            case INTERRUPTED:
                throw new DpsException(ErrorCode.DL_GET_LOCK_TIMEOUT_ERROR,
                        "Interrupted while acquiring lock " + lockId);
            default:
                throw new DpsException(ErrorCode.DL_GET_LOCK_TIMEOUT_ERROR,
                        "Unable to acquire lock " + lockId + " within " + maxWaitSeconds + "s");
        }

        long expiration = nowEpochSeconds() + (long) leaseSeconds;
        try {
            writeLockInfo(lockId, new LockInfo(1, expiration, pid, info.get().getLockName(), signature));
        } catch (IOException | IllegalStateException e) {
            releaseToken(KeySchema.lockTokenKey(lockId));
            throw new DpsException(ErrorCode.DL_LOCK_INFO_UPDATE_ERROR,
                    "Acquired lock " + lockId + " but could not record it: " + e.getMessage(), e);
        }
        logger.debug("Acquired lock {} with lease {}s", lockId, leaseSeconds);
    }

    /**
     * Release a named lock. Releasing a lock this caller does not hold only resets its record.
     */
    public void releaseLock(long lockId) throws DpsException {
        try {
            backend.delete(KeySchema.lockTokenKey(lockId));
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DL_LOCK_RELEASE_ERROR,
                    "Unable to release lock " + lockId + ": " + e.getMessage(), e);
        }
        Optional<LockInfo> info = getLockInfo(lockId);
        if (!info.isPresent()) {
            throw new DpsException(ErrorCode.DL_INVALID_LOCK_ID_ERROR, "No lock exists with id " + lockId);
        }
        try {
            writeLockInfo(lockId, LockInfo.free(info.get().getLockName()));
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DL_LOCK_INFO_UPDATE_ERROR,
                    "Released lock " + lockId + " but could not reset its record: " + e.getMessage(), e);
        }
        logger.debug("Released lock {}", lockId);
    }

    /**
     * Delete a named lock. The lock must be free: it is acquired first.
     *
     * @throws DpsException DL_LOCK_REMOVAL_ERROR if the lock is busy or cannot be deleted
     */
    public void removeLock(long lockId) throws DpsException {
        try {
            acquireLock(lockId, REMOVAL_LEASE_SECONDS, REMOVAL_MAX_WAIT_SECONDS);
        } catch (DpsException e) {
            if (e.getCode() == ErrorCode.DL_INVALID_LOCK_ID_ERROR) {
                throw e;
            }
            throw new DpsException(ErrorCode.DL_LOCK_REMOVAL_ERROR,
                    "Lock " + lockId + " is busy and cannot be removed: " + e.getMessage(), e);
        }

        Optional<LockInfo> info = getLockInfo(lockId);
        try {
            if (info.isPresent()) {
                backend.delete(KeySchema.lockNameKey(info.get().getLockName()));
            }
            backend.delete(KeySchema.lockInfoKey(lockId));
            backend.delete(KeySchema.lockTokenKey(lockId));
        } catch (IOException | IllegalStateException e) {
            throw new DpsException(ErrorCode.DL_LOCK_REMOVAL_ERROR,
                    "Unable to delete lock " + lockId + ": " + e.getMessage(), e);
        }
        logger.debug("Removed lock {}", lockId);
    }

    /**
     * Get the pid recorded as owner of a named lock.
     *
     * @return the owner pid, or 0 if the lock is free, does not exist or cannot be looked up
     */
    public long getPidForLock(String name) {
        try {
            OptionalLong lockId = findLockId(name);
            if (!lockId.isPresent()) {
                return 0;
            }
            return getLockInfo(lockId.getAsLong()).map(LockInfo::getOwnerPid).orElse(0L);
        } catch (DpsException e) {
            logger.warn("Unable to look up the owner of lock {}, reporting none: {}", name, e.getMessage());
            return 0;
        }
    }

    // ==================== Acquisition ====================

    /**
     * Retry the token insert until it succeeds or a bound is reached.
     *
     * @param signature token value identifying this acquisition
     * @param lockId named lock whose expired lease may be reclaimed, or -1 for internal locks
     */
    private Outcome acquireToken(String tokenKey, String signature, int ttlSeconds, long maxWaitNanos, long lockId)
            throws IOException {
        byte[] value = signature.getBytes(StandardCharsets.UTF_8);
        long start = System.nanoTime();
        try {
            for (int attempt = 1; ; attempt++) {
                if (tryAcquire(tokenKey, value, ttlSeconds)) {
                    return Outcome.ACQUIRED;
                }
                metrics.recordLockRetry();
                boolean reclaimed = lockId >= 0 && reclaimIfExpired(lockId, tokenKey);

                if (attempt >= policy.getMaxRetries()) {
                    logger.debug("Giving up on {} after {} attempts", tokenKey, attempt);
                    return Outcome.RETRIES_EXHAUSTED;
                }
                long remaining = maxWaitNanos - (System.nanoTime() - start);
                if (remaining <= 0) {
                    logger.debug("Wait for {} timed out after {} attempts", tokenKey, attempt);
                    return Outcome.TIMED_OUT;
                }
                if (!reclaimed) {
                    sleeper.sleep(policy.backoffNanos(attempt, remaining));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Interrupted while acquiring {}", tokenKey);
            return Outcome.INTERRUPTED;
        }
    }

    /**
     * One conditional insert followed by a read-back of the owner signature.
     * A just-written token may not be readable yet on some backends, so an empty
     * read is retried a few times.
     */
    private boolean tryAcquire(String tokenKey, byte[] signature, int ttlSeconds)
            throws IOException, InterruptedException {
        boolean inserted = backend.writeIfAbsent(tokenKey, signature, ttlSeconds);
        for (int read = 1; ; read++) {
            Optional<byte[]> owner = backend.read(tokenKey);
            if (owner.isPresent()) {
                return Arrays.equals(owner.get(), signature);
            }
            if (!inserted) {
                return false;
            }
            if (read >= policy.getReadBackAttempts()) {
                logger.warn("Token {} written but not readable after {} reads", tokenKey, read);
                return false;
            }
            sleeper.sleep(policy.readBackPauseNanos());
        }
    }

    /**
     * Delete the token of a lock whose recorded lease has run out. Only the token
     * named in the expired record is deleted: a token written by a new holder that
     * has not recorded itself yet stays.
     *
     * @return true if the token was deleted
     */
    private boolean reclaimIfExpired(long lockId, String tokenKey) throws IOException {
        Optional<byte[]> holder = backend.read(tokenKey);
        if (!holder.isPresent()) {
            return false;
        }
        Optional<LockInfo> info;
        try {
            info = readLockInfo(lockId);
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring corrupt info record of lock {}: {}", lockId, e.getMessage());
            return false;
        }
        if (!info.isPresent() || !info.get().isLeaseExpired(nowEpochSeconds())) {
            return false;
        }
        Optional<String> expiredOwner = info.get().getOwnerSignature();
        if (!expiredOwner.isPresent()
                || !Arrays.equals(holder.get(), expiredOwner.get().getBytes(StandardCharsets.UTF_8))) {
            logger.debug("Token of lock {} does not belong to the expired holder, not reclaiming", lockId);
            return false;
        }
        // Skip if the token changed hands since it was read
        Optional<byte[]> current = backend.read(tokenKey);
        if (!current.isPresent() || !Arrays.equals(current.get(), holder.get())) {
            return false;
        }
        backend.delete(tokenKey);
        metrics.recordLockReclaimed();
        logger.warn("Reclaimed lock {} from pid {}, lease expired at {}",
                lockId, info.get().getOwnerPid(), info.get().getExpirationEpochSeconds());
        return true;
    }

    private Optional<LockInfo> readLockInfo(long lockId) throws IOException {
        return backend.read(KeySchema.lockInfoKey(lockId))
                .map(bytes -> LockInfo.parse(new String(bytes, StandardCharsets.UTF_8)));
    }

    private void writeLockInfo(long lockId, LockInfo info) throws IOException {
        backend.write(KeySchema.lockInfoKey(lockId), info.format().getBytes(StandardCharsets.UTF_8), 0);
    }

    /**
     * Owner signature for one attempt. The stamp is strictly increasing so
     * threads sharing this manager never produce the same signature.
     */
    private String nextSignature() {
        long now = System.nanoTime();
        return ownerPrefix + lastStamp.updateAndGet(last -> Math.max(now, last + 1));
    }

    private static long nowEpochSeconds() {
        return TimeUnit.MILLISECONDS.toSeconds(System.currentTimeMillis());
    }

    private static void validateName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Lock name cannot be null or empty");
        }
    }

    /**
     * Process id recorded as owner of locks acquired through this manager.
     */
    public long getPid() {
        return pid;
    }

    public RetryPolicy getRetryPolicy() {
        return policy;
    }
}
