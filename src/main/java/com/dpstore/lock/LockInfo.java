package com.dpstore.lock;

import com.dpstore.keys.KeySchema;

import java.util.Objects;
import java.util.Optional;

/**
 * Lock bookkeeping record: usage count, lease expiration, owning pid, lock name
 * and, while held, the signature stored in the lock's token.
 *
 * Stored as {@code count_expirationEpochSeconds_pid_base64(name)}, followed by
 * {@code _base64(signature)} when a holder is recorded. Base64 text has no
 * underscore, so the fields split unambiguously.
 */
public final class LockInfo {

    private final long usageCount;
    private final long expirationEpochSeconds;
    private final long ownerPid;
    private final String lockName;
    private final String ownerSignature;

    public LockInfo(long usageCount, long expirationEpochSeconds, long ownerPid, String lockName) {
        this(usageCount, expirationEpochSeconds, ownerPid, lockName, null);
    }

    /**
     * @param ownerSignature token value of the holder, or null if none is recorded
     */
    public LockInfo(long usageCount, long expirationEpochSeconds, long ownerPid, String lockName,
                    String ownerSignature) {
        if (lockName == null) {
            throw new IllegalArgumentException("Lock name cannot be null");
        }
        this.usageCount = usageCount;
        this.expirationEpochSeconds = expirationEpochSeconds;
        this.ownerPid = ownerPid;
        this.lockName = lockName;
        this.ownerSignature = ownerSignature;
    }

    /**
     * Record for a lock nobody holds.
     */
    public static LockInfo free(String lockName) {
        return new LockInfo(0, 0, 0, lockName);
    }

    /**
     * Parse a stored record.
     *
     * @throws IllegalArgumentException if the text is not a lock record
     */
    public static LockInfo parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Lock info cannot be null");
        }
        String[] parts = text.split("_", 5);
        if (parts.length < 4) {
            throw new IllegalArgumentException("Malformed lock info: " + text);
        }
        try {
            String signature = parts.length == 5 ? KeySchema.decode(parts[4]) : null;
            return new LockInfo(Long.parseLong(parts[0]), Long.parseLong(parts[1]),
                    Long.parseLong(parts[2]), KeySchema.decode(parts[3]), signature);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed lock info: " + text, e);
        }
    }

    public String format() {
        String record = usageCount + "_" + expirationEpochSeconds + "_" + ownerPid + "_" + KeySchema.encode(lockName);
        return ownerSignature == null ? record : record + "_" + KeySchema.encode(ownerSignature);
    }

    public long getUsageCount() {
        return usageCount;
    }

    public long getExpirationEpochSeconds() {
        return expirationEpochSeconds;
    }

    public long getOwnerPid() {
        return ownerPid;
    }

    public String getLockName() {
        return lockName;
    }

    public Optional<String> getOwnerSignature() {
        return Optional.ofNullable(ownerSignature);
    }

    public boolean isFree() {
        return usageCount == 0 && expirationEpochSeconds == 0;
    }

    /**
     * Check whether the recorded lease ended before the given time.
     * A record without an expiration never expires.
     */
    public boolean isLeaseExpired(long nowEpochSeconds) {
        return expirationEpochSeconds > 0 && nowEpochSeconds > expirationEpochSeconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LockInfo that = (LockInfo) o;
        return usageCount == that.usageCount &&
               expirationEpochSeconds == that.expirationEpochSeconds &&
               ownerPid == that.ownerPid &&
               lockName.equals(that.lockName) &&
               Objects.equals(ownerSignature, that.ownerSignature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(usageCount, expirationEpochSeconds, ownerPid, lockName, ownerSignature);
    }

    @Override
    public String toString() {
        return "LockInfo{" +
               "usageCount=" + usageCount +
               ", expiration=" + expirationEpochSeconds +
               ", pid=" + ownerPid +
               ", name='" + lockName + '\'' +
               (ownerSignature != null ? ", owner='" + ownerSignature + '\'' : "") +
               '}';
    }
}
