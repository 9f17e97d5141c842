package com.dpstore.lock;

import com.dpstore.error.DpsException;

/**
 * Handle to a named distributed lock.
 */
public class Lock {

    private final LockManager manager;
    private final long id;
    private final String name;

    public Lock(LockManager manager, long id, String name) {
        this.manager = manager;
        this.id = id;
        this.name = name;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /**
     * Acquire with a practically unlimited lease, waiting up to 15 seconds.
     */
    public void acquireLock() throws DpsException {
        manager.acquireLock(id, LockManager.DEFAULT_LEASE_SECONDS, LockManager.DEFAULT_MAX_WAIT_SECONDS);
    }

    /**
     * Acquire with a lease, waiting at most maxWaitSeconds.
     *
     * @throws DpsException DL_GET_LOCK_TIMEOUT_ERROR if the wait runs out
     */
    public void acquireLock(double leaseSeconds, double maxWaitSeconds) throws DpsException {
        manager.acquireLock(id, leaseSeconds, maxWaitSeconds);
    }

    public void releaseLock() throws DpsException {
        manager.releaseLock(id);
    }

    @Override
    public String toString() {
        return "Lock{id=" + id + ", name='" + name + "'}";
    }
}
