package com.dpstore.lock;

import java.util.concurrent.locks.LockSupport;

/**
 * Suspends the calling thread between lock acquisition attempts.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Wait for about the given time.
     *
     * @param nanos time to wait in nanoseconds
     * @throws InterruptedException if the thread was interrupted while waiting
     */
    void sleep(long nanos) throws InterruptedException;

    /**
     * Default sleeper: parks the thread and reports interruption.
     * Parking may return early; callers re-check their deadline after every wait.
     */
    static Sleeper parking() {
        return nanos -> {
            if (nanos > 0) {
                LockSupport.parkNanos(nanos);
            }
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted while waiting for a lock");
            }
        };
    }
}
