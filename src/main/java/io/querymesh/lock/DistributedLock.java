package io.querymesh.lock;

import java.time.Duration;

/**
 * Named mutual exclusion with an owner token and a fixed expiry.
 *
 * <p>There is no renewal. A holder that outlives {@code timeout} loses the lock silently and a
 * new acquirer may take it over; {@link #release(LockGuard)} from the old holder then does nothing.
 */
public interface DistributedLock {

    /**
     * Waits up to {@code timeout} for the lock. A granted lock expires {@code timeout} after acquisition.
     *
     * @throws LockTimeoutException if the lock stayed held by someone else for the whole wait
     */
    LockGuard acquire(String name, Duration timeout) throws LockTimeoutException;

    /**
     * Deletes the lock record only if it still carries the guard's token. Idempotent.
     *
     * @return true if this call removed the record
     */
    boolean release(LockGuard guard);

    /**
     * False for the process-local fallback, which cannot exclude other processes.
     */
    boolean shared();
}
