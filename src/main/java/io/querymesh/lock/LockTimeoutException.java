package io.querymesh.lock;

import java.time.Duration;

public final class LockTimeoutException extends Exception {
    private final String lockName;

    public LockTimeoutException(String lockName, Duration timeout) {
        super("Could not acquire lock " + lockName + " within " + timeout.toMillis() + " ms");
        this.lockName = lockName;
    }

    public String lockName() {
        return lockName;
    }
}
