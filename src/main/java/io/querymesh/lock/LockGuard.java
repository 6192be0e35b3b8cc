package io.querymesh.lock;

public record LockGuard(String name, String ownerToken, long acquiredAtMs, long expiresAtMs) {
}
