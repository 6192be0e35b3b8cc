package io.querymesh.partition;

import io.querymesh.util.Hashing;

/**
 * Maps query text to a shard index.
 *
 * <p>The hash is the first four bytes of SHA-256 over the trimmed UTF-8 query, read as an
 * unsigned 32-bit big-endian integer. It does not depend on JVM, locale or run, so a
 * re-dispatch after a crash reproduces the same partitioning.
 *
 * <p>Result rows are identified by {@link #queryIdOf(String)}, the first eight bytes of the same
 * digest, since 32 bits collide long before a session reaches millions of distinct queries.
 */
public final class HashPartitioner {
    private HashPartitioner() {
    }

    public static long hashOf(String query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        byte[] digest = Hashing.sha256(query.strip());
        return ((digest[0] & 0xFFL) << 24)
                | ((digest[1] & 0xFFL) << 16)
                | ((digest[2] & 0xFFL) << 8)
                | (digest[3] & 0xFFL);
    }

    public static long queryIdOf(String query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        byte[] digest = Hashing.sha256(query.strip());
        long id = 0L;
        for (int i = 0; i < 8; i++) {
            id = (id << 8) | (digest[i] & 0xFFL);
        }
        return id;
    }

    public static int shardOf(String query, int totalShards) {
        if (totalShards <= 0) {
            throw new IllegalArgumentException("totalShards must be > 0, got " + totalShards);
        }
        return (int) (hashOf(query) % totalShards);
    }

    public static boolean belongsTo(String query, int remainder, int totalShards) {
        return shardOf(query, totalShards) == remainder;
    }

    /**
     * Shard count for a file holding {@code uniqueQueries} distinct queries: at least one shard,
     * otherwise one shard per {@code targetShardSize} queries rounded down.
     */
    public static int shardCountFor(long uniqueQueries, int targetShardSize) {
        if (targetShardSize <= 0) {
            throw new IllegalArgumentException("targetShardSize must be > 0, got " + targetShardSize);
        }
        long shards = Math.max(0L, uniqueQueries) / targetShardSize;
        return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, shards));
    }
}
