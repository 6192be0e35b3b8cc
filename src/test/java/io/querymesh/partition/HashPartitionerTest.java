package io.querymesh.partition;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

final class HashPartitionerTest {

    @Test
    void hashIsFirstFourDigestBytesOfTrimmedQuery() throws Exception {
        String query = "SELECT id, name FROM users WHERE id = 42";
        byte[] digest = MessageDigest.getInstance("SHA-256").digest(query.getBytes(StandardCharsets.UTF_8));
        long expected = ((digest[0] & 0xFFL) << 24)
                | ((digest[1] & 0xFFL) << 16)
                | ((digest[2] & 0xFFL) << 8)
                | (digest[3] & 0xFFL);

        Assertions.assertEquals(expected, HashPartitioner.hashOf(query));
        Assertions.assertEquals(expected, HashPartitioner.hashOf("  " + query + "\n"));
        Assertions.assertTrue(expected >= 0L && expected <= 0xFFFFFFFFL);
    }

    @Test
    void queryIdIsFirstEightDigestBytesAndStaysDistinct() throws Exception {
        String query = "SELECT id, name FROM users WHERE id = 42";
        byte[] digest = MessageDigest.getInstance("SHA-256").digest(query.getBytes(StandardCharsets.UTF_8));
        long expected = 0L;
        for (int i = 0; i < 8; i++) {
            expected = (expected << 8) | (digest[i] & 0xFFL);
        }
        Assertions.assertEquals(expected, HashPartitioner.queryIdOf(query));
        Assertions.assertEquals(expected, HashPartitioner.queryIdOf(" " + query + "\t"));
        Assertions.assertEquals(HashPartitioner.hashOf(query), expected >>> 32);

        Set<Long> ids = new HashSet<>();
        for (int i = 0; i < 200_000; i++) {
            Assertions.assertTrue(ids.add(HashPartitioner.queryIdOf("SELECT c" + i + " FROM t")));
        }
    }

    @Test
    void shardIsStableAndInRange() {
        for (int i = 0; i < 200; i++) {
            String query = "SELECT " + i + " FROM t";
            int shard = HashPartitioner.shardOf(query, 7);
            Assertions.assertTrue(shard >= 0 && shard < 7);
            Assertions.assertEquals(shard, HashPartitioner.shardOf(query, 7));
            Assertions.assertTrue(HashPartitioner.belongsTo(query, shard, 7));
        }
        Assertions.assertEquals(0, HashPartitioner.shardOf("anything", 1));
    }

    @Test
    void everyQueryLandsInExactlyOneShard() {
        int totalShards = 4;
        Map<Integer, Integer> perShard = new HashMap<>();
        for (int i = 0; i < 1_000; i++) {
            String query = "SELECT col_" + i + " FROM events";
            int owners = 0;
            for (int r = 0; r < totalShards; r++) {
                if (HashPartitioner.belongsTo(query, r, totalShards)) {
                    owners++;
                    perShard.merge(r, 1, Integer::sum);
                }
            }
            Assertions.assertEquals(1, owners);
        }
        Assertions.assertEquals(totalShards, perShard.size());
        Assertions.assertEquals(1_000, perShard.values().stream().mapToInt(Integer::intValue).sum());
    }

    @Test
    void rejectsNonPositiveShardCount() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> HashPartitioner.shardOf("SELECT 1", 0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> HashPartitioner.shardOf("SELECT 1", -3));
        Assertions.assertThrows(IllegalArgumentException.class, () -> HashPartitioner.shardCountFor(10, 0));
    }

    @Test
    void shardCountRoundsDownWithAtLeastOneShard() {
        Assertions.assertEquals(1, HashPartitioner.shardCountFor(0, 10_000));
        Assertions.assertEquals(1, HashPartitioner.shardCountFor(9_999, 10_000));
        Assertions.assertEquals(1, HashPartitioner.shardCountFor(10_000, 10_000));
        Assertions.assertEquals(2, HashPartitioner.shardCountFor(25_000, 10_000));
        Assertions.assertEquals(100, HashPartitioner.shardCountFor(1_000_000, 10_000));
    }
}
