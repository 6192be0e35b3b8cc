package io.querymesh.model;

/**
 * Pre-scan figures for one input file. {@code error} is set when the file could not be read;
 * such a file contributes no shards.
 */
public record FileStats(
        String filePath,
        long totalQueries,
        long uniqueQueries,
        int shards,
        long queriesPerShard,
        String error
) {
    public static FileStats scanned(String filePath, long totalQueries, long uniqueQueries, int shards) {
        return new FileStats(filePath, totalQueries, uniqueQueries, shards, uniqueQueries / Math.max(1, shards), null);
    }

    public static FileStats unreadable(String filePath, String error) {
        return new FileStats(filePath, 0L, 0L, 0, 0L, error);
    }

    public boolean readable() {
        return error == null;
    }
}
