package com.di.execmaps.sharding;

/**
 * Maps a logical (history) shard id to the physical database shard that stores its rows.
 *
 * <p>The mapping is {@code logicalShardId mod totalPhysicalShards}. It only stays stable for
 * as long as the physical shard count does: changing {@code execmaps.persistence.num-db-shards}
 * without migrating data strands rows on the wrong partition. That is an operational rule and
 * is not checked here.
 */
public final class ShardRouter {

    private final int totalPhysicalShards;

    public ShardRouter(int totalPhysicalShards) {
        requirePositiveTotal(totalPhysicalShards);
        this.totalPhysicalShards = totalPhysicalShards;
    }

    /**
     * Resolves the physical shard for the given logical shard id.
     *
     * @param logicalShardId      logical shard id carried by the execution identity (&gt;= 0)
     * @param totalPhysicalShards number of configured physical shards (&gt; 0)
     * @return physical shard index in {@code [0, totalPhysicalShards)}
     */
    public static int resolvePhysicalShard(int logicalShardId, int totalPhysicalShards) {
        requirePositiveTotal(totalPhysicalShards);
        if (logicalShardId < 0) {
            throw new IllegalArgumentException("logicalShardId must be >= 0, got " + logicalShardId);
        }
        return logicalShardId % totalPhysicalShards;
    }

    public int resolve(int logicalShardId) {
        return resolvePhysicalShard(logicalShardId, totalPhysicalShards);
    }

    public int getTotalPhysicalShards() {
        return totalPhysicalShards;
    }

    private static void requirePositiveTotal(int totalPhysicalShards) {
        if (totalPhysicalShards <= 0) {
            throw new IllegalArgumentException("totalPhysicalShards must be > 0, got " + totalPhysicalShards);
        }
    }
}
