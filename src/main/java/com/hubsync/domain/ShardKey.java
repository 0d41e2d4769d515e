package com.hubsync.domain;

/**
 * Static partition of identities. {@code totalShards == 0} means unsharded: key "all", owns every fid.
 * Otherwise the shard owns fid iff {@code fid mod totalShards == shardIndex}.
 */
public record ShardKey(int totalShards, int shardIndex) {

    public static final String UNSHARDED = "all";

    public ShardKey {
        if (totalShards < 0) {
            throw new IllegalArgumentException("totalShards must be >= 0: " + totalShards);
        }
        if (totalShards > 0 && (shardIndex < 0 || shardIndex >= totalShards)) {
            throw new IllegalArgumentException("shardIndex " + shardIndex + " out of range for " + totalShards + " shards");
        }
    }

    public static ShardKey unsharded() {
        return new ShardKey(0, 0);
    }

    public boolean isUnsharded() {
        return totalShards == 0;
    }

    public boolean owns(long fid) {
        return isUnsharded() || Math.floorMod(fid, (long) totalShards) == shardIndex;
    }

    public boolean owns(HubEvent event) {
        return owns(event.fid());
    }

    /** Stream key for this shard. */
    public String key() {
        return isUnsharded() ? UNSHARDED : Integer.toString(shardIndex);
    }

    @Override
    public String toString() {
        return key();
    }
}
