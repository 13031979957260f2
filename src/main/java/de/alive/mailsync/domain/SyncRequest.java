package de.alive.mailsync.domain;

import org.jetbrains.annotations.Nullable;

/**
 * @param shard     only accounts of this shard are claimed, all shards when {@code null}
 * @param syncLimit list and content batch size per account, the configured default when not positive
 */
public record SyncRequest(@Nullable Integer shard, int syncLimit) {

    public static SyncRequest allShards(int syncLimit) {
        return new SyncRequest(null, syncLimit);
    }
}
