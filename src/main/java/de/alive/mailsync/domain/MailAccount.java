package de.alive.mailsync.domain;

import de.alive.mailsync.util.LogUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * A remote mailbox together with its scheduling state.
 * <p>
 * {@code lastListSyncTime} doubles as the scheduling cursor: accounts that were never listed
 * come first, then the least recently listed ones.
 */
public record MailAccount(
        long id,
        @NotNull String address,
        @NotNull String password,
        @NotNull MailServerSettings server,
        @Nullable Integer shard,
        boolean active,
        @NotNull ClaimState claimState,
        @Nullable Instant claimedAt,
        @Nullable Instant lastListSyncTime,
        @Nullable Instant lastContentSyncTime
) {

    public MailAccount {
        if (address == null || !address.contains("@")) {
            throw new IllegalArgumentException("Account address must be an email address");
        }
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Account password cannot be empty");
        }
        if (server == null) {
            throw new IllegalArgumentException("Server settings cannot be null");
        }
        if (claimState == null) {
            claimState = ClaimState.IDLE;
        }
    }

    public static MailAccount of(long id, String address, String password, MailServerSettings server) {
        return new MailAccount(id, address, password, server, null, true, ClaimState.IDLE, null, null, null);
    }

    public boolean isClaimed() {
        return claimState == ClaimState.CLAIMED;
    }

    public boolean isSchedulable(@Nullable Integer requestedShard) {
        if (!active || isClaimed()) return false;
        return requestedShard == null || requestedShard.equals(shard);
    }

    public MailAccount withShard(@Nullable Integer newShard) {
        return new MailAccount(id, address, password, server, newShard, active, claimState,
                claimedAt, lastListSyncTime, lastContentSyncTime);
    }

    public MailAccount claimed(Instant now) {
        return new MailAccount(id, address, password, server, shard, active, ClaimState.CLAIMED,
                now, now, lastContentSyncTime);
    }

    public MailAccount released(Instant cursor) {
        return new MailAccount(id, address, password, server, shard, active, ClaimState.IDLE,
                null, cursor, lastContentSyncTime);
    }

    public MailAccount released(Instant listCursor, Instant contentCursor) {
        return new MailAccount(id, address, password, server, shard, active, ClaimState.IDLE,
                null, listCursor, contentCursor);
    }

    public MailAccount withListSyncTime(Instant time) {
        return new MailAccount(id, address, password, server, shard, active, claimState,
                claimedAt, time, lastContentSyncTime);
    }

    public MailAccount withContentSyncTime(Instant time) {
        return new MailAccount(id, address, password, server, shard, active, claimState,
                claimedAt, lastListSyncTime, time);
    }

    @Override
    public String toString() {
        return String.format("MailAccount{id=%d, address=%s, shard=%s, state=%s}",
                id, LogUtils.maskEmail(address), shard, claimState);
    }
}
