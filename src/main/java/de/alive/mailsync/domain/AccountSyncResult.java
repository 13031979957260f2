package de.alive.mailsync.domain;

import lombok.Builder;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of one worker run for one account.
 *
 * @param failed   messages moved to PERMANENT_FAILURE or DELETED
 * @param requeued messages handed back to PENDING after a transient error or a deadline stop
 */
@Builder(toBuilder = true)
public record AccountSyncResult(
        long accountId,
        int listed,
        int succeeded,
        int failed,
        int requeued,
        boolean stoppedByDeadline,
        @Nullable String error
) {

    public static AccountSyncResult failure(long accountId, String error) {
        return AccountSyncResult.builder().accountId(accountId).error(error).build();
    }

    public boolean isSuccess() {
        return error == null;
    }
}
