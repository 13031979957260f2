package de.alive.mailsync.domain;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Queued request to forward a synced message to other recipients.
 */
public record ForwardRequest(
        long id,
        long accountId,
        long uid,
        List<String> recipients,
        @Nullable String note,
        ForwardStatus status,
        @Nullable String result
) {

    public ForwardRequest {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
    }

    public static ForwardRequest pending(long id, long accountId, long uid, String recipients, @Nullable String note) {
        return new ForwardRequest(id, accountId, uid, OutgoingMessage.parseRecipients(recipients), note,
                ForwardStatus.PENDING, null);
    }

    public ForwardRequest withStatus(ForwardStatus newStatus, @Nullable String newResult) {
        return new ForwardRequest(id, accountId, uid, recipients, note, newStatus, newResult);
    }
}
