package de.alive.mailsync.domain;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

public record EmailRecord(
        @NotNull MessageFingerprint fingerprint,
        String subject,
        String sender,
        @Nullable Instant date,
        boolean hasAttachment,
        @NotNull MessageStatus status,
        @Nullable String lastError
) {

    public static EmailRecord pending(long accountId, ListedMessage listed) {
        return new EmailRecord(new MessageFingerprint(accountId, listed.uid()), listed.subject(),
                listed.from(), listed.date(), listed.hasAttachment(), MessageStatus.PENDING, null);
    }

    public long uid() {
        return fingerprint.uid();
    }

    public EmailRecord withStatus(MessageStatus newStatus, @Nullable String error) {
        return new EmailRecord(fingerprint, subject, sender, date, hasAttachment, newStatus, error);
    }
}
