package de.alive.mailsync.domain;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

public record FetchedMessage(
        long uid,
        String subject,
        String from,
        String to,
        @Nullable Instant date,
        ExtractedContent content
) {

    public MessageContent toContent(MessageFingerprint fingerprint) {
        return new MessageContent(fingerprint, subject, from, to, date, content.body(), content.htmlBody());
    }
}
