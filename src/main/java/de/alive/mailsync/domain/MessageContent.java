package de.alive.mailsync.domain;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

public record MessageContent(
        MessageFingerprint fingerprint,
        String subject,
        String from,
        String to,
        @Nullable Instant date,
        String body,
        String htmlBody
) {
}
