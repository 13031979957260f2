package de.alive.mailsync.domain;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * Envelope-level view of a message as returned by a listing.
 */
public record ListedMessage(
        long uid,
        String subject,
        String from,
        @Nullable Instant date,
        boolean hasAttachment
) {
}
