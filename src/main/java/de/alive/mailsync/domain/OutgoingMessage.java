package de.alive.mailsync.domain;

import java.util.Arrays;
import java.util.List;

public record OutgoingMessage(List<String> recipients, String subject, String body, boolean html) {

    public OutgoingMessage {
        if (recipients == null || recipients.isEmpty()) {
            throw new IllegalArgumentException("At least one recipient is required");
        }
        recipients = List.copyOf(recipients);
        subject = subject == null ? "" : subject;
        body = body == null ? "" : body;
    }

    /**
     * Accepts the comma separated recipient list the forward queue stores.
     */
    public static List<String> parseRecipients(String commaSeparated) {
        if (commaSeparated == null) return List.of();
        return Arrays.stream(commaSeparated.split(","))
                .map(String::trim)
                .filter(address -> !address.isEmpty())
                .toList();
    }
}
