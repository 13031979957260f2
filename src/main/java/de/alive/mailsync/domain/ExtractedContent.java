package de.alive.mailsync.domain;

import java.util.List;

public record ExtractedContent(String body, String htmlBody, List<AttachmentData> attachments) {

    public ExtractedContent {
        body = body == null ? "" : body;
        htmlBody = htmlBody == null ? "" : htmlBody;
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public boolean hasAttachments() {
        return !attachments.isEmpty();
    }
}
