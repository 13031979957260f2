package de.alive.mailsync.domain;

import java.util.List;

/**
 * Content and attachments collected for one message, persisted together with the DONE transition.
 */
public record ContentSyncResult(MessageContent content, List<StoredAttachment> attachments) {

    public ContentSyncResult {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public MessageFingerprint fingerprint() {
        return content.fingerprint();
    }
}
