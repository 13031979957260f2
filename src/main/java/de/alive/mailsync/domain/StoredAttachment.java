package de.alive.mailsync.domain;

/**
 * An attachment after upload. An empty {@code url} means every upload attempt failed.
 */
public record StoredAttachment(
        MessageFingerprint fingerprint,
        String filename,
        long size,
        String mimeType,
        String url
) {

    public boolean isUploaded() {
        return url != null && !url.isEmpty();
    }
}
