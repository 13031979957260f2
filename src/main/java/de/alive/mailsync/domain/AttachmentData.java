package de.alive.mailsync.domain;

import java.util.Arrays;

public record AttachmentData(String filename, byte[] content, String mimeType) {

    public AttachmentData {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Attachment filename cannot be empty");
        }
        content = content == null ? new byte[0] : content;
        mimeType = mimeType == null || mimeType.isBlank() ? "application/octet-stream" : mimeType;
    }

    public long size() {
        return content.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttachmentData other)) return false;
        return filename.equals(other.filename)
                && mimeType.equals(other.mimeType)
                && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * filename.hashCode() + mimeType.hashCode()) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return String.format("AttachmentData{filename='%s', size=%d, mimeType='%s'}", filename, content.length, mimeType);
    }
}
