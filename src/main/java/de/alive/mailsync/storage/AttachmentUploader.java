package de.alive.mailsync.storage;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;

/**
 * Object storage for attachment bytes.
 */
public interface AttachmentUploader {

    /**
     * @return URL under which the stored object can be retrieved
     */
    @NotNull String uploadBytes(@NotNull String filename, byte[] content, @NotNull String mimeType)
            throws IOException;
}
