package de.alive.mailsync.storage;

import de.alive.mailsync.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Stores attachments as files below a base directory and hands out {@code file:} URLs.
 */
@Slf4j
public class LocalDirectoryUploader implements AttachmentUploader {

    private final Path baseDirectory;

    public LocalDirectoryUploader(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    @NotNull
    @Override
    public String uploadBytes(@NotNull String filename, byte[] content, @NotNull String mimeType)
            throws IOException {
        Files.createDirectories(baseDirectory);
        Path target = baseDirectory.resolve(UUID.randomUUID() + "-" + sanitize(filename));
        Files.write(target, content);
        log.debug("{} Stored {} ({} bytes, {}) at {}", LogUtils.UPLOAD_EMOJI, filename, content.length, mimeType, target);
        return target.toUri().toString();
    }

    static String sanitize(String filename) {
        String cleaned = filename.replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_").trim();
        if (cleaned.isEmpty() || cleaned.equals(".") || cleaned.equals("..")) {
            return "attachment.bin";
        }
        return cleaned;
    }
}
