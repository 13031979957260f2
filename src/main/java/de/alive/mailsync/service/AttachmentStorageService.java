package de.alive.mailsync.service;

import de.alive.mailsync.domain.AttachmentData;
import de.alive.mailsync.domain.MessageFingerprint;
import de.alive.mailsync.domain.StoredAttachment;
import de.alive.mailsync.storage.AttachmentExpander;
import de.alive.mailsync.storage.AttachmentUploader;
import de.alive.mailsync.util.LogUtils;
import de.alive.mailsync.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Uploads extracted attachments. An attachment whose upload keeps failing is still recorded, with an empty URL,
 * so the message itself can complete.
 */
@Slf4j
public class AttachmentStorageService {

    private final AttachmentUploader uploader;
    private final AttachmentExpander expander;
    private final int maxAttempts;
    private final Duration backoff;
    private final Sleeper sleeper;

    public AttachmentStorageService(AttachmentUploader uploader, AttachmentExpander expander, int maxAttempts,
                                    Duration backoff, Sleeper sleeper) {
        this.uploader = uploader;
        this.expander = expander;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    @NotNull
    public List<StoredAttachment> store(@NotNull MessageFingerprint fingerprint, @NotNull List<AttachmentData> attachments) {
        List<StoredAttachment> stored = new ArrayList<>();
        for (AttachmentData attachment : attachments) {
            for (AttachmentData file : expand(fingerprint, attachment)) {
                String url = uploadWithRetry(fingerprint, file);
                stored.add(new StoredAttachment(fingerprint, file.filename(), file.size(), file.mimeType(), url));
            }
        }
        return stored;
    }

    private List<AttachmentData> expand(MessageFingerprint fingerprint, AttachmentData attachment) {
        try {
            return expander.expand(attachment);
        } catch (RuntimeException e) {
            log.warn("{} Cannot expand {} of message {}, storing it as is: {}", LogUtils.WARNING_EMOJI,
                    attachment.filename(), fingerprint, e.getMessage());
            return List.of(attachment);
        }
    }

    private String uploadWithRetry(MessageFingerprint fingerprint, AttachmentData file) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String url = uploader.uploadBytes(file.filename(), file.content(), file.mimeType());
                log.debug("{} Uploaded {} of message {}", LogUtils.UPLOAD_EMOJI, file.filename(), fingerprint);
                return url;
            } catch (IOException | RuntimeException e) {
                log.warn("{} Upload of {} for message {} failed (attempt {}/{}): {}", LogUtils.WARNING_EMOJI,
                        file.filename(), fingerprint, attempt, maxAttempts, e.getMessage());
            }
            if (attempt < maxAttempts && !pause(backoff.multipliedBy(attempt))) {
                break;
            }
        }
        log.error("{} Giving up on upload of {} for message {}, keeping record without URL", LogUtils.ERROR_EMOJI,
                file.filename(), fingerprint);
        return "";
    }

    private boolean pause(Duration delay) {
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} Interrupted during upload backoff", LogUtils.STOP_EMOJI);
            return false;
        }
    }
}
