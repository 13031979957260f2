package de.alive.mailsync.service;

import de.alive.mailsync.domain.AttachmentData;
import de.alive.mailsync.domain.MessageFingerprint;
import de.alive.mailsync.domain.StoredAttachment;
import de.alive.mailsync.storage.AttachmentExpander;
import de.alive.mailsync.storage.AttachmentUploader;
import de.alive.mailsync.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AttachmentStorageServiceTest {

    private static final MessageFingerprint FINGERPRINT = new MessageFingerprint(1L, 42L);
    private static final Duration BACKOFF = Duration.ofMillis(10);

    @Mock
    private AttachmentUploader uploader;

    private RecordingSleeper sleeper;
    private AttachmentData report;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        report = new AttachmentData("report.pdf", "%PDF".getBytes(StandardCharsets.US_ASCII), "application/pdf");
    }

    @Test
    @DisplayName("Upload succeeds after a retry")
    void testRetryThenSuccess() throws Exception {
        when(uploader.uploadBytes(eq("report.pdf"), any(), eq("application/pdf")))
                .thenThrow(new IOException("connection reset"))
                .thenReturn("file:/tmp/report.pdf");
        AttachmentStorageService service = new AttachmentStorageService(uploader, AttachmentExpander.IDENTITY, 3,
                BACKOFF, sleeper);

        List<StoredAttachment> stored = service.store(FINGERPRINT, List.of(report));

        assertThat(stored).singleElement().satisfies(attachment -> {
            assertThat(attachment.url()).isEqualTo("file:/tmp/report.pdf");
            assertThat(attachment.size()).isEqualTo(4);
            assertThat(attachment.fingerprint()).isEqualTo(FINGERPRINT);
        });
        assertThat(sleeper.getSleeps()).containsExactly(BACKOFF);
    }

    @Test
    @DisplayName("Attachment is kept with an empty URL once all attempts fail")
    void testGivesUpWithEmptyUrl() throws Exception {
        when(uploader.uploadBytes(anyString(), any(), anyString())).thenThrow(new IOException("bucket unavailable"));
        AttachmentStorageService service = new AttachmentStorageService(uploader, AttachmentExpander.IDENTITY, 3,
                BACKOFF, sleeper);

        List<StoredAttachment> stored = service.store(FINGERPRINT, List.of(report));

        assertThat(stored).singleElement().satisfies(attachment -> {
            assertThat(attachment.url()).isEmpty();
            assertThat(attachment.isUploaded()).isFalse();
        });
        verify(uploader, times(3)).uploadBytes(anyString(), any(), anyString());
        assertThat(sleeper.getSleeps()).containsExactly(BACKOFF, BACKOFF.multipliedBy(2));
    }

    @Test
    @DisplayName("Expanded attachments are stored as separate files")
    void testExpanderSplitsAttachment() throws Exception {
        AttachmentExpander unzip = attachment -> List.of(
                new AttachmentData("a.txt", new byte[]{1}, "text/plain"),
                new AttachmentData("b.txt", new byte[]{2, 3}, "text/plain"));
        when(uploader.uploadBytes(anyString(), any(), anyString()))
                .thenAnswer(invocation -> "file:/tmp/" + invocation.getArgument(0));
        AttachmentStorageService service = new AttachmentStorageService(uploader, unzip, 1, BACKOFF, sleeper);

        List<StoredAttachment> stored = service.store(FINGERPRINT, List.of(report));

        assertThat(stored).extracting(StoredAttachment::filename).containsExactly("a.txt", "b.txt");
        assertThat(stored).extracting(StoredAttachment::size).containsExactly(1L, 2L);
        assertThat(sleeper.getSleeps()).isEmpty();
    }

    @Test
    @DisplayName("Failing expander falls back to storing the attachment as received")
    void testExpanderFailureStoresOriginal() throws Exception {
        AttachmentExpander corrupt = attachment -> {
            throw new IllegalStateException("corrupt zip");
        };
        when(uploader.uploadBytes(eq("report.pdf"), any(), eq("application/pdf"))).thenReturn("file:/tmp/report.pdf");
        AttachmentStorageService service = new AttachmentStorageService(uploader, corrupt, 3, BACKOFF, sleeper);

        List<StoredAttachment> stored = service.store(FINGERPRINT, List.of(report));

        assertThat(stored).singleElement().satisfies(attachment -> {
            assertThat(attachment.filename()).isEqualTo("report.pdf");
            assertThat(attachment.isUploaded()).isTrue();
        });
    }
}
