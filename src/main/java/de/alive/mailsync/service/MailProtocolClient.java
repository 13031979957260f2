package de.alive.mailsync.service;

import de.alive.mailsync.domain.AttachmentData;
import de.alive.mailsync.domain.FetchedMessage;
import de.alive.mailsync.domain.ListedMessage;
import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.domain.OutgoingMessage;
import de.alive.mailsync.exception.MailOperationException;
import de.alive.mailsync.infrastructure.MailRetryEngine;
import de.alive.mailsync.infrastructure.MailSender;
import de.alive.mailsync.infrastructure.MessageContentExtractor;
import de.alive.mailsync.service.config.SyncConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import javax.mail.internet.MimeMessage;
import java.util.List;

/**
 * Mail operations for one account at a time. Every remote call goes through the retry engine.
 */
@Slf4j
public class MailProtocolClient {

    private final MailRetryEngine retryEngine;
    private final MailSender sender;
    private final MessageContentExtractor extractor;
    private final SyncConfiguration configuration;

    public MailProtocolClient(MailRetryEngine retryEngine, MailSender sender, MessageContentExtractor extractor,
                              SyncConfiguration configuration) {
        this.retryEngine = retryEngine;
        this.sender = sender;
        this.extractor = extractor;
        this.configuration = configuration;
    }

    /**
     * @param afterUid highest UID already known, or {@code 0} to list the newest {@code limit} messages
     */
    @NotNull
    public List<ListedMessage> listNewMessages(@NotNull MailAccount account, long afterUid, int limit)
            throws MailOperationException {
        return retryEngine.execute(account, configuration.getReadMaxAttempts(),
                session -> session.listSince(afterUid, limit));
    }

    @NotNull
    public FetchedMessage fetchMessage(@NotNull MailAccount account, long uid) throws MailOperationException {
        MimeMessage message = fetchRaw(account, uid);
        return extractor.extract(uid, message);
    }

    @NotNull
    public AttachmentData fetchAttachment(@NotNull MailAccount account, long uid, @NotNull String filename)
            throws MailOperationException {
        MimeMessage message = fetchRaw(account, uid);
        return extractor.findAttachment(uid, message, filename)
                .orElseThrow(() -> new MailOperationException(
                        "Message " + uid + " has no attachment named " + filename,
                        MailOperationException.Reason.NOT_FOUND));
    }

    public void sendMessage(@NotNull MailAccount account, @NotNull OutgoingMessage message)
            throws MailOperationException {
        retryEngine.executeWithoutSession(account, configuration.getConnectMaxAttempts(), () -> {
            sender.send(account, message);
            return null;
        });
    }

    public void forwardMessage(@NotNull MailAccount account, long uid, @NotNull List<String> recipients,
                               @Nullable String note) throws MailOperationException {
        if (recipients.isEmpty()) {
            throw new MailOperationException("Forward of " + uid + " has no recipients",
                    MailOperationException.Reason.INVALID_ARGUMENT);
        }
        MimeMessage original = fetchRaw(account, uid);
        retryEngine.executeWithoutSession(account, configuration.getConnectMaxAttempts(), () -> {
            sender.forward(account, original, recipients, note);
            return null;
        });
    }

    private MimeMessage fetchRaw(MailAccount account, long uid) throws MailOperationException {
        return retryEngine.execute(account, configuration.getReadMaxAttempts(), session -> session.fetchMessage(uid));
    }
}
