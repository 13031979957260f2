package de.alive.mailsync.infrastructure;

import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.domain.OutgoingMessage;
import de.alive.mailsync.exception.MailOperationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import javax.mail.internet.MimeMessage;
import java.util.List;

public interface MailSender {

    void send(@NotNull MailAccount account, @NotNull OutgoingMessage message) throws MailOperationException;

    /**
     * Sends {@code original} as a message/rfc822 attachment below an optional note.
     */
    void forward(@NotNull MailAccount account, @NotNull MimeMessage original, @NotNull List<String> recipients,
                 @Nullable String note) throws MailOperationException;
}
