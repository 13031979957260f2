package de.alive.mailsync.infrastructure;

import de.alive.mailsync.domain.ListedMessage;
import de.alive.mailsync.domain.ProtocolState;
import de.alive.mailsync.exception.MailOperationException;
import org.jetbrains.annotations.NotNull;

import javax.mail.internet.MimeMessage;
import java.util.List;

/**
 * One authenticated, INBOX-selected protocol connection bound to a single account.
 * Never used by two operations at once.
 */
public interface MailSession {

    long accountId();

    @NotNull ProtocolState state();

    /**
     * Local check only: transport connected and the folder still selected.
     */
    boolean isUsable();

    /**
     * Round trip to the server (NOOP).
     */
    void probe() throws MailOperationException;

    /**
     * Messages with a UID greater than {@code afterUid}, oldest first, or the newest {@code limit}
     * messages when {@code afterUid} is not positive.
     */
    @NotNull List<ListedMessage> listSince(long afterUid, int limit) throws MailOperationException;

    /**
     * Full message, detached from the folder so it stays readable after the session is gone.
     */
    @NotNull MimeMessage fetchMessage(long uid) throws MailOperationException;

    void close();
}
