package de.alive.mailsync.infrastructure;

import com.sun.mail.imap.IMAPFolder;
import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.domain.MailServerSettings;
import de.alive.mailsync.exception.MailOperationException;
import de.alive.mailsync.service.config.SyncConfiguration;
import de.alive.mailsync.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import javax.mail.MessagingException;
import javax.mail.Session;
import javax.mail.Store;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Opens IMAP sessions: connect (optionally upgrading with STARTTLS), authenticate, select INBOX.
 */
@Slf4j
public class ImapSessionFactory implements MailSessionFactory {

    private final SyncConfiguration configuration;
    private final MessageContentExtractor extractor;
    private final AtomicInteger sessionIdGenerator = new AtomicInteger(0);

    public ImapSessionFactory(SyncConfiguration configuration, MessageContentExtractor extractor) {
        this.configuration = configuration;
        this.extractor = extractor;
    }

    @NotNull
    @Override
    public MailSession open(@NotNull MailAccount account) throws MailOperationException {
        MailServerSettings server = account.server();
        Session session = Session.getInstance(createImapProperties(server));
        Store store = null;
        try {
            store = session.getStore(server.imapProtocol());
            store.connect(server.imapHost(), server.imapPort(), account.address(), account.password());
            IMAPFolder inbox = ImapMailSession.openInbox(store);

            int sessionId = sessionIdGenerator.incrementAndGet();
            log.info("{} IMAP session {} opened for {}", LogUtils.SUCCESS_EMOJI, sessionId,
                    LogUtils.maskEmail(account.address()));
            return new ImapMailSession(account.id(), sessionId, store, inbox, extractor);
        } catch (MessagingException | RuntimeException e) {
            closeQuietly(store);
            MailOperationException translated = MailErrorTranslator.translate(
                    "IMAP connect to " + server.imapHost() + ":" + server.imapPort(), e);
            log.warn("{} Opening session for {} failed ({}): {}", LogUtils.WARNING_EMOJI,
                    LogUtils.maskEmail(account.address()), translated.getReason(), e.getMessage());
            throw translated;
        }
    }

    Properties createImapProperties(MailServerSettings server) {
        String protocol = server.imapProtocol();
        String timeout = String.valueOf(configuration.getSocketTimeout().toMillis());
        String prefix = "mail." + protocol + ".";

        Properties props = new Properties();
        props.setProperty("mail.store.protocol", protocol);
        props.setProperty(prefix + "host", server.imapHost());
        props.setProperty(prefix + "port", String.valueOf(server.imapPort()));

        if (server.implicitTls()) {
            props.setProperty(prefix + "ssl.enable", "true");
            props.setProperty(prefix + "ssl.checkserveridentity", "true");
        } else if (server.startTls()) {
            props.setProperty(prefix + "starttls.enable", "true");
            props.setProperty(prefix + "starttls.required", "true");
        }

        // the pool owns reuse, JavaMail keeps one connection per store
        props.setProperty(prefix + "connectionpoolsize", "1");
        props.setProperty(prefix + "connectiontimeout", timeout);
        props.setProperty(prefix + "timeout", timeout);
        props.setProperty(prefix + "writetimeout", timeout);

        props.setProperty(prefix + "peek", "true");
        props.setProperty(prefix + "fetchsize", "8192");
        props.setProperty(prefix + "partialfetch", "false");
        props.setProperty(prefix + "closefoldersonstorefailure", "true");
        return props;
    }

    private static void closeQuietly(Store store) {
        if (store == null) return;
        try {
            store.close();
        } catch (MessagingException e) {
            log.debug("{} Error closing half-open store: {}", LogUtils.WARNING_EMOJI, e.getMessage());
        }
    }
}
