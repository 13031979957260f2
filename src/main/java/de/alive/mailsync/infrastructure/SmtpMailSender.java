package de.alive.mailsync.infrastructure;

import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.domain.MailServerSettings;
import de.alive.mailsync.domain.OutgoingMessage;
import de.alive.mailsync.exception.MailOperationException;
import de.alive.mailsync.service.config.SyncConfiguration;
import de.alive.mailsync.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import javax.activation.DataHandler;
import javax.mail.Message;
import javax.mail.MessagingException;
import javax.mail.Session;
import javax.mail.Transport;
import javax.mail.internet.InternetAddress;
import javax.mail.internet.MimeBodyPart;
import javax.mail.internet.MimeMessage;
import javax.mail.internet.MimeMultipart;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.List;
import java.util.Properties;

/**
 * SMTP submission with STARTTLS when the server offers it and authenticated login.
 */
@Slf4j
public class SmtpMailSender implements MailSender {

    private static final int SMTPS_PORT = 465;

    private final SyncConfiguration configuration;

    public SmtpMailSender(SyncConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public void send(@NotNull MailAccount account, @NotNull OutgoingMessage message) throws MailOperationException {
        Session session = createSession(account.server());
        try {
            MimeMessage mime = new MimeMessage(session);
            mime.setFrom(new InternetAddress(account.address()));
            mime.setRecipients(Message.RecipientType.TO, toAddresses(message.recipients()));
            mime.setSubject(message.subject(), StandardCharsets.UTF_8.name());
            if (message.html()) {
                mime.setContent(message.body(), "text/html; charset=UTF-8");
            } else {
                mime.setText(message.body(), StandardCharsets.UTF_8.name());
            }
            mime.setSentDate(new Date());
            transmit(account, session, mime);
        } catch (MessagingException | RuntimeException e) {
            throw MailErrorTranslator.translate("SMTP send", e);
        }
    }

    @Override
    public void forward(@NotNull MailAccount account, @NotNull MimeMessage original, @NotNull List<String> recipients,
                        @Nullable String note) throws MailOperationException {
        Session session = createSession(account.server());
        try {
            MimeMessage mime = new MimeMessage(session);
            mime.setFrom(new InternetAddress(account.address()));
            mime.setRecipients(Message.RecipientType.TO, toAddresses(recipients));
            String subject = original.getSubject();
            mime.setSubject("Fwd: " + (subject == null ? "" : subject), StandardCharsets.UTF_8.name());

            MimeBodyPart notePart = new MimeBodyPart();
            notePart.setText(note == null ? "" : note, StandardCharsets.UTF_8.name());

            MimeBodyPart originalPart = new MimeBodyPart();
            originalPart.setDataHandler(new DataHandler(original, "message/rfc822"));
            originalPart.setDisposition(MimeBodyPart.INLINE);

            MimeMultipart multipart = new MimeMultipart("mixed");
            multipart.addBodyPart(notePart);
            multipart.addBodyPart(originalPart);
            mime.setContent(multipart);
            mime.setSentDate(new Date());
            transmit(account, session, mime);
        } catch (MessagingException | RuntimeException e) {
            throw MailErrorTranslator.translate("SMTP forward", e);
        }
    }

    private void transmit(MailAccount account, Session session, MimeMessage mime) throws MessagingException {
        MailServerSettings server = account.server();
        mime.saveChanges();
        try (Transport transport = session.getTransport(transportProtocol(server))) {
            transport.connect(server.smtpHost(), server.smtpPort(), account.address(), account.password());
            transport.sendMessage(mime, mime.getAllRecipients());
        }
        log.info("{} Message sent from {} to {} recipients", LogUtils.EMAIL_EMOJI,
                LogUtils.maskEmail(account.address()), mime.getAllRecipients().length);
    }

    private static InternetAddress[] toAddresses(List<String> recipients) throws MessagingException {
        InternetAddress[] addresses = new InternetAddress[recipients.size()];
        for (int i = 0; i < recipients.size(); i++) {
            addresses[i] = new InternetAddress(recipients.get(i), true);
        }
        return addresses;
    }

    private static String transportProtocol(MailServerSettings server) {
        return server.smtpPort() == SMTPS_PORT ? "smtps" : "smtp";
    }

    Session createSession(MailServerSettings server) {
        if (!server.canSend()) {
            throw new IllegalArgumentException("No SMTP server configured for " + server.imapHost());
        }
        String protocol = transportProtocol(server);
        String prefix = "mail." + protocol + ".";
        String timeout = String.valueOf(configuration.getSocketTimeout().toMillis());

        Properties props = new Properties();
        props.setProperty("mail.transport.protocol", protocol);
        props.setProperty(prefix + "host", server.smtpHost());
        props.setProperty(prefix + "port", String.valueOf(server.smtpPort()));
        props.setProperty(prefix + "auth", "true");
        props.setProperty(prefix + "auth.mechanisms", "PLAIN LOGIN");
        if ("smtp".equals(protocol)) {
            props.setProperty(prefix + "starttls.enable", String.valueOf(server.startTls()));
        } else {
            props.setProperty(prefix + "ssl.enable", "true");
        }
        props.setProperty(prefix + "connectiontimeout", timeout);
        props.setProperty(prefix + "timeout", timeout);
        props.setProperty(prefix + "writetimeout", timeout);
        return Session.getInstance(props);
    }
}
