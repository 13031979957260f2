package de.alive.mailsync.infrastructure;

import de.alive.mailsync.domain.AttachmentData;
import de.alive.mailsync.domain.ExtractedContent;
import de.alive.mailsync.domain.FetchedMessage;
import de.alive.mailsync.domain.ListedMessage;
import de.alive.mailsync.domain.MessagePart;
import de.alive.mailsync.exception.MailOperationException;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import javax.mail.Address;
import javax.mail.Message;
import javax.mail.MessagingException;
import javax.mail.internet.InternetAddress;
import javax.mail.internet.MimeMessage;
import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Date;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reads headers and bodies out of messages that have already been fetched.
 * <p>
 * Input messages are detached copies, so any failure here is a property of the message itself
 * and is reported as {@link MailOperationException.Reason#MALFORMED_MESSAGE}.
 */
@Slf4j
public class MessageContentExtractor {

    private static final int MAX_SUBJECT_LENGTH = 1000;
    private static final int MAX_ADDRESS_LENGTH = 500;

    private final MimePartTreeBuilder treeBuilder;

    public MessageContentExtractor() {
        this(new MimePartTreeBuilder());
    }

    public MessageContentExtractor(MimePartTreeBuilder treeBuilder) {
        this.treeBuilder = treeBuilder;
    }

    @NotNull
    public FetchedMessage extract(long uid, @NotNull MimeMessage message) throws MailOperationException {
        try {
            MessagePart tree = treeBuilder.build(message);
            ExtractedContent content = tree.flatten();
            return new FetchedMessage(uid, subject(message), sender(message), recipients(message), date(message), content);
        } catch (MessagingException | IOException | RuntimeException e) {
            log.debug("Content extraction failed for uid {}: {}", uid, e.getMessage());
            throw new MailOperationException("Cannot parse message " + uid + ": " + e.getMessage(),
                    MailOperationException.Reason.MALFORMED_MESSAGE, e);
        }
    }

    @NotNull
    public Optional<AttachmentData> findAttachment(long uid, @NotNull MimeMessage message, @NotNull String filename)
            throws MailOperationException {
        return extract(uid, message).content().attachments().stream()
                .filter(attachment -> attachment.filename().equals(filename))
                .findFirst();
    }

    /**
     * Envelope view used by listings. Header problems degrade to empty values instead of failing the listing.
     */
    @NotNull
    public ListedMessage toListed(long uid, @NotNull Message message) {
        boolean hasAttachment = false;
        try {
            hasAttachment = MimePartTreeBuilder.containsAttachment(message);
        } catch (MessagingException | IOException e) {
            log.debug("Attachment detection failed for uid {}: {}", uid, e.getMessage());
        }
        return new ListedMessage(uid, safe(() -> subject(message)), safe(() -> sender(message)),
                safeDate(message), hasAttachment);
    }

    private static String subject(Message message) throws MessagingException {
        String subject = message.getSubject();
        if (subject == null) return "";
        subject = subject.trim();
        return subject.length() > MAX_SUBJECT_LENGTH ? subject.substring(0, MAX_SUBJECT_LENGTH) + "..." : subject;
    }

    private static String sender(Message message) throws MessagingException {
        Address[] from = message.getFrom();
        if (from == null || from.length == 0) return "";
        return truncate(format(from[0]));
    }

    private static String recipients(Message message) throws MessagingException {
        Address[] to = message.getRecipients(Message.RecipientType.TO);
        if (to == null) return "";
        return truncate(Arrays.stream(to).map(MessageContentExtractor::format).collect(Collectors.joining(", ")));
    }

    @Nullable
    private static Instant date(Message message) throws MessagingException {
        Date sent = message.getSentDate();
        if (sent == null) sent = message.getReceivedDate();
        return sent == null ? null : sent.toInstant();
    }

    private static String format(Address address) {
        if (address instanceof InternetAddress internetAddress) {
            return internetAddress.toUnicodeString();
        }
        return address.toString();
    }

    private static String truncate(String value) {
        return value.length() > MAX_ADDRESS_LENGTH ? value.substring(0, MAX_ADDRESS_LENGTH) + "..." : value;
    }

    @Nullable
    private static Instant safeDate(Message message) {
        try {
            return date(message);
        } catch (MessagingException e) {
            log.debug("Unreadable date header: {}", e.getMessage());
            return null;
        }
    }

    private static String safe(HeaderReader reader) {
        try {
            return reader.read();
        } catch (MessagingException e) {
            log.debug("Unreadable header: {}", e.getMessage());
            return "";
        }
    }

    @FunctionalInterface
    private interface HeaderReader {
        String read() throws MessagingException;
    }
}
