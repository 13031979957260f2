package de.alive.mailsync.infrastructure;

import de.alive.mailsync.domain.AttachmentData;
import de.alive.mailsync.domain.MessagePart;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.Nullable;

import javax.mail.BodyPart;
import javax.mail.MessagingException;
import javax.mail.Multipart;
import javax.mail.Part;
import javax.mail.internet.ContentType;
import javax.mail.internet.MimeUtility;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a JavaMail part hierarchy into a {@link MessagePart} tree.
 */
@Slf4j
public class MimePartTreeBuilder {

    public MessagePart build(Part root) throws MessagingException, IOException {
        MessagePart tree = build(root, 0);
        return tree != null ? tree : MessagePart.multipart(List.of());
    }

    @Nullable
    private MessagePart build(Part part, int depth) throws MessagingException, IOException {
        if (depth > MessagePart.MAX_DEPTH) {
            log.debug("Skipping MIME subtree deeper than {}", MessagePart.MAX_DEPTH);
            return null;
        }

        if (isAttachment(part)) {
            return MessagePart.attachment(readAttachment(part));
        }

        if (part.isMimeType("multipart/*")) {
            Multipart multipart = asMultipart(part);
            List<MessagePart> children = new ArrayList<>();
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart child = multipart.getBodyPart(i);
                MessagePart built = build(child, depth + 1);
                if (built != null) {
                    children.add(built);
                }
            }
            return MessagePart.multipart(children);
        }

        if (part.isMimeType("message/rfc822") && part.getContent() instanceof Part embedded) {
            MessagePart nested = build(embedded, depth + 1);
            return nested == null ? null : MessagePart.multipart(List.of(nested));
        }

        if (part.isMimeType("text/plain")) {
            return MessagePart.text(String.valueOf(part.getContent()));
        }
        if (part.isMimeType("text/html")) {
            return MessagePart.html(String.valueOf(part.getContent()));
        }

        // unknown leaf without a filename carries nothing worth keeping
        return null;
    }

    /**
     * Explicit attachment disposition, or inline disposition with a filename.
     */
    public static boolean isAttachment(Part part) throws MessagingException {
        String disposition = part.getDisposition();
        if (disposition == null) {
            return part.getFileName() != null && !part.isMimeType("multipart/*") && !part.isMimeType("text/*");
        }
        if (Part.ATTACHMENT.equalsIgnoreCase(disposition)) {
            return true;
        }
        return Part.INLINE.equalsIgnoreCase(disposition) && part.getFileName() != null;
    }

    /**
     * Walks the structure without downloading bodies, using only BODYSTRUCTURE information.
     */
    public static boolean containsAttachment(Part part) throws MessagingException, IOException {
        return containsAttachment(part, 0);
    }

    private static boolean containsAttachment(Part part, int depth) throws MessagingException, IOException {
        if (depth > MessagePart.MAX_DEPTH) return false;
        if (isAttachment(part)) return true;
        if (!part.isMimeType("multipart/*")) return false;

        Multipart multipart = asMultipart(part);
        for (int i = 0; i < multipart.getCount(); i++) {
            if (containsAttachment(multipart.getBodyPart(i), depth + 1)) {
                return true;
            }
        }
        return false;
    }

    private static Multipart asMultipart(Part part) throws MessagingException, IOException {
        Object content = part.getContent();
        if (content instanceof Multipart multipart) {
            return multipart;
        }
        throw new MessagingException("Declared multipart but content is " + content.getClass().getSimpleName());
    }

    static AttachmentData readAttachment(Part part) throws MessagingException, IOException {
        byte[] content;
        try (InputStream in = part.getInputStream()) {
            content = in.readAllBytes();
        }
        return new AttachmentData(decodeFilename(part.getFileName()), content, baseType(part.getContentType()));
    }

    static String decodeFilename(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return "attachment.bin";
        }
        String decoded;
        try {
            decoded = MimeUtility.decodeText(raw);
        } catch (UnsupportedEncodingException e) {
            log.debug("Keeping undecodable attachment filename '{}': {}", raw, e.getMessage());
            decoded = raw;
        }
        return decoded.isBlank() ? "attachment.bin" : decoded.trim();
    }

    static String baseType(@Nullable String contentType) {
        if (contentType == null) return "application/octet-stream";
        try {
            return new ContentType(contentType).getBaseType().toLowerCase(Locale.ROOT);
        } catch (javax.mail.internet.ParseException e) {
            int semicolon = contentType.indexOf(';');
            return (semicolon > 0 ? contentType.substring(0, semicolon) : contentType).trim().toLowerCase(Locale.ROOT);
        }
    }
}
