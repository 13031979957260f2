package de.alive.mailsync.domain;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * MIME structure as a tagged tree. Only MULTIPART nodes have children.
 */
public record MessagePart(Kind kind, @Nullable String text, @Nullable AttachmentData attachment, List<MessagePart> children) {

    public static final int MAX_DEPTH = 10;

    public enum Kind {
        TEXT,
        HTML,
        MULTIPART,
        ATTACHMENT
    }

    public MessagePart {
        children = children == null ? List.of() : List.copyOf(children);
        if (kind != Kind.MULTIPART && !children.isEmpty()) {
            throw new IllegalArgumentException(kind + " part cannot have children");
        }
    }

    public static MessagePart text(String text) {
        return new MessagePart(Kind.TEXT, text, null, List.of());
    }

    public static MessagePart html(String html) {
        return new MessagePart(Kind.HTML, html, null, List.of());
    }

    public static MessagePart attachment(AttachmentData attachment) {
        return new MessagePart(Kind.ATTACHMENT, null, attachment, List.of());
    }

    public static MessagePart multipart(List<MessagePart> children) {
        return new MessagePart(Kind.MULTIPART, null, null, children);
    }

    /**
     * Visits leaves depth first. Subtrees below {@link #MAX_DEPTH} are not visited.
     */
    public void forEachLeaf(Consumer<MessagePart> visitor) {
        visit(this, 0, visitor);
    }

    private static void visit(MessagePart part, int depth, Consumer<MessagePart> visitor) {
        if (depth > MAX_DEPTH) return;
        if (part.kind == Kind.MULTIPART) {
            for (MessagePart child : part.children) {
                visit(child, depth + 1, visitor);
            }
        } else {
            visitor.accept(part);
        }
    }

    public ExtractedContent flatten() {
        StringBuilder body = new StringBuilder();
        StringBuilder html = new StringBuilder();
        List<AttachmentData> attachments = new ArrayList<>();

        forEachLeaf(leaf -> {
            switch (leaf.kind) {
                case TEXT -> body.append(leaf.text);
                case HTML -> html.append(leaf.text.replace("\r\n", " ").replace("\n", " "));
                case ATTACHMENT -> attachments.add(leaf.attachment);
                default -> {
                }
            }
        });
        return new ExtractedContent(body.toString(), html.toString(), attachments);
    }
}
