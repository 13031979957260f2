package de.alive.mailsync.storage;

import de.alive.mailsync.domain.AttachmentData;

import java.util.List;

/**
 * Hook for unpacking attachments (archives, for example) into the files that are actually stored.
 */
@FunctionalInterface
public interface AttachmentExpander {

    AttachmentExpander IDENTITY = List::of;

    List<AttachmentData> expand(AttachmentData attachment);
}
