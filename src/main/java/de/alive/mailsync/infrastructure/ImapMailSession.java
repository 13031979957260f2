package de.alive.mailsync.infrastructure;

import com.sun.mail.imap.IMAPFolder;
import de.alive.mailsync.domain.ListedMessage;
import de.alive.mailsync.domain.ProtocolState;
import de.alive.mailsync.exception.MailOperationException;
import de.alive.mailsync.util.LogUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import javax.mail.FetchProfile;
import javax.mail.Flags;
import javax.mail.Folder;
import javax.mail.Message;
import javax.mail.MessagingException;
import javax.mail.Store;
import javax.mail.UIDFolder;
import javax.mail.internet.MimeMessage;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class ImapMailSession implements MailSession {

    private final long accountId;
    @Getter
    private final int sessionId;
    private final Store store;
    private final IMAPFolder inbox;
    private final MessageContentExtractor extractor;

    public ImapMailSession(long accountId, int sessionId, Store store, IMAPFolder inbox, MessageContentExtractor extractor) {
        this.accountId = accountId;
        this.sessionId = sessionId;
        this.store = store;
        this.inbox = inbox;
        this.extractor = extractor;
    }

    @Override
    public long accountId() {
        return accountId;
    }

    @NotNull
    @Override
    public ProtocolState state() {
        try {
            if (store == null || !store.isConnected()) return ProtocolState.DISCONNECTED;
            return inbox.isOpen() ? ProtocolState.FOLDER_SELECTED : ProtocolState.AUTHENTICATED;
        } catch (RuntimeException e) {
            log.debug("State check failed for session {}: {}", sessionId, e.getMessage());
            return ProtocolState.DISCONNECTED;
        }
    }

    @Override
    public boolean isUsable() {
        return state() == ProtocolState.FOLDER_SELECTED;
    }

    @Override
    public void probe() throws MailOperationException {
        try {
            inbox.doCommand(protocol -> {
                protocol.noop();
                return null;
            });
        } catch (MessagingException | RuntimeException e) {
            throw MailErrorTranslator.translate("NOOP", e);
        }
    }

    @NotNull
    @Override
    public List<ListedMessage> listSince(long afterUid, int limit) throws MailOperationException {
        if (limit <= 0) {
            throw new MailOperationException("List limit must be positive: " + limit,
                    MailOperationException.Reason.INVALID_ARGUMENT);
        }
        try {
            List<Message> candidates = afterUid > 0 ? messagesAfter(afterUid, limit) : newestMessages(limit);
            if (candidates.isEmpty()) {
                return List.of();
            }

            Message[] batch = candidates.toArray(new Message[0]);
            inbox.fetch(batch, listingProfile());

            List<ListedMessage> listed = new ArrayList<>(batch.length);
            for (Message message : batch) {
                if (message.isExpunged() || message.isSet(Flags.Flag.DELETED)) {
                    continue;
                }
                listed.add(extractor.toListed(inbox.getUID(message), message));
            }
            log.debug("{} Session {} listed {} messages after uid {}",
                    LogUtils.SEARCH_EMOJI, sessionId, listed.size(), afterUid);
            return listed;
        } catch (MessagingException | RuntimeException e) {
            throw MailErrorTranslator.translate("UID listing", e);
        }
    }

    private List<Message> messagesAfter(long afterUid, int limit) throws MessagingException {
        Message[] range = inbox.getMessagesByUID(afterUid + 1, UIDFolder.LASTUID);
        List<Message> newer = new ArrayList<>();
        // "n:*" always includes the highest UID, even when it is below n
        for (Message message : range) {
            if (message != null && inbox.getUID(message) > afterUid) {
                newer.add(message);
            }
        }
        sortByUid(newer);
        return newer.size() > limit ? newer.subList(0, limit) : newer;
    }

    private List<Message> newestMessages(int limit) throws MessagingException {
        int count = inbox.getMessageCount();
        if (count <= 0) {
            return List.of();
        }
        int start = Math.max(1, count - limit + 1);
        Message[] range = inbox.getMessages(start, count);

        FetchProfile uidOnly = new FetchProfile();
        uidOnly.add(UIDFolder.FetchProfileItem.UID);
        inbox.fetch(range, uidOnly);

        List<Message> newest = new ArrayList<>(Arrays.asList(range));
        sortByUid(newest);
        return newest;
    }

    private void sortByUid(List<Message> messages) throws MessagingException {
        Map<Message, Long> uids = new IdentityHashMap<>();
        for (Message message : messages) {
            uids.put(message, inbox.getUID(message));
        }
        messages.sort(Comparator.comparingLong(uids::get));
    }

    private static FetchProfile listingProfile() {
        FetchProfile profile = new FetchProfile();
        profile.add(FetchProfile.Item.ENVELOPE);
        profile.add(FetchProfile.Item.FLAGS);
        profile.add(FetchProfile.Item.CONTENT_INFO);
        profile.add(UIDFolder.FetchProfileItem.UID);
        return profile;
    }

    @NotNull
    @Override
    public MimeMessage fetchMessage(long uid) throws MailOperationException {
        try {
            Message message = inbox.getMessageByUID(uid);
            if (message == null) {
                throw new MailOperationException("No message with uid " + uid, MailOperationException.Reason.NOT_FOUND);
            }
            if (message.isExpunged()) {
                throw new MailOperationException("Message " + uid + " was expunged", MailOperationException.Reason.EXPUNGED);
            }
            return new MimeMessage((MimeMessage) message);
        } catch (MessagingException | RuntimeException e) {
            throw MailErrorTranslator.translate("Fetch of uid " + uid, e);
        }
    }

    @Override
    public void close() {
        try {
            if (inbox.isOpen()) {
                inbox.close(false);
            }
        } catch (MessagingException | RuntimeException e) {
            log.debug("{} Error closing INBOX of session {}: {}", LogUtils.WARNING_EMOJI, sessionId, e.getMessage());
        }
        try {
            if (store.isConnected()) {
                store.close();
            }
            log.debug("{} Session {} closed", LogUtils.SUCCESS_EMOJI, sessionId);
        } catch (MessagingException | RuntimeException e) {
            log.debug("{} Error closing store of session {}: {}", LogUtils.WARNING_EMOJI, sessionId, e.getMessage());
        }
    }

    static IMAPFolder openInbox(Store store) throws MessagingException {
        IMAPFolder folder = (IMAPFolder) store.getFolder("INBOX");
        folder.open(Folder.READ_ONLY);
        return folder;
    }
}
