package de.alive.mailsync.storage;

import de.alive.mailsync.domain.ContentSyncResult;
import de.alive.mailsync.domain.EmailRecord;
import de.alive.mailsync.domain.ForwardRequest;
import de.alive.mailsync.domain.ForwardStatus;
import de.alive.mailsync.domain.ListedMessage;
import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.domain.MessageContent;
import de.alive.mailsync.domain.MessageFingerprint;
import de.alive.mailsync.domain.MessageStatus;
import de.alive.mailsync.domain.StoredAttachment;
import de.alive.mailsync.exception.SyncStoreException;
import de.alive.mailsync.exception.SyncStoreException.Operation;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference store kept in memory. One store-wide lock stands in for row locks, so every method is
 * serializable with respect to every other.
 */
@Slf4j
public class InMemorySyncStore implements SyncStore {

    private static final Comparator<MailAccount> SCHEDULING_ORDER = Comparator
            .comparing(MailAccount::lastListSyncTime, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingLong(MailAccount::id);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, MailAccount> accounts = new TreeMap<>();
    private final Map<Long, TreeMap<Long, EmailRecord>> messages = new HashMap<>();
    private final Map<MessageFingerprint, MessageContent> contents = new HashMap<>();
    private final Map<MessageFingerprint, List<StoredAttachment>> attachments = new HashMap<>();
    private final Map<Long, ForwardRequest> forwards = new LinkedHashMap<>();

    @Override
    public void saveAccount(@NotNull MailAccount account) {
        lock.lock();
        try {
            accounts.put(account.id(), account);
        } finally {
            lock.unlock();
        }
    }

    @NotNull
    @Override
    public Optional<MailAccount> findAccount(long accountId) {
        lock.lock();
        try {
            return Optional.ofNullable(accounts.get(accountId));
        } finally {
            lock.unlock();
        }
    }

    @NotNull
    @Override
    public List<MailAccount> claimAccounts(@Nullable Integer shard, int limit, @NotNull Instant now) {
        if (limit <= 0) return List.of();
        lock.lock();
        try {
            List<MailAccount> selected = accounts.values().stream()
                    .filter(account -> account.isSchedulable(shard))
                    .sorted(SCHEDULING_ORDER)
                    .limit(limit)
                    .toList();

            List<MailAccount> claimed = new ArrayList<>(selected.size());
            for (MailAccount account : selected) {
                MailAccount updated = account.claimed(now);
                accounts.put(updated.id(), updated);
                claimed.add(updated);
            }
            return claimed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void completeClaim(long accountId, @NotNull Instant cursor) throws SyncStoreException {
        release(accountId, cursor);
    }

    @Override
    public void failClaim(long accountId, @NotNull Instant rolledBackCursor) throws SyncStoreException {
        release(accountId, rolledBackCursor);
    }

    private void release(long accountId, Instant cursor) throws SyncStoreException {
        lock.lock();
        try {
            MailAccount account = requireAccount(accountId, Operation.RELEASE_ACCOUNT);
            accounts.put(accountId, account.released(cursor));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int releaseStaleClaims(@NotNull Instant claimedBefore, @NotNull Instant rolledBackCursor) {
        lock.lock();
        try {
            int released = 0;
            for (MailAccount account : List.copyOf(accounts.values())) {
                if (account.isClaimed() && account.claimedAt() != null && account.claimedAt().isBefore(claimedBefore)) {
                    accounts.put(account.id(), account.released(rolledBackCursor, rolledBackCursor));
                    released++;
                }
            }
            return released;
        } finally {
            lock.unlock();
        }
    }

    @NotNull
    @Override
    public OptionalLong latestMessageUid(long accountId) {
        lock.lock();
        try {
            TreeMap<Long, EmailRecord> byUid = messages.get(accountId);
            return byUid == null || byUid.isEmpty() ? OptionalLong.empty() : OptionalLong.of(byUid.lastKey());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int persistListBatch(long accountId, @NotNull List<ListedMessage> listed, @NotNull Instant listTime)
            throws SyncStoreException {
        lock.lock();
        try {
            MailAccount account = requireAccount(accountId, Operation.PERSIST_LIST);
            TreeMap<Long, EmailRecord> byUid = messages.computeIfAbsent(accountId, id -> new TreeMap<>());

            int inserted = 0;
            for (ListedMessage message : listed) {
                if (byUid.putIfAbsent(message.uid(), EmailRecord.pending(accountId, message)) == null) {
                    inserted++;
                }
            }
            accounts.put(accountId, account.withListSyncTime(listTime));
            return inserted;
        } finally {
            lock.unlock();
        }
    }

    @NotNull
    @Override
    public List<EmailRecord> claimPendingMessages(long accountId, int limit) {
        if (limit <= 0) return List.of();
        lock.lock();
        try {
            TreeMap<Long, EmailRecord> byUid = messages.get(accountId);
            if (byUid == null) return List.of();

            List<EmailRecord> claimed = new ArrayList<>();
            for (EmailRecord record : byUid.values()) {
                if (claimed.size() >= limit) break;
                if (record.status() == MessageStatus.PENDING) {
                    claimed.add(record.withStatus(MessageStatus.CLAIMED, null));
                }
            }
            claimed.forEach(record -> byUid.put(record.uid(), record));
            return claimed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateMessageStatus(@NotNull MessageFingerprint fingerprint, @NotNull MessageStatus status,
                                    @Nullable String error) throws SyncStoreException {
        lock.lock();
        try {
            EmailRecord record = requireMessage(fingerprint, Operation.UPDATE_STATUS);
            checkTransition(record, status, Operation.UPDATE_STATUS);
            messages.get(fingerprint.accountId()).put(fingerprint.uid(), record.withStatus(status, error));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int resetToPending(@NotNull Collection<MessageFingerprint> fingerprints) {
        lock.lock();
        try {
            int reset = 0;
            for (MessageFingerprint fingerprint : fingerprints) {
                TreeMap<Long, EmailRecord> byUid = messages.get(fingerprint.accountId());
                EmailRecord record = byUid == null ? null : byUid.get(fingerprint.uid());
                if (record != null && record.status() == MessageStatus.CLAIMED) {
                    byUid.put(fingerprint.uid(), record.withStatus(MessageStatus.PENDING, null));
                    reset++;
                }
            }
            return reset;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void saveContents(long accountId, @NotNull List<ContentSyncResult> results, @NotNull Instant contentTime)
            throws SyncStoreException {
        lock.lock();
        try {
            MailAccount account = requireAccount(accountId, Operation.SAVE_CONTENT);
            // validate everything before the first write
            for (ContentSyncResult result : results) {
                if (result.fingerprint().accountId() != accountId) {
                    throw new SyncStoreException("Content " + result.fingerprint() + " does not belong to account "
                            + accountId, Operation.SAVE_CONTENT);
                }
                checkTransition(requireMessage(result.fingerprint(), Operation.SAVE_CONTENT),
                        MessageStatus.DONE, Operation.SAVE_CONTENT);
            }

            TreeMap<Long, EmailRecord> byUid = messages.get(accountId);
            for (ContentSyncResult result : results) {
                MessageFingerprint fingerprint = result.fingerprint();
                contents.put(fingerprint, result.content());
                attachments.put(fingerprint, result.attachments());
                byUid.put(fingerprint.uid(), byUid.get(fingerprint.uid()).withStatus(MessageStatus.DONE, null));
            }
            accounts.put(accountId, account.withContentSyncTime(contentTime));
        } finally {
            lock.unlock();
        }
    }

    @NotNull
    @Override
    public Optional<EmailRecord> findMessage(@NotNull MessageFingerprint fingerprint) {
        lock.lock();
        try {
            TreeMap<Long, EmailRecord> byUid = messages.get(fingerprint.accountId());
            return Optional.ofNullable(byUid == null ? null : byUid.get(fingerprint.uid()));
        } finally {
            lock.unlock();
        }
    }

    @NotNull
    @Override
    public List<EmailRecord> findMessages(long accountId) {
        lock.lock();
        try {
            TreeMap<Long, EmailRecord> byUid = messages.get(accountId);
            return byUid == null ? List.of() : List.copyOf(byUid.values());
        } finally {
            lock.unlock();
        }
    }

    @NotNull
    @Override
    public Optional<MessageContent> findContent(@NotNull MessageFingerprint fingerprint) {
        lock.lock();
        try {
            return Optional.ofNullable(contents.get(fingerprint));
        } finally {
            lock.unlock();
        }
    }

    @NotNull
    @Override
    public List<StoredAttachment> findAttachments(@NotNull MessageFingerprint fingerprint) {
        lock.lock();
        try {
            return attachments.getOrDefault(fingerprint, List.of());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void enqueueForward(@NotNull ForwardRequest request) throws SyncStoreException {
        lock.lock();
        try {
            if (forwards.containsKey(request.id())) {
                throw new SyncStoreException("Forward request " + request.id() + " already exists", Operation.FORWARD_QUEUE);
            }
            forwards.put(request.id(), request);
        } finally {
            lock.unlock();
        }
    }

    @NotNull
    @Override
    public List<ForwardRequest> claimPendingForwards(int limit) {
        if (limit <= 0) return List.of();
        lock.lock();
        try {
            Map<Long, Deque<ForwardRequest>> byAccount = new TreeMap<>();
            for (ForwardRequest request : forwards.values()) {
                if (request.status() == ForwardStatus.PENDING) {
                    byAccount.computeIfAbsent(request.accountId(), id -> new ArrayDeque<>()).add(request);
                }
            }

            List<ForwardRequest> claimed = new ArrayList<>();
            while (claimed.size() < limit && !byAccount.isEmpty()) {
                var iterator = byAccount.values().iterator();
                while (iterator.hasNext() && claimed.size() < limit) {
                    Deque<ForwardRequest> queue = iterator.next();
                    ForwardRequest next = queue.poll().withStatus(ForwardStatus.PROCESSING, null);
                    forwards.put(next.id(), next);
                    claimed.add(next);
                    if (queue.isEmpty()) {
                        iterator.remove();
                    }
                }
            }
            return claimed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void completeForward(long requestId, @NotNull ForwardStatus status, @Nullable String result)
            throws SyncStoreException {
        lock.lock();
        try {
            ForwardRequest request = forwards.get(requestId);
            if (request == null) {
                throw new SyncStoreException("Unknown forward request " + requestId, Operation.FORWARD_QUEUE);
            }
            if (request.status() != ForwardStatus.PROCESSING) {
                throw new SyncStoreException("Forward request " + requestId + " is not being processed",
                        Operation.FORWARD_QUEUE);
            }
            forwards.put(requestId, request.withStatus(status, result));
        } finally {
            lock.unlock();
        }
    }

    @NotNull
    @Override
    public Optional<ForwardRequest> findForward(long requestId) {
        lock.lock();
        try {
            return Optional.ofNullable(forwards.get(requestId));
        } finally {
            lock.unlock();
        }
    }

    private MailAccount requireAccount(long accountId, Operation operation) throws SyncStoreException {
        MailAccount account = accounts.get(accountId);
        if (account == null) {
            throw new SyncStoreException("Unknown account " + accountId, operation);
        }
        return account;
    }

    private EmailRecord requireMessage(MessageFingerprint fingerprint, Operation operation) throws SyncStoreException {
        TreeMap<Long, EmailRecord> byUid = messages.get(fingerprint.accountId());
        EmailRecord record = byUid == null ? null : byUid.get(fingerprint.uid());
        if (record == null) {
            throw new SyncStoreException("Unknown message " + fingerprint, operation);
        }
        return record;
    }

    private static void checkTransition(EmailRecord record, MessageStatus target, Operation operation)
            throws SyncStoreException {
        if (!record.status().canTransitionTo(target)) {
            log.warn("Rejected transition {} -> {} for message {}", record.status(), target, record.fingerprint());
            throw new SyncStoreException("Illegal transition " + record.status() + " -> " + target
                    + " for message " + record.fingerprint(), operation);
        }
    }
}
