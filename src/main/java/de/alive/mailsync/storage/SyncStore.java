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
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Transactional persistence for accounts, messages, contents and the forward queue.
 * Every method is one transaction.
 */
public interface SyncStore {

    // accounts

    void saveAccount(@NotNull MailAccount account) throws SyncStoreException;

    @NotNull Optional<MailAccount> findAccount(long accountId) throws SyncStoreException;

    /**
     * Selects up to {@code limit} schedulable accounts, never-listed first then oldest list cursor,
     * and marks them CLAIMED in the same transaction.
     */
    @NotNull List<MailAccount> claimAccounts(@Nullable Integer shard, int limit, @NotNull Instant now)
            throws SyncStoreException;

    void completeClaim(long accountId, @NotNull Instant cursor) throws SyncStoreException;

    void failClaim(long accountId, @NotNull Instant rolledBackCursor) throws SyncStoreException;

    /**
     * Releases claims taken before {@code claimedBefore}, setting both cursors to {@code rolledBackCursor}.
     *
     * @return number of accounts released
     */
    int releaseStaleClaims(@NotNull Instant claimedBefore, @NotNull Instant rolledBackCursor) throws SyncStoreException;

    // messages

    @NotNull OptionalLong latestMessageUid(long accountId) throws SyncStoreException;

    /**
     * Inserts unseen messages as PENDING and advances the account's list cursor, atomically.
     *
     * @return number of newly inserted messages
     */
    int persistListBatch(long accountId, @NotNull List<ListedMessage> listed, @NotNull Instant listTime)
            throws SyncStoreException;

    @NotNull List<EmailRecord> claimPendingMessages(long accountId, int limit) throws SyncStoreException;

    void updateMessageStatus(@NotNull MessageFingerprint fingerprint, @NotNull MessageStatus status,
                             @Nullable String error) throws SyncStoreException;

    /**
     * Returns CLAIMED messages among {@code fingerprints} to PENDING. Other states are left alone.
     *
     * @return number of messages reset
     */
    int resetToPending(@NotNull Collection<MessageFingerprint> fingerprints) throws SyncStoreException;

    /**
     * Writes contents and attachments and moves the messages to DONE, all or nothing.
     */
    void saveContents(long accountId, @NotNull List<ContentSyncResult> results, @NotNull Instant contentTime)
            throws SyncStoreException;

    @NotNull Optional<EmailRecord> findMessage(@NotNull MessageFingerprint fingerprint) throws SyncStoreException;

    @NotNull List<EmailRecord> findMessages(long accountId) throws SyncStoreException;

    @NotNull Optional<MessageContent> findContent(@NotNull MessageFingerprint fingerprint) throws SyncStoreException;

    @NotNull List<StoredAttachment> findAttachments(@NotNull MessageFingerprint fingerprint) throws SyncStoreException;

    // forward queue

    void enqueueForward(@NotNull ForwardRequest request) throws SyncStoreException;

    /**
     * Claims pending forward requests round-robin across accounts.
     */
    @NotNull List<ForwardRequest> claimPendingForwards(int limit) throws SyncStoreException;

    void completeForward(long requestId, @NotNull ForwardStatus status, @Nullable String result)
            throws SyncStoreException;

    @NotNull Optional<ForwardRequest> findForward(long requestId) throws SyncStoreException;
}
