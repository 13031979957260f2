package de.alive.mailsync.service;

import de.alive.mailsync.domain.AccountSyncResult;
import de.alive.mailsync.domain.ContentSyncResult;
import de.alive.mailsync.domain.EmailRecord;
import de.alive.mailsync.domain.FetchedMessage;
import de.alive.mailsync.domain.ListedMessage;
import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.domain.MessageFingerprint;
import de.alive.mailsync.domain.MessageStatus;
import de.alive.mailsync.domain.StoredAttachment;
import de.alive.mailsync.domain.SyncDeadline;
import de.alive.mailsync.exception.MailOperationException;
import de.alive.mailsync.exception.SyncStoreException;
import de.alive.mailsync.service.config.SyncConfiguration;
import de.alive.mailsync.storage.SyncStore;
import de.alive.mailsync.util.LogUtils;
import de.alive.mailsync.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Two-phase sync of a single account: list new messages, then fetch content for pending ones.
 * <p>
 * A failing message only changes that message's status. Only store failures abort the batch.
 */
@Slf4j
public class AccountSyncWorker {

    private final MailProtocolClient client;
    private final SyncStore store;
    private final AttachmentStorageService attachmentStorage;
    private final SyncConfiguration configuration;
    private final Clock clock;
    private final Sleeper sleeper;

    public AccountSyncWorker(MailProtocolClient client, SyncStore store, AttachmentStorageService attachmentStorage,
                             SyncConfiguration configuration, Clock clock, Sleeper sleeper) {
        this.client = client;
        this.store = store;
        this.attachmentStorage = attachmentStorage;
        this.configuration = configuration;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Runs both phases. Never throws; failures are reported in the result.
     * A message that fails with an unchecked error becomes PERMANENT_FAILURE.
     */
    @NotNull
    public AccountSyncResult run(@NotNull MailAccount account, int limit, @NotNull SyncDeadline deadline) {
        long startMs = System.currentTimeMillis();
        try {
            int listed = syncList(account, limit);
            if (deadline.shouldStop(configuration.getDeadlineSafetyMargin())) {
                log.info("{} Account {} reached its deadline after listing", LogUtils.CLOCK_EMOJI, account.id());
                return AccountSyncResult.builder().accountId(account.id()).listed(listed).stoppedByDeadline(true).build();
            }

            AccountSyncResult content = syncContent(account, limit, deadline);
            AccountSyncResult result = content.toBuilder().listed(listed).build();
            log.info("{} Account {} synced in {}: {} new, {}, {} requeued{}", LogUtils.SUCCESS_EMOJI, account.id(),
                    LogUtils.formatDuration(System.currentTimeMillis() - startMs, true), listed,
                    LogUtils.formatOutcome(result.succeeded(), result.failed()), result.requeued(),
                    result.stoppedByDeadline() ? " (deadline)" : "");
            return result;
        } catch (MailOperationException e) {
            log.error("{} Listing failed for account {} ({}): {}", LogUtils.ERROR_EMOJI, account.id(),
                    e.getReason(), e.getMessage());
            return AccountSyncResult.failure(account.id(), e.getMessage());
        } catch (SyncStoreException e) {
            log.error("{} Store failure while syncing account {} ({}): {}", LogUtils.ERROR_EMOJI, account.id(),
                    e.getOperation(), e.getMessage());
            return AccountSyncResult.failure(account.id(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} Unexpected failure while syncing account {}: {}", LogUtils.ERROR_EMOJI, account.id(),
                    e.getMessage(), e);
            return AccountSyncResult.failure(account.id(), String.valueOf(e.getMessage()));
        }
    }

    /**
     * Lists messages newer than the highest stored UID and inserts the unseen ones as PENDING.
     *
     * @return number of new messages
     */
    public int syncList(@NotNull MailAccount account, int limit) throws MailOperationException, SyncStoreException {
        OptionalLong latest = store.latestMessageUid(account.id());
        List<ListedMessage> listed = client.listNewMessages(account, latest.orElse(0L), limit);

        int inserted = store.persistListBatch(account.id(), listed, clock.instant());
        log.debug("{} Account {}: {} listed, {} new after uid {}", LogUtils.SEARCH_EMOJI, account.id(),
                listed.size(), inserted, latest.isPresent() ? latest.getAsLong() : "none");
        return inserted;
    }

    /**
     * Claims up to {@code limit} pending messages and fetches them one by one, stopping early when the
     * deadline comes within the safety margin. Unprocessed claims go back to PENDING.
     */
    @NotNull
    public AccountSyncResult syncContent(@NotNull MailAccount account, int limit, @NotNull SyncDeadline deadline)
            throws SyncStoreException {
        List<EmailRecord> claimed = store.claimPendingMessages(account.id(), limit);
        Set<MessageFingerprint> unsettled = new LinkedHashSet<>();
        claimed.forEach(record -> unsettled.add(record.fingerprint()));

        int succeeded = 0;
        int failed = 0;
        int requeued = 0;
        boolean stopped = false;

        try {
            for (int i = 0; i < claimed.size(); i++) {
                if (deadline.shouldStop(configuration.getDeadlineSafetyMargin())) {
                    stopped = true;
                    break;
                }
                if (i > 0 && !pace()) {
                    stopped = true;
                    break;
                }

                EmailRecord record = claimed.get(i);
                MessageFingerprint fingerprint = record.fingerprint();
                try {
                    ContentSyncResult result = fetchContent(account, fingerprint);
                    store.saveContents(account.id(), List.of(result), clock.instant());
                    succeeded++;
                } catch (MailOperationException e) {
                    MessageStatus target = statusFor(e);
                    store.updateMessageStatus(fingerprint, target, e.getMessage());
                    if (target == MessageStatus.PENDING) {
                        requeued++;
                    } else {
                        failed++;
                    }
                    log.warn("{} Message {} -> {} ({}): {}", LogUtils.WARNING_EMOJI, fingerprint, target,
                            e.getReason(), e.getMessage());
                } catch (RuntimeException e) {
                    store.updateMessageStatus(fingerprint, MessageStatus.PERMANENT_FAILURE, String.valueOf(e));
                    failed++;
                    log.error("{} Message {} -> {}: {}", LogUtils.ERROR_EMOJI, fingerprint,
                            MessageStatus.PERMANENT_FAILURE, e.getMessage(), e);
                }
                unsettled.remove(fingerprint);
            }

            if (!unsettled.isEmpty()) {
                int reset = store.resetToPending(unsettled);
                requeued += reset;
                log.info("{} Account {} stopped early, {} claimed messages returned to pending", LogUtils.CLOCK_EMOJI,
                        account.id(), reset);
            }
        } catch (SyncStoreException | RuntimeException e) {
            rollbackClaims(unsettled, e);
            throw e;
        }

        return AccountSyncResult.builder()
                .accountId(account.id())
                .succeeded(succeeded)
                .failed(failed)
                .requeued(requeued)
                .stoppedByDeadline(stopped)
                .build();
    }

    private ContentSyncResult fetchContent(MailAccount account, MessageFingerprint fingerprint)
            throws MailOperationException {
        FetchedMessage message = client.fetchMessage(account, fingerprint.uid());
        List<StoredAttachment> attachments = attachmentStorage.store(fingerprint, message.content().attachments());
        return new ContentSyncResult(message.toContent(fingerprint), attachments);
    }

    /**
     * TRANSIENT and PROTOCOL_STATE errors (and exhausted retries) requeue, an expunged message is DELETED,
     * everything else is a PERMANENT_FAILURE.
     */
    static MessageStatus statusFor(MailOperationException error) {
        if (error.getReason() == MailOperationException.Reason.EXPUNGED) {
            return MessageStatus.DELETED;
        }
        return switch (error.getKind()) {
            case TRANSIENT, PROTOCOL_STATE -> MessageStatus.PENDING;
            case PERMANENT -> MessageStatus.PERMANENT_FAILURE;
        };
    }

    private boolean pace() {
        try {
            sleeper.sleep(configuration.getInterItemDelay());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} Worker interrupted, stopping content phase", LogUtils.STOP_EMOJI);
            return false;
        }
    }

    private void rollbackClaims(Set<MessageFingerprint> unsettled, Exception cause) {
        if (unsettled.isEmpty()) return;
        try {
            store.resetToPending(unsettled);
        } catch (SyncStoreException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
            log.error("{} Could not return {} claimed messages to pending: {}", LogUtils.ERROR_EMOJI,
                    unsettled.size(), rollbackFailure.getMessage());
        }
    }
}
