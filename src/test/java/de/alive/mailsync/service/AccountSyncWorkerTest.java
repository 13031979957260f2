package de.alive.mailsync.service;

import de.alive.mailsync.domain.AccountSyncResult;
import de.alive.mailsync.domain.EmailRecord;
import de.alive.mailsync.domain.ExtractedContent;
import de.alive.mailsync.domain.FetchedMessage;
import de.alive.mailsync.domain.ListedMessage;
import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.domain.MessageFingerprint;
import de.alive.mailsync.domain.MessageStatus;
import de.alive.mailsync.domain.SyncDeadline;
import de.alive.mailsync.exception.MailOperationException;
import de.alive.mailsync.exception.MailOperationException.Reason;
import de.alive.mailsync.exception.SyncStoreException;
import de.alive.mailsync.service.config.SyncConfiguration;
import de.alive.mailsync.storage.InMemorySyncStore;
import de.alive.mailsync.storage.SyncStore;
import de.alive.mailsync.support.MutableClock;
import de.alive.mailsync.support.RecordingSleeper;
import de.alive.mailsync.support.TestAccounts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * AccountSyncWorker unit tests
 * - list phase inserts unseen messages only
 * - content phase maps errors to status transitions
 * - deadline stop conserves messages
 */
@ExtendWith(MockitoExtension.class)
class AccountSyncWorkerTest {

    private static final Instant START = Instant.parse("2024-05-01T08:00:00Z");

    @Mock
    private MailProtocolClient client;

    @Mock
    private AttachmentStorageService attachmentStorage;

    private InMemorySyncStore store;
    private MutableClock clock;
    private RecordingSleeper sleeper;
    private SyncConfiguration configuration;
    private AccountSyncWorker worker;
    private MailAccount account;

    @BeforeEach
    void setUp() {
        store = new InMemorySyncStore();
        clock = new MutableClock(START);
        sleeper = new RecordingSleeper();
        configuration = SyncConfiguration.forTesting().toBuilder()
                .interItemDelay(Duration.ofMillis(500))
                .build();
        worker = new AccountSyncWorker(client, store, attachmentStorage, configuration, clock, sleeper);
        account = TestAccounts.account(1L);
        store.saveAccount(account);
    }

    @Test
    @DisplayName("New account: three listed, limit 2 claims 101 and 102, 102 not found, 103 stays pending")
    void testListThenContentScenario() throws Exception {
        when(client.listNewMessages(account, 0L, 10)).thenReturn(List.of(listed(101), listed(102), listed(103)));
        when(client.fetchMessage(account, 101L)).thenReturn(fetched(101));
        when(client.fetchMessage(account, 102L))
                .thenThrow(new MailOperationException("No message with uid 102", Reason.NOT_FOUND));
        when(attachmentStorage.store(any(), anyList())).thenReturn(List.of());

        int inserted = worker.syncList(account, 10);

        assertThat(inserted).isEqualTo(3);
        assertThat(statuses()).containsOnly(
                Map.entry(101L, MessageStatus.PENDING),
                Map.entry(102L, MessageStatus.PENDING),
                Map.entry(103L, MessageStatus.PENDING));
        assertThat(store.findAccount(1L).orElseThrow().lastListSyncTime()).isEqualTo(START);

        AccountSyncResult result = worker.syncContent(account, 2, SyncDeadline.none(clock));

        assertThat(result.succeeded()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.isSuccess()).isTrue();
        assertThat(statuses()).containsOnly(
                Map.entry(101L, MessageStatus.DONE),
                Map.entry(102L, MessageStatus.PERMANENT_FAILURE),
                Map.entry(103L, MessageStatus.PENDING));
        assertThat(store.findContent(new MessageFingerprint(1L, 101L))).hasValueSatisfying(content ->
                assertThat(content.body()).isEqualTo("body 101"));
        assertThat(sleeper.getSleeps()).containsExactly(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("Second listing starts after the highest stored uid and skips known messages")
    void testListingIsIdempotent() throws Exception {
        when(client.listNewMessages(account, 0L, 10)).thenReturn(List.of(listed(101), listed(102)));
        when(client.listNewMessages(account, 102L, 10)).thenReturn(List.of(listed(102), listed(103)));

        worker.syncList(account, 10);
        clock.advance(Duration.ofMinutes(1));
        int inserted = worker.syncList(account, 10);

        assertThat(inserted).isEqualTo(1);
        assertThat(store.findMessages(1L)).hasSize(3);
        assertThat(store.findAccount(1L).orElseThrow().lastListSyncTime()).isEqualTo(START.plus(Duration.ofMinutes(1)));
    }

    @Test
    @DisplayName("Deadline stop persists finished work and returns the rest to pending")
    void testDeadlineConservesMessages() throws Exception {
        store.persistListBatch(1L, List.of(listed(1), listed(2), listed(3), listed(4)), START);
        when(client.fetchMessage(eq(account), anyLong())).thenAnswer(invocation -> {
            clock.advance(Duration.ofMinutes(5));
            return fetched(invocation.getArgument(1));
        });
        when(attachmentStorage.store(any(), anyList())).thenReturn(List.of());
        SyncDeadline deadline = SyncDeadline.after(Duration.ofMinutes(10), clock);

        AccountSyncResult result = worker.syncContent(account, 4, deadline);

        assertThat(result.stoppedByDeadline()).isTrue();
        assertThat(result.succeeded()).isEqualTo(2);
        assertThat(result.requeued()).isEqualTo(2);
        assertThat(statuses()).containsOnly(
                Map.entry(1L, MessageStatus.DONE),
                Map.entry(2L, MessageStatus.DONE),
                Map.entry(3L, MessageStatus.PENDING),
                Map.entry(4L, MessageStatus.PENDING));
    }

    @Test
    @DisplayName("Exhausted retries requeue, expunged messages are marked deleted")
    void testErrorClassificationToStatus() throws Exception {
        store.persistListBatch(1L, List.of(listed(1), listed(2)), START);
        when(client.fetchMessage(account, 1L))
                .thenThrow(new MailOperationException("gave up", Reason.RETRIES_EXHAUSTED));
        when(client.fetchMessage(account, 2L))
                .thenThrow(new MailOperationException("expunged", Reason.EXPUNGED));

        AccountSyncResult result = worker.syncContent(account, 5, SyncDeadline.none(clock));

        assertThat(result.requeued()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(statuses()).containsOnly(
                Map.entry(1L, MessageStatus.PENDING),
                Map.entry(2L, MessageStatus.DELETED));
        assertThat(store.findMessage(new MessageFingerprint(1L, 1L)).orElseThrow().lastError()).contains("gave up");
    }

    @Test
    @DisplayName("Cancelled deadline stops before the first fetch")
    void testCancelledDeadline() throws Exception {
        store.persistListBatch(1L, List.of(listed(1)), START);
        SyncDeadline deadline = SyncDeadline.none(clock);
        deadline.cancel();

        AccountSyncResult result = worker.syncContent(account, 5, deadline);

        assertThat(result.stoppedByDeadline()).isTrue();
        assertThat(result.requeued()).isEqualTo(1);
        assertThat(statuses()).containsOnly(Map.entry(1L, MessageStatus.PENDING));
    }

    @Test
    @DisplayName("Listing failure makes the whole run a failure")
    void testListFailureFailsRun() throws Exception {
        when(client.listNewMessages(account, 0L, 5))
                .thenThrow(new MailOperationException("login rejected", Reason.AUTHENTICATION));

        AccountSyncResult result = worker.run(account, 5, SyncDeadline.none(clock));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).contains("login rejected");
    }

    @Test
    @DisplayName("Store failure aborts the batch and returns claims to pending")
    void testStoreFailureRollsBackClaims(@Mock SyncStore failingStore) throws Exception {
        AccountSyncWorker failingWorker = new AccountSyncWorker(client, failingStore, attachmentStorage, configuration,
                clock, sleeper);
        EmailRecord record = EmailRecord.pending(1L, listed(1));
        when(failingStore.claimPendingMessages(1L, 5)).thenReturn(List.of(record.withStatus(MessageStatus.CLAIMED, null)));
        when(client.fetchMessage(account, 1L)).thenReturn(fetched(1));
        when(attachmentStorage.store(any(), anyList())).thenReturn(List.of());
        doThrow(new SyncStoreException("disk full", SyncStoreException.Operation.SAVE_CONTENT))
                .when(failingStore).saveContents(eq(1L), anyList(), any());

        assertThatThrownBy(() -> failingWorker.syncContent(account, 5, SyncDeadline.none(clock)))
                .isInstanceOf(SyncStoreException.class);

        verify(failingStore).resetToPending(Set.of(new MessageFingerprint(1L, 1L)));
    }

    @Test
    @DisplayName("Unchecked failure on one message marks it permanently failed and the run continues")
    void testUncheckedFailureIsContainedToMessage() throws Exception {
        when(client.listNewMessages(account, 0L, 3)).thenReturn(List.of(listed(1), listed(2), listed(3)));
        when(client.fetchMessage(eq(account), anyLong())).thenAnswer(invocation -> fetched(invocation.getArgument(1)));
        when(attachmentStorage.store(any(), anyList())).thenAnswer(invocation -> {
            MessageFingerprint fingerprint = invocation.getArgument(0);
            if (fingerprint.uid() == 2L) {
                throw new IllegalStateException("corrupt zip");
            }
            return List.of();
        });

        AccountSyncResult result = worker.run(account, 3, SyncDeadline.none(clock));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.succeeded()).isEqualTo(2);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(statuses()).containsOnly(
                Map.entry(1L, MessageStatus.DONE),
                Map.entry(2L, MessageStatus.PERMANENT_FAILURE),
                Map.entry(3L, MessageStatus.DONE));
        assertThat(store.findMessage(new MessageFingerprint(1L, 2L)).orElseThrow().lastError())
                .contains("corrupt zip");
    }

    @Test
    @DisplayName("Unchecked store failure returns every unsettled claim to pending and fails the run")
    void testUncheckedStoreFailureReleasesClaims(@Mock SyncStore failingStore) throws Exception {
        AccountSyncWorker failingWorker = new AccountSyncWorker(client, failingStore, attachmentStorage, configuration,
                clock, sleeper);
        MessageFingerprint first = new MessageFingerprint(1L, 1L);
        MessageFingerprint second = new MessageFingerprint(1L, 2L);
        when(client.listNewMessages(account, 0L, 5)).thenReturn(List.of());
        when(failingStore.claimPendingMessages(1L, 5)).thenReturn(List.of(
                EmailRecord.pending(1L, listed(1)).withStatus(MessageStatus.CLAIMED, null),
                EmailRecord.pending(1L, listed(2)).withStatus(MessageStatus.CLAIMED, null)));
        when(client.fetchMessage(account, 1L))
                .thenThrow(new MailOperationException("No message with uid 1", Reason.NOT_FOUND));
        doThrow(new IllegalStateException("connection pool closed"))
                .when(failingStore).updateMessageStatus(eq(first), eq(MessageStatus.PERMANENT_FAILURE), any());

        AccountSyncResult result = failingWorker.run(account, 5, SyncDeadline.none(clock));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).isEqualTo("connection pool closed");
        verify(failingStore).resetToPending(Set.of(first, second));
    }

    private Map<Long, MessageStatus> statuses() {
        return store.findMessages(1L).stream()
                .collect(Collectors.toMap(EmailRecord::uid, EmailRecord::status));
    }

    private static ListedMessage listed(long uid) {
        return new ListedMessage(uid, "subject " + uid, "sender@example.com", START, false);
    }

    private static FetchedMessage fetched(long uid) {
        return new FetchedMessage(uid, "subject " + uid, "sender@example.com", "me@example.com", START,
                new ExtractedContent("body " + uid, "", List.of()));
    }
}
