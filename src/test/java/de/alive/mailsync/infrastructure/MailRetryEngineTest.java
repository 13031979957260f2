package de.alive.mailsync.infrastructure;

import de.alive.mailsync.domain.ListedMessage;
import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.exception.MailOperationException;
import de.alive.mailsync.exception.MailOperationException.Reason;
import de.alive.mailsync.support.RecordingSleeper;
import de.alive.mailsync.support.TestAccounts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * MailRetryEngine unit tests
 * - transient errors: invalidate, linear backoff, bounded attempts
 * - protocol state errors: invalidate, no backoff
 * - permanent errors: single attempt
 */
@ExtendWith(MockitoExtension.class)
class MailRetryEngineTest {

    private static final Duration BASE = Duration.ofMillis(100);

    @Mock
    private SessionProvider sessions;

    @Mock
    private MailSession session;

    private RecordingSleeper sleeper;
    private MailRetryEngine engine;
    private MailAccount account;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        engine = new MailRetryEngine(sessions, BASE, sleeper);
        account = TestAccounts.account(7L);
    }

    @Test
    @DisplayName("Acquisition times out twice, third attempt succeeds with exactly two invalidations")
    void testAcquireTimesOutTwiceThenSucceeds() throws Exception {
        MailOperationException timeout = new MailOperationException("read timed out", Reason.TIMEOUT);
        when(sessions.acquire(account))
                .thenThrow(timeout)
                .thenThrow(timeout)
                .thenReturn(session);
        when(session.listSince(0L, 10)).thenReturn(List.of(new ListedMessage(1L, "s", "f", null, false)));

        List<ListedMessage> result = engine.execute(account, 5, s -> s.listSince(0L, 10));

        assertThat(result).hasSize(1);
        verify(sessions, times(2)).invalidate(account.id());
        verify(sessions).release(account.id());
        assertThat(sleeper.getSleeps()).containsExactly(BASE, BASE.multipliedBy(2));
    }

    @Test
    @DisplayName("Transient errors are retried up to maxAttempts and then reported as exhausted")
    void testTransientExhaustsAttempts() throws Exception {
        when(sessions.acquire(account)).thenReturn(session);
        when(session.fetchMessage(42L)).thenThrow(new MailOperationException("reset", Reason.NETWORK));

        assertThatThrownBy(() -> engine.execute(account, 3, s -> s.fetchMessage(42L)))
                .isInstanceOfSatisfying(MailOperationException.class, error -> {
                    assertThat(error.getReason()).isEqualTo(Reason.RETRIES_EXHAUSTED);
                    assertThat(error.getKind()).isEqualTo(MailOperationException.ErrorKind.TRANSIENT);
                    assertThat(error.getCause()).isInstanceOf(MailOperationException.class);
                });

        verify(session, times(3)).fetchMessage(42L);
        verify(sessions, times(3)).invalidate(account.id());
        // no pause after the final attempt
        assertThat(sleeper.getSleeps()).containsExactly(BASE, BASE.multipliedBy(2));
    }

    @Test
    @DisplayName("Protocol state errors replace the session and retry without delay")
    void testProtocolStateRetriesImmediately() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        when(sessions.acquire(account)).thenReturn(session);

        String result = engine.execute(account, 5, s -> {
            if (calls.incrementAndGet() == 1) {
                throw new MailOperationException("BAD command in wrong state", Reason.PROTOCOL_SEQUENCE);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        verify(sessions, times(1)).invalidate(account.id());
        assertThat(sleeper.getSleeps()).isEmpty();
    }

    @Test
    @DisplayName("Permanent errors make exactly one attempt")
    void testPermanentFailsOnce() throws Exception {
        when(sessions.acquire(account)).thenReturn(session);
        when(session.fetchMessage(9L)).thenThrow(new MailOperationException("gone", Reason.NOT_FOUND));

        assertThatThrownBy(() -> engine.execute(account, 5, s -> s.fetchMessage(9L)))
                .isInstanceOfSatisfying(MailOperationException.class,
                        error -> assertThat(error.getReason()).isEqualTo(Reason.NOT_FOUND));

        verify(session, times(1)).fetchMessage(9L);
        verify(sessions, never()).invalidate(account.id());
        assertThat(sleeper.getSleeps()).isEmpty();
    }

    @Test
    @DisplayName("Unchecked failures from JavaMail are translated before classification")
    void testUncheckedFailureIsClassified() throws Exception {
        when(sessions.acquire(account)).thenReturn(session);
        AtomicInteger calls = new AtomicInteger();

        Integer result = engine.execute(account, 2, s -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("This operation is not allowed on a closed folder");
            }
            return 1;
        });

        assertThat(result).isEqualTo(1);
        verify(sessions).invalidate(account.id());
    }

    @Test
    @DisplayName("Session-less operations follow the same policy without touching the pool")
    void testExecuteWithoutSession() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = engine.executeWithoutSession(account, 3, () -> {
            if (calls.incrementAndGet() < 3) {
                throw new MailOperationException("421 try later", Reason.SERVER_UNAVAILABLE);
            }
            return "sent";
        });

        assertThat(result).isEqualTo("sent");
        assertThat(calls.get()).isEqualTo(3);
        verify(sessions, never()).acquire(any());
        verify(sessions, never()).invalidate(account.id());
        assertThat(sleeper.getSleeps()).containsExactly(BASE, BASE.multipliedBy(2));
    }
}
