package de.alive.mailsync.infrastructure;

import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.exception.MailOperationException;
import de.alive.mailsync.exception.MailOperationException.Reason;
import de.alive.mailsync.service.config.SyncConfiguration;
import de.alive.mailsync.support.FakeMailSession;
import de.alive.mailsync.support.MutableClock;
import de.alive.mailsync.support.RecordingSleeper;
import de.alive.mailsync.support.TestAccounts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MailSessionPoolTest {

    @Mock
    private MailSessionFactory factory;

    private MutableClock clock;
    private RecordingSleeper sleeper;
    private SyncConfiguration configuration;
    private MailSessionPool pool;
    private MailAccount account;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T10:00:00Z"));
        sleeper = new RecordingSleeper();
        configuration = SyncConfiguration.forTesting();
        pool = new MailSessionPool(factory, configuration, clock, sleeper);
        account = TestAccounts.account(1L);
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    @Test
    @DisplayName("Healthy session is reused after a NOOP probe")
    void testReuseHealthySession() throws Exception {
        FakeMailSession session = new FakeMailSession(1L);
        when(factory.open(account)).thenReturn(session);

        MailSession first = pool.acquire(account);
        pool.release(account.id());
        MailSession second = pool.acquire(account);

        assertThat(second).isSameAs(first);
        assertThat(session.getProbes()).isEqualTo(1);
        verify(factory, times(1)).open(account);
    }

    @Test
    @DisplayName("Session failing its probe is closed and replaced")
    void testReplaceUnhealthySession() throws Exception {
        FakeMailSession broken = new FakeMailSession(1L);
        FakeMailSession fresh = new FakeMailSession(1L);
        when(factory.open(account)).thenReturn(broken, fresh);

        pool.acquire(account);
        pool.release(account.id());
        broken.breakProbe();

        MailSession replacement = pool.acquire(account);

        assertThat(replacement).isSameAs(fresh);
        assertThat(broken.isClosed()).isTrue();
    }

    @Test
    @DisplayName("Disconnected session is replaced without probing")
    void testReplaceDisconnectedSession() throws Exception {
        FakeMailSession dropped = new FakeMailSession(1L);
        FakeMailSession fresh = new FakeMailSession(1L);
        when(factory.open(account)).thenReturn(dropped, fresh);

        pool.acquire(account);
        dropped.drop();

        assertThat(pool.acquire(account)).isSameAs(fresh);
        assertThat(dropped.getProbes()).isZero();
    }

    @Test
    @DisplayName("Invalidate closes the session and the next acquire reconnects")
    void testInvalidate() throws Exception {
        FakeMailSession first = new FakeMailSession(1L);
        FakeMailSession second = new FakeMailSession(1L);
        when(factory.open(account)).thenReturn(first, second);

        pool.acquire(account);
        pool.invalidate(account.id());

        assertThat(first.isClosed()).isTrue();
        assertThat(pool.acquire(account)).isSameAs(second);
    }

    @Test
    @DisplayName("Idle sweep closes only sessions idle beyond the timeout and skips sessions in use")
    void testSweepIdle() throws Exception {
        MailAccount other = TestAccounts.account(2L);
        MailAccount busy = TestAccounts.account(3L);
        FakeMailSession idleSession = new FakeMailSession(1L);
        FakeMailSession recentSession = new FakeMailSession(2L);
        FakeMailSession busySession = new FakeMailSession(3L);
        when(factory.open(account)).thenReturn(idleSession);
        when(factory.open(other)).thenReturn(recentSession);
        when(factory.open(busy)).thenReturn(busySession);

        pool.acquire(account);
        pool.release(account.id());
        pool.acquire(busy);

        clock.advance(configuration.getSessionIdleTimeout().minusSeconds(30));
        pool.acquire(other);
        pool.release(other.id());
        clock.advance(Duration.ofMinutes(1));

        int closed = pool.sweepIdle();

        assertThat(closed).isEqualTo(1);
        assertThat(idleSession.isClosed()).isTrue();
        assertThat(recentSession.isClosed()).isFalse();
        assertThat(busySession.isClosed()).isFalse();
        assertThat(pool.status().sessions()).isEqualTo(2);
        assertThat(pool.status().inUse()).isEqualTo(1);
    }

    @Test
    @DisplayName("Connection establishment retries transient failures with linear backoff")
    void testConnectRetry() throws Exception {
        FakeMailSession session = new FakeMailSession(1L);
        when(factory.open(account))
                .thenThrow(new MailOperationException("connect timed out", Reason.TIMEOUT))
                .thenThrow(new MailOperationException("connection refused", Reason.NETWORK))
                .thenReturn(session);

        assertThat(pool.acquire(account)).isSameAs(session);
        Duration backoff = configuration.getConnectBackoff();
        assertThat(sleeper.getSleeps()).containsExactly(backoff, backoff.multipliedBy(2));
    }

    @Test
    @DisplayName("Authentication failure surfaces at once")
    void testAuthenticationFailureNotRetried() throws Exception {
        when(factory.open(account))
                .thenThrow(new MailOperationException("AUTHENTICATIONFAILED", Reason.AUTHENTICATION));

        assertThatThrownBy(() -> pool.acquire(account))
                .isInstanceOfSatisfying(MailOperationException.class,
                        error -> assertThat(error.getReason()).isEqualTo(Reason.AUTHENTICATION));
        verify(factory, times(1)).open(account);
        assertThat(sleeper.getSleeps()).isEmpty();
    }

    @Test
    @DisplayName("Exhausted connection attempts are reported as retries exhausted")
    void testConnectExhausted() throws Exception {
        when(factory.open(account)).thenThrow(new MailOperationException("unreachable", Reason.NETWORK));

        assertThatThrownBy(() -> pool.acquire(account))
                .isInstanceOfSatisfying(MailOperationException.class,
                        error -> assertThat(error.getReason()).isEqualTo(Reason.RETRIES_EXHAUSTED));
        verify(factory, times(configuration.getConnectMaxAttempts())).open(account);
    }

    @Test
    @DisplayName("Status does not wait for a connect in progress and reports it as in use")
    void testStatusDuringConnect() throws Exception {
        CountDownLatch connecting = new CountDownLatch(1);
        CountDownLatch finishConnect = new CountDownLatch(1);
        when(factory.open(account)).thenAnswer(invocation -> {
            connecting.countDown();
            finishConnect.await(5, TimeUnit.SECONDS);
            return new FakeMailSession(1L);
        });
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<MailSession> pending = executor.submit(() -> pool.acquire(account));
            assertThat(connecting.await(5, TimeUnit.SECONDS)).isTrue();

            PoolStatus during = pool.status();

            assertThat(during.inUse()).isEqualTo(1);
            assertThat(during.idleTimes()).containsEntry(1L, Duration.ZERO);

            finishConnect.countDown();
            assertThat(pending.get(5, TimeUnit.SECONDS)).isNotNull();
            pool.release(account.id());
            clock.advance(Duration.ofSeconds(30));

            PoolStatus after = pool.status();
            assertThat(after.inUse()).isZero();
            assertThat(after.idleTimes()).containsEntry(1L, Duration.ofSeconds(30));
        } finally {
            executor.shutdownNow();
        }
    }
}
