package de.alive.mailsync.infrastructure;

import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.exception.MailOperationException;
import de.alive.mailsync.service.config.SyncConfiguration;
import de.alive.mailsync.util.LogUtils;
import de.alive.mailsync.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps at most one live session per account and hands it out for reuse.
 * <p>
 * Lock order: the map lock is only held for insert, lookup and eviction. Entry work happens under the
 * entry's own lock; the sweeper never blocks on an entry lock, it skips entries that are busy.
 */
@Slf4j
public class MailSessionPool implements SessionProvider {

    private final MailSessionFactory factory;
    private final SyncConfiguration configuration;
    private final Clock clock;
    private final Sleeper sleeper;

    private final Map<Long, PooledSession> entries = new HashMap<>();
    private final Object entriesLock = new Object();
    private volatile Disposable sweeper;

    public MailSessionPool(MailSessionFactory factory, SyncConfiguration configuration, Clock clock, Sleeper sleeper) {
        this.factory = factory;
        this.configuration = configuration;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public MailSessionPool(MailSessionFactory factory, SyncConfiguration configuration) {
        this(factory, configuration, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    @NotNull
    @Override
    public MailSession acquire(@NotNull MailAccount account) throws MailOperationException {
        while (true) {
            PooledSession entry = entryFor(account.id());
            entry.lock.lock();
            try {
                if (entry.retired) {
                    // evicted between lookup and lock
                    continue;
                }
                MailSession current = entry.session;
                if (current != null) {
                    if (isHealthy(current)) {
                        entry.markInUse(clock.instant());
                        return current;
                    }
                    log.info("{} Replacing unhealthy session for account {}", LogUtils.RETRY_EMOJI, account.id());
                    closeQuietly(current);
                    entry.session = null;
                }

                MailSession created = connectWithRetry(account);
                entry.session = created;
                entry.markInUse(clock.instant());
                return created;
            } finally {
                entry.lock.unlock();
            }
        }
    }

    @Override
    public void release(long accountId) {
        PooledSession entry;
        synchronized (entriesLock) {
            entry = entries.get(accountId);
        }
        if (entry == null) return;

        entry.lock.lock();
        try {
            entry.inUse = false;
            entry.lastUsed = clock.instant();
        } finally {
            entry.lock.unlock();
        }
    }

    @Override
    public void invalidate(long accountId) {
        PooledSession entry;
        synchronized (entriesLock) {
            entry = entries.get(accountId);
        }
        if (entry == null) return;

        entry.lock.lock();
        try {
            if (entry.session != null) {
                log.debug("{} Invalidating session for account {}", LogUtils.STOP_EMOJI, accountId);
                closeQuietly(entry.session);
                entry.session = null;
            }
            entry.inUse = false;
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Closes sessions idle for longer than the configured idle timeout.
     *
     * @return number of sessions closed
     */
    public int sweepIdle() {
        Instant threshold = clock.instant().minus(configuration.getSessionIdleTimeout());
        List<MailSession> toClose = new ArrayList<>();

        synchronized (entriesLock) {
            Iterator<PooledSession> iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                PooledSession entry = iterator.next();
                if (!entry.lock.tryLock()) {
                    continue;
                }
                try {
                    if (entry.inUse || entry.lastUsed.isAfter(threshold)) {
                        continue;
                    }
                    if (entry.session != null) {
                        toClose.add(entry.session);
                        entry.session = null;
                    }
                    entry.retired = true;
                    iterator.remove();
                } finally {
                    entry.lock.unlock();
                }
            }
        }

        toClose.forEach(MailSessionPool::closeQuietly);
        if (!toClose.isEmpty()) {
            log.info("{} Closed {} idle sessions", LogUtils.HEARTBEAT_EMOJI, toClose.size());
        }
        return toClose.size();
    }

    public void start() {
        if (sweeper != null && !sweeper.isDisposed()) {
            return;
        }
        Duration interval = configuration.getSweepInterval();
        sweeper = Flux.interval(interval, interval, Schedulers.boundedElastic())
                .subscribe(tick -> {
                    try {
                        sweepIdle();
                    } catch (RuntimeException e) {
                        log.error("{} Idle sweep failed: {}", LogUtils.ERROR_EMOJI, e.getMessage(), e);
                    }
                });
        log.info("{} Session pool started, idle sweep every {}", LogUtils.ROCKET_EMOJI,
                LogUtils.formatDuration(interval));
    }

    /**
     * Snapshot of the pool. An entry whose lock is held is being acquired and counts as in use with zero idle time.
     */
    @NotNull
    public PoolStatus status() {
        Instant now = clock.instant();
        Map<Long, Duration> idle = new HashMap<>();
        int inUse = 0;
        synchronized (entriesLock) {
            for (Map.Entry<Long, PooledSession> e : entries.entrySet()) {
                PooledSession entry = e.getValue();
                if (!entry.lock.tryLock()) {
                    inUse++;
                    idle.put(e.getKey(), Duration.ZERO);
                    continue;
                }
                try {
                    if (entry.session == null) continue;
                    if (entry.inUse) inUse++;
                    idle.put(e.getKey(), Duration.between(entry.lastUsed, now));
                } finally {
                    entry.lock.unlock();
                }
            }
        }
        return new PoolStatus(idle.size(), inUse, idle);
    }

    public void shutdown() {
        Disposable current = sweeper;
        if (current != null) {
            current.dispose();
        }

        List<MailSession> toClose = new ArrayList<>();
        synchronized (entriesLock) {
            for (PooledSession entry : entries.values()) {
                entry.lock.lock();
                try {
                    if (entry.session != null) {
                        toClose.add(entry.session);
                        entry.session = null;
                    }
                    entry.retired = true;
                } finally {
                    entry.lock.unlock();
                }
            }
            entries.clear();
        }
        toClose.forEach(MailSessionPool::closeQuietly);
        log.info("{} Session pool shut down, {} sessions closed", LogUtils.STOP_EMOJI, toClose.size());
    }

    private PooledSession entryFor(long accountId) {
        synchronized (entriesLock) {
            return entries.computeIfAbsent(accountId, id -> new PooledSession(clock.instant()));
        }
    }

    private boolean isHealthy(MailSession session) {
        if (!session.isUsable()) {
            return false;
        }
        Boolean alive = Mono.fromCallable(() -> {
                    session.probe();
                    return true;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(configuration.getProbeTimeout())
                .onErrorResume(error -> {
                    log.debug("{} Probe failed for account {}: {}", LogUtils.WARNING_EMOJI,
                            session.accountId(), error.getMessage());
                    return Mono.just(false);
                })
                .block();
        return Boolean.TRUE.equals(alive);
    }

    private MailSession connectWithRetry(MailAccount account) throws MailOperationException {
        int maxAttempts = configuration.getConnectMaxAttempts();
        MailOperationException last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return factory.open(account);
            } catch (MailOperationException e) {
                last = e;
                if (!e.isRecoverable()) {
                    throw e;
                }
                log.warn("{} Connection attempt {}/{} for account {} failed: {}", LogUtils.WARNING_EMOJI,
                        attempt, maxAttempts, account.id(), e.getMessage());
                if (attempt < maxAttempts) {
                    pause(configuration.getConnectBackoff().multipliedBy(attempt));
                }
            }
        }
        throw new MailOperationException("Could not connect account " + account.id() + " after "
                + maxAttempts + " attempts", MailOperationException.Reason.RETRIES_EXHAUSTED, last);
    }

    private void pause(Duration duration) throws MailOperationException {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MailOperationException("Interrupted while waiting to reconnect",
                    MailOperationException.Reason.INTERRUPTED, e);
        }
    }

    private static void closeQuietly(MailSession session) {
        try {
            session.close();
        } catch (RuntimeException e) {
            log.debug("{} Error closing session for account {}: {}", LogUtils.WARNING_EMOJI,
                    session.accountId(), e.getMessage());
        }
    }

    private static final class PooledSession {
        private final ReentrantLock lock = new ReentrantLock();
        private MailSession session;
        private Instant lastUsed;
        private boolean inUse;
        private boolean retired;

        private PooledSession(Instant createdAt) {
            this.lastUsed = createdAt;
        }

        private void markInUse(Instant now) {
            inUse = true;
            lastUsed = now;
        }
    }
}
