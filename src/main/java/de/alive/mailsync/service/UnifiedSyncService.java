package de.alive.mailsync.service;

import de.alive.mailsync.domain.AccountSyncResult;
import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.domain.SyncDeadline;
import de.alive.mailsync.domain.SyncRequest;
import de.alive.mailsync.domain.SyncRunSummary;
import de.alive.mailsync.exception.SyncStoreException;
import de.alive.mailsync.service.config.SyncConfiguration;
import de.alive.mailsync.storage.SyncStore;
import de.alive.mailsync.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Claims due accounts and runs one worker per account under a global concurrency ceiling.
 * <p>
 * Slots are reserved at claim time, under the claim lock, and released when the worker's publisher
 * terminates, whatever the outcome.
 */
@Slf4j
public class UnifiedSyncService {

    private final SyncStore store;
    private final AccountSyncWorker worker;
    private final SyncConfiguration configuration;
    private final Clock clock;
    private final Scheduler workerScheduler;

    private final AtomicInteger runningWorkers = new AtomicInteger(0);
    private final Object claimLock = new Object();
    private final Set<SyncDeadline> activeDeadlines = ConcurrentHashMap.newKeySet();
    private final Disposable.Composite jobs = Disposables.composite();

    public UnifiedSyncService(SyncStore store, AccountSyncWorker worker, SyncConfiguration configuration, Clock clock) {
        this.store = store;
        this.worker = worker;
        this.configuration = configuration;
        this.clock = clock;
        this.workerScheduler = Schedulers.newBoundedElastic(configuration.getMaxConcurrentWorkers(),
                Integer.MAX_VALUE, "sync-worker", 60, true);

        log.info("{} UnifiedSyncService initialized: {}", LogUtils.PROCESS_EMOJI, configuration.getSummary());
    }

    /**
     * Claims as many due accounts as there are free worker slots and starts them in the background.
     */
    @NotNull
    public SyncAcknowledgement trigger(@NotNull SyncRequest request) {
        int limit = request.syncLimit() > 0 ? request.syncLimit() : configuration.getDefaultSyncLimit();
        List<MailAccount> claimed;

        synchronized (claimLock) {
            int freeSlots = configuration.getMaxConcurrentWorkers() - runningWorkers.get();
            if (freeSlots <= 0) {
                log.info("{} All {} worker slots busy, nothing claimed", LogUtils.LOCK_EMOJI,
                        configuration.getMaxConcurrentWorkers());
                return SyncAcknowledgement.nothingAccepted("All worker slots are busy");
            }
            try {
                claimed = store.claimAccounts(request.shard(), freeSlots, clock.instant());
            } catch (SyncStoreException e) {
                log.error("{} Claiming accounts failed: {}", LogUtils.ERROR_EMOJI, e.getMessage(), e);
                return SyncAcknowledgement.nothingAccepted("Claiming accounts failed: " + e.getMessage());
            }
            runningWorkers.addAndGet(claimed.size());
        }

        if (claimed.isEmpty()) {
            log.debug("{} No accounts due for shard {}", LogUtils.INFO_EMOJI, request.shard());
            return SyncAcknowledgement.nothingAccepted("No accounts due");
        }

        Instant started = clock.instant();
        log.info("{} Starting sync of {} accounts (limit {}, shard {})", LogUtils.ROCKET_EMOJI, claimed.size(),
                limit, request.shard() == null ? "all" : request.shard());

        Mono<SyncRunSummary> completion = Flux.fromIterable(claimed)
                .flatMap(account -> runWorker(account, limit), claimed.size())
                .collectList()
                .map(results -> new SyncRunSummary(results, Duration.between(started, clock.instant())))
                .doOnNext(this::logSummary)
                .cache();
        completion.subscribe(
                summary -> { },
                error -> log.error("{} Sync run failed: {}", LogUtils.ERROR_EMOJI, error.getMessage(), error));

        return new SyncAcknowledgement(claimed.size(), "Sync started for " + claimed.size() + " accounts", completion);
    }

    private Mono<AccountSyncResult> runWorker(MailAccount account, int limit) {
        SyncDeadline deadline = SyncDeadline.after(configuration.getWorkerTimeout(), clock);
        activeDeadlines.add(deadline);

        return Mono.fromCallable(() -> worker.run(account, limit, deadline))
                .onErrorResume(error -> {
                    log.error("{} Worker for account {} crashed: {}", LogUtils.ERROR_EMOJI, account.id(),
                            error.getMessage(), error);
                    return Mono.just(AccountSyncResult.failure(account.id(), String.valueOf(error.getMessage())));
                })
                .map(result -> releaseClaim(account, result))
                .subscribeOn(workerScheduler)
                .doFinally(signal -> {
                    activeDeadlines.remove(deadline);
                    runningWorkers.decrementAndGet();
                });
    }

    private AccountSyncResult releaseClaim(MailAccount account, AccountSyncResult result) {
        Instant now = clock.instant();
        try {
            if (result.isSuccess()) {
                store.completeClaim(account.id(), now);
            } else {
                store.failClaim(account.id(), now.minus(configuration.getFailureRollback()));
            }
        } catch (SyncStoreException e) {
            log.error("{} Could not release claim of account {}, stale-claim cleanup will pick it up: {}",
                    LogUtils.ERROR_EMOJI, account.id(), e.getMessage());
        }
        return result;
    }

    /**
     * Releases claims older than the stale-claim timeout, left behind by workers that died without cleanup.
     */
    public int releaseStaleClaims() throws SyncStoreException {
        Instant now = clock.instant();
        int released = store.releaseStaleClaims(now.minus(configuration.getStaleClaimTimeout()),
                now.minus(configuration.getStaleClaimRollback()));
        if (released > 0) {
            log.warn("{} Released {} stale account claims", LogUtils.WARNING_EMOJI, released);
        }
        return released;
    }

    /**
     * Starts the recurring stale-claim cleanup.
     */
    public void startMaintenance() {
        Duration interval = configuration.getSweepInterval();
        jobs.add(Flux.interval(interval, interval, Schedulers.boundedElastic())
                .subscribe(tick -> {
                    try {
                        releaseStaleClaims();
                    } catch (SyncStoreException e) {
                        log.error("{} Stale claim cleanup failed: {}", LogUtils.ERROR_EMOJI, e.getMessage(), e);
                    }
                }));
    }

    /**
     * Triggers {@code request} every {@code interval}, starting immediately.
     */
    public void schedulePeriodic(@NotNull SyncRequest request, @NotNull Duration interval) {
        jobs.add(Flux.interval(Duration.ZERO, interval, Schedulers.boundedElastic())
                .subscribe(tick -> {
                    SyncAcknowledgement acknowledgement = trigger(request);
                    log.debug("{} Periodic trigger: {}", LogUtils.HEARTBEAT_EMOJI, acknowledgement.message());
                }));
        log.info("{} Periodic sync every {}", LogUtils.CLOCK_EMOJI, LogUtils.formatDuration(interval));
    }

    public int getRunningWorkers() {
        return runningWorkers.get();
    }

    /**
     * Stops recurring jobs and asks running workers to wind down at their next checkpoint.
     */
    public void shutdown() {
        jobs.dispose();
        activeDeadlines.forEach(SyncDeadline::cancel);
        log.info("{} Shutdown requested, {} workers still running", LogUtils.STOP_EMOJI, runningWorkers.get());
        workerScheduler.disposeGracefully()
                .timeout(Duration.ofSeconds(30))
                .onErrorResume(error -> {
                    log.warn("{} Workers did not finish in time: {}", LogUtils.WARNING_EMOJI, error.getMessage());
                    workerScheduler.dispose();
                    return Mono.empty();
                })
                .block();
    }

    private void logSummary(SyncRunSummary summary) {
        log.info("{} Sync run finished in {}: {} accounts, {}, {} messages synced", LogUtils.CHART_EMOJI,
                LogUtils.formatDuration(summary.elapsed()), summary.accounts(),
                LogUtils.formatOutcome(summary.succeeded(), summary.failed()), summary.messagesSynced());
    }
}
