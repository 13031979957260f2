package de.alive.mailsync;

import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.domain.SyncRequest;
import de.alive.mailsync.exception.SyncStoreException;
import de.alive.mailsync.infrastructure.ImapSessionFactory;
import de.alive.mailsync.infrastructure.MailRetryEngine;
import de.alive.mailsync.infrastructure.MailSessionPool;
import de.alive.mailsync.infrastructure.MessageContentExtractor;
import de.alive.mailsync.infrastructure.SmtpMailSender;
import de.alive.mailsync.service.AccountSyncWorker;
import de.alive.mailsync.service.AttachmentStorageService;
import de.alive.mailsync.service.ConfigurationService;
import de.alive.mailsync.service.ForwardService;
import de.alive.mailsync.service.MailProtocolClient;
import de.alive.mailsync.service.UnifiedSyncService;
import de.alive.mailsync.service.config.SyncConfiguration;
import de.alive.mailsync.storage.AttachmentExpander;
import de.alive.mailsync.storage.InMemorySyncStore;
import de.alive.mailsync.storage.LocalDirectoryUploader;
import de.alive.mailsync.storage.SyncStore;
import de.alive.mailsync.util.LogUtils;
import de.alive.mailsync.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

@Slf4j
public class MailSyncApplication {

    private final ConfigurationService configurationService;
    private final SyncConfiguration configuration;
    private final SyncStore store;
    private final MailSessionPool sessionPool;
    private final UnifiedSyncService syncService;
    private final ForwardService forwardService;
    private Disposable forwardJob;

    public MailSyncApplication(ConfigurationService configurationService) {
        this.configurationService = configurationService;
        this.configuration = configurationService.loadSyncConfiguration();
        Clock clock = Clock.systemUTC();

        MessageContentExtractor extractor = new MessageContentExtractor();
        this.store = new InMemorySyncStore();
        this.sessionPool = new MailSessionPool(new ImapSessionFactory(configuration, extractor), configuration,
                clock, Sleeper.SYSTEM);

        MailRetryEngine retryEngine = new MailRetryEngine(sessionPool, configuration.getRetryBaseDelay(), Sleeper.SYSTEM);
        MailProtocolClient client = new MailProtocolClient(retryEngine, new SmtpMailSender(configuration), extractor,
                configuration);
        AttachmentStorageService attachmentStorage = new AttachmentStorageService(
                new LocalDirectoryUploader(configurationService.attachmentDirectory()), AttachmentExpander.IDENTITY,
                configuration.getUploadMaxAttempts(), configuration.getRetryBaseDelay(), Sleeper.SYSTEM);

        AccountSyncWorker worker = new AccountSyncWorker(client, store, attachmentStorage, configuration, clock,
                Sleeper.SYSTEM);
        this.syncService = new UnifiedSyncService(store, worker, configuration, clock);
        this.forwardService = new ForwardService(store, client);
    }

    public static void main(String[] args) {
        log.info("{} Starting mail sync...", LogUtils.ROCKET_EMOJI);

        try {
            MailSyncApplication app = new MailSyncApplication(new ConfigurationService());
            app.run();
        } catch (Exception e) {
            log.error("{} Application failed: {}", LogUtils.ERROR_EMOJI, e.getMessage(), e);
            System.exit(1);
        }
    }

    public void run() throws SyncStoreException, InterruptedException {
        MailAccount account = configurationService.loadBootstrapAccount();
        store.saveAccount(account);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            shutdown();
            stopped.countDown();
        }, "mailsync-shutdown"));

        sessionPool.start();
        syncService.startMaintenance();
        syncService.schedulePeriodic(new SyncRequest(configurationService.shard().orElse(null),
                configuration.getDefaultSyncLimit()), configurationService.triggerInterval());
        startForwardQueue(configurationService.triggerInterval());

        log.info("{} Mail sync running, press Ctrl+C to stop", LogUtils.SUCCESS_EMOJI);
        stopped.await();
    }

    private void startForwardQueue(Duration interval) {
        forwardJob = Flux.interval(interval, interval, Schedulers.boundedElastic())
                .subscribe(tick -> {
                    try {
                        forwardService.processPending(configuration.getForwardBatchSize());
                    } catch (SyncStoreException e) {
                        log.error("{} Forward queue run failed: {}", LogUtils.ERROR_EMOJI, e.getMessage(), e);
                    }
                });
    }

    public void shutdown() {
        log.info("{} Shutting down...", LogUtils.STOP_EMOJI);
        if (forwardJob != null) {
            forwardJob.dispose();
        }
        syncService.shutdown();
        sessionPool.shutdown();
        log.info("{} Application shutdown completed", LogUtils.SUCCESS_EMOJI);
    }
}
