package de.alive.mailsync.service.config;

import de.alive.mailsync.exception.ConfigurationException;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;

@Data
@Builder(toBuilder = true)
public class SyncConfiguration {

    // Scheduler
    private final int maxConcurrentWorkers;
    private final int defaultSyncLimit;
    private final Duration workerTimeout;
    private final Duration failureRollback;
    private final Duration staleClaimTimeout;
    private final Duration staleClaimRollback;

    // Worker pacing
    private final Duration deadlineSafetyMargin;
    private final Duration interItemDelay;

    // Retry
    private final int readMaxAttempts;
    private final int connectMaxAttempts;
    private final int uploadMaxAttempts;
    private final Duration retryBaseDelay;
    private final Duration connectBackoff;

    // Session pool
    private final Duration sessionIdleTimeout;
    private final Duration sweepInterval;
    private final Duration probeTimeout;
    private final Duration socketTimeout;

    // Forward queue
    private final int forwardBatchSize;

    public static final int DEFAULT_MAX_CONCURRENT_WORKERS = 20;
    public static final int DEFAULT_SYNC_LIMIT = 30;
    public static final Duration DEFAULT_WORKER_TIMEOUT = Duration.ofMinutes(25);
    public static final Duration DEFAULT_SAFETY_MARGIN = Duration.ofMinutes(2);
    public static final Duration DEFAULT_INTER_ITEM_DELAY = Duration.ofMillis(500);
    public static final Duration DEFAULT_FAILURE_ROLLBACK = Duration.ofHours(1);

    public static SyncConfiguration forProduction() {
        return SyncConfiguration.builder()
                .maxConcurrentWorkers(DEFAULT_MAX_CONCURRENT_WORKERS)
                .defaultSyncLimit(DEFAULT_SYNC_LIMIT)
                .workerTimeout(DEFAULT_WORKER_TIMEOUT)
                .failureRollback(DEFAULT_FAILURE_ROLLBACK)
                .staleClaimTimeout(Duration.ofMinutes(60))
                .staleClaimRollback(Duration.ofHours(2))
                .deadlineSafetyMargin(DEFAULT_SAFETY_MARGIN)
                .interItemDelay(DEFAULT_INTER_ITEM_DELAY)
                .readMaxAttempts(5)
                .connectMaxAttempts(3)
                .uploadMaxAttempts(3)
                .retryBaseDelay(Duration.ofSeconds(1))
                .connectBackoff(Duration.ofSeconds(2))
                .sessionIdleTimeout(Duration.ofMinutes(4))
                .sweepInterval(Duration.ofMinutes(2))
                .probeTimeout(Duration.ofSeconds(10))
                .socketTimeout(Duration.ofSeconds(60))
                .forwardBatchSize(10)
                .build();
    }

    public static SyncConfiguration forTesting() {
        return forProduction().toBuilder()
                .maxConcurrentWorkers(4)
                .defaultSyncLimit(10)
                .workerTimeout(Duration.ofMinutes(5))
                .interItemDelay(Duration.ZERO)
                .retryBaseDelay(Duration.ofMillis(10))
                .connectBackoff(Duration.ofMillis(10))
                .probeTimeout(Duration.ofSeconds(1))
                .socketTimeout(Duration.ofSeconds(5))
                .build();
    }

    public void validate() {
        requirePositive(maxConcurrentWorkers, "maxConcurrentWorkers");
        requirePositive(defaultSyncLimit, "defaultSyncLimit");
        requirePositive(readMaxAttempts, "readMaxAttempts");
        requirePositive(connectMaxAttempts, "connectMaxAttempts");
        requirePositive(uploadMaxAttempts, "uploadMaxAttempts");
        requirePositive(forwardBatchSize, "forwardBatchSize");
        requirePositive(workerTimeout, "workerTimeout");
        requirePositive(sessionIdleTimeout, "sessionIdleTimeout");
        requirePositive(sweepInterval, "sweepInterval");
        requirePositive(probeTimeout, "probeTimeout");
        requirePositive(staleClaimTimeout, "staleClaimTimeout");
        requireNonNegative(interItemDelay, "interItemDelay");
        requireNonNegative(retryBaseDelay, "retryBaseDelay");
        requireNonNegative(connectBackoff, "connectBackoff");
        requireNonNegative(failureRollback, "failureRollback");
        requireNonNegative(staleClaimRollback, "staleClaimRollback");
        requireNonNegative(deadlineSafetyMargin, "deadlineSafetyMargin");
        requireNonNegative(socketTimeout, "socketTimeout");

        if (deadlineSafetyMargin.compareTo(workerTimeout) >= 0) {
            throw new ConfigurationException("Deadline safety margin must be shorter than the worker timeout",
                    "deadlineSafetyMargin", ConfigurationException.ConfigurationType.INCONSISTENT_LIMITS);
        }
        if (staleClaimTimeout.compareTo(workerTimeout) <= 0) {
            throw new ConfigurationException("Stale claim timeout must exceed the worker timeout",
                    "staleClaimTimeout", ConfigurationException.ConfigurationType.INCONSISTENT_LIMITS);
        }
    }

    public String getSummary() {
        return String.format(
                "Workers: %d, SyncLimit: %d, Timeout: %dm, Margin: %ds, Pace: %dms, ReadAttempts: %d, IdleTimeout: %ds",
                maxConcurrentWorkers, defaultSyncLimit, workerTimeout.toMinutes(), deadlineSafetyMargin.toSeconds(),
                interItemDelay.toMillis(), readMaxAttempts, sessionIdleTimeout.toSeconds());
    }

    private static void requirePositive(int value, String key) {
        if (value <= 0) {
            throw new ConfigurationException(key + " must be positive", key,
                    ConfigurationException.ConfigurationType.INVALID_VALUE);
        }
    }

    private static void requirePositive(Duration value, String key) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigurationException(key + " must be a positive duration", key,
                    ConfigurationException.ConfigurationType.INVALID_VALUE);
        }
    }

    private static void requireNonNegative(Duration value, String key) {
        if (value == null || value.isNegative()) {
            throw new ConfigurationException(key + " must not be negative", key,
                    ConfigurationException.ConfigurationType.INVALID_VALUE);
        }
    }
}
