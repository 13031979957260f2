package de.alive.mailsync.infrastructure;

import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.exception.MailOperationException;
import de.alive.mailsync.util.LogUtils;
import de.alive.mailsync.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;

/**
 * Runs protocol operations with classification-driven retry.
 * <ul>
 *     <li>transient: invalidate the session, wait {@code base * attempt}, retry</li>
 *     <li>protocol state: invalidate the session, retry at once</li>
 *     <li>permanent: fail on the first attempt</li>
 * </ul>
 * Callers only ever see permanent errors or {@link MailOperationException.Reason#RETRIES_EXHAUSTED}.
 */
@Slf4j
public class MailRetryEngine {

    @FunctionalInterface
    public interface SessionOperation<T> {
        T apply(MailSession session) throws MailOperationException;
    }

    @FunctionalInterface
    public interface Operation<T> {
        T call() throws MailOperationException;
    }

    private final SessionProvider sessions;
    private final Duration baseDelay;
    private final Sleeper sleeper;

    public MailRetryEngine(SessionProvider sessions, Duration baseDelay, Sleeper sleeper) {
        this.sessions = sessions;
        this.baseDelay = baseDelay;
        this.sleeper = sleeper;
    }

    public <T> T execute(@NotNull MailAccount account, int maxAttempts, @NotNull SessionOperation<T> operation)
            throws MailOperationException {
        MailOperationException last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                MailSession session = sessions.acquire(account);
                T result = operation.apply(session);
                sessions.release(account.id());
                return result;
            } catch (MailOperationException | RuntimeException e) {
                last = MailErrorTranslator.translate("Operation on account " + account.id(), e);
                handleFailure(account, attempt, maxAttempts, last, true);
            }
        }
        throw exhausted(account, maxAttempts, last);
    }

    /**
     * Same policy for operations that do not use a pooled session, such as SMTP submission.
     */
    public <T> T executeWithoutSession(@NotNull MailAccount account, int maxAttempts, @NotNull Operation<T> operation)
            throws MailOperationException {
        MailOperationException last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.call();
            } catch (MailOperationException | RuntimeException e) {
                last = MailErrorTranslator.translate("Operation on account " + account.id(), e);
                handleFailure(account, attempt, maxAttempts, last, false);
            }
        }
        throw exhausted(account, maxAttempts, last);
    }

    private void handleFailure(MailAccount account, int attempt, int maxAttempts, MailOperationException error,
                               boolean pooled) throws MailOperationException {
        switch (error.getKind()) {
            case PERMANENT -> {
                if (pooled) sessions.release(account.id());
                throw error;
            }
            case PROTOCOL_STATE -> {
                log.warn("{} Protocol state error on account {} (attempt {}/{}), replacing session: {}",
                        LogUtils.RETRY_EMOJI, account.id(), attempt, maxAttempts, error.getMessage());
                if (pooled) sessions.invalidate(account.id());
            }
            case TRANSIENT -> {
                log.warn("{} Transient error on account {} (attempt {}/{}): {}",
                        LogUtils.RETRY_EMOJI, account.id(), attempt, maxAttempts, error.getMessage());
                if (pooled) sessions.invalidate(account.id());
                if (error.getReason() == MailOperationException.Reason.INTERRUPTED) {
                    throw error;
                }
                if (attempt < maxAttempts) {
                    pause(baseDelay.multipliedBy(attempt));
                }
            }
        }
    }

    private void pause(Duration delay) throws MailOperationException {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MailOperationException("Interrupted during retry backoff",
                    MailOperationException.Reason.INTERRUPTED, e);
        }
    }

    private static MailOperationException exhausted(MailAccount account, int maxAttempts, MailOperationException last) {
        log.error("{} Giving up on account {} after {} attempts", LogUtils.ERROR_EMOJI, account.id(), maxAttempts);
        return new MailOperationException("Retries exhausted after " + maxAttempts + " attempts"
                + (last != null ? ": " + last.getMessage() : ""),
                MailOperationException.Reason.RETRIES_EXHAUSTED, last);
    }
}
