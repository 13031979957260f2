package de.alive.mailsync.domain;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-worker deadline. A worker polls {@link #shouldStop(Duration)} between units of work and stops
 * gracefully once the remaining time drops below the safety margin or the deadline was cancelled.
 */
public class SyncDeadline {

    private final Instant deadline;
    private final Clock clock;
    private volatile boolean cancelled;

    public SyncDeadline(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static SyncDeadline after(Duration timeout, Clock clock) {
        return new SyncDeadline(clock.instant().plus(timeout), clock);
    }

    public static SyncDeadline none(Clock clock) {
        return new SyncDeadline(Instant.MAX, clock);
    }

    public Duration remaining() {
        if (deadline.equals(Instant.MAX)) return Duration.ofSeconds(Long.MAX_VALUE);
        return Duration.between(clock.instant(), deadline);
    }

    public boolean shouldStop(Duration safetyMargin) {
        return cancelled || remaining().compareTo(safetyMargin) < 0;
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
