package de.alive.mailsync.util;

import java.time.Duration;

/**
 * Blocking pause used between retry attempts and between paced fetches.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
