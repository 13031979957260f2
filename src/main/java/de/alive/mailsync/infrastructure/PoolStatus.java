package de.alive.mailsync.infrastructure;

import java.time.Duration;
import java.util.Map;

/**
 * @param idleTimes idle time per account id, for entries holding a session or connecting one
 */
public record PoolStatus(int sessions, int inUse, Map<Long, Duration> idleTimes) {

    public PoolStatus {
        idleTimes = Map.copyOf(idleTimes);
    }
}
