package de.alive.mailsync.service;

import de.alive.mailsync.domain.SyncRunSummary;
import reactor.core.publisher.Mono;

/**
 * Immediate answer to a sync trigger. The run itself continues in the background;
 * {@code completion} is cached and replays the summary to late subscribers.
 */
public record SyncAcknowledgement(int accepted, String message, Mono<SyncRunSummary> completion) {

    static SyncAcknowledgement nothingAccepted(String message) {
        return new SyncAcknowledgement(0, message, Mono.just(SyncRunSummary.empty()));
    }
}
