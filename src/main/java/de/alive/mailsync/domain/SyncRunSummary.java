package de.alive.mailsync.domain;

import java.time.Duration;
import java.util.List;

public record SyncRunSummary(List<AccountSyncResult> results, Duration elapsed) {

    public SyncRunSummary {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static SyncRunSummary empty() {
        return new SyncRunSummary(List.of(), Duration.ZERO);
    }

    public int accounts() {
        return results.size();
    }

    public int succeeded() {
        return (int) results.stream().filter(AccountSyncResult::isSuccess).count();
    }

    public int failed() {
        return accounts() - succeeded();
    }

    public int messagesSynced() {
        return results.stream().mapToInt(AccountSyncResult::succeeded).sum();
    }
}
