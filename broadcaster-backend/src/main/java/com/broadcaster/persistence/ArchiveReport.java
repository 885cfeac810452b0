package com.broadcaster.persistence;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one archive pass over all accounts.
 */
public record ArchiveReport(int positionsUpserted, int ordersUpserted, List<String> failedAccounts, Duration elapsed) {

    public ArchiveReport {
        failedAccounts = List.copyOf(failedAccounts);
    }

    public boolean hasFailures() {
        return !failedAccounts.isEmpty();
    }
}
