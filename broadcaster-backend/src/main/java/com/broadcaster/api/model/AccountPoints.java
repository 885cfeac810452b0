package com.broadcaster.api.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Earned reward points for one account, read from {@code /user/rewards/earned}.
 */
public record AccountPoints(String accountId, String accountName, double totalPoints, double lastWeekPoints) {

    /**
     * Sums {@code points} over every record of the payload. The most recent record counts as last week.
     */
    public static Optional<AccountPoints> from(JsonNode payload, String accountId, String accountName) {
        var records = Payloads.records(payload);
        if (records.isEmpty()) {
            return Optional.empty();
        }
        double total = 0;
        for (JsonNode record : records) {
            total += Payloads.decimalOrZero(record, "points", "earnedPoints", "totalPoints");
        }
        double lastWeek = Payloads.decimalOrZero(records.get(records.size() - 1), "points", "earnedPoints");
        return Optional.of(new AccountPoints(accountId, accountName, total, lastWeek));
    }
}
