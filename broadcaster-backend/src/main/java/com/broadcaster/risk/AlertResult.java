package com.broadcaster.risk;

import java.util.List;

/**
 * Outcome of one margin check.
 *
 * @param thresholdTriggered highest crossed threshold, null when below all
 * @param alertsSent         channels that reported success
 */
public record AlertResult(
    String accountId,
    String accountName,
    double marginRatio,
    double equity,
    Double thresholdTriggered,
    boolean cooldownActive,
    List<String> alertsSent
) {
    public AlertResult {
        alertsSent = List.copyOf(alertsSent);
    }

    public boolean alerted() {
        return thresholdTriggered != null && !cooldownActive;
    }
}
