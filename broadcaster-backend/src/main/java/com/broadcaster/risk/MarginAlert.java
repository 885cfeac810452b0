package com.broadcaster.risk;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * One margin alert ready to be rendered for each notification channel.
 *
 * @param threshold the highest threshold the margin ratio crossed
 */
public record MarginAlert(
    String accountId,
    String accountName,
    double marginRatio,
    double equity,
    double threshold,
    Instant createdAt
) {
    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    public static final double CRITICAL_THRESHOLD = 0.90;
    public static final double EMERGENCY_THRESHOLD = 0.95;

    /**
     * Sample alert used by the channel self-test.
     */
    public static MarginAlert test(Instant at) {
        return new MarginAlert("test", "TEST ACCOUNT", 0.85, 0.0, 0.80, at);
    }

    public boolean isCritical() {
        return threshold >= CRITICAL_THRESHOLD;
    }

    public boolean isTest() {
        return "test".equals(accountId);
    }

    /**
     * Pushover priority: 2 (emergency) from 95%, 1 from 90%, otherwise 0.
     */
    public int pushoverPriority() {
        if (isTest()) {
            return 0;
        }
        if (threshold >= EMERGENCY_THRESHOLD) {
            return 2;
        }
        return threshold >= CRITICAL_THRESHOLD ? 1 : 0;
    }

    public String title() {
        return isTest() ? "Test Alert" : "Margin Alert: " + accountName;
    }

    public String richMessage() {
        return String.format(Locale.US, "⚠️ MARGIN ALERT ⚠️\n\n%s\nMargin: %.1f%%\n%s",
            accountName, marginRatio * 100, TIMESTAMP.format(createdAt));
    }

    public String plainMessage() {
        return String.format(Locale.US, "MARGIN ALERT\n%s\nMargin: %.1f%%\n%s",
            accountName, marginRatio * 100, TIMESTAMP.format(createdAt));
    }

    /**
     * Text-to-speech script for the voice call, read in Polish.
     */
    public String callMessage() {
        if (isTest()) {
            return "To jest test systemu alertów Extended Broadcaster. "
                + "Jeśli słyszysz tę wiadomość, system działa poprawnie.";
        }
        return String.format(Locale.US,
            "Uwaga! Alarm margin dla konta %s. Margin wynosi %.0f procent. Equity wynosi %.0f dolarów.",
            accountName, marginRatio * 100, equity);
    }
}
