package com.broadcaster.notifications;

import com.broadcaster.risk.MarginAlert;

import java.util.Map;

/**
 * One way of reaching the operator about a margin alert.
 */
public interface NotificationChannel {

    /**
     * Short name reported in alert results, e.g. {@code telegram}.
     */
    String name();

    /**
     * Lowest crossed threshold at which this channel is used.
     */
    double minimumThreshold();

    boolean isConfigured();

    /**
     * Delivers the alert. Returns false when unconfigured or when the provider rejects it.
     */
    boolean send(MarginAlert alert);

    /**
     * Configuration details safe to expose over the status endpoint.
     */
    default Map<String, Object> configStatus() {
        return Map.of("configured", isConfigured());
    }

    static String preview(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "MISSING";
        }
        return secret.length() <= 10 ? secret.charAt(0) + "..." : secret.substring(0, 10) + "...";
    }
}
