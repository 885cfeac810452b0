package com.broadcaster.risk;

import com.broadcaster.api.model.BalanceSummary;
import com.broadcaster.cache.AccountSnapshot;
import com.broadcaster.notifications.NotificationChannel;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Margin-usage alerting with tiered channels and a per-threshold cooldown.
 *
 * Tiers: Telegram and Pushover from 70%, SMS from 80%, voice call from 90%.
 * An alert for a threshold is not repeated within the cooldown; once the ratio falls
 * below a threshold its state is cleared so the next crossing alerts again.
 */
public final class MarginRiskMonitor {
    private static final Logger logger = LoggerFactory.getLogger(MarginRiskMonitor.class);

    private final List<Double> thresholds;
    private final Duration cooldown;
    private final List<NotificationChannel> channels;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final AlertState state;

    public MarginRiskMonitor(List<Double> thresholds, Duration cooldown, List<NotificationChannel> channels,
                             AlertState state, Clock clock, MeterRegistry meterRegistry) {
        if (thresholds.isEmpty()) {
            throw new IllegalArgumentException("At least one margin threshold is required");
        }
        this.thresholds = thresholds.stream().sorted().toList();
        this.cooldown = cooldown;
        this.channels = List.copyOf(channels);
        this.state = state;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        long configured = channels.stream().filter(NotificationChannel::isConfigured).count();
        logger.info("🛡️ Margin monitor: thresholds {}, cooldown {} min, {}/{} channels configured",
            this.thresholds, cooldown.toMinutes(), configured, channels.size());
    }

    /**
     * Highest threshold not above {@code marginRatio}, or empty when below all of them.
     */
    public Optional<Double> thresholdLevel(double marginRatio) {
        Double level = null;
        for (double threshold : thresholds) {
            if (marginRatio >= threshold) {
                level = threshold;
            }
        }
        return Optional.ofNullable(level);
    }

    /**
     * Reads the cached balance of one account and checks it; empty when no margin ratio is known yet.
     */
    public Optional<AlertResult> checkAccount(AccountSnapshot snapshot) {
        var balance = snapshot.get(AccountSnapshot.Field.BALANCE);
        if (balance == null) {
            return Optional.empty();
        }
        return BalanceSummary.from(balance)
            .filter(BalanceSummary::hasMarginRatio)
            .map(summary -> checkAndAlert(snapshot.account().id(), snapshot.account().name(),
                summary.marginRatio(), summary.equity()));
    }

    public AlertResult checkAndAlert(String accountId, String accountName, double marginRatio, double equity) {
        Optional<Double> level = thresholdLevel(marginRatio);
        if (level.isEmpty()) {
            state.clear(accountId);
            return new AlertResult(accountId, accountName, marginRatio, equity, null, false, List.of());
        }

        double threshold = level.get();
        state.clearAbove(accountId, threshold);

        Instant now = clock.instant();
        if (!state.canSend(accountId, threshold, now, cooldown)) {
            return new AlertResult(accountId, accountName, marginRatio, equity, threshold, true, List.of());
        }

        MarginAlert alert = new MarginAlert(accountId, accountName, marginRatio, equity, threshold, now);
        logger.atWarn()
            .addKeyValue("account", accountName)
            .addKeyValue("marginRatio", marginRatio)
            .addKeyValue("threshold", threshold)
            .log("🚨 Margin threshold crossed");

        List<String> sent = new ArrayList<>();
        for (NotificationChannel channel : channels) {
            if (threshold >= channel.minimumThreshold() && deliver(channel, alert)) {
                sent.add(channel.name());
            }
        }

        // marked even when every channel failed
        state.markSent(accountId, threshold, now);
        meterRegistry.counter("broadcaster.alerts.triggered",
            "threshold", String.format(Locale.US, "%.2f", threshold)).increment();

        return new AlertResult(accountId, accountName, marginRatio, equity, threshold, false, sent);
    }

    /**
     * Sends the sample alert through every channel regardless of tier.
     */
    public Map<String, Boolean> testAllChannels() {
        MarginAlert alert = MarginAlert.test(clock.instant());
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (NotificationChannel channel : channels) {
            results.put(channel.name(), deliver(channel, alert));
        }
        return results;
    }

    public Map<String, Object> channelStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        for (NotificationChannel channel : channels) {
            Map<String, Object> entry = new LinkedHashMap<>(channel.configStatus());
            entry.put("minimum_threshold", channel.minimumThreshold());
            status.put(channel.name(), entry);
        }
        return status;
    }

    public List<Double> getThresholds() {
        return thresholds;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    public AlertState getState() {
        return state;
    }

    private boolean deliver(NotificationChannel channel, MarginAlert alert) {
        try {
            return channel.send(alert);
        } catch (RuntimeException e) {
            logger.error("❌ {} failed for {}: {}", channel.name(), alert.accountName(), e.getMessage());
            return false;
        }
    }
}
