package com.broadcaster.config;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.ToLongFunction;

/**
 * Configuration for the broadcaster: accounts, cadences, alert thresholds, order-book stream.
 * Loads from environment variables first, then config.properties, then defaults.
 */
public final class Config {
    private static final Logger logger = LoggerFactory.getLogger(Config.class);
    private static final String CONFIG_FILE = "config.properties";

    @Positive(message = "Fast poll interval must be positive")
    private final long fastPollIntervalMs;

    @Min(value = 1, message = "Medium cadence must be at least every fast tick")
    private final int mediumEveryTicks;

    @Min(value = 1, message = "Slow cadence must be at least every fast tick")
    private final int slowEveryTicks;

    @Min(value = 1, message = "Points cadence must be at least every slow tick")
    private final int pointsEverySlowTicks;

    @Min(value = 1, message = "Alert cooldown must be at least one minute")
    private final int alertCooldownMinutes;

    @NotEmpty(message = "At least one margin threshold is required")
    private final List<@DecimalMin("0.0") @DecimalMax("1.0") Double> marginThresholds;

    @Min(value = 1, message = "Order book depth must be at least one level")
    private final int orderBookMaxLevels;

    @Min(value = 1, message = "Archive page size must be positive")
    private final int archivePageSize;

    @Min(value = 1, message = "Archive interval must be at least one minute")
    private final int archiveIntervalMinutes;

    @Min(1) @Max(65535)
    private final int serverPort;

    @NotBlank(message = "Database path is required")
    private final String databasePath;

    @Positive(message = "Request timeout must be positive")
    private final long requestTimeoutSeconds;

    @Min(value = 1, message = "Poll executor needs at least one thread")
    private final int pollThreads;

    @Positive(message = "Reconnect base delay must be positive")
    private final long reconnectBaseSeconds;

    @Positive(message = "Reconnect cap must be positive")
    private final long reconnectMaxSeconds;

    private final ProxySettings orderBookProxy;

    private final Map<String, String> env;
    private final Properties properties;

    public Config() {
        this(System.getenv(), loadProperties());
    }

    public Config(Map<String, String> env, Properties properties) {
        this.env = env;
        this.properties = properties;

        this.fastPollIntervalMs = getLongProperty("FAST_POLL_INTERVAL_MS", 250);
        this.mediumEveryTicks = getIntProperty("TRADES_POLL_EVERY_TICKS", 4);
        this.slowEveryTicks = getIntProperty("RISK_CHECK_EVERY_TICKS", 20);
        this.pointsEverySlowTicks = getIntProperty("POINTS_POLL_EVERY_SLOW_TICKS", 60);
        this.alertCooldownMinutes = getIntProperty("ALERT_COOLDOWN_MINUTES", 30);
        this.marginThresholds = parseThresholds(getProperty("MARGIN_THRESHOLDS", "0.70,0.80,0.90,0.95"));
        this.orderBookMaxLevels = getIntProperty("ORDERBOOK_MAX_LEVELS", 10);
        this.archivePageSize = getIntProperty("HISTORY_PAGE_SIZE", 100);
        this.archiveIntervalMinutes = getIntProperty("HISTORY_ARCHIVE_INTERVAL_MINUTES", 10);
        this.serverPort = getIntProperty("PORT", 8000);
        this.databasePath = getProperty("DATABASE_PATH", "broadcaster.db");
        this.requestTimeoutSeconds = getLongProperty("REQUEST_TIMEOUT_SECONDS", 15);
        this.pollThreads = getIntProperty("POLL_THREADS", 16);
        this.reconnectBaseSeconds = getLongProperty("ORDERBOOK_RECONNECT_BASE_SECONDS", 5);
        this.reconnectMaxSeconds = getLongProperty("ORDERBOOK_RECONNECT_MAX_SECONDS", 300);
        this.orderBookProxy = parseOrderBookProxy(getProperty("ORDERBOOK_PROXY_URL"));
    }

    private static Properties loadProperties() {
        var props = new Properties();
        try (var fis = new FileInputStream(CONFIG_FILE)) {
            props.load(fis);
            logger.debug("Loaded properties from {}", CONFIG_FILE);
        } catch (IOException e) {
            logger.debug("No config.properties found");
        }
        return props;
    }

    private static List<Double> parseThresholds(String raw) {
        try {
            return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Double::parseDouble)
                .sorted()
                .toList();
        } catch (NumberFormatException e) {
            throw new IllegalStateException("MARGIN_THRESHOLDS must be comma-separated numbers, got '" + raw + "'", e);
        }
    }

    private static ProxySettings parseOrderBookProxy(String raw) {
        try {
            return ProxySettings.parse(raw).orElse(null);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("ORDERBOOK_PROXY_URL is invalid: " + e.getMessage(), e);
        }
    }

    /**
     * Validate configuration using Bean Validation.
     * Throws IllegalStateException if validation fails.
     */
    public void validate() {
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        var violations = validator.validate(this);

        if (!violations.isEmpty()) {
            var errorMessages = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .toList();

            throw new IllegalStateException(
                "Configuration validation failed: " + String.join(", ", errorMessages)
            );
        }
    }

    /**
     * Accounts parsed from the merged environment and properties.
     * Throws IllegalStateException when none are configured.
     */
    public List<AccountIdentity> loadAccounts() {
        List<AccountIdentity> accounts = new AccountLoader(mergedSettings()).load();
        if (accounts.isEmpty()) {
            throw new IllegalStateException(
                "No account API keys configured! Set ACCOUNT_1_API_KEY or EXTENDED_API_KEY");
        }
        return accounts;
    }

    private Map<String, String> mergedSettings() {
        var merged = new HashMap<String, String>();
        properties.stringPropertyNames().forEach(key -> merged.put(key, properties.getProperty(key)));
        merged.putAll(env);
        return merged;
    }

    // ==================== Cadences ====================

    public Duration getFastPollInterval() {
        return Duration.ofMillis(fastPollIntervalMs);
    }

    /**
     * Closed-trade polling runs every N fast periods (default 4, about once a second).
     */
    public int getMediumEveryTicks() {
        return mediumEveryTicks;
    }

    /**
     * Risk checks run every N fast periods (default 20, about every 5 seconds).
     */
    public int getSlowEveryTicks() {
        return slowEveryTicks;
    }

    public int getPointsEverySlowTicks() {
        return pointsEverySlowTicks;
    }

    public Duration getRequestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    public int getPollThreads() {
        return pollThreads;
    }

    // ==================== Margin alerts ====================

    public List<Double> getMarginThresholds() {
        return marginThresholds;
    }

    public Duration getAlertCooldown() {
        return Duration.ofMinutes(alertCooldownMinutes);
    }

    public String getTelegramBotToken() {
        return getProperty("Telegram_bot_token");
    }

    public String getTelegramChatId() {
        return getProperty("Telegram_id");
    }

    public String getPushoverAppToken() {
        return Optional.ofNullable(getProperty("Pushover_API_token"))
            .orElse(getProperty("Pushover_app_token"));
    }

    public String getPushoverUserKey() {
        return getProperty("Pushover_user_key");
    }

    public String getTwilioAccountSid() {
        return getProperty("Twilio_account_sid");
    }

    public String getTwilioApiKeySid() {
        return getProperty("Twilio_sid");
    }

    public String getTwilioApiKeySecret() {
        return Optional.ofNullable(getProperty("Twilio_secret_api"))
            .orElse(getProperty("Twillio_secret_api"));
    }

    public String getAlertPhoneNumber() {
        return getProperty("Alert_phone_number");
    }

    public String getTwilioFromNumber() {
        return getProperty("Twilio_from_number");
    }

    // ==================== Order book stream ====================

    public String getOrderBookWebsocketUrl() {
        return getProperty("ORDERBOOK_WS_URL",
            "wss://api.starknet.extended.exchange/stream.extended.exchange/v1/orderbooks");
    }

    public List<String> getOrderBookMarkets() {
        return Arrays.stream(getProperty("ORDERBOOK_MARKETS", "BTC-USD,ETH-USD,SOL-USD").split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    public Optional<ProxySettings> getOrderBookProxy() {
        return Optional.ofNullable(orderBookProxy);
    }

    public int getOrderBookMaxLevels() {
        return orderBookMaxLevels;
    }

    public Duration getReconnectBaseDelay() {
        return Duration.ofSeconds(reconnectBaseSeconds);
    }

    public Duration getReconnectMaxDelay() {
        return Duration.ofSeconds(reconnectMaxSeconds);
    }

    public boolean isOrderBookEnabled() {
        return getBooleanProperty("ORDERBOOK_ENABLED", true);
    }

    // ==================== History ====================

    public int getArchivePageSize() {
        return archivePageSize;
    }

    public Duration getArchiveInterval() {
        return Duration.ofMinutes(archiveIntervalMinutes);
    }

    public String getDatabasePath() {
        return databasePath;
    }

    // ==================== Server ====================

    public int getServerPort() {
        return serverPort;
    }

    private String getProperty(String key) {
        return Optional.ofNullable(env.get(key))
                .or(() -> Optional.ofNullable(properties.getProperty(key)))
                .orElse(null);
    }

    private String getProperty(String key, String defaultValue) {
        return Optional.ofNullable(env.get(key))
                .or(() -> Optional.ofNullable(properties.getProperty(key)))
                .orElse(defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        return (int) parseNumber(key, defaultValue, Integer::parseInt);
    }

    private long getLongProperty(String key, long defaultValue) {
        return parseNumber(key, defaultValue, Long::parseLong);
    }

    private long parseNumber(String key, long defaultValue, ToLongFunction<String> parser) {
        String value = getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return parser.applyAsLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be a whole number, got '" + value + "'", e);
        }
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = getProperty(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }
}
