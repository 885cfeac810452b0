package com.broadcaster.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the account list from flat key/value settings.
 *
 * Three naming conventions are tried in order, the first one that yields accounts wins:
 * <ol>
 *   <li>{@code Extended_N_CODE_API_KEY} with proxy in {@code Extended_N_PROXY_N_URL}</li>
 *   <li>{@code ACCOUNT_N_API_KEY} with optional {@code ACCOUNT_N_NAME}, {@code ACCOUNT_N_BASE_URL},
 *       {@code ACCOUNT_N_PROXY_URL}</li>
 *   <li>single legacy {@code EXTENDED_API_KEY} / {@code EXTENDED_API_BASE_URL}</li>
 * </ol>
 */
public final class AccountLoader {
    private static final Logger logger = LoggerFactory.getLogger(AccountLoader.class);

    private static final Pattern EXTENDED_KEY = Pattern.compile("^Extended_(\\d+)_([A-Za-z0-9]+)_API_KEY$");
    private static final Pattern NUMBERED_KEY = Pattern.compile("^ACCOUNT_(\\d+)_API_KEY$");

    private final Map<String, String> settings;

    public AccountLoader(Map<String, String> settings) {
        this.settings = settings;
    }

    public List<AccountIdentity> load() {
        List<AccountIdentity> accounts = loadExtendedFormat();
        if (accounts.isEmpty()) {
            accounts = loadNumberedFormat();
        }
        if (accounts.isEmpty()) {
            accounts = loadLegacyFormat();
        }

        long proxied = accounts.stream().filter(a -> a.proxy() != null).count();
        logger.info("🎯 Total accounts configured: {} ({} via proxy)", accounts.size(), proxied);
        return accounts;
    }

    private List<AccountIdentity> loadExtendedFormat() {
        var byIndex = new TreeMap<Integer, AccountIdentity>();
        String baseUrl = settings.getOrDefault("EXTENDED_API_BASE_URL", AccountIdentity.DEFAULT_BASE_URL);

        for (var entry : settings.entrySet()) {
            Matcher m = EXTENDED_KEY.matcher(entry.getKey());
            if (!m.matches() || isBlank(entry.getValue())) {
                continue;
            }
            int index = Integer.parseInt(m.group(1));
            String code = m.group(2);
            String proxyVar = "Extended_" + index + "_PROXY_" + index + "_URL";
            ProxySettings proxy = parseProxy(index, settings.get(proxyVar));

            byIndex.put(index, new AccountIdentity(
                "account_" + index,
                "Extended " + index + " (" + code + ")",
                entry.getValue().trim(),
                baseUrl,
                proxy));
            logger.info("✅ Loaded Account {}: Extended_{}_{}{}", index, index, code,
                proxy != null ? " (via proxy " + proxy.describe() + ")" : " (no proxy)");
        }
        return new ArrayList<>(byIndex.values());
    }

    private List<AccountIdentity> loadNumberedFormat() {
        var byIndex = new TreeMap<Integer, AccountIdentity>();

        for (var entry : settings.entrySet()) {
            Matcher m = NUMBERED_KEY.matcher(entry.getKey());
            if (!m.matches() || isBlank(entry.getValue())) {
                continue;
            }
            int index = Integer.parseInt(m.group(1));
            String prefix = "ACCOUNT_" + index + "_";

            byIndex.put(index, new AccountIdentity(
                "account_" + index,
                settings.getOrDefault(prefix + "NAME", "Account " + index),
                entry.getValue().trim(),
                settings.get(prefix + "BASE_URL"),
                parseProxy(index, settings.get(prefix + "PROXY_URL"))));
            logger.info("✅ Loaded Account {}: {}", index, settings.getOrDefault(prefix + "NAME", "Account " + index));
        }
        return new ArrayList<>(byIndex.values());
    }

    private List<AccountIdentity> loadLegacyFormat() {
        String apiKey = settings.get("EXTENDED_API_KEY");
        if (isBlank(apiKey)) {
            return List.of();
        }
        logger.info("✅ Loaded single account (legacy mode)");
        return List.of(new AccountIdentity(
            "account_1",
            "Main Account",
            apiKey.trim(),
            settings.get("EXTENDED_API_BASE_URL"),
            parseProxy(1, settings.get("EXTENDED_PROXY_URL"))));
    }

    private ProxySettings parseProxy(int index, String raw) {
        try {
            return ProxySettings.parse(raw).orElse(null);
        } catch (IllegalArgumentException e) {
            logger.warn("⚠️ Account {} proxy invalid, continuing without proxy: {}", index, e.getMessage());
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
