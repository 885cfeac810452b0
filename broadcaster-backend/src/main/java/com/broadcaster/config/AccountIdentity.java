package com.broadcaster.config;

import java.util.Optional;

/**
 * Immutable identity of one exchange sub-account.
 *
 * @param id      stable id, {@code account_N}
 * @param name    display name
 * @param apiKey  exchange API key sent as {@code X-Api-Key}
 * @param baseUrl REST base URL without trailing slash
 * @param proxy   optional proxy, may be null
 */
public record AccountIdentity(String id, String name, String apiKey, String baseUrl, ProxySettings proxy) {

    public static final String DEFAULT_BASE_URL = "https://api.starknet.extended.exchange/api/v1";

    public AccountIdentity {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Account id is required");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("API key is required for " + id);
        }
        baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : stripTrailingSlash(baseUrl);
        name = name == null || name.isBlank() ? id : name;
    }

    public Optional<ProxySettings> proxySettings() {
        return Optional.ofNullable(proxy);
    }

    /**
     * Numeric index taken from the id suffix, {@code account_3 -> 3}; 0 when the id has no numeric suffix.
     */
    public int accountIndex() {
        int underscore = id.lastIndexOf('_');
        try {
            return Integer.parseInt(id.substring(underscore + 1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    @Override
    public String toString() {
        return "AccountIdentity[" + id + ", " + name + (proxy != null ? ", via " + proxy.describe() : "") + "]";
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
