package com.broadcaster.api;

import com.broadcaster.config.AccountIdentity;
import com.broadcaster.config.ProxySettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HTTP client for the Extended exchange REST API.
 *
 * One OkHttp client per account, all sharing the same connection pool and dispatcher;
 * accounts with a proxy get their own proxy and proxy authenticator.
 */
public final class ExtendedApiClient implements ExchangeGateway {
    private static final Logger logger = LoggerFactory.getLogger(ExtendedApiClient.class);
    private static final String USER_AGENT = "extended-broadcaster/3.0-multiaccount";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

    private final OkHttpClient baseClient;
    private final ObjectMapper objectMapper;
    private final Map<String, OkHttpClient> accountClients = new ConcurrentHashMap<>();

    public ExtendedApiClient() {
        this(DEFAULT_TIMEOUT);
    }

    public ExtendedApiClient(Duration timeout) {
        this(new OkHttpClient.Builder()
                .callTimeout(timeout)
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .build(),
            new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    public ExtendedApiClient(OkHttpClient baseClient, ObjectMapper objectMapper) {
        this.baseClient = baseClient;
        this.objectMapper = objectMapper;
        logger.info("ExtendedApiClient initialized (timeout: {}ms)", baseClient.callTimeoutMillis());
    }

    /**
     * Performs the GET and parses the body.
     *
     * @throws ExchangeRequestException on non-2xx status, transport failure or unparseable body
     */
    public JsonNode get(AccountIdentity account, String path, Map<String, String> params)
            throws ExchangeRequestException {
        HttpUrl url = buildUrl(account, path, params);
        Request request = new Request.Builder()
            .url(url)
            .header("X-Api-Key", account.apiKey())
            .header("User-Agent", USER_AGENT)
            .header("Content-Type", "application/json")
            .get()
            .build();

        try (Response response = clientFor(account).newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new ExchangeRequestException(account.id(), path, response.code(),
                    "HTTP " + response.code() + proxySuffix(account));
            }
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (text.isBlank()) {
                throw new ExchangeRequestException(account.id(), path, response.code(), "Empty response body");
            }
            return objectMapper.readTree(text);
        } catch (IOException e) {
            throw new ExchangeRequestException(account.id(), path,
                e.getClass().getSimpleName() + ": " + e.getMessage() + proxySuffix(account), e);
        }
    }

    @Override
    public Optional<JsonNode> fetch(AccountIdentity account, String path, Map<String, String> params) {
        try {
            return Optional.of(get(account, path, params));
        } catch (ExchangeRequestException e) {
            logger.warn("⚠️ [{}][{}] {}", account.name(), path, e.getMessage());
            return Optional.empty();
        }
    }

    private HttpUrl buildUrl(AccountIdentity account, String path, Map<String, String> params)
            throws ExchangeRequestException {
        HttpUrl parsed = HttpUrl.parse(account.baseUrl() + path);
        if (parsed == null) {
            throw new ExchangeRequestException(account.id(), path, -1, "Invalid URL: " + account.baseUrl() + path);
        }
        HttpUrl.Builder builder = parsed.newBuilder();
        params.forEach(builder::addQueryParameter);
        return builder.build();
    }

    private OkHttpClient clientFor(AccountIdentity account) {
        return accountClients.computeIfAbsent(account.id(), id -> account.proxySettings()
            .map(this::proxiedClient)
            .orElse(baseClient));
    }

    private OkHttpClient proxiedClient(ProxySettings proxy) {
        OkHttpClient.Builder builder = baseClient.newBuilder().proxy(proxy.toProxy());
        if (proxy.hasCredentials()) {
            String credential = Credentials.basic(proxy.username(), proxy.password());
            builder.proxyAuthenticator((route, response) -> {
                if (response.request().header("Proxy-Authorization") != null) {
                    // credentials already rejected once
                    return null;
                }
                return response.request().newBuilder()
                    .header("Proxy-Authorization", credential)
                    .build();
            });
        }
        return builder.build();
    }

    private static String proxySuffix(AccountIdentity account) {
        return account.proxySettings().map(p -> " (proxy: " + p.host() + ")").orElse("");
    }
}
