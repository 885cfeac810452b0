package com.broadcaster.notifications;

import com.broadcaster.risk.MarginAlert;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Shared plumbing for channels backed by an HTTP provider API.
 */
abstract class HttpNotificationChannel implements NotificationChannel {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final OkHttpClient httpClient;
    protected final ObjectMapper mapper;
    protected final String baseUrl;

    protected HttpNotificationChannel(OkHttpClient httpClient, ObjectMapper mapper, String baseUrl) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    /**
     * Executes the request and returns the status code with the parsed body (a missing node when unparseable).
     */
    protected ProviderResponse execute(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            JsonNode json;
            try {
                json = text.isBlank() ? mapper.missingNode() : mapper.readTree(text);
            } catch (IOException e) {
                logger.debug("{} returned a non-JSON body: {}", name(), e.getMessage());
                json = mapper.missingNode();
            }
            return new ProviderResponse(response.code(), json, text);
        }
    }

    @Override
    public final boolean send(MarginAlert alert) {
        if (!isConfigured()) {
            logger.warn("{} not configured", name());
            return false;
        }
        try {
            return deliver(alert);
        } catch (Exception e) {
            logger.error("❌ {} exception: {}", name(), e.getMessage());
            return false;
        }
    }

    protected abstract boolean deliver(MarginAlert alert) throws IOException;

    protected record ProviderResponse(int status, JsonNode json, String raw) {
    }
}
