package com.broadcaster.notifications;

import com.broadcaster.risk.MarginAlert;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Common base of the Twilio SMS and voice channels: same credentials, same REST resource layout.
 */
abstract class TwilioChannel extends HttpNotificationChannel {
    public static final String API_URL = "https://api.twilio.com";

    protected final TwilioSettings settings;

    protected TwilioChannel(OkHttpClient httpClient, ObjectMapper mapper, String baseUrl, TwilioSettings settings) {
        super(httpClient, mapper, baseUrl);
        this.settings = settings;
    }

    @Override
    public boolean isConfigured() {
        return settings.isConfigured();
    }

    protected boolean post(String resource, FormBody form, String successLog) throws IOException {
        Request request = new Request.Builder()
            .url(baseUrl + "/2010-04-01/Accounts/" + settings.accountSid() + "/" + resource)
            .header("Authorization", Credentials.basic(settings.apiKeySid(), settings.apiKeySecret()))
            .post(form)
            .build();

        ProviderResponse response = execute(request);
        if (response.status() == 200 || response.status() == 201) {
            logger.info("✅ {} to {}", successLog, settings.toNumber());
            return true;
        }
        logger.error("❌ Twilio {} error: {} {}", name(), response.status(), response.raw());
        return false;
    }

    @Override
    public Map<String, Object> configStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("configured", isConfigured());
        status.put("account_sid_preview", NotificationChannel.preview(settings.accountSid()));
        status.put("api_key_sid_preview", NotificationChannel.preview(settings.apiKeySid()));
        status.put("api_secret_set", settings.apiKeySecret() != null && !settings.apiKeySecret().isEmpty());
        status.put("phone_number_set", settings.toNumber() != null && !settings.toNumber().isEmpty());
        status.put("from_number_set", settings.fromNumber() != null && !settings.fromNumber().isEmpty());
        return status;
    }
}
