package com.broadcaster.notifications;

import com.broadcaster.risk.MarginAlert;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushover push notifications. Priority escalates with the crossed threshold;
 * emergency priority (2) repeats every 60 s for up to an hour until acknowledged.
 */
public final class PushoverNotifier extends HttpNotificationChannel {
    public static final String API_URL = "https://api.pushover.net";

    private final String appToken;
    private final String userKey;

    public PushoverNotifier(OkHttpClient httpClient, ObjectMapper mapper, String appToken, String userKey) {
        this(httpClient, mapper, API_URL, appToken, userKey);
    }

    public PushoverNotifier(OkHttpClient httpClient, ObjectMapper mapper, String baseUrl,
                            String appToken, String userKey) {
        super(httpClient, mapper, baseUrl);
        this.appToken = appToken;
        this.userKey = userKey;
    }

    @Override
    public String name() {
        return "pushover";
    }

    @Override
    public double minimumThreshold() {
        return 0.70;
    }

    @Override
    public boolean isConfigured() {
        return appToken != null && !appToken.isEmpty() && userKey != null && !userKey.isEmpty();
    }

    @Override
    protected boolean deliver(MarginAlert alert) throws IOException {
        int priority = alert.pushoverPriority();
        FormBody.Builder form = new FormBody.Builder()
            .add("token", appToken)
            .add("user", userKey)
            .add("title", alert.title())
            .add("message", alert.plainMessage())
            .add("priority", Integer.toString(priority))
            .add("sound", priority >= 1 ? "siren" : "pushover");
        if (priority == 2) {
            form.add("retry", "60").add("expire", "3600");
        }

        Request request = new Request.Builder()
            .url(baseUrl + "/1/messages.json")
            .post(form.build())
            .build();

        ProviderResponse response = execute(request);
        if (response.json().path("status").asInt(0) == 1) {
            logger.info("✅ Pushover alert sent (priority={})", priority);
            return true;
        }
        logger.error("❌ Pushover error: {} {}", response.status(), response.raw());
        return false;
    }

    @Override
    public Map<String, Object> configStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("configured", isConfigured());
        status.put("app_token_preview", NotificationChannel.preview(appToken));
        status.put("user_key_preview", NotificationChannel.preview(userKey));
        return status;
    }
}
