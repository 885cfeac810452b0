package com.broadcaster.notifications;

import com.broadcaster.risk.MarginAlert;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Telegram bot notification channel.
 * Requires Telegram_bot_token and Telegram_id.
 */
public final class TelegramNotifier extends HttpNotificationChannel {
    public static final String API_URL = "https://api.telegram.org";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String botToken;
    private final String chatId;

    public TelegramNotifier(OkHttpClient httpClient, ObjectMapper mapper, String botToken, String chatId) {
        this(httpClient, mapper, API_URL, botToken, chatId);
    }

    public TelegramNotifier(OkHttpClient httpClient, ObjectMapper mapper, String baseUrl,
                            String botToken, String chatId) {
        super(httpClient, mapper, baseUrl);
        this.botToken = botToken;
        this.chatId = chatId;

        if (isConfigured()) {
            logger.info("Telegram notifications enabled");
        } else {
            logger.info("Telegram notifications disabled (missing config)");
        }
    }

    @Override
    public String name() {
        return "telegram";
    }

    @Override
    public double minimumThreshold() {
        return 0.70;
    }

    @Override
    public boolean isConfigured() {
        return botToken != null && !botToken.isEmpty() && chatId != null && !chatId.isEmpty();
    }

    @Override
    protected boolean deliver(MarginAlert alert) throws IOException {
        String text = alert.isCritical()
            ? "🚨🚨🚨 CRITICAL 🚨🚨🚨\n\n" + alert.richMessage()
            : alert.richMessage();

        ObjectNode payload = mapper.createObjectNode();
        payload.put("chat_id", chatId);
        payload.put("text", text);
        payload.put("parse_mode", "HTML");

        Request request = new Request.Builder()
            .url(baseUrl + "/bot" + botToken + "/sendMessage")
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .build();

        ProviderResponse response = execute(request);
        if (response.json().path("ok").asBoolean(false)) {
            logger.info("✅ Telegram alert sent");
            return true;
        }
        logger.error("❌ Telegram error: {} {}", response.status(), response.raw());
        return false;
    }

    @Override
    public Map<String, Object> configStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("configured", isConfigured());
        status.put("bot_token_set", botToken != null && !botToken.isEmpty());
        status.put("bot_token_preview", NotificationChannel.preview(botToken));
        status.put("chat_id_set", chatId != null && !chatId.isEmpty());
        return status;
    }
}
