package com.broadcaster.notifications;

import com.broadcaster.risk.MarginAlert;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;

import java.io.IOException;

/**
 * SMS through Twilio, used from the 80% tier.
 */
public final class TwilioSmsNotifier extends TwilioChannel {
    private static final int SMS_LIMIT = 1600;

    public TwilioSmsNotifier(OkHttpClient httpClient, ObjectMapper mapper, TwilioSettings settings) {
        this(httpClient, mapper, API_URL, settings);
    }

    public TwilioSmsNotifier(OkHttpClient httpClient, ObjectMapper mapper, String baseUrl, TwilioSettings settings) {
        super(httpClient, mapper, baseUrl, settings);
    }

    @Override
    public String name() {
        return "sms";
    }

    @Override
    public double minimumThreshold() {
        return 0.80;
    }

    @Override
    protected boolean deliver(MarginAlert alert) throws IOException {
        String body = alert.plainMessage();
        if (body.length() > SMS_LIMIT) {
            body = body.substring(0, SMS_LIMIT);
        }
        FormBody form = new FormBody.Builder()
            .add("To", settings.toNumber())
            .add("From", settings.fromNumber())
            .add("Body", body)
            .build();
        return post("Messages.json", form, "SMS sent");
    }
}
