package com.broadcaster.notifications;

import com.broadcaster.risk.MarginAlert;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;

import java.io.IOException;

/**
 * Voice call through Twilio with a text-to-speech TwiML script, used from the 90% tier.
 */
public final class TwilioCallNotifier extends TwilioChannel {
    private static final String VOICE = "alice";
    private static final String LANGUAGE = "pl-PL";

    public TwilioCallNotifier(OkHttpClient httpClient, ObjectMapper mapper, TwilioSettings settings) {
        this(httpClient, mapper, API_URL, settings);
    }

    public TwilioCallNotifier(OkHttpClient httpClient, ObjectMapper mapper, String baseUrl, TwilioSettings settings) {
        super(httpClient, mapper, baseUrl, settings);
    }

    @Override
    public String name() {
        return "phone_call";
    }

    @Override
    public double minimumThreshold() {
        return 0.90;
    }

    @Override
    protected boolean deliver(MarginAlert alert) throws IOException {
        FormBody form = new FormBody.Builder()
            .add("To", settings.toNumber())
            .add("From", settings.fromNumber())
            .add("Twiml", twiml(alert.callMessage()))
            .build();
        return post("Calls.json", form, "Phone call initiated");
    }

    /**
     * Speaks the message twice with a one-second pause in between.
     */
    static String twiml(String message) {
        String say = "<Say voice=\"" + VOICE + "\" language=\"" + LANGUAGE + "\">" + escapeXml(message) + "</Say>";
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<Response>\n    " + say
            + "\n    <Pause length=\"1\"/>\n    " + say + "\n</Response>";
    }

    private static String escapeXml(String text) {
        return text.replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;");
    }
}
