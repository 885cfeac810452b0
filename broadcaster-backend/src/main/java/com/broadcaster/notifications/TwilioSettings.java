package com.broadcaster.notifications;

/**
 * Twilio credentials (API key SID and secret used for basic auth) and phone numbers.
 */
public record TwilioSettings(String accountSid, String apiKeySid, String apiKeySecret,
                             String toNumber, String fromNumber) {

    public boolean isConfigured() {
        return present(accountSid) && present(apiKeySid) && present(apiKeySecret)
            && present(toNumber) && present(fromNumber);
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
