package com.broadcaster.api;

/**
 * A single exchange request that did not produce a usable JSON body.
 */
public class ExchangeRequestException extends Exception {
    private final String accountId;
    private final String path;
    private final int statusCode;

    public ExchangeRequestException(String accountId, String path, int statusCode, String message) {
        super(message);
        this.accountId = accountId;
        this.path = path;
        this.statusCode = statusCode;
    }

    public ExchangeRequestException(String accountId, String path, String message, Throwable cause) {
        super(message, cause);
        this.accountId = accountId;
        this.path = path;
        this.statusCode = -1;
    }

    public String getAccountId() {
        return accountId;
    }

    public String getPath() {
        return path;
    }

    /**
     * HTTP status, or -1 when the request failed before a response arrived.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
