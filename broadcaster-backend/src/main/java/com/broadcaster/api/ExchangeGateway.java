package com.broadcaster.api;

import com.broadcaster.config.AccountIdentity;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Optional;

/**
 * Authenticated read access to the exchange REST API for one account.
 * Implementations never throw: any transport or HTTP failure is an empty result.
 */
public interface ExchangeGateway {

    Optional<JsonNode> fetch(AccountIdentity account, String path, Map<String, String> params);

    default Optional<JsonNode> fetch(AccountIdentity account, String path) {
        return fetch(account, path, Map.of());
    }
}
