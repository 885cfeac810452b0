package com.broadcaster.api.model;

import com.broadcaster.config.AccountIdentity;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * A filled order from {@code /user/orders/history}, keyed by the exchange order id.
 */
public record FilledOrder(
    String id,
    String accountId,
    int accountIndex,
    String market,
    String side,
    String type,
    Double price,
    Double averagePrice,
    double qty,
    Double filledQty,
    Double payedFee,
    String status,
    Long createdTime,
    Long updatedTime
) {

    public static Optional<FilledOrder> from(JsonNode node, AccountIdentity account) {
        Optional<String> id = Payloads.text(node, "id", "orderId");
        if (id.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new FilledOrder(
            id.get(),
            account.id(),
            account.accountIndex(),
            Payloads.text(node, "market").orElse(""),
            Payloads.text(node, "side").orElse(""),
            Payloads.text(node, "type").orElse(null),
            Payloads.decimal(node, "price").orElse(null),
            Payloads.decimal(node, "averagePrice").orElse(null),
            Payloads.decimalOrZero(node, "qty", "size"),
            Payloads.decimal(node, "filledQty", "filled").orElse(null),
            Payloads.decimal(node, "payedFee", "fee").orElse(null),
            Payloads.text(node, "status").orElse(null),
            Payloads.epochMillis(node, "createdTime", "createdAt").orElse(null),
            Payloads.epochMillis(node, "updatedTime", "updatedAt").orElse(null)
        ));
    }
}
