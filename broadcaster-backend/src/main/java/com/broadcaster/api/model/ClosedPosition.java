package com.broadcaster.api.model;

import com.broadcaster.config.AccountIdentity;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * A closed position from {@code /user/positions/history}, keyed by the exchange position id.
 * Nullable boxed fields are values the exchange has not reported yet.
 */
public record ClosedPosition(
    String id,
    String accountId,
    int accountIndex,
    String accountName,
    String market,
    String side,
    double size,
    Double maxPositionSize,
    Double leverage,
    Double openPrice,
    Double exitPrice,
    Double realisedPnl,
    Double tradePnl,
    Double fundingFees,
    Double openFees,
    Double closeFees,
    Long createdTime,
    Long closedTime
) {

    /**
     * Normalizes one history record; empty when the record carries no id.
     */
    public static Optional<ClosedPosition> from(JsonNode node, AccountIdentity account) {
        Optional<String> id = Payloads.text(node, "id", "positionId");
        if (id.isEmpty()) {
            return Optional.empty();
        }
        JsonNode breakdown = node.path("realisedPnlBreakdown");
        return Optional.of(new ClosedPosition(
            id.get(),
            account.id(),
            account.accountIndex(),
            account.name(),
            Payloads.text(node, "market").orElse(""),
            Payloads.text(node, "side").orElse(""),
            Payloads.decimalOrZero(node, "size"),
            Payloads.decimal(node, "maxPositionSize").orElse(null),
            Payloads.decimal(node, "leverage").orElse(null),
            Payloads.decimal(node, "openPrice").orElse(null),
            Payloads.decimal(node, "exitPrice", "closePrice").orElse(null),
            Payloads.decimal(node, "realisedPnl").orElse(null),
            Payloads.decimal(breakdown, "tradePnl").orElse(null),
            Payloads.decimal(breakdown, "fundingFees").orElse(null),
            Payloads.decimal(breakdown, "openFees").orElse(null),
            Payloads.decimal(breakdown, "closeFees").orElse(null),
            Payloads.epochMillis(node, "createdTime", "createdAt").orElse(null),
            Payloads.epochMillis(node, "closedTime", "closedAt").orElse(null)
        ));
    }

    /**
     * Notional traded when the position was opened.
     */
    public double volume() {
        return openPrice == null ? 0.0 : Math.abs(size * openPrice);
    }
}
