package com.broadcaster.api.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Typed view over the {@code /user/balance} payload.
 *
 * <p>Tolerated shapes: {@code {"data": {...}}}, a bare object, or a list whose first element is the balance.
 * Margin ratio comes from {@code marginRatio}; when absent it is derived as {@code initialMargin / equity}.
 */
public record BalanceSummary(double equity, Double marginRatio, double availableBalance, double unrealisedPnl) {

    public static Optional<BalanceSummary> from(JsonNode payload) {
        JsonNode body = Payloads.unwrapData(payload);
        if (body != null && body.isArray()) {
            body = body.size() > 0 ? body.get(0) : null;
        }
        if (body == null || !body.isObject()) {
            return Optional.empty();
        }

        double equity = Payloads.decimalOrZero(body, "equity", "totalEquity");
        Double ratio = Payloads.decimal(body, "marginRatio").orElse(null);
        if (ratio == null && equity > 0) {
            ratio = Payloads.decimal(body, "initialMargin")
                .map(margin -> margin / equity)
                .orElse(null);
        }
        double available = Payloads.decimalOrZero(body, "availableForTrade", "available_balance", "balance");
        double upnl = Payloads.decimalOrZero(body, "unrealisedPnl", "unrealizedPnl");

        return Optional.of(new BalanceSummary(equity, ratio, available, upnl));
    }

    public boolean hasMarginRatio() {
        return marginRatio != null;
    }
}
