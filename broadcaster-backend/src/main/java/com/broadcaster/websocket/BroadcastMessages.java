package com.broadcaster.websocket;

import com.broadcaster.api.model.AccountPoints;
import com.broadcaster.cache.AccountSnapshot;
import com.broadcaster.cache.OrderBookSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builders for the broadcast protocol. Every message carries a {@code type} discriminator
 * and a {@code timestamp} in epoch seconds.
 */
public final class BroadcastMessages {
    private final ObjectMapper mapper;
    private final Clock clock;

    public BroadcastMessages(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Full state sent to a subscriber right after it connects.
     */
    public ObjectNode snapshot(Collection<AccountSnapshot.View> accounts,
                               Map<String, OrderBookSnapshot> orderBooks,
                               Map<String, AccountPoints> points) {
        ObjectNode message = createMessage("snapshot");
        ObjectNode accountsNode = message.putObject("accounts");
        for (AccountSnapshot.View view : accounts) {
            ObjectNode node = accountsNode.putObject(view.id());
            node.put("id", view.id());
            node.put("name", view.name());
            node.set("positions", view.positions());
            node.set("balance", view.balance());
            node.set("trades", view.trades());
            node.set("orders", view.orders());
        }
        message.put("total_accounts", accounts.size());

        ObjectNode books = message.putObject("orderbooks");
        orderBooks.forEach((market, book) -> books.set(market, orderBookNode(book)));

        if (!points.isEmpty()) {
            message.set("points", pointsNode(points));
        }
        return message;
    }

    /**
     * Positions and balance of one account; a field that did not change is sent as null.
     */
    public ObjectNode accountUpdate(AccountSnapshot.View view, Set<AccountSnapshot.Field> changed) {
        ObjectNode message = accountMessage("account_update", view);
        message.set("positions", changed.contains(AccountSnapshot.Field.POSITIONS) ? view.positions() : null);
        message.set("balance", changed.contains(AccountSnapshot.Field.BALANCE) ? view.balance() : null);
        return message;
    }

    public ObjectNode tradesUpdate(AccountSnapshot.View view) {
        ObjectNode message = accountMessage("trades_update", view);
        message.set("trades", view.trades());
        return message;
    }

    public ObjectNode ordersUpdate(AccountSnapshot.View view) {
        ObjectNode message = accountMessage("orders_update", view);
        message.set("orders", view.orders());
        return message;
    }

    public ObjectNode orderBookUpdate(OrderBookSnapshot book) {
        ObjectNode message = createMessage("orderbook_update");
        message.put("market", book.market());
        ObjectNode body = orderBookNode(book);
        message.set("bids", body.get("bids"));
        message.set("asks", body.get("asks"));
        message.put("sequence", book.sequence());
        return message;
    }

    public ObjectNode pointsUpdate(Map<String, AccountPoints> points) {
        ObjectNode message = createMessage("points_update");
        message.setAll(pointsNode(points));
        return message;
    }

    public ObjectNode ping() {
        return createMessage("ping");
    }

    public ObjectNode pong() {
        return createMessage("pong");
    }

    private ObjectNode accountMessage(String type, AccountSnapshot.View view) {
        ObjectNode message = createMessage(type);
        message.put("account_id", view.id());
        message.put("account_name", view.name());
        return message;
    }

    private ObjectNode orderBookNode(OrderBookSnapshot book) {
        ObjectNode node = mapper.createObjectNode();
        node.put("market", book.market());
        node.set("bids", levels(book.bids()));
        node.set("asks", levels(book.asks()));
        node.put("sequence", book.sequence());
        node.put("timestamp", book.timestamp().toEpochMilli() / 1000.0);
        return node;
    }

    private ArrayNode levels(List<OrderBookSnapshot.PriceLevel> levels) {
        ArrayNode array = mapper.createArrayNode();
        for (OrderBookSnapshot.PriceLevel level : levels) {
            ObjectNode entry = array.addObject();
            entry.put("p", level.price());
            entry.put("q", level.quantity());
        }
        return array;
    }

    private ObjectNode pointsNode(Map<String, AccountPoints> points) {
        ObjectNode node = mapper.createObjectNode();
        ObjectNode accounts = node.putObject("accounts");
        double total = 0;
        double lastWeek = 0;
        for (AccountPoints entry : points.values()) {
            ObjectNode account = accounts.putObject(entry.accountId());
            account.put("name", entry.accountName());
            account.put("points", entry.totalPoints());
            account.put("last_week_points", entry.lastWeekPoints());
            total += entry.totalPoints();
            lastWeek += entry.lastWeekPoints();
        }
        node.put("total_points", total);
        node.put("total_last_week_points", lastWeek);
        return node;
    }

    private ObjectNode createMessage(String type) {
        ObjectNode message = mapper.createObjectNode();
        message.put("type", type);
        message.put("timestamp", clock.millis() / 1000.0);
        return message;
    }
}
