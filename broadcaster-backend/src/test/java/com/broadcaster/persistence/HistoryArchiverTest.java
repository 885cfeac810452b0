package com.broadcaster.persistence;

import com.broadcaster.api.ExchangeGateway;
import com.broadcaster.api.model.ClosedPosition;
import com.broadcaster.api.model.FilledOrder;
import com.broadcaster.config.AccountIdentity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("HistoryArchiver Tests")
class HistoryArchiverTest {

    private static final int PAGE_SIZE = 2;

    private final ObjectMapper mapper = new ObjectMapper();
    private final AccountIdentity main = new AccountIdentity("account_1", "Main", "k1", null, null);
    private final AccountIdentity broken = new AccountIdentity("account_2", "Broken", "k2", null, null);

    private ExchangeGateway gateway;
    private HistoryStore store;

    @BeforeEach
    void setUp() {
        gateway = mock(ExchangeGateway.class);
        store = mock(HistoryStore.class);
        when(gateway.fetch(eq(main), eq(HistoryArchiver.ORDERS_HISTORY_PATH), anyMap()))
            .thenReturn(Optional.of(page(0, 1, null)));
        when(gateway.fetch(eq(broken), any(), anyMap())).thenReturn(Optional.empty());
    }

    /**
     * Page of {@code count} records with ids starting at {@code firstId}.
     */
    private JsonNode page(int firstId, int count, String nextCursor) {
        ObjectNode page = mapper.createObjectNode();
        ArrayNode data = page.putArray("data");
        for (int i = 0; i < count; i++) {
            data.addObject()
                .put("id", String.valueOf(firstId + i))
                .put("market", "BTC-USD")
                .put("size", "1");
        }
        if (nextCursor != null) {
            page.putObject("pagination").put("cursor", nextCursor);
        }
        return page;
    }

    private void positionPages(Map<String, JsonNode> byCursor) {
        when(gateway.fetch(eq(main), eq(HistoryArchiver.POSITIONS_HISTORY_PATH), anyMap()))
            .thenAnswer(invocation -> {
                Map<String, String> params = invocation.getArgument(2);
                return Optional.ofNullable(byCursor.get(params.getOrDefault("cursor", "")));
            });
    }

    private HistoryArchiver archiver(List<AccountIdentity> accounts) {
        return new HistoryArchiver(accounts, gateway, store, PAGE_SIZE, Duration.ofMinutes(30));
    }

    @Test
    @DisplayName("Should follow cursors until a short page")
    void followsCursors() {
        Map<String, JsonNode> pages = new HashMap<>();
        pages.put("", page(0, 2, "c1"));
        pages.put("c1", page(2, 2, "c2"));
        pages.put("c2", page(4, 1, "c3"));
        positionPages(pages);

        ArchiveReport report = archiver(List.of(main)).runPass();

        assertEquals(5, report.positionsUpserted());
        assertEquals(1, report.ordersUpserted());
        assertFalse(report.hasFailures());
        verify(store, times(5)).upsertClosedPosition(any(ClosedPosition.class));
        verify(store).upsertFilledOrder(any(FilledOrder.class));
        verify(gateway, times(3)).fetch(eq(main), eq(HistoryArchiver.POSITIONS_HISTORY_PATH), anyMap());
    }

    @Test
    @DisplayName("Should stop when the cursor does not advance")
    void stopsOnRepeatedCursor() {
        Map<String, JsonNode> pages = new HashMap<>();
        pages.put("", page(0, 2, "c1"));
        pages.put("c1", page(2, 2, "c1"));
        positionPages(pages);

        ArchiveReport report = archiver(List.of(main)).runPass();

        assertEquals(4, report.positionsUpserted());
        verify(gateway, times(2)).fetch(eq(main), eq(HistoryArchiver.POSITIONS_HISTORY_PATH), anyMap());
    }

    @Test
    @DisplayName("Should request filled orders with limit and status filter")
    void orderParams() {
        positionPages(Map.of("", page(0, 0, null)));

        archiver(List.of(main)).runPass();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> params = ArgumentCaptor.forClass(Map.class);
        verify(gateway).fetch(eq(main), eq(HistoryArchiver.ORDERS_HISTORY_PATH), params.capture());
        assertEquals("FILLED", params.getValue().get("status"));
        assertEquals("2", params.getValue().get("limit"));
        assertFalse(params.getValue().containsKey("cursor"));
    }

    @Test
    @DisplayName("Unreachable account should be reported and skipped")
    void skipsFailingAccount() {
        positionPages(Map.of("", page(0, 1, null)));

        ArchiveReport report = archiver(List.of(broken, main)).runPass();

        assertEquals(List.of("account_2"), report.failedAccounts());
        assertTrue(report.hasFailures());
        assertEquals(1, report.positionsUpserted());
        verify(gateway, never()).fetch(eq(broken), eq(HistoryArchiver.ORDERS_HISTORY_PATH), anyMap());
    }

    @Test
    @DisplayName("Full refresh should clear the archive before refetching")
    void fullRefresh() {
        positionPages(Map.of("", page(0, 1, null)));

        HistoryArchiver archiver = archiver(List.of(main));
        ArchiveReport report = archiver.runFullRefresh();

        var order = inOrder(store);
        order.verify(store).clearArchive();
        order.verify(store).upsertClosedPosition(any(ClosedPosition.class));
        assertEquals(1, report.positionsUpserted());
        assertEquals(Optional.of(report), archiver.getLastReport());
        assertFalse(archiver.isRunning());
    }
}
