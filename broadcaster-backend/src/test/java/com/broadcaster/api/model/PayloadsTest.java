package com.broadcaster.api.model;

import com.broadcaster.config.AccountIdentity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Payload normalization Tests")
class PayloadsTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Nested
    @DisplayName("Payloads helpers")
    class Helpers {

        @Test
        @DisplayName("Should unwrap data envelopes and list records")
        void records() throws Exception {
            assertEquals(2, Payloads.records(json("{\"status\":\"OK\",\"data\":[{\"id\":1},{\"id\":2}]}")).size());
            assertEquals(1, Payloads.records(json("{\"id\":1}")).size());
            assertTrue(Payloads.records(json("{\"data\":null}")).isEmpty());
            assertTrue(Payloads.records(null).isEmpty());
        }

        @Test
        @DisplayName("Should read numbers given as strings and skip junk")
        void decimals() throws Exception {
            JsonNode node = json("{\"a\":\"12.5\",\"b\":3,\"c\":\"n/a\",\"d\":null}");

            assertEquals(Optional.of(12.5), Payloads.decimal(node, "a"));
            assertEquals(Optional.of(3.0), Payloads.decimal(node, "b"));
            assertTrue(Payloads.decimal(node, "c", "d", "missing").isEmpty());
            assertEquals(3.0, Payloads.decimalOrZero(node, "c", "b"));
        }

        @Test
        @DisplayName("Should render numeric ids as text")
        void textIds() throws Exception {
            assertEquals(Optional.of("42"), Payloads.text(json("{\"id\":42}"), "id"));
            assertTrue(Payloads.text(json("{\"id\":\" \"}"), "id").isEmpty());
        }
    }

    @Nested
    @DisplayName("BalanceSummary")
    class Balance {

        @Test
        @DisplayName("Should read an enveloped balance")
        void envelope() throws Exception {
            var summary = BalanceSummary.from(json(
                "{\"status\":\"OK\",\"data\":{\"equity\":\"1000\",\"marginRatio\":\"0.42\","
                    + "\"availableForTrade\":\"580\",\"unrealisedPnl\":\"-12.5\"}}")).orElseThrow();

            assertEquals(1000.0, summary.equity());
            assertEquals(0.42, summary.marginRatio());
            assertEquals(580.0, summary.availableBalance());
            assertEquals(-12.5, summary.unrealisedPnl());
        }

        @Test
        @DisplayName("Should take the first element of a list balance")
        void listShape() throws Exception {
            var summary = BalanceSummary.from(json("[{\"totalEquity\":200,\"marginRatio\":0.1}]")).orElseThrow();

            assertEquals(200.0, summary.equity());
            assertTrue(summary.hasMarginRatio());
        }

        @Test
        @DisplayName("Should derive margin ratio from initial margin when missing")
        void derivedRatio() throws Exception {
            var summary = BalanceSummary.from(json("{\"equity\":\"400\",\"initialMargin\":\"100\"}")).orElseThrow();

            assertEquals(0.25, summary.marginRatio(), 1e-9);
        }

        @Test
        @DisplayName("Should be empty for an empty list")
        void emptyList() throws Exception {
            assertTrue(BalanceSummary.from(json("{\"data\":[]}")).isEmpty());
        }
    }

    @Nested
    @DisplayName("History records")
    class History {

        private final AccountIdentity account =
            new AccountIdentity("account_2", "Two", "k", null, null);

        @Test
        @DisplayName("Should normalize a closed position with its pnl breakdown")
        void closedPosition() throws Exception {
            var position = ClosedPosition.from(json("""
                {"id":"981","market":"BTC-USD","side":"LONG","size":"0.5","maxPositionSize":"0.8",
                 "openPrice":"60000","exitPrice":"61000","realisedPnl":"480.5",
                 "realisedPnlBreakdown":{"tradePnl":"500","fundingFees":"-4.5","openFees":"-7","closeFees":"-8"},
                 "createdTime":1700000000000,"closedTime":1700000500000}
                """), account).orElseThrow();

            assertEquals("981", position.id());
            assertEquals(2, position.accountIndex());
            assertEquals(0.8, position.maxPositionSize());
            assertEquals(500.0, position.tradePnl());
            assertEquals(-8.0, position.closeFees());
            assertEquals(1700000500000L, position.closedTime());
            assertEquals(30000.0, position.volume(), 1e-9);
        }

        @Test
        @DisplayName("Should skip records without id")
        void missingId() throws Exception {
            assertTrue(ClosedPosition.from(json("{\"market\":\"ETH-USD\"}"), account).isEmpty());
            assertTrue(FilledOrder.from(json("{\"market\":\"ETH-USD\"}"), account).isEmpty());
        }

        @Test
        @DisplayName("Should sum earned points across records")
        void points() throws Exception {
            var points = AccountPoints.from(json("{\"data\":[{\"points\":\"10\"},{\"points\":\"2.5\"}]}"),
                "account_2", "Two").orElseThrow();

            assertEquals(12.5, points.totalPoints());
            assertEquals(2.5, points.lastWeekPoints());
        }
    }
}
