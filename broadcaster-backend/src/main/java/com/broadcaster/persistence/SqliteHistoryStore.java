package com.broadcaster.persistence;

import com.broadcaster.api.model.BalanceSummary;
import com.broadcaster.api.model.ClosedPosition;
import com.broadcaster.api.model.FilledOrder;
import com.broadcaster.api.model.Payloads;
import com.broadcaster.config.AccountIdentity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.StampedLock;

/**
 * SQLite history store.
 *
 * Thread-Safety: one connection guarded by a StampedLock; writes take the write lock,
 * queries the read lock.
 */
public final class SqliteHistoryStore implements HistoryStore {
    private static final Logger logger = LoggerFactory.getLogger(SqliteHistoryStore.class);
    private static final String EXCHANGE = "extended";
    private static final Map<String, Duration> PERIODS = periods();

    private final Connection connection;
    private final StampedLock lock = new StampedLock();
    private final ObjectMapper mapper;
    private final Clock clock;

    public SqliteHistoryStore(String dbPath, ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            createTables();
            logger.info("History database initialized: {} with StampedLock concurrency", dbPath);
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to initialize database " + dbPath, e);
        }
    }

    private static Map<String, Duration> periods() {
        var periods = new LinkedHashMap<String, Duration>();
        periods.put("24h", Duration.ofHours(24));
        periods.put("7d", Duration.ofDays(7));
        periods.put("30d", Duration.ofDays(30));
        return periods;
    }

    private void createTables() throws SQLException {
        String snapshotsSql = """
            CREATE TABLE IF NOT EXISTS account_snapshots (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                account_index INTEGER NOT NULL,
                account_id TEXT NOT NULL,
                exchange TEXT NOT NULL,
                timestamp TEXT NOT NULL,
                equity REAL,
                margin_ratio REAL,
                available_balance REAL,
                unrealised_pnl REAL,
                orders_count INTEGER,
                raw_data TEXT
            )
            """;

        String positionsSql = """
            CREATE TABLE IF NOT EXISTS positions (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                account_index INTEGER NOT NULL,
                exchange TEXT NOT NULL,
                timestamp TEXT NOT NULL,
                market TEXT,
                side TEXT,
                size REAL,
                open_price REAL,
                mark_price REAL,
                unrealised_pnl REAL,
                raw_data TEXT
            )
            """;

        String ordersSql = """
            CREATE TABLE IF NOT EXISTS orders (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                account_index INTEGER NOT NULL,
                exchange TEXT NOT NULL,
                timestamp TEXT NOT NULL,
                order_id TEXT,
                market TEXT,
                side TEXT,
                order_type TEXT,
                price REAL,
                size REAL,
                filled REAL,
                status TEXT,
                raw_data TEXT
            )
            """;

        String tradesSql = """
            CREATE TABLE IF NOT EXISTS trades (
                account_index INTEGER NOT NULL,
                trade_id TEXT NOT NULL,
                account_id TEXT NOT NULL,
                exchange TEXT NOT NULL,
                market TEXT,
                side TEXT,
                size REAL,
                price REAL,
                exit_price REAL,
                realised_pnl REAL,
                value REAL,
                fee REAL,
                trade_time INTEGER NOT NULL,
                recorded_at TEXT NOT NULL,
                raw_data TEXT,
                PRIMARY KEY (account_index, trade_id)
            )
            """;

        String archivedPositionsSql = """
            CREATE TABLE IF NOT EXISTS trade_positions (
                id TEXT PRIMARY KEY,
                account_id TEXT NOT NULL,
                account_index INTEGER NOT NULL,
                account_name TEXT,
                market TEXT,
                side TEXT,
                size REAL,
                max_position_size REAL,
                leverage REAL,
                open_price REAL,
                exit_price REAL,
                realised_pnl REAL,
                trade_pnl REAL,
                funding_fees REAL,
                open_fees REAL,
                close_fees REAL,
                created_time INTEGER,
                closed_time INTEGER,
                fetched_at TEXT NOT NULL
            )
            """;

        String archivedOrdersSql = """
            CREATE TABLE IF NOT EXISTS trade_orders (
                id TEXT PRIMARY KEY,
                account_id TEXT NOT NULL,
                account_index INTEGER NOT NULL,
                market TEXT,
                side TEXT,
                type TEXT,
                price REAL,
                average_price REAL,
                qty REAL,
                filled_qty REAL,
                fee REAL,
                status TEXT,
                created_time INTEGER,
                updated_time INTEGER,
                fetched_at TEXT NOT NULL
            )
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            stmt.execute(snapshotsSql);
            stmt.execute(positionsSql);
            stmt.execute(ordersSql);
            stmt.execute(tradesSql);
            stmt.execute(archivedPositionsSql);
            stmt.execute(archivedOrdersSql);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_snapshots_account ON account_snapshots(account_index, timestamp)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_trades_time ON trades(trade_time)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_trade_positions_account ON trade_positions(account_index, created_time)");
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    // ==================== Poller writes ====================

    @Override
    public void saveSnapshot(AccountIdentity account, JsonNode balance, JsonNode orders) {
        String sql = """
            INSERT INTO account_snapshots (account_index, account_id, exchange, timestamp, equity, margin_ratio,
                                           available_balance, unrealised_pnl, orders_count, raw_data)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        Optional<BalanceSummary> summary = BalanceSummary.from(balance);

        var raw = mapper.createObjectNode();
        raw.set("balance", Payloads.unwrapData(balance));
        raw.set("active_orders", orders == null ? mapper.createArrayNode() : Payloads.unwrapData(orders));

        write("save snapshot for " + account.id(), sql, stmt -> {
            stmt.setInt(1, account.accountIndex());
            stmt.setString(2, account.id());
            stmt.setString(3, EXCHANGE);
            stmt.setString(4, clock.instant().toString());
            setDouble(stmt, 5, summary.map(BalanceSummary::equity).orElse(null));
            setDouble(stmt, 6, summary.map(BalanceSummary::marginRatio).orElse(null));
            setDouble(stmt, 7, summary.map(BalanceSummary::availableBalance).orElse(null));
            setDouble(stmt, 8, summary.map(BalanceSummary::unrealisedPnl).orElse(null));
            stmt.setInt(9, orders == null ? 0 : Payloads.records(orders).size());
            stmt.setString(10, toJson(raw));
            stmt.executeUpdate();
        });
    }

    @Override
    public void savePositions(AccountIdentity account, JsonNode positions) {
        List<JsonNode> records = Payloads.records(positions);
        if (records.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO positions (account_index, exchange, timestamp, market, side, size, open_price,
                                   mark_price, unrealised_pnl, raw_data)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        String timestamp = clock.instant().toString();
        write("save positions for " + account.id(), sql, stmt -> {
            for (JsonNode position : records) {
                stmt.setInt(1, account.accountIndex());
                stmt.setString(2, EXCHANGE);
                stmt.setString(3, timestamp);
                stmt.setString(4, Payloads.text(position, "market", "market_name").orElse(null));
                stmt.setString(5, Payloads.text(position, "side").orElse(null));
                setDouble(stmt, 6, Payloads.decimal(position, "size").orElse(null));
                setDouble(stmt, 7, Payloads.decimal(position, "openPrice", "entry_price").orElse(null));
                setDouble(stmt, 8, Payloads.decimal(position, "markPrice", "mark_price").orElse(null));
                setDouble(stmt, 9, Payloads.decimal(position, "unrealisedPnl", "unrealized_pnl").orElse(null));
                stmt.setString(10, toJson(position));
                stmt.addBatch();
            }
            stmt.executeBatch();
        });
        logger.debug("Saved {} positions for {}", records.size(), account.id());
    }

    @Override
    public void saveOrders(AccountIdentity account, JsonNode orders) {
        List<JsonNode> records = Payloads.records(orders);
        if (records.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO orders (account_index, exchange, timestamp, order_id, market, side, order_type,
                                price, size, filled, status, raw_data)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        String timestamp = clock.instant().toString();
        write("save orders for " + account.id(), sql, stmt -> {
            for (JsonNode order : records) {
                stmt.setInt(1, account.accountIndex());
                stmt.setString(2, EXCHANGE);
                stmt.setString(3, timestamp);
                stmt.setString(4, Payloads.text(order, "id", "order_id").orElse(null));
                stmt.setString(5, Payloads.text(order, "market", "market_name").orElse(null));
                stmt.setString(6, Payloads.text(order, "side").orElse(null));
                stmt.setString(7, Payloads.text(order, "type", "order_type").orElse(null));
                setDouble(stmt, 8, Payloads.decimal(order, "price").orElse(null));
                setDouble(stmt, 9, Payloads.decimal(order, "size", "qty").orElse(null));
                setDouble(stmt, 10, Payloads.decimal(order, "filled", "filledQty").orElse(null));
                stmt.setString(11, Payloads.text(order, "status").orElse(null));
                stmt.setString(12, toJson(order));
                stmt.addBatch();
            }
            stmt.executeBatch();
        });
    }

    @Override
    public void saveTrade(AccountIdentity account, JsonNode trade) {
        Optional<ClosedPosition> parsed = ClosedPosition.from(trade, account);
        if (parsed.isEmpty()) {
            logger.debug("Skipping trade without id for {}", account.id());
            return;
        }
        ClosedPosition position = parsed.get();
        String sql = """
            INSERT INTO trades (account_index, trade_id, account_id, exchange, market, side, size, price,
                                exit_price, realised_pnl, value, fee, trade_time, recorded_at, raw_data)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(account_index, trade_id) DO UPDATE SET
                size = excluded.size,
                price = COALESCE(excluded.price, trades.price),
                exit_price = COALESCE(trades.exit_price, excluded.exit_price),
                realised_pnl = COALESCE(excluded.realised_pnl, trades.realised_pnl),
                value = COALESCE(excluded.value, trades.value),
                fee = COALESCE(excluded.fee, trades.fee),
                raw_data = excluded.raw_data
            """;
        Instant now = clock.instant();
        long tradeTime = Optional.ofNullable(position.closedTime())
            .or(() -> Optional.ofNullable(position.createdTime()))
            .orElse(now.toEpochMilli());
        Double value = Payloads.decimal(trade, "value").orElse(position.openPrice() == null ? null : position.volume());
        Double fee = totalFees(position).orElse(Payloads.decimal(trade, "fee").orElse(null));

        write("save trade " + position.id(), sql, stmt -> {
            stmt.setInt(1, account.accountIndex());
            stmt.setString(2, position.id());
            stmt.setString(3, account.id());
            stmt.setString(4, EXCHANGE);
            stmt.setString(5, position.market());
            stmt.setString(6, position.side());
            stmt.setDouble(7, position.size());
            setDouble(stmt, 8, position.openPrice());
            setDouble(stmt, 9, position.exitPrice());
            setDouble(stmt, 10, position.realisedPnl());
            setDouble(stmt, 11, value);
            setDouble(stmt, 12, fee);
            stmt.setLong(13, tradeTime);
            stmt.setString(14, now.toString());
            stmt.setString(15, toJson(trade));
            stmt.executeUpdate();
        });
    }

    // ==================== Archive writes ====================

    @Override
    public void upsertClosedPosition(ClosedPosition position) {
        String sql = """
            INSERT INTO trade_positions (id, account_id, account_index, account_name, market, side, size,
                                         max_position_size, leverage, open_price, exit_price, realised_pnl,
                                         trade_pnl, funding_fees, open_fees, close_fees, created_time,
                                         closed_time, fetched_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                size = excluded.size,
                max_position_size = MAX(COALESCE(trade_positions.max_position_size, excluded.max_position_size),
                                        COALESCE(excluded.max_position_size, trade_positions.max_position_size)),
                leverage = COALESCE(excluded.leverage, trade_positions.leverage),
                open_price = COALESCE(excluded.open_price, trade_positions.open_price),
                exit_price = COALESCE(trade_positions.exit_price, excluded.exit_price),
                realised_pnl = COALESCE(excluded.realised_pnl, trade_positions.realised_pnl),
                trade_pnl = COALESCE(excluded.trade_pnl, trade_positions.trade_pnl),
                funding_fees = COALESCE(excluded.funding_fees, trade_positions.funding_fees),
                open_fees = COALESCE(excluded.open_fees, trade_positions.open_fees),
                close_fees = COALESCE(excluded.close_fees, trade_positions.close_fees),
                created_time = COALESCE(trade_positions.created_time, excluded.created_time),
                closed_time = COALESCE(trade_positions.closed_time, excluded.closed_time),
                fetched_at = excluded.fetched_at
            """;
        write("upsert position " + position.id(), sql, stmt -> {
            stmt.setString(1, position.id());
            stmt.setString(2, position.accountId());
            stmt.setInt(3, position.accountIndex());
            stmt.setString(4, position.accountName());
            stmt.setString(5, position.market());
            stmt.setString(6, position.side());
            stmt.setDouble(7, position.size());
            setDouble(stmt, 8, position.maxPositionSize());
            setDouble(stmt, 9, position.leverage());
            setDouble(stmt, 10, position.openPrice());
            setDouble(stmt, 11, position.exitPrice());
            setDouble(stmt, 12, position.realisedPnl());
            setDouble(stmt, 13, position.tradePnl());
            setDouble(stmt, 14, position.fundingFees());
            setDouble(stmt, 15, position.openFees());
            setDouble(stmt, 16, position.closeFees());
            setLong(stmt, 17, position.createdTime());
            setLong(stmt, 18, position.closedTime());
            stmt.setString(19, clock.instant().toString());
            stmt.executeUpdate();
        });
    }

    @Override
    public void upsertFilledOrder(FilledOrder order) {
        String sql = """
            INSERT INTO trade_orders (id, account_id, account_index, market, side, type, price, average_price,
                                      qty, filled_qty, fee, status, created_time, updated_time, fetched_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                price = COALESCE(excluded.price, trade_orders.price),
                average_price = COALESCE(excluded.average_price, trade_orders.average_price),
                qty = excluded.qty,
                filled_qty = MAX(COALESCE(trade_orders.filled_qty, excluded.filled_qty),
                                 COALESCE(excluded.filled_qty, trade_orders.filled_qty)),
                fee = COALESCE(excluded.fee, trade_orders.fee),
                status = COALESCE(excluded.status, trade_orders.status),
                created_time = COALESCE(trade_orders.created_time, excluded.created_time),
                updated_time = MAX(COALESCE(trade_orders.updated_time, excluded.updated_time),
                                   COALESCE(excluded.updated_time, trade_orders.updated_time)),
                fetched_at = excluded.fetched_at
            """;
        write("upsert order " + order.id(), sql, stmt -> {
            stmt.setString(1, order.id());
            stmt.setString(2, order.accountId());
            stmt.setInt(3, order.accountIndex());
            stmt.setString(4, order.market());
            stmt.setString(5, order.side());
            stmt.setString(6, order.type());
            setDouble(stmt, 7, order.price());
            setDouble(stmt, 8, order.averagePrice());
            stmt.setDouble(9, order.qty());
            setDouble(stmt, 10, order.filledQty());
            setDouble(stmt, 11, order.payedFee());
            stmt.setString(12, order.status());
            setLong(stmt, 13, order.createdTime());
            setLong(stmt, 14, order.updatedTime());
            stmt.setString(15, clock.instant().toString());
            stmt.executeUpdate();
        });
    }

    @Override
    public void clearArchive() {
        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            int positions = stmt.executeUpdate("DELETE FROM trade_positions");
            int orders = stmt.executeUpdate("DELETE FROM trade_orders");
            logger.info("🧹 Cleared archive: {} positions, {} orders", positions, orders);
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to clear archive", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    // ==================== Queries ====================

    @Override
    public List<Map<String, Object>> getHistory(int accountIndex, int limit) {
        String sql = """
            SELECT * FROM account_snapshots WHERE account_index = ? ORDER BY id DESC LIMIT ?
            """;
        return query(sql, stmt -> {
            stmt.setInt(1, accountIndex);
            stmt.setInt(2, limit);
        });
    }

    @Override
    public List<Map<String, Object>> getRecentTrades(Integer accountIndex, int limit) {
        if (accountIndex == null) {
            return query("SELECT * FROM trades ORDER BY trade_time DESC LIMIT ?", stmt -> stmt.setInt(1, limit));
        }
        return query("SELECT * FROM trades WHERE account_index = ? ORDER BY trade_time DESC LIMIT ?", stmt -> {
            stmt.setInt(1, accountIndex);
            stmt.setInt(2, limit);
        });
    }

    @Override
    public Map<String, PeriodStats> getStats(Integer accountIndex) {
        String sql = """
            SELECT COALESCE(SUM(realised_pnl), 0) AS total_pnl,
                   COALESCE(SUM(ABS(value)), 0) AS total_volume,
                   COUNT(*) AS trades_count,
                   COALESCE(SUM(CASE WHEN realised_pnl > 0 THEN 1 ELSE 0 END), 0) AS wins,
                   COALESCE(SUM(CASE WHEN realised_pnl < 0 THEN 1 ELSE 0 END), 0) AS losses
            FROM trades
            WHERE trade_time >= ? AND (? IS NULL OR account_index = ?)
            """;
        long now = clock.millis();
        Map<String, PeriodStats> stats = new LinkedHashMap<>();

        long stamp = lock.readLock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            for (var period : PERIODS.entrySet()) {
                stmt.setLong(1, now - period.getValue().toMillis());
                setInt(stmt, 2, accountIndex);
                setInt(stmt, 3, accountIndex);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        stats.put(period.getKey(), PeriodStats.empty(period.getKey()));
                        continue;
                    }
                    int count = rs.getInt("trades_count");
                    int wins = rs.getInt("wins");
                    stats.put(period.getKey(), new PeriodStats(
                        period.getKey(),
                        rs.getDouble("total_pnl"),
                        rs.getDouble("total_volume"),
                        count,
                        wins,
                        rs.getInt("losses"),
                        count == 0 ? 0.0 : wins * 100.0 / count
                    ));
                }
            }
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to compute period stats", e);
        } finally {
            lock.unlockRead(stamp);
        }
        return stats;
    }

    @Override
    public List<Map<String, Object>> getClosedPositions(Integer accountIndex, int limit) {
        if (accountIndex == null) {
            return query("SELECT * FROM trade_positions ORDER BY created_time DESC LIMIT ?",
                stmt -> stmt.setInt(1, limit));
        }
        return query("SELECT * FROM trade_positions WHERE account_index = ? ORDER BY created_time DESC LIMIT ?",
            stmt -> {
                stmt.setInt(1, accountIndex);
                stmt.setInt(2, limit);
            });
    }

    @Override
    public int countClosedPositions() {
        return count("SELECT COUNT(*) FROM trade_positions");
    }

    @Override
    public int countFilledOrders() {
        return count("SELECT COUNT(*) FROM trade_orders");
    }

    /**
     * Archived filled orders, most recently updated first.
     */
    public List<Map<String, Object>> getFilledOrders(Integer accountIndex, int limit) {
        if (accountIndex == null) {
            return query("SELECT * FROM trade_orders ORDER BY updated_time DESC LIMIT ?",
                stmt -> stmt.setInt(1, limit));
        }
        return query("SELECT * FROM trade_orders WHERE account_index = ? ORDER BY updated_time DESC LIMIT ?",
            stmt -> {
                stmt.setInt(1, accountIndex);
                stmt.setInt(2, limit);
            });
    }

    /**
     * Row count of the trades table.
     */
    public int countTrades() {
        return count("SELECT COUNT(*) FROM trades");
    }

    @Override
    public void close() {
        try {
            connection.close();
            logger.info("History database closed");
        } catch (SQLException e) {
            logger.error("Failed to close history database", e);
        }
    }

    // ==================== Helpers ====================

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    private void write(String operation, String sql, StatementBinder binder) {
        long stamp = lock.writeLock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            binder.bind(stmt);
        } catch (SQLException e) {
            throw new HistoryStoreException("Database write failed: " + operation, e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    private List<Map<String, Object>> query(String sql, StatementBinder binder) {
        long stamp = lock.readLock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                return rows(rs);
            }
        } catch (SQLException e) {
            throw new HistoryStoreException("Database query failed", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    private int count(String sql) {
        long stamp = lock.readLock();
        try (var stmt = connection.createStatement(); var rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new HistoryStoreException("Database query failed", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    private List<Map<String, Object>> rows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                String column = meta.getColumnLabel(i);
                Object value = rs.getObject(i);
                row.put(column, "raw_data".equals(column) && value != null ? parseJson(value.toString()) : value);
            }
            rows.add(row);
        }
        return rows;
    }

    private JsonNode parseJson(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            logger.debug("Stored raw_data is not valid JSON: {}", e.getMessage());
            return mapper.getNodeFactory().textNode(json);
        }
    }

    private String toJson(JsonNode node) throws SQLException {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to serialize raw_data", e);
        }
    }

    private static Optional<Double> totalFees(ClosedPosition position) {
        if (position.openFees() == null && position.closeFees() == null) {
            return Optional.empty();
        }
        double open = position.openFees() == null ? 0.0 : Math.abs(position.openFees());
        double close = position.closeFees() == null ? 0.0 : Math.abs(position.closeFees());
        return Optional.of(open + close);
    }

    private static void setDouble(PreparedStatement stmt, int index, Double value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.REAL);
        } else {
            stmt.setDouble(index, value);
        }
    }

    private static void setLong(PreparedStatement stmt, int index, Long value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setLong(index, value);
        }
    }

    private static void setInt(PreparedStatement stmt, int index, Integer value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setInt(index, value);
        }
    }
}
