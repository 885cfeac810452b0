package com.broadcaster.cache;

import com.broadcaster.config.AccountIdentity;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Latest known exchange state for one account.
 *
 * Every value is written together with its fetch timestamp under the snapshot monitor,
 * so a reader never sees a value whose timestamp is not set yet.
 */
public final class AccountSnapshot {

    public enum Field {
        POSITIONS("positions"),
        BALANCE("balance"),
        ORDERS("orders"),
        TRADES("trades");

        private final String key;

        Field(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }
    }

    private final AccountIdentity account;
    private final Clock clock;
    private final EnumMap<Field, JsonNode> values = new EnumMap<>(Field.class);
    private final EnumMap<Field, Instant> lastUpdate = new EnumMap<>(Field.class);

    public AccountSnapshot(AccountIdentity account, Clock clock) {
        this.account = account;
        this.clock = clock;
    }

    public AccountIdentity account() {
        return account;
    }

    public synchronized JsonNode get(Field field) {
        return values.get(field);
    }

    public synchronized Optional<Instant> lastUpdate(Field field) {
        return Optional.ofNullable(lastUpdate.get(field));
    }

    /**
     * Applies every fresh value that differs from the cached one in a single step.
     * Absent entries in {@code fresh} (failed fetches) leave the field untouched.
     *
     * @return the fields that changed, empty when nothing did
     */
    public synchronized Set<Field> applyChanges(Map<Field, JsonNode> fresh, ChangeDetector detector) {
        Set<Field> changed = EnumSet.noneOf(Field.class);
        Instant now = clock.instant();
        fresh.forEach((field, value) -> {
            if (value != null && detector.changed(values.get(field), value)) {
                values.put(field, value);
                lastUpdate.put(field, now);
                changed.add(field);
            }
        });
        return changed;
    }

    public boolean updateIfChanged(Field field, JsonNode fresh, ChangeDetector detector) {
        if (fresh == null) {
            return false;
        }
        return !applyChanges(Map.of(field, fresh), detector).isEmpty();
    }

    /**
     * True once both positions and balance have been fetched at least once.
     */
    public synchronized boolean isInitialized() {
        return values.get(Field.POSITIONS) != null && values.get(Field.BALANCE) != null;
    }

    /**
     * Point-in-time copy for readers outside the polling threads.
     */
    public synchronized View view() {
        Map<String, Instant> updates = new LinkedHashMap<>();
        lastUpdate.forEach((field, instant) -> updates.put(field.key(), instant));
        return new View(
            account.id(),
            account.name(),
            values.get(Field.POSITIONS),
            values.get(Field.BALANCE),
            values.get(Field.ORDERS),
            values.get(Field.TRADES),
            Map.copyOf(updates)
        );
    }

    public record View(
        String id,
        String name,
        JsonNode positions,
        JsonNode balance,
        JsonNode orders,
        JsonNode trades,
        Map<String, Instant> lastUpdate
    ) {
        /**
         * Milliseconds since each field was last refreshed; null for fields never fetched.
         */
        public Map<String, Long> cacheAgeMs(Instant now) {
            Map<String, Long> ages = new LinkedHashMap<>();
            for (Field field : Field.values()) {
                Instant updated = lastUpdate.get(field.key());
                ages.put(field.key(), updated == null ? null : Duration.between(updated, now).toMillis());
            }
            return ages;
        }
    }
}
