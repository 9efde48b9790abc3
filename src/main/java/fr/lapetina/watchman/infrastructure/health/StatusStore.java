package fr.lapetina.watchman.infrastructure.health;

import fr.lapetina.watchman.domain.model.StatusEntry;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the authoritative status table.
 *
 * Single writer (the reconciler), any number of lock-free readers. The table
 * is swapped as a whole, so a reader sees either the previous round or the
 * next one, never a mix.
 */
public final class StatusStore {

    private final AtomicReference<StatusTable> table = new AtomicReference<>(StatusTable.EMPTY);

    /**
     * Atomically swaps in a new table.
     */
    public void replace(StatusTable next) {
        table.set(next);
    }

    /**
     * Current table. Use this when several reads must agree with each other.
     */
    public StatusTable current() {
        return table.get();
    }

    public Optional<StatusEntry> get(String name) {
        return Optional.ofNullable(table.get().entries().get(name));
    }

    public List<StatusEntry> list() {
        return List.copyOf(table.get().entries().values());
    }

    /**
     * Immutable status table produced by one reconciliation round.
     *
     * @param round        sequence of the round that produced it, 0 before the first round
     * @param reconciledAt when the round was applied, null before the first round
     * @param entries      entries keyed by target name
     */
    public record StatusTable(long round, Instant reconciledAt, Map<String, StatusEntry> entries) {

        static final StatusTable EMPTY = new StatusTable(0, null, Map.of());

        public StatusTable {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        public int size() {
            return entries.size();
        }

        public long healthyCount() {
            return entries.values().stream().filter(StatusEntry::isHealthy).count();
        }
    }
}
