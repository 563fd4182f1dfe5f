package org.deadstore.dataflow.livevariable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.deadstore.dataflow.cfg.node.Location;

/**
 * Collects {@link DeadStore}s, at most one per location and identifier. Adding a finding for a
 * location and identifier that already has one replaces it.
 *
 * <p>Tables are safe for concurrent use.
 */
public class DiagnosticTable {

    /** The key findings are deduplicated by. */
    private static final class Key {
        final Location location;
        final String identifier;

        Key(Location location, String identifier) {
            this.location = location;
            this.identifier = identifier;
        }

        @Override
        public boolean equals(@Nullable Object obj) {
            if (!(obj instanceof Key)) {
                return false;
            }
            Key other = (Key) obj;
            return location.equals(other.location) && identifier.equals(other.identifier);
        }

        @Override
        public int hashCode() {
            return Objects.hash(location, identifier);
        }
    }

    private final ConcurrentMap<Key, DeadStore> diagnostics = new ConcurrentHashMap<>();

    /**
     * Add a finding, replacing any finding for the same location and identifier.
     *
     * @param deadStore the finding
     */
    public void put(DeadStore deadStore) {
        diagnostics.put(new Key(deadStore.getLocation(), deadStore.getIdentifier()), deadStore);
    }

    /**
     * Add all findings of {@code other}, as if each were {@link #put} into this table.
     *
     * @param other another table
     */
    public void putAll(DiagnosticTable other) {
        diagnostics.putAll(other.diagnostics);
    }

    /**
     * Report every pending store of {@code store} as a dead store.
     *
     * @param store a store at the end of the analysis of a function
     */
    public void reportPending(LivenessStore store) {
        for (Map.Entry<String, SortedSet<Location>> entry : store.getUnused().entrySet()) {
            for (Location location : entry.getValue()) {
                put(new DeadStore(location, entry.getKey(), store.getDefine()));
            }
        }
    }

    public int size() {
        return diagnostics.size();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    /** @return the findings, ordered by location and then identifier */
    public List<DeadStore> sortedDiagnostics() {
        List<DeadStore> result = new ArrayList<>(diagnostics.values());
        Collections.sort(result);
        return result;
    }

    @Override
    public String toString() {
        return "DiagnosticTable" + sortedDiagnostics();
    }
}
