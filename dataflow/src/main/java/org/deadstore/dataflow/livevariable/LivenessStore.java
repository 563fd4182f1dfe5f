package org.deadstore.dataflow.livevariable;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.javacutil.BugInCF;
import org.deadstore.dataflow.analysis.Store;
import org.deadstore.dataflow.cfg.node.FunctionDefinitionNode;
import org.deadstore.dataflow.cfg.node.Location;
import org.deadstore.dataflow.cfg.node.ParameterNode;

/**
 * The store of the dead store analysis. Both directions share it:
 *
 * <ul>
 *   <li>the forward analysis tracks the pending stores ({@link #getUnused()}): for every
 *       identifier, the locations of its latest assignments that have not been read yet;
 *   <li>the backward analysis tracks the live identifiers ({@link #getUsed()}): those read at or
 *       after the current point.
 * </ul>
 *
 * <p>The store also records whether the current point is unreachable, the analyzed function, and
 * the nested function definitions seen so far.
 *
 * <p>Stores are mutable; transfer functions update the store they are given. The lattice
 * operations never modify their arguments.
 */
public class LivenessStore implements Store<LivenessStore> {

    /** Pending stores: identifier to the locations of its unread latest assignments. */
    private final TreeMap<String, TreeSet<Location>> unused;

    /** Live identifiers. */
    private final TreeSet<String> used;

    /** True if control cannot reach this point. */
    private boolean bottom;

    /** The analyzed function. */
    private final FunctionDefinitionNode define;

    /** Nested function definitions by location. */
    private final TreeMap<Location, NestedDefine> nestedDefines;

    private LivenessStore(
            FunctionDefinitionNode define,
            TreeMap<String, TreeSet<Location>> unused,
            TreeSet<String> used,
            boolean bottom,
            TreeMap<Location, NestedDefine> nestedDefines) {
        this.define = define;
        this.unused = unused;
        this.used = used;
        this.bottom = bottom;
        this.nestedDefines = nestedDefines;
    }

    /**
     * Create an empty store for {@code define}.
     *
     * @param define the analyzed function
     */
    public LivenessStore(FunctionDefinitionNode define) {
        this(define, new TreeMap<>(), new TreeSet<>(), false, new TreeMap<>());
    }

    /**
     * Create the entry store of {@code define}: every parameter is a pending store at its own
     * location, so that unread parameters are reported like unread locals.
     *
     * @param enclosing the store of the enclosing function at the definition, or {@code null} for
     *     a top-level function; it does not influence the entry store
     * @param define the analyzed function
     * @return the entry store
     */
    public static LivenessStore initial(
            @Nullable LivenessStore enclosing, FunctionDefinitionNode define) {
        LivenessStore store = new LivenessStore(define);
        for (ParameterNode parameter : define.getParameters()) {
            store.updateUnused(parameter.getName(), parameter.getLocation(), null);
        }
        return store;
    }

    /** @return the analyzed function */
    public FunctionDefinitionNode getDefine() {
        return define;
    }

    /** @return the pending stores, read-only */
    public SortedMap<String, SortedSet<Location>> getUnused() {
        TreeMap<String, SortedSet<Location>> view = new TreeMap<>();
        for (Map.Entry<String, TreeSet<Location>> entry : unused.entrySet()) {
            view.put(entry.getKey(), Collections.unmodifiableSortedSet(entry.getValue()));
        }
        return Collections.unmodifiableSortedMap(view);
    }

    /** @return the live identifiers, read-only */
    public SortedSet<String> getUsed() {
        return Collections.unmodifiableSortedSet(used);
    }

    /** @return true if control cannot reach this point */
    public boolean isBottom() {
        return bottom;
    }

    /** Mark this point as unreachable. */
    public void markBottom() {
        bottom = true;
    }

    /** @return the nested function definitions seen so far, by location, read-only */
    public SortedMap<Location, NestedDefine> getNestedDefines() {
        return Collections.unmodifiableSortedMap(nestedDefines);
    }

    /**
     * Record a nested function definition. A later definition at the same location replaces the
     * earlier one.
     *
     * @param location the location of the definition
     * @param nestedDefine the definition and the enclosing store captured there
     */
    public void putNestedDefine(Location location, NestedDefine nestedDefine) {
        nestedDefines.put(location, nestedDefine);
    }

    /**
     * Record that {@code identifier} is assigned at {@code location}. The locations of its
     * previous pending stores are reported as dead stores, since they are overwritten without
     * being read.
     *
     * @param identifier the assigned identifier
     * @param location the location of the assignment
     * @param diagnostics the table overwritten stores are reported to, or {@code null} if there
     *     cannot be any
     */
    public void updateUnused(
            String identifier, Location location, @Nullable DiagnosticTable diagnostics) {
        TreeSet<Location> existing = unused.get(identifier);
        if (existing != null) {
            if (diagnostics == null) {
                throw new BugInCF(
                        "LivenessStore: %s is overwritten at %s without a diagnostic table",
                        identifier, location);
            }
            for (Location overwritten : existing) {
                diagnostics.put(new DeadStore(overwritten, identifier, define));
            }
        }
        TreeSet<Location> locations = new TreeSet<>();
        locations.add(location);
        unused.put(identifier, locations);
    }

    /**
     * Remove the pending stores of the given identifiers: their values have been read.
     *
     * @param identifiers identifiers read by a statement
     */
    public void consumeReads(Collection<String> identifiers) {
        for (String identifier : identifiers) {
            unused.remove(identifier);
        }
    }

    /**
     * @param identifier an identifier
     * @return true if {@code identifier} is live at this point
     */
    public boolean isUsed(String identifier) {
        return used.contains(identifier);
    }

    /**
     * Add the given identifiers to the live identifiers.
     *
     * @param identifiers identifiers read by a statement
     */
    public void addUsed(Collection<String> identifiers) {
        used.addAll(identifiers);
    }

    /**
     * Remove {@code identifier} from the live identifiers.
     *
     * @param identifier an identifier assigned by a statement
     */
    public void killUsed(String identifier) {
        used.remove(identifier);
    }

    @Override
    public LivenessStore copy() {
        return new LivenessStore(
                define, copyUnused(unused), new TreeSet<>(used), bottom, new TreeMap<>(nestedDefines));
    }

    private static TreeMap<String, TreeSet<Location>> copyUnused(
            Map<String, TreeSet<Location>> unused) {
        TreeMap<String, TreeSet<Location>> result = new TreeMap<>();
        for (Map.Entry<String, TreeSet<Location>> entry : unused.entrySet()) {
            result.put(entry.getKey(), new TreeSet<>(entry.getValue()));
        }
        return result;
    }

    /**
     * Joins two stores. Live identifiers and pending stores are united; the result is unreachable
     * only if both stores are. Nested definitions are united as well, preferring this store's
     * entry when both have one at the same location.
     *
     * <p>{@link #lessOrEqual} only compares the locations of nested definitions, so joins in
     * either order are equivalent in the order even though the captured store at a shared
     * location is taken from {@code this}.
     */
    @Override
    public LivenessStore leastUpperBound(LivenessStore other) {
        TreeMap<String, TreeSet<Location>> unusedLub = copyUnused(unused);
        for (Map.Entry<String, TreeSet<Location>> entry : other.unused.entrySet()) {
            TreeSet<Location> locations = unusedLub.get(entry.getKey());
            if (locations == null) {
                unusedLub.put(entry.getKey(), new TreeSet<>(entry.getValue()));
            } else {
                locations.addAll(entry.getValue());
            }
        }
        TreeSet<String> usedLub = new TreeSet<>(used);
        usedLub.addAll(other.used);
        TreeMap<Location, NestedDefine> nestedLub = new TreeMap<>(other.nestedDefines);
        nestedLub.putAll(nestedDefines);
        return new LivenessStore(define, unusedLub, usedLub, bottom && other.bottom, nestedLub);
    }

    /** The lattice has finite height for a given function, so the join is a widening. */
    @Override
    public LivenessStore widenedUpperBound(LivenessStore previous) {
        return previous.leastUpperBound(this);
    }

    /**
     * {@code this} is less or equal to {@code other} if every pending store of {@code this} is
     * pending in {@code other}, every live identifier of {@code this} is live in {@code other},
     * {@code this} is unreachable whenever {@code other} is, and {@code other} knows every nested
     * definition of {@code this}.
     */
    @Override
    public boolean lessOrEqual(LivenessStore other) {
        for (Map.Entry<String, TreeSet<Location>> entry : unused.entrySet()) {
            TreeSet<Location> locations = other.unused.get(entry.getKey());
            if (locations == null || !locations.containsAll(entry.getValue())) {
                return false;
            }
        }
        if (!other.used.containsAll(used)) {
            return false;
        }
        if (other.bottom && !bottom) {
            return false;
        }
        return other.nestedDefines.keySet().containsAll(nestedDefines.keySet());
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof LivenessStore)) {
            return false;
        }
        LivenessStore other = (LivenessStore) obj;
        return define == other.define
                && bottom == other.bottom
                && unused.equals(other.unused)
                && used.equals(other.used)
                && nestedDefines.equals(other.nestedDefines);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unused, used, bottom, nestedDefines.keySet());
    }

    @Override
    public String toString() {
        Set<Location> nested = nestedDefines.keySet();
        return "LivenessStore{unused="
                + unused
                + ", used="
                + used
                + (bottom ? ", bottom" : "")
                + (nested.isEmpty() ? "" : ", nested=" + nested)
                + "}";
    }
}
