package org.deadstore.dataflow.livevariable;

import java.util.Comparator;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.deadstore.dataflow.cfg.node.FunctionDefinitionNode;
import org.deadstore.dataflow.cfg.node.Location;

/** A finding of the analysis: the value assigned to an identifier at a location is never read. */
public final class DeadStore implements Comparable<DeadStore> {

    /** The kinds of findings, with their error codes. */
    public enum Kind {
        DEAD_STORE(1003, "Dead store");

        private final int code;
        private final String displayName;

        Kind(int code, String displayName) {
            this.code = code;
            this.displayName = displayName;
        }

        public int getCode() {
            return code;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    private static final Comparator<DeadStore> ORDER =
            Comparator.comparing(DeadStore::getLocation)
                    .thenComparing(DeadStore::getIdentifier)
                    .thenComparing(d -> d.define.getQualifiedName());

    private final Location location;
    private final String identifier;
    private final FunctionDefinitionNode define;

    /**
     * @param location the location of the assignment, or of the parameter
     * @param identifier the assigned identifier
     * @param define the function the assignment belongs to
     */
    public DeadStore(Location location, String identifier, FunctionDefinitionNode define) {
        this.location = location;
        this.identifier = identifier;
        this.define = define;
    }

    public Location getLocation() {
        return location;
    }

    public String getIdentifier() {
        return identifier;
    }

    public Kind getKind() {
        return Kind.DEAD_STORE;
    }

    /** @return the function the assignment belongs to */
    public FunctionDefinitionNode getDefine() {
        return define;
    }

    /** @return the user-facing message */
    public String getDescription() {
        return "Value assigned to `" + identifier + "` is never used.";
    }

    @Override
    public int compareTo(DeadStore other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof DeadStore)) {
            return false;
        }
        DeadStore other = (DeadStore) obj;
        return location.equals(other.location)
                && identifier.equals(other.identifier)
                && define == other.define;
    }

    @Override
    public int hashCode() {
        return 31 * location.hashCode() + identifier.hashCode();
    }

    @Override
    public String toString() {
        return location
                + ": "
                + getKind().getDisplayName()
                + " ["
                + getKind().getCode()
                + "]: "
                + getDescription();
    }
}
