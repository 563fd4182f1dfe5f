package org.deadstore.dataflow.resolution;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.deadstore.dataflow.cfg.node.FunctionDefinitionNode;

/**
 * Identifies where an expression is resolved: the enclosing function, the never-returning
 * functions declared in it or in the functions around it, and, for flow-sensitive oracles, the
 * statement key (the id of the block holding the statement). The liveness analysis passes it
 * through to the {@link NeverTypeOracle} unchanged.
 *
 * <p>Contexts are immutable. Each analyzed function gets its own, so what one function declares is
 * never visible to an unrelated one.
 */
public final class ResolutionContext {

    private final String functionName;
    private final @Nullable String parent;
    private final @Nullable Integer key;

    /** Dotted names of the {@code NoReturn} functions in scope. */
    private final SortedSet<String> declaredNoReturn;

    public ResolutionContext(String functionName, @Nullable String parent, @Nullable Integer key) {
        this(functionName, parent, key, Collections.<String>emptySet());
    }

    private ResolutionContext(
            String functionName,
            @Nullable String parent,
            @Nullable Integer key,
            Collection<String> declaredNoReturn) {
        this.functionName = functionName;
        this.parent = parent;
        this.key = key;
        this.declaredNoReturn = Collections.unmodifiableSortedSet(new TreeSet<>(declaredNoReturn));
    }

    /**
     * Create the context for statements of {@code function}, with nothing declared in scope.
     *
     * @param function the enclosing function definition
     * @param key the statement key, or {@code null} for a flow-insensitive context
     * @return the resolution context
     */
    public static ResolutionContext of(FunctionDefinitionNode function, @Nullable Integer key) {
        return new ResolutionContext(function.getName(), function.getParent(), key);
    }

    public String getFunctionName() {
        return functionName;
    }

    public @Nullable String getParent() {
        return parent;
    }

    public @Nullable Integer getKey() {
        return key;
    }

    /** @return the dotted names of the never-returning functions declared in scope, sorted */
    public SortedSet<String> getDeclaredNoReturn() {
        return declaredNoReturn;
    }

    /**
     * Returns a context for the same function with another statement key.
     *
     * @param newKey the statement key
     * @return a context differing from this one only in the key
     */
    public ResolutionContext withKey(@Nullable Integer newKey) {
        return new ResolutionContext(functionName, parent, newKey, declaredNoReturn);
    }

    /**
     * Returns this context with {@code names} also declared never-returning.
     *
     * @param names dotted names of never-returning functions
     * @return a context whose declared names are this one's and {@code names}
     */
    public ResolutionContext withDeclaredNoReturn(Collection<String> names) {
        if (declaredNoReturn.containsAll(names)) {
            return this;
        }
        TreeSet<String> union = new TreeSet<>(declaredNoReturn);
        union.addAll(names);
        return new ResolutionContext(functionName, parent, key, union);
    }

    /**
     * Returns the context for the body of {@code function}, defined where this context applies.
     * The functions declared around it stay in scope.
     *
     * @param function a function defined in this context's function
     * @return the flow-insensitive context of {@code function}
     */
    public ResolutionContext nested(FunctionDefinitionNode function) {
        return new ResolutionContext(
                function.getName(), function.getParent(), null, declaredNoReturn);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (!(o instanceof ResolutionContext)) {
            return false;
        }
        ResolutionContext other = (ResolutionContext) o;
        return functionName.equals(other.functionName)
                && Objects.equals(parent, other.parent)
                && Objects.equals(key, other.key)
                && declaredNoReturn.equals(other.declaredNoReturn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, parent, key, declaredNoReturn);
    }

    @Override
    public String toString() {
        return (parent == null ? functionName : parent + "." + functionName)
                + (key == null ? "" : "@" + key);
    }
}
