package org.deadstore.dataflow.livevariable;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.deadstore.dataflow.cfg.node.FunctionDefinitionNode;

/**
 * A function defined inside the analyzed function, together with the store of the enclosing
 * function right after the definition.
 */
public final class NestedDefine {

    private final FunctionDefinitionNode define;
    private final LivenessStore state;

    /**
     * @param define the nested function definition
     * @param state the enclosing store at the definition; it is not copied
     */
    public NestedDefine(FunctionDefinitionNode define, LivenessStore state) {
        this.define = define;
        this.state = state;
    }

    public FunctionDefinitionNode getDefine() {
        return define;
    }

    public LivenessStore getState() {
        return state;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof NestedDefine)) {
            return false;
        }
        NestedDefine other = (NestedDefine) obj;
        return define == other.define && state.equals(other.state);
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(define);
    }

    @Override
    public String toString() {
        return define.getQualifiedName() + "@" + define.getLocation();
    }
}
