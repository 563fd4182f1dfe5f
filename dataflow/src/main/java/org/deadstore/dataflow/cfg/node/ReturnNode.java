package org.deadstore.dataflow.cfg.node;

import java.util.Collection;
import java.util.Collections;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A node for a return statement, with or without a result. */
public class ReturnNode extends Node {

    protected final @Nullable Node result;

    public ReturnNode(Location location, @Nullable Node result) {
        super(location);
        this.result = result;
    }

    public @Nullable Node getResult() {
        return result;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitReturn(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        if (result == null) {
            return Collections.emptyList();
        }
        return Collections.singletonList(result);
    }

    @Override
    public String toString() {
        return result == null ? "return" : "return " + result;
    }
}
