package org.deadstore.dataflow.cfg.node;

import java.util.Collection;
import java.util.Collections;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A node for a raise statement, with or without an exception. */
public class RaiseNode extends Node {

    protected final @Nullable Node exception;

    public RaiseNode(Location location, @Nullable Node exception) {
        super(location);
        this.exception = exception;
    }

    public @Nullable Node getException() {
        return exception;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitRaise(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        if (exception == null) {
            return Collections.emptyList();
        }
        return Collections.singletonList(exception);
    }

    @Override
    public String toString() {
        return exception == null ? "raise" : "raise " + exception;
    }
}
