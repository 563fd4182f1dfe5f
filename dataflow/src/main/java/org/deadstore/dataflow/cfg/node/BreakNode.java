package org.deadstore.dataflow.cfg.node;

import java.util.Collection;
import java.util.Collections;

/** A node for the {@code break} statement. */
public class BreakNode extends Node {

    public BreakNode(Location location) {
        super(location);
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitBreak(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "break";
    }
}
