package org.deadstore.dataflow.cfg.node;

import java.util.Collection;
import java.util.Collections;

/** A node for the {@code continue} statement. */
public class ContinueNode extends Node {

    public ContinueNode(Location location) {
        super(location);
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitContinue(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "continue";
    }
}
