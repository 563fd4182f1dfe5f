package org.deadstore.dataflow.cfg.node;

import java.util.Collection;
import java.util.Collections;

/** A node for an integer literal. */
public class IntegerLiteralNode extends Node {

    protected final long value;

    public IntegerLiteralNode(Location location, long value) {
        super(location);
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitIntegerLiteral(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
