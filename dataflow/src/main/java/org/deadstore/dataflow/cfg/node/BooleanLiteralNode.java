package org.deadstore.dataflow.cfg.node;

import java.util.Collection;
import java.util.Collections;

/** A node for the literals {@code True} and {@code False}. */
public class BooleanLiteralNode extends Node {

    protected final boolean value;

    public BooleanLiteralNode(Location location, boolean value) {
        super(location);
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitBooleanLiteral(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return value ? "True" : "False";
    }
}
