package org.deadstore.dataflow.cfg.node;

import java.util.Arrays;
import java.util.Collection;

/** A node for a subscript, such as {@code base[index]}. */
public class SubscriptNode extends Node {

    protected final Node base;
    protected final Node index;

    public SubscriptNode(Location location, Node base, Node index) {
        super(location);
        this.base = base;
        this.index = index;
    }

    public Node getBase() {
        return base;
    }

    public Node getIndex() {
        return index;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitSubscript(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        return Arrays.asList(base, index);
    }

    @Override
    public String toString() {
        return base + "[" + index + "]";
    }
}
