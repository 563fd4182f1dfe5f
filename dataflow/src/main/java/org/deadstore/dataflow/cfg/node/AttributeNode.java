package org.deadstore.dataflow.cfg.node;

import java.util.Collection;
import java.util.Collections;

/** A node for an attribute access, such as {@code base.attribute}. */
public class AttributeNode extends Node {

    protected final Node base;
    protected final String attribute;

    public AttributeNode(Location location, Node base, String attribute) {
        super(location);
        this.base = base;
        this.attribute = attribute;
    }

    public Node getBase() {
        return base;
    }

    public String getAttribute() {
        return attribute;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitAttribute(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        return Collections.singletonList(base);
    }

    @Override
    public String toString() {
        return base + "." + attribute;
    }
}
