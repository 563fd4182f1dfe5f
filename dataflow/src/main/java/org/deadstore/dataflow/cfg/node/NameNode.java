package org.deadstore.dataflow.cfg.node;

import java.util.Collection;
import java.util.Collections;

/**
 * A node for a bare identifier, such as {@code x}.
 *
 * <p>As an operand a name is a read of the variable; as the target of an {@link AssignmentNode} it
 * is a store.
 */
public class NameNode extends Node {

    protected final String identifier;

    public NameNode(Location location, String identifier) {
        super(location);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitName(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return identifier;
    }
}
