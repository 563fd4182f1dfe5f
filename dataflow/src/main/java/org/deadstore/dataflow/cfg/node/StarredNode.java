package org.deadstore.dataflow.cfg.node;

import java.util.Collection;
import java.util.Collections;

/**
 * A node for a single starred expression, such as {@code *rest}. In a destructuring assignment
 * target the starred element receives the remaining values.
 */
public class StarredNode extends Node {

    protected final Node operand;

    public StarredNode(Location location, Node operand) {
        super(location);
        this.operand = operand;
    }

    public Node getOperand() {
        return operand;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitStarred(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        return Collections.singletonList(operand);
    }

    @Override
    public String toString() {
        return "*" + operand;
    }
}
