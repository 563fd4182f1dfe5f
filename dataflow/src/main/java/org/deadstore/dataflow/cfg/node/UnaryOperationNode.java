package org.deadstore.dataflow.cfg.node;

import java.util.Collection;
import java.util.Collections;

/** A node for a unary operation such as {@code -a} or {@code not a}. */
public class UnaryOperationNode extends Node {

    /** The spelling of logical negation. */
    public static final String NOT = "not";

    protected final String operator;
    protected final Node operand;

    public UnaryOperationNode(Location location, String operator, Node operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public String getOperator() {
        return operator;
    }

    public Node getOperand() {
        return operand;
    }

    /** @return true if this is a logical negation */
    public boolean isNot() {
        return NOT.equals(operator);
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitUnaryOperation(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        return Collections.singletonList(operand);
    }

    @Override
    public String toString() {
        return isNot() ? "not " + operand : operator + operand;
    }
}
