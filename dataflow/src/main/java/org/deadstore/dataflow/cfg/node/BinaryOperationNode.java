package org.deadstore.dataflow.cfg.node;

import java.util.Arrays;
import java.util.Collection;

/**
 * A node for a binary operation such as {@code a + b}, {@code a < b} or {@code a and b}. The
 * operator is kept as its source spelling; the analyses only care about the operands.
 */
public class BinaryOperationNode extends Node {

    protected final String operator;
    protected final Node left;
    protected final Node right;

    public BinaryOperationNode(Location location, String operator, Node left, Node right) {
        super(location);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public String getOperator() {
        return operator;
    }

    public Node getLeftOperand() {
        return left;
    }

    public Node getRightOperand() {
        return right;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitBinaryOperation(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        return Arrays.asList(left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
