package org.deadstore.dataflow.cfg.node;

import java.util.Collection;
import java.util.Collections;

/** A node for an expression evaluated for its effect, such as a call on its own line. */
public class ExpressionStatementNode extends Node {

    protected final Node expression;

    public ExpressionStatementNode(Location location, Node expression) {
        super(location);
        this.expression = expression;
    }

    public Node getExpression() {
        return expression;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitExpressionStatement(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        return Collections.singletonList(expression);
    }

    @Override
    public String toString() {
        return expression.toString();
    }
}
