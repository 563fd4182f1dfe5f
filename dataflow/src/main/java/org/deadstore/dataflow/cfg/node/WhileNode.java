package org.deadstore.dataflow.cfg.node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A node for {@code while test: body else: orElse}. The else clause runs when the test fails, but
 * not when the loop is left through {@code break}.
 */
public class WhileNode extends Node {

    protected final Node test;
    protected final List<Node> body;
    protected final List<Node> orElse;

    public WhileNode(Location location, Node test, List<Node> body, List<Node> orElse) {
        super(location);
        this.test = test;
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
        this.orElse = Collections.unmodifiableList(new ArrayList<>(orElse));
    }

    public Node getTest() {
        return test;
    }

    public List<Node> getBody() {
        return body;
    }

    public List<Node> getOrElse() {
        return orElse;
    }

    /** @return true for {@code while True}, which can only be left by a jump */
    public boolean isInfinite() {
        return test instanceof BooleanLiteralNode && ((BooleanLiteralNode) test).getValue();
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitWhile(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        List<Node> operands = new ArrayList<>(1 + body.size() + orElse.size());
        operands.add(test);
        operands.addAll(body);
        operands.addAll(orElse);
        return operands;
    }

    @Override
    public String toString() {
        return "while " + test;
    }
}
