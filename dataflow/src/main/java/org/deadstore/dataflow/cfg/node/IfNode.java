package org.deadstore.dataflow.cfg.node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/** A node for {@code if test: body else: orElse}. An {@code elif} is a nested if in orElse. */
public class IfNode extends Node {

    protected final Node test;
    protected final List<Node> body;
    protected final List<Node> orElse;

    public IfNode(Location location, Node test, List<Node> body, List<Node> orElse) {
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

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitIf(this, p);
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
        return "if " + test;
    }
}
