package org.deadstore.dataflow.cfg.node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/** A node for {@code for target in iterable: body else: orElse}. */
public class ForNode extends Node {

    protected final Node target;
    protected final Node iterable;
    protected final List<Node> body;
    protected final List<Node> orElse;

    public ForNode(
            Location location, Node target, Node iterable, List<Node> body, List<Node> orElse) {
        super(location);
        this.target = target;
        this.iterable = iterable;
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
        this.orElse = Collections.unmodifiableList(new ArrayList<>(orElse));
    }

    public Node getTarget() {
        return target;
    }

    public Node getIterable() {
        return iterable;
    }

    public List<Node> getBody() {
        return body;
    }

    public List<Node> getOrElse() {
        return orElse;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitFor(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        List<Node> operands = new ArrayList<>(2 + body.size() + orElse.size());
        operands.add(target);
        operands.add(iterable);
        operands.addAll(body);
        operands.addAll(orElse);
        return operands;
    }

    @Override
    public String toString() {
        return "for " + target + " in " + iterable;
    }
}
