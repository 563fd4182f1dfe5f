package org.deadstore.dataflow.cfg.node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * A node for a tuple, such as {@code (a, b)} or {@code a, b}. As an assignment target it is
 * destructured element by element.
 */
public class TupleNode extends Node {

    protected final List<Node> elements;

    public TupleNode(Location location, List<Node> elements) {
        super(location);
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public List<Node> getElements() {
        return elements;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitTuple(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        return elements;
    }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "(", ")");
        for (Node element : elements) {
            sj.add(element.toString());
        }
        return sj.toString();
    }
}
