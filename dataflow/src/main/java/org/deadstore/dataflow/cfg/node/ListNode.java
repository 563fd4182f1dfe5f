package org.deadstore.dataflow.cfg.node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * A node for a list display, such as {@code [a, b]}. As an assignment target it is
 * destructured element by element.
 */
public class ListNode extends Node {

    protected final List<Node> elements;

    public ListNode(Location location, List<Node> elements) {
        super(location);
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public List<Node> getElements() {
        return elements;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitList(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        return elements;
    }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "[", "]");
        for (Node element : elements) {
            sj.add(element.toString());
        }
        return sj.toString();
    }
}
