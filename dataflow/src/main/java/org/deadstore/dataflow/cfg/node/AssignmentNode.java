package org.deadstore.dataflow.cfg.node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A node for an assignment statement, {@code target: annotation = value}.
 *
 * <p>The target may be a name, an attribute access, a subscript, or a (possibly nested) list or
 * tuple of targets with at most one starred element. The optional annotation is the declared type
 * of a name target.
 */
public class AssignmentNode extends Node {

    protected final Node target;
    protected final Node value;
    protected final @Nullable Node annotation;

    public AssignmentNode(Location location, Node target, Node value) {
        this(location, target, value, null);
    }

    public AssignmentNode(
            Location location, Node target, Node value, @Nullable Node annotation) {
        super(location);
        this.target = target;
        this.value = value;
        this.annotation = annotation;
    }

    public Node getTarget() {
        return target;
    }

    public Node getValue() {
        return value;
    }

    public @Nullable Node getAnnotation() {
        return annotation;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitAssignment(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        List<Node> operands = new ArrayList<>(3);
        operands.add(target);
        if (annotation != null) {
            operands.add(annotation);
        }
        operands.add(value);
        return operands;
    }

    @Override
    public String toString() {
        if (annotation != null) {
            return target + ": " + annotation + " = " + value;
        }
        return target + " = " + value;
    }
}
