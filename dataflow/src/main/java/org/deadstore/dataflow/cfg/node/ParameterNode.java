package org.deadstore.dataflow.cfg.node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A formal parameter of a {@link FunctionDefinitionNode}. The location of a parameter is its
 * declaration site, which is where an unused parameter is reported.
 */
public class ParameterNode extends Node {

    protected final String name;
    protected final @Nullable Node annotation;
    protected final @Nullable Node defaultValue;

    public ParameterNode(Location location, String name) {
        this(location, name, null, null);
    }

    public ParameterNode(
            Location location,
            String name,
            @Nullable Node annotation,
            @Nullable Node defaultValue) {
        super(location);
        this.name = name;
        this.annotation = annotation;
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    public @Nullable Node getAnnotation() {
        return annotation;
    }

    public @Nullable Node getDefaultValue() {
        return defaultValue;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitParameter(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        List<Node> operands = new ArrayList<>(2);
        if (annotation != null) {
            operands.add(annotation);
        }
        if (defaultValue != null) {
            operands.add(defaultValue);
        }
        return operands;
    }

    @Override
    public String toString() {
        return name
                + (annotation == null ? "" : ": " + annotation)
                + (defaultValue == null ? "" : " = " + defaultValue);
    }
}
