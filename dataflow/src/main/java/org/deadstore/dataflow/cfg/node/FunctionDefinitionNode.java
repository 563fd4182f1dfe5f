package org.deadstore.dataflow.cfg.node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A function definition: the unit of analysis of the dead store checker, and, when it occurs in
 * the body of another function, a statement that introduces a nested definition.
 *
 * <p>A module's top-level statements are analyzed as the body of a synthetic definition named
 * {@value #TOPLEVEL_NAME}, see {@link #toplevel(List)}.
 */
public class FunctionDefinitionNode extends Node {

    /** The name of the synthetic definition wrapping a module's top-level statements. */
    public static final String TOPLEVEL_NAME = "$toplevel";

    protected final String name;

    /** The name of the enclosing class, if this is a method. */
    protected final @Nullable String parent;

    protected final List<ParameterNode> parameters;
    protected final @Nullable Node returnAnnotation;
    protected final List<Node> body;

    public FunctionDefinitionNode(
            Location location, String name, List<ParameterNode> parameters, List<Node> body) {
        this(location, name, null, parameters, null, body);
    }

    public FunctionDefinitionNode(
            Location location,
            String name,
            @Nullable String parent,
            List<ParameterNode> parameters,
            @Nullable Node returnAnnotation,
            List<Node> body) {
        super(location);
        this.name = name;
        this.parent = parent;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.returnAnnotation = returnAnnotation;
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
    }

    /**
     * Wrap the top-level statements of a module into a synthetic function definition without
     * parameters.
     *
     * @param statements the module body
     * @return a definition named {@value #TOPLEVEL_NAME}
     */
    public static FunctionDefinitionNode toplevel(List<Node> statements) {
        Location location =
                statements.isEmpty()
                        ? Location.of(1, 0)
                        : new Location(
                                1,
                                0,
                                statements.get(statements.size() - 1).getLocation().getStopLine(),
                                statements.get(statements.size() - 1)
                                        .getLocation()
                                        .getStopColumn());
        return new FunctionDefinitionNode(
                location, TOPLEVEL_NAME, Collections.emptyList(), statements);
    }

    public String getName() {
        return name;
    }

    public @Nullable String getParent() {
        return parent;
    }

    /** @return the qualified name, {@code Parent.name} for methods */
    public String getQualifiedName() {
        return parent == null ? name : parent + "." + name;
    }

    public List<ParameterNode> getParameters() {
        return parameters;
    }

    public @Nullable Node getReturnAnnotation() {
        return returnAnnotation;
    }

    public List<Node> getBody() {
        return body;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitFunctionDefinition(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        List<Node> operands = new ArrayList<>(parameters);
        if (returnAnnotation != null) {
            operands.add(returnAnnotation);
        }
        operands.addAll(body);
        return operands;
    }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "def " + getQualifiedName() + "(", ")");
        for (ParameterNode parameter : parameters) {
            sj.add(parameter.toString());
        }
        return sj.toString();
    }
}
