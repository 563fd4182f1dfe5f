package org.deadstore.dataflow.cfg.node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/** A node for a call, such as {@code callee(argument, ...)}. */
public class CallNode extends Node {

    protected final Node callee;
    protected final List<Node> arguments;

    public CallNode(Location location, Node callee, List<Node> arguments) {
        super(location);
        this.callee = callee;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public Node getCallee() {
        return callee;
    }

    public List<Node> getArguments() {
        return arguments;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitCall(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        List<Node> operands = new ArrayList<>(arguments.size() + 1);
        operands.add(callee);
        operands.addAll(arguments);
        return operands;
    }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", callee + "(", ")");
        for (Node argument : arguments) {
            sj.add(argument.toString());
        }
        return sj.toString();
    }
}
