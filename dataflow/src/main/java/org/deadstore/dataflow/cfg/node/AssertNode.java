package org.deadstore.dataflow.cfg.node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A node for an assertion, {@code assert test, message}.
 *
 * <p>Besides user-written assertions, the {@link org.deadstore.dataflow.cfg.CFGBuilder} places a
 * synthetic assertion of the branch condition (or its negation) at the start of every branch of
 * an {@code if}, {@code while} or {@code for}.
 */
public class AssertNode extends Node {

    protected final Node test;
    protected final @Nullable Node message;

    public AssertNode(Location location, Node test) {
        this(location, test, null);
    }

    public AssertNode(Location location, Node test, @Nullable Node message) {
        super(location);
        this.test = test;
        this.message = message;
    }

    public Node getTest() {
        return test;
    }

    public @Nullable Node getMessage() {
        return message;
    }

    /** @return true if the test is the literal {@code False}, so control never continues */
    public boolean isAssertFalse() {
        return test instanceof BooleanLiteralNode && !((BooleanLiteralNode) test).getValue();
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitAssert(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        List<Node> operands = new ArrayList<>(2);
        operands.add(test);
        if (message != null) {
            operands.add(message);
        }
        return operands;
    }

    @Override
    public String toString() {
        return "assert " + test + (message == null ? "" : ", " + message);
    }
}
