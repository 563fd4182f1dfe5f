package org.deadstore.dataflow.cfg.node;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the base identifiers referenced by a node, in source order. For an attribute access
 * {@code a.b.c} only the base {@code a} is collected.
 *
 * <p>The collector descends into every operand, including the parameter defaults, annotations
 * and whole body of a nested {@link FunctionDefinitionNode}: a variable referenced from a closure
 * counts as referenced by the statement that defines the closure.
 */
public class IdentifierCollector extends AbstractNodeVisitor<Void, List<NameNode>> {

    /** The collector is stateless; all state lives in the list being filled. */
    private static final IdentifierCollector INSTANCE = new IdentifierCollector();

    private IdentifierCollector() {}

    /**
     * Collect the base identifiers referenced by {@code node}.
     *
     * @param node an expression or statement
     * @return the name nodes referenced by {@code node}, in source order, with duplicates
     */
    public static List<NameNode> collectBaseIdentifiers(Node node) {
        List<NameNode> names = new ArrayList<>();
        node.accept(INSTANCE, names);
        return names;
    }

    @Override
    public Void visitNode(Node n, List<NameNode> names) {
        for (Node operand : n.getOperands()) {
            operand.accept(this, names);
        }
        return null;
    }

    @Override
    public Void visitName(NameNode n, List<NameNode> names) {
        names.add(n);
        return null;
    }
}
