package org.deadstore.dataflow.livevariable;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Consumer;
import org.deadstore.dataflow.cfg.node.AssignmentNode;
import org.deadstore.dataflow.cfg.node.IdentifierCollector;
import org.deadstore.dataflow.cfg.node.ListNode;
import org.deadstore.dataflow.cfg.node.NameNode;
import org.deadstore.dataflow.cfg.node.Node;
import org.deadstore.dataflow.cfg.node.StarredNode;
import org.deadstore.dataflow.cfg.node.TupleNode;

/** Destructuring of assignment targets and the read set of statements, for both directions. */
final class AssignmentTargets {

    private AssignmentTargets() {}

    /**
     * Walk the leaves of an assignment target. Lists and tuples are walked element by element, a
     * starred target is unwrapped.
     *
     * @param target an assignment target
     * @param onName called for each leaf that is a plain name
     * @param onOther called for each other leaf, such as {@code a.b} or {@code a[i]}
     */
    static void destructure(Node target, Consumer<NameNode> onName, Consumer<Node> onOther) {
        if (target instanceof NameNode) {
            onName.accept((NameNode) target);
        } else if (target instanceof ListNode) {
            for (Node element : ((ListNode) target).getElements()) {
                destructure(element, onName, onOther);
            }
        } else if (target instanceof TupleNode) {
            for (Node element : ((TupleNode) target).getElements()) {
                destructure(element, onName, onOther);
            }
        } else if (target instanceof StarredNode) {
            destructure(((StarredNode) target).getOperand(), onName, onOther);
        } else {
            onOther.accept(target);
        }
    }

    /**
     * Call {@code action} for every name an assignment stores into.
     *
     * @param target an assignment target
     * @param action called for each assigned name
     */
    static void forEachAssignedName(Node target, Consumer<NameNode> action) {
        destructure(target, action, other -> {});
    }

    /**
     * Returns the identifiers a simple statement reads. The names an assignment stores into are
     * not reads; the bases of attribute and subscript targets are.
     *
     * @param statement a simple statement
     * @return the identifiers read, in source order without duplicates
     */
    static Set<String> readIdentifiers(Node statement) {
        Set<String> reads = new LinkedHashSet<>();
        if (statement instanceof AssignmentNode) {
            AssignmentNode assignment = (AssignmentNode) statement;
            addBaseIdentifiers(assignment.getValue(), reads);
            if (assignment.getAnnotation() != null) {
                addBaseIdentifiers(assignment.getAnnotation(), reads);
            }
            destructure(assignment.getTarget(), name -> {}, other -> addBaseIdentifiers(other, reads));
        } else {
            addBaseIdentifiers(statement, reads);
        }
        return reads;
    }

    private static void addBaseIdentifiers(Node node, Collection<String> reads) {
        for (NameNode name : IdentifierCollector.collectBaseIdentifiers(node)) {
            reads.add(name.getIdentifier());
        }
    }
}
