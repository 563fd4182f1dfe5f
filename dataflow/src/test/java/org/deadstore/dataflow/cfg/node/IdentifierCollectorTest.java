package org.deadstore.dataflow.cfg.node;

import static com.google.common.truth.Truth.assertThat;
import static org.deadstore.dataflow.cfg.node.Syntax.assign;
import static org.deadstore.dataflow.cfg.node.Syntax.attribute;
import static org.deadstore.dataflow.cfg.node.Syntax.call;
import static org.deadstore.dataflow.cfg.node.Syntax.def;
import static org.deadstore.dataflow.cfg.node.Syntax.name;
import static org.deadstore.dataflow.cfg.node.Syntax.params;
import static org.deadstore.dataflow.cfg.node.Syntax.plus;
import static org.deadstore.dataflow.cfg.node.Syntax.ret;
import static org.deadstore.dataflow.cfg.node.Syntax.subscript;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IdentifierCollectorTest {

    private static List<String> identifiers(Node node) {
        List<String> result = new ArrayList<>();
        for (NameNode n : IdentifierCollector.collectBaseIdentifiers(node)) {
            result.add(n.getIdentifier());
        }
        return result;
    }

    @Test
    public void attributeChainsContributeTheirBase() {
        Node chain = attribute(1, attribute(1, name(1, "a"), "b"), "c");
        assertThat(identifiers(chain)).containsExactly("a");
    }

    @Test
    public void callsContributeCalleeAndArguments() {
        assertThat(identifiers(call(1, "f", "x", "y"))).containsExactly("f", "x", "y").inOrder();
    }

    @Test
    public void subscriptsAndOperationsContributeAllOperands() {
        Node expression = plus(1, subscript(1, name(1, "a"), name(1, "i")), name(1, "b"));
        assertThat(identifiers(expression)).containsExactly("a", "i", "b").inOrder();
    }

    @Test
    public void duplicatesAreKept() {
        assertThat(identifiers(plus(1, name(1, "x"), name(1, "x")))).containsExactly("x", "x");
    }

    @Test
    public void nestedDefinitionsContributeDefaultsAndBody() {
        ParameterNode p = new ParameterNode(Location.of(1, 8), "p", null, name(1, "default"));
        FunctionDefinitionNode inner = def(1, "inner", params(p), ret(2, "captured"));
        assertThat(identifiers(inner)).containsExactly("default", "captured").inOrder();
    }

    @Test
    public void assignmentStatementsIncludeTheirTarget() {
        // The read set of an assignment excludes the target; the collector itself does not.
        assertThat(identifiers(assign(1, "x", name(1, "y")))).containsExactly("x", "y").inOrder();
    }
}
