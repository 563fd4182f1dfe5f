package org.deadstore.dataflow.livevariable;

import static com.google.common.truth.Truth.assertThat;
import static org.deadstore.dataflow.cfg.node.Syntax.assertFalse;
import static org.deadstore.dataflow.cfg.node.Syntax.assign;
import static org.deadstore.dataflow.cfg.node.Syntax.at;
import static org.deadstore.dataflow.cfg.node.Syntax.attribute;
import static org.deadstore.dataflow.cfg.node.Syntax.def;
import static org.deadstore.dataflow.cfg.node.Syntax.ifThen;
import static org.deadstore.dataflow.cfg.node.Syntax.integer;
import static org.deadstore.dataflow.cfg.node.Syntax.list;
import static org.deadstore.dataflow.cfg.node.Syntax.name;
import static org.deadstore.dataflow.cfg.node.Syntax.param;
import static org.deadstore.dataflow.cfg.node.Syntax.params;
import static org.deadstore.dataflow.cfg.node.Syntax.pass;
import static org.deadstore.dataflow.cfg.node.Syntax.plus;
import static org.deadstore.dataflow.cfg.node.Syntax.ret;
import static org.deadstore.dataflow.cfg.node.Syntax.starred;
import static org.deadstore.dataflow.cfg.node.Syntax.subscript;
import static org.deadstore.dataflow.cfg.node.Syntax.tuple;
import static org.deadstore.dataflow.cfg.node.Syntax.use;
import static org.junit.Assert.assertThrows;

import java.util.Collections;
import org.checkerframework.javacutil.BugInCF;
import org.deadstore.dataflow.analysis.TransferInput;
import org.deadstore.dataflow.cfg.node.AssertNode;
import org.deadstore.dataflow.cfg.node.AssignmentNode;
import org.deadstore.dataflow.cfg.node.CallNode;
import org.deadstore.dataflow.cfg.node.ExpressionStatementNode;
import org.deadstore.dataflow.cfg.node.FunctionDefinitionNode;
import org.deadstore.dataflow.cfg.node.Location;
import org.deadstore.dataflow.cfg.node.Node;
import org.deadstore.dataflow.resolution.DeclaredNoReturnOracle;
import org.deadstore.dataflow.resolution.NeverTypeOracle;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ForwardLivenessTransferTest {

    private final FunctionDefinitionNode f = def(1, "f", pass(2));

    private DiagnosticTable diagnostics;
    private ForwardLivenessTransfer transfer;
    private LivenessStore store;

    @Before
    public void setUp() {
        diagnostics = new DiagnosticTable();
        transfer = new ForwardLivenessTransfer(null, new DeclaredNoReturnOracle(), diagnostics);
        store = new LivenessStore(f);
    }

    private void run(Node statement) {
        store = statement.accept(transfer, new TransferInput<>(statement, store)).getRegularStore();
    }

    @Test
    public void initialStoreMakesParametersPending() {
        FunctionDefinitionNode g = def(1, "g", params(param(1, 6, "p")), pass(2));
        LivenessStore initial = transfer.initialStore(g, g.getParameters());
        assertThat(initial.getUnused().keySet()).containsExactly("p");
    }

    @Test
    public void assignmentReadsItsValueBeforeStoring() {
        run(assign(2, "x", 1));
        run(assign(3, "x", plus(3, name(3, "x"), integer(3, 1))));

        assertThat(store.getUnused().get("x")).containsExactly(at(3));
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    public void overwriteWithoutReadIsReported() {
        run(assign(2, "x", 1));
        run(assign(3, "x", 2));

        assertThat(diagnostics.sortedDiagnostics()).containsExactly(new DeadStore(at(2), "x", f));
        assertThat(store.getUnused().get("x")).containsExactly(at(3));
    }

    @Test
    public void readConsumesPendingStore() {
        run(assign(2, "x", 1));
        run(assign(3, "y", name(3, "x")));

        assertThat(store.getUnused().keySet()).containsExactly("y");
    }

    @Test
    public void destructuringStoresEveryName() {
        Node target =
                tuple(2, name(2, "a"), list(2, name(2, "b"), starred(2, name(2, "c"))));
        run(assign(2, target, name(2, "v")));

        assertThat(store.getUnused().keySet()).containsExactly("a", "b", "c");
        assertThat(store.getUnused().get("c")).containsExactly(at(2));
    }

    @Test
    public void subscriptTargetReadsItsOperands() {
        run(assign(2, "d", 1));
        run(assign(3, "i", 2));
        run(assign(4, subscript(4, name(4, "d"), name(4, "i")), integer(4, 3)));

        assertThat(store.getUnused()).isEmpty();
    }

    @Test
    public void annotationIsRead() {
        run(assign(2, "T", 1));
        run(new AssignmentNode(at(3), name(3, "x"), integer(3, 1), name(3, "T")));

        assertThat(store.getUnused().keySet()).containsExactly("x");
    }

    @Test
    public void returnMakesTheStoreUnreachable() {
        run(assign(2, "x", 1));
        run(ret(3, "x"));
        assertThat(store.isBottom()).isTrue();
        assertThat(store.getUnused()).isEmpty();

        run(assign(4, "y", 1));
        run(assign(5, "y", 2));
        assertThat(store.getUnused()).isEmpty();
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    public void readsAreNotConsumedWhenUnreachable() {
        run(assign(2, "x", 1));
        run(assertFalse(3));
        run(use(4, "x"));

        assertThat(store.isBottom()).isTrue();
        assertThat(store.getUnused().keySet()).containsExactly("x");
    }

    @Test
    public void onlyAFalseAssertionIsUnreachable() {
        run(new AssertNode(at(2), name(2, "c")));
        assertThat(store.isBottom()).isFalse();
    }

    @Test
    public void noReturnCallMakesTheStoreUnreachable() {
        Node exit =
                new CallNode(
                        Location.of(2, 4),
                        attribute(2, name(2, "sys"), "exit"),
                        Collections.<Node>emptyList());
        ExpressionStatementNode statement = new ExpressionStatementNode(at(2), exit);

        transfer = new ForwardLivenessTransfer(null, NeverTypeOracle.NONE, diagnostics);
        run(statement);
        assertThat(store.isBottom()).isFalse();

        transfer = new ForwardLivenessTransfer(null, new DeclaredNoReturnOracle(), diagnostics);
        run(statement);
        assertThat(store.isBottom()).isTrue();
    }

    @Test
    public void nestedDefinitionIsRecordedWithTheCurrentStore() {
        run(assign(2, "y", 1));
        run(assign(3, "z", 1));
        FunctionDefinitionNode inner = def(4, "inner", ret(5, "z"));
        run(inner);

        NestedDefine nested = store.getNestedDefines().get(at(4));
        assertThat(nested).isNotNull();
        assertThat(nested.getDefine()).isSameInstanceAs(inner);
        assertThat(nested.getState().getUnused().keySet()).containsExactly("y");
        // The closure reads z.
        assertThat(store.getUnused().keySet()).containsExactly("y");
    }

    @Test
    public void compoundStatementsAreABug() {
        Node compound = ifThen(2, name(2, "c"), pass(3));
        assertThrows(BugInCF.class, () -> run(compound));
    }
}
