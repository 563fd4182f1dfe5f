package org.deadstore.dataflow.livevariable;

import static com.google.common.truth.Truth.assertThat;
import static org.deadstore.dataflow.cfg.node.Syntax.annotatedDef;
import static org.deadstore.dataflow.cfg.node.Syntax.assign;
import static org.deadstore.dataflow.cfg.node.Syntax.attribute;
import static org.deadstore.dataflow.cfg.node.Syntax.at;
import static org.deadstore.dataflow.cfg.node.Syntax.bool;
import static org.deadstore.dataflow.cfg.node.Syntax.call;
import static org.deadstore.dataflow.cfg.node.Syntax.def;
import static org.deadstore.dataflow.cfg.node.Syntax.expression;
import static org.deadstore.dataflow.cfg.node.Syntax.forLoop;
import static org.deadstore.dataflow.cfg.node.Syntax.ifThen;
import static org.deadstore.dataflow.cfg.node.Syntax.integer;
import static org.deadstore.dataflow.cfg.node.Syntax.name;
import static org.deadstore.dataflow.cfg.node.Syntax.param;
import static org.deadstore.dataflow.cfg.node.Syntax.params;
import static org.deadstore.dataflow.cfg.node.Syntax.pass;
import static org.deadstore.dataflow.cfg.node.Syntax.plus;
import static org.deadstore.dataflow.cfg.node.Syntax.raise;
import static org.deadstore.dataflow.cfg.node.Syntax.ret;
import static org.deadstore.dataflow.cfg.node.Syntax.statements;
import static org.deadstore.dataflow.cfg.node.Syntax.tuple;
import static org.deadstore.dataflow.cfg.node.Syntax.use;
import static org.deadstore.dataflow.cfg.node.Syntax.whileLoop;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.checkerframework.javacutil.UserError;
import org.deadstore.dataflow.cfg.node.CallNode;
import org.deadstore.dataflow.cfg.node.ExpressionStatementNode;
import org.deadstore.dataflow.cfg.node.FunctionDefinitionNode;
import org.deadstore.dataflow.cfg.node.Location;
import org.deadstore.dataflow.cfg.node.Node;
import org.deadstore.dataflow.cfg.node.ParameterNode;
import org.deadstore.dataflow.resolution.NeverTypeOracle;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DeadStoreCheckerTest {

    private final DeadStoreChecker checker = new DeadStoreChecker();

    /** Renders findings as {@code identifier@line:column} for compact assertions. */
    private static List<String> render(List<DeadStore> deadStores) {
        List<String> result = new ArrayList<>();
        for (DeadStore d : deadStores) {
            result.add(d.getIdentifier() + "@" + d.getLocation());
        }
        return result;
    }

    private List<String> check(FunctionDefinitionNode function) {
        return render(checker.check(function));
    }

    @Test
    public void unusedParameterIsReported() {
        FunctionDefinitionNode f = def(1, "f", params(param(1, 6, "p")), ret(2, null));
        assertThat(check(f)).containsExactly("p@1:6");
    }

    @Test
    public void usedParameterIsNotReported() {
        FunctionDefinitionNode f = def(1, "f", params(param(1, 6, "p")), ret(2, "p"));
        assertThat(check(f)).isEmpty();
    }

    @Test
    public void overwriteWithoutReadIsReportedOnce() {
        FunctionDefinitionNode f =
                def(1, "f", assign(2, "x", 1), assign(3, "x", 2), use(4, "x"));
        assertThat(check(f)).containsExactly("x@2:0");
    }

    @Test
    public void valueNeverReadIsReportedOnce() {
        assertThat(check(def(1, "f", assign(2, "x", 1)))).containsExactly("x@2:0");
    }

    @Test
    public void valueReadByReturnIsNotReported() {
        assertThat(check(def(1, "f", assign(2, "x", 1), ret(3, "x")))).isEmpty();
    }

    @Test
    public void codeAfterReturnIsIgnored() {
        FunctionDefinitionNode f =
                def(1, "f", assign(2, "x", 1), ret(3, null), assign(4, "x", 2));
        assertThat(check(f)).containsExactly("x@2:0");
    }

    @Test
    public void valueThatMayReachTheExitUnreadIsReported() {
        FunctionDefinitionNode f =
                def(
                        1,
                        "f",
                        params(param(1, 6, "c")),
                        assign(2, "x", 1),
                        ifThen(3, name(3, "c"), use(4, "x")),
                        ret(5, null));
        assertThat(check(f)).containsExactly("x@2:0");
    }

    @Test
    public void loopCarriedValueIsNotReported() {
        FunctionDefinitionNode f =
                def(
                        1,
                        "f",
                        params(param(1, 6, "c")),
                        assign(2, "x", 0),
                        whileLoop(
                                3,
                                name(3, "c"),
                                assign(4, "x", plus(4, name(4, "x"), integer(4, 1)))),
                        ret(5, "x"));
        assertThat(check(f)).isEmpty();
    }

    @Test
    public void unusedLoopVariableIsReported() {
        FunctionDefinitionNode f =
                def(
                        1,
                        "f",
                        params(param(1, 6, "xs")),
                        forLoop(2, name(2, "item"), name(2, "xs"), pass(3)),
                        ret(4, null));
        assertThat(check(f)).containsExactly("item@2:0");
    }

    @Test
    public void destructuredNamesAreCheckedIndividually() {
        FunctionDefinitionNode f =
                def(
                        1,
                        "f",
                        assign(2, tuple(2, name(2, "a"), name(2, "b")), call(2, "pair")),
                        ret(3, "a"));
        assertThat(check(f)).containsExactly("b@2:0");
    }

    @Test
    public void unreachableExitOnlyReportsOverwrites() {
        FunctionDefinitionNode f =
                def(
                        1,
                        "f",
                        assign(2, "x", 1),
                        assign(3, "x", 2),
                        assign(4, "unread", 3),
                        whileLoop(5, bool(5, true), use(6, "x")));
        assertThat(check(f)).containsExactly("x@2:0");
    }

    @Test
    public void functionsDefinedInANonTerminatingBodyAreAnalyzed() {
        FunctionDefinitionNode inner = def(3, "inner", assign(4, "y", 1));
        FunctionDefinitionNode g = def(1, "g", whileLoop(2, bool(2, true), inner));

        List<DeadStore> deadStores = checker.check(g);

        assertThat(render(deadStores)).containsExactly("y@4:0");
        assertThat(deadStores.get(0).getDefine()).isSameInstanceAs(inner);
    }

    @Test
    public void nestedFunctionsAreAnalyzedSeparately() {
        FunctionDefinitionNode inner = def(4, "inner", assign(5, "z", 1), ret(6, null));
        FunctionDefinitionNode outer =
                def(
                        1,
                        "outer",
                        ifThen(2, name(2, "c"), assign(3, "y", 1), inner, use(7, "y")),
                        ret(8, null));

        List<DeadStore> deadStores = checker.check(outer);

        assertThat(render(deadStores)).containsExactly("z@5:0");
        assertThat(deadStores.get(0).getDefine()).isSameInstanceAs(inner);
    }

    @Test
    public void closuresKeepCapturedValuesAlive() {
        FunctionDefinitionNode outer =
                def(
                        1,
                        "outer",
                        assign(2, "y", 1),
                        def(3, "inner", ret(4, "y")),
                        ret(5, "inner"));
        assertThat(check(outer)).isEmpty();
    }

    @Test
    public void readsAfterANeverReturningCallDoNotCount() {
        FunctionDefinitionNode f =
                def(1, "f", assign(2, "x", 1), expression(3, "exit"), use(4, "x"));

        assertThat(check(f)).containsExactly("x@2:0");
        DeadStoreChecker unaware = new DeadStoreChecker(LivenessOptions.DEFAULT, NeverTypeOracle.NONE);
        assertThat(unaware.check(f)).isEmpty();
    }

    @Test
    public void resultDoesNotDependOnPreviouslyCheckedFunctions() throws InterruptedException {
        FunctionDefinitionNode caller =
                def(10, "caller", assign(11, "x", 1), expression(12, "g"), use(13, "x"));
        FunctionDefinitionNode declaring =
                def(1, "declaring", annotatedDef(2, "g", name(2, "NoReturn"), raise(3)));

        List<DeadStore> before = checker.check(caller);
        assertThat(checker.check(declaring)).isEmpty();
        List<DeadStore> after = checker.check(caller);

        assertThat(before).isEmpty();
        assertThat(after).containsExactlyElementsIn(before);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            assertThat(checker.checkAll(Arrays.asList(declaring, caller), executor)).isEmpty();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void nestedFunctionsSeeNeverReturningFunctionsDeclaredAroundThem() {
        FunctionDefinitionNode outer =
                def(
                        1,
                        "outer",
                        annotatedDef(2, "die", name(2, "NoReturn"), raise(3)),
                        def(4, "inner", assign(5, "x", 1), expression(6, "die"), use(7, "x")),
                        expression(8, "inner"));

        assertThat(check(outer)).containsExactly("x@5:0");
    }

    @Test
    public void neverReturningMethodsOnlyMatchQualifiedCalls() {
        FunctionDefinitionNode method =
                new FunctionDefinitionNode(
                        at(2),
                        "fail",
                        "Checker",
                        Collections.<ParameterNode>emptyList(),
                        name(2, "NoReturn"),
                        Collections.<Node>singletonList(raise(3)));
        ExpressionStatementNode qualifiedCall =
                new ExpressionStatementNode(
                        at(5),
                        new CallNode(
                                Location.of(5, 4),
                                attribute(5, name(5, "Checker"), "fail"),
                                Collections.<Node>emptyList()));

        FunctionDefinitionNode bare =
                def(1, "bare", method, assign(4, "x", 1), expression(5, "fail"), use(6, "x"));
        FunctionDefinitionNode qualified =
                def(1, "qualified", method, assign(4, "x", 1), qualifiedCall, use(6, "x"));

        assertThat(check(bare)).isEmpty();
        assertThat(check(qualified)).containsExactly("x@4:0");
    }

    @Test
    public void moduleTopLevelIsAnalyzed() {
        List<DeadStore> deadStores =
                checker.checkModule(
                        statements(
                                annotatedDef(1, "die", name(1, "NoReturn"), raise(2)),
                                assign(3, "x", 1),
                                expression(4, "die"),
                                use(5, "x"),
                                assign(6, "y", 2)));

        assertThat(render(deadStores)).containsExactly("x@3:0", "y@6:0").inOrder();
        assertThat(deadStores.get(0).getDefine().getName())
                .isEqualTo(FunctionDefinitionNode.TOPLEVEL_NAME);
    }

    @Test
    public void analysisIsDeterministic() {
        FunctionDefinitionNode f =
                def(
                        1,
                        "f",
                        params(param(1, 6, "a"), param(1, 9, "b")),
                        assign(2, "x", 1),
                        assign(3, "x", 2),
                        assign(4, tuple(4, name(4, "p"), name(4, "q")), name(4, "b")));

        List<DeadStore> first = checker.check(f);
        List<DeadStore> second = checker.check(f);

        assertThat(second).containsExactlyElementsIn(first).inOrder();
        assertThat(render(first))
                .containsExactly("a@1:6", "x@2:0", "x@3:0", "p@4:0", "q@4:0")
                .inOrder();
    }

    @Test
    public void functionsCanBeCheckedInParallel() throws InterruptedException {
        FunctionDefinitionNode f = def(1, "f", assign(2, "x", 1));
        FunctionDefinitionNode g = def(10, "g", params(param(10, 6, "unused")), pass(11));
        FunctionDefinitionNode h = def(20, "h", assign(21, "y", 1), ret(22, "y"));

        List<DeadStore> sequential = new ArrayList<>();
        for (FunctionDefinitionNode function : Arrays.asList(f, g, h)) {
            sequential.addAll(checker.check(function));
        }
        Collections.sort(sequential);

        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            List<DeadStore> parallel = checker.checkAll(Arrays.asList(h, g, f), executor);
            assertThat(parallel).containsExactlyElementsIn(sequential).inOrder();
            assertThat(render(parallel)).containsExactly("x@2:0", "unused@10:6").inOrder();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void malformedInputIsReported() {
        FunctionDefinitionNode f = def(1, "f", name(2, "x"));
        assertThrows(UserError.class, () -> checker.check(f));
    }

    @Test
    public void parallelFailuresArePropagated() {
        FunctionDefinitionNode f = def(1, "f", name(2, "x"));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            assertThrows(
                    UserError.class,
                    () -> checker.checkAll(Collections.singletonList(f), executor));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void findingsCarryTheirLocation() {
        List<DeadStore> deadStores = checker.check(def(1, "f", assign(7, "x", 1)));
        assertThat(deadStores.get(0).getLocation()).isEqualTo(at(7));
        assertThat(deadStores.get(0).getDescription())
                .isEqualTo("Value assigned to `x` is never used.");
    }
}
