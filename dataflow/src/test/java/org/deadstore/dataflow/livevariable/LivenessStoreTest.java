package org.deadstore.dataflow.livevariable;

import static com.google.common.truth.Truth.assertThat;
import static org.deadstore.dataflow.cfg.node.Syntax.def;
import static org.deadstore.dataflow.cfg.node.Syntax.param;
import static org.deadstore.dataflow.cfg.node.Syntax.params;
import static org.deadstore.dataflow.cfg.node.Syntax.pass;
import static org.junit.Assert.assertThrows;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.checkerframework.javacutil.BugInCF;
import org.deadstore.dataflow.cfg.node.FunctionDefinitionNode;
import org.deadstore.dataflow.cfg.node.Location;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LivenessStoreTest {

    private final FunctionDefinitionNode f =
            def(1, "f", params(param(1, 6, "a"), param(1, 9, "b")), pass(2));

    private final FunctionDefinitionNode inner = def(3, "inner", pass(4));

    private static final Location L2 = Location.of(2, 0);
    private static final Location L3 = Location.of(3, 0);

    private LivenessStore store(String pendingName, Location location, String... live) {
        LivenessStore store = new LivenessStore(f);
        store.updateUnused(pendingName, location, new DiagnosticTable());
        store.addUsed(Arrays.asList(live));
        return store;
    }

    /** A sample of reachable stores, with and without each component. */
    private List<LivenessStore> samples() {
        LivenessStore bottom = store("x", L2, "y");
        bottom.markBottom();
        LivenessStore nested = store("z", L3);
        nested.putNestedDefine(L3, new NestedDefine(inner, nested.copy()));
        return Arrays.asList(
                new LivenessStore(f),
                LivenessStore.initial(null, f),
                store("x", L2),
                store("x", L3, "x", "y"),
                bottom,
                nested);
    }

    @Test
    public void initialStoreMakesParametersPending() {
        LivenessStore initial = LivenessStore.initial(null, f);

        assertThat(initial.getUnused().keySet()).containsExactly("a", "b");
        assertThat(initial.getUnused().get("a")).containsExactly(Location.of(1, 6));
        assertThat(initial.getUsed()).isEmpty();
        assertThat(initial.isBottom()).isFalse();
        assertThat(initial.getNestedDefines()).isEmpty();
        assertThat(initial.getDefine()).isSameInstanceAs(f);
    }

    @Test
    public void enclosingStoreDoesNotChangeTheInitialStore() {
        LivenessStore enclosing = store("q", L2, "q");
        assertThat(LivenessStore.initial(enclosing, f)).isEqualTo(LivenessStore.initial(null, f));
    }

    @Test
    public void overwritingReportsThePreviousStores() {
        DiagnosticTable diagnostics = new DiagnosticTable();
        LivenessStore store = new LivenessStore(f);
        store.updateUnused("x", L2, diagnostics);
        assertThat(diagnostics.isEmpty()).isTrue();

        store.updateUnused("x", L3, diagnostics);
        assertThat(store.getUnused().get("x")).containsExactly(L3);
        assertThat(diagnostics.sortedDiagnostics())
                .containsExactly(new DeadStore(L2, "x", f));
    }

    @Test
    public void overwritingWithoutATableIsABug() {
        LivenessStore store = new LivenessStore(f);
        store.updateUnused("x", L2, null);
        assertThrows(BugInCF.class, () -> store.updateUnused("x", L3, null));
    }

    @Test
    public void readsConsumePendingStores() {
        LivenessStore store = store("x", L2);
        store.consumeReads(Collections.singleton("x"));
        assertThat(store.getUnused()).isEmpty();
    }

    @Test
    public void joinUnitesPendingLocationsAndLiveNames() {
        LivenessStore left = store("x", L2, "a");
        LivenessStore right = store("x", L3, "b");
        right.updateUnused("y", L3, new DiagnosticTable());

        LivenessStore lub = left.leastUpperBound(right);

        assertThat(lub.getUnused().get("x")).containsExactly(L2, L3);
        assertThat(lub.getUnused().get("y")).containsExactly(L3);
        assertThat(lub.getUsed()).containsExactly("a", "b");
        // Arguments are unchanged.
        assertThat(left.getUnused().get("x")).containsExactly(L2);
        assertThat(right.getUsed()).containsExactly("b");
    }

    @Test
    public void joinIsUnreachableOnlyIfBothAre() {
        LivenessStore reachable = new LivenessStore(f);
        LivenessStore unreachable = new LivenessStore(f);
        unreachable.markBottom();

        assertThat(reachable.leastUpperBound(unreachable).isBottom()).isFalse();
        assertThat(unreachable.leastUpperBound(unreachable.copy()).isBottom()).isTrue();
    }

    @Test
    public void joinKeepsNestedDefinitionsOfBothSides() {
        LivenessStore left = new LivenessStore(f);
        LivenessStore right = new LivenessStore(f);
        FunctionDefinitionNode other = def(5, "other", pass(6));
        left.putNestedDefine(L3, new NestedDefine(inner, left.copy()));
        right.putNestedDefine(Location.of(5, 0), new NestedDefine(other, right.copy()));

        assertThat(left.leastUpperBound(right).getNestedDefines().keySet())
                .containsExactly(L3, Location.of(5, 0));
    }

    @Test
    public void joinIsAnUpperBound() {
        for (LivenessStore a : samples()) {
            for (LivenessStore b : samples()) {
                LivenessStore lub = a.leastUpperBound(b);
                assertThat(a.lessOrEqual(lub)).isTrue();
                assertThat(b.lessOrEqual(lub)).isTrue();
                assertThat(a.widenedUpperBound(b)).isEqualTo(b.leastUpperBound(a));
            }
        }
    }

    @Test
    public void lessOrEqualIsReflexive() {
        for (LivenessStore a : samples()) {
            assertThat(a.lessOrEqual(a.copy())).isTrue();
        }
    }

    @Test
    public void lessOrEqualComparesEveryComponent() {
        LivenessStore empty = new LivenessStore(f);
        assertThat(store("x", L2).lessOrEqual(empty)).isFalse();
        assertThat(store("x", L2).lessOrEqual(store("x", L3))).isFalse();
        assertThat(store("x", L2, "y").lessOrEqual(store("x", L2))).isFalse();

        LivenessStore unreachable = new LivenessStore(f);
        unreachable.markBottom();
        assertThat(empty.lessOrEqual(unreachable)).isFalse();
        assertThat(unreachable.lessOrEqual(empty)).isTrue();

        LivenessStore nested = new LivenessStore(f);
        nested.putNestedDefine(L3, new NestedDefine(inner, empty));
        assertThat(nested.lessOrEqual(empty)).isFalse();
        assertThat(empty.lessOrEqual(nested)).isTrue();
    }

    @Test
    public void copiesAreIndependent() {
        LivenessStore original = store("x", L2, "y");
        LivenessStore copy = original.copy();
        copy.updateUnused("z", L3, new DiagnosticTable());
        copy.killUsed("y");
        copy.markBottom();

        assertThat(copy).isNotEqualTo(original);
        assertThat(original.getUnused().keySet()).containsExactly("x");
        assertThat(original.isUsed("y")).isTrue();
        assertThat(original.isBottom()).isFalse();
    }

    @Test
    public void joinOrderOnlyDecidesWhichCapturedStoreIsKept() {
        LivenessStore left = store("x", L2);
        left.putNestedDefine(L3, new NestedDefine(inner, store("x", L2)));
        LivenessStore right = store("y", L2, "y");
        right.putNestedDefine(L3, new NestedDefine(inner, store("y", L2)));

        LivenessStore leftFirst = left.leastUpperBound(right);
        LivenessStore rightFirst = right.leastUpperBound(left);

        assertThat(leftFirst.lessOrEqual(rightFirst)).isTrue();
        assertThat(rightFirst.lessOrEqual(leftFirst)).isTrue();
        assertThat(leftFirst.getNestedDefines().get(L3).getState().getUnused().keySet())
                .containsExactly("x");
        assertThat(rightFirst.getNestedDefines().get(L3).getState().getUnused().keySet())
                .containsExactly("y");
    }
}
