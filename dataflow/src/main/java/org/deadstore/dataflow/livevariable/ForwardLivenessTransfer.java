package org.deadstore.dataflow.livevariable;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.javacutil.BugInCF;
import org.deadstore.dataflow.analysis.ForwardTransferFunction;
import org.deadstore.dataflow.analysis.RegularTransferResult;
import org.deadstore.dataflow.analysis.TransferInput;
import org.deadstore.dataflow.analysis.TransferResult;
import org.deadstore.dataflow.cfg.block.Block;
import org.deadstore.dataflow.cfg.node.AbstractNodeVisitor;
import org.deadstore.dataflow.cfg.node.AssertNode;
import org.deadstore.dataflow.cfg.node.AssignmentNode;
import org.deadstore.dataflow.cfg.node.ExpressionStatementNode;
import org.deadstore.dataflow.cfg.node.FunctionDefinitionNode;
import org.deadstore.dataflow.cfg.node.Node;
import org.deadstore.dataflow.cfg.node.ParameterNode;
import org.deadstore.dataflow.cfg.node.PassNode;
import org.deadstore.dataflow.cfg.node.RaiseNode;
import org.deadstore.dataflow.cfg.node.ReturnNode;
import org.deadstore.dataflow.resolution.NeverTypeOracle;
import org.deadstore.dataflow.resolution.ResolutionContext;

/**
 * The forward transfer function of the dead store analysis. It tracks pending stores, reports
 * stores that are overwritten before being read, finds the points control cannot pass, and
 * records nested function definitions.
 *
 * <p>For each statement, in order:
 *
 * <ol>
 *   <li>the pending stores of the identifiers the statement reads are removed;
 *   <li>an assignment makes each assigned name pending at the statement, reporting the name's
 *       previous pending stores;
 *   <li>{@code return}, {@code assert False} and an expression of type {@code NoReturn} make the
 *       store unreachable;
 *   <li>a nested function definition is recorded with the store after step 2.
 * </ol>
 *
 * Once the store is unreachable, steps 1 and 2 are skipped.
 */
public class ForwardLivenessTransfer
        extends AbstractNodeVisitor<TransferResult<LivenessStore>, TransferInput<LivenessStore>>
        implements ForwardTransferFunction<LivenessStore> {

    /** The store of the enclosing function at the definition of the analyzed one. */
    private final @Nullable LivenessStore enclosing;

    private final NeverTypeOracle oracle;

    /** The context of the analyzed function, or {@code null} to derive one without declarations. */
    private final @Nullable ResolutionContext scope;

    /** Where overwritten stores are reported. */
    private final DiagnosticTable diagnostics;

    /**
     * Create a transfer function that resolves expressions with nothing declared in scope.
     *
     * @param enclosing the store of the enclosing function at the definition of the analyzed
     *     function, or {@code null} for a top-level function
     * @param oracle decides which expressions never return
     * @param diagnostics where overwritten stores are reported
     */
    public ForwardLivenessTransfer(
            @Nullable LivenessStore enclosing,
            NeverTypeOracle oracle,
            DiagnosticTable diagnostics) {
        this(enclosing, oracle, null, diagnostics);
    }

    /**
     * @param enclosing the store of the enclosing function at the definition of the analyzed
     *     function, or {@code null} for a top-level function
     * @param oracle decides which expressions never return
     * @param scope the flow-insensitive context of the analyzed function, or {@code null}
     * @param diagnostics where overwritten stores are reported
     */
    public ForwardLivenessTransfer(
            @Nullable LivenessStore enclosing,
            NeverTypeOracle oracle,
            @Nullable ResolutionContext scope,
            DiagnosticTable diagnostics) {
        this.enclosing = enclosing;
        this.oracle = oracle;
        this.scope = scope;
        this.diagnostics = diagnostics;
    }

    @Override
    public LivenessStore initialStore(
            FunctionDefinitionNode underlyingAST, List<ParameterNode> parameters) {
        return LivenessStore.initial(enclosing, underlyingAST);
    }

    /** Only simple statements appear in blocks. */
    @Override
    public TransferResult<LivenessStore> visitNode(Node n, TransferInput<LivenessStore> in) {
        throw new BugInCF("ForwardLivenessTransfer: %s at %s is not a simple statement",
                n.getClass().getSimpleName(), n.getLocation());
    }

    /** Remove the pending stores of the identifiers {@code n} reads. */
    private static void consumeReads(Node n, LivenessStore store) {
        if (!store.isBottom()) {
            store.consumeReads(AssignmentTargets.readIdentifiers(n));
        }
    }

    @Override
    public TransferResult<LivenessStore> visitAssignment(
            AssignmentNode n, TransferInput<LivenessStore> in) {
        LivenessStore store = in.getRegularStore();
        if (!store.isBottom()) {
            store.consumeReads(AssignmentTargets.readIdentifiers(n));
            AssignmentTargets.forEachAssignedName(
                    n.getTarget(),
                    name -> store.updateUnused(name.getIdentifier(), n.getLocation(), diagnostics));
        }
        return new RegularTransferResult<>(store);
    }

    @Override
    public TransferResult<LivenessStore> visitAssert(AssertNode n, TransferInput<LivenessStore> in) {
        LivenessStore store = in.getRegularStore();
        consumeReads(n, store);
        if (n.isAssertFalse()) {
            store.markBottom();
        }
        return new RegularTransferResult<>(store);
    }

    @Override
    public TransferResult<LivenessStore> visitReturn(ReturnNode n, TransferInput<LivenessStore> in) {
        LivenessStore store = in.getRegularStore();
        consumeReads(n, store);
        store.markBottom();
        return new RegularTransferResult<>(store);
    }

    @Override
    public TransferResult<LivenessStore> visitRaise(RaiseNode n, TransferInput<LivenessStore> in) {
        LivenessStore store = in.getRegularStore();
        consumeReads(n, store);
        return new RegularTransferResult<>(store);
    }

    @Override
    public TransferResult<LivenessStore> visitExpressionStatement(
            ExpressionStatementNode n, TransferInput<LivenessStore> in) {
        LivenessStore store = in.getRegularStore();
        consumeReads(n, store);
        if (oracle.isNoReturn(n.getExpression(), resolutionContext(n, store))) {
            store.markBottom();
        }
        return new RegularTransferResult<>(store);
    }

    @Override
    public TransferResult<LivenessStore> visitPass(PassNode n, TransferInput<LivenessStore> in) {
        return new RegularTransferResult<>(in.getRegularStore());
    }

    @Override
    public TransferResult<LivenessStore> visitFunctionDefinition(
            FunctionDefinitionNode n, TransferInput<LivenessStore> in) {
        LivenessStore store = in.getRegularStore();
        consumeReads(n, store);
        store.putNestedDefine(n.getLocation(), new NestedDefine(n, store.copy()));
        return new RegularTransferResult<>(store);
    }

    /** The context {@code n} is resolved in: the analyzed function, keyed by the block of {@code n}. */
    private ResolutionContext resolutionContext(Node n, LivenessStore store) {
        ResolutionContext base =
                scope == null ? ResolutionContext.of(store.getDefine(), null) : scope;
        Block block = n.getBlock();
        return base.withKey(block == null ? null : block.getId());
    }
}
