package org.deadstore.dataflow.livevariable;

import java.util.List;
import org.checkerframework.javacutil.BugInCF;
import org.deadstore.dataflow.analysis.BackwardTransferFunction;
import org.deadstore.dataflow.analysis.RegularTransferResult;
import org.deadstore.dataflow.analysis.TransferInput;
import org.deadstore.dataflow.analysis.TransferResult;
import org.deadstore.dataflow.cfg.node.AbstractNodeVisitor;
import org.deadstore.dataflow.cfg.node.AssertNode;
import org.deadstore.dataflow.cfg.node.AssignmentNode;
import org.deadstore.dataflow.cfg.node.ExpressionStatementNode;
import org.deadstore.dataflow.cfg.node.FunctionDefinitionNode;
import org.deadstore.dataflow.cfg.node.Node;
import org.deadstore.dataflow.cfg.node.PassNode;
import org.deadstore.dataflow.cfg.node.RaiseNode;
import org.deadstore.dataflow.cfg.node.ReturnNode;

/**
 * The backward transfer function of the dead store analysis. It computes the live identifiers
 * and reports assignments to identifiers that are not live after the assignment.
 */
public class BackwardLivenessTransfer
        extends AbstractNodeVisitor<TransferResult<LivenessStore>, TransferInput<LivenessStore>>
        implements BackwardTransferFunction<LivenessStore> {

    /** The store at the exit, as computed by the forward analysis. */
    private final LivenessStore exitStore;

    /** Where assignments to dead identifiers are reported. */
    private final DiagnosticTable diagnostics;

    /**
     * @param exitStore the store reaching the exit in the forward analysis; the backward analysis
     *     starts from a copy of it
     * @param diagnostics where assignments to dead identifiers are reported
     */
    public BackwardLivenessTransfer(LivenessStore exitStore, DiagnosticTable diagnostics) {
        this.exitStore = exitStore;
        this.diagnostics = diagnostics;
    }

    @Override
    public LivenessStore initialNormalExitStore(
            FunctionDefinitionNode underlyingAST, List<ReturnNode> returnNodes) {
        return exitStore.copy();
    }

    /** Only simple statements appear in blocks. */
    @Override
    public TransferResult<LivenessStore> visitNode(Node n, TransferInput<LivenessStore> in) {
        throw new BugInCF("BackwardLivenessTransfer: %s at %s is not a simple statement",
                n.getClass().getSimpleName(), n.getLocation());
    }

    /** Statements other than assignments only add the identifiers they read. */
    private TransferResult<LivenessStore> addReads(Node n, TransferInput<LivenessStore> in) {
        LivenessStore store = in.getRegularStore();
        store.addUsed(AssignmentTargets.readIdentifiers(n));
        return new RegularTransferResult<>(store);
    }

    @Override
    public TransferResult<LivenessStore> visitAssignment(
            AssignmentNode n, TransferInput<LivenessStore> in) {
        LivenessStore store = in.getRegularStore();
        AssignmentTargets.forEachAssignedName(
                n.getTarget(),
                name -> {
                    String identifier = name.getIdentifier();
                    if (store.isUsed(identifier)) {
                        store.killUsed(identifier);
                    } else {
                        diagnostics.put(
                                new DeadStore(n.getLocation(), identifier, store.getDefine()));
                    }
                });
        store.addUsed(AssignmentTargets.readIdentifiers(n));
        return new RegularTransferResult<>(store);
    }

    @Override
    public TransferResult<LivenessStore> visitAssert(AssertNode n, TransferInput<LivenessStore> in) {
        return addReads(n, in);
    }

    @Override
    public TransferResult<LivenessStore> visitReturn(ReturnNode n, TransferInput<LivenessStore> in) {
        return addReads(n, in);
    }

    @Override
    public TransferResult<LivenessStore> visitRaise(RaiseNode n, TransferInput<LivenessStore> in) {
        return addReads(n, in);
    }

    @Override
    public TransferResult<LivenessStore> visitExpressionStatement(
            ExpressionStatementNode n, TransferInput<LivenessStore> in) {
        return addReads(n, in);
    }

    @Override
    public TransferResult<LivenessStore> visitPass(PassNode n, TransferInput<LivenessStore> in) {
        return new RegularTransferResult<>(in.getRegularStore());
    }

    @Override
    public TransferResult<LivenessStore> visitFunctionDefinition(
            FunctionDefinitionNode n, TransferInput<LivenessStore> in) {
        return addReads(n, in);
    }
}
