package org.deadstore.dataflow.analysis;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.javacutil.BugInCF;
import org.deadstore.dataflow.cfg.block.Block;
import org.deadstore.dataflow.cfg.block.SpecialBlock;
import org.deadstore.dataflow.cfg.node.FunctionDefinitionNode;
import org.deadstore.dataflow.cfg.node.Node;

/**
 * An implementation of a forward analysis to solve a dataflow problem given a control flow graph
 * and a forward transfer function.
 *
 * <p>The input of a block is the store before its first statement. The entry block is seeded
 * with {@link ForwardTransferFunction#initialStore}; every other block's input is the join of
 * the outputs of its reached predecessors.
 *
 * @param <S> the store type used in the analysis
 * @param <T> the transfer function type that is used to approximate runtime behavior
 */
public class ForwardAnalysisImpl<S extends Store<S>, T extends ForwardTransferFunction<S>>
        extends AbstractAnalysis<S, T> implements ForwardAnalysis<S, T> {

    /**
     * Construct an object that can perform a dataflow forward analysis over a control flow graph,
     * with the default iteration limits.
     *
     * @param transfer the transfer function
     */
    public ForwardAnalysisImpl(T transfer) {
        this(transfer, DEFAULT_MAX_COUNT_BEFORE_WIDENING, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Construct an object that can perform a dataflow forward analysis over a control flow graph.
     *
     * @param transfer the transfer function
     * @param maxCountBeforeWidening input changes of a block before widening is used
     * @param maxIterations input changes of a block before the analysis gives up
     */
    public ForwardAnalysisImpl(T transfer, int maxCountBeforeWidening, int maxIterations) {
        super(Direction.FORWARD, transfer, maxCountBeforeWidening, maxIterations);
    }

    @Override
    protected void initInitialInputs() {
        SpecialBlock entry = cfg.getEntryBlock();
        FunctionDefinitionNode function = cfg.getUnderlyingAST();
        S initial = transferFunction.initialStore(function, function.getParameters());
        inputs.put(entry, new TransferInput<>(null, initial));
        updateCounts.put(entry, 1);
        addToWorklist(entry);
    }

    @Override
    protected void performAnalysisBlock(Block b) {
        TransferInput<S> input = getInput(b);
        if (input == null) {
            throw new BugInCF("ForwardAnalysisImpl: %s is on the worklist without an input", b);
        }
        switch (b.getType()) {
            case REGULAR_BLOCK:
                {
                    TransferInput<S> current = input.copy();
                    Node lastNode = null;
                    for (Node n : b.getNodes()) {
                        TransferResult<S> result = callTransferFunction(n, current);
                        current = new TransferInput<>(n, result.getRegularStore());
                        lastNode = n;
                    }
                    propagateStoresTo(b, lastNode, current.getRegularStore());
                    break;
                }
            case CONDITIONAL_BLOCK:
            case SPECIAL_BLOCK:
                // Neither holds statements; the exit block has no successors.
                propagateStoresTo(b, null, input.getRegularStore());
                break;
            default:
                throw new BugInCF(
                        "ForwardAnalysisImpl::performAnalysis() unexpected block type: "
                                + b.getType());
        }
    }

    /** Merge {@code store} into every successor of {@code b}. */
    private void propagateStoresTo(Block b, @Nullable Node node, S store) {
        for (Block succ : b.getSuccessors()) {
            // Inputs are never shared between blocks.
            if (updateInput(succ, node, store.copy())) {
                addToWorklist(succ);
            }
        }
    }
}
