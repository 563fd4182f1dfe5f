package org.deadstore.dataflow.analysis;

import java.util.List;
import java.util.ListIterator;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.javacutil.BugInCF;
import org.deadstore.dataflow.cfg.ControlFlowGraph;
import org.deadstore.dataflow.cfg.block.Block;
import org.deadstore.dataflow.cfg.block.SpecialBlock;
import org.deadstore.dataflow.cfg.block.SpecialBlock.SpecialBlockType;
import org.deadstore.dataflow.cfg.node.Node;

/**
 * An implementation of a backward analysis to solve a dataflow problem given a control flow graph
 * and a transfer function.
 *
 * <p>The input of a block is the store after its last statement. The regular exit block is seeded
 * with {@link BackwardTransferFunction#initialNormalExitStore}; statements are visited in reverse
 * and the result flows to every predecessor.
 *
 * @param <S> The store type used in the analysis
 * @param <T> The transfer function type that is used to approximated runtime behavior
 */
public class BackwardAnalysisImpl<S extends Store<S>, T extends BackwardTransferFunction<S>>
        extends AbstractAnalysis<S, T> implements BackwardAnalysis<S, T> {

    /** The store before the entry block. */
    protected @Nullable S storeAtEntry;

    /**
     * Construct an object that can perform a dataflow backward analysis over a control flow graph
     * given a transfer function, with the default iteration limits.
     *
     * @param transfer the transfer function
     */
    public BackwardAnalysisImpl(T transfer) {
        this(transfer, DEFAULT_MAX_COUNT_BEFORE_WIDENING, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Construct an object that can perform a dataflow backward analysis over a control flow graph
     * given a transfer function.
     *
     * @param transfer the transfer function
     * @param maxCountBeforeWidening input changes of a block before widening is used
     * @param maxIterations input changes of a block before the analysis gives up
     */
    public BackwardAnalysisImpl(T transfer, int maxCountBeforeWidening, int maxIterations) {
        super(Direction.BACKWARD, transfer, maxCountBeforeWidening, maxIterations);
    }

    @Override
    protected void performAnalysisBlock(Block block) {
        TransferInput<S> inputAfter = getInput(block);
        if (inputAfter == null) {
            throw new BugInCF(
                    "BackwardAnalysisImpl: %s is on the worklist without an input", block);
        }
        switch (block.getType()) {
            case REGULAR_BLOCK:
                {
                    TransferInput<S> currentInput = inputAfter.copy();
                    Node firstNode = null;
                    List<Node> nodeList = block.getNodes();
                    ListIterator<Node> reverseIter = nodeList.listIterator(nodeList.size());
                    while (reverseIter.hasPrevious()) {
                        Node node = reverseIter.previous();
                        TransferResult<S> transferResult =
                                callTransferFunction(node, currentInput);
                        currentInput = new TransferInput<>(node, transferResult.getRegularStore());
                        firstNode = node;
                    }
                    propagateStoresTo(block, firstNode, currentInput.getRegularStore());
                    break;
                }

            case CONDITIONAL_BLOCK:
                propagateStoresTo(block, null, inputAfter.getRegularStore());
                break;

            case SPECIAL_BLOCK:
                {
                    // Special basic blocks are empty, thus there is no need to perform any
                    // analysis.
                    SpecialBlock sBlock = (SpecialBlock) block;
                    if (sBlock.getSpecialType() == SpecialBlockType.ENTRY) {
                        storeAtEntry = inputAfter.getRegularStore();
                    } else {
                        propagateStoresTo(block, null, inputAfter.getRegularStore());
                    }
                    break;
                }

            default:
                throw new BugInCF(
                        "BackwardAnalysisImpl::performAnalysis() unexpected block type: "
                                + block.getType());
        }
    }

    /** Merge {@code store} into the output of every reached predecessor of {@code block}. */
    private void propagateStoresTo(Block block, @Nullable Node node, S store) {
        for (Block pred : block.getPredecessors()) {
            if (!worklist.isReachable(pred)) {
                continue;
            }
            // Inputs are never shared between blocks.
            if (updateInput(pred, node, store.copy())) {
                addToWorklist(pred);
            }
        }
    }

    @Override
    public @Nullable S getEntryStore() {
        return storeAtEntry;
    }

    @Override
    protected void initFields(ControlFlowGraph cfg) {
        super.initFields(cfg);
        // storeAtEntry is null before analysis begin
        storeAtEntry = null;
    }

    @Override
    protected void initInitialInputs() {
        SpecialBlock regularExitBlock = cfg.getRegularExitBlock();
        if (!worklist.isReachable(regularExitBlock)) {
            throw new BugInCF(
                    "BackwardAnalysisImpl::initInitialInputs() the regular exit block of %s is unreachable",
                    cfg.getUnderlyingAST().getQualifiedName());
        }
        S normalInitialStore =
                transferFunction.initialNormalExitStore(
                        cfg.getUnderlyingAST(), cfg.getReturnNodes());
        inputs.put(regularExitBlock, new TransferInput<>(null, normalInitialStore));
        updateCounts.put(regularExitBlock, 1);
        addToWorklist(regularExitBlock);
    }
}
