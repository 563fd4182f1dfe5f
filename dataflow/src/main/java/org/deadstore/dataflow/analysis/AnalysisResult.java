package org.deadstore.dataflow.analysis;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.deadstore.dataflow.cfg.ControlFlowGraph;
import org.deadstore.dataflow.cfg.block.Block;

/**
 * An {@link AnalysisResult} represents the result of a dataflow analysis by providing the
 * converged input store of every block the analysis reached.
 *
 * <p>For a forward analysis the input of a block is the store before its first statement; for a
 * backward analysis it is the store after its last statement.
 *
 * @param <S> type of the store
 */
public class AnalysisResult<S extends Store<S>> {

    /** The graph that was analyzed. */
    protected final ControlFlowGraph cfg;

    /** The converged inputs of the reached blocks. */
    protected final IdentityHashMap<Block, TransferInput<S>> stores;

    /**
     * Initialize with given mappings.
     *
     * @param cfg the graph that was analyzed
     * @param stores a map from blocks to transfer inputs
     */
    public AnalysisResult(ControlFlowGraph cfg, Map<Block, TransferInput<S>> stores) {
        this.cfg = cfg;
        this.stores = new IdentityHashMap<>(stores);
    }

    /**
     * Return the converged input of block {@code b}.
     *
     * @param b a block of the analyzed graph
     * @return the transfer input of {@code b}, or {@code null} if the analysis never reached it
     */
    public @Nullable TransferInput<S> getInput(Block b) {
        return stores.get(b);
    }

    /**
     * Return the converged input stores of all reached blocks, in the depth-first order of the
     * graph.
     *
     * @return the stores of the reached blocks
     */
    public List<S> getStores() {
        List<S> result = new ArrayList<>(stores.size());
        for (Block b : cfg.getDepthFirstOrderedBlocks()) {
            TransferInput<S> input = stores.get(b);
            if (input != null) {
                result.add(input.getRegularStore());
            }
        }
        return result;
    }
}
