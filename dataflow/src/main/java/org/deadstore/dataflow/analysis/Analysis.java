package org.deadstore.dataflow.analysis;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.deadstore.dataflow.cfg.ControlFlowGraph;
import org.deadstore.dataflow.cfg.block.Block;

/**
 * General Dataflow Analysis Interface. This interface defines general behaviors of a data-flow
 * analysis, given a control flow graph and a transfer function. A data-flow analysis should only
 * has one direction, either forward or backward. The direction of corresponding transfer function
 * should be consistent with the analysis, i.e. a forward analysis should be given a forward
 * transfer function, and a backward analysis should be given a backward transfer function.
 *
 * @param <S> the store type used in the analysis
 * @param <T> the transfer function type that is used to approximated runtime behavior
 */
public interface Analysis<S extends Store<S>, T extends TransferFunction<S>> {

    /**
     * The direction of an analysis instance. An analysis could either be a forward analysis with
     * FORWARD direction, or a backward analysis with BACKWARD direction.
     */
    enum Direction {
        /** The forward direction. */
        FORWARD,
        /** The backward direction. */
        BACKWARD
    }

    /**
     * Get the direction of this analysis.
     *
     * @return the direction of this analysis
     */
    Direction getDirection();

    /**
     * Get the status of the analysis that whether it is currently running.
     *
     * @return true if the analysis is running currently
     */
    boolean isRunning();

    /**
     * Perform the actual analysis, iterating the transfer function over {@code cfg} until no
     * block's input store changes any more.
     *
     * @param cfg the control flow graph
     */
    void performAnalysis(ControlFlowGraph cfg);

    /**
     * Run {@code transfer} once more over every analyzed block of the last graph, starting each
     * block from its converged input store. Blocks that were never reached are skipped.
     *
     * <p>Useful for transfer functions with side effects that should only observe converged
     * stores.
     *
     * @param transfer the transfer function to replay
     */
    void replay(T transfer);

    /**
     * The result of running the analysis. This is only available once the analysis finished
     * running.
     *
     * @return the result of running the analysis
     */
    AnalysisResult<S> getResult();

    /**
     * Get the transfer function of this analysis.
     *
     * @return the transfer function of this analysis
     */
    T getTransferFunction();

    /**
     * Get the transfer input of a given {@link Block} b.
     *
     * @param b a given Block
     * @return the transfer input of this Block, or {@code null} if it was never reached
     */
    @Nullable TransferInput<S> getInput(Block b);

    /**
     * Get the regular exit store of this analysis.
     *
     * @return the regular exit store, or {@code null} if there is no such store (because the
     *     function cannot exit through the regular exit block)
     */
    @Nullable S getRegularExitStore();
}
