package org.deadstore.dataflow.analysis;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * This interface defines a backward analysis, given a control flow graph and a backward transfer
 * function.
 *
 * @param <S> The store type used in the analysis
 * @param <T> The backward transfer function type that is used to approximated runtime behavior
 */
public interface BackwardAnalysis<S extends Store<S>, T extends BackwardTransferFunction<S>>
        extends Analysis<S, T> {

    /**
     * Get the output store at the entry block of a given CFG. For a backward analysis, the output
     * store contain the analyzed flow information from exit block to entry block.
     *
     * @return the output store at the entry block of a given CFG
     */
    @Nullable S getEntryStore();
}
