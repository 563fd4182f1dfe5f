package org.deadstore.dataflow.analysis;

/**
 * General dataflow forward analysis interface. This sub-interface of {@link Analysis} defines the
 * general behaviors of a forward analysis, given a control flow graph and a forward transfer
 * function.
 *
 * @param <S> the store type used in the analysis
 * @param <T> the forward transfer function type that is used to approximated runtime behavior
 */
public interface ForwardAnalysis<S extends Store<S>, T extends ForwardTransferFunction<S>>
        extends Analysis<S, T> {}
