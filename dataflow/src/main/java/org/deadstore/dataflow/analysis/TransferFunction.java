package org.deadstore.dataflow.analysis;

import org.deadstore.dataflow.cfg.node.NodeVisitor;

/**
 * Interface of a transfer function for the abstract interpretation used for the flow analysis.
 *
 * <p>A transfer function consists of the following components:
 *
 * <ul>
 *   <li>Initial store method(s) that determines which initial store should be used in the
 *       dataflow analysis.
 *   <li>A function for every statement type that determines the behavior of the dataflow analysis
 *       in that case. This method takes a statement and an incoming store, and produces a {@link
 *       RegularTransferResult}.
 * </ul>
 *
 * <p><em>Note</em>: Initial store method(s) is different between forward and backward transfer
 * function. Thus, in this general interface it doesn't define any initial store method(s), and
 * leave this to sub-interface {@link ForwardTransferFunction} and {@link BackwardTransferFunction}.
 *
 * <p><em>Important</em>: The individual transfer functions ( {@code visit*}) are allowed to use
 * (and modify) the stores contained in the argument passed; the ownership is transferred from the
 * caller to that function.
 *
 * @param <S> the {@link Store} used to keep track of intermediate results
 */
public interface TransferFunction<S extends Store<S>>
        extends NodeVisitor<TransferResult<S>, TransferInput<S>> {}
