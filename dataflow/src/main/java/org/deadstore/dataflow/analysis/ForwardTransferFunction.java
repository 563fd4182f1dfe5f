package org.deadstore.dataflow.analysis;

import java.util.List;
import org.deadstore.dataflow.cfg.node.FunctionDefinitionNode;
import org.deadstore.dataflow.cfg.node.ParameterNode;

/**
 * General interface of a forward transfer function for the abstract interpretation used for the
 * forward flow analysis.
 *
 * <p>A forward transfer function consists of the following components:
 *
 * <ul>
 *   <li>A method {@code initialStore} that determines which initial store should be used in the
 *       dataflow forward analysis.
 *   <li>A function for every statement type that determines the behavior of the dataflow analysis
 *       in that case.
 * </ul>
 *
 * @param <S> the store type used in the analysis
 */
public interface ForwardTransferFunction<S extends Store<S>> extends TransferFunction<S> {

    /**
     * Return the initial store to be used by the dataflow analysis.
     *
     * @param underlyingAST the function being analyzed
     * @param parameters the formal parameters of the function
     * @return the initial store
     */
    S initialStore(FunctionDefinitionNode underlyingAST, List<ParameterNode> parameters);
}
