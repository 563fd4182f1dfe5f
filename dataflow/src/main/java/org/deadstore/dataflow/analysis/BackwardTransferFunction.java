package org.deadstore.dataflow.analysis;

import java.util.List;
import org.deadstore.dataflow.cfg.node.FunctionDefinitionNode;
import org.deadstore.dataflow.cfg.node.ReturnNode;

/**
 * General interface of a backward transfer function for the abstract interpretation used for the
 * backward flow analysis.
 *
 * <p>A backward transfer function consists of the following components:
 *
 * <ul>
 *   <li>A method {@code initialNormalExitStore} that determines which initial store should be used
 *       at the regular exit block in the dataflow backward analysis.
 *   <li>A function for every statement type that determines the behavior of the dataflow analysis
 *       in that case. Statements of a block are visited last to first.
 * </ul>
 *
 * @param <S> the store type used in the analysis
 */
public interface BackwardTransferFunction<S extends Store<S>> extends TransferFunction<S> {

    /**
     * Return the initial store that should be used at the regular exit block.
     *
     * @param underlyingAST the function whose graph is analyzed
     * @param returnNodes the reachable return statements of the function
     * @return the initial store that should be used at the regular exit block
     */
    S initialNormalExitStore(FunctionDefinitionNode underlyingAST, List<ReturnNode> returnNodes);
}
