package org.deadstore.dataflow.resolution;

import org.deadstore.dataflow.cfg.node.Node;

/** Decides whether the static type of an expression is the bottom type {@code NoReturn}. */
public interface NeverTypeOracle {

    /** An oracle for which no expression is never-typed. */
    NeverTypeOracle NONE = (expression, context) -> false;

    /**
     * Returns true if evaluating {@code expression} never completes normally.
     *
     * @param expression the expression of an expression statement
     * @param context where the expression is resolved
     * @return true if the static type of {@code expression} is {@code NoReturn}
     */
    boolean isNoReturn(Node expression, ResolutionContext context);
}
