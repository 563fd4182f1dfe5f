package org.deadstore.dataflow.cfg.block;

/**
 * Represents a conditional basic block. It has no contents; the condition it branches on is
 * asserted at the start of each of its successors.
 */
public interface ConditionalBlock extends Block {

    /** @return the entry block of the then branch */
    Block getThenSuccessor();

    /** @return the entry block of the else branch */
    Block getElseSuccessor();
}
