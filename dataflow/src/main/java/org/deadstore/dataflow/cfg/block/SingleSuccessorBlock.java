package org.deadstore.dataflow.cfg.block;

import org.checkerframework.checker.nullness.qual.Nullable;

/** A basic block that has at most one successor. */
public interface SingleSuccessorBlock extends Block {

    /** @return the non-exceptional successor block, or {@code null} if there is none */
    @Nullable Block getSuccessor();
}
