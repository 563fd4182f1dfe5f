package org.deadstore.dataflow.cfg.block;

import java.util.Collections;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Implementation of a non-special basic block. */
public abstract class SingleSuccessorBlockImpl extends BlockImpl implements SingleSuccessorBlock {

    /** Internal representation of the successor. */
    protected @Nullable BlockImpl successor;

    protected SingleSuccessorBlockImpl(BlockType type, int id) {
        super(type, id);
    }

    @Override
    public @Nullable Block getSuccessor() {
        return successor;
    }

    @Override
    public List<Block> getSuccessors() {
        if (successor == null) {
            return Collections.emptyList();
        }
        return Collections.<Block>singletonList(successor);
    }

    /**
     * Set a basic block as the successor of this block, and this block as its predecessor.
     *
     * @param successor the block that will be the successor of this
     */
    public void setSuccessor(BlockImpl successor) {
        this.successor = successor;
        successor.addPredecessor(this);
    }
}
