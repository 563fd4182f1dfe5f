package org.deadstore.dataflow.cfg.block;

import java.util.Arrays;
import java.util.List;

/** Implementation of a conditional basic block. */
public class ConditionalBlockImpl extends BlockImpl implements ConditionalBlock {

    /** Successor of the then branch. */
    protected BlockImpl thenSuccessor;

    /** Successor of the else branch. */
    protected BlockImpl elseSuccessor;

    /**
     * Initialize an empty conditional basic block to be filled with contents and linked to other
     * basic blocks later.
     *
     * @param id the unique ID of this block within its graph
     */
    public ConditionalBlockImpl(int id) {
        super(BlockType.CONDITIONAL_BLOCK, id);
    }

    /** Set the then branch successor. */
    public void setThenSuccessor(BlockImpl b) {
        thenSuccessor = b;
        b.addPredecessor(this);
    }

    /** Set the else branch successor. */
    public void setElseSuccessor(BlockImpl b) {
        elseSuccessor = b;
        b.addPredecessor(this);
    }

    @Override
    public Block getThenSuccessor() {
        return thenSuccessor;
    }

    @Override
    public Block getElseSuccessor() {
        return elseSuccessor;
    }

    @Override
    public List<Block> getSuccessors() {
        return Arrays.<Block>asList(thenSuccessor, elseSuccessor);
    }

    @Override
    public String toString() {
        return "ConditionalBlock#" + id + "(then=" + thenSuccessor.getId() + ", else="
                + elseSuccessor.getId() + ")";
    }
}
