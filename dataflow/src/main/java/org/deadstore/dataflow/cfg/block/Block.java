package org.deadstore.dataflow.cfg.block;

import java.util.List;
import java.util.Set;
import org.deadstore.dataflow.cfg.node.Node;

/** Represents a basic block in a control flow graph. */
public interface Block {

    /** The types of basic blocks. */
    enum BlockType {

        /** A regular basic block. */
        REGULAR_BLOCK,

        /** A conditional basic block. */
        CONDITIONAL_BLOCK,

        /** A special basic block. */
        SPECIAL_BLOCK,
    }

    /** @return the type of this basic block */
    BlockType getType();

    /** @return the unique identifier of this block within its graph */
    int getId();

    /** @return the predecessors of this basic block */
    Set<Block> getPredecessors();

    /** @return the successors of this basic block, in the order control may take them */
    List<Block> getSuccessors();

    /**
     * Returns the statements contained within this basic block, in execution order. The list is
     * empty for conditional and special blocks.
     *
     * @return the statements of this block
     */
    List<Node> getNodes();
}
