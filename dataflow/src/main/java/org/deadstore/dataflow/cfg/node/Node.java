package org.deadstore.dataflow.cfg.node;

import java.util.Collection;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.deadstore.dataflow.cfg.block.Block;

/**
 * A node in the syntax of an analyzed function. Simple statements are the contents of the basic
 * blocks of a {@link org.deadstore.dataflow.cfg.ControlFlowGraph}; expressions only appear as
 * operands of statements; compound statements ({@link IfNode}, {@link WhileNode}, {@link
 * ForNode}, {@link BreakNode}, {@link ContinueNode}) are lowered into blocks and edges by the
 * {@link org.deadstore.dataflow.cfg.CFGBuilder}.
 *
 * <p>Nodes are compared by identity: two syntactically equal statements at the same location are
 * still different nodes.
 */
public abstract class Node {

    /** The source range of this node. */
    protected final Location location;

    /** The basic block this node belongs to, or {@code null} if it is not part of a graph. */
    protected @Nullable Block block;

    /**
     * Create a node.
     *
     * @param location the source range of the node
     */
    protected Node(Location location) {
        this.location = location;
    }

    /** @return the source range of this node */
    public Location getLocation() {
        return location;
    }

    /**
     * @return the basic block this node belongs to, or {@code null} for expressions and for
     *     statements that are not contents of a block
     */
    public @Nullable Block getBlock() {
        return block;
    }

    /** Set the basic block this node belongs to. */
    public void setBlock(Block b) {
        block = b;
    }

    /**
     * Accept method of the visitor pattern.
     *
     * @param <R> result type of the operation
     * @param <P> parameter type
     * @param visitor the visitor to be applied to this node
     * @param p the parameter for this operation
     * @return the result of the visit
     */
    public abstract <R, P> R accept(NodeVisitor<R, P> visitor, P p);

    /** @return the direct sub-nodes of this node, in source order */
    public abstract Collection<Node> getOperands();
}
