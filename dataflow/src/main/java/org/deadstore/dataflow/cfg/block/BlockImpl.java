package org.deadstore.dataflow.cfg.block;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.deadstore.dataflow.cfg.node.Node;

/** Base class of the {@link Block} implementation hierarchy. */
public abstract class BlockImpl implements Block {

    /** The type of this basic block. */
    protected final BlockType type;

    /** The set of predecessors, in the order the edges were added. */
    protected final Set<BlockImpl> predecessors;

    /** The unique ID of this block within its graph. */
    protected final int id;

    /**
     * Create a new BlockImpl.
     *
     * @param type the type of this basic block
     * @param id the unique ID of this block within its graph
     */
    protected BlockImpl(BlockType type, int id) {
        this.type = type;
        this.id = id;
        this.predecessors = new LinkedHashSet<>();
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public BlockType getType() {
        return type;
    }

    @Override
    public Set<Block> getPredecessors() {
        return Collections.unmodifiableSet(new LinkedHashSet<Block>(predecessors));
    }

    @Override
    public List<Node> getNodes() {
        return Collections.emptyList();
    }

    /** Add {@code pred} as a predecessor of this block. */
    public void addPredecessor(BlockImpl pred) {
        predecessors.add(pred);
    }

    /** Remove {@code pred} from the predecessors of this block. */
    public void removePredecessor(BlockImpl pred) {
        predecessors.remove(pred);
    }

    @Override
    public String toString() {
        return type + "#" + id;
    }
}
