package org.deadstore.dataflow.cfg.block;

import java.util.List;
import org.deadstore.dataflow.cfg.node.Node;

/** A regular basic block that contains a sequence of simple statements. */
public interface RegularBlock extends SingleSuccessorBlock {

    /** @return the unmodifiable sequence of statements of this block */
    List<Node> getContents();

    /** @return true if the block contains no statements */
    boolean isEmpty();
}
