package org.deadstore.dataflow.cfg;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.deadstore.dataflow.cfg.block.Block;
import org.deadstore.dataflow.cfg.block.SpecialBlock;
import org.deadstore.dataflow.cfg.node.FunctionDefinitionNode;
import org.deadstore.dataflow.cfg.node.Node;
import org.deadstore.dataflow.cfg.node.ReturnNode;

/**
 * A control flow graph (CFG for short) of a single function definition. Nested function
 * definitions are statements of the graph; their bodies get graphs of their own.
 *
 * <p>Every block of the graph is reachable from the entry block. The regular exit block always
 * exists, but is not part of the graph if no path reaches it (e.g. the body ends in an infinite
 * loop).
 */
public class ControlFlowGraph {

    /** The entry block of the control flow graph. */
    protected final SpecialBlock entryBlock;

    /** The regular exit block of the control flow graph. */
    protected final SpecialBlock regularExitBlock;

    /** The function this graph represents. */
    protected final FunctionDefinitionNode underlyingAST;

    /** All return nodes (if any) encountered, in source order. */
    protected final List<ReturnNode> returnNodes;

    /** The blocks reachable from the entry, computed lazily. */
    private List<Block> depthFirstOrderedBlocks;

    public ControlFlowGraph(
            SpecialBlock entryBlock,
            SpecialBlock regularExitBlock,
            FunctionDefinitionNode underlyingAST,
            List<ReturnNode> returnNodes) {
        this.entryBlock = entryBlock;
        this.regularExitBlock = regularExitBlock;
        this.underlyingAST = underlyingAST;
        this.returnNodes = returnNodes;
    }

    /** @return the entry block of the control flow graph */
    public SpecialBlock getEntryBlock() {
        return entryBlock;
    }

    /** @return the regular exit block of the control flow graph */
    public SpecialBlock getRegularExitBlock() {
        return regularExitBlock;
    }

    /** @return true if some path from the entry reaches the regular exit block */
    public boolean isExitReachable() {
        return getDepthFirstOrderedBlocks().contains(regularExitBlock);
    }

    /** @return the function this graph represents */
    public FunctionDefinitionNode getUnderlyingAST() {
        return underlyingAST;
    }

    /** @return the reachable return statements, in source order */
    public List<ReturnNode> getReturnNodes() {
        return returnNodes;
    }

    /** @return the set of all basic blocks in this control flow graph */
    public Set<Block> getAllBlocks() {
        return new LinkedHashSet<>(getDepthFirstOrderedBlocks());
    }

    /**
     * Returns all basic blocks in this control flow graph, in reverse post-order of a depth-first
     * traversal from the entry block. Every block appears exactly once; a block comes before all
     * of its successors except along back edges.
     *
     * @return the blocks of the graph in reverse post-order
     */
    public List<Block> getDepthFirstOrderedBlocks() {
        if (depthFirstOrderedBlocks != null) {
            return depthFirstOrderedBlocks;
        }
        List<Block> postOrder = new ArrayList<>();
        Map<Block, Boolean> visited = new IdentityHashMap<>();
        Deque<Block> stack = new ArrayDeque<>();
        Deque<Integer> nextSuccessor = new ArrayDeque<>();
        stack.push(entryBlock);
        nextSuccessor.push(0);
        visited.put(entryBlock, Boolean.TRUE);
        while (!stack.isEmpty()) {
            Block current = stack.peek();
            int index = nextSuccessor.pop();
            List<Block> successors = current.getSuccessors();
            if (index < successors.size()) {
                nextSuccessor.push(index + 1);
                Block succ = successors.get(index);
                if (!visited.containsKey(succ)) {
                    visited.put(succ, Boolean.TRUE);
                    stack.push(succ);
                    nextSuccessor.push(0);
                }
            } else {
                stack.pop();
                postOrder.add(current);
            }
        }
        Collections.reverse(postOrder);
        depthFirstOrderedBlocks = Collections.unmodifiableList(postOrder);
        return depthFirstOrderedBlocks;
    }

    /** @return all statements of all blocks, in depth-first block order */
    public List<Node> getAllNodes() {
        List<Node> nodes = new ArrayList<>();
        for (Block b : getDepthFirstOrderedBlocks()) {
            nodes.addAll(b.getNodes());
        }
        return nodes;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CFG of ").append(underlyingAST).append('\n');
        for (Block b : getDepthFirstOrderedBlocks()) {
            sb.append("  ").append(b).append(" ->");
            for (Block succ : b.getSuccessors()) {
                sb.append(' ').append(succ.getId());
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
