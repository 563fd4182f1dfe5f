package org.deadstore.dataflow.analysis;

import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.PriorityQueue;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.javacutil.BugInCF;
import org.deadstore.dataflow.cfg.ControlFlowGraph;
import org.deadstore.dataflow.cfg.block.Block;
import org.deadstore.dataflow.cfg.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of common features for {@link BackwardAnalysisImpl} and {@link
 * ForwardAnalysisImpl}.
 *
 * <p>Stores are merged into a block with {@link Store#leastUpperBound}, switching to {@link
 * Store#widenedUpperBound} once the block's input has changed {@code maxCountBeforeWidening}
 * times. A block is queued again only if the merged store is not {@link Store#lessOrEqual} its
 * previous input. A block whose input changes more than {@code maxIterations} times indicates a
 * non-monotone store and aborts the analysis.
 *
 * @param <S> the store type used in the analysis
 * @param <T> the transfer function type that is used to approximated runtime behavior
 */
public abstract class AbstractAnalysis<S extends Store<S>, T extends TransferFunction<S>>
        implements Analysis<S, T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractAnalysis.class);

    /** The default number of input changes of a block before widening is used. */
    public static final int DEFAULT_MAX_COUNT_BEFORE_WIDENING = 3;

    /** The default number of input changes of a block before the analysis gives up. */
    public static final int DEFAULT_MAX_ITERATIONS = 1000;

    /** The direction of this analysis. */
    protected final Direction direction;

    /** Is the analysis currently running? */
    protected boolean isRunning = false;

    /** The transfer function for regular nodes. */
    protected final T transferFunction;

    /** The current control flow graph to perform the analysis on. */
    protected @Nullable ControlFlowGraph cfg;

    /** Input stores before (forward) or after (backward) every reached basic block. */
    protected final IdentityHashMap<Block, TransferInput<S>> inputs;

    /** The number of times the input of each block has changed. */
    protected final IdentityHashMap<Block, Integer> updateCounts;

    /** The worklist used for the fix-point iteration. */
    protected final Worklist worklist;

    /** Input changes of a block before {@link Store#widenedUpperBound} replaces the lub. */
    protected final int maxCountBeforeWidening;

    /** Input changes of a block before the analysis is considered divergent. */
    protected final int maxIterations;

    /** The node that is currently handled in the analysis (if it is running). */
    protected @Nullable Node currentNode;

    /**
     * Create an analysis with the given direction, transfer function and iteration limits.
     *
     * @param direction direction of the analysis
     * @param transfer the transfer function
     * @param maxCountBeforeWidening input changes of a block before widening is used
     * @param maxIterations input changes of a block before the analysis gives up
     */
    protected AbstractAnalysis(
            Direction direction, T transfer, int maxCountBeforeWidening, int maxIterations) {
        this.direction = direction;
        this.transferFunction = transfer;
        this.maxCountBeforeWidening = maxCountBeforeWidening;
        this.maxIterations = maxIterations;
        this.inputs = new IdentityHashMap<>();
        this.updateCounts = new IdentityHashMap<>();
        this.worklist = new Worklist(direction);
    }

    @Override
    public Direction getDirection() {
        return direction;
    }

    @Override
    public boolean isRunning() {
        return isRunning;
    }

    @Override
    public T getTransferFunction() {
        return transferFunction;
    }

    @Override
    public @Nullable TransferInput<S> getInput(Block b) {
        return inputs.get(b);
    }

    @Override
    public @Nullable S getRegularExitStore() {
        if (cfg == null) {
            throw new BugInCF("%s analysis has not been performed", direction);
        }
        TransferInput<S> input = inputs.get(cfg.getRegularExitBlock());
        return input == null ? null : input.getRegularStore();
    }

    @Override
    public AnalysisResult<S> getResult() {
        if (isRunning || cfg == null) {
            throw new BugInCF(
                    "AbstractAnalysis::getResult() the result is only available after the analysis finished");
        }
        return new AnalysisResult<>(cfg, inputs);
    }

    @Override
    public void performAnalysis(ControlFlowGraph cfg) {
        if (isRunning) {
            throw new BugInCF(
                    "%s analysis: performAnalysis() doesn't expected get called when analysis is running!",
                    direction);
        }
        isRunning = true;
        try {
            init(cfg);
            while (!worklist.isEmpty()) {
                Block b = worklist.poll();
                LOGGER.trace("{} analysis of {}: visiting {}", direction,
                        cfg.getUnderlyingAST().getName(), b);
                performAnalysisBlock(b);
            }
        } finally {
            isRunning = false;
        }
    }

    /**
     * Perform the actual analysis on one block.
     *
     * @param b the block to analyze
     */
    protected abstract void performAnalysisBlock(Block b);

    @Override
    public void replay(T transfer) {
        if (isRunning || cfg == null) {
            throw new BugInCF(
                    "AbstractAnalysis::replay() is only possible after the analysis finished");
        }
        for (Block b : cfg.getDepthFirstOrderedBlocks()) {
            TransferInput<S> input = inputs.get(b);
            List<Node> nodes = b.getNodes();
            if (input == null || nodes.isEmpty()) {
                continue;
            }
            TransferInput<S> store = input.copy();
            if (direction == Direction.FORWARD) {
                for (Node n : nodes) {
                    store = new TransferInput<>(n, n.accept(transfer, store).getRegularStore());
                }
            } else {
                ListIterator<Node> reverseIter = nodes.listIterator(nodes.size());
                while (reverseIter.hasPrevious()) {
                    Node n = reverseIter.previous();
                    store = new TransferInput<>(n, n.accept(transfer, store).getRegularStore());
                }
            }
        }
    }

    /**
     * Initialize the analysis with a new control flow graph.
     *
     * @param cfg the control flow graph to use
     */
    protected final void init(ControlFlowGraph cfg) {
        initFields(cfg);
        initInitialInputs();
    }

    /**
     * Initialize fields of this object based on a given control flow graph. Sub-class may override
     * this method to initialize customized fields.
     *
     * @param cfg a given control flow graph
     */
    protected void initFields(ControlFlowGraph cfg) {
        this.cfg = cfg;
        inputs.clear();
        updateCounts.clear();
        currentNode = null;
        worklist.process(cfg);
    }

    /** Initialize the transfer inputs of the starting blocks, and add them to the worklist. */
    protected abstract void initInitialInputs();

    /**
     * Call the transfer function for node {@code node}, and set that node as current node first.
     *
     * @param node a node
     * @param input the input store of the node
     * @return the transfer result of the node
     */
    protected TransferResult<S> callTransferFunction(Node node, TransferInput<S> input) {
        currentNode = node;
        return node.accept(transferFunction, input);
    }

    /**
     * Merge {@code s} into the input of block {@code b}.
     *
     * @param b the block whose input is updated
     * @param node the node the store flows from, or {@code null}
     * @param s the incoming store
     * @return true if the input of {@code b} changed and {@code b} has to be analyzed again
     */
    protected boolean updateInput(Block b, @Nullable Node node, S s) {
        TransferInput<S> previous = inputs.get(b);
        if (previous == null) {
            inputs.put(b, new TransferInput<>(node, s));
            updateCounts.put(b, 1);
            return true;
        }
        S previousStore = previous.getRegularStore();
        int count = updateCounts.get(b);
        S merged =
                count >= maxCountBeforeWidening
                        ? s.widenedUpperBound(previousStore)
                        : previousStore.leastUpperBound(s);
        if (merged.lessOrEqual(previousStore)) {
            return false;
        }
        if (count >= maxIterations) {
            throw new BugInCF(
                    "%s analysis of %s did not converge: the input of %s changed %d times",
                    direction, cfg.getUnderlyingAST().getName(), b, count);
        }
        updateCounts.put(b, count + 1);
        inputs.put(b, new TransferInput<>(node, merged));
        return true;
    }

    /**
     * Add a basic block to the worklist. If {@code b} is already present, the method does nothing.
     *
     * @param b the block to add to the worklist
     */
    protected void addToWorklist(Block b) {
        worklist.add(b);
    }

    /**
     * A worklist is a priority queue of blocks in which the order is given by depth-first ordering
     * to place non-loop predecessors ahead of successors.
     */
    protected static class Worklist {

        /** Map all blocks in the CFG to their depth-first order. */
        protected final IdentityHashMap<Block, Integer> depthFirstOrder = new IdentityHashMap<>();

        /** Comparator to allow priority queue to order blocks by their depth-first order. */
        public class ForwardDFOComparator implements Comparator<Block> {
            @Override
            public int compare(Block b1, Block b2) {
                return depthFirstOrder.get(b1) - depthFirstOrder.get(b2);
            }
        }

        /** Comparator to allow priority queue to order blocks by their reverse depth-first order. */
        public class BackwardDFOComparator implements Comparator<Block> {
            @Override
            public int compare(Block b1, Block b2) {
                return depthFirstOrder.get(b2) - depthFirstOrder.get(b1);
            }
        }

        /** The backing priority queue. */
        protected final PriorityQueue<Block> queue;

        /**
         * Create a Worklist.
         *
         * @param direction the direction (forward or backward)
         */
        public Worklist(Direction direction) {
            if (direction == Direction.FORWARD) {
                queue = new PriorityQueue<>(11, new ForwardDFOComparator());
            } else {
                queue = new PriorityQueue<>(11, new BackwardDFOComparator());
            }
        }

        /**
         * Process the control flow graph, add the blocks to {@link #depthFirstOrder}.
         *
         * @param cfg the control flow graph to process
         */
        public void process(ControlFlowGraph cfg) {
            depthFirstOrder.clear();
            int count = 1;
            for (Block b : cfg.getDepthFirstOrderedBlocks()) {
                depthFirstOrder.put(b, count++);
            }
            queue.clear();
        }

        /** @return true if the block is part of the processed graph */
        public boolean isReachable(Block block) {
            return depthFirstOrder.containsKey(block);
        }

        public boolean isEmpty() {
            return queue.isEmpty();
        }

        public boolean contains(Block block) {
            return queue.contains(block);
        }

        /**
         * Add the given block to {@link #queue}, unless it is already queued.
         *
         * @param block the block to add to {@link #queue}
         */
        public void add(Block block) {
            if (!contains(block)) {
                queue.add(block);
            }
        }

        /**
         * Retrieves and removes the head of the queue.
         *
         * @return the head of the queue, or {@code null} if this queue is empty
         */
        public @Nullable Block poll() {
            return queue.poll();
        }

        @Override
        public String toString() {
            return "Worklist(" + queue + ")";
        }
    }
}
