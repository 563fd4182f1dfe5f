package org.deadstore.dataflow.cfg;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import org.checkerframework.javacutil.UserError;
import org.deadstore.dataflow.cfg.block.Block;
import org.deadstore.dataflow.cfg.block.BlockImpl;
import org.deadstore.dataflow.cfg.block.ConditionalBlockImpl;
import org.deadstore.dataflow.cfg.block.RegularBlockImpl;
import org.deadstore.dataflow.cfg.block.SpecialBlock.SpecialBlockType;
import org.deadstore.dataflow.cfg.block.SpecialBlockImpl;
import org.deadstore.dataflow.cfg.node.AbstractNodeVisitor;
import org.deadstore.dataflow.cfg.node.AssertNode;
import org.deadstore.dataflow.cfg.node.AssignmentNode;
import org.deadstore.dataflow.cfg.node.BooleanLiteralNode;
import org.deadstore.dataflow.cfg.node.BreakNode;
import org.deadstore.dataflow.cfg.node.ContinueNode;
import org.deadstore.dataflow.cfg.node.ExpressionStatementNode;
import org.deadstore.dataflow.cfg.node.ForNode;
import org.deadstore.dataflow.cfg.node.FunctionDefinitionNode;
import org.deadstore.dataflow.cfg.node.IfNode;
import org.deadstore.dataflow.cfg.node.Node;
import org.deadstore.dataflow.cfg.node.PassNode;
import org.deadstore.dataflow.cfg.node.RaiseNode;
import org.deadstore.dataflow.cfg.node.ReturnNode;
import org.deadstore.dataflow.cfg.node.UnaryOperationNode;
import org.deadstore.dataflow.cfg.node.WhileNode;

/**
 * Builds the control flow graph of a function definition.
 *
 * <p>Simple statements are appended to the current regular block. Compound statements are
 * translated as follows:
 *
 * <ul>
 *   <li>{@code if t}: a conditional block whose then branch starts with {@code assert t} and
 *       whose else branch starts with {@code assert not t}; both branches meet in a new block.
 *   <li>{@code while t}: a conditional loop head; the body starts with {@code assert t} and
 *       flows back to the head, the exit edge starts with {@code assert not t} and runs the else
 *       clause. {@code while True} has no exit edge.
 *   <li>{@code for x in it}: {@code it} is evaluated once, then a conditional loop head; the body
 *       starts with the synthetic assignment {@code x = it}.
 *   <li>{@code return}, {@code raise}, {@code break} and {@code continue} end the current block
 *       with an edge to the exit, loop join or loop head. Statements after them land in a block
 *       without predecessors.
 * </ul>
 *
 * Blocks that cannot be reached from the entry are pruned before the graph is returned.
 */
public class CFGBuilder {

    /** The jump targets of the innermost enclosing loops. */
    private static class LoopTargets {
        final BlockImpl continueTarget;
        final BlockImpl breakTarget;

        LoopTargets(BlockImpl continueTarget, BlockImpl breakTarget) {
            this.continueTarget = continueTarget;
            this.breakTarget = breakTarget;
        }
    }

    /** The next block ID to hand out. */
    private int nextId;

    private final SpecialBlockImpl entryBlock;
    private final SpecialBlockImpl exitBlock;

    /** The block that simple statements are currently appended to. */
    private RegularBlockImpl current;

    private final Deque<LoopTargets> loops = new ArrayDeque<>();
    private final List<ReturnNode> returnNodes = new ArrayList<>();

    private CFGBuilder() {
        entryBlock = new SpecialBlockImpl(SpecialBlockType.ENTRY, nextId++);
        exitBlock = new SpecialBlockImpl(SpecialBlockType.EXIT, nextId++);
        current = newRegularBlock();
        entryBlock.setSuccessor(current);
    }

    /**
     * Build the control flow graph of {@code function}.
     *
     * @param function the function definition
     * @return the control flow graph of the function body
     * @throws UserError if the body is malformed
     */
    public static ControlFlowGraph build(FunctionDefinitionNode function) {
        return new CFGBuilder().buildGraph(function);
    }

    private ControlFlowGraph buildGraph(FunctionDefinitionNode function) {
        translate(function.getBody());
        current.setSuccessor(exitBlock);
        ControlFlowGraph cfg =
                new ControlFlowGraph(entryBlock, exitBlock, function, new ArrayList<ReturnNode>());
        prune(cfg);
        return cfg;
    }

    /** Remove the edges from unreachable blocks, and the return nodes they contain. */
    private void prune(ControlFlowGraph cfg) {
        Set<Block> reachable = cfg.getAllBlocks();
        for (Block b : reachable) {
            for (Block pred : b.getPredecessors()) {
                if (!reachable.contains(pred)) {
                    ((BlockImpl) b).removePredecessor((BlockImpl) pred);
                }
            }
        }
        for (ReturnNode ret : returnNodes) {
            if (ret.getBlock() != null && reachable.contains(ret.getBlock())) {
                cfg.getReturnNodes().add(ret);
            }
        }
    }

    private RegularBlockImpl newRegularBlock() {
        return new RegularBlockImpl(nextId++);
    }

    private void translate(List<Node> statements) {
        for (Node statement : statements) {
            statement.accept(translator, null);
        }
    }

    /**
     * End the current block with an edge to {@code target}, and continue in a block that has no
     * predecessors yet.
     */
    private void jumpTo(BlockImpl target) {
        current.setSuccessor(target);
        current = newRegularBlock();
    }

    /** Start {@code block} with an assertion of {@code test}. */
    private static void assume(RegularBlockImpl block, Node test) {
        block.addNode(new AssertNode(test.getLocation(), test));
    }

    /**
     * Returns the negation of a branch condition, folding constants and double negation.
     *
     * @param test a branch condition
     * @return {@code not test}
     */
    static Node negate(Node test) {
        if (test instanceof BooleanLiteralNode) {
            return new BooleanLiteralNode(
                    test.getLocation(), !((BooleanLiteralNode) test).getValue());
        }
        if (test instanceof UnaryOperationNode && ((UnaryOperationNode) test).isNot()) {
            return ((UnaryOperationNode) test).getOperand();
        }
        return new UnaryOperationNode(test.getLocation(), UnaryOperationNode.NOT, test);
    }

    private final AbstractNodeVisitor<Void, Void> translator =
            new AbstractNodeVisitor<Void, Void>() {

                /** Expressions, parameters and anything else that is not a statement. */
                @Override
                public Void visitNode(Node n, Void p) {
                    throw new UserError(
                            "%s at %s is not a statement", n.getClass().getSimpleName(),
                            n.getLocation());
                }

                private Void append(Node n) {
                    current.addNode(n);
                    return null;
                }

                @Override
                public Void visitAssignment(AssignmentNode n, Void p) {
                    return append(n);
                }

                @Override
                public Void visitAssert(AssertNode n, Void p) {
                    return append(n);
                }

                @Override
                public Void visitExpressionStatement(ExpressionStatementNode n, Void p) {
                    return append(n);
                }

                @Override
                public Void visitPass(PassNode n, Void p) {
                    return append(n);
                }

                @Override
                public Void visitFunctionDefinition(FunctionDefinitionNode n, Void p) {
                    return append(n);
                }

                @Override
                public Void visitReturn(ReturnNode n, Void p) {
                    append(n);
                    returnNodes.add(n);
                    jumpTo(exitBlock);
                    return null;
                }

                @Override
                public Void visitRaise(RaiseNode n, Void p) {
                    append(n);
                    jumpTo(exitBlock);
                    return null;
                }

                @Override
                public Void visitBreak(BreakNode n, Void p) {
                    LoopTargets loop = loops.peek();
                    if (loop == null) {
                        throw new UserError("'break' outside loop at %s", n.getLocation());
                    }
                    jumpTo(loop.breakTarget);
                    return null;
                }

                @Override
                public Void visitContinue(ContinueNode n, Void p) {
                    LoopTargets loop = loops.peek();
                    if (loop == null) {
                        throw new UserError("'continue' not properly in loop at %s", n.getLocation());
                    }
                    jumpTo(loop.continueTarget);
                    return null;
                }

                @Override
                public Void visitIf(IfNode n, Void p) {
                    ConditionalBlockImpl cond = new ConditionalBlockImpl(nextId++);
                    current.setSuccessor(cond);

                    RegularBlockImpl thenEntry = newRegularBlock();
                    cond.setThenSuccessor(thenEntry);
                    assume(thenEntry, n.getTest());
                    current = thenEntry;
                    translate(n.getBody());
                    RegularBlockImpl thenExit = current;

                    RegularBlockImpl elseEntry = newRegularBlock();
                    cond.setElseSuccessor(elseEntry);
                    assume(elseEntry, negate(n.getTest()));
                    current = elseEntry;
                    translate(n.getOrElse());
                    RegularBlockImpl elseExit = current;

                    RegularBlockImpl join = newRegularBlock();
                    thenExit.setSuccessor(join);
                    elseExit.setSuccessor(join);
                    current = join;
                    return null;
                }

                @Override
                public Void visitWhile(WhileNode n, Void p) {
                    RegularBlockImpl join = newRegularBlock();
                    if (n.isInfinite()) {
                        RegularBlockImpl head = newRegularBlock();
                        current.setSuccessor(head);
                        current = head;
                        loops.push(new LoopTargets(head, join));
                        translate(n.getBody());
                        loops.pop();
                        current.setSuccessor(head);
                        // The else clause only runs when the test fails.
                        current = newRegularBlock();
                        translate(n.getOrElse());
                        current.setSuccessor(join);
                        current = join;
                        return null;
                    }

                    ConditionalBlockImpl head = new ConditionalBlockImpl(nextId++);
                    current.setSuccessor(head);

                    RegularBlockImpl bodyEntry = newRegularBlock();
                    head.setThenSuccessor(bodyEntry);
                    assume(bodyEntry, n.getTest());
                    current = bodyEntry;
                    loops.push(new LoopTargets(head, join));
                    translate(n.getBody());
                    loops.pop();
                    current.setSuccessor(head);

                    RegularBlockImpl elseEntry = newRegularBlock();
                    head.setElseSuccessor(elseEntry);
                    assume(elseEntry, negate(n.getTest()));
                    current = elseEntry;
                    translate(n.getOrElse());
                    current.setSuccessor(join);
                    current = join;
                    return null;
                }

                @Override
                public Void visitFor(ForNode n, Void p) {
                    current.addNode(
                            new ExpressionStatementNode(
                                    n.getIterable().getLocation(), n.getIterable()));
                    RegularBlockImpl join = newRegularBlock();
                    ConditionalBlockImpl head = new ConditionalBlockImpl(nextId++);
                    current.setSuccessor(head);

                    RegularBlockImpl bodyEntry = newRegularBlock();
                    head.setThenSuccessor(bodyEntry);
                    bodyEntry.addNode(
                            new AssignmentNode(n.getLocation(), n.getTarget(), n.getIterable()));
                    current = bodyEntry;
                    loops.push(new LoopTargets(head, join));
                    translate(n.getBody());
                    loops.pop();
                    current.setSuccessor(head);

                    RegularBlockImpl elseEntry = newRegularBlock();
                    head.setElseSuccessor(elseEntry);
                    current = elseEntry;
                    translate(n.getOrElse());
                    current.setSuccessor(join);
                    current = join;
                    return null;
                }
            };
}
