package org.deadstore.dataflow.cfg.node;

/**
 * A default implementation of the node visitor interface. The class introduces a new method
 * {@code visitNode} which gets called by all unimplemented visit methods.
 *
 * @param <R> return type of the visitor
 * @param <P> parameter type of the visitor
 */
public abstract class AbstractNodeVisitor<R, P> implements NodeVisitor<R, P> {

    public abstract R visitNode(Node n, P p);

    @Override
    public R visitName(NameNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitAttribute(AttributeNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitSubscript(SubscriptNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitCall(CallNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitList(ListNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitTuple(TupleNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitStarred(StarredNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitBooleanLiteral(BooleanLiteralNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitIntegerLiteral(IntegerLiteralNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitStringLiteral(StringLiteralNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitBinaryOperation(BinaryOperationNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitUnaryOperation(UnaryOperationNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitAssignment(AssignmentNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitAssert(AssertNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitReturn(ReturnNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitRaise(RaiseNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitExpressionStatement(ExpressionStatementNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitPass(PassNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitFunctionDefinition(FunctionDefinitionNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitParameter(ParameterNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitIf(IfNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitWhile(WhileNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitFor(ForNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitBreak(BreakNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitContinue(ContinueNode n, P p) {
        return visitNode(n, p);
    }
}
