package org.deadstore.dataflow.cfg.node;

/**
 * A visitor for a {@link Node} tree.
 *
 * @param <R> return type of the visitor
 * @param <P> parameter type of the visitor
 */
public interface NodeVisitor<R, P> {
    R visitName(NameNode name, P p);

    R visitAttribute(AttributeNode attribute, P p);

    R visitSubscript(SubscriptNode subscript, P p);

    R visitCall(CallNode call, P p);

    R visitList(ListNode list, P p);

    R visitTuple(TupleNode tuple, P p);

    R visitStarred(StarredNode starred, P p);

    R visitBooleanLiteral(BooleanLiteralNode booleanLiteral, P p);

    R visitIntegerLiteral(IntegerLiteralNode integerLiteral, P p);

    R visitStringLiteral(StringLiteralNode stringLiteral, P p);

    R visitBinaryOperation(BinaryOperationNode binaryOperation, P p);

    R visitUnaryOperation(UnaryOperationNode unaryOperation, P p);

    R visitAssignment(AssignmentNode assignment, P p);

    R visitAssert(AssertNode assertNode, P p);

    R visitReturn(ReturnNode returnNode, P p);

    R visitRaise(RaiseNode raise, P p);

    R visitExpressionStatement(ExpressionStatementNode expressionStatement, P p);

    R visitPass(PassNode pass, P p);

    R visitFunctionDefinition(FunctionDefinitionNode functionDefinition, P p);

    R visitParameter(ParameterNode parameter, P p);

    R visitIf(IfNode ifNode, P p);

    R visitWhile(WhileNode whileNode, P p);

    R visitFor(ForNode forNode, P p);

    R visitBreak(BreakNode breakNode, P p);

    R visitContinue(ContinueNode continueNode, P p);
}
