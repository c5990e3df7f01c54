package com.mqparser.ast;

import java.util.List;

public record IfExpression(
    int id,
    TokenRange tokenRange,
    Constant ifConstant,
    Node condition,
    Constant thenConstant,
    Node trueExpression,
    Constant elseConstant,
    Node falseExpression
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.IF_EXPRESSION;
    }

    @Override
    public List<Node> children() {
        return Children.of(ifConstant, condition, thenConstant, trueExpression, elseConstant, falseExpression);
    }
}
