package com.mqparser.ast;

import java.util.List;

public record UnaryExpression(
    int id,
    TokenRange tokenRange,
    ArrayWrapper operators,
    Node typeExpression
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.UNARY_EXPRESSION;
    }

    @Override
    public List<Node> children() {
        return Children.of(operators, typeExpression);
    }
}
