package com.mqparser.ast;

import java.util.List;

public record LetExpression(
    int id,
    TokenRange tokenRange,
    Constant letConstant,
    ArrayWrapper variableList,
    Constant inConstant,
    Node expression
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.LET_EXPRESSION;
    }

    @Override
    public List<Node> children() {
        return Children.of(letConstant, variableList, inConstant, expression);
    }
}
