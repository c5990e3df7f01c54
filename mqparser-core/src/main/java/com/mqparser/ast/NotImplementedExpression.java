package com.mqparser.ast;

import java.util.List;

public record NotImplementedExpression(
    int id,
    TokenRange tokenRange,
    Constant ellipsisConstant
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.NOT_IMPLEMENTED_EXPRESSION;
    }

    @Override
    public List<Node> children() {
        return Children.of(ellipsisConstant);
    }
}
