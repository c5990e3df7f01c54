package com.mqparser.ast;

import java.util.List;

public record RangeExpression(
    int id,
    TokenRange tokenRange,
    Node left,
    Constant rangeConstant,
    Node right
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.RANGE_EXPRESSION;
    }

    @Override
    public List<Node> children() {
        return Children.of(left, rangeConstant, right);
    }
}
