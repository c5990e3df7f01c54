package com.mqparser.ast;

import java.util.List;

/**
 * {@code left operator right} for every operator in {@link BinOpOperator}.
 */
public record BinOpExpression(
    int id,
    NodeKind kind,
    TokenRange tokenRange,
    Node left,
    Constant operatorConstant,
    Node right
) implements Node {

    public BinOpExpression {
        if (!kind.isBinOpExpression()) {
            throw new IllegalArgumentException("Not a binary expression node kind: " + kind);
        }
    }

    public BinOpOperator operator() {
        return BinOpOperator.fromConstantKind(operatorConstant.constantKind());
    }

    @Override
    public List<Node> children() {
        return Children.of(left, operatorConstant, right);
    }
}
