package com.mqparser.ast;

import java.util.List;

public record LiteralExpression(
    int id,
    TokenRange tokenRange,
    String literal,
    LiteralKind literalKind
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.LITERAL_EXPRESSION;
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
