package com.mqparser.ast;

import java.util.List;

public record IdentifierExpression(
    int id,
    TokenRange tokenRange,
    Constant inclusiveConstant,  // Can be null
    Identifier identifier
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.IDENTIFIER_EXPRESSION;
    }

    @Override
    public List<Node> children() {
        return Children.of(inclusiveConstant, identifier);
    }
}
