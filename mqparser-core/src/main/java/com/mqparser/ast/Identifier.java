package com.mqparser.ast;

import java.util.List;

public record Identifier(
    int id,
    TokenRange tokenRange,
    IdentifierContextKind identifierContextKind,
    String literal
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.IDENTIFIER;
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
