package com.mqparser.ast;

import java.util.List;

/**
 * A record field name, which may span several tokens such as {@code Column 1} or {@code and}.
 */
public record GeneralizedIdentifier(
    int id,
    TokenRange tokenRange,
    String literal
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.GENERALIZED_IDENTIFIER;
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
