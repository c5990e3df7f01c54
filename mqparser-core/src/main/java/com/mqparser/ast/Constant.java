package com.mqparser.ast;

import java.util.List;

public record Constant(
    int id,
    TokenRange tokenRange,
    ConstantKind constantKind
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.CONSTANT;
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
