package com.mqparser.ast;

import java.util.List;

public record PrimitiveType(
    int id,
    TokenRange tokenRange,
    PrimitiveTypeKind primitiveTypeKind
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.PRIMITIVE_TYPE;
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
