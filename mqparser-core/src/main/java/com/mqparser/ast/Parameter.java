package com.mqparser.ast;

import java.util.List;

public record Parameter(
    int id,
    TokenRange tokenRange,
    Constant optionalConstant,  // Can be null
    Identifier name,
    PairedConstant parameterType  // Can be null
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.PARAMETER;
    }

    @Override
    public List<Node> children() {
        return Children.of(optionalConstant, name, parameterType);
    }
}
