package com.mqparser.ast;

import java.util.List;

public record FieldSpecification(
    int id,
    TokenRange tokenRange,
    Constant optionalConstant,  // Can be null
    GeneralizedIdentifier name,
    PairedConstant fieldTypeSpecification  // Can be null
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.FIELD_SPECIFICATION;
    }

    @Override
    public List<Node> children() {
        return Children.of(optionalConstant, name, fieldTypeSpecification);
    }
}
