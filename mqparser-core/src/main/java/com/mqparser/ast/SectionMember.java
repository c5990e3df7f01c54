package com.mqparser.ast;

import java.util.List;

public record SectionMember(
    int id,
    TokenRange tokenRange,
    Wrapped literalAttributes,  // Can be null
    Constant sharedConstant,  // Can be null
    KeyValuePair namePairedExpression,
    Constant semicolonConstant
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.SECTION_MEMBER;
    }

    @Override
    public List<Node> children() {
        return Children.of(literalAttributes, sharedConstant, namePairedExpression, semicolonConstant);
    }
}
