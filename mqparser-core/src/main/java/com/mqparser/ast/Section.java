package com.mqparser.ast;

import java.util.List;

/**
 * Root of a section document: {@code section Name; member1 = ...; shared member2 = ...;}.
 */
public record Section(
    int id,
    TokenRange tokenRange,
    Wrapped literalAttributes,  // Can be null
    Constant sectionConstant,
    Identifier name,  // Can be null
    Constant semicolonConstant,
    ArrayWrapper sectionMembers
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.SECTION;
    }

    @Override
    public List<Node> children() {
        return Children.of(literalAttributes, sectionConstant, name, semicolonConstant, sectionMembers);
    }
}
