package com.mqparser.ast;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Content between an opening and a closing constant, optionally followed by {@code ?}.
 */
public record Wrapped(
    int id,
    NodeKind kind,
    TokenRange tokenRange,
    Constant openWrapperConstant,
    Node content,
    Constant closeWrapperConstant,
    Constant optionalConstant  // Can be null
) implements Node {

    public static final Set<NodeKind> KINDS = EnumSet.of(
        NodeKind.FIELD_PROJECTION,
        NodeKind.FIELD_SELECTOR,
        NodeKind.INVOKE_EXPRESSION,
        NodeKind.ITEM_ACCESS_EXPRESSION,
        NodeKind.LIST_EXPRESSION,
        NodeKind.LIST_LITERAL,
        NodeKind.LIST_TYPE,
        NodeKind.PARAMETER_LIST,
        NodeKind.PARENTHESIZED_EXPRESSION,
        NodeKind.RECORD_EXPRESSION,
        NodeKind.RECORD_LITERAL);

    public Wrapped {
        if (!KINDS.contains(kind)) {
            throw new IllegalArgumentException("Not a wrapped node kind: " + kind);
        }
    }

    @Override
    public List<Node> children() {
        return Children.of(openWrapperConstant, content, closeWrapperConstant, optionalConstant);
    }
}
