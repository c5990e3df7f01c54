package com.mqparser.ast;

import java.util.List;

/**
 * A primary expression followed by invoke, item access, field selection or projection suffixes.
 */
public record RecursivePrimaryExpression(
    int id,
    TokenRange tokenRange,
    Node head,
    ArrayWrapper recursiveExpressions
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.RECURSIVE_PRIMARY_EXPRESSION;
    }

    @Override
    public List<Node> children() {
        return Children.of(head, recursiveExpressions);
    }
}
