package com.mqparser.ast;

import java.util.List;

/**
 * {@code try protected}, optionally followed by a {@code catch} or {@code otherwise} handler.
 */
public record ErrorHandlingExpression(
    int id,
    TokenRange tokenRange,
    Constant tryConstant,
    Node protectedExpression,
    PairedConstant handler  // CatchExpression, OtherwiseExpression, or null
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.ERROR_HANDLING_EXPRESSION;
    }

    @Override
    public List<Node> children() {
        return Children.of(tryConstant, protectedExpression, handler);
    }
}
