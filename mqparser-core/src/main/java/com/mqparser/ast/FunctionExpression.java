package com.mqparser.ast;

import java.util.List;

public record FunctionExpression(
    int id,
    TokenRange tokenRange,
    Wrapped parameters,
    PairedConstant functionReturnType,  // Can be null
    Constant fatArrowConstant,
    Node expression
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION_EXPRESSION;
    }

    @Override
    public List<Node> children() {
        return Children.of(parameters, functionReturnType, fatArrowConstant, expression);
    }
}
