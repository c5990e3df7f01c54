package com.mqparser.ast;

import java.util.List;

public record FunctionType(
    int id,
    TokenRange tokenRange,
    Constant functionConstant,
    Wrapped parameters,
    PairedConstant functionReturnType
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION_TYPE;
    }

    @Override
    public List<Node> children() {
        return Children.of(functionConstant, parameters, functionReturnType);
    }
}
