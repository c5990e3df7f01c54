package com.mqparser.ast;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A leading constant and the node it introduces, e.g. {@code each _}, {@code as number} or {@code nullable text}.
 */
public record PairedConstant(
    int id,
    NodeKind kind,
    TokenRange tokenRange,
    Constant constant,
    Node paired
) implements Node {

    public static final Set<NodeKind> KINDS = EnumSet.of(
        NodeKind.AS_NULLABLE_PRIMITIVE_TYPE,
        NodeKind.AS_TYPE,
        NodeKind.CATCH_EXPRESSION,
        NodeKind.EACH_EXPRESSION,
        NodeKind.ERROR_RAISING_EXPRESSION,
        NodeKind.FIELD_TYPE_SPECIFICATION,
        NodeKind.NULLABLE_PRIMITIVE_TYPE,
        NodeKind.NULLABLE_TYPE,
        NodeKind.OTHERWISE_EXPRESSION,
        NodeKind.TABLE_TYPE,
        NodeKind.TYPE_PRIMARY_TYPE);

    public PairedConstant {
        if (!KINDS.contains(kind)) {
            throw new IllegalArgumentException("Not a paired constant node kind: " + kind);
        }
    }

    @Override
    public List<Node> children() {
        return Children.of(constant, paired);
    }
}
