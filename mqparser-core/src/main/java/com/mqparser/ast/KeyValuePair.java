package com.mqparser.ast;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public record KeyValuePair(
    int id,
    NodeKind kind,
    TokenRange tokenRange,
    Node key,  // Identifier or GeneralizedIdentifier
    Constant equalConstant,
    Node value
) implements Node {

    public static final Set<NodeKind> KINDS = EnumSet.of(
        NodeKind.GENERALIZED_IDENTIFIER_PAIRED_ANY_LITERAL,
        NodeKind.GENERALIZED_IDENTIFIER_PAIRED_EXPRESSION,
        NodeKind.IDENTIFIER_PAIRED_EXPRESSION);

    public KeyValuePair {
        if (!KINDS.contains(kind)) {
            throw new IllegalArgumentException("Not a key value pair node kind: " + kind);
        }
    }

    @Override
    public List<Node> children() {
        return Children.of(key, equalConstant, value);
    }
}
