package com.mqparser.jackson;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.mqparser.ast.ConstantKind;
import com.mqparser.ast.Node;
import com.mqparser.ast.NodeKind;

import java.util.List;

/**
 * Jackson module that configures serialization for the syntax tree records.
 *
 * This module handles:
 * - The kind and leaf flag, which are methods rather than record components on most nodes
 * - Hiding the derived children list, since every child is already a named component
 * - Constant kinds written as source text
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.mqparser", "mqparser-jackson"));
        addSerializer(ConstantKind.class, new ConstantKindSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        // Mixins on the sealed interface are not reliably merged into record accessors, so each
        // permitted node record gets its own registration
        for (Class<?> nodeClass : Node.class.getPermittedSubclasses()) {
            context.setMixInAnnotations(nodeClass, NodeMixin.class);
        }
    }

    @JsonPropertyOrder({"kind", "id", "tokenRange", "isLeaf"})
    private interface NodeMixin {
        @JsonProperty("kind")
        NodeKind kind();

        @JsonProperty("isLeaf")
        boolean isLeaf();

        @JsonIgnore
        List<Node> children();
    }
}
