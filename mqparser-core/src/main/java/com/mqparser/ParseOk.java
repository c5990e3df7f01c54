package com.mqparser;

import com.mqparser.ast.Node;
import com.mqparser.engine.NodeRegistry;
import com.mqparser.lexer.LexerSnapshot;

/**
 * A successful parse: the root node plus the registry holding every node of the tree.
 */
public record ParseOk(Node root, NodeRegistry registry, LexerSnapshot lexerSnapshot) {
}
