package com.mqparser;

import com.mqparser.ast.Node;
import com.mqparser.engine.NodeRegistry;
import com.mqparser.lexer.LexerSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * What was built before a parse failed. Open contexts are left as they were when the error was thrown.
 */
public record ParsePartial(NodeRegistry registry, LexerSnapshot lexerSnapshot) {

    /**
     * Finished nodes in id order.
     */
    public List<Node> finishedNodes() {
        List<Node> nodes = new ArrayList<>();
        for (int id : registry.idsInState(NodeRegistry.SlotState.FINISHED)) {
            nodes.add(registry.astNode(id));
        }
        return nodes;
    }
}
