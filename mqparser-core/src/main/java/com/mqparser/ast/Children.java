package com.mqparser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class Children {

    private Children() {
    }

    static List<Node> of(Node... nodes) {
        List<Node> present = new ArrayList<>(nodes.length);
        for (Node node : nodes) {
            if (node != null) {
                present.add(node);
            }
        }
        return Collections.unmodifiableList(present);
    }
}
