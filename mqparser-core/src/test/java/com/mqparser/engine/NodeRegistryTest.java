package com.mqparser.engine;

import com.mqparser.ast.Constant;
import com.mqparser.ast.ConstantKind;
import com.mqparser.ast.NodeKind;
import com.mqparser.ast.TokenRange;
import com.mqparser.error.InvariantException;
import com.mqparser.lexer.Position;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class NodeRegistryTest {

    private static final TokenRange RANGE = new TokenRange(0, 0, Position.START, Position.START);

    private static Constant comma(int id) {
        return new Constant(id, RANGE, ConstantKind.COMMA);
    }

    @Test
    void testOpenAndPromote() {
        NodeRegistry registry = new NodeRegistry();
        int root = registry.openContext(NodeKind.ARRAY_WRAPPER, 0, null, NodeRegistry.NO_ID);
        int child = registry.openContext(NodeKind.CONSTANT, 0, null, root);

        assertEquals(1, root, "Ids start at 1");
        assertEquals(root, registry.rootId());
        assertEquals(0, registry.attributeIndex(child));
        assertEquals(List.of(child), registry.childIds(root));
        assertEquals(1, registry.contextNode(root).attributeCounter());

        registry.promote(child, comma(child));
        assertEquals(NodeRegistry.SlotState.FINISHED, registry.slotState(child));
        assertNotNull(registry.astNode(child));
        assertNull(registry.contextNode(child), "A finished node is no longer a context");
        assertTrue(registry.leafIds().contains(child));
        assertTrue(registry.idsByKind(NodeKind.CONSTANT).contains(child));
    }

    @Test
    void testPromoteTwiceFails() {
        NodeRegistry registry = new NodeRegistry();
        int id = registry.openContext(NodeKind.CONSTANT, 0, null, NodeRegistry.NO_ID);
        registry.promote(id, comma(id));
        assertThrows(InvariantException.class, () -> registry.promote(id, comma(id)));
    }

    @Test
    void testPromoteWithWrongIdFails() {
        NodeRegistry registry = new NodeRegistry();
        int id = registry.openContext(NodeKind.CONSTANT, 0, null, NodeRegistry.NO_ID);
        assertThrows(InvariantException.class, () -> registry.promote(id, comma(id + 1)));
    }

    @Test
    void testOpenContextAsParentTakesThePlaceOfTheExistingNode() {
        NodeRegistry registry = new NodeRegistry();
        int root = registry.openContext(NodeKind.ARRAY_WRAPPER, 0, null, NodeRegistry.NO_ID);
        int first = registry.openContext(NodeKind.CONSTANT, 0, null, root);
        registry.promote(first, comma(first));

        int wrapper = registry.openContextAsParent(NodeKind.CSV, first);

        assertEquals(List.of(wrapper), registry.childIds(root));
        assertEquals(0, registry.attributeIndex(wrapper));
        assertEquals(wrapper, registry.parentId(first));
        assertEquals(0, registry.attributeIndex(first));
        assertEquals(1, registry.attributeCounter(wrapper));
    }

    @Test
    void testOpenContextAsParentOfRootBecomesRoot() {
        NodeRegistry registry = new NodeRegistry();
        int first = registry.openContext(NodeKind.CONSTANT, 0, null, NodeRegistry.NO_ID);
        registry.promote(first, comma(first));

        int wrapper = registry.openContextAsParent(NodeKind.CSV, first);
        assertEquals(wrapper, registry.rootId());
    }

    @Test
    void testDeleteContextUnwrapsItsOnlyChild() {
        NodeRegistry registry = new NodeRegistry();
        int root = registry.openContext(NodeKind.ARRAY_WRAPPER, 0, null, NodeRegistry.NO_ID);
        registry.incrementAttributeCounter(root);
        int wrapper = registry.openContext(NodeKind.METADATA_EXPRESSION, 0, null, root);
        int inner = registry.openContext(NodeKind.CONSTANT, 0, null, wrapper);
        registry.promote(inner, comma(inner));

        registry.deleteContext(wrapper);

        assertEquals(NodeRegistry.SlotState.DELETED, registry.slotState(wrapper));
        assertEquals(List.of(inner), registry.childIds(root));
        assertEquals(root, registry.parentId(inner));
        assertEquals(1, registry.attributeIndex(inner), "The child inherits the wrapper's attribute index");
        assertTrue(registry.idsByKind(NodeKind.METADATA_EXPRESSION).isEmpty());
    }

    @Test
    void testDeleteEmptyContextGivesBackTheAttribute() {
        NodeRegistry registry = new NodeRegistry();
        int root = registry.openContext(NodeKind.ARRAY_WRAPPER, 0, null, NodeRegistry.NO_ID);
        int empty = registry.openContext(NodeKind.CSV, 0, null, root);
        assertEquals(1, registry.attributeCounter(root));

        registry.deleteContext(empty);

        assertEquals(0, registry.attributeCounter(root));
        assertTrue(registry.childIds(root).isEmpty());
    }

    @Test
    void testDeleteContextWithTwoChildrenFails() {
        NodeRegistry registry = new NodeRegistry();
        int root = registry.openContext(NodeKind.ARRAY_WRAPPER, 0, null, NodeRegistry.NO_ID);
        registry.openContext(NodeKind.CONSTANT, 0, null, root);
        registry.openContext(NodeKind.CONSTANT, 0, null, root);
        assertThrows(InvariantException.class, () -> registry.deleteContext(root));
    }

    @Test
    void testDeleteSubtree() {
        NodeRegistry registry = new NodeRegistry();
        int root = registry.openContext(NodeKind.ARRAY_WRAPPER, 0, null, NodeRegistry.NO_ID);
        int child = registry.openContext(NodeKind.CSV, 0, null, root);
        int grandchild = registry.openContext(NodeKind.CONSTANT, 0, null, child);

        registry.deleteSubtree(child);

        assertTrue(registry.childIds(root).isEmpty());
        assertEquals(NodeRegistry.SlotState.DELETED, registry.slotState(child));
        assertEquals(NodeRegistry.SlotState.DELETED, registry.slotState(grandchild));
        assertThrows(InvariantException.class, () -> registry.attachChild(root, child),
            "Deleted nodes cannot be linked again");
    }

    @Test
    void testAttachChildTwiceFails() {
        NodeRegistry registry = new NodeRegistry();
        int a = registry.openContext(NodeKind.ARRAY_WRAPPER, 0, null, NodeRegistry.NO_ID);
        int b = registry.openContext(NodeKind.ARRAY_WRAPPER, 0, null, NodeRegistry.NO_ID);
        int child = registry.openContext(NodeKind.CONSTANT, 0, null, a);
        assertThrows(InvariantException.class, () -> registry.attachChild(b, child));
    }

    @Test
    void testReparentMovesNodeToNextAttribute() {
        NodeRegistry registry = new NodeRegistry();
        int a = registry.openContext(NodeKind.ARRAY_WRAPPER, 0, null, NodeRegistry.NO_ID);
        int b = registry.openContext(NodeKind.ARRAY_WRAPPER, 0, null, NodeRegistry.NO_ID);
        registry.incrementAttributeCounter(b);
        int child = registry.openContext(NodeKind.CONSTANT, 0, null, a);

        registry.reparent(child, b);

        assertTrue(registry.childIds(a).isEmpty());
        assertEquals(List.of(child), registry.childIds(b));
        assertEquals(1, registry.attributeIndex(child));
    }

    @Test
    void testRollbackForgetsNewerIds() {
        NodeRegistry registry = new NodeRegistry();
        int root = registry.openContext(NodeKind.ARRAY_WRAPPER, 0, null, NodeRegistry.NO_ID);
        int kept = registry.openContext(NodeKind.CONSTANT, 0, null, root);
        int idCounter = registry.idCounter();

        int dropped = registry.openContext(NodeKind.CSV, 0, null, root);
        int droppedChild = registry.openContext(NodeKind.CONSTANT, 0, null, dropped);
        registry.promote(droppedChild, comma(droppedChild));

        registry.rollback(idCounter);

        assertEquals(idCounter, registry.idCounter());
        assertEquals(List.of(kept), registry.childIds(root));
        assertTrue(registry.idsByKind(NodeKind.CSV).isEmpty());
        assertFalse(registry.leafIds().contains(droppedChild));
        assertThrows(InvariantException.class, () -> registry.slotState(droppedChild));
    }

    @Test
    void testEveryIdIsInExactlyOneState() {
        NodeRegistry registry = new NodeRegistry();
        int root = registry.openContext(NodeKind.ARRAY_WRAPPER, 0, null, NodeRegistry.NO_ID);
        int finished = registry.openContext(NodeKind.CONSTANT, 0, null, root);
        registry.promote(finished, comma(finished));
        int deleted = registry.openContext(NodeKind.CSV, 0, null, root);
        registry.deleteContext(deleted);
        registry.openContext(NodeKind.CSV, 0, null, root);

        Set<Integer> seen = new HashSet<>();
        int total = 0;
        for (NodeRegistry.SlotState state : NodeRegistry.SlotState.values()) {
            List<Integer> ids = registry.idsInState(state);
            total += ids.size();
            seen.addAll(ids);
        }
        assertEquals(registry.idCounter(), total);
        assertEquals(registry.idCounter(), seen.size());
        assertEquals(List.of(deleted), registry.idsInState(NodeRegistry.SlotState.DELETED));
    }
}
