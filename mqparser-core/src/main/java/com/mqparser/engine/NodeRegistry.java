package com.mqparser.engine;

import com.mqparser.ast.Node;
import com.mqparser.ast.NodeKind;
import com.mqparser.error.InvariantException;
import com.mqparser.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Arena of every node created during a parse, open or finished, indexed by id.
 * <p>
 * Ids start at 1 and are handed out in order. A slot never changes id: promotion turns an open
 * context into a finished node in place. Parent and child edges are kept symmetric, and every
 * allocated id is in exactly one of the open, finished or deleted states.
 * <p>
 * Not thread safe.
 */
public final class NodeRegistry {

    public static final int NO_ID = 0;

    public enum SlotState {
        OPEN,
        FINISHED,
        DELETED
    }

    /**
     * Read-only view of an open context.
     *
     * @param tokenStart     first token of the context, null when opened at the end of the stream
     * @param attributeIndex position inside the parent, -1 for a parentless context
     */
    public record ContextNode(
        int id,
        NodeKind kind,
        int tokenIndexStart,
        Token tokenStart,  // Can be null
        int attributeCounter,
        int attributeIndex
    ) {
    }

    private static final class Slot {
        NodeKind kind;
        int tokenIndexStart;
        Token tokenStart;
        int attributeCounter;
        int attributeIndex = -1;
        int parentId = NO_ID;
        final List<Integer> childIds = new ArrayList<>();
        SlotState state = SlotState.OPEN;
        Node node;
    }

    private final List<Slot> slots = new ArrayList<>();
    private final Map<NodeKind, NavigableSet<Integer>> idsByKind = new EnumMap<>(NodeKind.class);
    private final NavigableSet<Integer> leafIds = new TreeSet<>();
    private int rootId = NO_ID;

    // ========================================================================
    // Mutation
    // ========================================================================

    /**
     * Opens a context under {@code parentId} (or parentless for {@link #NO_ID}).
     * The first parentless context becomes the root.
     */
    public int openContext(NodeKind kind, int tokenIndexStart, Token tokenStart, int parentId) {
        Slot slot = new Slot();
        slot.kind = kind;
        slot.tokenIndexStart = tokenIndexStart;
        slot.tokenStart = tokenStart;
        slots.add(slot);
        int id = slots.size();

        if (parentId != NO_ID) {
            attachChild(parentId, id);
        } else if (rootId == NO_ID) {
            rootId = id;
        }
        indexKind(kind, id);
        return id;
    }

    /**
     * Opens a context that takes over the place of {@code existingId} in its parent, then adopts
     * the existing node as its first child.
     */
    public int openContextAsParent(NodeKind kind, int existingId) {
        Slot existing = live(existingId);

        Slot slot = new Slot();
        slot.kind = kind;
        slot.tokenIndexStart = tokenIndexStartOf(existing);
        slot.tokenStart = existing.tokenStart;
        slot.parentId = existing.parentId;
        slot.attributeIndex = existing.attributeIndex;
        slots.add(slot);
        int id = slots.size();

        if (existing.parentId != NO_ID) {
            List<Integer> siblings = live(existing.parentId).childIds;
            siblings.set(siblings.indexOf(existingId), id);
        }
        if (rootId == existingId) {
            rootId = id;
        }

        existing.parentId = id;
        existing.attributeIndex = 0;
        slot.childIds.add(existingId);
        slot.attributeCounter = 1;
        indexKind(kind, id);
        return id;
    }

    public void attachChild(int parentId, int childId) {
        Slot parent = live(parentId);
        Slot child = live(childId);
        if (child.parentId != NO_ID) {
            throw new InvariantException("Node " + childId + " already has parent " + child.parentId);
        }
        child.parentId = parentId;
        child.attributeIndex = parent.attributeCounter++;
        parent.childIds.add(childId);
    }

    /**
     * Moves a node under a new parent as its next attribute. The old parent's counter is left as is.
     */
    public void reparent(int childId, int newParentId) {
        detach(childId);
        attachChild(newParentId, childId);
    }

    /**
     * Removes the parent edge of a node. The node keeps its state.
     */
    public void detach(int id) {
        Slot slot = live(id);
        if (slot.parentId != NO_ID) {
            live(slot.parentId).childIds.remove(Integer.valueOf(id));
            slot.parentId = NO_ID;
            slot.attributeIndex = -1;
        }
    }

    public void promote(int id, Node node) {
        Slot slot = live(id);
        if (slot.state != SlotState.OPEN) {
            throw new InvariantException("Cannot promote node " + id + " in state " + slot.state);
        }
        if (node.id() != id) {
            throw new InvariantException("Promoted node has id " + node.id() + " but the context is " + id);
        }
        if (node.kind() != slot.kind) {
            unindexKind(slot.kind, id);
            slot.kind = node.kind();
            indexKind(slot.kind, id);
        }
        slot.state = SlotState.FINISHED;
        slot.node = node;
        if (node.isLeaf()) {
            leafIds.add(id);
        }
    }

    /**
     * Removes an open context, letting its only child (if any) take its place and attribute index.
     * With no child, the parent's attribute counter is given back.
     */
    public void deleteContext(int id) {
        Slot slot = live(id);
        if (slot.state != SlotState.OPEN) {
            throw new InvariantException("Cannot delete node " + id + " in state " + slot.state);
        }
        if (slot.childIds.size() > 1) {
            throw new InvariantException("Cannot unwrap node " + id + " with " + slot.childIds.size() + " children");
        }

        if (slot.childIds.isEmpty()) {
            if (slot.parentId != NO_ID) {
                Slot parent = live(slot.parentId);
                parent.childIds.remove(Integer.valueOf(id));
                parent.attributeCounter--;
            }
            if (rootId == id) {
                rootId = NO_ID;
            }
        } else {
            int childId = slot.childIds.get(0);
            Slot child = live(childId);
            child.parentId = slot.parentId;
            child.attributeIndex = slot.attributeIndex;
            if (slot.parentId != NO_ID) {
                List<Integer> siblings = live(slot.parentId).childIds;
                siblings.set(siblings.indexOf(id), childId);
            }
            if (rootId == id) {
                rootId = childId;
            }
        }

        slot.childIds.clear();
        slot.parentId = NO_ID;
        markDeleted(id, slot);
    }

    /**
     * Removes a node and everything below it.
     */
    public void deleteSubtree(int id) {
        Slot slot = live(id);
        if (slot.parentId != NO_ID) {
            live(slot.parentId).childIds.remove(Integer.valueOf(id));
            slot.parentId = NO_ID;
        }
        if (rootId == id) {
            rootId = NO_ID;
        }
        deleteDescendants(id, slot);
    }

    public void incrementAttributeCounter(int id) {
        live(id).attributeCounter++;
    }

    void setAttributeCounter(int id, int attributeCounter) {
        live(id).attributeCounter = attributeCounter;
    }

    /**
     * Forgets every id above {@code idCounter}, unlinking them from surviving parents.
     */
    void rollback(int idCounter) {
        for (int id = slots.size(); id > idCounter; id--) {
            Slot slot = slots.get(id - 1);
            if (slot.parentId != NO_ID && slot.parentId <= idCounter) {
                slots.get(slot.parentId - 1).childIds.remove(Integer.valueOf(id));
            }
            if (slot.state != SlotState.DELETED) {
                unindexKind(slot.kind, id);
            }
            leafIds.remove(id);
            slots.remove(id - 1);
        }
        if (rootId > idCounter) {
            rootId = NO_ID;
        }
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * @return the finished node, or null when the id is open or deleted
     */
    public Node astNode(int id) {
        Slot slot = slot(id);
        return slot.state == SlotState.FINISHED ? slot.node : null;
    }

    /**
     * @return the open context, or null when the id is finished or deleted
     */
    public ContextNode contextNode(int id) {
        Slot slot = slot(id);
        if (slot.state != SlotState.OPEN) {
            return null;
        }
        return new ContextNode(id, slot.kind, slot.tokenIndexStart, slot.tokenStart, slot.attributeCounter,
            slot.attributeIndex);
    }

    public SlotState slotState(int id) {
        return slot(id).state;
    }

    public NodeKind kind(int id) {
        return slot(id).kind;
    }

    public int attributeIndex(int id) {
        return slot(id).attributeIndex;
    }

    public int attributeCounter(int id) {
        return slot(id).attributeCounter;
    }

    public int parentId(int id) {
        return slot(id).parentId;
    }

    public List<Integer> childIds(int id) {
        return Collections.unmodifiableList(new ArrayList<>(slot(id).childIds));
    }

    public Set<Integer> idsByKind(NodeKind kind) {
        NavigableSet<Integer> ids = idsByKind.get(kind);
        return ids == null ? Set.of() : Collections.unmodifiableSet(ids);
    }

    public Set<Integer> leafIds() {
        return Collections.unmodifiableSet(leafIds);
    }

    public int rootId() {
        return rootId;
    }

    /**
     * The highest id handed out so far.
     */
    public int idCounter() {
        return slots.size();
    }

    public List<Integer> idsInState(SlotState state) {
        List<Integer> ids = new ArrayList<>();
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).state == state) {
                ids.add(i + 1);
            }
        }
        return ids;
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    int tokenIndexStart(int id) {
        return slot(id).tokenIndexStart;
    }

    Token tokenStart(int id) {
        return slot(id).tokenStart;
    }

    // ========================================================================
    // Internals
    // ========================================================================

    private void deleteDescendants(int id, Slot slot) {
        for (int childId : slot.childIds) {
            Slot child = slots.get(childId - 1);
            child.parentId = NO_ID;
            deleteDescendants(childId, child);
        }
        slot.childIds.clear();
        markDeleted(id, slot);
    }

    private void markDeleted(int id, Slot slot) {
        unindexKind(slot.kind, id);
        leafIds.remove(id);
        slot.state = SlotState.DELETED;
        slot.node = null;
    }

    private int tokenIndexStartOf(Slot slot) {
        return slot.node != null ? slot.node.tokenRange().tokenIndexStart() : slot.tokenIndexStart;
    }

    private void indexKind(NodeKind kind, int id) {
        idsByKind.computeIfAbsent(kind, k -> new TreeSet<>()).add(id);
    }

    private void unindexKind(NodeKind kind, int id) {
        NavigableSet<Integer> ids = idsByKind.get(kind);
        if (ids != null) {
            ids.remove(id);
            if (ids.isEmpty()) {
                idsByKind.remove(kind);
            }
        }
    }

    private Slot slot(int id) {
        if (id < 1 || id > slots.size()) {
            throw new InvariantException("Unknown node id " + id);
        }
        return slots.get(id - 1);
    }

    private Slot live(int id) {
        Slot slot = slot(id);
        if (slot.state == SlotState.DELETED) {
            throw new InvariantException("Node " + id + " was deleted");
        }
        return slot;
    }
}
