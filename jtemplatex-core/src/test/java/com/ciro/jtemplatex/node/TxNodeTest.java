package com.ciro.jtemplatex.node;

import com.ciro.jtemplatex.layout.LayoutSlot;
import com.ciro.jtemplatex.style.Style;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.ciro.jtemplatex.testing.Trees.childIds;
import static com.ciro.jtemplatex.testing.Trees.container;
import static com.ciro.jtemplatex.testing.Trees.sameShape;
import static com.ciro.jtemplatex.testing.Trees.text;
import static com.ciro.jtemplatex.testing.Trees.view;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TxNodeTest {

    @Test
    void childrenKnowTheirParent() {
        TxNode a = text("a", "1");
        TxNode root = view("root", a);

        assertSame(root, a.parent());
        assertTrue(root.isRoot());
        assertFalse(a.isRoot());

        root.removeChild(a);
        assertNull(a.parent());
        assertEquals(0, root.childCount());
    }

    @Test
    void nodeCannotHaveTwoParents() {
        TxNode a = text("a", "1");
        view("one", a);

        assertThrows(IllegalStateException.class, () -> view("two", a));
    }

    @Test
    void insertAndMoveClampIndices() {
        TxNode root = view("root", text("a", "1"), text("b", "2"));

        assertEquals(2, root.insertChild(99, text("c", "3")));
        assertEquals(0, root.insertChild(-5, text("z", "0")));
        assertEquals(List.of("z", "a", "b", "c"), childIds(root));

        root.moveChild(root.childAt(0), 10);
        assertEquals(List.of("a", "b", "c", "z"), childIds(root));
        assertEquals(-1, root.moveChild(text("ajeno", "x"), 0));
    }

    @Test
    void walkIsPreOrder() {
        TxNode root = view("r", view("a", text("a1", ""), text("a2", "")), text("b", ""));
        List<String> seen = new ArrayList<>();
        root.walk(n -> seen.add(n.id()));

        assertEquals(List.of("r", "a", "a1", "a2", "b"), seen);
        assertEquals(5, root.subtreeSize());
        assertEquals("a2", root.find("a2").id());
        assertNull(root.find("nope"));
    }

    @Test
    void deepCopyIsIndependentAndDropsTransientState() {
        TxNode root = view("r", text("a", "1"));
        root.childAt(0).putBinding("text", "bound");
        root.childAt(0).setLayoutResult(new Frame(1, 2, 3, 4));
        root._attachView(new Object(), false);

        TxNode copy = root.deepCopy();

        assertTrue(sameShape(root, copy));
        assertNotSame(root.childAt(0), copy.childAt(0));
        assertSame(copy, copy.childAt(0).parent());
        assertNull(copy.viewHandle());
        assertEquals(new Frame(1, 2, 3, 4), copy.childAt(0).layoutResult());

        copy.childAt(0).putBinding("text", "otro");
        assertEquals("bound", root.childAt(0).binding("text"));
    }

    @Test
    void deepCopyDoesNotShareNestedCollections() {
        List<Object> tags = new ArrayList<>(List.of("a"));
        Map<String, Object> meta = new HashMap<>(Map.of("tags", tags));
        TxNode n = TxNode.builder("n", NodeKind.VIEW).binding("meta", meta).prop("items", tags).build();

        TxNode copy = n.deepCopy();
        tags.add("b");
        meta.put("extra", 1);

        assertEquals(Map.of("tags", List.of("a")), copy.binding("meta"));
        assertEquals(List.of("a"), copy.prop("items"));
    }

    @Test
    void bindingWinsOverStaticProp() {
        TxNode t = text("t", "estático");
        assertEquals("estático", t.resolved("text"));

        t.putBinding("text", "dinámico");
        assertEquals("dinámico", t.resolved("text"));
    }

    @Test
    void keyComesFromTheKeyBinding() {
        TxNode t = TxNode.builder("t", NodeKind.TEXT).binding(TxNode.KEY_BINDING, 42).build();

        assertEquals("42", t.key());
        assertNull(text("x", "").key());
    }

    @Test
    void flattenableOnlyForPlainNonRootContainers() {
        TxNode plain = container("plain");
        TxNode painted = TxNode.builder("painted", NodeKind.VIEW)
                .style(Style.builder().backgroundColor("#fff").build()).build();
        TxNode clickable = TxNode.builder("clickable", NodeKind.VIEW).event("onTap", "open").build();
        TxNode label = text("label", "x");
        TxNode root = view("root", plain, painted, clickable, label);

        assertFalse(root.isFlattenable());
        assertTrue(plain.isFlattenable());
        assertFalse(painted.isFlattenable());
        assertFalse(clickable.isFlattenable());
        assertFalse(label.isFlattenable());
    }

    @Test
    void layoutSlotCannotBeAssignedTwice() {
        TxNode n = text("n", "");
        n._assignLayoutSlot(new LayoutSlot(3, 1));

        assertThrows(IllegalStateException.class, () -> n._assignLayoutSlot(new LayoutSlot(4, 1)));
        n._clearLayoutSlot();
        n._assignLayoutSlot(new LayoutSlot(4, 1));
        assertEquals(4, n._layoutSlot().index());
    }

    @Test
    void kindsFromTypeNames() {
        assertEquals(NodeKind.TEXT, NodeKind.fromType("text"));
        assertEquals(NodeKind.UNKNOWN, NodeKind.fromType("carousel"));
        assertTrue(NodeKind.TEXT.isMeasured());
        assertFalse(NodeKind.VIEW.isMeasured());
    }
}
