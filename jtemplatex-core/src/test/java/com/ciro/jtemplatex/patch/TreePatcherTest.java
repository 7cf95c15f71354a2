package com.ciro.jtemplatex.patch;

import com.ciro.jtemplatex.diff.EditScript;
import com.ciro.jtemplatex.diff.TreeDiffer;
import com.ciro.jtemplatex.node.NodeKind;
import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.style.Style;
import com.ciro.jtemplatex.testing.Trees;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.ciro.jtemplatex.testing.Trees.childIds;
import static com.ciro.jtemplatex.testing.Trees.keyed;
import static com.ciro.jtemplatex.testing.Trees.text;
import static com.ciro.jtemplatex.testing.Trees.view;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TreePatcherTest {

    private final TreeDiffer differ = new TreeDiffer();

    private TxNode patch(TxNode oldTree, TxNode newTree) {
        TxNode live = oldTree.deepCopy();
        return TreePatcher.apply(differ.diff(oldTree, newTree), live).root();
    }

    @Test
    void patchedTreeMatchesTarget() {
        TxNode oldTree = view("root", text("a", "1"), text("b", "2"), view("box", text("c", "3")));
        TxNode newTree = view("root", view("box", text("c", "tres"), text("d", "4")), text("a", "1"));

        assertTrue(Trees.sameShape(newTree, patch(oldTree, newTree)));
    }

    @Test
    void patchKeepsMatchedNodeInstances() {
        TxNode live = view("root", text("a", "1"), text("b", "2"));
        TxNode a = live.childAt(0);
        TxNode newTree = view("root", text("b", "2"), text("a", "uno"));

        TreePatcher.Outcome out = TreePatcher.apply(differ.diff(live, newTree), live);

        assertSame(live, out.root());
        assertSame(a, out.root().childAt(1));
        assertEquals("uno", a.prop("text"));
        assertTrue(out.detached().isEmpty());
    }

    @Test
    void insertedSubtreesAreCopies() {
        TxNode inserted = text("new", "x");
        TxNode live = view("root");
        TxNode target = view("root", inserted);

        TxNode root = TreePatcher.apply(differ.diff(live, target), live).root();

        assertNotSame(inserted, root.childAt(0));
        assertSame(target, inserted.parent());
    }

    @Test
    void deletedSubtreesAreReported() {
        TxNode live = view("root", view("gone", text("inner", "x")), text("kept", "y"));

        TreePatcher.Outcome out = TreePatcher.apply(differ.diff(live, view("root", text("kept", "y"))), live);

        assertEquals(1, out.detached().size());
        assertEquals("gone", out.detached().get(0).id());
        assertNull(out.detached().get(0).parent());
        assertEquals(List.of("kept"), childIds(out.root()));
    }

    @Test
    void rootReplaceKeepsPreviousRoot() {
        TxNode live = view("root", text("a", "1"));
        TxNode target = TxNode.builder("root", NodeKind.SCROLL).child(text("a", "1")).build();

        TreePatcher.Outcome out = TreePatcher.apply(differ.diff(live, target), live);

        assertSame(live, out.previousRoot());
        assertEquals(NodeKind.SCROLL, out.root().kind());
        assertEquals(1, out.applied());
    }

    @Test
    void operationsAfterRekeyStillUseOldId() {
        // el padre cambia de id por key; el insert y el delete de sus hijos siguen apuntando al id viejo
        TxNode oldTree = view("list", TxNode.builder("a", NodeKind.VIEW).binding(TxNode.KEY_BINDING, "k")
                .child(text("t1", "1")).child(text("t2", "2")).build());
        TxNode newTree = view("list", TxNode.builder("b", NodeKind.VIEW).binding(TxNode.KEY_BINDING, "k")
                .child(text("t1", "1")).child(text("t3", "3")).build());

        TxNode root = patch(oldTree, newTree);

        assertTrue(Trees.sameShape(newTree, root));
        assertEquals("b", root.childAt(0).id());
    }

    @Test
    void skipsOperationsOnMissingNodes() {
        TxNode oldTree = view("root", text("a", "1"));
        EditScript script = differ.diff(oldTree, view("root"));

        TreePatcher.Outcome out = TreePatcher.apply(script, view("root", text("other", "x")));

        assertEquals(0, out.applied());
    }

    @Test
    void styleAndBindingsAreApplied() {
        Style bold = Style.builder().fontWeight("bold").build();
        TxNode oldTree = view("root", TxNode.builder("t", NodeKind.TEXT).binding("title", "A").binding("stale", 1).build());
        TxNode newTree = view("root", TxNode.builder("t", NodeKind.TEXT).binding("title", "B").style(bold).build());

        TxNode t = patch(oldTree, newTree).childAt(0);

        assertEquals(bold, t.style());
        assertEquals("B", t.binding("title"));
        assertFalse(t.bindings().containsKey("stale"));
    }

    @Test
    void anyPropChangeConvergesAfterOnePatch() {
        TxNode oldTree = view("root",
                TxNode.builder("t", NodeKind.TEXT).prop("text", "a").prop("maxLines", 1).prop("legacy", true).build(),
                TxNode.builder("box", NodeKind.VIEW).prop("tag", "x").build());
        TxNode newTree = view("root",
                TxNode.builder("t", NodeKind.TEXT).prop("text", "a").prop("maxLines", 2).build(),
                TxNode.builder("box", NodeKind.VIEW).prop("tag", "y").build());
        TxNode live = oldTree.deepCopy();

        TxNode patched = TreePatcher.apply(differ.diff(oldTree, newTree), live).root();

        assertEquals(2, patched.childAt(0).prop("maxLines"));
        assertFalse(patched.childAt(0).props().containsKey("legacy"));
        assertEquals("y", patched.childAt(1).prop("tag"));
        assertTrue(Trees.sameShape(newTree, patched));
        assertFalse(differ.diff(patched, newTree).hasDiff());
    }

    /** 🔥 Listas grandes con keys: borrados, altas, reordenamientos y cambios de texto al azar. */
    @RepeatedTest(25)
    void randomizedKeyedListsConverge(RepetitionInfo info) {
        Random rnd = new Random(7919L * info.getCurrentRepetition());
        int nextKey = 0;

        List<Integer> oldKeys = new ArrayList<>();
        for (int i = 0; i < 40 + rnd.nextInt(60); i++) oldKeys.add(nextKey++);
        TxNode oldTree = list(oldKeys, rnd, 0);

        List<Integer> newKeys = new ArrayList<>();
        for (Integer k : oldKeys) {
            if (rnd.nextInt(4) != 0) newKeys.add(k);
        }
        int extra = rnd.nextInt(20);
        for (int i = 0; i < extra; i++) {
            newKeys.add(rnd.nextInt(newKeys.size() + 1), nextKey++);
        }
        for (int i = 0; i < 5; i++) {
            int from = rnd.nextInt(newKeys.size());
            newKeys.add(rnd.nextInt(newKeys.size()), newKeys.remove(from));
        }
        if (rnd.nextBoolean()) Collections.shuffle(newKeys, rnd);
        TxNode newTree = list(newKeys, rnd, 3);

        TxNode patched = patch(oldTree, newTree);

        assertTrue(Trees.sameShape(newTree, patched), "repetición " + info.getCurrentRepetition());
    }

    private static TxNode list(List<Integer> keys, Random rnd, int textVariants) {
        TxNode root = view("feed");
        for (Integer k : keys) {
            String label = "label-" + k + (textVariants > 0 && rnd.nextInt(textVariants) == 0 ? "*" : "");
            root.addChild(TxNode.builder("row-" + k, NodeKind.VIEW)
                    .binding(TxNode.KEY_BINDING, String.valueOf(k))
                    .child(text("text-" + k, label))
                    .build());
        }
        return root;
    }

    @Test
    void keyedSwapOfNeighbours() {
        TxNode oldTree = view("l", keyed("a", "1"), keyed("b", "2"), keyed("c", "3"), keyed("d", "4"));
        TxNode newTree = view("l", keyed("a", "1"), keyed("c", "3"), keyed("b", "2"), keyed("d", "4"));

        TxNode patched = patch(oldTree, newTree);

        assertEquals(List.of("a", "c", "b", "d"), childIds(patched));
    }
}
