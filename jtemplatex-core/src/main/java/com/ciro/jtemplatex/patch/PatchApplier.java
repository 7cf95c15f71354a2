package com.ciro.jtemplatex.patch;

import com.ciro.jtemplatex.diff.EditScript;
import com.ciro.jtemplatex.layout.LayoutEngine;
import com.ciro.jtemplatex.layout.LayoutResults;
import com.ciro.jtemplatex.node.Frame;
import com.ciro.jtemplatex.node.Size;
import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.thread.UiThread;
import com.ciro.jtemplatex.view.ViewSync;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Aplica un edit script al árbol vivo y a sus vistas, y vuelve a calcular el layout.
 * Hilo UI.
 */
public final class PatchApplier {

    private static final Logger log = LoggerFactory.getLogger(PatchApplier.class);

    private final LayoutEngine layout;
    private final ViewSync views;
    private final UiThread ui;

    public PatchApplier(LayoutEngine layout, ViewSync views, UiThread ui) {
        this.layout = layout;
        this.views = views;
        this.ui = ui;
    }

    /**
     * @return operaciones aplicadas
     */
    public int apply(EditScript script, LiveTree tree, Size containerSize) {
        if (!ui.check("patch")) return 0;
        if (script == null || !script.hasDiff()) return 0;

        long t0 = System.nanoTime();
        TreePatcher.Outcome out = TreePatcher.apply(script, tree.root());

        for (TxNode d : out.detached()) views.release(d);
        if (out.previousRoot() != null) {
            if (out.root() != null) views.replaceRoot(out.previousRoot(), out.root());
            else views.release(out.previousRoot());
        }
        tree.setRoot(out.root());
        tree.setContainerSize(containerSize);

        relayout(tree);

        if (log.isDebugEnabled()) {
            log.debug("Patch {}: {}/{} ops en {} µs", script.statistics(), out.applied(),
                    script.operationCount(), (System.nanoTime() - t0) / 1_000);
        }
        return out.applied();
    }

    /**
     * Camino rápido: el llamador garantiza que {@code bound} tiene la misma forma que el
     * árbol vivo. Se copian los bindings nodo a nodo sin diff. La forma no se verifica.
     */
    public void quickUpdate(LiveTree tree, TxNode bound, Size containerSize) {
        if (!ui.check("quickUpdate")) return;
        TxNode live = tree.root();
        if (live == null || bound == null) return;
        copyBindings(live, bound);
        tree.setContainerSize(containerSize);
        relayout(tree);
    }

    private static void copyBindings(TxNode live, TxNode bound) {
        live.clearBindings();
        bound.bindings().forEach(live::putBinding);
        List<TxNode> lc = live.children();
        List<TxNode> bc = bound.children();
        int n = Math.min(lc.size(), bc.size());
        for (int i = 0; i < n; i++) {
            copyBindings(lc.get(i), bc.get(i));
        }
    }

    /** Layout sobre el árbol vivo (ya mutado), frames, jerarquía y propiedades de vistas. */
    public void relayout(LiveTree tree) {
        TxNode root = tree.root();
        if (root == null) return;
        Map<String, Frame> frames = layout.computeLayout(root, tree.containerSize());
        LayoutResults.apply(root, frames);
        views.syncTree(root);
        views.applyFrames(root);
        views.updateViews(root);
    }
}
