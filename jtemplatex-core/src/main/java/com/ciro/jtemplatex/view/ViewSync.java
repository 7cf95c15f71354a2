package com.ciro.jtemplatex.view;

import com.ciro.jtemplatex.config.RenderConfig;
import com.ciro.jtemplatex.error.RenderFailure;
import com.ciro.jtemplatex.node.Frame;
import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.spi.RecyclePool;
import com.ciro.jtemplatex.spi.ViewHost;
import com.ciro.jtemplatex.spi.WidgetMaterializer;
import com.ciro.jtemplatex.spi.WidgetRegistry;
import com.ciro.jtemplatex.style.Display;
import com.ciro.jtemplatex.style.Style;
import com.ciro.jtemplatex.style.Visibility;
import com.ciro.jtemplatex.thread.UiThread;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Puente entre el árbol de nodos y las vistas del toolkit. Todo aquí corre en el hilo UI.
 * <p>
 * Los nodos aplanados no tienen vista: las vistas de sus hijos cuelgan del ancestro
 * más cercano que sí tiene. {@link #syncTree(TxNode)} deja la jerarquía de vistas igual
 * al árbol (crea las que faltan, suelta las de nodos que pasaron a ser aplanables,
 * reordena hijos) sin asumir nada de cómo se llegó al árbol actual.
 */
public final class ViewSync {

    private static final Logger log = LoggerFactory.getLogger(ViewSync.class);

    private final WidgetRegistry widgets;
    private final ViewHost host;
    private final RecyclePool recyclePool;
    private final UiThread ui;
    private final RenderConfig config;

    public ViewSync(WidgetRegistry widgets, ViewHost host, RecyclePool recyclePool, UiThread ui, RenderConfig config) {
        this.widgets = widgets;
        this.host = host;
        this.recyclePool = recyclePool;
        this.ui = ui;
        this.config = config;
    }

    public ViewHost host() {
        return host;
    }

    // ---------------------------------------------------------------------
    // Materialización
    // ---------------------------------------------------------------------

    /**
     * Crea (o saca del pool) la vista del nodo. No toca hijos ni jerarquía.
     *
     * @return la vista, o null si el nodo es aplanable
     */
    public Object materialize(TxNode node) {
        if (!ui.check("materialize")) return null;
        if (node.isFlattenable()) return null;
        if (node.viewHandle() != null) return node.viewHandle();

        if (recycling()) {
            Object recycled = recyclePool.dequeue(node.kind());
            if (recycled != null) {
                node._attachView(recycled, false);
                node._markForceApply();
                return recycled;
            }
        }

        Optional<WidgetMaterializer> materializer = widgets.find(node.kind());
        if (materializer.isEmpty()) {
            return attachPlaceholder(node, "tipo desconocido '" + node.typeName() + "'");
        }
        try {
            Object view = materializer.get().create(node);
            if (view == null) return attachPlaceholder(node, "el materializador devolvió null");
            node._attachView(view, false);
            return view;
        } catch (RuntimeException e) {
            log.warn("{} en '{}' ({}): {}", RenderFailure.MATERIALIZE_FAILED, node.id(), node.typeName(), e.toString());
            return attachPlaceholder(node, e.getMessage());
        }
    }

    private Object attachPlaceholder(TxNode node, String reason) {
        Object placeholder = host.createPlaceholder(node, reason);
        // En producción: vista vacía y oculta. En debug se ve el placeholder.
        if (!config.debugMode()) host.setHidden(placeholder, true);
        else log.debug("Placeholder para '{}': {}", node.id(), reason);
        node._attachView(placeholder, true);
        return placeholder;
    }

    /**
     * Cuelga la vista del nodo al final del ancestro con vista más cercano. Sirve para la
     * construcción en pre-orden del pipeline, donde "al final" es la posición correcta.
     */
    public void attach(TxNode node) {
        if (!ui.check("attach")) return;
        Object view = node.viewHandle();
        if (view == null) return;
        Object container = containerViewOf(node);
        if (container == null) return;
        if (host.parentOf(view) == container) return;
        host.insertChild(container, view, host.childCount(container));
    }

    private static Object containerViewOf(TxNode node) {
        for (TxNode p = node.parent(); p != null; p = p.parent()) {
            if (p.viewHandle() != null) return p.viewHandle();
        }
        return null;
    }

    /**
     * Materializa y monta un árbol completo. Devuelve la vista raíz.
     */
    public Object mount(TxNode root) {
        if (!ui.check("mount")) return null;
        syncTree(root);
        applyFrames(root);
        updateViews(root);
        return root.viewHandle();
    }

    // ---------------------------------------------------------------------
    // Reconciliación de jerarquía
    // ---------------------------------------------------------------------

    /**
     * Deja la jerarquía de vistas igual al árbol. Idempotente.
     */
    public void syncTree(TxNode root) {
        if (!ui.check("syncTree")) return;
        Deque<TxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TxNode node = stack.pop();
            if (node.isFlattenable()) {
                if (node.viewHandle() != null) releaseView(node);
            } else if (node.viewHandle() == null) {
                materialize(node);
            }
            for (int i = node.childCount() - 1; i >= 0; i--) stack.push(node.childAt(i));
        }

        stack.push(root);
        while (!stack.isEmpty()) {
            TxNode node = stack.pop();
            if (node.viewHandle() != null) reorderChildren(node);
            for (int i = node.childCount() - 1; i >= 0; i--) stack.push(node.childAt(i));
        }
    }

    private void reorderChildren(TxNode node) {
        Object view = node.viewHandle();
        List<Object> desired = new ArrayList<>();
        collectChildViews(node, desired);

        for (int i = 0; i < desired.size(); i++) {
            Object child = desired.get(i);
            if (i >= host.childCount(view) || host.childAt(view, i) != child) {
                host.insertChild(view, child, i);
            }
        }
        // lo que sobra son vistas que ya no corresponden a ningún hijo
        while (host.childCount(view) > desired.size()) {
            host.removeFromParent(host.childAt(view, desired.size()));
        }
    }

    /** Vistas hijas en orden, atravesando los nodos aplanados. */
    private static void collectChildViews(TxNode node, List<Object> out) {
        for (TxNode c : node.children()) {
            if (c.viewHandle() != null) out.add(c.viewHandle());
            else if (c.isFlattenable()) collectChildViews(c, out);
        }
    }

    // ---------------------------------------------------------------------
    // Frames y propiedades
    // ---------------------------------------------------------------------

    public void applyFrame(TxNode node) {
        if (!ui.check("applyFrame")) return;
        Object view = node.viewHandle();
        if (view == null) return;
        Frame f = node.layoutResult();
        if (node._forceApply() || !f.equals(node._lastAppliedFrame())) {
            host.setFrame(view, f);
            node._rememberAppliedFrame(f);
        }
    }

    public void applyFrames(TxNode root) {
        root.walk(this::applyFrame);
    }

    /**
     * Aplica display/visibility/opacidad si el estilo cambió y deja que el materializador
     * copie el contenido del tipo. Limpia el forceApply.
     */
    public void updateView(TxNode node) {
        if (!ui.check("updateView")) return;
        Object view = node.viewHandle();
        if (view == null) return;
        if (node.isPlaceholderView()) {
            node._clearForceApply();
            return;
        }

        Style s = node.style();
        if (node._forceApply() || !s.equals(node._lastAppliedStyle())) {
            host.setHidden(view, s.display() == Display.NONE);
            host.setAlpha(view, s.visibility() == Visibility.HIDDEN ? 0f : s.opacity());
            node._rememberAppliedStyle(s);
        }
        widgets.find(node.kind()).ifPresent(m -> m.update(view, node));
        node._clearForceApply();
    }

    public void updateViews(TxNode root) {
        root.walk(this::updateView);
    }

    // ---------------------------------------------------------------------
    // Liberación
    // ---------------------------------------------------------------------

    /**
     * Suelta todas las vistas de un subárbol (que ya salió del árbol vivo): las separa
     * y, si el reciclaje está activo, las entrega al pool.
     */
    public void release(TxNode subtree) {
        if (!ui.check("release")) return;
        List<TxNode> nodes = new ArrayList<>();
        subtree.walk(nodes::add);
        // post-orden: hojas primero
        for (int i = nodes.size() - 1; i >= 0; i--) {
            TxNode n = nodes.get(i);
            if (n.viewHandle() != null) releaseView(n);
        }
    }

    private void releaseView(TxNode node) {
        Object view = node.viewHandle();
        host.removeFromParent(view);
        // hijos de un nodo que pasó a aplanable: reorderChildren los recoloca después
        while (host.childCount(view) > 0) host.removeFromParent(host.childAt(view, 0));
        if (recycling() && !node.isPlaceholderView()) {
            recyclePool.recycle(node);
        }
        node._detachView();
    }

    /**
     * Replace de la raíz: suelta el árbol viejo, materializa el nuevo y pone su vista
     * donde estaba la vieja dentro del contenedor del host (si lo había).
     */
    public void replaceRoot(TxNode oldRoot, TxNode newRoot) {
        if (!ui.check("replaceRoot")) return;
        Object oldView = oldRoot.viewHandle();
        Object parent = oldView == null ? null : host.parentOf(oldView);
        int index = parent == null ? -1 : indexIn(parent, oldView);

        release(oldRoot);
        syncTree(newRoot);

        if (parent != null && newRoot.viewHandle() != null) {
            host.insertChild(parent, newRoot.viewHandle(), Math.max(index, 0));
        }
    }

    private int indexIn(Object parent, Object child) {
        int n = host.childCount(parent);
        for (int i = 0; i < n; i++) {
            if (host.childAt(parent, i) == child) return i;
        }
        return -1;
    }

    private boolean recycling() {
        return recyclePool != null && config.enableViewRecycling();
    }
}
