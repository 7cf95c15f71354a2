package com.ciro.jtemplatex.layout;

import com.ciro.jtemplatex.node.Frame;
import com.ciro.jtemplatex.node.TxNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

/**
 * Vuelca el mapa id → frame del layout sobre el árbol, plegando el offset de los
 * nodos aplanados.
 * <p>
 * Un nodo aplanado conserva su frame tal cual lo reportó el solver (sólo sirve para
 * propagar el offset) y pasa a sus hijos offset + su origen. Un nodo con vista suma el
 * offset acumulado a su propio frame, que queda relativo al ancestro con vista.
 */
public final class LayoutResults {

    private LayoutResults() {}

    private record Pending(TxNode node, float dx, float dy) {}

    /**
     * Nodos sin entrada en el mapa (layout fallido) quedan con {@link Frame#ZERO}.
     */
    public static void apply(TxNode root, Map<String, Frame> frames) {
        if (root == null) return;
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(root, 0, 0));
        while (!stack.isEmpty()) {
            Pending p = stack.pop();
            TxNode node = p.node();
            Frame raw = frames.getOrDefault(node.id(), Frame.ZERO);

            float childDx;
            float childDy;
            if (node.isFlattenable()) {
                node.setLayoutResult(raw);
                childDx = p.dx() + raw.x();
                childDy = p.dy() + raw.y();
            } else {
                node.setLayoutResult(raw.offset(p.dx(), p.dy()));
                childDx = 0;
                childDy = 0;
            }
            for (int i = node.childCount() - 1; i >= 0; i--) {
                stack.push(new Pending(node.childAt(i), childDx, childDy));
            }
        }
    }
}
