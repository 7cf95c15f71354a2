package com.ciro.jtemplatex.testing;

import com.ciro.jtemplatex.layout.LayoutEngine;
import com.ciro.jtemplatex.node.Frame;
import com.ciro.jtemplatex.node.Size;
import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.style.Dimension;
import com.ciro.jtemplatex.style.Display;
import com.ciro.jtemplatex.style.Edges;
import com.ciro.jtemplatex.style.Style;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Layout determinista para tests: todo en columna, ancho del padre salvo width en
 * puntos, hojas de {@link #LEAF_HEIGHT} y contenedores con la suma de sus hijos.
 */
public final class StackLayoutEngine implements LayoutEngine {

    public static final float LEAF_HEIGHT = 20f;

    private final AtomicInteger calls = new AtomicInteger();

    @Override
    public Map<String, Frame> computeLayout(TxNode root, Size containerSize) {
        calls.incrementAndGet();
        Map<String, Frame> out = new HashMap<>();
        if (root == null) return out;
        float width = containerSize != null && containerSize.isWidthDefined() ? containerSize.width() : 100f;
        layout(root, 0, 0, width, out);
        return out;
    }

    private float layout(TxNode node, float x, float y, float available, Map<String, Frame> out) {
        Style s = node.style();
        if (s.display() == Display.NONE) {
            out.put(node.id(), new Frame(x, y, 0, 0));
            return 0;
        }
        float width = points(s.width()) ? s.width().value() : available;
        Edges p = s.padding();
        float height;
        if (node.childCount() == 0) {
            height = points(s.height()) ? s.height().value() : LEAF_HEIGHT;
        } else {
            float cy = p.top();
            for (TxNode c : node.children()) {
                cy += layout(c, p.left(), cy, width - p.horizontal(), out);
            }
            height = points(s.height()) ? s.height().value() : cy + p.bottom();
        }
        out.put(node.id(), new Frame(x, y, width, height));
        return height;
    }

    private static boolean points(Dimension d) {
        return d.unit() == Dimension.Unit.POINT;
    }

    public int calls() {
        return calls.get();
    }
}
