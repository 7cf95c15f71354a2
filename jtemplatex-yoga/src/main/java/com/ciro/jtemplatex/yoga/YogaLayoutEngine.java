package com.ciro.jtemplatex.yoga;

import com.ciro.jtemplatex.config.RenderConfig;
import com.ciro.jtemplatex.error.RenderFailure;
import com.ciro.jtemplatex.layout.ContentMeasurer;
import com.ciro.jtemplatex.layout.LayoutEngine;
import com.ciro.jtemplatex.layout.LayoutSlot;
import com.ciro.jtemplatex.node.Frame;
import com.ciro.jtemplatex.node.NodeKind;
import com.ciro.jtemplatex.node.Size;
import com.ciro.jtemplatex.node.TxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.lwjgl.util.yoga.Yoga.*;

/**
 * Layout flexbox con Yoga. Por cada pase: un nodo del pool por nodo del árbol, estilo
 * copiado, medidor en las hojas de texto/botón/input, cálculo, lectura de frames y
 * devolución de todos los nodos al pool (también si algo falla).
 * <p>
 * Thread-safe: varios árboles distintos pueden calcularse a la vez. El mismo árbol
 * no (el slot asignado lo detecta).
 */
public final class YogaLayoutEngine implements LayoutEngine, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(YogaLayoutEngine.class);

    private final LayoutNodePool pool;
    private final boolean ownsPool;
    private final Map<NodeKind, ContentMeasurer> measurers;
    private final YogaMeasureBridge measures = new YogaMeasureBridge();

    public YogaLayoutEngine(LayoutNodePool pool, Map<NodeKind, ContentMeasurer> measurers) {
        this(pool, measurers, false);
    }

    private YogaLayoutEngine(LayoutNodePool pool, Map<NodeKind, ContentMeasurer> measurers, boolean ownsPool) {
        this.pool = pool;
        this.ownsPool = ownsPool;
        EnumMap<NodeKind, ContentMeasurer> m = new EnumMap<>(NodeKind.class);
        if (measurers != null) m.putAll(measurers);
        this.measurers = Collections.unmodifiableMap(m);
    }

    /** Motor con pool propio dimensionado según la configuración. */
    public static YogaLayoutEngine create(RenderConfig config, Map<NodeKind, ContentMeasurer> measurers) {
        return new YogaLayoutEngine(new LayoutNodePool(config.layoutPoolMaxIdle()), measurers, true);
    }

    public LayoutNodePool pool() {
        return pool;
    }

    @Override
    public Map<String, Frame> computeLayout(TxNode root, Size containerSize) {
        if (root == null) return Map.of();

        List<TxNode> nodes = new ArrayList<>();
        root.walk(nodes::add);

        Set<String> seen = new HashSet<>();
        for (TxNode n : nodes) {
            if (!seen.add(n.id())) {
                log.warn("⚠️ {}: id duplicado '{}' en el árbol de '{}'", RenderFailure.LAYOUT_FAILED, n.id(), root.id());
                return Map.of();
            }
        }

        List<TxNode> built = new ArrayList<>(nodes.size());
        try {
            for (TxNode n : nodes) {
                LayoutSlot slot = pool.acquire();
                try {
                    n._assignLayoutSlot(slot);
                } catch (IllegalStateException e) {
                    pool.release(slot);
                    throw e;
                }
                built.add(n);
                long h = pool.handle(slot);

                TxNode parent = n.parent();
                if (n != root && parent != null) {
                    long ph = pool.handle(parent._layoutSlot());
                    YGNodeInsertChild(ph, h, YGNodeGetChildCount(ph));
                }
                YogaStyleMapper.apply(h, n.style());

                if (n.childCount() == 0 && n.kind().isMeasured()) {
                    ContentMeasurer m = measurers.get(n.kind());
                    if (m != null) measures.attach(h, n, m);
                }
            }

            float w = containerSize == null ? Float.NaN : containerSize.width();
            float hgt = containerSize == null ? Float.NaN : containerSize.height();
            YGNodeCalculateLayout(pool.handle(root._layoutSlot()), w, hgt, YGDirectionLTR);

            Map<String, Frame> frames = new HashMap<>(nodes.size() * 2);
            for (TxNode n : nodes) {
                long h = pool.handle(n._layoutSlot());
                frames.put(n.id(), new Frame(
                        YGNodeLayoutGetLeft(h),
                        YGNodeLayoutGetTop(h),
                        YGNodeLayoutGetWidth(h),
                        YGNodeLayoutGetHeight(h)));
            }
            return frames;
        } catch (RuntimeException e) {
            log.warn("⚠️ {} en '{}': {}", RenderFailure.LAYOUT_FAILED, root.id(), e.toString());
            return Map.of();
        } finally {
            releaseAll(built);
        }
    }

    /** Hijos antes que padres: el orden inverso del pre-orden. */
    private void releaseAll(List<TxNode> built) {
        for (int i = built.size() - 1; i >= 0; i--) {
            TxNode n = built.get(i);
            LayoutSlot slot = n._layoutSlot();
            n._clearLayoutSlot();
            if (slot == null) continue;
            try {
                measures.detach(pool.handle(slot));
                pool.release(slot);
            } catch (StaleLayoutSlotException e) {
                log.error("Slot de layout perdido para '{}'", n.id(), e);
            }
        }
    }

    @Override
    public void close() {
        measures.close();
        if (ownsPool) pool.close();
    }
}
