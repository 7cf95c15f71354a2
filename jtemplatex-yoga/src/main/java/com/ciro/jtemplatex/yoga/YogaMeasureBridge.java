package com.ciro.jtemplatex.yoga;

import com.ciro.jtemplatex.layout.ContentMeasurer;
import com.ciro.jtemplatex.layout.MeasureConstraints;
import com.ciro.jtemplatex.layout.MeasureMode;
import com.ciro.jtemplatex.node.Size;
import com.ciro.jtemplatex.node.TxNode;
import org.lwjgl.util.yoga.YGMeasureFunc;
import org.lwjgl.util.yoga.YGSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.lwjgl.util.yoga.Yoga.*;

/**
 * Un único callback nativo de medida para todos los nodos: el handle que Yoga pasa
 * se resuelve al (nodo, medidor) registrado. Así no se crea un upcall por nodo.
 */
final class YogaMeasureBridge implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(YogaMeasureBridge.class);

    private record Target(TxNode node, ContentMeasurer measurer) {}

    private final Map<Long, Target> targets = new ConcurrentHashMap<>();
    private final YGMeasureFunc callback = YGMeasureFunc.create(this::measure);

    void attach(long handle, TxNode node, ContentMeasurer measurer) {
        targets.put(handle, new Target(node, measurer));
        YGNodeSetMeasureFunc(handle, callback);
    }

    void detach(long handle) {
        if (targets.remove(handle) != null) YGNodeSetMeasureFunc(handle, null);
    }

    int attachedCount() {
        return targets.size();
    }

    private void measure(long node, float width, int widthMode, float height, int heightMode, YGSize out) {
        Target t = targets.get(node);
        float w = 0;
        float h = 0;
        if (t != null) {
            try {
                MeasureConstraints c = new MeasureConstraints(width, mode(widthMode), height, mode(heightMode));
                Size s = t.measurer().measure(t.node(), c);
                if (s != null) {
                    w = Float.isNaN(s.width()) ? 0 : s.width();
                    h = Float.isNaN(s.height()) ? 0 : s.height();
                }
            } catch (RuntimeException e) {
                // una excepción no puede cruzar el upcall nativo
                log.warn("Medidor falló en '{}': {}", t.node().id(), e.toString());
            }
        }
        out.width(w).height(h);
    }

    private static MeasureMode mode(int ygMode) {
        if (ygMode == YGMeasureModeExactly) return MeasureMode.EXACTLY;
        if (ygMode == YGMeasureModeAtMost) return MeasureMode.AT_MOST;
        return MeasureMode.UNDEFINED;
    }

    @Override
    public void close() {
        if (!targets.isEmpty()) log.warn("YogaMeasureBridge cerrado con {} medidores activos", targets.size());
        targets.clear();
        callback.free();
    }
}
