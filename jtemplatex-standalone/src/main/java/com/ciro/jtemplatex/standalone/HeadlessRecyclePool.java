package com.ciro.jtemplatex.standalone;

import com.ciro.jtemplatex.node.NodeKind;
import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.spi.RecyclePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

/**
 * Pilas de vistas libres por tipo, con tope por tipo y tope global. Lo que no entra
 * se descarta. Sólo hilo UI.
 */
public final class HeadlessRecyclePool implements RecyclePool {

    private static final Logger log = LoggerFactory.getLogger(HeadlessRecyclePool.class);

    public record Stats(long hits, long misses, long recycled, long dropped, int pooled) {
        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0 : (double) hits / total;
        }
    }

    private final Map<NodeKind, Deque<HeadlessView>> free = new EnumMap<>(NodeKind.class);
    private final int perKind;
    private final int total;
    private int pooled;

    private long hits;
    private long misses;
    private long recycled;
    private long dropped;

    public HeadlessRecyclePool(int perKind, int total) {
        this.perKind = perKind;
        this.total = total;
    }

    @Override
    public Object dequeue(NodeKind kind) {
        Deque<HeadlessView> stack = free.get(kind);
        HeadlessView v = stack == null ? null : stack.pollFirst();
        if (v == null) {
            misses++;
            return null;
        }
        pooled--;
        hits++;
        return v;
    }

    @Override
    public void recycle(TxNode node) {
        if (!(node.viewHandle() instanceof HeadlessView v) || v.isPlaceholder()) return;
        if (v.parent() != null || !v.children().isEmpty()) {
            // todavía enganchada: el core la suelta antes, si llega así es un bug del llamador
            log.warn("Vista {} llega al pool con jerarquía, se descarta", v);
            dropped++;
            return;
        }
        Deque<HeadlessView> stack = free.computeIfAbsent(v.kind(), _k -> new ArrayDeque<>());
        if (pooled >= total || stack.size() >= perKind) {
            dropped++;
            return;
        }
        v.prepareForReuse();
        stack.addFirst(v);
        pooled++;
        recycled++;
    }

    public int pooledCount(NodeKind kind) {
        Deque<HeadlessView> stack = free.get(kind);
        return stack == null ? 0 : stack.size();
    }

    public int pooledCount() {
        return pooled;
    }

    public void clear() {
        free.clear();
        pooled = 0;
    }

    public Stats stats() {
        return new Stats(hits, misses, recycled, dropped, pooled);
    }
}
