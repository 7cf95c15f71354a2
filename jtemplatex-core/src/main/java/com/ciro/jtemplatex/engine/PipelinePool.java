package com.ciro.jtemplatex.engine;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Pool acotado de pipelines ociosos. Si está vacío, {@link #acquire()} crea uno nuevo;
 * si está lleno, {@link #release} lo descarta.
 */
public final class PipelinePool {

    private final TxContext ctx;
    private final int capacity;
    private final Deque<RenderPipeline> idle = new ArrayDeque<>();

    private long created;
    private long reused;

    public PipelinePool(TxContext ctx) {
        this(ctx, ctx.config().pipelinePoolCapacity());
    }

    public PipelinePool(TxContext ctx, int capacity) {
        if (capacity < 0) throw new IllegalArgumentException("capacity < 0");
        this.ctx = ctx;
        this.capacity = capacity;
    }

    public synchronized RenderPipeline acquire() {
        RenderPipeline p = idle.pollFirst();
        if (p == null) {
            created++;
            return new RenderPipeline(ctx);
        }
        reused++;
        p.recycle();
        return p;
    }

    /** @return true si quedó en el pool */
    public boolean release(RenderPipeline pipeline) {
        if (pipeline == null) return false;
        pipeline.recycle();
        synchronized (this) {
            if (idle.size() >= capacity || idle.contains(pipeline)) return false;
            idle.addFirst(pipeline);
            return true;
        }
    }

    public synchronized void clear() {
        idle.clear();
    }

    public synchronized int size() {
        return idle.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized long createdCount() {
        return created;
    }

    public synchronized long reusedCount() {
        return reused;
    }
}
