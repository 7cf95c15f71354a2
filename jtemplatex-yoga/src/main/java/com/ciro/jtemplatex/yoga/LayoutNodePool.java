package com.ciro.jtemplatex.yoga;

import com.ciro.jtemplatex.layout.LayoutSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Arena de nodos nativos de Yoga compartida entre hilos.
 * <p>
 * Cada slot guarda un handle, una generación y si está prestado. Los árboles sólo ven
 * {@link LayoutSlot}s: al liberar, la generación sube y cualquier copia vieja del slot
 * falla con {@link StaleLayoutSlotException} en vez de tocar un nodo que ya es de otro
 * árbol. Un handle nunca está prestado a dos árboles a la vez.
 * <p>
 * Si no hay ociosos se crea un nodo nuevo: el pool crece, nunca falla por agotamiento.
 * Los ociosos por encima de {@code maxIdle} se liberan al devolverlos.
 */
public final class LayoutNodePool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LayoutNodePool.class);

    private static final int INITIAL_CAPACITY = 64;

    private final NativeNodes nodes;
    private final int maxIdle;
    private final ReentrantLock lock = new ReentrantLock();

    private long[] handles = new long[INITIAL_CAPACITY];
    private int[] generations = new int[INITIAL_CAPACITY];
    private boolean[] checkedOut = new boolean[INITIAL_CAPACITY];
    private int used;

    private final Deque<Integer> idle = new ArrayDeque<>();
    private final Deque<Integer> empty = new ArrayDeque<>();
    private int outstanding;
    private boolean closed;

    private long created;
    private long reused;
    private long released;
    private long freed;

    public LayoutNodePool(int maxIdle) {
        this(YogaNodes.INSTANCE, maxIdle);
    }

    LayoutNodePool(NativeNodes nodes, int maxIdle) {
        if (maxIdle < 0) throw new IllegalArgumentException("maxIdle < 0");
        this.nodes = nodes;
        this.maxIdle = maxIdle;
    }

    // ---------------------------------------------------------------------
    // Préstamo
    // ---------------------------------------------------------------------

    public LayoutSlot acquire() {
        lock.lock();
        try {
            return _acquire();
        } finally {
            lock.unlock();
        }
    }

    public List<LayoutSlot> acquireBatch(int count) {
        List<LayoutSlot> out = new ArrayList<>(count);
        lock.lock();
        try {
            for (int i = 0; i < count; i++) out.add(_acquire());
        } finally {
            lock.unlock();
        }
        return out;
    }

    private LayoutSlot _acquire() {
        if (closed) throw new IllegalStateException("LayoutNodePool cerrado");
        Integer slot = idle.pollFirst();
        if (slot != null) {
            reused++;
        } else {
            slot = empty.pollFirst();
            if (slot == null) slot = grow();
            handles[slot] = nodes.create();
            created++;
        }
        checkedOut[slot] = true;
        outstanding++;
        return new LayoutSlot(slot, generations[slot]);
    }

    private int grow() {
        if (used == handles.length) {
            int cap = handles.length * 2;
            handles = Arrays.copyOf(handles, cap);
            generations = Arrays.copyOf(generations, cap);
            checkedOut = Arrays.copyOf(checkedOut, cap);
        }
        return used++;
    }

    /**
     * Handle nativo de un slot prestado.
     *
     * @throws StaleLayoutSlotException si el slot ya se devolvió o es de otra generación
     */
    public long handle(LayoutSlot slot) {
        lock.lock();
        try {
            validate(slot);
            return handles[slot.index()];
        } finally {
            lock.unlock();
        }
    }

    private void validate(LayoutSlot slot) {
        if (slot == null) throw new IllegalArgumentException("slot null");
        int i = slot.index();
        if (i < 0 || i >= used) throw new StaleLayoutSlotException(slot, "índice fuera del arena");
        if (generations[i] != slot.generation()) {
            throw new StaleLayoutSlotException(slot, "generación actual " + generations[i]);
        }
        if (!checkedOut[i]) throw new StaleLayoutSlotException(slot, "no está prestado");
    }

    // ---------------------------------------------------------------------
    // Devolución
    // ---------------------------------------------------------------------

    /**
     * Devuelve un slot. El nodo se separa de su dueño y de sus hijos; los hijos se
     * devuelven aparte (idealmente antes que el padre).
     */
    public void release(LayoutSlot slot) {
        lock.lock();
        try {
            validate(slot);
            int i = slot.index();
            long h = handles[i];
            nodes.detach(h);
            checkedOut[i] = false;
            generations[i]++;
            outstanding--;
            released++;

            if (!closed && idle.size() < maxIdle) {
                nodes.reset(h);
                idle.addFirst(i);
            } else {
                nodes.free(h);
                handles[i] = 0L;
                empty.addFirst(i);
                freed++;
            }
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Mantenimiento
    // ---------------------------------------------------------------------

    /** Pre-crea nodos ociosos hasta tener {@code count} (acotado a maxIdle). */
    public void warmUp(int count) {
        lock.lock();
        try {
            if (closed) throw new IllegalStateException("LayoutNodePool cerrado");
            int target = Math.min(count, maxIdle);
            while (idle.size() < target) {
                Integer slot = empty.pollFirst();
                if (slot == null) slot = grow();
                handles[slot] = nodes.create();
                created++;
                idle.addFirst(slot);
            }
        } finally {
            lock.unlock();
        }
        log.debug("LayoutNodePool precalentado: {} ociosos", availableCount());
    }

    /** Libera todos los ociosos. Los prestados no se tocan. */
    public void drain() {
        lock.lock();
        try {
            Integer slot;
            while ((slot = idle.pollFirst()) != null) {
                nodes.free(handles[slot]);
                handles[slot] = 0L;
                generations[slot]++;
                empty.addFirst(slot);
                freed++;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Libera los ociosos y deja de prestar. Los que sigan prestados se liberan cuando
     * vuelvan.
     */
    @Override
    public void close() {
        int leaked;
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            leaked = outstanding;
        } finally {
            lock.unlock();
        }
        drain();
        if (leaked > 0) log.warn("⚠️ LayoutNodePool cerrado con {} nodos todavía prestados", leaked);
    }

    public int availableCount() {
        lock.lock();
        try {
            return idle.size();
        } finally {
            lock.unlock();
        }
    }

    public int checkedOutCount() {
        lock.lock();
        try {
            return outstanding;
        } finally {
            lock.unlock();
        }
    }

    public int maxIdle() {
        return maxIdle;
    }

    public PoolStats stats() {
        lock.lock();
        try {
            return new PoolStats(created, reused, released, freed, idle.size(), outstanding);
        } finally {
            lock.unlock();
        }
    }

    public void resetStats() {
        lock.lock();
        try {
            created = 0;
            reused = 0;
            released = 0;
            freed = 0;
        } finally {
            lock.unlock();
        }
    }
}
