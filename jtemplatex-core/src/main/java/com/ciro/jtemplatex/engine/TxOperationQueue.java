package com.ciro.jtemplatex.engine;

import com.ciro.jtemplatex.error.RenderFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Cola FIFO de operaciones diferidas que el background encola y el hilo UI ejecuta.
 * <p>
 * El "background terminó" es un {@link CompletableFuture} de una sola asignación que
 * crea {@link #markPreparing()} y completa {@link #markReady()}; {@link #syncFlush(long)}
 * lo espera con timeout. Es la única llamada bloqueante, y sólo bloquea al hilo UI.
 * <p>
 * Las operaciones encoladas después de tomar el snapshot de un flush quedan para el
 * siguiente.
 */
public final class TxOperationQueue {

    private static final Logger log = LoggerFactory.getLogger(TxOperationQueue.class);

    /** Operación diferida. La de raíz devuelve la vista raíz; el resto devuelve null. */
    private record Op(String tag, Supplier<Object> action, boolean root) {}

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Op> pending = new ArrayList<>();
    private final List<Op> highPriority = new ArrayList<>();

    private QueueState state = QueueState.IDLE;
    private CompletableFuture<Void> backgroundDone = CompletableFuture.completedFuture(null);

    private volatile int lastFlushCount;
    private volatile long lastWaitMs;
    private volatile long lastExecuteMs;
    private final AtomicLong timeouts = new AtomicLong();

    // ---------------------------------------------------------------------
    // Máquina de estados
    // ---------------------------------------------------------------------

    /** El background empieza: nuevo "terminado" pendiente. */
    public void markPreparing() {
        lock.lock();
        try {
            backgroundDone = new CompletableFuture<>();
            state = QueueState.PREPARING;
        } finally {
            lock.unlock();
        }
    }

    /** El background terminó de encolar: despierta a quien espere. */
    public void markReady() {
        CompletableFuture<Void> done;
        lock.lock();
        try {
            // si el hilo UI ya está vaciando (tras un timeout) no le pisamos el estado
            if (state != QueueState.FLUSHING) state = QueueState.READY;
            done = backgroundDone;
        } finally {
            lock.unlock();
        }
        done.complete(null);
    }

    /**
     * Error en background: descarta lo normal encolado y vuelve a idle. Las operaciones
     * de alta prioridad (callbacks de error) se conservan para el próximo flush.
     */
    public void markError(Throwable cause) {
        CompletableFuture<Void> done;
        int dropped;
        lock.lock();
        try {
            dropped = pending.size();
            pending.clear();
            state = QueueState.IDLE;
            done = backgroundDone;
        } finally {
            lock.unlock();
        }
        done.complete(null);
        log.warn("Cola en error ({} ops descartadas): {}", dropped, cause == null ? "?" : cause.toString());
    }

    /** Vacía todo y vuelve a idle. Libera a un syncFlush que esté esperando. */
    public void reset() {
        CompletableFuture<Void> done;
        lock.lock();
        try {
            pending.clear();
            highPriority.clear();
            state = QueueState.IDLE;
            done = backgroundDone;
            backgroundDone = CompletableFuture.completedFuture(null);
        } finally {
            lock.unlock();
        }
        done.complete(null);
    }

    public QueueState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Encolado (cualquier hilo)
    // ---------------------------------------------------------------------

    public void enqueue(String tag, Runnable action) {
        add(pending, new Op(tag, () -> {
            action.run();
            return null;
        }, false));
    }

    /** La vista que devuelva la primera operación de raíz es el resultado del flush. */
    public void enqueueRoot(Supplier<Object> action) {
        add(pending, new Op("root", action, true));
    }

    public void enqueueHighPriority(String tag, Runnable action) {
        add(highPriority, new Op(tag, () -> {
            action.run();
            return null;
        }, false));
    }

    private void add(List<Op> target, Op op) {
        lock.lock();
        try {
            target.add(op);
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size() + highPriority.size();
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Flush (hilo UI)
    // ---------------------------------------------------------------------

    /**
     * Si está idle ejecuta ya; si no, espera al background como mucho {@code timeoutMs}
     * y ejecuta lo que haya. Nunca se queda colgado.
     *
     * @return la vista de la primera operación de raíz ejecutada, o null
     */
    public Object syncFlush(long timeoutMs) {
        CompletableFuture<Void> done;
        QueueState current;
        lock.lock();
        try {
            current = state;
            done = backgroundDone;
        } finally {
            lock.unlock();
        }

        long waited = 0;
        if (current != QueueState.IDLE && !done.isDone()) {
            long w0 = System.nanoTime();
            try {
                done.get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                timeouts.incrementAndGet();
                log.warn("⏱️ {}: el background no terminó en {} ms, se vacía lo que hay ({} ops)",
                        RenderFailure.FLUSH_TIMEOUT, timeoutMs, pendingCount());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("syncFlush interrumpido, se vacía lo que hay");
            } catch (ExecutionException e) {
                // el future sólo se completa normalmente; si llega aquí es un bug
                log.error("Espera del background falló", e.getCause());
            }
            waited = (System.nanoTime() - w0) / 1_000_000;
        }
        lastWaitMs = waited;
        return flush();
    }

    /** Ejecuta lo encolado sin esperar. */
    public Object forceFlush() {
        lastWaitMs = 0;
        return flush();
    }

    private Object flush() {
        List<Op> batch;
        lock.lock();
        try {
            state = QueueState.FLUSHING;
            batch = new ArrayList<>(highPriority.size() + pending.size());
            batch.addAll(highPriority);
            batch.addAll(pending);
            highPriority.clear();
            pending.clear();
        } finally {
            lock.unlock();
        }

        long t0 = System.nanoTime();
        Object rootResult = null;
        boolean rootSeen = false;
        for (Op op : batch) {
            try {
                Object r = op.action().get();
                if (op.root() && !rootSeen) {
                    rootResult = r;
                    rootSeen = true;
                }
            } catch (RuntimeException e) {
                // una operación rota no tumba el resto del frame
                log.error("Operación '{}' falló en el flush", op.tag(), e);
            }
        }
        lastExecuteMs = (System.nanoTime() - t0) / 1_000_000;
        lastFlushCount = batch.size();

        lock.lock();
        try {
            state = backgroundDone.isDone() ? QueueState.IDLE : QueueState.PREPARING;
        } finally {
            lock.unlock();
        }
        return rootResult;
    }

    public QueueStats stats() {
        return new QueueStats(lastFlushCount, lastWaitMs, lastExecuteMs, timeouts.get());
    }
}
