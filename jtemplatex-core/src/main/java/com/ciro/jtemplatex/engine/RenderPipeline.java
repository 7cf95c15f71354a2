package com.ciro.jtemplatex.engine;

import com.ciro.jtemplatex.error.RenderFailure;
import com.ciro.jtemplatex.error.TxRenderException;
import com.ciro.jtemplatex.layout.LayoutResults;
import com.ciro.jtemplatex.node.Frame;
import com.ciro.jtemplatex.node.Size;
import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.thread.CancellationToken;
import com.ciro.jtemplatex.view.ViewSync;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Render en dos mitades: parse + bind + layout en background, materialización de
 * vistas encolada para el hilo UI.
 * <pre>
 * pipeline.start(template, data, size);   // vuelve enseguida
 * ...
 * Object view = pipeline.syncFlush();     // en el pase de layout del hilo UI
 * </pre>
 * Cada {@code start} cancela lo anterior. Cancelar después de "ready" no retira lo ya
 * encolado: quien necesite cancelación dura descarta la vista resultante.
 */
public final class RenderPipeline {

    private static final Logger log = LoggerFactory.getLogger(RenderPipeline.class);

    private final TxContext ctx;
    private final String instanceId;
    private final TxOperationQueue queue = new TxOperationQueue();

    // token + encolado + markReady van bajo este monitor: cancel() ve todo o nada
    private final Object lifecycle = new Object();
    private CancellationToken token = new CancellationToken();

    private volatile PipelineState state = PipelineState.IDLE;
    private volatile TxNode rootNode;
    private volatile Object renderedView;
    private volatile PipelineTiming timing = PipelineTiming.ZERO;
    private volatile TxRenderException lastError;

    private volatile Consumer<Object> onComplete;
    private volatile Consumer<TxRenderException> onError;

    public RenderPipeline(TxContext ctx) {
        this(ctx, UUID.randomUUID().toString());
    }

    public RenderPipeline(TxContext ctx, String instanceId) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.instanceId = instanceId;
    }

    // ---------------------------------------------------------------------
    // Arranque (cualquier hilo)
    // ---------------------------------------------------------------------

    public CompletableFuture<Void> start(String rawTemplate, Map<String, Object> data, Size containerSize) {
        return begin(() -> ctx.parser().parse(rawTemplate), data, containerSize);
    }

    /** Igual que {@link #start} pero clona un árbol ya parseado en vez de parsear. */
    public CompletableFuture<Void> startWithPrototype(TxNode prototype, Map<String, Object> data, Size containerSize) {
        Objects.requireNonNull(prototype, "prototype");
        return begin(prototype::deepCopy, data, containerSize);
    }

    private CompletableFuture<Void> begin(Supplier<TxNode> source, Map<String, Object> data, Size size) {
        CancellationToken tok;
        synchronized (lifecycle) {
            token.cancel();
            resetLocked();
            tok = token;
            state = PipelineState.PREPARING;
            queue.markPreparing();
        }
        Map<String, Object> d = data == null ? Map.of() : data;
        return CompletableFuture.runAsync(() -> runBackground(tok, source, d, size), ctx.backgroundExecutor());
    }

    private void runBackground(CancellationToken tok, Supplier<TxNode> source, Map<String, Object> data, Size size) {
        try {
            if (tok.isCancelled()) return;

            // 1. Parse (o clon del prototipo)
            long t0 = System.nanoTime();
            TxNode root = source.get();
            if (root == null) throw new TxRenderException(RenderFailure.PARSE_FAILED, "El template no produjo nodos");
            double parseMs = ms(t0);
            if (tok.isCancelled()) return;

            // 2. Bind
            long t1 = System.nanoTime();
            ctx.binder().bind(data, root);
            double bindMs = ms(t1);
            if (tok.isCancelled()) return;

            // 3. Layout
            long t2 = System.nanoTime();
            Map<String, Frame> frames = ctx.layout().computeLayout(root, size);
            LayoutResults.apply(root, frames);
            double layoutMs = ms(t2);

            synchronized (lifecycle) {
                if (tok.isCancelled()) return;
                timing = timing.withBackground(parseMs, bindMs, layoutMs);
                rootNode = root;
                enqueueUiOperations(root);
                queue.markReady();
                if (state == PipelineState.PREPARING) state = PipelineState.READY;
            }
            log.trace("Pipeline[{}] background listo: {}", instanceId, timing);
        } catch (RuntimeException e) {
            fail(tok, e);
        }
    }

    /** Materialización en pre-orden: raíz, luego cada hijo crea su vista y se cuelga del ancestro. */
    private void enqueueUiOperations(TxNode root) {
        ViewSync views = ctx.views();
        queue.enqueueRoot(() -> {
            Object v = views.materialize(root);
            renderedView = v;
            return v;
        });

        List<TxNode> nodes = new ArrayList<>();
        root.walk(nodes::add);
        for (int i = 1; i < nodes.size(); i++) {
            TxNode n = nodes.get(i);
            queue.enqueue("materialize:" + n.id(), () -> {
                views.materialize(n);
                views.attach(n);
            });
        }

        queue.enqueue("frames", () -> views.applyFrames(root));
        queue.enqueue("views", () -> views.updateViews(root));
        queue.enqueue("complete", this::complete);
    }

    private void complete() {
        state = PipelineState.COMPLETED;
        Consumer<Object> cb = onComplete;
        if (cb != null && renderedView != null) cb.accept(renderedView);
    }

    private void fail(CancellationToken tok, RuntimeException e) {
        if (tok.isCancelled()) return; // cancelado: silencio

        TxRenderException err = e instanceof TxRenderException tx
                ? tx
                : new TxRenderException(RenderFailure.PARSE_FAILED, "Fallo en background: " + e.getMessage(), e);
        lastError = err;
        log.warn("Pipeline[{}] {}: {}", instanceId, err.failure(), err.getMessage());

        synchronized (lifecycle) {
            if (tok.isCancelled()) return;
            // el callback de error corre en el hilo UI, en el próximo flush
            queue.enqueueHighPriority("error", () -> {
                state = PipelineState.ERROR;
                Consumer<TxRenderException> cb = onError;
                if (cb != null) cb.accept(err);
            });
            queue.markError(err);
            state = PipelineState.ERROR;
        }
    }

    // ---------------------------------------------------------------------
    // Flush (hilo UI)
    // ---------------------------------------------------------------------

    /**
     * Espera al background como mucho {@code syncFlushTimeoutMs} y ejecuta lo encolado.
     * Con {@code enableSyncFlush = false} no espera.
     *
     * @return la vista raíz, o null si todavía no se materializó
     */
    public Object syncFlush() {
        if (!ctx.ui().check("syncFlush")) return null;
        return ctx.config().enableSyncFlush()
                ? flush(() -> queue.syncFlush(ctx.config().syncFlushTimeoutMs()))
                : forceFlush();
    }

    /** Ejecuta lo que haya sin esperar. */
    public Object forceFlush() {
        if (!ctx.ui().check("forceFlush")) return null;
        return flush(queue::forceFlush);
    }

    private Object flush(Supplier<Object> run) {
        if (state == PipelineState.READY) state = PipelineState.FLUSHING;
        run.get();
        if (state == PipelineState.FLUSHING) state = PipelineState.COMPLETED;

        QueueStats qs = queue.stats();
        timing = timing.withFlush(qs.lastWaitMs(), qs.lastExecuteMs());
        if (ctx.config().enablePerformanceMonitor()) {
            log.debug("Pipeline[{}] {} ({} ops)", instanceId, timing, qs.lastFlushCount());
        }
        return renderedView;
    }

    // ---------------------------------------------------------------------
    // Cancelación y reset
    // ---------------------------------------------------------------------

    /**
     * Corta el trabajo en background en el próximo checkpoint. Si el background ya
     * terminó, lo encolado se queda y el próximo flush lo ejecuta.
     */
    public void cancel() {
        synchronized (lifecycle) {
            token.cancel();
            if (state == PipelineState.PREPARING) {
                queue.reset();
                state = PipelineState.IDLE;
            }
        }
    }

    /** Cancela, vacía la cola y olvida el resultado anterior. Los callbacks se conservan. */
    public void reset() {
        synchronized (lifecycle) {
            token.cancel();
            resetLocked();
        }
    }

    private void resetLocked() {
        token = new CancellationToken();
        queue.reset();
        rootNode = null;
        renderedView = null;
        lastError = null;
        timing = PipelineTiming.ZERO;
        state = PipelineState.IDLE;
    }

    /** Además de {@link #reset()} quita los callbacks; lo usa el pool al devolver. */
    void recycle() {
        reset();
        onComplete = null;
        onError = null;
    }

    // ---------------------------------------------------------------------

    public RenderPipeline onComplete(Consumer<Object> cb) {
        this.onComplete = cb;
        return this;
    }

    public RenderPipeline onError(Consumer<TxRenderException> cb) {
        this.onError = cb;
        return this;
    }

    public PipelineState state()          { return state; }
    public TxNode rootNode()              { return rootNode; }
    public Object renderedView()          { return renderedView; }
    public PipelineTiming timing()        { return timing; }
    public TxRenderException lastError()  { return lastError; }
    public String instanceId()            { return instanceId; }
    public TxOperationQueue queue()       { return queue; }

    private static double ms(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
