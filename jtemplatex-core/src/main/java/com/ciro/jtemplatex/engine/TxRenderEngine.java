package com.ciro.jtemplatex.engine;

import com.ciro.jtemplatex.cache.HeightCache;
import com.ciro.jtemplatex.cache.TemplateCache;
import com.ciro.jtemplatex.diff.EditScript;
import com.ciro.jtemplatex.error.RenderFailure;
import com.ciro.jtemplatex.error.TxRenderException;
import com.ciro.jtemplatex.layout.LayoutResults;
import com.ciro.jtemplatex.node.Frame;
import com.ciro.jtemplatex.node.Size;
import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.patch.LiveTree;
import com.ciro.jtemplatex.spi.TemplateParser;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Fachada síncrona del motor: render completo, update por diff y quickUpdate sobre
 * vistas ya renderizadas. Todo en el hilo UI salvo {@link #calculateHeight}, que no
 * toca vistas.
 * <p>
 * El árbol vivo de cada vista se guarda en un cache Caffeine con claves débiles por
 * identidad: cuando el host suelta la vista raíz, la entrada desaparece sola.
 */
public final class TxRenderEngine {

    private static final Logger log = LoggerFactory.getLogger(TxRenderEngine.class);

    private final TxContext ctx;
    private final Cache<Object, LiveTree> liveTrees;
    private final TemplateCache templates;
    private final HeightCache heights;
    private final PipelinePool pipelinePool;

    public TxRenderEngine(TxContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.liveTrees = Caffeine.newBuilder().weakKeys().build();
        this.templates = new TemplateCache(ctx.config().prototypeCacheCapacity());
        this.heights = new HeightCache(ctx.config().heightCacheCapacity());
        this.pipelinePool = new PipelinePool(ctx);
    }

    public TxContext context() {
        return ctx;
    }

    // ---------------------------------------------------------------------
    // Render
    // ---------------------------------------------------------------------

    /**
     * Bind + layout + montaje del árbol. El árbol pasa a ser el árbol vivo de la vista
     * devuelta: el llamador no debe reutilizarlo.
     *
     * @return vista raíz, o null si el hilo no es el UI (modo no estricto)
     */
    public Object render(TxNode tree, Map<String, Object> data, Size containerSize) {
        Objects.requireNonNull(tree, "tree");
        if (!ctx.ui().check("render")) return null;

        long t0 = System.nanoTime();
        Map<String, Object> d = data == null ? Map.of() : data;
        ctx.binder().bind(d, tree);
        long t1 = System.nanoTime();
        Map<String, Frame> frames = ctx.layout().computeLayout(tree, containerSize);
        LayoutResults.apply(tree, frames);
        long t2 = System.nanoTime();
        Object view = mount(tree, d, containerSize);
        long t3 = System.nanoTime();

        if (ctx.config().enablePerformanceMonitor()) {
            log.debug("render {}: bind={}µs layout={}µs mount={}µs ({} nodos)", tree.id(),
                    (t1 - t0) / 1_000, (t2 - t1) / 1_000, (t3 - t2) / 1_000, tree.subtreeSize());
        }
        return view;
    }

    private Object mount(TxNode tree, Map<String, Object> data, Size containerSize) {
        Object view = ctx.views().mount(tree);
        if (view != null) liveTrees.put(view, new LiveTree(tree, data, containerSize));
        return view;
    }

    /** Parse + render. Un fallo de parse sale como {@link TxRenderException}. */
    public Object render(String rawTemplate, Map<String, Object> data, Size containerSize) {
        TxNode tree = ctx.parser().parse(rawTemplate);
        if (tree == null) throw new TxRenderException(RenderFailure.PARSE_FAILED, "El template no produjo nodos");
        return render(tree, data, containerSize);
    }

    /** Render a partir del prototipo cacheado de {@code templateId} (se parsea la primera vez). */
    public Object renderTemplate(String templateId, String rawTemplate, Map<String, Object> data, Size containerSize) {
        TxNode tree = templates.instantiate(templateId, rawTemplate, ctx.parser());
        if (tree == null) throw new TxRenderException(RenderFailure.PARSE_FAILED, "Template '" + templateId + "' vacío");
        Object view = render(tree, data, containerSize);
        LiveTree lt = view == null ? null : liveTrees.getIfPresent(view);
        if (lt != null) lt.setTemplateId(templateId);
        return view;
    }

    /** Registra (o reemplaza) el prototipo de un template y olvida sus alturas. */
    public void registerTemplate(String templateId, String rawTemplate) {
        TxNode proto = ctx.parser().parse(rawTemplate);
        if (proto == null) throw new TxRenderException(RenderFailure.PARSE_FAILED, "Template '" + templateId + "' vacío");
        templates.put(templateId, proto);
        heights.invalidateTemplate(templateId);
    }

    // ---------------------------------------------------------------------
    // Lotes
    // ---------------------------------------------------------------------

    private record Prepared(BatchRenderTask task, TxNode tree, Map<String, Frame> frames, RuntimeException error) {}

    /**
     * Parse, bind y layout de todas las tareas en paralelo sobre el executor de fondo.
     * Después las vistas se crean de a una, en el orden de {@code tasks}, con
     * {@code uiExecutor}, que tiene que correr en el hilo UI.
     * <p>
     * Un fallo de una tarea queda en su resultado y no frena al resto.
     */
    public CompletableFuture<List<BatchRenderResult>> renderBatch(List<BatchRenderTask> tasks, Executor uiExecutor) {
        Objects.requireNonNull(uiExecutor, "uiExecutor");
        if (tasks == null || tasks.isEmpty()) return CompletableFuture.completedFuture(List.of());
        TemplateParser parser = ctx.parser();
        long t0 = System.nanoTime();
        return prepareAll(tasks, parser).thenApplyAsync(prepared -> mountAll(prepared, "renderBatch", t0), uiExecutor);
    }

    /**
     * Igual que {@link #renderBatch}, pero el hilo UI espera a que termine la preparación
     * y crea las vistas él mismo.
     *
     * @return resultados en el orden de {@code tasks}; vacío si el hilo no es el UI (modo no estricto)
     */
    public List<BatchRenderResult> renderBatchSync(List<BatchRenderTask> tasks) {
        if (tasks == null || tasks.isEmpty()) return List.of();
        if (!ctx.ui().check("renderBatchSync")) return List.of();
        TemplateParser parser = ctx.parser();
        long t0 = System.nanoTime();
        return mountAll(prepareAll(tasks, parser).join(), "renderBatchSync", t0);
    }

    private CompletableFuture<List<Prepared>> prepareAll(List<BatchRenderTask> tasks, TemplateParser parser) {
        List<CompletableFuture<Prepared>> futures = new ArrayList<>(tasks.size());
        for (BatchRenderTask task : tasks) {
            futures.add(CompletableFuture.supplyAsync(() -> prepare(task, parser), ctx.backgroundExecutor()));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenApply(v -> futures.stream().map(CompletableFuture::join).collect(Collectors.toList()));
    }

    private Prepared prepare(BatchRenderTask task, TemplateParser parser) {
        try {
            TxNode tree = parser.parse(task.rawTemplate());
            if (tree == null) {
                throw new TxRenderException(RenderFailure.PARSE_FAILED, "Tarea '" + task.id() + "': el template no produjo nodos");
            }
            ctx.binder().bind(task.data(), tree);
            Map<String, Frame> frames = ctx.layout().computeLayout(tree, task.containerSize());
            return new Prepared(task, tree, frames, null);
        } catch (RuntimeException e) {
            log.warn("Lote: la tarea '{}' falló al preparar: {}", task.id(), e.toString());
            return new Prepared(task, null, null, e);
        }
    }

    private List<BatchRenderResult> mountAll(List<Prepared> prepared, String op, long t0) {
        long t1 = System.nanoTime();
        boolean onUi = ctx.ui().check(op);
        List<BatchRenderResult> results = new ArrayList<>(prepared.size());
        for (Prepared p : prepared) {
            String id = p.task().id();
            if (p.error() != null) {
                results.add(BatchRenderResult.failed(id, p.error()));
                continue;
            }
            if (!onUi) {
                results.add(BatchRenderResult.failed(id,
                        new TxRenderException(RenderFailure.MATERIALIZE_FAILED, "Vistas fuera del hilo UI")));
                continue;
            }
            try {
                LayoutResults.apply(p.tree(), p.frames());
                Object view = mount(p.tree(), p.task().data(), p.task().containerSize());
                results.add(view != null
                        ? BatchRenderResult.ok(id, view)
                        : BatchRenderResult.failed(id, new TxRenderException(RenderFailure.MATERIALIZE_FAILED,
                                "Tarea '" + id + "': el montaje no produjo vista")));
            } catch (RuntimeException e) {
                log.warn("Lote: la tarea '{}' falló al montar: {}", id, e.toString());
                results.add(BatchRenderResult.failed(id, e));
            }
        }
        if (ctx.config().enablePerformanceMonitor()) {
            long t2 = System.nanoTime();
            log.debug("{}: total={}µs prepare={}µs mount={}µs ({} tareas)", op,
                    (t2 - t0) / 1_000, (t1 - t0) / 1_000, (t2 - t1) / 1_000, prepared.size());
        }
        return results;
    }

    // ---------------------------------------------------------------------
    // Update
    // ---------------------------------------------------------------------

    /**
     * Re-bind del árbol vivo con datos nuevos, diff y patch.
     *
     * @return operaciones aplicadas, o -1 si la vista no tiene árbol vivo
     */
    public int update(Object view, Map<String, Object> data, Size containerSize) {
        LiveTree lt = live(view, "update");
        if (lt == null) return -1;
        Map<String, Object> d = data == null ? Map.of() : data;
        TxNode fresh = lt.root().deepCopy();
        ctx.binder().bind(d, fresh);
        return patch(view, lt, fresh, d, containerSize);
    }

    /**
     * Diff contra un árbol nuevo completo (p.ej. un template distinto).
     *
     * @return operaciones aplicadas, o -1 si la vista no tiene árbol vivo
     */
    public int update(Object view, TxNode newTree, Map<String, Object> data, Size containerSize) {
        Objects.requireNonNull(newTree, "newTree");
        LiveTree lt = live(view, "update");
        if (lt == null) return -1;
        Map<String, Object> d = data == null ? Map.of() : data;
        ctx.binder().bind(d, newTree);
        return patch(view, lt, newTree, d, containerSize);
    }

    private int patch(Object view, LiveTree lt, TxNode target, Map<String, Object> data, Size size) {
        long t0 = System.nanoTime();
        EditScript script = ctx.differ().diff(lt.root(), target);
        long t1 = System.nanoTime();

        int applied;
        if (script.hasDiff()) {
            applied = ctx.patcher().apply(script, lt, size);
        } else {
            applied = 0;
            if (!Objects.equals(size, lt.containerSize())) {
                lt.setContainerSize(size);
                ctx.patcher().relayout(lt);
            }
        }
        lt.setData(data);
        rekey(view, lt);

        if (ctx.config().enablePerformanceMonitor()) {
            log.debug("update: diff={}µs patch={}µs {}", (t1 - t0) / 1_000, (System.nanoTime() - t1) / 1_000,
                    script.statistics());
        }
        return applied;
    }

    /**
     * Sin diff: el llamador garantiza que los datos nuevos no cambian la forma del árbol
     * (mismos nodos, mismas listas). Sólo se copian bindings y se rehace layout.
     *
     * @return false si la vista no tiene árbol vivo
     */
    public boolean quickUpdate(Object view, Map<String, Object> data, Size containerSize) {
        LiveTree lt = live(view, "quickUpdate");
        if (lt == null) return false;
        Map<String, Object> d = data == null ? Map.of() : data;
        TxNode bound = lt.root().deepCopy();
        ctx.binder().bind(d, bound);
        ctx.patcher().quickUpdate(lt, bound, containerSize);
        lt.setData(d);
        rekey(view, lt);
        return true;
    }

    private LiveTree live(Object view, String op) {
        if (view == null || !ctx.ui().check(op)) return null;
        LiveTree lt = liveTrees.getIfPresent(view);
        if (lt == null || lt.root() == null) {
            log.debug("{}: la vista no tiene árbol vivo", op);
            return null;
        }
        return lt;
    }

    /** Un replace de raíz cambia la vista raíz: la clave del cache la sigue. */
    private void rekey(Object oldView, LiveTree lt) {
        Object nv = lt.rootView();
        if (nv == oldView) return;
        liveTrees.invalidate(oldView);
        if (nv != null) liveTrees.put(nv, lt);
    }

    // ---------------------------------------------------------------------
    // Alturas
    // ---------------------------------------------------------------------

    /**
     * Alto de una celda de ancho fijo, sin crear vistas. Se cachea por
     * (template, ancho, dataKey). Seguro fuera del hilo UI.
     *
     * @throws IllegalStateException si el template no está registrado
     */
    public float calculateHeight(String templateId, String dataKey, Map<String, Object> data, float width) {
        return heights.getOrCompute(templateId, width, dataKey, () -> {
            TxNode proto = templates.prototype(templateId);
            if (proto == null) throw new IllegalStateException("Template no registrado: " + templateId);
            TxNode tree = proto.deepCopy();
            ctx.binder().bind(data == null ? Map.of() : data, tree);
            Frame f = ctx.layout().computeLayout(tree, Size.wrapHeight(width)).get(tree.id());
            return f == null ? 0f : f.height();
        });
    }

    // ---------------------------------------------------------------------
    // Consulta y limpieza
    // ---------------------------------------------------------------------

    public TxNode getNode(Object view) {
        LiveTree lt = view == null ? null : liveTrees.getIfPresent(view);
        return lt == null ? null : lt.root();
    }

    public Map<String, Object> getData(Object view) {
        LiveTree lt = view == null ? null : liveTrees.getIfPresent(view);
        return lt == null ? null : lt.data();
    }

    public LiveTree liveTree(Object view) {
        return view == null ? null : liveTrees.getIfPresent(view);
    }

    /** Olvida el árbol vivo de la vista. Las vistas siguen siendo del host. */
    public void cleanup(Object view) {
        if (view != null) liveTrees.invalidate(view);
    }

    public void clearAllCache() {
        liveTrees.invalidateAll();
        templates.clear();
        heights.clear();
        pipelinePool.clear();
        log.debug("Caches del motor vaciados");
    }

    public long liveTreeCount() {
        liveTrees.cleanUp();
        return liveTrees.estimatedSize();
    }

    public TemplateCache templates() {
        return templates;
    }

    public HeightCache heights() {
        return heights;
    }

    // ---------------------------------------------------------------------
    // Pipelines
    // ---------------------------------------------------------------------

    public RenderPipeline newPipeline() {
        return new RenderPipeline(ctx);
    }

    public PipelinePool pipelinePool() {
        return pipelinePool;
    }
}
