package com.ciro.jtemplatex.engine;

import com.ciro.jtemplatex.config.RenderConfig;
import com.ciro.jtemplatex.diff.TreeDiffer;
import com.ciro.jtemplatex.layout.LayoutEngine;
import com.ciro.jtemplatex.patch.PatchApplier;
import com.ciro.jtemplatex.spi.DataBinder;
import com.ciro.jtemplatex.spi.RecyclePool;
import com.ciro.jtemplatex.spi.TemplateParser;
import com.ciro.jtemplatex.spi.ViewHost;
import com.ciro.jtemplatex.spi.WidgetRegistry;
import com.ciro.jtemplatex.thread.UiThread;
import com.ciro.jtemplatex.view.ViewSync;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Todo lo que el motor necesita, pasado explícitamente. No hay singletons: dos
 * contextos conviven sin compartir nada salvo lo que el llamador les pase.
 */
public final class TxContext implements AutoCloseable {

    private final RenderConfig config;
    private final UiThread ui;
    private final LayoutEngine layout;
    private final WidgetRegistry widgets;
    private final ViewHost host;
    private final RecyclePool recyclePool;
    private final TemplateParser parser;
    private final DataBinder binder;
    private final Executor backgroundExecutor;
    private final ExecutorService ownedExecutor;

    private final TreeDiffer differ;
    private final ViewSync views;
    private final PatchApplier patcher;

    private TxContext(Builder b) {
        this.config = b.config;
        this.ui = Objects.requireNonNull(b.ui, "ui");
        this.layout = Objects.requireNonNull(b.layout, "layout");
        this.widgets = Objects.requireNonNull(b.widgets, "widgets");
        this.host = Objects.requireNonNull(b.host, "host");
        this.recyclePool = b.recyclePool;
        this.parser = b.parser;
        this.binder = b.binder;
        // el executor del llamador es suyo; el por defecto lo cierra close()
        this.ownedExecutor = b.backgroundExecutor == null ? defaultBackground() : null;
        this.backgroundExecutor = b.backgroundExecutor != null ? b.backgroundExecutor : ownedExecutor;

        this.differ = new TreeDiffer(config.diffMaxDepth());
        this.views = new ViewSync(widgets, host, recyclePool, ui, config);
        this.patcher = new PatchApplier(layout, views, ui);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Pool cacheado sin límite, hilos daemon para no retener la JVM. */
    private static ExecutorService defaultBackground() {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "jtx-bg-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newCachedThreadPool(tf);
    }

    public RenderConfig config()              { return config; }
    public UiThread ui()                      { return ui; }
    public LayoutEngine layout()              { return layout; }
    public WidgetRegistry widgets()           { return widgets; }
    public ViewHost host()                    { return host; }
    public RecyclePool recyclePool()          { return recyclePool; }
    public DataBinder binder()                { return binder; }
    public Executor backgroundExecutor()      { return backgroundExecutor; }
    public TreeDiffer differ()                { return differ; }
    public ViewSync views()                   { return views; }
    public PatchApplier patcher()             { return patcher; }

    /**
     * @throws IllegalStateException si el contexto se construyó sin parser
     */
    public TemplateParser parser() {
        if (parser == null) throw new IllegalStateException("TxContext sin TemplateParser");
        return parser;
    }

    public boolean hasParser() {
        return parser != null;
    }

    /** Cierra el executor de fondo si lo creó el contexto. Idempotente. */
    @Override
    public void close() {
        if (ownedExecutor != null) ownedExecutor.shutdown();
    }

    public static final class Builder {
        private RenderConfig config = RenderConfig.defaults();
        private UiThread ui;
        private LayoutEngine layout;
        private WidgetRegistry widgets = new WidgetRegistry();
        private ViewHost host;
        private RecyclePool recyclePool;
        private TemplateParser parser;
        private DataBinder binder = DataBinder.NONE;
        private Executor backgroundExecutor;

        private Builder() {}

        public Builder config(RenderConfig v)             { this.config = Objects.requireNonNull(v); return this; }
        public Builder ui(UiThread v)                     { this.ui = v; return this; }
        public Builder layout(LayoutEngine v)             { this.layout = v; return this; }
        public Builder widgets(WidgetRegistry v)          { this.widgets = v; return this; }
        public Builder host(ViewHost v)                   { this.host = v; return this; }
        public Builder recyclePool(RecyclePool v)         { this.recyclePool = v; return this; }
        public Builder parser(TemplateParser v)           { this.parser = v; return this; }
        public Builder binder(DataBinder v)               { this.binder = v != null ? v : DataBinder.NONE; return this; }
        public Builder backgroundExecutor(Executor v)     { this.backgroundExecutor = v; return this; }

        public TxContext build() {
            if (ui == null) ui = UiThread.bindToCurrentThread(config.debugMode());
            return new TxContext(this);
        }
    }
}
