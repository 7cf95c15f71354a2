package com.ciro.jtemplatex.standalone;

import com.ciro.jtemplatex.config.RenderConfig;
import com.ciro.jtemplatex.config.RenderConfigLoader;
import com.ciro.jtemplatex.engine.TxContext;
import com.ciro.jtemplatex.engine.TxRenderEngine;
import com.ciro.jtemplatex.layout.ContentMeasurer;
import com.ciro.jtemplatex.layout.LayoutEngine;
import com.ciro.jtemplatex.node.NodeKind;
import com.ciro.jtemplatex.thread.UiThread;
import com.ciro.jtemplatex.yoga.YogaLayoutEngine;

import java.util.Map;

/**
 * Arma un motor completo sin toolkit gráfico: vistas en memoria, Yoga para el layout,
 * parser JSON y binder de caminos. El hilo que lo crea pasa a ser el hilo UI.
 */
public final class HeadlessToolkit implements AutoCloseable {

    private final RenderConfig config;
    private final HeadlessViewHost host = new HeadlessViewHost();
    private final HeadlessRecyclePool recyclePool;
    private final LayoutEngine layout;
    private final boolean ownsLayout;
    private final TxContext context;
    private final TxRenderEngine engine;

    private HeadlessToolkit(RenderConfig config, LayoutEngine layout, boolean ownsLayout) {
        this.config = config;
        this.ownsLayout = ownsLayout;
        this.recyclePool = new HeadlessRecyclePool(config.recyclePerKind(), config.recycleTotal());
        this.layout = layout;
        this.context = TxContext.builder()
                .config(config)
                .ui(UiThread.bindToCurrentThread(config.debugMode()))
                .layout(layout)
                .widgets(HeadlessWidgets.registry())
                .host(host)
                .recyclePool(recyclePool)
                .parser(new JsonTemplateParser())
                .binder(new PathDataBinder())
                .build();
        this.engine = new TxRenderEngine(context);
    }

    /** Config de {@code jtemplatex.json} en el classpath, o defaults. */
    public static HeadlessToolkit create() {
        return create(new RenderConfigLoader().loadDefault());
    }

    public static HeadlessToolkit create(RenderConfig config) {
        return new HeadlessToolkit(config, YogaLayoutEngine.create(config, measurers(new MonospaceTextMeasurer())), true);
    }

    /** Con otro motor de layout (el toolkit no lo cierra). */
    public static HeadlessToolkit create(RenderConfig config, LayoutEngine layout) {
        return new HeadlessToolkit(config, layout, false);
    }

    public static Map<NodeKind, ContentMeasurer> measurers(ContentMeasurer text) {
        return Map.of(NodeKind.TEXT, text, NodeKind.BUTTON, text, NodeKind.INPUT, text);
    }

    public RenderConfig config()                 { return config; }
    public HeadlessViewHost host()               { return host; }
    public HeadlessRecyclePool recyclePool()     { return recyclePool; }
    public LayoutEngine layout()                 { return layout; }
    public TxContext context()                   { return context; }
    public TxRenderEngine engine()               { return engine; }

    @Override
    public void close() {
        engine.clearAllCache();
        context.close();
        if (ownsLayout && layout instanceof YogaLayoutEngine yoga) yoga.close();
    }
}
