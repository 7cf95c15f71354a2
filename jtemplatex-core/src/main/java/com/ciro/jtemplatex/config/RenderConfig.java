package com.ciro.jtemplatex.config;

/**
 * Configuración del motor. Inmutable; los presets cubren los casos habituales y
 * {@link RenderConfigLoader} permite sobreescribir campos desde {@code jtemplatex.json}.
 *
 * @param syncFlushTimeoutMs     espera máxima de syncFlush por el trabajo en background
 * @param enableSyncFlush        false = syncFlush se comporta como forceFlush
 * @param enableViewRecycling    usar el RecyclePool al crear/soltar vistas
 * @param enablePerformanceMonitor loguear tiempos por fase en debug
 * @param debugMode              placeholders visibles y violaciones de hilo UI como excepción
 * @param diffMaxDepth           profundidad máxima de recursión del differ
 * @param pipelinePoolCapacity   pipelines ociosos que guarda el PipelinePool
 * @param layoutPoolMaxIdle      nodos nativos ociosos que guarda el pool de layout
 * @param heightCacheCapacity    entradas LRU del cache de alturas
 * @param prototypeCacheCapacity entradas LRU del cache de prototipos de template
 * @param recyclePerKind         vistas recicladas por tipo
 * @param recycleTotal           vistas recicladas en total
 */
public record RenderConfig(
        long syncFlushTimeoutMs,
        boolean enableSyncFlush,
        boolean enableViewRecycling,
        boolean enablePerformanceMonitor,
        boolean debugMode,
        int diffMaxDepth,
        int pipelinePoolCapacity,
        int layoutPoolMaxIdle,
        int heightCacheCapacity,
        int prototypeCacheCapacity,
        int recyclePerKind,
        int recycleTotal
) {

    public static final long DEFAULT_SYNC_FLUSH_TIMEOUT_MS = 100;

    public RenderConfig {
        if (syncFlushTimeoutMs < 0) throw new IllegalArgumentException("syncFlushTimeoutMs < 0");
        if (diffMaxDepth < 1) throw new IllegalArgumentException("diffMaxDepth < 1");
        if (pipelinePoolCapacity < 0) throw new IllegalArgumentException("pipelinePoolCapacity < 0");
        if (layoutPoolMaxIdle < 0) throw new IllegalArgumentException("layoutPoolMaxIdle < 0");
    }

    public static RenderConfig defaults() {
        return new RenderConfig(DEFAULT_SYNC_FLUSH_TIMEOUT_MS, true, true, false, false,
                50, 8, 256, 500, 64, 20, 100);
    }

    /** Timeout corto para listas con scroll rápido. */
    public static RenderConfig highPerformance() {
        return new RenderConfig(50, true, true, false, false,
                50, 16, 512, 1000, 128, 40, 200);
    }

    public static RenderConfig debug() {
        return new RenderConfig(DEFAULT_SYNC_FLUSH_TIMEOUT_MS, true, true, true, true,
                50, 8, 256, 500, 64, 20, 100);
    }

    /** Sin espera sincronizada ni reciclaje: lo más fácil de depurar. */
    public static RenderConfig simple() {
        return new RenderConfig(0, false, false, false, false,
                50, 0, 64, 100, 16, 0, 0);
    }

    public static RenderConfig preset(String name) {
        if (name == null) return defaults();
        return switch (name.trim().toLowerCase()) {
            case "highperformance", "high-performance", "high_performance" -> highPerformance();
            case "debug" -> debug();
            case "simple" -> simple();
            default -> defaults();
        };
    }

    public RenderConfig withSyncFlushTimeoutMs(long v) {
        return new RenderConfig(v, enableSyncFlush, enableViewRecycling, enablePerformanceMonitor, debugMode,
                diffMaxDepth, pipelinePoolCapacity, layoutPoolMaxIdle, heightCacheCapacity,
                prototypeCacheCapacity, recyclePerKind, recycleTotal);
    }

    public RenderConfig withDebugMode(boolean v) {
        return new RenderConfig(syncFlushTimeoutMs, enableSyncFlush, enableViewRecycling, enablePerformanceMonitor, v,
                diffMaxDepth, pipelinePoolCapacity, layoutPoolMaxIdle, heightCacheCapacity,
                prototypeCacheCapacity, recyclePerKind, recycleTotal);
    }

    public RenderConfig withViewRecycling(boolean v) {
        return new RenderConfig(syncFlushTimeoutMs, enableSyncFlush, v, enablePerformanceMonitor, debugMode,
                diffMaxDepth, pipelinePoolCapacity, layoutPoolMaxIdle, heightCacheCapacity,
                prototypeCacheCapacity, recyclePerKind, recycleTotal);
    }

    public RenderConfig withPipelinePoolCapacity(int v) {
        return new RenderConfig(syncFlushTimeoutMs, enableSyncFlush, enableViewRecycling, enablePerformanceMonitor, debugMode,
                diffMaxDepth, v, layoutPoolMaxIdle, heightCacheCapacity,
                prototypeCacheCapacity, recyclePerKind, recycleTotal);
    }
}
