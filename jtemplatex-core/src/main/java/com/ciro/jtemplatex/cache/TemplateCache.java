package com.ciro.jtemplatex.cache;

import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.spi.TemplateParser;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

/**
 * Prototipos parseados por templateId. El prototipo nunca sale del cache: quien lo
 * pide recibe un clon profundo que puede mutar (bind, layout, vistas) libremente.
 */
public final class TemplateCache {

    private final Cache<String, TxNode> prototypes;

    public TemplateCache(int maximumSize) {
        this.prototypes = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    /**
     * Clon del prototipo, parseando {@code raw} la primera vez.
     *
     * @return null si el parser no produce árbol (no se cachea nada)
     */
    public TxNode instantiate(String templateId, String raw, TemplateParser parser) {
        TxNode proto = prototypes.get(templateId, _k -> parser.parse(raw));
        return proto == null ? null : proto.deepCopy();
    }

    /** El prototipo tal cual (sólo lectura), o null. */
    public TxNode prototype(String templateId) {
        return prototypes.getIfPresent(templateId);
    }

    public void put(String templateId, TxNode prototype) {
        prototypes.put(templateId, prototype);
    }

    public void invalidate(String templateId) {
        prototypes.invalidate(templateId);
    }

    public void clear() {
        prototypes.invalidateAll();
    }

    public long size() {
        prototypes.cleanUp();
        return prototypes.estimatedSize();
    }

    public CacheStats stats() {
        return prototypes.stats();
    }
}
