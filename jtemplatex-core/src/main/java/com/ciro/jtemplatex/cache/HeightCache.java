package com.ciro.jtemplatex.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.function.Supplier;

/**
 * Alturas calculadas para celdas de lista, por (template, ancho, dataKey).
 * El ancho entra en la clave redondeado a 0.5 pt.
 */
public final class HeightCache {

    public record Key(String templateId, float width, String dataKey) {}

    private final Cache<Key, Float> heights;

    public HeightCache(int maximumSize) {
        this.heights = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    public static Key key(String templateId, float width, String dataKey) {
        return new Key(templateId, Math.round(width * 2f) / 2f, dataKey);
    }

    public float getOrCompute(String templateId, float width, String dataKey, Supplier<Float> compute) {
        return heights.get(key(templateId, width, dataKey), _k -> compute.get());
    }

    /** NaN si no está. */
    public float get(String templateId, float width, String dataKey) {
        Float h = heights.getIfPresent(key(templateId, width, dataKey));
        return h == null ? Float.NaN : h;
    }

    public void put(String templateId, float width, String dataKey, float height) {
        heights.put(key(templateId, width, dataKey), height);
    }

    /** Borra todas las alturas de un template (p.ej. cuando cambia su definición). */
    public void invalidateTemplate(String templateId) {
        heights.asMap().keySet().removeIf(k -> k.templateId().equals(templateId));
    }

    public void clear() {
        heights.invalidateAll();
    }

    public long size() {
        heights.cleanUp();
        return heights.estimatedSize();
    }
}
