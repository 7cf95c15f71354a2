package com.ciro.jtemplatex.spi;

import com.ciro.jtemplatex.node.NodeKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tabla tipo → materializador. Se arma una vez al componer el contexto.
 */
public final class WidgetRegistry {

    private final Map<NodeKind, WidgetMaterializer> byKind = new EnumMap<>(NodeKind.class);

    public WidgetRegistry register(NodeKind kind, WidgetMaterializer materializer) {
        if (kind == NodeKind.UNKNOWN) {
            throw new IllegalArgumentException("UNKNOWN siempre se materializa como placeholder");
        }
        byKind.put(kind, materializer);
        return this;
    }

    public Optional<WidgetMaterializer> find(NodeKind kind) {
        return Optional.ofNullable(byKind.get(kind));
    }

    public boolean supports(NodeKind kind) {
        return byKind.containsKey(kind);
    }
}
