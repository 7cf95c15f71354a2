package com.ciro.jtemplatex.node;

import java.util.Locale;
import java.util.Map;

/**
 * Tipo de nodo, resuelto una sola vez al parsear. El resto del core despacha sobre
 * este enum (EnumMap / switch), nunca sobre el string del template.
 */
public enum NodeKind {
    VIEW("view", false),
    CONTAINER("container", false),
    TEXT("text", true),
    IMAGE("image", false),
    BUTTON("button", true),
    INPUT("input", true),
    SCROLL("scroll", false),
    UNKNOWN("unknown", false);

    private static final Map<String, NodeKind> ALIASES = Map.ofEntries(
            Map.entry("view", VIEW),
            Map.entry("container", CONTAINER),
            Map.entry("flex", CONTAINER),
            Map.entry("flexbox", CONTAINER),
            Map.entry("stack", CONTAINER),
            Map.entry("div", CONTAINER),
            Map.entry("text", TEXT),
            Map.entry("label", TEXT),
            Map.entry("image", IMAGE),
            Map.entry("img", IMAGE),
            Map.entry("button", BUTTON),
            Map.entry("input", INPUT),
            Map.entry("textfield", INPUT),
            Map.entry("scroll", SCROLL),
            Map.entry("scrollview", SCROLL),
            Map.entry("list", SCROLL)
    );

    private final String typeName;
    private final boolean measured;

    NodeKind(String typeName, boolean measured) {
        this.typeName = typeName;
        this.measured = measured;
    }

    public String typeName() {
        return typeName;
    }

    /** El tamaño intrínseco depende del contenido (texto): el layout necesita un medidor. */
    public boolean isMeasured() {
        return measured;
    }

    /** Contenedor puro: candidato a aplanarse si no tiene efecto visual. */
    public boolean isPlainContainer() {
        return this == VIEW || this == CONTAINER;
    }

    public static NodeKind fromType(String type) {
        if (type == null) return UNKNOWN;
        return ALIASES.getOrDefault(type.trim().toLowerCase(Locale.ROOT), UNKNOWN);
    }
}
