package com.ciro.jtemplatex.engine;

import com.ciro.jtemplatex.node.Size;

import java.util.Map;
import java.util.Objects;

/** Un template a renderizar dentro de un lote. {@code id} sólo identifica el resultado. */
public record BatchRenderTask(String id, String rawTemplate, Map<String, Object> data, Size containerSize) {

    public BatchRenderTask {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(rawTemplate, "rawTemplate");
        Objects.requireNonNull(containerSize, "containerSize");
        data = data == null ? Map.of() : data;
    }
}
