package com.ciro.jtemplatex.standalone;

import com.ciro.jtemplatex.config.ObjectMapperFactory;
import com.ciro.jtemplatex.error.TxRenderException;
import com.ciro.jtemplatex.node.NodeKind;
import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.spi.TemplateParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Template JSON → árbol de {@link TxNode}.
 * <pre>
 * {
 *   "type": "container", "id": "card",
 *   "style": "flex-direction: row; padding: 8px",      // o un objeto
 *   "props": { "text": "Hola" },
 *   "bindings": { "text": "${user.name}", "key": "${user.id}" },
 *   "events": { "onTap": "openProfile" },
 *   "children": [ ... ]
 * }
 * </pre>
 * Un binding con {@code ${...}} es una expresión que resuelve el DataBinder; cualquier
 * otro valor es un binding estático. Sin {@code id} se genera {@code tipo_N}. Un tipo
 * desconocido da un nodo {@code UNKNOWN} que se materializa como placeholder.
 */
public final class JsonTemplateParser implements TemplateParser {

    private static final Logger log = LoggerFactory.getLogger(JsonTemplateParser.class);

    private final ObjectMapper mapper;

    public JsonTemplateParser() {
        this(ObjectMapperFactory.create());
    }

    public JsonTemplateParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public TxNode parse(String rawTemplate) {
        if (rawTemplate == null || rawTemplate.isBlank()) return null;
        JsonNode root;
        try {
            root = mapper.readTree(rawTemplate);
        } catch (JsonProcessingException e) {
            throw TxRenderException.parseFailed("JSON de template inválido: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    public TxNode parse(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) return null;
        if (!root.isObject()) throw TxRenderException.parseFailed("La raíz del template debe ser un objeto", null);
        return node(root, new HashMap<>(), "$");
    }

    private TxNode node(JsonNode json, Map<String, Integer> ids, String path) {
        String type = json.path("type").asText("");
        if (type.isEmpty()) throw TxRenderException.parseFailed("Nodo sin 'type' en " + path, null);

        NodeKind kind = NodeKind.fromType(type);
        if (kind == NodeKind.UNKNOWN) log.debug("Tipo desconocido '{}' en {}", type, path);

        String id = json.hasNonNull("id")
                ? json.get("id").asText()
                : type + "_" + ids.merge(type, 1, Integer::sum);

        TxNode.Builder b = TxNode.builder(id, kind)
                .typeName(type)
                .style(StyleParser.fromJson(json.get("style")));

        fields(json.get("props"), path + ".props").forEachRemaining(e -> {
            Object v = value(e.getValue());
            if (v != null) b.prop(e.getKey(), v);
        });
        fields(json.get("events"), path + ".events").forEachRemaining(e -> b.event(e.getKey(), value(e.getValue())));
        fields(json.get("bindings"), path + ".bindings").forEachRemaining(e -> {
            JsonNode v = e.getValue();
            if (v.isTextual() && v.asText().contains("${")) b.expression(e.getKey(), v.asText());
            else b.binding(e.getKey(), value(v));
        });

        JsonNode children = json.get("children");
        if (children != null && !children.isNull()) {
            if (!children.isArray()) throw TxRenderException.parseFailed("'children' debe ser un array en " + path, null);
            for (int i = 0; i < children.size(); i++) {
                JsonNode c = children.get(i);
                if (!c.isObject()) throw TxRenderException.parseFailed("Hijo no es un objeto en " + path + "[" + i + "]", null);
                b.child(node(c, ids, path + ".children[" + i + "]"));
            }
        }
        return b.build();
    }

    private static Iterator<Map.Entry<String, JsonNode>> fields(JsonNode n, String path) {
        if (n == null || n.isNull()) return Collections.emptyIterator();
        if (!n.isObject()) throw TxRenderException.parseFailed("Se esperaba un objeto en " + path, null);
        return n.fields();
    }

    private Object value(JsonNode v) {
        if (v.isTextual()) return v.asText();
        if (v.isBoolean()) return v.asBoolean();
        if (v.isIntegralNumber()) return v.canConvertToInt() ? (Object) v.asInt() : (Object) v.asLong();
        if (v.isNumber()) return v.asDouble();
        if (v.isNull()) return null;
        try {
            return mapper.treeToValue(v, Object.class);
        } catch (JsonProcessingException e) {
            throw TxRenderException.parseFailed("Valor no convertible: " + v, e);
        }
    }
}
