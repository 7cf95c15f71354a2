package com.ciro.jtemplatex.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Carga {@link RenderConfig} desde JSON. El campo opcional {@code preset} elige la base
 * y el resto de campos la sobreescribe; lo que falte queda con el valor del preset.
 *
 * <pre>{ "preset": "debug", "syncFlushTimeoutMs": 250 }</pre>
 */
public final class RenderConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(RenderConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "jtemplatex.json";

    private final ObjectMapper mapper;

    public RenderConfigLoader() {
        this(ObjectMapperFactory.create());
    }

    public RenderConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Lee {@value #DEFAULT_RESOURCE} del classpath; si no existe, defaults. */
    public RenderConfig loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public RenderConfig loadResource(String resource) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = RenderConfigLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("No hay {} en el classpath, se usan los defaults", resource);
                return RenderConfig.defaults();
            }
            return merge(mapper.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo leer " + resource, e);
        }
    }

    public RenderConfig parse(String json) {
        try {
            return merge(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Config JSON inválida: " + e.getOriginalMessage(), e);
        }
    }

    private RenderConfig merge(JsonNode overrides) throws JsonProcessingException {
        if (overrides == null || !overrides.isObject()) {
            log.warn("Config vacía o no es un objeto JSON, se usan los defaults");
            return RenderConfig.defaults();
        }
        RenderConfig base = RenderConfig.preset(overrides.path("preset").asText(null));
        ObjectNode merged = mapper.valueToTree(base);
        ((ObjectNode) overrides).fieldNames().forEachRemaining(name -> {
            if (!name.equals("preset")) merged.set(name, overrides.get(name));
        });
        RenderConfig cfg = mapper.treeToValue(merged, RenderConfig.class);
        log.debug("Config cargada: {}", cfg);
        return cfg;
    }
}
