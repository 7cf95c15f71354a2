package com.ciro.jtemplatex.standalone;

import com.ciro.jtemplatex.config.ObjectMapperFactory;
import com.ciro.jtemplatex.engine.RenderPipeline;
import com.ciro.jtemplatex.engine.TxRenderEngine;
import com.ciro.jtemplatex.node.Size;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Demo: {@code Main [template.json [data.json]]}. Sin argumentos usa la tarjeta de
 * perfil incluida.
 */
public class Main {

    private static final Size SCREEN = Size.wrapHeight(375);

    public static void main(String[] args) {
        ObjectMapper mapper = ObjectMapperFactory.create();

        String template = args.length > 0 ? readFile(args[0]) : readResource("templates/profile-card.json");
        String dataJson = args.length > 1 ? readFile(args[1]) : readResource("templates/profile-data.json");
        Map<String, Object> data = readData(mapper, dataJson);

        try (HeadlessToolkit toolkit = HeadlessToolkit.create()) {
            TxRenderEngine engine = toolkit.engine();

            // 1. Render síncrono
            HeadlessView view = (HeadlessView) engine.render(template, data, SCREEN);
            System.out.println("🚀 Render inicial:");
            System.out.print(view.dump());

            // 2. Update con datos nuevos: diff + patch
            Map<String, Object> changed = copyWithName(data, "Ada Lovelace");
            int ops = engine.update(view, changed, SCREEN);
            // la raíz no cambia de tipo: la vista raíz sigue siendo la misma
            System.out.println("\n🔁 Update (" + ops + " ops):");
            System.out.print(view.dump());

            // 3. Pipeline: background + syncFlush en este hilo
            RenderPipeline pipeline = engine.pipelinePool().acquire();
            pipeline.start(template, changed, SCREEN);
            HeadlessView piped = (HeadlessView) pipeline.syncFlush();
            System.out.println("\n⚡ Pipeline " + pipeline.state() + ": " + pipeline.timing());
            if (piped != null) System.out.println("   " + piped.subtreeSize() + " vistas");
            engine.pipelinePool().release(pipeline);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> copyWithName(Map<String, Object> data, String name) {
        Map<String, Object> copy = new HashMap<>(data);
        Object user = data.get("user");
        Map<String, Object> u = user instanceof Map<?, ?> m ? new HashMap<>((Map<String, Object>) m) : new HashMap<>();
        u.put("name", name);
        copy.put("user", u);
        return copy;
    }

    private static Map<String, Object> readData(ObjectMapper mapper, String json) {
        try {
            return mapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Datos JSON inválidos", e);
        }
    }

    private static String readFile(String path) {
        try {
            return Files.readString(Path.of(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo leer " + path, e);
        }
    }

    private static String readResource(String name) {
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) throw new IllegalStateException("Falta el recurso " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo leer " + name, e);
        }
    }
}
