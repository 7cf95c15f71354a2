package com.ciro.jtemplatex.standalone;

import com.ciro.jtemplatex.config.ObjectMapperFactory;
import com.ciro.jtemplatex.config.RenderConfig;
import com.ciro.jtemplatex.engine.PipelineState;
import com.ciro.jtemplatex.engine.RenderPipeline;
import com.ciro.jtemplatex.engine.TxRenderEngine;
import com.ciro.jtemplatex.node.NodeKind;
import com.ciro.jtemplatex.node.Size;
import com.ciro.jtemplatex.node.TxNode;
import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tarjeta de perfil completa: JSON → Yoga → vistas headless, y updates encima.
 */
class HeadlessRenderIntegrationTest {

    private static final Size SCREEN = Size.wrapHeight(375);

    private String template;
    private Map<String, Object> data;
    private HeadlessToolkit toolkit;
    private TxRenderEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        template = JsonTemplateParserTest.resource("templates/profile-card.json");
        data = ObjectMapperFactory.create().readValue(
                JsonTemplateParserTest.resource("templates/profile-data.json"),
                new TypeReference<Map<String, Object>>() {});
        toolkit = HeadlessToolkit.create(RenderConfig.defaults());
        engine = toolkit.engine();
    }

    @AfterEach
    void tearDown() {
        toolkit.close();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> withUser(String field, Object value) {
        Map<String, Object> user = new HashMap<>((Map<String, Object>) data.get("user"));
        if (value == null) user.remove(field);
        else user.put(field, value);
        Map<String, Object> copy = new HashMap<>(data);
        copy.put("user", user);
        return copy;
    }

    @Test
    void rendersTheCardWithFlattenedHeader() {
        HeadlessView card = (HeadlessView) engine.render(template, data, SCREEN);

        assertEquals("card", card.nodeId());
        assertEquals(0f, card.frame().x());
        assertEquals(375f, card.frame().width());

        // header es fila sin fondo: no tiene vista y sus hijos cuelgan de card
        assertNull(card.findByNodeId("header"));
        HeadlessView avatar = card.findByNodeId("avatar");
        assertSame(card, avatar.parent());
        assertEquals(12f, avatar.frame().x());
        assertEquals(12f, avatar.frame().y());
        assertEquals(48f, avatar.frame().width());
        assertEquals(48f, avatar.frame().height());
        assertEquals("https://example.org/ada.png", avatar.content("src"));

        HeadlessView name = card.findByNodeId("name");
        assertEquals(68f, name.frame().x());
        assertEquals(375f - 12 - 68, name.frame().width(), 0.01f);
        assertEquals("Ada", name.content("text"));

        HeadlessView bio = card.findByNodeId("bio");
        assertEquals(12f, bio.frame().x());
        assertEquals(12f + 48 + 8, bio.frame().y(), 0.01f);

        assertEquals("Seguir a Ada", card.findByNodeId("follow").content("title"));
        assertTrue(card.frame().height() > bio.frame().maxY());
    }

    @Test
    void unknownTypeGetsAHiddenPlaceholder() {
        HeadlessView card = (HeadlessView) engine.render(template, data, SCREEN);

        HeadlessView legacy = card.findByNodeId("legacy");
        assertTrue(legacy.isPlaceholder());
        assertTrue(legacy.isHidden());
        assertSame(card, legacy.parent());
        assertTrue(legacy.placeholderReason().contains("carousel"), legacy.placeholderReason());
    }

    @Test
    void debugModeShowsThePlaceholder() {
        try (HeadlessToolkit debug = HeadlessToolkit.create(RenderConfig.debug())) {
            HeadlessView card = (HeadlessView) debug.engine().render(template, data, SCREEN);
            assertFalse(card.findByNodeId("legacy").isHidden());
        }
    }

    @Test
    void updateKeepsViewsAndChangesContent() {
        HeadlessView card = (HeadlessView) engine.render(template, data, SCREEN);
        HeadlessView avatar = card.findByNodeId("avatar");
        float nameWidth = card.findByNodeId("name").frame().width();

        int ops = engine.update(card, withUser("name", "Ada Lovelace"), SCREEN);

        assertTrue(ops > 0);
        assertSame(avatar, card.findByNodeId("avatar"));
        assertEquals("Ada Lovelace", card.findByNodeId("name").content("text"));
        assertEquals("Seguir a Ada Lovelace", card.findByNodeId("follow").content("title"));
        assertEquals(nameWidth, card.findByNodeId("name").frame().width(), 0.01f);
        assertEquals("Ada Lovelace", ((Map<?, ?>) engine.getData(card).get("user")).get("name"));
    }

    @Test
    void updateWithSameDataTouchesNothing() {
        HeadlessView card = (HeadlessView) engine.render(template, data, SCREEN);
        long changes = toolkit.host().hierarchyChanges();

        assertEquals(0, engine.update(card, data, SCREEN));
        assertEquals(changes, toolkit.host().hierarchyChanges());
    }

    @Test
    void missingDataClearsTheContent() {
        HeadlessView card = (HeadlessView) engine.render(template, data, SCREEN);
        float heightBefore = card.frame().height();

        engine.update(card, withUser("bio", null), SCREEN);

        assertNull(card.findByNodeId("bio").content("text"));
        assertTrue(card.frame().height() < heightBefore);
    }

    @Test
    void removedNodeViewGoesToTheRecyclePool() {
        HeadlessView card = (HeadlessView) engine.render(template, data, SCREEN);
        TxNode smaller = new JsonTemplateParser().parse(template);
        smaller.removeChild(smaller.find("follow"));
        smaller.removeChild(smaller.find("legacy"));

        int ops = engine.update(card, smaller, data, SCREEN);

        assertEquals(2, ops);
        assertNull(card.findByNodeId("follow"));
        assertNull(card.findByNodeId("legacy"));
        assertEquals(1, toolkit.recyclePool().pooledCount(NodeKind.BUTTON));
        assertEquals(1, toolkit.recyclePool().pooledCount());
    }

    @Test
    void quickUpdateRebindsWithoutDiff() {
        HeadlessView card = (HeadlessView) engine.render(template, data, SCREEN);

        assertTrue(engine.quickUpdate(card, withUser("name", "Grace"), SCREEN));
        assertEquals("Grace", card.findByNodeId("name").content("text"));
    }

    @Test
    void widerScreenRelayoutsWithoutOps() {
        HeadlessView card = (HeadlessView) engine.render(template, data, SCREEN);

        assertEquals(0, engine.update(card, data, Size.wrapHeight(500)));
        assertEquals(500f, card.frame().width());
        assertEquals(500f - 12 - 68, card.findByNodeId("name").frame().width(), 0.01f);
    }

    @Test
    void calculatedHeightMatchesTheRenderedCard() {
        HeadlessView card = (HeadlessView) engine.render(template, data, SCREEN);
        engine.registerTemplate("profile", template);

        float h = engine.calculateHeight("profile", "ada", data, 375);

        assertEquals(card.frame().height(), h, 0.5f);
        assertEquals(1, engine.heights().size());
    }

    @Test
    void pipelineBuildsInBackgroundAndFlushesHere() {
        RenderPipeline pipeline = engine.pipelinePool().acquire();

        pipeline.start(template, data, SCREEN).join();
        HeadlessView card = (HeadlessView) pipeline.syncFlush();

        assertNotNull(card);
        assertEquals(PipelineState.COMPLETED, pipeline.state());
        assertEquals("Ada", card.findByNodeId("name").content("text"));
        assertEquals(12f, card.findByNodeId("avatar").frame().x());
        assertTrue(engine.pipelinePool().release(pipeline));
    }

    @Test
    void cleanupForgetsTheLiveTree() {
        HeadlessView card = (HeadlessView) engine.render(template, data, SCREEN);
        assertNotNull(engine.getNode(card));

        engine.cleanup(card);

        assertNull(engine.getNode(card));
        assertEquals(-1, engine.update(card, data, SCREEN));
    }
}
