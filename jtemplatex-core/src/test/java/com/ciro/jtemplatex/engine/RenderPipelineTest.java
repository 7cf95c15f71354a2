package com.ciro.jtemplatex.engine;

import com.ciro.jtemplatex.config.RenderConfig;
import com.ciro.jtemplatex.error.RenderFailure;
import com.ciro.jtemplatex.error.TxRenderException;
import com.ciro.jtemplatex.node.NodeKind;
import com.ciro.jtemplatex.node.Size;
import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.testing.FakeView;
import com.ciro.jtemplatex.testing.MapTemplateParser;
import com.ciro.jtemplatex.testing.TestContexts;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.ciro.jtemplatex.testing.Trees.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RenderPipelineTest {

    private static final Size SCREEN = Size.wrapHeight(200);

    private final CountDownLatch gate = new CountDownLatch(1);

    private final MapTemplateParser parser = new MapTemplateParser()
            .with("card", RenderPipelineTest::card)
            .with("slow", () -> {
                await(gate);
                return card();
            });

    private static TxNode card() {
        return TxNode.builder("card", NodeKind.VIEW)
                .child(TxNode.builder("name", NodeKind.TEXT).expression("text", "${name}").build())
                .child(text("footer", "fin"))
                .build();
    }

    private TestContexts contexts(RenderConfig config) {
        return TestContexts.create(config, parser);
    }

    @Test
    void backgroundThenFlushMaterializesTheTree() throws Exception {
        TestContexts t = contexts(RenderConfig.defaults());
        RenderPipeline pipeline = new RenderPipeline(t.ctx, "p1");
        AtomicReference<Object> completed = new AtomicReference<>();
        pipeline.onComplete(completed::set);

        pipeline.start("card", Map.of("name", "Ada"), SCREEN).get(5, TimeUnit.SECONDS);
        assertEquals(PipelineState.READY, pipeline.state());

        FakeView view = (FakeView) pipeline.syncFlush();

        assertNotNull(view);
        assertEquals(PipelineState.COMPLETED, pipeline.state());
        assertSame(view, completed.get());
        assertSame(view, pipeline.renderedView());
        assertEquals(List.of("name", "footer"), view.childIds());
        assertEquals("Ada", view.find("name").content.get("text"));
        assertEquals(20f, view.find("footer").frame.y());
        assertTrue(pipeline.timing().totalMs() >= 0);
        assertEquals("card", pipeline.rootNode().id());
    }

    @Test
    void parseErrorReachesOnErrorOnTheUiThread() throws Exception {
        TestContexts t = contexts(RenderConfig.defaults());
        RenderPipeline pipeline = new RenderPipeline(t.ctx);
        List<TxRenderException> errors = new ArrayList<>();
        List<Thread> threads = new ArrayList<>();
        pipeline.onError(e -> {
            errors.add(e);
            threads.add(Thread.currentThread());
        });

        pipeline.start("no-such-template", Map.of(), SCREEN).get(5, TimeUnit.SECONDS);
        assertTrue(errors.isEmpty());

        assertNull(pipeline.syncFlush());

        assertEquals(1, errors.size());
        assertEquals(RenderFailure.PARSE_FAILED, errors.get(0).failure());
        assertSame(Thread.currentThread(), threads.get(0));
        assertEquals(PipelineState.ERROR, pipeline.state());
        assertSame(errors.get(0), pipeline.lastError());
    }

    @Test
    void emptyTemplateIsAParseFailure() throws Exception {
        TestContexts t = contexts(RenderConfig.defaults());
        RenderPipeline pipeline = new RenderPipeline(t.ctx);

        pipeline.start("empty", Map.of(), SCREEN).get(5, TimeUnit.SECONDS);
        pipeline.syncFlush();

        assertEquals(RenderFailure.PARSE_FAILED, pipeline.lastError().failure());
    }

    @Test
    void cancelWhilePreparingDropsEverything() throws Exception {
        TestContexts t = contexts(RenderConfig.defaults());
        RenderPipeline pipeline = new RenderPipeline(t.ctx);
        AtomicReference<Object> completed = new AtomicReference<>();
        pipeline.onComplete(completed::set);

        CompletableFuture<Void> run = pipeline.start("slow", Map.of("name", "x"), SCREEN);
        pipeline.cancel();
        assertEquals(PipelineState.IDLE, pipeline.state());

        gate.countDown();
        run.get(5, TimeUnit.SECONDS);

        assertNull(pipeline.syncFlush());
        assertEquals(0, pipeline.queue().pendingCount());
        assertNull(completed.get());
        assertNull(pipeline.lastError());
    }

    @Test
    void cancelAfterReadyLeavesQueuedWorkForTheNextFlush() throws Exception {
        TestContexts t = contexts(RenderConfig.defaults());
        RenderPipeline pipeline = new RenderPipeline(t.ctx);

        pipeline.start("card", Map.of("name", "x"), SCREEN).get(5, TimeUnit.SECONDS);
        pipeline.cancel();

        assertEquals(PipelineState.READY, pipeline.state());
        assertNotNull(pipeline.syncFlush());
    }

    @Test
    void restartSupersedesPreviousRun() throws Exception {
        TestContexts t = contexts(RenderConfig.defaults());
        RenderPipeline pipeline = new RenderPipeline(t.ctx);

        CompletableFuture<Void> first = pipeline.start("slow", Map.of("name", "primero"), SCREEN);
        CompletableFuture<Void> second = pipeline.start("card", Map.of("name", "segundo"), SCREEN);
        second.get(5, TimeUnit.SECONDS);
        gate.countDown();
        first.get(5, TimeUnit.SECONDS);

        FakeView view = (FakeView) pipeline.syncFlush();

        assertEquals("segundo", view.find("name").content.get("text"));
        assertEquals("segundo", pipeline.rootNode().find("name").binding("text"));
    }

    @Test
    void syncFlushGivesUpAfterTimeoutAndFinishesLater() throws Exception {
        TestContexts t = contexts(RenderConfig.defaults().withSyncFlushTimeoutMs(20));
        RenderPipeline pipeline = new RenderPipeline(t.ctx);

        CompletableFuture<Void> run = pipeline.start("slow", Map.of("name", "tarde"), SCREEN);

        assertNull(pipeline.syncFlush());
        assertEquals(1, pipeline.queue().stats().timeouts());
        assertEquals(PipelineState.PREPARING, pipeline.state());

        gate.countDown();
        run.get(5, TimeUnit.SECONDS);

        FakeView view = (FakeView) pipeline.syncFlush();
        assertEquals("tarde", view.find("name").content.get("text"));
        assertEquals(PipelineState.COMPLETED, pipeline.state());
    }

    @Test
    void disabledSyncFlushNeverWaits() throws Exception {
        TestContexts t = contexts(RenderConfig.simple());
        RenderPipeline pipeline = new RenderPipeline(t.ctx);

        CompletableFuture<Void> run = pipeline.start("slow", Map.of(), SCREEN);
        assertNull(pipeline.syncFlush());
        assertEquals(0, pipeline.queue().stats().timeouts());

        gate.countDown();
        run.get(5, TimeUnit.SECONDS);
        assertNotNull(pipeline.forceFlush());
    }

    @Test
    void prototypeIsClonedNotMutated() throws Exception {
        TestContexts t = contexts(RenderConfig.defaults());
        RenderPipeline pipeline = new RenderPipeline(t.ctx);
        TxNode proto = card();

        pipeline.startWithPrototype(proto, Map.of("name", "Grace"), SCREEN).get(5, TimeUnit.SECONDS);
        pipeline.syncFlush();

        assertNull(proto.find("name").binding("text"));
        assertNull(proto.viewHandle());
        assertEquals(0, parser.parses());
        assertEquals("Grace", pipeline.rootNode().find("name").binding("text"));
    }

    @Test
    void flushOutsideUiThreadIsRejectedInStrictMode() throws Exception {
        TestContexts t = contexts(RenderConfig.defaults());
        RenderPipeline pipeline = new RenderPipeline(t.ctx);
        pipeline.start("card", Map.of(), SCREEN).get(5, TimeUnit.SECONDS);

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> CompletableFuture.supplyAsync(pipeline::syncFlush).get(5, TimeUnit.SECONDS));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(PipelineState.READY, pipeline.state());
    }

    @Test
    void resetForgetsThePreviousResult() throws Exception {
        TestContexts t = contexts(RenderConfig.defaults());
        RenderPipeline pipeline = new RenderPipeline(t.ctx);
        pipeline.start("card", Map.of(), SCREEN).get(5, TimeUnit.SECONDS);
        pipeline.syncFlush();

        pipeline.reset();

        assertEquals(PipelineState.IDLE, pipeline.state());
        assertNull(pipeline.renderedView());
        assertNull(pipeline.rootNode());
        assertEquals(PipelineTiming.ZERO, pipeline.timing());
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) throw new IllegalStateException("gate nunca se abrió");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
