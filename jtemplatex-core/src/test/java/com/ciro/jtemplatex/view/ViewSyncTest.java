package com.ciro.jtemplatex.view;

import com.ciro.jtemplatex.config.RenderConfig;
import com.ciro.jtemplatex.node.Frame;
import com.ciro.jtemplatex.node.NodeKind;
import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.spi.WidgetRegistry;
import com.ciro.jtemplatex.style.Display;
import com.ciro.jtemplatex.style.Style;
import com.ciro.jtemplatex.style.Visibility;
import com.ciro.jtemplatex.testing.FakeRecyclePool;
import com.ciro.jtemplatex.testing.FakeView;
import com.ciro.jtemplatex.testing.FakeWidgets;
import com.ciro.jtemplatex.testing.RecordingViewHost;
import com.ciro.jtemplatex.thread.UiThread;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static com.ciro.jtemplatex.testing.Trees.text;
import static com.ciro.jtemplatex.testing.Trees.view;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ViewSyncTest {

    private final RecordingViewHost host = new RecordingViewHost();
    private final FakeRecyclePool pool = new FakeRecyclePool();

    private ViewSync sync(RenderConfig config, WidgetRegistry widgets) {
        return new ViewSync(widgets, host, pool, UiThread.bindToCurrentThread(true), config);
    }

    private static TxNode unknown(String id) {
        return TxNode.builder(id, NodeKind.UNKNOWN).typeName("carousel").build();
    }

    @Test
    void unknownKindGetsHiddenPlaceholderInProduction() {
        TxNode root = view("root", unknown("legacy"), text("t", "x"));

        FakeView rootView = (FakeView) sync(RenderConfig.defaults(), FakeWidgets.registry()).mount(root);

        FakeView placeholder = rootView.find("legacy");
        assertTrue(placeholder.placeholder);
        assertTrue(placeholder.hidden);
        assertTrue(root.childAt(0).isPlaceholderView());
        assertEquals(List.of("legacy", "t"), rootView.childIds());
    }

    @Test
    void placeholderIsVisibleInDebugMode() {
        TxNode root = view("root", unknown("legacy"));

        FakeView rootView = (FakeView) sync(RenderConfig.debug(), FakeWidgets.registry()).mount(root);

        assertFalse(rootView.find("legacy").hidden);
    }

    @Test
    void failingMaterializerFallsBackToPlaceholder() {
        TxNode root = view("root", TxNode.builder("img", NodeKind.IMAGE).prop("src", "::").build());

        FakeView rootView = (FakeView) sync(RenderConfig.defaults(), FakeWidgets.withBrokenImage()).mount(root);

        assertTrue(rootView.find("img").placeholder);
        assertEquals(1, host.placeholders);
    }

    @Test
    void placeholdersAreNotRecycled() {
        TxNode root = view("root", unknown("legacy"));
        ViewSync views = sync(RenderConfig.defaults(), FakeWidgets.registry());
        views.mount(root);

        TxNode legacy = root.childAt(0);
        root.removeChild(legacy);
        views.release(legacy);

        assertEquals(0, pool.recycled);
    }

    @Test
    void framesAreOnlyPushedWhenTheyChange() {
        TxNode root = view("root", text("t", "x"));
        root.childAt(0).setLayoutResult(new Frame(0, 0, 100, 20));
        ViewSync views = sync(RenderConfig.defaults(), FakeWidgets.registry());
        views.mount(root);
        FakeView t = (FakeView) root.childAt(0).viewHandle();

        views.applyFrames(root);
        assertEquals(1, t.frameSets);

        root.childAt(0).setLayoutResult(new Frame(0, 10, 100, 20));
        views.applyFrames(root);
        assertEquals(2, t.frameSets);
        assertEquals(10f, t.frame.y());
    }

    @Test
    void displayAndVisibilityReachTheView() {
        TxNode gone = TxNode.builder("gone", NodeKind.TEXT).style(Style.builder().display(Display.NONE).build()).build();
        TxNode ghost = TxNode.builder("ghost", NodeKind.TEXT)
                .style(Style.builder().visibility(Visibility.HIDDEN).build()).build();
        TxNode faded = TxNode.builder("faded", NodeKind.TEXT).style(Style.builder().opacity(0.4f).build()).build();

        FakeView rootView = (FakeView) sync(RenderConfig.defaults(), FakeWidgets.registry())
                .mount(view("root", gone, ghost, faded));

        assertTrue(rootView.find("gone").hidden);
        assertEquals(0f, rootView.find("ghost").alpha);
        assertEquals(0.4f, rootView.find("faded").alpha);
    }

    @Test
    void syncTreeIsIdempotent() {
        TxNode root = view("root", text("a", "1"), view("flat", text("b", "2")));
        ViewSync views = sync(RenderConfig.defaults(), FakeWidgets.registry());
        views.mount(root);
        int inserts = host.inserts;

        views.syncTree(root);
        views.syncTree(root);

        assertEquals(inserts, host.inserts);
        assertEquals(List.of("a", "b"), ((FakeView) root.viewHandle()).childIds());
    }

    @Test
    void recyclingCanBeTurnedOff() {
        TxNode root = view("root", text("a", "1"));
        ViewSync views = sync(RenderConfig.defaults().withViewRecycling(false), FakeWidgets.registry());
        views.mount(root);

        TxNode a = root.childAt(0);
        root.removeChild(a);
        views.release(a);

        assertEquals(0, pool.recycled);
        assertNull(a.viewHandle());
    }

    @Test
    void replaceRootKeepsTheHostPosition() {
        ViewSync views = sync(RenderConfig.defaults(), FakeWidgets.registry());
        FakeView screen = new FakeView(NodeKind.VIEW, "screen", false);
        FakeView before = new FakeView(NodeKind.VIEW, "before", false);
        host.insertChild(screen, before, 0);
        TxNode oldRoot = view("root");
        host.insertChild(screen, views.mount(oldRoot), 1);

        TxNode newRoot = TxNode.builder("root", NodeKind.SCROLL).build();
        views.replaceRoot(oldRoot, newRoot);

        assertSame(newRoot.viewHandle(), screen.children.get(1));
        assertEquals(2, screen.children.size());
    }

    @Test
    void strictModeRejectsOtherThreads() {
        ViewSync views = sync(RenderConfig.debug(), FakeWidgets.registry());
        TxNode root = view("root");

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> CompletableFuture.supplyAsync(() -> views.mount(root)).get(5, TimeUnit.SECONDS));

        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
