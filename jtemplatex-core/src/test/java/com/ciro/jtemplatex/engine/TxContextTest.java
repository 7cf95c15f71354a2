package com.ciro.jtemplatex.engine;

import com.ciro.jtemplatex.testing.FakeWidgets;
import com.ciro.jtemplatex.testing.RecordingViewHost;
import com.ciro.jtemplatex.testing.StackLayoutEngine;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TxContextTest {

    private static TxContext.Builder base() {
        return TxContext.builder()
                .layout(new StackLayoutEngine())
                .widgets(FakeWidgets.registry())
                .host(new RecordingViewHost());
    }

    @Test
    void closeShutsDownTheDefaultExecutor() {
        TxContext ctx = base().build();
        ExecutorService bg = (ExecutorService) ctx.backgroundExecutor();

        ctx.close();
        ctx.close();

        assertTrue(bg.isShutdown());
    }

    @Test
    void closeLeavesTheCallersExecutorAlone() {
        ExecutorService mine = Executors.newSingleThreadExecutor();
        try {
            TxContext ctx = base().backgroundExecutor(mine).build();
            assertSame(mine, ctx.backgroundExecutor());

            ctx.close();

            assertFalse(mine.isShutdown());
        } finally {
            mine.shutdownNow();
        }
    }
}
