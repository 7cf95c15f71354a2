package com.ciro.jtemplatex.thread;

import java.util.concurrent.atomic.AtomicBoolean;

/** Bandera de cancelación que el pipeline consulta entre parse, bind, layout y encolado. */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
