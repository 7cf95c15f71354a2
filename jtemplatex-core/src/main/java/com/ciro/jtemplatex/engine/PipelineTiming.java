package com.ciro.jtemplatex.engine;

/** Tiempos por fase de la última ejecución del pipeline, en milisegundos. */
public record PipelineTiming(double parseMs, double bindMs, double layoutMs,
                             double waitMs, double flushMs, double totalMs) {

    public static final PipelineTiming ZERO = new PipelineTiming(0, 0, 0, 0, 0, 0);

    PipelineTiming withBackground(double parse, double bind, double layout) {
        return new PipelineTiming(parse, bind, layout, waitMs, flushMs, totalMs);
    }

    PipelineTiming withFlush(double wait, double flush) {
        return new PipelineTiming(parseMs, bindMs, layoutMs, wait, flush, parseMs + bindMs + layoutMs + wait + flush);
    }

    @Override
    public String toString() {
        return String.format("parse=%.2fms | bind=%.2fms | layout=%.2fms | wait=%.2fms | flush=%.2fms | total=%.2fms",
                parseMs, bindMs, layoutMs, waitMs, flushMs, totalMs);
    }
}
