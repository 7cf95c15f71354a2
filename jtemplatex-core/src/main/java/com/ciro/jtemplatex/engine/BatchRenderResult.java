package com.ciro.jtemplatex.engine;

/** Vista raíz o error de una tarea del lote; nunca los dos. */
public record BatchRenderResult(String id, Object view, RuntimeException error) {

    static BatchRenderResult ok(String id, Object view) {
        return new BatchRenderResult(id, view, null);
    }

    static BatchRenderResult failed(String id, RuntimeException error) {
        return new BatchRenderResult(id, null, error);
    }

    public boolean isSuccess() {
        return error == null && view != null;
    }
}
