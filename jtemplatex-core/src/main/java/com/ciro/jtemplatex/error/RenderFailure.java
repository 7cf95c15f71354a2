package com.ciro.jtemplatex.error;

/** Taxonomía de fallos del pipeline de render. */
public enum RenderFailure {
    /** El parser no produjo árbol. Terminal para esa llamada. */
    PARSE_FAILED,
    /** Árbol vacío o malformado, o fallo del solver. Se loguea y se sigue con frames vacíos. */
    LAYOUT_FAILED,
    /** syncFlush agotó el timeout. Sólo warning. */
    FLUSH_TIMEOUT,
    /** Tarea cancelada. Silencioso. */
    CANCELLED,
    /** Un materializador lanzó al crear la vista; se usa un placeholder. */
    MATERIALIZE_FAILED
}
