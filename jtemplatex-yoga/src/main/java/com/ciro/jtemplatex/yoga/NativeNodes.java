package com.ciro.jtemplatex.yoga;

/**
 * Operaciones nativas que el pool necesita sobre un handle. Se separan para poder
 * probar el pool sin cargar la librería nativa.
 */
interface NativeNodes {

    long create();

    /** Quita el nodo de su dueño y suelta sus hijos. */
    void detach(long handle);

    /** Deja el nodo como recién creado (estilo por defecto, sin medidor). */
    void reset(long handle);

    void free(long handle);
}
