package com.ciro.jtemplatex.yoga;

/**
 * Foto de los contadores del pool de layout.
 *
 * @param created    nodos nativos creados
 * @param reused     acquires servidos desde la lista de ociosos
 * @param released   releases
 * @param freed      nodos nativos liberados (exceso sobre maxIdle o drain)
 * @param available  ociosos ahora
 * @param checkedOut prestados ahora
 */
public record PoolStats(long created, long reused, long released, long freed, int available, int checkedOut) {

    public double reuseRate() {
        long total = created + reused;
        return total == 0 ? 0 : (double) reused / total;
    }
}
