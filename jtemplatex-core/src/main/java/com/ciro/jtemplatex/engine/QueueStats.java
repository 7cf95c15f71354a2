package com.ciro.jtemplatex.engine;

/**
 * Estadísticas del último flush.
 *
 * @param lastFlushCount   operaciones ejecutadas
 * @param lastWaitMs       espera por el background
 * @param lastExecuteMs    ejecución de las operaciones
 * @param timeouts         flushes que agotaron el timeout desde la creación
 */
public record QueueStats(int lastFlushCount, long lastWaitMs, long lastExecuteMs, long timeouts) {
}
