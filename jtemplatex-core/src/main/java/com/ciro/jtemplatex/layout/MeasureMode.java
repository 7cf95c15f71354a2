package com.ciro.jtemplatex.layout;

/** Cómo interpretar la restricción propuesta por el solver. */
public enum MeasureMode {
    /** Sin límite: tamaño natural. */
    UNDEFINED,
    /** El resultado debe ser exactamente la restricción. */
    EXACTLY,
    /** Como máximo la restricción. */
    AT_MOST
}
