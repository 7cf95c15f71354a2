package com.ciro.jtemplatex.layout;

import com.ciro.jtemplatex.node.Size;
import com.ciro.jtemplatex.node.TxNode;

/**
 * Tamaño intrínseco del contenido de una hoja (texto). Lo invoca el solver durante el
 * layout, desde el hilo que lo disparó: debe ser reentrante y thread-safe.
 */
@FunctionalInterface
public interface ContentMeasurer {

    Size measure(TxNode node, MeasureConstraints constraints);
}
