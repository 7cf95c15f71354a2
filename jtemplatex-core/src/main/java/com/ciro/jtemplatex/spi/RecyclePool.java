package com.ciro.jtemplatex.spi;

import com.ciro.jtemplatex.node.NodeKind;
import com.ciro.jtemplatex.node.TxNode;

/**
 * Reutilización opcional de vistas. Sólo hilo UI.
 */
public interface RecyclePool {

    /** Vista libre del tipo pedido, o null. */
    Object dequeue(NodeKind kind);

    /** Recibe la vista del nodo (ya separada de su padre). El nodo conserva la referencia hasta que el core la limpie. */
    void recycle(TxNode node);
}
