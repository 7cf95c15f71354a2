package com.ciro.jtemplatex.spi;

import com.ciro.jtemplatex.node.TxNode;

/**
 * Crea y actualiza la vista concreta de un tipo de nodo. Sólo se invoca en el hilo UI.
 */
public interface WidgetMaterializer {

    Object create(TxNode node);

    /** Copia a la vista el contenido propio del tipo (texto, imagen, título...). */
    void update(Object view, TxNode node);
}
