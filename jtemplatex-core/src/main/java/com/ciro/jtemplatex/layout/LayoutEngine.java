package com.ciro.jtemplatex.layout;

import com.ciro.jtemplatex.node.Frame;
import com.ciro.jtemplatex.node.Size;
import com.ciro.jtemplatex.node.TxNode;

import java.util.Map;

/**
 * Calcula los frames de un árbol. Sin estado entre llamadas: se puede invocar en
 * paralelo sobre árboles independientes.
 */
public interface LayoutEngine {

    /**
     * @param containerSize NaN en ancho o alto = ajustar al contenido
     * @return id → frame relativo al padre; vacío si el árbol es vacío o malformado (nunca lanza)
     */
    Map<String, Frame> computeLayout(TxNode root, Size containerSize);
}
