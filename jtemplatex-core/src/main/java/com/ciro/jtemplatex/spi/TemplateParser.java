package com.ciro.jtemplatex.spi;

import com.ciro.jtemplatex.error.TxRenderException;
import com.ciro.jtemplatex.node.TxNode;

/**
 * Template crudo → árbol. Un fallo es terminal para esa llamada: el core no reintenta.
 */
public interface TemplateParser {

    /**
     * @return el árbol, o null si el template no produce nodos
     * @throws TxRenderException con {@code PARSE_FAILED} si el template es inválido
     */
    TxNode parse(String rawTemplate);
}
