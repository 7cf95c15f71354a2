package com.ciro.jtemplatex.spi;

import com.ciro.jtemplatex.node.TxNode;

import java.util.Map;

/**
 * Resuelve las expresiones declaradas de cada nodo contra {@code data} y deja los
 * valores en sus bindings. Muta el árbol en sitio.
 */
@FunctionalInterface
public interface DataBinder {

    DataBinder NONE = (data, root) -> { };

    void bind(Map<String, Object> data, TxNode root);
}
