package com.ciro.jtemplatex.spi;

import com.ciro.jtemplatex.node.Frame;
import com.ciro.jtemplatex.node.TxNode;

/**
 * Operaciones de jerarquía del toolkit anfitrión sobre vistas opacas. Sólo hilo UI.
 */
public interface ViewHost {

    /** Inserta {@code child} en {@code parent} en {@code index}; si ya estaba en algún padre se mueve. */
    void insertChild(Object parent, Object child, int index);

    void removeFromParent(Object view);

    Object parentOf(Object view);

    int childCount(Object parent);

    Object childAt(Object parent, int index);

    void setFrame(Object view, Frame frame);

    void setHidden(Object view, boolean hidden);

    void setAlpha(Object view, float alpha);

    /**
     * Vista de reemplazo para un nodo de tipo desconocido o cuya creación falló.
     * El core la oculta fuera de modo debug.
     */
    Object createPlaceholder(TxNode node, String reason);
}
