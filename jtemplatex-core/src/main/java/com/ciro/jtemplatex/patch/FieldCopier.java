package com.ciro.jtemplatex.patch;

import com.ciro.jtemplatex.node.TxNode;

/** Copia los campos propios desde el nodo nuevo al vivo. */
@FunctionalInterface
public interface FieldCopier {

    /**
     * Sincroniza el mapa de props entero: lo que falta en origen se borra en el vivo.
     */
    FieldCopier ALL_PROPS = (from, to) -> {
        for (String name : to.props().keySet().toArray(new String[0])) {
            if (!from.props().containsKey(name)) to.removeProp(name);
        }
        from.props().forEach(to::putProp);
    };

    void copy(TxNode from, TxNode to);
}
