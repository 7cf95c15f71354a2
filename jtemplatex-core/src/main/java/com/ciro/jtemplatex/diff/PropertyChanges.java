package com.ciro.jtemplatex.diff;

import com.ciro.jtemplatex.style.Style;

import java.util.Map;

/**
 * Cambios de un nodo emparejado.
 *
 * @param styleChanges   el estilo nuevo completo, o null si no cambió
 * @param bindingChanges sólo las claves cambiadas o nuevas; una clave borrada aparece con valor null.
 *                       null si no hubo cambios
 * @param propsChanged   los campos propios del tipo difieren
 */
public record PropertyChanges(Style styleChanges, Map<String, Object> bindingChanges, boolean propsChanged) {

    public static final PropertyChanges NONE = new PropertyChanges(null, null, false);

    public boolean isEmpty() {
        return styleChanges == null && bindingChanges == null && !propsChanged;
    }
}
