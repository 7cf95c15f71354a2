package com.ciro.jtemplatex.style;

/**
 * Enum cuyo valor tiene una palabra clave CSS/flexbox equivalente ("row", "flex-start", ...).
 */
public interface CssKeyword {

    String css();

    /**
     * Busca la constante por su palabra clave. Acepta también el nombre Java
     * (ROW_REVERSE) y camelCase (rowReverse) porque los parsers los mezclan.
     */
    static <E extends Enum<E> & CssKeyword> E lookup(Class<E> type, String raw, E fallback) {
        if (raw == null || raw.isBlank()) return fallback;
        String v = raw.trim();
        for (E e : type.getEnumConstants()) {
            if (e.css().equalsIgnoreCase(v) || e.name().equalsIgnoreCase(v)) return e;
        }
        String kebab = v.replaceAll("([a-z])([A-Z])", "$1-$2").toLowerCase();
        for (E e : type.getEnumConstants()) {
            if (e.css().equals(kebab)) return e;
        }
        return fallback;
    }
}
