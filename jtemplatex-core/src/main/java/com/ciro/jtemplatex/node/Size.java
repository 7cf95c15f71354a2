package com.ciro.jtemplatex.node;

/**
 * Tamaño del contenedor para un pase de layout. NaN en una dimensión = wrap content.
 */
public record Size(float width, float height) {

    public static Size of(float width, float height) {
        return new Size(width, height);
    }

    /** Ancho fijo, alto según contenido (celdas de lista). */
    public static Size wrapHeight(float width) {
        return new Size(width, Float.NaN);
    }

    public boolean isWidthDefined() {
        return !Float.isNaN(width);
    }

    public boolean isHeightDefined() {
        return !Float.isNaN(height);
    }
}
