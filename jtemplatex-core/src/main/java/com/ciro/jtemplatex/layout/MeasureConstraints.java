package com.ciro.jtemplatex.layout;

public record MeasureConstraints(float width, MeasureMode widthMode, float height, MeasureMode heightMode) {

    public static MeasureConstraints unbounded() {
        return new MeasureConstraints(Float.NaN, MeasureMode.UNDEFINED, Float.NaN, MeasureMode.UNDEFINED);
    }

    public static MeasureConstraints atMostWidth(float width) {
        return new MeasureConstraints(width, MeasureMode.AT_MOST, Float.NaN, MeasureMode.UNDEFINED);
    }

    /** Ancho máximo utilizable para partir líneas, o +inf si no hay límite. */
    public float maxWidth() {
        return widthMode == MeasureMode.UNDEFINED || Float.isNaN(width) ? Float.POSITIVE_INFINITY : width;
    }
}
