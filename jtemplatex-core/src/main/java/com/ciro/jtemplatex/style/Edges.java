package com.ciro.jtemplatex.style;

/**
 * Cuatro lados (margin, padding, position). NaN en un lado significa "sin definir",
 * sólo tiene sentido para position.
 */
public record Edges(float left, float top, float right, float bottom) {

    public static final Edges ZERO = new Edges(0, 0, 0, 0);
    public static final Edges UNDEFINED = new Edges(Float.NaN, Float.NaN, Float.NaN, Float.NaN);

    public static Edges all(float v) {
        return new Edges(v, v, v, v);
    }

    public static Edges symmetric(float horizontal, float vertical) {
        return new Edges(horizontal, vertical, horizontal, vertical);
    }

    public Edges withLeft(float v)   { return new Edges(v, top, right, bottom); }
    public Edges withTop(float v)    { return new Edges(left, v, right, bottom); }
    public Edges withRight(float v)  { return new Edges(left, top, v, bottom); }
    public Edges withBottom(float v) { return new Edges(left, top, right, v); }

    public float horizontal() {
        return left + right;
    }

    public float vertical() {
        return top + bottom;
    }
}
