package com.ciro.jtemplatex.node;

/** Caja calculada por el layout. El origen es relativo al padre con vista. */
public record Frame(float x, float y, float width, float height) {

    public static final Frame ZERO = new Frame(0, 0, 0, 0);

    public Frame offset(float dx, float dy) {
        if (dx == 0 && dy == 0) return this;
        return new Frame(x + dx, y + dy, width, height);
    }

    public float maxX() {
        return x + width;
    }

    public float maxY() {
        return y + height;
    }
}
