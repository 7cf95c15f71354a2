package com.ciro.jtemplatex.style;

public record Shadow(String color, float offsetX, float offsetY, float radius, float opacity) {

    public static final Shadow NONE = new Shadow(null, 0, 0, 0, 0);

    public boolean isVisible() {
        return color != null && opacity > 0;
    }
}
