package com.ciro.jtemplatex.style;

/** Alineación en el eje principal (justify-content). */
public enum Justify implements CssKeyword {
    FLEX_START("flex-start"),
    CENTER("center"),
    FLEX_END("flex-end"),
    SPACE_BETWEEN("space-between"),
    SPACE_AROUND("space-around"),
    SPACE_EVENLY("space-evenly");

    private final String css;

    Justify(String css) {
        this.css = css;
    }

    @Override
    public String css() {
        return css;
    }

    public static Justify fromCss(String raw, Justify fallback) {
        return CssKeyword.lookup(Justify.class, raw, fallback);
    }
}
