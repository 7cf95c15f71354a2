package com.ciro.jtemplatex.style;

/** Alineación en el eje cruzado (align-items, align-self, align-content). */
public enum Align implements CssKeyword {
    AUTO("auto"),
    FLEX_START("flex-start"),
    CENTER("center"),
    FLEX_END("flex-end"),
    STRETCH("stretch"),
    BASELINE("baseline"),
    SPACE_BETWEEN("space-between"),
    SPACE_AROUND("space-around");

    private final String css;

    Align(String css) {
        this.css = css;
    }

    @Override
    public String css() {
        return css;
    }

    public static Align fromCss(String raw, Align fallback) {
        return CssKeyword.lookup(Align.class, raw, fallback);
    }
}
