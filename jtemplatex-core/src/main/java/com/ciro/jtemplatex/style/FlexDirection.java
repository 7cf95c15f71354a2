package com.ciro.jtemplatex.style;

/** Eje principal de un contenedor flex. */
public enum FlexDirection implements CssKeyword {
    ROW("row"),
    ROW_REVERSE("row-reverse"),
    COLUMN("column"),
    COLUMN_REVERSE("column-reverse");

    private final String css;

    FlexDirection(String css) {
        this.css = css;
    }

    @Override
    public String css() {
        return css;
    }

    public static FlexDirection fromCss(String raw, FlexDirection fallback) {
        return CssKeyword.lookup(FlexDirection.class, raw, fallback);
    }
}
