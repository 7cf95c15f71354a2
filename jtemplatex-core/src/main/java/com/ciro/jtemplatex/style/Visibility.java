package com.ciro.jtemplatex.style;

/** visibility: hidden conserva el espacio pero la vista queda con alpha 0. */
public enum Visibility implements CssKeyword {
    VISIBLE("visible"),
    HIDDEN("hidden");

    private final String css;

    Visibility(String css) {
        this.css = css;
    }

    @Override
    public String css() {
        return css;
    }

    public static Visibility fromCss(String raw, Visibility fallback) {
        return CssKeyword.lookup(Visibility.class, raw, fallback);
    }
}
