package com.ciro.jtemplatex.style;

/** display: none saca el nodo del layout y oculta su vista. */
public enum Display implements CssKeyword {
    FLEX("flex"),
    NONE("none");

    private final String css;

    Display(String css) {
        this.css = css;
    }

    @Override
    public String css() {
        return css;
    }

    public static Display fromCss(String raw, Display fallback) {
        return CssKeyword.lookup(Display.class, raw, fallback);
    }
}
