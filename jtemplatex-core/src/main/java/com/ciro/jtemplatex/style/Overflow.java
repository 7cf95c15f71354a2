package com.ciro.jtemplatex.style;

public enum Overflow implements CssKeyword {
    VISIBLE("visible"),
    HIDDEN("hidden"),
    SCROLL("scroll");

    private final String css;

    Overflow(String css) {
        this.css = css;
    }

    @Override
    public String css() {
        return css;
    }

    public static Overflow fromCss(String raw, Overflow fallback) {
        return CssKeyword.lookup(Overflow.class, raw, fallback);
    }
}
