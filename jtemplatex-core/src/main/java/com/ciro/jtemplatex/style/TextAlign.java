package com.ciro.jtemplatex.style;

public enum TextAlign implements CssKeyword {
    LEFT("left"),
    CENTER("center"),
    RIGHT("right"),
    JUSTIFY("justify");

    private final String css;

    TextAlign(String css) {
        this.css = css;
    }

    @Override
    public String css() {
        return css;
    }

    public static TextAlign fromCss(String raw, TextAlign fallback) {
        return CssKeyword.lookup(TextAlign.class, raw, fallback);
    }
}
