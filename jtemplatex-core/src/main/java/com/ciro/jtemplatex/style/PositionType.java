package com.ciro.jtemplatex.style;

public enum PositionType implements CssKeyword {
    RELATIVE("relative"),
    ABSOLUTE("absolute");

    private final String css;

    PositionType(String css) {
        this.css = css;
    }

    @Override
    public String css() {
        return css;
    }

    public static PositionType fromCss(String raw, PositionType fallback) {
        return CssKeyword.lookup(PositionType.class, raw, fallback);
    }
}
