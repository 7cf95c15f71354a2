package com.ciro.jtemplatex.style;

public enum FlexWrap implements CssKeyword {
    NO_WRAP("nowrap"),
    WRAP("wrap"),
    WRAP_REVERSE("wrap-reverse");

    private final String css;

    FlexWrap(String css) {
        this.css = css;
    }

    @Override
    public String css() {
        return css;
    }

    public static FlexWrap fromCss(String raw, FlexWrap fallback) {
        return CssKeyword.lookup(FlexWrap.class, raw, fallback);
    }
}
