package com.ciro.jtemplatex.style;

/**
 * Valor de dimensión flexbox: auto, puntos fijos o porcentaje del contenedor.
 */
public record Dimension(float value, Unit unit) {

    public enum Unit { AUTO, POINT, PERCENT }

    public static final Dimension AUTO = new Dimension(Float.NaN, Unit.AUTO);

    public static Dimension points(float value) {
        return new Dimension(value, Unit.POINT);
    }

    public static Dimension percent(float value) {
        return new Dimension(value, Unit.PERCENT);
    }

    public boolean isAuto() {
        return unit == Unit.AUTO;
    }

    /**
     * Acepta "auto", "120", "120px", "120pt" y "50%". Lo que no se entiende es auto.
     */
    public static Dimension parse(String raw) {
        if (raw == null) return AUTO;
        String v = raw.trim().toLowerCase();
        if (v.isEmpty() || v.equals("auto")) return AUTO;
        try {
            if (v.endsWith("%")) {
                return percent(Float.parseFloat(v.substring(0, v.length() - 1).trim()));
            }
            if (v.endsWith("px") || v.endsWith("pt")) {
                v = v.substring(0, v.length() - 2).trim();
            }
            return points(Float.parseFloat(v));
        } catch (NumberFormatException e) {
            return AUTO;
        }
    }

    @Override
    public String toString() {
        return switch (unit) {
            case AUTO -> "auto";
            case POINT -> value + "pt";
            case PERCENT -> value + "%";
        };
    }
}
