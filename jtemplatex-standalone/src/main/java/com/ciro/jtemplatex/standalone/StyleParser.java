package com.ciro.jtemplatex.standalone;

import com.ciro.jtemplatex.style.Align;
import com.ciro.jtemplatex.style.Dimension;
import com.ciro.jtemplatex.style.Display;
import com.ciro.jtemplatex.style.Edges;
import com.ciro.jtemplatex.style.FlexDirection;
import com.ciro.jtemplatex.style.FlexWrap;
import com.ciro.jtemplatex.style.Justify;
import com.ciro.jtemplatex.style.Overflow;
import com.ciro.jtemplatex.style.PositionType;
import com.ciro.jtemplatex.style.Shadow;
import com.ciro.jtemplatex.style.Style;
import com.ciro.jtemplatex.style.TextAlign;
import com.ciro.jtemplatex.style.Visibility;
import com.fasterxml.jackson.databind.JsonNode;
import com.helger.css.ECSSVersion;
import com.helger.css.decl.CSSDeclaration;
import com.helger.css.decl.CSSDeclarationList;
import com.helger.css.reader.CSSReaderDeclarationList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Estilo desde el template: objeto JSON ({@code {"flexDirection": "row"}}) o CSS en
 * línea ({@code "flex-direction: row; padding: 8px"}). Las propiedades se aceptan en
 * camelCase o kebab-case. Lo que no se reconoce se ignora con un debug.
 */
public final class StyleParser {

    private static final Logger log = LoggerFactory.getLogger(StyleParser.class);

    private StyleParser() {}

    public static Style fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return Style.DEFAULT;
        if (node.isTextual()) return fromCss(node.asText());

        Draft d = new Draft();
        node.fields().forEachRemaining(e -> {
            JsonNode v = e.getValue();
            apply(d, e.getKey(), v.isValueNode() ? v.asText() : v.toString());
        });
        return d.build();
    }

    /** CSS de declaraciones sueltas (el contenido de un atributo {@code style}). */
    public static Style fromCss(String css) {
        if (css == null || css.isBlank()) return Style.DEFAULT;
        CSSDeclarationList decls = CSSReaderDeclarationList.readFromString(css, ECSSVersion.CSS30);
        if (decls == null) {
            log.warn("⚠️ CSS inválido en estilo en línea, se ignora: {}", css);
            return Style.DEFAULT;
        }
        Draft d = new Draft();
        for (CSSDeclaration decl : decls.getAllDeclarations()) {
            apply(d, decl.getProperty(), decl.getExpressionAsCSSString());
        }
        return d.build();
    }

    /** Builder más las cajas por lado, que se arman de a una propiedad. */
    private static final class Draft {
        final Style.Builder b = Style.builder();
        Edges margin = Edges.ZERO;
        Edges padding = Edges.ZERO;
        Edges position = Edges.UNDEFINED;

        Style build() {
            return b.margin(margin).padding(padding).position(position).build();
        }
    }

    private static void apply(Draft d, String rawName, String rawValue) {
        Style.Builder b = d.b;
        String name = kebab(rawName);
        String v = rawValue == null ? "" : rawValue.trim();
        try {
            switch (name) {
                case "width" -> b.width(Dimension.parse(v));
                case "height" -> b.height(Dimension.parse(v));
                case "min-width" -> b.minWidth(num(v));
                case "min-height" -> b.minHeight(num(v));
                case "max-width" -> b.maxWidth(num(v));
                case "max-height" -> b.maxHeight(num(v));
                case "aspect-ratio" -> b.aspectRatio(num(v));

                case "margin" -> d.margin = edges(v);
                case "padding" -> d.padding = edges(v);
                case "margin-left", "margin-top", "margin-right", "margin-bottom" ->
                        d.margin = side(d.margin, name.substring(7), num(v));
                case "padding-left", "padding-top", "padding-right", "padding-bottom" ->
                        d.padding = side(d.padding, name.substring(8), num(v));
                // position arranca sin definir: sólo el lado pedido deja de ser NaN
                case "left", "top", "right", "bottom" -> d.position = side(d.position, name, num(v));

                case "flex" -> {
                    float f = num(v);
                    b.flexGrow(f).flexShrink(1).flexBasis(f > 0 ? 0 : Float.NaN);
                }
                case "flex-grow" -> b.flexGrow(num(v));
                case "flex-shrink" -> b.flexShrink(num(v));
                case "flex-basis" -> b.flexBasis(v.equals("auto") ? Float.NaN : num(v));
                case "flex-direction" -> b.flexDirection(FlexDirection.fromCss(v, FlexDirection.COLUMN));
                case "flex-wrap" -> b.flexWrap(FlexWrap.fromCss(v, FlexWrap.NO_WRAP));
                case "justify-content" -> b.justifyContent(Justify.fromCss(v, Justify.FLEX_START));
                case "align-items" -> b.alignItems(Align.fromCss(v, Align.STRETCH));
                case "align-self" -> b.alignSelf(Align.fromCss(v, Align.AUTO));
                case "align-content" -> b.alignContent(Align.fromCss(v, Align.FLEX_START));
                case "position" -> b.positionType(PositionType.fromCss(v, PositionType.RELATIVE));
                case "overflow" -> b.overflow(Overflow.fromCss(v, Overflow.VISIBLE));
                case "display" -> b.display(Display.fromCss(v, Display.FLEX));
                case "visibility" -> b.visibility(Visibility.fromCss(v, Visibility.VISIBLE));

                case "background-color", "background" -> b.backgroundColor(v);
                case "border-width" -> b.borderWidth(num(v));
                case "border-color" -> b.borderColor(v);
                case "border-radius", "corner-radius" -> b.cornerRadius(num(v));
                case "box-shadow", "shadow" -> b.shadow(shadow(v));
                case "opacity" -> b.opacity(num(v));
                case "clips-to-bounds", "clip" -> b.clipsToBounds(Boolean.parseBoolean(v));

                case "font-size" -> b.fontSize(num(v));
                case "font-weight" -> b.fontWeight(v);
                case "color", "text-color" -> b.textColor(v);
                case "text-align" -> b.textAlign(TextAlign.fromCss(v, TextAlign.LEFT));
                case "line-height" -> b.lineHeight(num(v));
                case "letter-spacing" -> b.letterSpacing(num(v));
                case "number-of-lines", "lines", "max-lines" -> b.numberOfLines((int) num(v));

                default -> log.debug("Propiedad de estilo desconocida '{}', se ignora", rawName);
            }
        } catch (NumberFormatException e) {
            log.warn("Valor inválido para '{}': '{}', se ignora", rawName, rawValue);
        }
    }

    static String kebab(String name) {
        return name.trim().replaceAll("([a-z0-9])([A-Z])", "$1-$2").toLowerCase(Locale.ROOT);
    }

    static float num(String v) {
        String s = v.trim().toLowerCase(Locale.ROOT);
        if (s.endsWith("px") || s.endsWith("pt")) s = s.substring(0, s.length() - 2).trim();
        return Float.parseFloat(s);
    }

    /** Orden CSS: 1 valor = todos; 2 = vertical horizontal; 3 = top h bottom; 4 = top right bottom left. */
    static Edges edges(String v) {
        String[] p = v.trim().split("\\s+");
        return switch (p.length) {
            case 1 -> Edges.all(num(p[0]));
            case 2 -> Edges.symmetric(num(p[1]), num(p[0]));
            case 3 -> new Edges(num(p[1]), num(p[0]), num(p[1]), num(p[2]));
            default -> new Edges(num(p[3]), num(p[0]), num(p[1]), num(p[2]));
        };
    }

    private static Edges side(Edges base, String side, float value) {
        return switch (side) {
            case "left" -> base.withLeft(value);
            case "top" -> base.withTop(value);
            case "right" -> base.withRight(value);
            default -> base.withBottom(value);
        };
    }

    /** "offsetX offsetY radius color", p.ej. {@code 0 2px 4px #00000033}. */
    static Shadow shadow(String v) {
        if (v.equalsIgnoreCase("none")) return Shadow.NONE;
        String[] p = v.trim().split("\\s+");
        if (p.length < 4) return Shadow.NONE;
        return new Shadow(p[3], num(p[0]), num(p[1]), num(p[2]), 1f);
    }
}
