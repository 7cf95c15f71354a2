package com.ciro.jtemplatex.standalone;

import com.ciro.jtemplatex.layout.ContentMeasurer;
import com.ciro.jtemplatex.layout.MeasureConstraints;
import com.ciro.jtemplatex.layout.MeasureMode;
import com.ciro.jtemplatex.node.NodeKind;
import com.ciro.jtemplatex.node.Size;
import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.style.Style;

import java.util.ArrayList;
import java.util.List;

/**
 * Medidor de texto sin fuentes: cada carácter avanza {@code fontSize * advanceRatio}
 * y las líneas se parten por palabras al ancho disponible. Determinista, sin estado.
 */
public final class MonospaceTextMeasurer implements ContentMeasurer {

    public static final float DEFAULT_ADVANCE_RATIO = 0.6f;
    public static final float DEFAULT_LINE_HEIGHT_RATIO = 1.2f;

    private static final float BUTTON_PAD_H = 16f;
    private static final float BUTTON_PAD_V = 8f;

    private final float advanceRatio;

    public MonospaceTextMeasurer() {
        this(DEFAULT_ADVANCE_RATIO);
    }

    public MonospaceTextMeasurer(float advanceRatio) {
        this.advanceRatio = advanceRatio;
    }

    @Override
    public Size measure(TxNode node, MeasureConstraints c) {
        Style s = node.style();
        String text = textOf(node);
        float pad = node.kind() == NodeKind.BUTTON ? BUTTON_PAD_H * 2 : 0;
        float padV = node.kind() == NodeKind.BUTTON ? BUTTON_PAD_V * 2 : 0;

        float advance = s.fontSize() * advanceRatio + s.letterSpacing();
        float lineHeight = Float.isNaN(s.lineHeight()) ? s.fontSize() * DEFAULT_LINE_HEIGHT_RATIO : s.lineHeight();

        float maxLine = c.maxWidth() - pad;
        List<String> lines = wrap(text, advance, maxLine);
        if (s.numberOfLines() > 0 && lines.size() > s.numberOfLines()) {
            lines = lines.subList(0, s.numberOfLines());
        }

        float widest = 0;
        for (String l : lines) widest = Math.max(widest, l.length() * advance);
        float w = widest + pad;
        if (c.widthMode() == MeasureMode.EXACTLY) w = c.width();
        else if (c.widthMode() == MeasureMode.AT_MOST) w = Math.min(w, c.width());

        float h = Math.max(1, lines.size()) * lineHeight + padV;
        if (c.heightMode() == MeasureMode.EXACTLY) h = c.height();
        else if (c.heightMode() == MeasureMode.AT_MOST) h = Math.min(h, c.height());
        return Size.of(w, h);
    }

    private static String textOf(TxNode node) {
        Object v = switch (node.kind()) {
            case BUTTON -> node.resolved("title");
            case INPUT -> {
                Object t = node.resolved("text");
                yield t != null && !String.valueOf(t).isEmpty() ? t : node.resolved("placeholder");
            }
            default -> node.resolved("text");
        };
        return v == null ? "" : String.valueOf(v);
    }

    /** Parte por saltos de línea explícitos y luego por palabras; una palabra más larga que la línea se corta. */
    static List<String> wrap(String text, float advance, float maxWidth) {
        List<String> out = new ArrayList<>();
        int maxChars = advance <= 0 || Float.isInfinite(maxWidth)
                ? Integer.MAX_VALUE
                : Math.max(1, (int) Math.floor(maxWidth / advance));

        for (String para : text.split("\n", -1)) {
            StringBuilder line = new StringBuilder();
            for (String word : para.split(" ")) {
                if (word.isEmpty()) continue;
                while (word.length() > maxChars) {
                    if (line.length() > 0) {
                        out.add(line.toString());
                        line.setLength(0);
                    }
                    out.add(word.substring(0, maxChars));
                    word = word.substring(maxChars);
                }
                int needed = line.length() == 0 ? word.length() : line.length() + 1 + word.length();
                if (needed > maxChars) {
                    out.add(line.toString());
                    line.setLength(0);
                }
                if (line.length() > 0) line.append(' ');
                line.append(word);
            }
            out.add(line.toString());
        }
        return out;
    }
}
