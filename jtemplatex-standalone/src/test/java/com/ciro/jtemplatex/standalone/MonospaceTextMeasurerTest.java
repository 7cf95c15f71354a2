package com.ciro.jtemplatex.standalone;

import com.ciro.jtemplatex.layout.MeasureConstraints;
import com.ciro.jtemplatex.layout.MeasureMode;
import com.ciro.jtemplatex.node.NodeKind;
import com.ciro.jtemplatex.node.Size;
import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.style.Style;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MonospaceTextMeasurerTest {

    // avance 5pt por carácter, líneas de 12pt
    private static final Style TEN = Style.builder().fontSize(10).lineHeight(12).build();

    private final MonospaceTextMeasurer measurer = new MonospaceTextMeasurer(0.5f);

    private static TxNode node(NodeKind kind, String field, String value, Style style) {
        TxNode.Builder b = TxNode.builder("n", kind).style(style);
        if (value != null) b.prop(field, value);
        return b.build();
    }

    @Test
    void singleLineWhenUnbounded() {
        Size s = measurer.measure(node(NodeKind.TEXT, "text", "hello world", TEN), MeasureConstraints.unbounded());
        assertEquals(Size.of(55, 12), s);
    }

    @Test
    void wrapsByWordsAtMostWidth() {
        Size s = measurer.measure(node(NodeKind.TEXT, "text", "hello world", TEN), MeasureConstraints.atMostWidth(32));
        assertEquals(Size.of(25, 24), s);
    }

    @Test
    void numberOfLinesTruncates() {
        Style oneLine = TEN.toBuilder().numberOfLines(1).build();
        Size s = measurer.measure(node(NodeKind.TEXT, "text", "hello world", oneLine), MeasureConstraints.atMostWidth(32));
        assertEquals(12f, s.height());
    }

    @Test
    void exactWidthIsRespected() {
        MeasureConstraints exact = new MeasureConstraints(100, MeasureMode.EXACTLY, Float.NaN, MeasureMode.UNDEFINED);
        Size s = measurer.measure(node(NodeKind.TEXT, "text", "hi", TEN), exact);
        assertEquals(Size.of(100, 12), s);
    }

    @Test
    void atMostHeightClamps() {
        MeasureConstraints c = new MeasureConstraints(10, MeasureMode.AT_MOST, 20, MeasureMode.AT_MOST);
        Size s = measurer.measure(node(NodeKind.TEXT, "text", "uno dos tres", TEN), c);
        assertEquals(10f, s.width());
        assertEquals(20f, s.height());
    }

    @Test
    void buttonAddsPadding() {
        Size s = measurer.measure(node(NodeKind.BUTTON, "title", "OK", TEN), MeasureConstraints.unbounded());
        assertEquals(Size.of(10 + 32, 12 + 16), s);
    }

    @Test
    void emptyInputMeasuresItsPlaceholder() {
        Size s = measurer.measure(node(NodeKind.INPUT, "placeholder", "Buscar", TEN), MeasureConstraints.unbounded());
        assertEquals(Size.of(30, 12), s);
    }

    @Test
    void emptyTextStillTakesOneLine() {
        Size s = measurer.measure(node(NodeKind.TEXT, "text", null, TEN), MeasureConstraints.unbounded());
        assertEquals(Size.of(0, 12), s);
    }

    @Test
    void bindingWinsOverProp() {
        TxNode n = node(NodeKind.TEXT, "text", "prop", TEN);
        n.putBinding("text", "binding!");
        assertEquals(40f, measurer.measure(n, MeasureConstraints.unbounded()).width());
    }

    @Test
    void wrapSplitsLongWordsAndKeepsExplicitBreaks() {
        assertEquals(List.of("abc", "def", "gh"), MonospaceTextMeasurer.wrap("abcdefgh", 1, 3));
        assertEquals(List.of("uno dos", "tres"), MonospaceTextMeasurer.wrap("uno dos\ntres", 1, Float.POSITIVE_INFINITY));
        assertEquals(List.of("a b"), MonospaceTextMeasurer.wrap("a  b", 1, Float.POSITIVE_INFINITY));
        assertEquals(List.of("ab", "cdef", "g"), MonospaceTextMeasurer.wrap("ab cdefg", 1, 4));
    }
}
