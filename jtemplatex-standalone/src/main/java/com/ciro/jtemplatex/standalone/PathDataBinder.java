package com.ciro.jtemplatex.standalone;

import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.spi.DataBinder;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resuelve expresiones {@code ${a.b.c}} contra mapas anidados. Índices de lista con
 * {@code items.0.title} o {@code items[0].title}.
 * <ul>
 *   <li>La expresión es sólo {@code ${path}}: el binding recibe el valor tal cual (número, lista...).</li>
 *   <li>Texto con expresiones intercaladas: se interpola a String; lo no resuelto queda vacío.</li>
 *   <li>{@code ${path}} que no resuelve: se quita el binding.</li>
 * </ul>
 */
public final class PathDataBinder implements DataBinder {

    private static final Pattern EXPR = Pattern.compile("\\$\\{\\s*([^}]+?)\\s*}");

    @Override
    public void bind(Map<String, Object> data, TxNode root) {
        if (root == null) return;
        Map<String, Object> d = data == null ? Map.of() : data;
        root.walk(n -> {
            for (Map.Entry<String, String> e : n.expressions().entrySet()) {
                Object v = evaluate(e.getValue(), d);
                if (v == null) n.removeBinding(e.getKey());
                else n.putBinding(e.getKey(), v);
            }
        });
    }

    static Object evaluate(String expression, Map<String, Object> data) {
        Matcher m = EXPR.matcher(expression);
        if (m.matches()) return resolve(data, m.group(1));

        StringBuilder sb = new StringBuilder();
        m.reset();
        while (m.find()) {
            Object v = resolve(data, m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(v == null ? "" : String.valueOf(v)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /** null si algún tramo del camino no existe. */
    static Object resolve(Map<String, Object> data, String path) {
        Object cur = data;
        for (String seg : path.replace("[", ".").replace("]", "").split("\\.")) {
            if (seg.isEmpty()) continue;
            if (cur instanceof Map<?, ?> map) {
                cur = map.get(seg);
            } else if (cur instanceof List<?> list) {
                int i;
                try {
                    i = Integer.parseInt(seg);
                } catch (NumberFormatException e) {
                    return null;
                }
                cur = i >= 0 && i < list.size() ? list.get(i) : null;
            } else {
                return null;
            }
            if (cur == null) return null;
        }
        return cur;
    }
}
