package com.ciro.jtemplatex.standalone;

import com.ciro.jtemplatex.node.Frame;
import com.ciro.jtemplatex.node.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vista en memoria: lo mínimo que un toolkit real guardaría (frame, jerarquía,
 * visibilidad y contenido). Sirve para el demo y para verificar renders en tests.
 */
public final class HeadlessView {

    private final NodeKind kind;
    private String nodeId;
    private Frame frame = Frame.ZERO;
    private boolean hidden;
    private float alpha = 1f;
    private final boolean placeholder;
    private final String placeholderReason;

    HeadlessView parent;
    final List<HeadlessView> children = new ArrayList<>();
    private final Map<String, Object> content = new LinkedHashMap<>();

    public HeadlessView(NodeKind kind, String nodeId) {
        this(kind, nodeId, false, null);
    }

    private HeadlessView(NodeKind kind, String nodeId, boolean placeholder, String reason) {
        this.kind = kind;
        this.nodeId = nodeId;
        this.placeholder = placeholder;
        this.placeholderReason = reason;
    }

    public static HeadlessView placeholder(String nodeId, String reason) {
        return new HeadlessView(NodeKind.UNKNOWN, nodeId, true, reason);
    }

    public NodeKind kind()                 { return kind; }
    public String nodeId()                 { return nodeId; }
    public Frame frame()                   { return frame; }
    public boolean isHidden()              { return hidden; }
    public float alpha()                   { return alpha; }
    public boolean isPlaceholder()         { return placeholder; }
    public String placeholderReason()      { return placeholderReason; }
    public HeadlessView parent()           { return parent; }

    public List<HeadlessView> children() {
        return Collections.unmodifiableList(children);
    }

    public Map<String, Object> content() {
        return Collections.unmodifiableMap(content);
    }

    public Object content(String name) {
        return content.get(name);
    }

    void setNodeId(String nodeId)          { this.nodeId = nodeId; }
    void setFrame(Frame frame)             { this.frame = frame; }
    void setHidden(boolean hidden)         { this.hidden = hidden; }
    void setAlpha(float alpha)             { this.alpha = alpha; }

    void putContent(String name, Object value) {
        if (value == null) content.remove(name);
        else content.put(name, value);
    }

    /** Vuelve al estado de recién creada para el pool de reciclaje. */
    void prepareForReuse() {
        content.clear();
        frame = Frame.ZERO;
        hidden = false;
        alpha = 1f;
    }

    /** Primer descendiente (incluida esta vista) que pinta el nodo {@code id}. */
    public HeadlessView findByNodeId(String id) {
        if (id.equals(nodeId)) return this;
        for (HeadlessView c : children) {
            HeadlessView f = c.findByNodeId(id);
            if (f != null) return f;
        }
        return null;
    }

    public int subtreeSize() {
        int n = 1;
        for (HeadlessView c : children) n += c.subtreeSize();
        return n;
    }

    /** Volcado indentado de la jerarquía. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        dump(sb, 0);
        return sb.toString();
    }

    private void dump(StringBuilder sb, int depth) {
        sb.append("  ".repeat(depth))
          .append(placeholder ? "placeholder" : kind.typeName())
          .append('#').append(nodeId)
          .append(String.format(" (%.1f, %.1f, %.1f x %.1f)", frame.x(), frame.y(), frame.width(), frame.height()));
        if (hidden) sb.append(" hidden");
        if (alpha < 1f) sb.append(" alpha=").append(alpha);
        if (!content.isEmpty()) sb.append(' ').append(content);
        if (placeholder && placeholderReason != null) sb.append(" ⚠️ ").append(placeholderReason);
        sb.append('\n');
        for (HeadlessView c : children) c.dump(sb, depth + 1);
    }

    @Override
    public String toString() {
        return kind.typeName() + "#" + nodeId;
    }
}
