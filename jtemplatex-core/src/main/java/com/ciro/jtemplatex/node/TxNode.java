package com.ciro.jtemplatex.node;

import com.ciro.jtemplatex.layout.LayoutSlot;
import com.ciro.jtemplatex.style.Style;

import java.lang.ref.WeakReference;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Nodo del árbol de componentes.
 * <p>
 * El padre es dueño de sus hijos (lista fuerte); el hijo sólo guarda una referencia
 * débil al padre, que se asigna al adjuntar y se limpia al separar. Los métodos con
 * prefijo {@code _} son estado transitorio del framework (vista, slot de layout,
 * memo de lo último aplicado) y no forman parte del modelo que compara el differ.
 */
public class TxNode {

    /** Binding reservado: clave estable para emparejar hijos de una lista. */
    public static final String KEY_BINDING = "key";

    private String id;
    private final NodeKind kind;
    private final String typeName;
    private Style style;

    private final List<TxNode> children = new ArrayList<>();
    private WeakReference<TxNode> parent;

    private final Map<String, Object> bindings = new LinkedHashMap<>();
    private final Map<String, String> expressions;
    private final Map<String, Object> props = new LinkedHashMap<>();
    private final Map<String, Object> events;

    private Frame layoutResult = Frame.ZERO;

    // --- Transitorio (no se copia en clones) ---
    private Object viewHandle;
    private boolean placeholderView;
    private LayoutSlot layoutSlot;
    private Style lastAppliedStyle;
    private Frame lastAppliedFrame;
    private boolean forceApply;

    protected TxNode(String id, NodeKind kind, String typeName, Style style,
                     Map<String, String> expressions, Map<String, Object> events) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.typeName = typeName != null ? typeName : kind.typeName();
        this.style = style != null ? style : Style.DEFAULT;
        this.expressions = Collections.unmodifiableMap(new LinkedHashMap<>(expressions));
        this.events = Collections.unmodifiableMap(new LinkedHashMap<>(events));
    }

    public static Builder builder(String id, NodeKind kind) {
        return new Builder(id, kind);
    }

    // ---------------------------------------------------------------------
    // Identidad y estilo
    // ---------------------------------------------------------------------

    public String id()          { return id; }
    public NodeKind kind()      { return kind; }
    public String typeName()    { return typeName; }
    public Style style()        { return style; }

    public void setStyle(Style style) {
        this.style = Objects.requireNonNull(style, "style");
    }

    /** Cambia el id de un nodo vivo (el patch lo usa cuando un hijo se emparejó por key). */
    public void _rekey(String newId) {
        this.id = Objects.requireNonNull(newId, "id");
    }

    /** Clave de lista: el binding {@code key} si existe. */
    public String key() {
        Object k = bindings.get(KEY_BINDING);
        return k == null ? null : String.valueOf(k);
    }

    // ---------------------------------------------------------------------
    // Árbol
    // ---------------------------------------------------------------------

    public List<TxNode> children() {
        return Collections.unmodifiableList(children);
    }

    public int childCount() {
        return children.size();
    }

    public TxNode childAt(int index) {
        return children.get(index);
    }

    /** Índice por identidad, -1 si no es hijo directo. */
    public int indexOf(TxNode child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) return i;
        }
        return -1;
    }

    public TxNode parent() {
        return parent == null ? null : parent.get();
    }

    public boolean isRoot() {
        return parent() == null;
    }

    public void addChild(TxNode child) {
        insertChild(children.size(), child);
    }

    /**
     * Inserta en {@code index}, acotado a [0, childCount]. Devuelve el índice real.
     */
    public int insertChild(int index, TxNode child) {
        Objects.requireNonNull(child, "child");
        if (child == this) throw new IllegalArgumentException("Un nodo no puede ser hijo de sí mismo");
        if (child.parent() != null) {
            throw new IllegalStateException("El nodo " + child.id + " ya tiene padre: " + child.parent().id);
        }
        int at = Math.max(0, Math.min(index, children.size()));
        children.add(at, child);
        child.parent = new WeakReference<>(this);
        return at;
    }

    public boolean removeChild(TxNode child) {
        int i = indexOf(child);
        if (i < 0) return false;
        children.remove(i);
        child.parent = null;
        return true;
    }

    public void removeAllChildren() {
        for (TxNode c : children) c.parent = null;
        children.clear();
    }

    /** Mueve un hijo existente a {@code index} (acotado). Devuelve el índice real o -1. */
    public int moveChild(TxNode child, int index) {
        int from = indexOf(child);
        if (from < 0) return -1;
        children.remove(from);
        int at = Math.max(0, Math.min(index, children.size()));
        children.add(at, child);
        return at;
    }

    /** Recorrido pre-orden, iterativo para no depender de la profundidad del árbol. */
    public void walk(Consumer<TxNode> visitor) {
        Deque<TxNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            TxNode n = stack.pop();
            visitor.accept(n);
            for (int i = n.children.size() - 1; i >= 0; i--) {
                stack.push(n.children.get(i));
            }
        }
    }

    public TxNode find(String nodeId) {
        Deque<TxNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            TxNode n = stack.pop();
            if (n.id.equals(nodeId)) return n;
            for (TxNode c : n.children) stack.push(c);
        }
        return null;
    }

    public int subtreeSize() {
        int[] count = {0};
        walk(n -> count[0]++);
        return count[0];
    }

    // ---------------------------------------------------------------------
    // Datos
    // ---------------------------------------------------------------------

    public Map<String, Object> bindings() {
        return Collections.unmodifiableMap(bindings);
    }

    public Object binding(String name) {
        return bindings.get(name);
    }

    public void putBinding(String name, Object value) {
        bindings.put(name, value);
    }

    public void removeBinding(String name) {
        bindings.remove(name);
    }

    public void clearBindings() {
        bindings.clear();
    }

    /** Expresiones declaradas en el template (binding → "${...}"); las resuelve el DataBinder. */
    public Map<String, String> expressions() {
        return expressions;
    }

    /** Campos propios del tipo (text, src, title, disabled...). */
    public Map<String, Object> props() {
        return Collections.unmodifiableMap(props);
    }

    public Object prop(String name) {
        return props.get(name);
    }

    public void putProp(String name, Object value) {
        if (value == null) props.remove(name);
        else props.put(name, value);
    }

    public void removeProp(String name) {
        props.remove(name);
    }

    public Map<String, Object> events() {
        return events;
    }

    /**
     * Valor efectivo de un campo: el binding resuelto gana sobre el prop estático.
     */
    public Object resolved(String name) {
        Object v = bindings.get(name);
        return v != null ? v : props.get(name);
    }

    // ---------------------------------------------------------------------
    // Layout
    // ---------------------------------------------------------------------

    public Frame layoutResult() {
        return layoutResult;
    }

    public void setLayoutResult(Frame frame) {
        this.layoutResult = frame == null ? Frame.ZERO : frame;
    }

    public LayoutSlot _layoutSlot() {
        return layoutSlot;
    }

    public void _assignLayoutSlot(LayoutSlot slot) {
        if (layoutSlot != null && slot != null) {
            throw new IllegalStateException("El nodo " + id + " ya tiene " + layoutSlot + " (¿layout concurrente del mismo árbol?)");
        }
        this.layoutSlot = slot;
    }

    public void _clearLayoutSlot() {
        this.layoutSlot = null;
    }

    /**
     * Contenedor puro, sin efecto visual ni eventos, que no es raíz: no materializa vista
     * y su offset se pliega en los frames de sus hijos.
     */
    public boolean isFlattenable() {
        return !isRoot()
                && kind.isPlainContainer()
                && events.isEmpty()
                && !style.hasVisualEffect();
    }

    // ---------------------------------------------------------------------
    // Vista (propiedad externa; sólo hilo UI)
    // ---------------------------------------------------------------------

    public Object viewHandle() {
        return viewHandle;
    }

    public boolean isPlaceholderView() {
        return placeholderView;
    }

    public void _attachView(Object view, boolean placeholder) {
        this.viewHandle = view;
        this.placeholderView = placeholder;
        this.lastAppliedStyle = null;
        this.lastAppliedFrame = null;
    }

    public void _detachView() {
        this.viewHandle = null;
        this.placeholderView = false;
        this.lastAppliedStyle = null;
        this.lastAppliedFrame = null;
        this.forceApply = false;
    }

    public Style _lastAppliedStyle()  { return lastAppliedStyle; }
    public Frame _lastAppliedFrame()  { return lastAppliedFrame; }
    public boolean _forceApply()      { return forceApply; }

    public void _rememberAppliedStyle(Style s)  { this.lastAppliedStyle = s; }
    public void _rememberAppliedFrame(Frame f)  { this.lastAppliedFrame = f; }

    /** La vista viene del pool de reciclaje: su estado visual no es el memorizado. */
    public void _markForceApply()   { this.forceApply = true; }
    public void _clearForceApply()  { this.forceApply = false; }

    // ---------------------------------------------------------------------
    // Clonado
    // ---------------------------------------------------------------------

    /**
     * Copia por valor de estilo, bindings, props, eventos y último layout. Sin hijos,
     * sin padre, sin vista ni slot: el llamador adjunta los descendientes.
     */
    public TxNode copyShallow() {
        TxNode copy = new TxNode(id, kind, typeName, style, expressions, events);
        bindings.forEach((k, v) -> copy.bindings.put(k, copyValue(v)));
        props.forEach((k, v) -> copy.props.put(k, copyValue(v)));
        copy.layoutResult = layoutResult;
        return copy;
    }

    /** Listas y mapas anidados se copian; el resto de valores se tratan como inmutables. */
    static Object copyValue(Object value) {
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) copy.add(copyValue(item));
            return copy;
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>(map.size() * 2);
            map.forEach((k, v) -> copy.put(k, copyValue(v)));
            return copy;
        }
        return value;
    }

    /** Clona el subárbol completo y reconstruye los enlaces padre/hijo. */
    public TxNode deepCopy() {
        TxNode root = copyShallow();
        Deque<TxNode[]> stack = new ArrayDeque<>();
        stack.push(new TxNode[]{this, root});
        while (!stack.isEmpty()) {
            TxNode[] pair = stack.pop();
            for (TxNode child : pair[0].children) {
                TxNode c = child.copyShallow();
                pair[1].addChild(c);
                stack.push(new TxNode[]{child, c});
            }
        }
        return root;
    }

    @Override
    public String toString() {
        return kind.typeName() + "#" + id + (children.isEmpty() ? "" : "[" + children.size() + "]");
    }

    // ---------------------------------------------------------------------

    public static final class Builder {
        private final String id;
        private final NodeKind kind;
        private String typeName;
        private Style style = Style.DEFAULT;
        private final Map<String, Object> bindings = new LinkedHashMap<>();
        private final Map<String, String> expressions = new LinkedHashMap<>();
        private final Map<String, Object> props = new LinkedHashMap<>();
        private final Map<String, Object> events = new LinkedHashMap<>();
        private final List<TxNode> children = new ArrayList<>();

        private Builder(String id, NodeKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder typeName(String v)             { this.typeName = v; return this; }
        public Builder style(Style v)                 { this.style = v; return this; }
        public Builder binding(String k, Object v)    { this.bindings.put(k, v); return this; }
        public Builder expression(String k, String v) { this.expressions.put(k, v); return this; }
        public Builder prop(String k, Object v)       { this.props.put(k, v); return this; }
        public Builder event(String k, Object v)      { this.events.put(k, v); return this; }
        public Builder child(TxNode c)                { this.children.add(c); return this; }

        public Builder children(List<TxNode> cs) {
            this.children.addAll(cs);
            return this;
        }

        public TxNode build() {
            TxNode n = new TxNode(id, kind, typeName, style, expressions, events);
            n.bindings.putAll(bindings);
            n.props.putAll(props);
            for (TxNode c : children) n.addChild(c);
            return n;
        }
    }
}
