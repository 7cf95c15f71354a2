package com.ciro.jtemplatex.standalone;

import com.ciro.jtemplatex.node.Frame;
import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.spi.ViewHost;

/** {@link ViewHost} sobre {@link HeadlessView}. */
public final class HeadlessViewHost implements ViewHost {

    private long hierarchyChanges;

    @Override
    public void insertChild(Object parent, Object child, int index) {
        HeadlessView p = cast(parent);
        HeadlessView c = cast(child);
        if (c.parent != null) {
            c.parent.children.remove(c);
        }
        int at = Math.max(0, Math.min(index, p.children.size()));
        p.children.add(at, c);
        c.parent = p;
        hierarchyChanges++;
    }

    @Override
    public void removeFromParent(Object view) {
        HeadlessView v = cast(view);
        if (v.parent == null) return;
        v.parent.children.remove(v);
        v.parent = null;
        hierarchyChanges++;
    }

    @Override
    public Object parentOf(Object view) {
        return cast(view).parent;
    }

    @Override
    public int childCount(Object parent) {
        return cast(parent).children.size();
    }

    @Override
    public Object childAt(Object parent, int index) {
        return cast(parent).children.get(index);
    }

    @Override
    public void setFrame(Object view, Frame frame) {
        cast(view).setFrame(frame);
    }

    @Override
    public void setHidden(Object view, boolean hidden) {
        cast(view).setHidden(hidden);
    }

    @Override
    public void setAlpha(Object view, float alpha) {
        cast(view).setAlpha(alpha);
    }

    @Override
    public Object createPlaceholder(TxNode node, String reason) {
        return HeadlessView.placeholder(node.id(), reason);
    }

    /** Inserciones y remociones hechas desde la creación; útil para medir cuánto toca un patch. */
    public long hierarchyChanges() {
        return hierarchyChanges;
    }

    private static HeadlessView cast(Object view) {
        if (view instanceof HeadlessView hv) return hv;
        throw new IllegalArgumentException("No es una HeadlessView: " + view);
    }
}
