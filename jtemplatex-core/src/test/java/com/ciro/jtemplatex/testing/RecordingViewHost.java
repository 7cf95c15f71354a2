package com.ciro.jtemplatex.testing;

import com.ciro.jtemplatex.node.Frame;
import com.ciro.jtemplatex.node.NodeKind;
import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.spi.ViewHost;

public final class RecordingViewHost implements ViewHost {

    public int inserts;
    public int removals;
    public int placeholders;

    @Override
    public void insertChild(Object parent, Object child, int index) {
        FakeView p = (FakeView) parent;
        FakeView c = (FakeView) child;
        if (c.parent != null) c.parent.children.remove(c);
        p.children.add(Math.max(0, Math.min(index, p.children.size())), c);
        c.parent = p;
        inserts++;
    }

    @Override
    public void removeFromParent(Object view) {
        FakeView v = (FakeView) view;
        if (v.parent == null) return;
        v.parent.children.remove(v);
        v.parent = null;
        removals++;
    }

    @Override
    public Object parentOf(Object view) {
        return ((FakeView) view).parent;
    }

    @Override
    public int childCount(Object parent) {
        return ((FakeView) parent).children.size();
    }

    @Override
    public Object childAt(Object parent, int index) {
        return ((FakeView) parent).children.get(index);
    }

    @Override
    public void setFrame(Object view, Frame frame) {
        FakeView v = (FakeView) view;
        v.frame = frame;
        v.frameSets++;
    }

    @Override
    public void setHidden(Object view, boolean hidden) {
        ((FakeView) view).hidden = hidden;
    }

    @Override
    public void setAlpha(Object view, float alpha) {
        ((FakeView) view).alpha = alpha;
    }

    @Override
    public Object createPlaceholder(TxNode node, String reason) {
        placeholders++;
        return new FakeView(NodeKind.UNKNOWN, node.id(), true);
    }
}
