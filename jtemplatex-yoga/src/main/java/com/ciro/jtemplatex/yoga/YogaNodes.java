package com.ciro.jtemplatex.yoga;

import static org.lwjgl.system.MemoryUtil.NULL;
import static org.lwjgl.util.yoga.Yoga.*;

/** {@link NativeNodes} sobre Yoga (LWJGL). */
final class YogaNodes implements NativeNodes {

    static final YogaNodes INSTANCE = new YogaNodes();

    private YogaNodes() {}

    @Override
    public long create() {
        long h = YGNodeNew();
        if (h == NULL) throw new IllegalStateException("YGNodeNew devolvió NULL");
        return h;
    }

    @Override
    public void detach(long handle) {
        long owner = YGNodeGetOwner(handle);
        if (owner != NULL) YGNodeRemoveChild(owner, handle);
        YGNodeRemoveAllChildren(handle);
    }

    @Override
    public void reset(long handle) {
        YGNodeReset(handle);
    }

    @Override
    public void free(long handle) {
        YGNodeFree(handle);
    }
}
