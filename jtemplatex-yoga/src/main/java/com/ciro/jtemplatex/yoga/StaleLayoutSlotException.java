package com.ciro.jtemplatex.yoga;

import com.ciro.jtemplatex.layout.LayoutSlot;

/** Un slot ya liberado (o de otra generación) se usó como si siguiera vivo. */
public class StaleLayoutSlotException extends IllegalStateException {

    private final LayoutSlot slot;

    public StaleLayoutSlotException(LayoutSlot slot, String detail) {
        super("Slot de layout inválido " + slot + ": " + detail);
        this.slot = slot;
    }

    public LayoutSlot slot() {
        return slot;
    }
}
