package com.ciro.jtemplatex.layout;

/**
 * Referencia a un nodo del pool de layout: índice dentro del arena + generación.
 * Al liberar un slot el pool incrementa la generación, así un slot viejo se detecta
 * en vez de apuntar a un nodo nativo que ya usa otro árbol.
 */
public record LayoutSlot(int index, int generation) {

    @Override
    public String toString() {
        return "slot#" + index + "@" + generation;
    }
}
