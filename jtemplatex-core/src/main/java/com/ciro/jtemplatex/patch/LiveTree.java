package com.ciro.jtemplatex.patch;

import com.ciro.jtemplatex.node.Size;
import com.ciro.jtemplatex.node.TxNode;

import java.util.Map;

/**
 * Árbol vivo de una vista renderizada: raíz (puede cambiar por un replace/insert de
 * raíz), últimos datos y último tamaño de contenedor. Sólo hilo UI.
 */
public final class LiveTree {

    private TxNode root;
    private Map<String, Object> data;
    private Size containerSize;
    private String templateId;

    public LiveTree(TxNode root, Map<String, Object> data, Size containerSize) {
        this.root = root;
        this.data = data == null ? Map.of() : data;
        this.containerSize = containerSize;
    }

    public TxNode root()                  { return root; }
    public Map<String, Object> data()     { return data; }
    public Size containerSize()           { return containerSize; }
    public String templateId()            { return templateId; }

    public Object rootView() {
        return root == null ? null : root.viewHandle();
    }

    void setRoot(TxNode root) {
        this.root = root;
    }

    public void setData(Map<String, Object> data) {
        this.data = data == null ? Map.of() : data;
    }

    public void setContainerSize(Size size) {
        this.containerSize = size;
    }

    public void setTemplateId(String templateId) {
        this.templateId = templateId;
    }
}
