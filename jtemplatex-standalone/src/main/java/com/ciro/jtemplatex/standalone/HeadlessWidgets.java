package com.ciro.jtemplatex.standalone;

import com.ciro.jtemplatex.node.NodeKind;
import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.spi.WidgetMaterializer;
import com.ciro.jtemplatex.spi.WidgetRegistry;

import java.util.List;

/** Materializadores headless para todos los tipos conocidos. */
public final class HeadlessWidgets {

    private HeadlessWidgets() {}

    public static WidgetRegistry registry() {
        return new WidgetRegistry()
                .register(NodeKind.VIEW, new Materializer(NodeKind.VIEW, List.of()))
                .register(NodeKind.CONTAINER, new Materializer(NodeKind.CONTAINER, List.of()))
                .register(NodeKind.TEXT, new Materializer(NodeKind.TEXT, List.of("text")))
                .register(NodeKind.IMAGE, new Materializer(NodeKind.IMAGE, List.of("src", "scaleType")))
                .register(NodeKind.BUTTON, new Materializer(NodeKind.BUTTON, List.of("title", "disabled")))
                .register(NodeKind.INPUT, new Materializer(NodeKind.INPUT, List.of("text", "placeholder", "disabled")))
                .register(NodeKind.SCROLL, new Materializer(NodeKind.SCROLL, List.of("horizontal")));
    }

    /**
     * Crea la vista del tipo y copia a su contenido los campos listados, con el valor
     * resuelto (binding sobre prop).
     */
    record Materializer(NodeKind kind, List<String> fields) implements WidgetMaterializer {

        @Override
        public Object create(TxNode node) {
            return new HeadlessView(kind, node.id());
        }

        @Override
        public void update(Object view, TxNode node) {
            HeadlessView v = (HeadlessView) view;
            // una vista reciclada o un rekey dejan el id viejo
            v.setNodeId(node.id());
            for (String f : fields) {
                v.putContent(f, node.resolved(f));
            }
        }
    }
}
