package com.ciro.jtemplatex.diff;

import com.ciro.jtemplatex.node.TxNode;

/**
 * Operación del edit script.
 * <p>
 * Todos los ids (nodo y padre) son los del árbol viejo tal como estaba antes de aplicar
 * el script: un {@link Update} que cambia el id de un nodo no afecta a cómo lo
 * referencian las operaciones siguientes. Los índices sí son secuenciales: valen para
 * la lista de hijos después de aplicar las operaciones anteriores del mismo padre.
 * <p>
 * Convención para la raíz: {@code parentId} igual al id del propio nodo.
 */
public interface EditOperation {

    /** Id del nodo afectado. */
    String targetId();

    /** Inserta {@code node} (subárbol completo) como hijo {@code index} de {@code parentId}. */
    record Insert(TxNode node, int index, String parentId) implements EditOperation {
        @Override public String targetId() { return node.id(); }
    }

    /** Quita el subárbol con raíz {@code id}. */
    record Delete(String id, String parentId) implements EditOperation {
        @Override public String targetId() { return id; }
    }

    /**
     * Copia propiedades sobre el nodo vivo {@code id}. {@code source} es el nodo nuevo
     * (de él salen los campos propios del tipo y, si difiere, el id nuevo).
     */
    record Update(String id, PropertyChanges changes, TxNode source) implements EditOperation {
        @Override public String targetId() { return id; }

        public boolean rekeys() {
            return !id.equals(source.id());
        }
    }

    /** Mueve un hijo de {@code fromIndex} a {@code toIndex} dentro de {@code parentId}. */
    record Move(String id, int fromIndex, int toIndex, String parentId) implements EditOperation {
        @Override public String targetId() { return id; }
    }

    /** Cambio de tipo: el subárbol {@code oldId} se sustituye por {@code node} en la misma posición. */
    record Replace(String oldId, TxNode node, String parentId) implements EditOperation {
        @Override public String targetId() { return oldId; }
    }
}
