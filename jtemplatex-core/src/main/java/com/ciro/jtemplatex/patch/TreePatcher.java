package com.ciro.jtemplatex.patch;

import com.ciro.jtemplatex.diff.EditOperation;
import com.ciro.jtemplatex.diff.EditScript;
import com.ciro.jtemplatex.diff.PropertyChanges;
import com.ciro.jtemplatex.node.TxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parte estructural del patch: aplica el edit script sobre el árbol de nodos, sin
 * tocar vistas ni layout. No depende del hilo.
 * <p>
 * Los ids del script son los del árbol antes de aplicarlo, así que el índice id → nodo
 * se arma una vez y no se actualiza con los cambios de id de los updates.
 */
public final class TreePatcher {

    private static final Logger log = LoggerFactory.getLogger(TreePatcher.class);

    /**
     * @param root         raíz resultante (puede ser otra o null)
     * @param previousRoot la raíz anterior si fue reemplazada o borrada, si no null
     * @param applied      operaciones aplicadas (las que referencian nodos inexistentes se saltan)
     * @param detached     subárboles que salieron del árbol, con sus vistas aún puestas
     */
    public record Outcome(TxNode root, TxNode previousRoot, int applied, List<TxNode> detached) {}

    private TxNode root;
    private TxNode previousRoot;
    private final Map<String, TxNode> index = new HashMap<>();
    // id original de cada nodo indexado: un update puede haberle cambiado el id
    private final Map<TxNode, String> originalIds = new IdentityHashMap<>();
    private final List<TxNode> detached = new ArrayList<>();

    private TreePatcher(TxNode root) {
        this.root = root;
        if (root != null) {
            root.walk(n -> {
                if (index.putIfAbsent(n.id(), n) == null) originalIds.put(n, n.id());
            });
        }
    }

    public static Outcome apply(EditScript script, TxNode root) {
        TreePatcher p = new TreePatcher(root);
        int applied = 0;
        for (EditOperation op : script.operations()) {
            if (p.applyOne(op)) applied++;
        }
        return new Outcome(p.root, p.previousRoot, applied, List.copyOf(p.detached));
    }

    private boolean applyOne(EditOperation op) {
        if (op instanceof EditOperation.Insert ins) return insert(ins);
        if (op instanceof EditOperation.Delete del) return delete(del);
        if (op instanceof EditOperation.Update upd) return update(upd);
        if (op instanceof EditOperation.Move mv) return move(mv);
        if (op instanceof EditOperation.Replace rep) return replace(rep);
        log.warn("Operación desconocida {}", op);
        return false;
    }

    private boolean insert(EditOperation.Insert op) {
        TxNode copy = op.node().deepCopy();
        // insert de raíz: parentId == id propio
        if (op.parentId().equals(op.node().id())) {
            if (root != null) detachRoot();
            root = copy;
            return true;
        }
        TxNode parent = index.get(op.parentId());
        if (parent == null) {
            log.warn("insert '{}': el padre '{}' no existe en el árbol vivo", op.node().id(), op.parentId());
            return false;
        }
        parent.insertChild(op.index(), copy);
        return true;
    }

    private boolean delete(EditOperation.Delete op) {
        TxNode node = index.get(op.id());
        if (node == null) {
            log.warn("delete '{}': no existe", op.id());
            return false;
        }
        if (node == root) {
            detachRoot();
            root = null;
            return true;
        }
        TxNode parent = node.parent();
        if (parent == null || !parent.removeChild(node)) {
            log.warn("delete '{}': no está colgado de '{}'", op.id(), op.parentId());
            return false;
        }
        detach(node);
        return true;
    }

    private boolean update(EditOperation.Update op) {
        TxNode node = index.get(op.id());
        if (node == null) {
            log.warn("update '{}': no existe", op.id());
            return false;
        }
        TxNode source = op.source();
        PropertyChanges changes = op.changes();
        if (changes.styleChanges() != null) {
            node.setStyle(changes.styleChanges());
        }
        if (changes.bindingChanges() != null) {
            changes.bindingChanges().forEach((k, v) -> {
                // null en el delta = clave borrada, salvo que el nodo nuevo tenga null de verdad
                if (v == null && !source.bindings().containsKey(k)) node.removeBinding(k);
                else node.putBinding(k, v);
            });
        }
        if (changes.propsChanged()) {
            FieldCopier.ALL_PROPS.copy(source, node);
        }
        if (op.rekeys()) {
            node._rekey(source.id());
        }
        return true;
    }

    private boolean move(EditOperation.Move op) {
        TxNode node = index.get(op.id());
        TxNode parent = index.get(op.parentId());
        if (node == null || parent == null || node.parent() != parent) {
            log.warn("move '{}' en '{}': nodo o padre inconsistentes", op.id(), op.parentId());
            return false;
        }
        parent.moveChild(node, op.toIndex());
        return true;
    }

    private boolean replace(EditOperation.Replace op) {
        TxNode old = index.get(op.oldId());
        if (old == null) {
            log.warn("replace '{}': no existe", op.oldId());
            return false;
        }
        TxNode copy = op.node().deepCopy();
        if (old == root) {
            detachRoot();
            root = copy;
            return true;
        }
        TxNode parent = old.parent();
        int at = parent.indexOf(old);
        parent.removeChild(old);
        parent.insertChild(at, copy);
        detach(old);
        return true;
    }

    private void detachRoot() {
        if (previousRoot == null) previousRoot = root;
        else detached.add(root);
        unindex(root);
    }

    private void detach(TxNode subtree) {
        detached.add(subtree);
        unindex(subtree);
    }

    private void unindex(TxNode subtree) {
        subtree.walk(n -> {
            String id = originalIds.remove(n);
            if (id != null) index.remove(id, n);
        });
    }
}
