package com.ciro.jtemplatex.diff;

import com.ciro.jtemplatex.node.TxNode;
import com.ciro.jtemplatex.style.Style;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reconciliador de árboles: produce el edit script que transforma el árbol viejo en
 * el nuevo.
 * <p>
 * Por cada par emparejado: (1) si cambia el tipo, {@code replace} y no se baja más;
 * (2) estilo, bindings y campos propios → un {@code update}; (3) lista de hijos.
 * <p>
 * Hijos: se empareja por {@code key} cuando ambos la declaran, por id si no. Primero
 * los prefijos y sufijos comunes, luego el medio con mapas key/id. Gana el primer
 * emparejamiento; un duplicado posterior queda como insert. Los emparejados que no
 * están en la subsecuencia estable más larga se mueven.
 * <p>
 * Orden de emisión por padre: deletes (índice viejo ascendente), luego por cada índice
 * nuevo ascendente: insert o move del hijo y a continuación su update y su diff
 * recursivo. Los índices de insert/move se calculan sobre una copia simulada de la
 * lista viva, así se pueden aplicar en secuencia sin recalcular nada.
 * <p>
 * Sin estado: se puede usar desde cualquier hilo.
 */
public final class TreeDiffer {

    private static final Logger log = LoggerFactory.getLogger(TreeDiffer.class);

    public static final int DEFAULT_MAX_DEPTH = 50;

    private final int maxDepth;

    public TreeDiffer() {
        this(DEFAULT_MAX_DEPTH);
    }

    public TreeDiffer(int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth < 1");
        this.maxDepth = maxDepth;
    }

    public EditScript diff(TxNode oldTree, TxNode newTree) {
        if (oldTree == null && newTree == null) return EditScript.EMPTY;

        List<EditOperation> ops = new ArrayList<>();
        if (oldTree == null) {
            ops.add(new EditOperation.Insert(newTree, 0, newTree.id()));
        } else if (newTree == null) {
            ops.add(new EditOperation.Delete(oldTree.id(), oldTree.id()));
        } else {
            TxNode p = oldTree.parent();
            diffNode(oldTree, newTree, p != null ? p.id() : oldTree.id(), ops, 0);
        }

        EditScript script = new EditScript(ops);
        if (log.isTraceEnabled()) log.trace("diff {} → {}: {}", oldTree, newTree, script.statistics());
        return script;
    }

    // ---------------------------------------------------------------------
    // Nodo
    // ---------------------------------------------------------------------

    private void diffNode(TxNode old, TxNode neu, String parentId, List<EditOperation> ops, int depth) {
        if (depth > maxDepth) {
            log.warn("⚠️ Diff cortado: profundidad {} supera el máximo {} en '{}'", depth, maxDepth, old.id());
            return;
        }

        // 1. Cambio de tipo: no hay diff fino posible
        if (old.kind() != neu.kind()) {
            ops.add(new EditOperation.Replace(old.id(), neu, parentId));
            return;
        }

        // 2. Propiedades
        PropertyChanges changes = diffProperties(old, neu);
        if (!changes.isEmpty() || !old.id().equals(neu.id())) {
            ops.add(new EditOperation.Update(old.id(), changes, neu));
        }

        // 3. Hijos
        diffChildren(old, neu, ops, depth + 1);
    }

    static PropertyChanges diffProperties(TxNode old, TxNode neu) {
        // estilo: igualdad de valor completa, nada de seguimiento por campo
        Style styleChanges = old.style().equals(neu.style()) ? null : neu.style();
        Map<String, Object> bindingDelta = bindingDelta(old.bindings(), neu.bindings());
        boolean propsChanged = !sameValues(old.props(), neu.props());
        if (styleChanges == null && bindingDelta == null && !propsChanged) return PropertyChanges.NONE;
        return new PropertyChanges(styleChanges, bindingDelta, propsChanged);
    }

    /**
     * Claves nuevas o con valor distinto, más las borradas con valor null. null si no hay cambios.
     */
    static Map<String, Object> bindingDelta(Map<String, Object> old, Map<String, Object> neu) {
        Map<String, Object> delta = null;
        for (Map.Entry<String, Object> e : neu.entrySet()) {
            String k = e.getKey();
            if (!old.containsKey(k) || !Objects.deepEquals(old.get(k), e.getValue())) {
                if (delta == null) delta = new LinkedHashMap<>();
                delta.put(k, e.getValue());
            }
        }
        for (String k : old.keySet()) {
            if (!neu.containsKey(k)) {
                if (delta == null) delta = new LinkedHashMap<>();
                delta.put(k, null);
            }
        }
        return delta == null ? null : Collections.unmodifiableMap(delta);
    }

    private static boolean sameValues(Map<String, Object> a, Map<String, Object> b) {
        if (a.size() != b.size()) return false;
        for (Map.Entry<String, Object> e : a.entrySet()) {
            if (!b.containsKey(e.getKey()) || !Objects.deepEquals(e.getValue(), b.get(e.getKey()))) return false;
        }
        return true;
    }

    // ---------------------------------------------------------------------
    // Hijos
    // ---------------------------------------------------------------------

    private void diffChildren(TxNode oldParent, TxNode newParent, List<EditOperation> ops, int depth) {
        List<TxNode> oc = oldParent.children();
        List<TxNode> nc = newParent.children();
        String parentId = oldParent.id();

        if (oc.isEmpty() && nc.isEmpty()) return;

        if (oc.isEmpty()) {
            for (int i = 0; i < nc.size(); i++) {
                ops.add(new EditOperation.Insert(nc.get(i), i, parentId));
            }
            return;
        }
        if (nc.isEmpty()) {
            for (TxNode o : oc) ops.add(new EditOperation.Delete(o.id(), parentId));
            return;
        }

        int[] newToOld = match(oc, nc);
        boolean[] oldMatched = new boolean[oc.size()];
        for (int oi : newToOld) if (oi >= 0) oldMatched[oi] = true;

        // Deletes primero: la lista viva queda sólo con los emparejados, en orden viejo
        List<TxNode> live = new ArrayList<>(oc.size());
        for (int i = 0; i < oc.size(); i++) {
            if (oldMatched[i]) live.add(oc.get(i));
            else ops.add(new EditOperation.Delete(oc.get(i).id(), parentId));
        }

        boolean[] stable = stableNewIndices(newToOld);
        TxNode[] placed = new TxNode[nc.size()];

        for (int j = 0; j < nc.size(); j++) {
            TxNode n = nc.get(j);
            int oi = newToOld[j];

            if (oi < 0) {
                int at = slotAfter(live, placed, j);
                live.add(at, n);
                placed[j] = n;
                ops.add(new EditOperation.Insert(n, at, parentId));
                continue;
            }

            TxNode o = oc.get(oi);
            placed[j] = o;
            if (!stable[j]) {
                int from = indexOfIdentity(live, o);
                live.remove(from);
                int to = slotAfter(live, placed, j);
                live.add(to, o);
                if (from != to) ops.add(new EditOperation.Move(o.id(), from, to, parentId));
            }
            diffNode(o, n, parentId, ops, depth);
        }
    }

    /**
     * Emparejamiento nuevo → viejo (-1 = sin pareja).
     */
    static int[] match(List<TxNode> oc, List<TxNode> nc) {
        int[] newToOld = new int[nc.size()];
        Arrays.fill(newToOld, -1);
        boolean[] oldMatched = new boolean[oc.size()];

        // Prefijo común
        int head = 0;
        int limit = Math.min(oc.size(), nc.size());
        while (head < limit && canMatch(oc.get(head), nc.get(head))) {
            newToOld[head] = head;
            oldMatched[head] = true;
            head++;
        }

        // Sufijo común
        int oe = oc.size() - 1;
        int ne = nc.size() - 1;
        while (oe >= head && ne >= head && canMatch(oc.get(oe), nc.get(ne))) {
            newToOld[ne] = oe;
            oldMatched[oe] = true;
            oe--;
            ne--;
        }

        if (head > ne) return newToOld;

        // Medio: el primero que aparece gana (putIfAbsent)
        Map<String, Integer> byKey = new HashMap<>();
        Map<String, Integer> byId = new HashMap<>();
        for (int i = head; i <= oe; i++) {
            TxNode o = oc.get(i);
            String k = o.key();
            if (k != null) byKey.putIfAbsent(k, i);
            byId.putIfAbsent(o.id(), i);
        }

        for (int j = head; j <= ne; j++) {
            TxNode n = nc.get(j);
            int found = -1;
            String k = n.key();
            if (k != null) {
                Integer i = byKey.get(k);
                if (i != null && !oldMatched[i] && canMatch(oc.get(i), n)) found = i;
            }
            if (found < 0) {
                Integer i = byId.get(n.id());
                if (i != null && !oldMatched[i] && canMatch(oc.get(i), n)) found = i;
            }
            if (found >= 0) {
                newToOld[j] = found;
                oldMatched[found] = true;
            }
        }
        return newToOld;
    }

    /** Misma key si ambos la tienen; si no, mismo id. El tipo no cuenta: un cambio de tipo es replace. */
    static boolean canMatch(TxNode old, TxNode neu) {
        String ok = old.key();
        String nk = neu.key();
        if (ok != null && nk != null) return ok.equals(nk);
        return old.id().equals(neu.id());
    }

    /**
     * Marca los índices nuevos cuya pareja vieja forma la subsecuencia creciente más larga:
     * esos no se mueven.
     */
    static boolean[] stableNewIndices(int[] newToOld) {
        int n = newToOld.length;
        boolean[] stable = new boolean[n];

        int[] seqNew = new int[n];
        int k = 0;
        for (int j = 0; j < n; j++) {
            if (newToOld[j] >= 0) seqNew[k++] = j;
        }
        if (k == 0) return stable;

        int[] tails = new int[k];
        int[] prev = new int[k];
        int len = 0;
        for (int i = 0; i < k; i++) {
            int v = newToOld[seqNew[i]];
            int lo = 0;
            int hi = len;
            while (lo < hi) {
                int mid = (lo + hi) >>> 1;
                if (newToOld[seqNew[tails[mid]]] < v) lo = mid + 1;
                else hi = mid;
            }
            prev[i] = lo > 0 ? tails[lo - 1] : -1;
            tails[lo] = i;
            if (lo == len) len++;
        }
        for (int i = tails[len - 1]; i >= 0; i = prev[i]) {
            stable[seqNew[i]] = true;
        }
        return stable;
    }

    /** Posición justo después del hermano anterior (ya colocado) en la lista simulada. */
    private static int slotAfter(List<TxNode> live, TxNode[] placed, int j) {
        if (j == 0) return 0;
        return indexOfIdentity(live, placed[j - 1]) + 1;
    }

    private static int indexOfIdentity(List<TxNode> list, TxNode node) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == node) return i;
        }
        return -1;
    }
}
