package com.ciro.jtemplatex.diff;

import java.util.List;

/**
 * Resultado del differ: operaciones en orden de aplicación + contadores.
 */
public final class EditScript {

    public static final EditScript EMPTY = new EditScript(List.of());

    private final List<EditOperation> operations;
    private final DiffStatistics statistics;

    public EditScript(List<EditOperation> operations) {
        this.operations = List.copyOf(operations);
        this.statistics = DiffStatistics.of(this.operations);
    }

    public List<EditOperation> operations() {
        return operations;
    }

    public DiffStatistics statistics() {
        return statistics;
    }

    public boolean hasDiff() {
        return !operations.isEmpty();
    }

    public int operationCount() {
        return operations.size();
    }

    public <T extends EditOperation> List<T> ofType(Class<T> type) {
        return operations.stream().filter(type::isInstance).map(type::cast).toList();
    }

    @Override
    public String toString() {
        return "EditScript{" + statistics + "}";
    }
}
