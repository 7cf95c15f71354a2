package com.ciro.jtemplatex.diff;

import java.util.List;

public record DiffStatistics(int inserts, int deletes, int updates, int moves, int replaces) {

    public static final DiffStatistics EMPTY = new DiffStatistics(0, 0, 0, 0, 0);

    public static DiffStatistics of(List<EditOperation> ops) {
        int i = 0, d = 0, u = 0, m = 0, r = 0;
        for (EditOperation op : ops) {
            if (op instanceof EditOperation.Insert) i++;
            else if (op instanceof EditOperation.Delete) d++;
            else if (op instanceof EditOperation.Update) u++;
            else if (op instanceof EditOperation.Move) m++;
            else if (op instanceof EditOperation.Replace) r++;
        }
        return new DiffStatistics(i, d, u, m, r);
    }

    public int total() {
        return inserts + deletes + updates + moves + replaces;
    }

    public DiffStatistics merge(DiffStatistics other) {
        return new DiffStatistics(inserts + other.inserts, deletes + other.deletes,
                updates + other.updates, moves + other.moves, replaces + other.replaces);
    }

    @Override
    public String toString() {
        return "+" + inserts + " -" + deletes + " ~" + updates + " ↕" + moves + " ⇄" + replaces;
    }
}
