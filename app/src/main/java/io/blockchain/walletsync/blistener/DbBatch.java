package io.blockchain.walletsync.blistener;

import io.blockchain.walletsync.chain.ChainStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Storage operations a listener wants executed together with a chain batch.
 */
public final class DbBatch {

    @FunctionalInterface
    public interface Op {
        void apply(ChainStore store);
    }

    private static final DbBatch EMPTY = new DbBatch(List.of());

    private final List<Op> ops;

    private DbBatch(List<Op> ops) {
        this.ops = List.copyOf(ops);
    }

    public static DbBatch empty() {
        return EMPTY;
    }

    public static DbBatch of(Op... ops) {
        return new DbBatch(List.of(ops));
    }

    public DbBatch then(DbBatch next) {
        if (next.isEmpty()) return this;
        if (isEmpty()) return next;
        List<Op> all = new ArrayList<>(ops);
        all.addAll(next.ops);
        return new DbBatch(all);
    }

    public List<Op> ops() { return ops; }
    public boolean isEmpty() { return ops.isEmpty(); }
    public int size() { return ops.size(); }

    @Override public String toString() {
        return "DbBatch{ops=" + ops.size() + "}";
    }
}
