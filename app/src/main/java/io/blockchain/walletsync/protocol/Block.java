package io.blockchain.walletsync.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Block = header + list of transactions.
 * Genesis blocks never carry transactions; main blocks carry zero or more.
 */
public final class Block {
    private final BlockHeader header;
    private final List<Transaction> transactions;

    public Block(BlockHeader header, List<Transaction> txs) {
        this.header = header;
        this.transactions = txs != null ? List.copyOf(txs) : List.of();
        basicValidate();
    }

    public static Block genesis(BlockHeader header) {
        return new Block(header, List.of());
    }

    public BlockHeader header() { return header; }
    public List<Transaction> transactions() { return transactions; }
    public boolean isGenesis() { return header.isGenesis(); }
    public Hash hash() { return header.hash(); }

    /** Merkle root over tx ids, pairwise SHA-256, last leaf duplicated on odd levels. */
    public static Hash merkleRootOf(List<Transaction> txs) {
        if (txs.isEmpty()) return Hash.ZERO;
        List<Hash> level = new ArrayList<>(txs.size());
        for (Transaction tx : txs) level.add(tx.id());
        while (level.size() > 1) {
            List<Hash> next = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i < level.size(); i += 2) {
                Hash left = level.get(i);
                Hash right = i + 1 < level.size() ? level.get(i + 1) : left;
                byte[] concat = new byte[Hash.LENGTH * 2];
                System.arraycopy(left.bytes(), 0, concat, 0, Hash.LENGTH);
                System.arraycopy(right.bytes(), 0, concat, Hash.LENGTH, Hash.LENGTH);
                next.add(Hash.of(concat));
            }
            level = next;
        }
        return level.get(0);
    }

    public void basicValidate() {
        if (header == null) throw new IllegalArgumentException("missing header");
        if (header.isGenesis() && !transactions.isEmpty()) {
            throw new IllegalArgumentException("genesis block cannot carry transactions");
        }
        if (transactions.size() > 1_000_000) throw new IllegalArgumentException("too many txs"); // sanity cap
    }

    @Override public String toString() {
        return "Block{" + (isGenesis() ? "genesis " : "") + "slot=" + header.slot() + ", txs=" + transactions.size() + "}";
    }
}
