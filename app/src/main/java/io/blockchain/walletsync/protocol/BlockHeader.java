package io.blockchain.walletsync.protocol;

import io.blockchain.walletsync.slotting.SlotId;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Header: everything needed to identify a block and place it in time.
 * - parentHash: link to previous block (zero hash for the first genesis block)
 * - merkleRoot: commitment to all txs in this block
 * - slot: epoch/slot the block was issued in; genesis blocks sit at slot 0 of their epoch
 * - difficulty: number of main blocks on the chain up to and including this one
 * - genesis: epoch-boundary block without transactions
 */
public final class BlockHeader {
    private final Hash parentHash;
    private final Hash merkleRoot;
    private final SlotId slot;
    private final long difficulty;
    private final boolean genesis;

    public BlockHeader(Hash parentHash, Hash merkleRoot, SlotId slot, long difficulty, boolean genesis) {
        this.parentHash = parentHash != null ? parentHash : Hash.ZERO;
        this.merkleRoot = merkleRoot != null ? merkleRoot : Hash.ZERO;
        this.slot = Objects.requireNonNull(slot, "slot");
        this.difficulty = difficulty;
        this.genesis = genesis;
        basicValidate();
    }

    public Hash parentHash() { return parentHash; }
    public Hash merkleRoot() { return merkleRoot; }
    public SlotId slot() { return slot; }
    public long difficulty() { return difficulty; }
    public boolean isGenesis() { return genesis; }

    // Deterministic header bytes (no signature concept here)
    public byte[] serialize() {
        ByteBuffer buf = ByteBuffer.allocate(Hash.LENGTH * 2 + 8 + 4 + 8 + 1);
        buf.put(parentHash.bytes());
        buf.put(merkleRoot.bytes());
        buf.putLong(slot.epoch());
        buf.putInt(slot.index());
        buf.putLong(difficulty);
        buf.put((byte) (genesis ? 1 : 0));
        buf.flip();
        byte[] out = new byte[buf.remaining()];
        buf.get(out);
        return out;
    }

    public Hash hash() {
        return Hash.of(serialize());
    }

    public void basicValidate() {
        if (difficulty < 0) throw new IllegalArgumentException("difficulty must be >= 0");
        if (genesis && slot.index() != 0) throw new IllegalArgumentException("genesis header must be at slot 0");
    }

    @Override public String toString() {
        return "BlockHeader{" + (genesis ? "genesis " : "") + "slot=" + slot + ", diff=" + difficulty + "}";
    }
}
