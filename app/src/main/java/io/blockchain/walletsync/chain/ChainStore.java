package io.blockchain.walletsync.chain;

import io.blockchain.walletsync.protocol.Block;
import io.blockchain.walletsync.protocol.BlockUndo;
import io.blockchain.walletsync.protocol.Blund;
import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.slotting.SlottingData;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Minimal chain persistence API.
 * Stores blunds by their header hash and tracks the current tip.
 *
 * Notes:
 * - Block "hash" = SHA-256 of the BlockHeader serialization (see BlockHeader#hash()).
 * - The tip only moves through {@link #setTip(Hash)}, except that the very first
 *   stored block becomes the tip.
 */
public interface ChainStore extends ChainReader {

    /** Persist a blund (idempotent). Safe to call again with the same blund. */
    void putBlund(Blund blund);

    Optional<Blund> getBlund(Hash blockHash);

    /** Return the current tip if set. */
    Optional<Hash> getHead();

    /** Move the tip. The block must be stored already. */
    void setTip(Hash blockHash);

    void setSlottingData(SlottingData slottingData);

    /** Number of blocks stored (debug/metrics). */
    long size();

    @Override
    default Hash getTip() {
        return getHead().orElseThrow(() -> new IllegalStateException("Chain has no tip (genesis not stored)"));
    }

    default Optional<Block> getBlock(Hash blockHash) {
        return getBlund(blockHash).map(Blund::block);
    }

    default Optional<BlockUndo> getUndo(Hash blockHash) {
        return getBlund(blockHash).map(Blund::undo);
    }

    /**
     * Up to {@code count} blunds walking back from the tip, newest first.
     * Stops at the first block, which has a zero parent hash.
     */
    default List<Blund> getNewestBlunds(int count) {
        List<Blund> out = new ArrayList<>();
        Optional<Hash> cursor = getHead();
        while (cursor.isPresent() && out.size() < count) {
            Optional<Blund> blund = getBlund(cursor.get());
            if (blund.isEmpty()) break;
            out.add(blund.get());
            Hash parent = blund.get().block().header().parentHash();
            cursor = parent.isZero() ? Optional.empty() : Optional.of(parent);
        }
        return out;
    }
}
