package io.blockchain.walletsync.chain;

import io.blockchain.walletsync.protocol.Blund;
import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.slotting.SlottingData;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Simple, fast in-memory chain store.
 * Good for tests and the demo node.
 */
public final class InMemoryChainStore implements ChainStore {

    /** Map: blockHash -> Blund */
    private final Map<Hash, Blund> blunds = new HashMap<>();

    /** Current tip */
    private Hash tip; // null until the first block is stored

    private SlottingData slottingData;

    public InMemoryChainStore(SlottingData slottingData) {
        this.slottingData = Objects.requireNonNull(slottingData, "slottingData");
    }

    @Override
    public synchronized void putBlund(Blund blund) {
        if (blund == null) return;
        Hash h = blund.hash();
        blunds.put(h, blund);
        if (tip == null) {
            tip = h;
        }
    }

    @Override
    public synchronized Optional<Blund> getBlund(Hash blockHash) {
        if (blockHash == null) return Optional.empty();
        return Optional.ofNullable(blunds.get(blockHash));
    }

    @Override
    public synchronized Optional<Hash> getHead() {
        return Optional.ofNullable(tip);
    }

    @Override
    public synchronized void setTip(Hash blockHash) {
        // only set if we actually know this block
        if (blockHash == null || !blunds.containsKey(blockHash)) {
            throw new IllegalArgumentException("Unknown tip hash (store the block first)");
        }
        tip = blockHash;
    }

    @Override
    public synchronized SlottingData getSlottingData() {
        return slottingData;
    }

    @Override
    public synchronized void setSlottingData(SlottingData slottingData) {
        this.slottingData = Objects.requireNonNull(slottingData, "slottingData");
    }

    @Override
    public synchronized long size() {
        return blunds.size();
    }
}
