package io.blockchain.walletsync.chain;

import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.slotting.SlottingData;

/**
 * Read-only view of the canonical chain state (tip and slot timing).
 */
public interface ChainReader {

    /** Current tip. Throws if the chain has not been initialized with a genesis block. */
    Hash getTip();

    SlottingData getSlottingData();
}
