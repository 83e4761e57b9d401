package io.blockchain.walletsync.chain;

import io.blockchain.walletsync.protocol.Hash;

/** Runs under the block lock after a batch moved the tip from {@code oldTip} to {@code newTip}. */
@FunctionalInterface
public interface PostBatchHook {
    void afterBatch(Hash oldTip, Hash newTip);
}
