package io.blockchain.walletsync.blistener;

import io.blockchain.walletsync.chrono.NewestFirst;
import io.blockchain.walletsync.chrono.OldestFirst;
import io.blockchain.walletsync.protocol.Blund;

/**
 * Callbacks the chain pipeline invokes under the block lock, before it moves
 * the tip. The chain state does not change while a callback runs.
 */
public interface BListener {

    /** Blocks about to be applied, oldest first. Returns storage operations to run with the batch. */
    DbBatch onApplyBlocks(OldestFirst<Blund> blunds);

    /** Blocks about to be rolled back, newest first. */
    DbBatch onRollbackBlocks(NewestFirst<Blund> blunds);
}
