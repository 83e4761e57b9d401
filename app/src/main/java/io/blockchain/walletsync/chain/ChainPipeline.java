package io.blockchain.walletsync.chain;

import io.blockchain.walletsync.blistener.BListener;
import io.blockchain.walletsync.blistener.DbBatch;
import io.blockchain.walletsync.chrono.NewestFirst;
import io.blockchain.walletsync.chrono.OldestFirst;
import io.blockchain.walletsync.protocol.Blund;
import io.blockchain.walletsync.protocol.Hash;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Moves the chain tip forward and backward in batches.
 * <p>
 * Every batch runs under one block lock: listeners see the chain as it was
 * before the batch, then blunds are stored, the tip moves, listener storage
 * operations run, and finally post-batch hooks run with the new tip.
 * A failing hook is logged; the batch stays committed.
 */
public final class ChainPipeline {
    private static final Logger LOG = Logger.getLogger(ChainPipeline.class.getName());

    private final ChainStore store;
    private final ReentrantLock blockLock = new ReentrantLock();
    private final List<BListener> listeners = new CopyOnWriteArrayList<>();
    private final List<PostBatchHook> hooks = new CopyOnWriteArrayList<>();

    public ChainPipeline(ChainStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public void addListener(BListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void addPostBatchHook(PostBatchHook hook) {
        hooks.add(Objects.requireNonNull(hook, "hook"));
    }

    /** Store the first block if the chain is empty. Safe to call multiple times. */
    public Hash initGenesis(Blund genesis) {
        return withBlockLock(() -> {
            if (store.getHead().isEmpty()) {
                if (!genesis.block().header().parentHash().isZero()) {
                    throw new IllegalArgumentException("First block must have a zero parent hash");
                }
                store.putBlund(genesis);
                LOG.info("Initialized chain with " + genesis.block() + " tip=" + genesis.hash());
            }
            return store.getTip();
        });
    }

    public Hash applyBlocks(OldestFirst<Blund> blunds) {
        return withBlockLock(() -> {
            Hash oldTip = store.getTip();
            Hash expectedParent = oldTip;
            for (Blund blund : blunds) {
                Hash parent = blund.block().header().parentHash();
                if (!parent.equals(expectedParent)) {
                    throw new IllegalArgumentException("Block " + blund.hash() + " does not attach to "
                            + expectedParent + " (parent " + parent + ")");
                }
                expectedParent = blund.hash();
            }

            DbBatch batch = DbBatch.empty();
            for (BListener listener : listeners) {
                batch = batch.then(listener.onApplyBlocks(blunds));
            }
            for (Blund blund : blunds) {
                store.putBlund(blund);
            }
            Hash newTip = blunds.newest().hash();
            return commit(oldTip, newTip, batch, "Applied " + blunds.size() + " block(s)");
        });
    }

    public Hash rollbackBlocks(NewestFirst<Blund> blunds) {
        return withBlockLock(() -> {
            Hash oldTip = store.getTip();
            Hash expected = oldTip;
            for (Blund blund : blunds) {
                if (!blund.hash().equals(expected)) {
                    throw new IllegalArgumentException("Rollback expected block " + expected + " but got " + blund.hash());
                }
                expected = blund.block().header().parentHash();
            }
            Hash newTip = expected;
            if (newTip.isZero() || store.getBlund(newTip).isEmpty()) {
                throw new IllegalArgumentException("Cannot roll back past the first block");
            }

            DbBatch batch = DbBatch.empty();
            for (BListener listener : listeners) {
                batch = batch.then(listener.onRollbackBlocks(blunds));
            }
            return commit(oldTip, newTip, batch, "Rolled back " + blunds.size() + " block(s)");
        });
    }

    /** Roll back the newest {@code count} blocks currently on the chain. */
    public Hash rollbackLatest(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0");
        }
        return withBlockLock(() -> {
            List<Blund> newest = store.getNewestBlunds(count);
            if (newest.size() < count) {
                throw new IllegalArgumentException("Chain has only " + newest.size() + " block(s)");
            }
            return rollbackBlocks(NewestFirst.of(newest));
        });
    }

    public <T> T withBlockLock(Supplier<T> action) {
        blockLock.lock();
        try {
            return action.get();
        } finally {
            blockLock.unlock();
        }
    }

    private Hash commit(Hash oldTip, Hash newTip, DbBatch batch, String what) {
        store.setTip(newTip);
        for (DbBatch.Op op : batch.ops()) {
            op.apply(store);
        }
        for (PostBatchHook hook : hooks) {
            try {
                hook.afterBatch(oldTip, newTip);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Post-batch hook failed at tip " + newTip, e);
            }
        }
        LOG.info(what + ", tip=" + newTip);
        return newTip;
    }
}
