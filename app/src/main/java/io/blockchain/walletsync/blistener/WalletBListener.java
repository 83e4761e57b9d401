package io.blockchain.walletsync.blistener;

import io.blockchain.walletsync.chain.ChainReader;
import io.blockchain.walletsync.chrono.NewestFirst;
import io.blockchain.walletsync.chrono.OldestFirst;
import io.blockchain.walletsync.metrics.WalletSyncMetrics;
import io.blockchain.walletsync.protocol.Blund;
import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.slotting.SlotClock;
import io.blockchain.walletsync.slotting.SlotId;
import io.blockchain.walletsync.tracking.TxWithUndo;
import io.blockchain.walletsync.tracking.WalletModifier;
import io.blockchain.walletsync.wallet.WalletDB;
import io.blockchain.walletsync.wallet.WalletId;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Keeps every tracked wallet's buffered state in step with blocks the chain
 * applies or rolls back.
 * <p>
 * Each wallet is guarded and updated on its own: a wallet that fails is
 * reported and the batch moves on to the next one. Results only land in the
 * in-memory {@link BlocksStorageModifier}; nothing is written to storage as
 * part of the chain batch, so both callbacks return {@link DbBatch#empty()}.
 * <p>
 * Must be called under the block lock.
 */
public final class WalletBListener implements BListener {
    private static final Logger LOG = Logger.getLogger(WalletBListener.class.getName());

    private final ChainReader chain;
    private final SlotClock slots;
    private final WalletDB walletDb;
    private final WalletGuard guard;
    private final ModifierAggregator aggregator;
    private final Reporter reporter;
    private final TimeoutWatchdog watchdog;

    public WalletBListener(ChainReader chain,
                           SlotClock slots,
                           WalletDB walletDb,
                           ModifierAggregator aggregator,
                           Reporter reporter,
                           TimeoutWatchdog watchdog) {
        this.chain = Objects.requireNonNull(chain, "chain");
        this.slots = Objects.requireNonNull(slots, "slots");
        this.walletDb = Objects.requireNonNull(walletDb, "walletDb");
        this.guard = new WalletGuard(walletDb);
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.watchdog = Objects.requireNonNull(watchdog, "watchdog");
    }

    @Override
    public DbBatch onApplyBlocks(OldestFirst<Blund> blunds) {
        syncApply(blunds);
        return DbBatch.empty();
    }

    @Override
    public DbBatch onRollbackBlocks(NewestFirst<Blund> blunds) {
        syncRollback(blunds);
        return DbBatch.empty();
    }

    List<WalletSyncOutcome> syncApply(OldestFirst<Blund> blunds) {
        return reportTimeouts("apply", () -> {
            List<TxWithUndo> txs = BlundFlattener.flattenApply(blunds);
            Hash curTip = chain.getTip();
            List<WalletSyncOutcome> outcomes = new ArrayList<>();
            for (WalletId wid : walletDb.getWalletIds()) {
                outcomes.add(catchInSync("apply", wid, curTip, () -> {
                    WalletModifier modifier = aggregator.applyTxs(wid, txs);
                    logMsg("Applied", blunds.size(), wid, modifier);
                }));
            }
            return outcomes;
        });
    }

    List<WalletSyncOutcome> syncRollback(NewestFirst<Blund> blunds) {
        return reportTimeouts("rollback", () -> {
            List<TxWithUndo> txs = BlundFlattener.flattenRollback(blunds);
            SlotId curSlot = slots.getCurrentSlotInaccurate();
            Hash curTip = chain.getTip();
            List<WalletSyncOutcome> outcomes = new ArrayList<>();
            for (WalletId wid : walletDb.getWalletIds()) {
                outcomes.add(catchInSync("rollback", wid, curTip, () -> {
                    WalletModifier modifier = aggregator.rollbackTxs(wid, curSlot, txs);
                    logMsg("Rolled back", blunds.size(), wid, modifier);
                }));
            }
            return outcomes;
        });
    }

    private WalletSyncOutcome catchInSync(String op, WalletId wid, Hash curTip, WalletGuard.SyncAction syncWallet) {
        WalletSyncOutcome outcome;
        try {
            outcome = WalletSyncOutcome.of(wid, guard.runIfEligible(curTip, wid, syncWallet));
        } catch (Exception e) {
            reporter.reportOrLogW("Failed to sync wallet " + wid + " in BListener (" + op + "): ", e);
            outcome = WalletSyncOutcome.failed(wid, e);
        }
        WalletSyncMetrics.recordOutcome(op, outcome.status().name().toLowerCase(Locale.ROOT));
        return outcome;
    }

    private <T> T reportTimeouts(String desc, Supplier<T> action) {
        Duration firstWarningTime = slots.getCurrentEpochSlotDuration().dividedBy(2);
        String tag = "Wallet blistener " + desc;
        return WalletSyncMetrics.recordBatch(desc,
                () -> watchdog.logWarningWaitOnce(firstWarningTime, tag, action));
    }

    private static void logMsg(String action, int blocks, WalletId wid, WalletModifier modifier) {
        LOG.info(action + " " + blocks + " block(s) to wallet " + wid + ", " + modifier);
    }
}
