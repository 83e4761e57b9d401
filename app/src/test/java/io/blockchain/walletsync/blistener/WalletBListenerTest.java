package io.blockchain.walletsync.blistener;

import io.blockchain.walletsync.TestChain;
import io.blockchain.walletsync.TestChain.FixedSlotClock;
import io.blockchain.walletsync.chain.InMemoryChainStore;
import io.blockchain.walletsync.chrono.NewestFirst;
import io.blockchain.walletsync.chrono.OldestFirst;
import io.blockchain.walletsync.metrics.WalletSyncMetrics;
import io.blockchain.walletsync.protocol.BlockHeader;
import io.blockchain.walletsync.protocol.BlockUndo;
import io.blockchain.walletsync.protocol.Blund;
import io.blockchain.walletsync.protocol.Transaction;
import io.blockchain.walletsync.protocol.TxOut;
import io.blockchain.walletsync.slotting.SlotId;
import io.blockchain.walletsync.slotting.SlottingData;
import io.blockchain.walletsync.tracking.HeaderInfo;
import io.blockchain.walletsync.tracking.TxHistoryEntry;
import io.blockchain.walletsync.tracking.TxTracker;
import io.blockchain.walletsync.tracking.TxWithUndo;
import io.blockchain.walletsync.tracking.UtxoTxTracker;
import io.blockchain.walletsync.tracking.WalletModifier;
import io.blockchain.walletsync.wallet.InMemoryWalletDB;
import io.blockchain.walletsync.wallet.SyncTip;
import io.blockchain.walletsync.wallet.WalletId;
import io.blockchain.walletsync.wallet.WalletKeys;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class WalletBListenerTest {

    private static final WalletId W1 = WalletId.of("w1");
    private static final WalletId W2 = WalletId.of("w2");
    private static final WalletId W3 = WalletId.of("w3");

    private InMemoryChainStore chain;
    private TestChain blocks;
    private InMemoryWalletDB walletDb;
    private Map<WalletId, WalletKeys> keys;
    private BlocksStorageModifier buffer;
    private CountingTracker tracker;
    private RecordingReporter reporter;
    private FixedSlotClock slots;
    private TimeoutWatchdog watchdog;
    private WalletBListener listener;

    @BeforeEach
    void setUp() {
        chain = new InMemoryChainStore(SlottingData.uniform(TestChain.SLOT, TestChain.EPOCH_SLOTS, 1));
        blocks = new TestChain();
        chain.putBlund(blocks.genesis());
        walletDb = new InMemoryWalletDB();
        keys = new HashMap<>();
        buffer = new BlocksStorageModifier();
        tracker = new CountingTracker(new UtxoTxTracker());
        reporter = new RecordingReporter();
        slots = new FixedSlotClock(new SlotId(0, 5));
        watchdog = new TimeoutWatchdog();
        ModifierAggregator aggregator = new ModifierAggregator(chain, slots, walletDb, wid -> {
            WalletKeys k = keys.get(wid);
            if (k == null) {
                throw new IllegalStateException("Keys of wallet '" + wid + "' are encrypted; unlock before use");
            }
            return k;
        }, tracker, buffer);
        listener = new WalletBListener(chain, slots, walletDb, aggregator, reporter, watchdog);
    }

    @AfterEach
    void tearDown() {
        watchdog.close();
    }

    @Test
    void syncedWalletGetsBlockDelta() {
        WalletKeys k1 = addWallet(W1, SyncTip.syncedWith(chain.getTip()));
        Transaction t1 = blocks.issue(k1.rootAddress(), 100);
        Transaction t2 = blocks.issue(k1.rootAddress(), 50);
        Blund b1 = blocks.next(t1, t2);

        List<WalletSyncOutcome> outcomes = listener.syncApply(OldestFirst.of(b1));

        assertEquals(1, outcomes.size());
        assertEquals(WalletSyncOutcome.Status.SYNCED, outcomes.get(0).status());
        assertEquals(WalletGuard.Decision.ELIGIBLE, outcomes.get(0).decision());
        assertEquals(1, tracker.applyCalls);
        assertEquals(2, tracker.lastTxCount);
        WalletModifier buffered = buffer.get(W1).orElseThrow();
        assertFalse(buffered.isEmpty());
        assertEquals(2, buffered.utxo().insertions().size());
        assertTrue(reporter.prefixes.isEmpty());
    }

    @Test
    void historyEntryCarriesSlotStartTimestamp() {
        WalletKeys k1 = addWallet(W1, SyncTip.syncedWith(chain.getTip()));
        Transaction t1 = blocks.issue(k1.rootAddress(), 100);
        Blund b1 = blocks.next(t1);

        listener.syncApply(OldestFirst.of(b1));

        TxHistoryEntry entry = buffer.get(W1).orElseThrow().history().insertions().get(t1.id());
        Instant expected = TestChain.SYSTEM_START.plus(TestChain.SLOT.multipliedBy(b1.block().header().slot().index()));
        assertEquals(Optional.of(expected), entry.timestamp());
        assertEquals(Optional.of(1L), entry.difficulty());
    }

    @Test
    void failingWalletIsReportedAndOthersStillSync() {
        WalletKeys k1 = addWallet(W1, SyncTip.syncedWith(chain.getTip()));
        addWallet(W2, SyncTip.syncedWith(chain.getTip()));
        keys.remove(W2);
        WalletKeys k3 = addWallet(W3, SyncTip.syncedWith(chain.getTip()));
        Blund b1 = blocks.next(blocks.issue(k1.rootAddress(), 10), blocks.issue(k3.rootAddress(), 20));

        List<WalletSyncOutcome> outcomes = listener.syncApply(OldestFirst.of(b1));

        assertEquals(WalletSyncOutcome.Status.SYNCED, outcomes.get(0).status());
        assertEquals(WalletSyncOutcome.Status.FAILED, outcomes.get(1).status());
        assertTrue(outcomes.get(1).failure().orElseThrow() instanceof IllegalStateException);
        assertEquals(WalletSyncOutcome.Status.SYNCED, outcomes.get(2).status());
        assertTrue(buffer.get(W1).isPresent());
        assertTrue(buffer.get(W2).isEmpty());
        assertTrue(buffer.get(W3).isPresent());
        assertEquals(List.of("Failed to sync wallet w2 in BListener (apply): "), reporter.prefixes);
    }

    @Test
    void laggingAndUnsyncedWalletsAreSkipped() {
        addWallet(W1, SyncTip.notSynced());
        Blund b1 = blocks.next(blocks.issue("x", 1));
        chain.putBlund(b1);
        addWallet(W2, SyncTip.syncedWith(b1.hash()));
        Blund b2 = blocks.next(blocks.issue("y", 1));

        List<WalletSyncOutcome> outcomes = listener.syncApply(OldestFirst.of(b2));

        assertEquals(WalletGuard.Decision.NOT_SYNCED, outcomes.get(0).decision());
        assertEquals(WalletGuard.Decision.TIP_MISMATCH, outcomes.get(1).decision());
        assertEquals(WalletSyncOutcome.Status.SKIPPED, outcomes.get(1).status());
        assertEquals(0, tracker.applyCalls);
        assertTrue(buffer.isEmpty());
        assertTrue(reporter.prefixes.isEmpty());
    }

    @Test
    void corruptUndoEscapesTheListener() {
        addWallet(W1, SyncTip.syncedWith(chain.getTip()));
        Blund good = blocks.next(blocks.issue("x", 1));
        Blund broken = new Blund(good.block(), BlockUndo.empty());

        assertThrows(IllegalStateException.class, () -> listener.onApplyBlocks(OldestFirst.of(broken)));
        assertTrue(reporter.prefixes.isEmpty());
    }

    @Test
    void callbacksReturnEmptyBatch() {
        addWallet(W1, SyncTip.syncedWith(chain.getTip()));
        Blund b1 = blocks.next(blocks.issue("x", 1));

        assertTrue(listener.onApplyBlocks(OldestFirst.of(b1)).isEmpty());
    }

    @Test
    void rollbackUsesCurrentSlotAndReportsWithRollbackTag() {
        WalletKeys k1 = addWallet(W1, SyncTip.syncedWith(chain.getTip()));
        Transaction t1 = blocks.issue(k1.rootAddress(), 100);
        Blund b1 = blocks.next(t1);
        chain.putBlund(b1);
        chain.setTip(b1.hash());
        walletDb.setWalletSyncTip(W1, SyncTip.syncedWith(b1.hash()));
        addWallet(W2, SyncTip.syncedWith(b1.hash()));
        keys.remove(W2);
        slots.setCurrent(new SlotId(1, 3));

        List<WalletSyncOutcome> outcomes = listener.syncRollback(NewestFirst.of(b1));

        assertEquals(WalletSyncOutcome.Status.SYNCED, outcomes.get(0).status());
        assertEquals(1, tracker.rollbackCalls);
        WalletModifier buffered = buffer.get(W1).orElseThrow();
        assertEquals(new TxOut(k1.rootAddress(), 100), buffered.utxo().deletions().get(t1.outRef(0)));
        assertEquals(new SlotId(1, 3), buffered.history().deletions().get(t1.id()).slot());
        assertEquals(List.of("Failed to sync wallet w2 in BListener (rollback): "), reporter.prefixes);
    }

    @Test
    void slowBatchWarnsOnceAfterHalfTheSlot() {
        List<LogRecord> records = new CopyOnWriteArrayList<>();
        Handler capture = new Handler() {
            @Override public void publish(LogRecord record) { records.add(record); }
            @Override public void flush() { }
            @Override public void close() { }
        };
        Logger watchdogLog = Logger.getLogger(TimeoutWatchdog.class.getName());
        watchdogLog.addHandler(capture);
        try {
            WalletKeys k1 = addWallet(W1, SyncTip.syncedWith(chain.getTip()));
            slots.setSlotDuration(Duration.ofMillis(40));
            tracker.sleepMillis = 300;
            double slowBefore = WalletSyncMetrics.slowBatchCount();

            listener.syncApply(OldestFirst.of(blocks.next(blocks.issue(k1.rootAddress(), 1))));

            List<LogRecord> warnings = records.stream().filter(r -> r.getLevel() == Level.WARNING)
                    .collect(Collectors.toList());
            assertEquals(1, warnings.size());
            assertTrue(warnings.get(0).getMessage().startsWith("Wallet blistener apply is taking longer than 20 ms"));
            assertTrue(WalletSyncMetrics.slowBatchCount() > slowBefore);
        } finally {
            watchdogLog.removeHandler(capture);
        }
    }

    private WalletKeys addWallet(WalletId wid, SyncTip tip) {
        WalletKeys k = TestChain.newKeys();
        keys.put(wid, k);
        walletDb.createWallet(wid, Set.of());
        walletDb.setWalletSyncTip(wid, tip);
        return k;
    }

    static final class RecordingReporter implements Reporter {
        final List<String> prefixes = new ArrayList<>();

        @Override
        public void reportOrLogW(String prefix, Throwable cause) {
            prefixes.add(prefix);
        }
    }

    static final class CountingTracker implements TxTracker {
        private final TxTracker delegate;
        int applyCalls;
        int rollbackCalls;
        int lastTxCount;
        long sleepMillis;

        CountingTracker(TxTracker delegate) {
            this.delegate = delegate;
        }

        @Override
        public WalletModifier trackingApplyTxs(WalletKeys keys, Set<String> addresses,
                                               Function<BlockHeader, HeaderInfo> headerInfo, List<TxWithUndo> txs) {
            applyCalls++;
            lastTxCount = txs.size();
            if (sleepMillis > 0) {
                try {
                    Thread.sleep(sleepMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }
            return delegate.trackingApplyTxs(keys, addresses, headerInfo, txs);
        }

        @Override
        public WalletModifier trackingRollbackTxs(WalletKeys keys, Set<String> addresses, SlotId curSlot,
                                                  Function<BlockHeader, HeaderInfo> headerInfo, List<TxWithUndo> txs) {
            rollbackCalls++;
            lastTxCount = txs.size();
            return delegate.trackingRollbackTxs(keys, addresses, curSlot, headerInfo, txs);
        }
    }
}
