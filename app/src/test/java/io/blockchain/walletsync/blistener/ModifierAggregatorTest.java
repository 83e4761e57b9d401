package io.blockchain.walletsync.blistener;

import io.blockchain.walletsync.TestChain;
import io.blockchain.walletsync.TestChain.FixedSlotClock;
import io.blockchain.walletsync.chain.InMemoryChainStore;
import io.blockchain.walletsync.chrono.OldestFirst;
import io.blockchain.walletsync.protocol.Blund;
import io.blockchain.walletsync.protocol.Transaction;
import io.blockchain.walletsync.slotting.SlotId;
import io.blockchain.walletsync.slotting.SlottingData;
import io.blockchain.walletsync.tracking.UtxoTxTracker;
import io.blockchain.walletsync.tracking.WalletModifier;
import io.blockchain.walletsync.wallet.InMemoryWalletDB;
import io.blockchain.walletsync.wallet.WalletId;
import io.blockchain.walletsync.wallet.WalletKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ModifierAggregatorTest {

    private static final WalletId WID = WalletId.of("w");

    private InMemoryWalletDB walletDb;
    private BlocksStorageModifier buffer;
    private WalletKeys keys;
    private ModifierAggregator aggregator;
    private TestChain blocks;

    @BeforeEach
    void setUp() {
        InMemoryChainStore chain = new InMemoryChainStore(
                SlottingData.uniform(TestChain.SLOT, TestChain.EPOCH_SLOTS, 0));
        blocks = new TestChain();
        chain.putBlund(blocks.genesis());
        walletDb = new InMemoryWalletDB();
        walletDb.createWallet(WID, Set.of("tracked"));
        buffer = new BlocksStorageModifier();
        keys = TestChain.newKeys();
        aggregator = new ModifierAggregator(chain, new FixedSlotClock(new SlotId(0, 9)), walletDb,
                wid -> keys, new UtxoTxTracker(), buffer);
    }

    @Test
    void applyThenRollbackRestoresBufferedEntry() {
        Transaction a = blocks.issue(keys.rootAddress(), 100);
        Blund blockA = blocks.next(a);
        aggregator.applyTxs(WID, BlundFlattener.flattenApply(OldestFirst.of(blockA)));
        WalletModifier before = buffer.get(WID).orElseThrow();

        Transaction spend = blocks.transfer(a.outRef(0), "bob", 40);
        Blund blockB = blocks.next(spend, blocks.issue("tracked", 7));
        OldestFirst<Blund> batch = OldestFirst.of(blockB);
        aggregator.applyTxs(WID, BlundFlattener.flattenApply(batch));
        assertNotEquals(before, buffer.get(WID).orElseThrow());

        aggregator.rollbackTxs(WID, new SlotId(0, 9), BlundFlattener.flattenRollback(batch.toNewestFirst()));

        assertEquals(before, buffer.get(WID).orElseThrow());
    }

    @Test
    void roundTripFromEmptyBufferLeavesEmptyModifier() {
        Blund b1 = blocks.next(blocks.issue(keys.rootAddress(), 5));
        OldestFirst<Blund> batch = OldestFirst.of(b1);

        aggregator.applyTxs(WID, BlundFlattener.flattenApply(batch));
        aggregator.rollbackTxs(WID, new SlotId(0, 9), BlundFlattener.flattenRollback(batch.toNewestFirst()));

        assertTrue(buffer.get(WID).orElseThrow().isEmpty());
    }

    @Test
    void returnsBatchDeltaNotMergedValue() {
        Transaction first = blocks.issue("tracked", 1);
        aggregator.applyTxs(WID, BlundFlattener.flattenApply(OldestFirst.of(blocks.next(first))));
        Transaction second = blocks.issue("tracked", 2);

        WalletModifier delta = aggregator.applyTxs(WID,
                BlundFlattener.flattenApply(OldestFirst.of(blocks.next(second))));

        assertEquals(1, delta.utxo().size());
        assertEquals(2, buffer.get(WID).orElseThrow().utxo().size());
    }

    @Test
    void unknownWalletFails() {
        Blund b1 = blocks.next(blocks.issue("tracked", 1));
        assertThrows(IllegalArgumentException.class,
                () -> aggregator.applyTxs(WalletId.of("nope"), BlundFlattener.flattenApply(OldestFirst.of(b1))));
        assertTrue(buffer.isEmpty());
    }
}
