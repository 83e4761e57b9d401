package io.blockchain.walletsync.blistener;

import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.protocol.TxIn;
import io.blockchain.walletsync.protocol.TxOut;
import io.blockchain.walletsync.tracking.WalletModifier;
import io.blockchain.walletsync.wallet.WalletId;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class BlocksStorageModifierTest {

    private static final WalletId W1 = WalletId.of("w1");
    private static final WalletId W2 = WalletId.of("w2");

    @Test
    void mergesInCallOrder() {
        BlocksStorageModifier buffer = new BlocksStorageModifier();
        TxIn in = ref("t", 0);
        TxOut out = new TxOut("addr", 5);

        buffer.applyWalModifier(W1, WalletModifier.builder().addUtxo(in, out).build());
        WalletModifier merged = buffer.applyWalModifier(W1, WalletModifier.builder().spendUtxo(in, out).build());

        assertTrue(merged.isEmpty());
        assertEquals(merged, buffer.get(W1).orElseThrow());
        assertTrue(buffer.get(W2).isEmpty());
    }

    @Test
    void concurrentUpdatesAreNotLost() throws Exception {
        BlocksStorageModifier buffer = new BlocksStorageModifier();
        int threads = 8;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        WalletId wid = (i % 2 == 0) ? W1 : W2;
                        buffer.applyWalModifier(wid, WalletModifier.builder()
                                .addUtxo(ref("t" + thread, i), new TxOut("addr", 1))
                                .build());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        int half = threads * perThread / 2;
        assertEquals(half, buffer.get(W1).orElseThrow().utxo().size());
        assertEquals(half, buffer.get(W2).orElseThrow().utxo().size());
    }

    @Test
    void drainEmptiesAndRestorePutsBackAheadOfNewerChanges() {
        BlocksStorageModifier buffer = new BlocksStorageModifier();
        TxIn in = ref("t", 0);
        TxOut out = new TxOut("addr", 5);
        buffer.applyWalModifier(W1, WalletModifier.builder().addUtxo(in, out).build());

        Map<WalletId, WalletModifier> drained = buffer.drain();
        assertTrue(buffer.isEmpty());
        assertEquals(1, drained.size());

        buffer.applyWalModifier(W1, WalletModifier.builder().spendUtxo(in, out).build());
        buffer.restore(drained);

        // add followed by spend: nothing left
        assertTrue(buffer.get(W1).orElseThrow().isEmpty());
        assertEquals(1, buffer.size());
    }

    @Test
    void snapshotIsReadOnlyCopy() {
        BlocksStorageModifier buffer = new BlocksStorageModifier();
        buffer.applyWalModifier(W1, WalletModifier.empty());
        Map<WalletId, WalletModifier> snapshot = buffer.snapshot();
        buffer.applyWalModifier(W2, WalletModifier.empty());

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put(W2, WalletModifier.empty()));
    }

    private static TxIn ref(String seed, int index) {
        return new TxIn(Hash.of(seed.getBytes(StandardCharsets.UTF_8)), index);
    }
}
