package io.blockchain.walletsync.blistener;

import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.wallet.InMemoryWalletDB;
import io.blockchain.walletsync.wallet.SyncTip;
import io.blockchain.walletsync.wallet.WalletId;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class WalletGuardTest {

    private static final Hash TIP = Hash.of("tip".getBytes(StandardCharsets.UTF_8));
    private static final Hash OTHER = Hash.of("other".getBytes(StandardCharsets.UTF_8));
    private static final WalletId WID = WalletId.of("w");

    @Test
    void runsOnlyWhenSyncedWithCurrentTip() throws Exception {
        InMemoryWalletDB db = new InMemoryWalletDB();
        db.createWallet(WID, Set.of());
        WalletGuard guard = new WalletGuard(db);
        AtomicInteger runs = new AtomicInteger();

        db.setWalletSyncTip(WID, SyncTip.syncedWith(TIP));
        assertEquals(WalletGuard.Decision.ELIGIBLE, guard.runIfEligible(TIP, WID, runs::incrementAndGet));
        assertEquals(1, runs.get());

        db.setWalletSyncTip(WID, SyncTip.syncedWith(OTHER));
        assertEquals(WalletGuard.Decision.TIP_MISMATCH, guard.runIfEligible(TIP, WID, runs::incrementAndGet));

        db.setWalletSyncTip(WID, SyncTip.notSynced());
        assertEquals(WalletGuard.Decision.NOT_SYNCED, guard.runIfEligible(TIP, WID, runs::incrementAndGet));

        db.removeWalletSyncTip(WID);
        assertEquals(WalletGuard.Decision.NO_SYNC_TIP, guard.runIfEligible(TIP, WID, runs::incrementAndGet));

        assertEquals(1, runs.get());
    }

    @Test
    void unknownWalletHasNoSyncTip() {
        WalletGuard guard = new WalletGuard(new InMemoryWalletDB());
        assertEquals(WalletGuard.Decision.NO_SYNC_TIP, guard.check(TIP, WID));
    }

    @Test
    void actionFailurePropagates() {
        InMemoryWalletDB db = new InMemoryWalletDB();
        db.createWallet(WID, Set.of());
        db.setWalletSyncTip(WID, SyncTip.syncedWith(TIP));
        WalletGuard guard = new WalletGuard(db);

        Exception thrown = assertThrows(Exception.class, () -> guard.runIfEligible(TIP, WID, () -> {
            throw new Exception("sync failed");
        }));
        assertEquals("sync failed", thrown.getMessage());
    }
}
