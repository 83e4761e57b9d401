package io.blockchain.walletsync.wallet;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryWalletDBTest {

    @Test
    void createdWalletIsNotSynced() {
        WalletDBContract.createdWalletIsNotSynced(new InMemoryWalletDB());
    }

    @Test
    void tracksAddressesAndTips() {
        WalletDBContract.tracksAddressesAndTips(new InMemoryWalletDB());
    }

    @Test
    void appliesModifiers() {
        WalletDBContract.appliesModifiers(new InMemoryWalletDB());
    }

    @Test
    void removedSyncTipReadsAsAbsent() {
        InMemoryWalletDB db = new InMemoryWalletDB();
        db.createWallet(WalletDBContract.WID, Set.of());
        db.removeWalletSyncTip(WalletDBContract.WID);

        assertTrue(db.getWalletSyncTip(WalletDBContract.WID).isEmpty());
        assertEquals(1, db.getWalletIds().size());
    }
}
