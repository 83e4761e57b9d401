package io.blockchain.walletsync.wallet;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class WalletKeyStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void plainKeysReloadWithSameAddress() throws Exception {
        WalletKeyStore store = new WalletKeyStore(tempDir);
        WalletKeys created = store.createKeys(WalletId.of("alice"), null);

        assertTrue(Files.exists(tempDir.resolve("alice.key")));
        assertTrue(Files.exists(tempDir.resolve("alice.pub")));

        WalletKeyStore reopened = new WalletKeyStore(tempDir);
        assertEquals(List.of(WalletId.of("alice")), reopened.walletIds());
        assertFalse(reopened.isLocked(WalletId.of("alice")));
        assertEquals(created.rootAddress(), reopened.keysFor(WalletId.of("alice")).rootAddress());
    }

    @Test
    void encryptedKeysStayLockedUntilUnlocked() throws Exception {
        WalletKeyStore store = new WalletKeyStore(tempDir);
        WalletKeys created = store.createKeys(WalletId.of("bob"), "secret".toCharArray());
        assertTrue(Files.readString(tempDir.resolve("bob.key")).contains("ENCRYPTED PRIVATE KEY"));
        assertTrue(store.isLocked(WalletId.of("bob")));
        assertThrows(IllegalStateException.class, () -> store.keysFor(WalletId.of("bob")));

        WalletKeyStore reopened = new WalletKeyStore(tempDir);
        assertThrows(IllegalStateException.class, () -> reopened.keysFor(WalletId.of("bob")));
        WalletKeys unlocked = reopened.unlock(WalletId.of("bob"), "secret".toCharArray());

        assertEquals(created.rootAddress(), unlocked.rootAddress());
        assertEquals(created.privateKey(), unlocked.privateKey());
        assertSame(unlocked, reopened.keysFor(WalletId.of("bob")));

        reopened.lock(WalletId.of("bob"));
        assertTrue(reopened.isLocked(WalletId.of("bob")));
    }

    @Test
    void wrongPassphraseFails() throws Exception {
        WalletKeyStore store = new WalletKeyStore(tempDir);
        store.createKeys(WalletId.of("bob"), "secret".toCharArray());

        assertThrows(Exception.class, () -> store.unlock(WalletId.of("bob"), "wrong".toCharArray()));
        assertTrue(store.isLocked(WalletId.of("bob")));
    }

    @Test
    void unknownWalletAndDuplicatesRejected() throws Exception {
        WalletKeyStore store = new WalletKeyStore(tempDir);
        store.createKeys(WalletId.of("alice"), null);

        assertThrows(IllegalArgumentException.class, () -> store.createKeys(WalletId.of("alice"), null));
        assertThrows(IllegalArgumentException.class, () -> store.keysFor(WalletId.of("nobody")));
        assertThrows(IllegalArgumentException.class, () -> store.createKeys(WalletId.of("../escape"), null));
    }
}
