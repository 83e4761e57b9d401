package io.blockchain.walletsync.wallet;

/**
 * Looks up the key material of a wallet.
 */
@FunctionalInterface
public interface KeyProvider {

    /**
     * @throws IllegalArgumentException if the wallet is unknown
     * @throws IllegalStateException if its keys cannot be loaded (e.g. encrypted and locked)
     */
    WalletKeys keysFor(WalletId id);
}
