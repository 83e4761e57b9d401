package io.blockchain.walletsync.wallet;

import io.blockchain.walletsync.protocol.SignatureUtil;

import java.security.KeyPair;
import java.security.PrivateKey;
import java.util.Objects;

/** Key material of one wallet plus the root address derived from it. */
public final class WalletKeys {
    private final KeyPair keyPair;
    private final String rootAddress;

    public WalletKeys(KeyPair keyPair) {
        this.keyPair = Objects.requireNonNull(keyPair, "keyPair");
        this.rootAddress = SignatureUtil.deriveAddress(keyPair.getPublic());
    }

    public String rootAddress() {
        return rootAddress;
    }

    public PrivateKey privateKey() {
        return keyPair.getPrivate();
    }
}
