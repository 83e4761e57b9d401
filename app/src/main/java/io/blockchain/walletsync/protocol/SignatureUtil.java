package io.blockchain.walletsync.protocol;

import java.security.PublicKey;

public final class SignatureUtil {
    private SignatureUtil() {}

    /** Root address of a key: first 20 bytes of SHA-256(encoded public key), hex. */
    public static String deriveAddress(PublicKey pub) {
        String hex = Hash.of(pub.getEncoded()).hex();
        return hex.substring(0, 40);
    }
}
