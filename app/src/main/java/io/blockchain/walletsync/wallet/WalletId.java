package io.blockchain.walletsync.wallet;

import java.util.Objects;

/** Opaque identifier of a tracked wallet. */
public record WalletId(String value) implements Comparable<WalletId> {
    public WalletId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank() || value.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Invalid wallet id: '" + value + "'");
        }
    }

    public static WalletId of(String value) {
        return new WalletId(value);
    }

    @Override public int compareTo(WalletId o) {
        return value.compareTo(o.value);
    }

    @Override public String toString() {
        return value;
    }
}
