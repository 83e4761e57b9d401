package io.blockchain.walletsync.protocol;

import java.util.Objects;

/** Reference to output {@code index} of transaction {@code txId}. */
public record TxIn(Hash txId, int index) {
    public TxIn {
        Objects.requireNonNull(txId, "txId");
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
    }

    @Override public String toString() {
        return txId + "#" + index;
    }
}
