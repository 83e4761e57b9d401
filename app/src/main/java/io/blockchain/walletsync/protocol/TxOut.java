package io.blockchain.walletsync.protocol;

import java.util.Objects;

public record TxOut(String address, long amountMinor) {
    public TxOut {
        Objects.requireNonNull(address, "address");
        if (address.isBlank()) throw new IllegalArgumentException("Missing address");
        if (amountMinor <= 0) throw new IllegalArgumentException("amount must be > 0");
    }
}
