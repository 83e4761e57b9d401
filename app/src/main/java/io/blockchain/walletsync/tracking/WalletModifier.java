package io.blockchain.walletsync.tracking;

import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.protocol.TxIn;
import io.blockchain.walletsync.protocol.TxOut;

import java.util.Objects;

/**
 * Not-yet-flushed delta of one wallet's derived state: UTXO changes and
 * history changes. Immutable; build one with {@link #builder()}.
 */
public final class WalletModifier {

    private static final WalletModifier EMPTY = new WalletModifier(new MapModifier<>(), new MapModifier<>());

    private final MapModifier<TxIn, TxOut> utxo;
    private final MapModifier<Hash, TxHistoryEntry> history;

    private WalletModifier(MapModifier<TxIn, TxOut> utxo, MapModifier<Hash, TxHistoryEntry> history) {
        this.utxo = utxo;
        this.history = history;
    }

    public static WalletModifier empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Copy of the UTXO changes. */
    public MapModifier<TxIn, TxOut> utxo() {
        return utxo.copy();
    }

    public MapModifier<Hash, TxHistoryEntry> history() {
        return history.copy();
    }

    /** This modifier followed by {@code next}, in chain order. */
    public WalletModifier then(WalletModifier next) {
        Objects.requireNonNull(next, "next");
        MapModifier<TxIn, TxOut> u = utxo.copy();
        u.mergeFrom(next.utxo);
        MapModifier<Hash, TxHistoryEntry> h = history.copy();
        h.mergeFrom(next.history);
        return new WalletModifier(u, h);
    }

    public boolean isEmpty() {
        return utxo.isEmpty() && history.isEmpty();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WalletModifier)) return false;
        WalletModifier other = (WalletModifier) o;
        return utxo.equals(other.utxo) && history.equals(other.history);
    }

    @Override public int hashCode() {
        return Objects.hash(utxo, history);
    }

    @Override public String toString() {
        return "WalletModifier{utxo " + utxo + ", history " + history + "}";
    }

    public static final class Builder {
        private final MapModifier<TxIn, TxOut> utxo = new MapModifier<>();
        private final MapModifier<Hash, TxHistoryEntry> history = new MapModifier<>();

        public Builder addUtxo(TxIn in, TxOut out) { utxo.insert(in, out); return this; }
        public Builder spendUtxo(TxIn in, TxOut previous) { utxo.delete(in, previous); return this; }
        public Builder addHistory(TxHistoryEntry entry) { history.insert(entry.txId(), entry); return this; }
        public Builder removeHistory(TxHistoryEntry entry) { history.delete(entry.txId(), entry); return this; }

        public WalletModifier build() {
            return new WalletModifier(utxo.copy(), history.copy());
        }
    }
}
