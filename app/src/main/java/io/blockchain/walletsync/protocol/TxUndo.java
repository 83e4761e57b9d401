package io.blockchain.walletsync.protocol;

import java.util.List;

/**
 * Rollback data for one transaction: the outputs its inputs consumed,
 * positionally aligned with {@link Transaction#inputs()}.
 */
public record TxUndo(List<TxOut> spent) {
    public TxUndo {
        spent = List.copyOf(spent);
    }

    public static TxUndo empty() {
        return new TxUndo(List.of());
    }

    public int size() {
        return spent.size();
    }
}
