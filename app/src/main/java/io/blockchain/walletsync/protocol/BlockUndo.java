package io.blockchain.walletsync.protocol;

import java.util.List;

/** Undo data for a whole block, one {@link TxUndo} per transaction in block order. */
public record BlockUndo(List<TxUndo> txUndos) {
    public BlockUndo {
        txUndos = List.copyOf(txUndos);
    }

    public static BlockUndo empty() {
        return new BlockUndo(List.of());
    }
}
