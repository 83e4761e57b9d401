package io.blockchain.walletsync.protocol;

import java.util.Objects;

/** A block together with the undo data needed to roll it back. */
public record Blund(Block block, BlockUndo undo) {
    public Blund {
        Objects.requireNonNull(block, "block");
        Objects.requireNonNull(undo, "undo");
    }

    public Hash hash() {
        return block.header().hash();
    }
}
