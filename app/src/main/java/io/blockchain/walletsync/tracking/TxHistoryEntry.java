package io.blockchain.walletsync.tracking;

import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.protocol.TxOut;
import io.blockchain.walletsync.slotting.SlotId;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One line of a wallet's transaction history.
 *
 * @param inputs     outputs consumed by the transaction (from its undo data)
 * @param outputs    outputs the transaction created
 * @param difficulty chain difficulty of the including block; empty once rolled back
 * @param timestamp  wall-clock time of the including block, when known
 * @param slot       slot the entry is dated at: the block's slot, or the
 *                   slot of the rollback that removed it
 */
public record TxHistoryEntry(Hash txId,
                             List<TxOut> inputs,
                             List<TxOut> outputs,
                             Optional<Long> difficulty,
                             Optional<Instant> timestamp,
                             SlotId slot) {
    public TxHistoryEntry {
        Objects.requireNonNull(txId, "txId");
        Objects.requireNonNull(slot, "slot");
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        difficulty = difficulty != null ? difficulty : Optional.empty();
        timestamp = timestamp != null ? timestamp : Optional.empty();
    }

    public boolean isConfirmed() {
        return difficulty.isPresent();
    }
}
