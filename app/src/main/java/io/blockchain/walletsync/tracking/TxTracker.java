package io.blockchain.walletsync.tracking;

import io.blockchain.walletsync.protocol.BlockHeader;
import io.blockchain.walletsync.slotting.SlotId;
import io.blockchain.walletsync.wallet.WalletKeys;

import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Computes what a batch of transactions changes for one wallet.
 * Implementations are pure: no I/O beyond calling {@code headerInfo}.
 */
public interface TxTracker {

    /** Forward delta of {@code txs}, consumed in the given (oldest-first) order. */
    WalletModifier trackingApplyTxs(WalletKeys keys,
                                    Set<String> addresses,
                                    Function<BlockHeader, HeaderInfo> headerInfo,
                                    List<TxWithUndo> txs);

    /**
     * Inverse delta of {@code txs}, consumed newest transaction first.
     * {@code curSlot} dates entries that lose their block context.
     */
    WalletModifier trackingRollbackTxs(WalletKeys keys,
                                       Set<String> addresses,
                                       SlotId curSlot,
                                       Function<BlockHeader, HeaderInfo> headerInfo,
                                       List<TxWithUndo> txs);
}
