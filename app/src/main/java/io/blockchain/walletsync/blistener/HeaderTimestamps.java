package io.blockchain.walletsync.blistener;

import io.blockchain.walletsync.chain.ChainReader;
import io.blockchain.walletsync.protocol.BlockHeader;
import io.blockchain.walletsync.slotting.SlotClock;
import io.blockchain.walletsync.slotting.SlottingData;
import io.blockchain.walletsync.tracking.HeaderInfo;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

final class HeaderTimestamps {
    private HeaderTimestamps() {}

    /**
     * Snapshot of the slot timing: maps a header to its difficulty and the
     * start of its slot. Genesis headers get no timestamp.
     */
    static Function<BlockHeader, HeaderInfo> headerInfoGetter(ChainReader chain, SlotClock slots) {
        Instant systemStart = slots.getSystemStart();
        SlottingData sd = chain.getSlottingData();
        return header -> {
            Optional<Instant> ts = header.isGenesis()
                    ? Optional.empty()
                    : sd.slotStart(systemStart, header.slot());
            return new HeaderInfo(header.difficulty(), ts);
        };
    }
}
