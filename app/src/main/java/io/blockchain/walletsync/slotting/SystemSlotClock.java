package io.blockchain.walletsync.slotting;

import io.blockchain.walletsync.chain.ChainReader;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Slot clock driven by wall-clock time and the chain's slotting data.
 * Past the last known epoch it extrapolates with the current epoch's timing.
 */
public final class SystemSlotClock implements SlotClock {

    private final Instant systemStart;
    private final int epochSlots;
    private final ChainReader chain;
    private final Clock clock;

    public SystemSlotClock(Instant systemStart, int epochSlots, ChainReader chain, Clock clock) {
        if (epochSlots <= 0) {
            throw new IllegalArgumentException("epochSlots must be > 0");
        }
        this.systemStart = Objects.requireNonNull(systemStart, "systemStart");
        this.epochSlots = epochSlots;
        this.chain = Objects.requireNonNull(chain, "chain");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Instant getSystemStart() {
        return systemStart;
    }

    @Override
    public SlotId getCurrentSlotInaccurate() {
        SlottingData sd = chain.getSlottingData();
        Instant now = clock.instant();
        if (now.isBefore(systemStart)) {
            return SlotId.genesisOf(0);
        }
        Duration sinceStart = Duration.between(systemStart, now);

        // walk back to the latest epoch that has already started
        long epoch = sd.currentEpoch();
        EpochSlottingData data = sd.currentEpochData();
        while (epoch > 0 && sinceStart.compareTo(data.epochStart()) < 0) {
            epoch--;
            data = sd.epoch(epoch).orElseThrow();
        }
        long slotsIn = sinceStart.minus(data.epochStart()).toMillis() / data.slotDuration().toMillis();
        long extraEpochs = slotsIn / epochSlots;
        return new SlotId(epoch + extraEpochs, (int) (slotsIn % epochSlots));
    }

    @Override
    public Duration getCurrentEpochSlotDuration() {
        return chain.getSlottingData().currentEpochData().slotDuration();
    }
}
