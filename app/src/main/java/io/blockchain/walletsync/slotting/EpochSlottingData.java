package io.blockchain.walletsync.slotting;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing of one epoch: its slot length and when it starts, as an offset
 * from the system start.
 */
public record EpochSlottingData(Duration slotDuration, Duration epochStart) {
    public EpochSlottingData {
        Objects.requireNonNull(slotDuration, "slotDuration");
        Objects.requireNonNull(epochStart, "epochStart");
        if (slotDuration.isZero() || slotDuration.isNegative()) {
            throw new IllegalArgumentException("slot duration must be positive");
        }
        if (epochStart.isNegative()) {
            throw new IllegalArgumentException("epoch start offset must be >= 0");
        }
    }
}
