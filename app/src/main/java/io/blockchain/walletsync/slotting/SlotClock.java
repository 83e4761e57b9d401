package io.blockchain.walletsync.slotting;

import java.time.Duration;
import java.time.Instant;

/**
 * Slot timing service.
 */
public interface SlotClock {

    Instant getSystemStart();

    /** Best-effort current slot; may lag or lead the chain near epoch boundaries. */
    SlotId getCurrentSlotInaccurate();

    Duration getCurrentEpochSlotDuration();
}
