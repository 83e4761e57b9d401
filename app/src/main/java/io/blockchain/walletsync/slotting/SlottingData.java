package io.blockchain.walletsync.slotting;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Known epoch timings, keyed by epoch. Epochs are contiguous from 0 and the
 * last one is the current epoch as far as the chain state knows.
 */
public final class SlottingData {
    private final NavigableMap<Long, EpochSlottingData> epochs;

    private SlottingData(NavigableMap<Long, EpochSlottingData> epochs) {
        if (epochs.isEmpty()) {
            throw new IllegalArgumentException("slotting data needs at least one epoch");
        }
        if (epochs.firstKey() != 0L || epochs.lastKey() != epochs.size() - 1L) {
            throw new IllegalArgumentException("slotting data epochs must be contiguous from 0");
        }
        this.epochs = epochs;
    }

    /**
     * Uniform timing: every epoch up to {@code lastEpoch} has the same slot
     * duration and {@code epochSlots} slots.
     */
    public static SlottingData uniform(Duration slotDuration, int epochSlots, long lastEpoch) {
        if (epochSlots <= 0) {
            throw new IllegalArgumentException("epochSlots must be > 0");
        }
        NavigableMap<Long, EpochSlottingData> map = new TreeMap<>();
        Duration epochLength = slotDuration.multipliedBy(epochSlots);
        for (long e = 0; e <= lastEpoch; e++) {
            map.put(e, new EpochSlottingData(slotDuration, epochLength.multipliedBy(e)));
        }
        return new SlottingData(map);
    }

    public static SlottingData of(Map<Long, EpochSlottingData> epochs) {
        return new SlottingData(new TreeMap<>(epochs));
    }

    public Optional<EpochSlottingData> epoch(long epoch) {
        return Optional.ofNullable(epochs.get(epoch));
    }

    public long currentEpoch() {
        return epochs.lastKey();
    }

    public EpochSlottingData currentEpochData() {
        return epochs.lastEntry().getValue();
    }

    /** Start of {@code slot}, or empty when its epoch is not known yet. */
    public Optional<Instant> slotStart(Instant systemStart, SlotId slot) {
        EpochSlottingData data = epochs.get(slot.epoch());
        if (data == null) {
            return Optional.empty();
        }
        return Optional.of(systemStart
                .plus(data.epochStart())
                .plus(data.slotDuration().multipliedBy(slot.index())));
    }

    /** Returns a copy with {@code next} appended as the following epoch. */
    public SlottingData withNextEpoch(EpochSlottingData next) {
        NavigableMap<Long, EpochSlottingData> copy = new TreeMap<>(epochs);
        copy.put(epochs.lastKey() + 1, next);
        return new SlottingData(copy);
    }

    @Override public boolean equals(Object o) {
        return o instanceof SlottingData && epochs.equals(((SlottingData) o).epochs);
    }

    @Override public int hashCode() { return epochs.hashCode(); }

    @Override public String toString() {
        return "SlottingData{epochs=" + epochs.size() + ", current=" + currentEpochData() + "}";
    }
}
