package io.blockchain.walletsync.slotting;

/** Slot {@code index} within epoch {@code epoch}. */
public record SlotId(long epoch, int index) implements Comparable<SlotId> {
    public SlotId {
        if (epoch < 0) throw new IllegalArgumentException("epoch must be >= 0");
        if (index < 0) throw new IllegalArgumentException("slot index must be >= 0");
    }

    public static SlotId genesisOf(long epoch) {
        return new SlotId(epoch, 0);
    }

    @Override public int compareTo(SlotId o) {
        int c = Long.compare(epoch, o.epoch);
        return c != 0 ? c : Integer.compare(index, o.index);
    }

    @Override public String toString() {
        return epoch + "/" + index;
    }
}
