package io.blockchain.walletsync.tracking;

import java.time.Instant;
import java.util.Optional;

/** What the tracker needs to know about a block header: its difficulty and wall-clock time. */
public record HeaderInfo(long difficulty, Optional<Instant> timestamp) {
    public HeaderInfo {
        timestamp = timestamp != null ? timestamp : Optional.empty();
    }
}
