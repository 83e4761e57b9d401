package io.blockchain.walletsync.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/** Config holder for the wallet sync node. */
public final class WalletSyncConfig {
    public final Instant systemStart;
    public final long slotDurationMillis;
    public final int epochSlots;
    public final long lastEpoch;
    public final long issuanceMinor;
    public final long transferMinor;

    public WalletSyncConfig(Instant systemStart, long slotDurationMillis, int epochSlots, long lastEpoch,
                            long issuanceMinor, long transferMinor) {
        if (slotDurationMillis <= 0) throw new IllegalArgumentException("slotDurationMillis must be > 0");
        if (epochSlots <= 0) throw new IllegalArgumentException("epochSlots must be > 0");
        if (lastEpoch < 0) throw new IllegalArgumentException("lastEpoch must be >= 0");
        if (issuanceMinor <= 0) throw new IllegalArgumentException("issuanceMinor must be > 0");
        if (transferMinor <= 0 || transferMinor > issuanceMinor) {
            throw new IllegalArgumentException("transferMinor must be in (0, issuanceMinor]");
        }
        this.systemStart = systemStart;
        this.slotDurationMillis = slotDurationMillis;
        this.epochSlots = epochSlots;
        this.lastEpoch = lastEpoch;
        this.issuanceMinor = issuanceMinor;
        this.transferMinor = transferMinor;
    }

    public static WalletSyncConfig defaultLocal() {
        return new WalletSyncConfig(
                Instant.now(),
                1_000L,     // 1s slots keep the watchdog threshold short
                10,         // slots per epoch
                0L,         // only the first epoch is known up front
                1_000_000L, // initial funds per wallet (minor units)
                250L        // per-transfer amount in the demo
        );
    }

    /**
     * Reads a JSON object from {@code path}; fields it leaves out keep their
     * {@link #defaultLocal()} value. {@code systemStart} is epoch millis.
     */
    public static WalletSyncConfig load(Path path) {
        WalletSyncConfig defaults = defaultLocal();
        JsonNode root;
        try {
            root = new ObjectMapper().readTree(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config from " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Config " + path + " must be a JSON object");
        }
        try {
            return new WalletSyncConfig(
                    root.hasNonNull("systemStart")
                            ? Instant.ofEpochMilli(root.get("systemStart").asLong())
                            : defaults.systemStart,
                    root.path("slotDurationMillis").asLong(defaults.slotDurationMillis),
                    root.path("epochSlots").asInt(defaults.epochSlots),
                    root.path("lastEpoch").asLong(defaults.lastEpoch),
                    root.path("issuanceMinor").asLong(defaults.issuanceMinor),
                    root.path("transferMinor").asLong(defaults.transferMinor)
            );
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid config " + path + ": " + e.getMessage(), e);
        }
    }

    public Duration slotDuration() {
        return Duration.ofMillis(slotDurationMillis);
    }
}
