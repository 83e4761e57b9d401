package io.blockchain.walletsync.blistener;

/**
 * Sink for errors worth reporting beyond the local log.
 */
public interface Reporter {

    /** Report {@code cause} if reporting is enabled, otherwise log it as a warning prefixed with {@code prefix}. */
    void reportOrLogW(String prefix, Throwable cause);
}
