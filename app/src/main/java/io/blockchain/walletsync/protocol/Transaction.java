package io.blockchain.walletsync.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * UTXO transaction: spends {@link TxIn}s and creates {@link TxOut}s.
 * A transaction without inputs issues new funds (demo chains only).
 */
public final class Transaction {

    private final List<TxIn> inputs;
    private final List<TxOut> outputs;
    private final long timestamp;
    private final Hash id;

    private Transaction(List<TxIn> inputs, List<TxOut> outputs, long timestamp) {
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
        this.timestamp = timestamp;
        basicValidate();
        this.id = Hash.of(serialize());
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private final List<TxIn> inputs = new ArrayList<>();
        private final List<TxOut> outputs = new ArrayList<>();
        private long timestamp = System.currentTimeMillis();

        public Builder input(Hash txId, int index) { this.inputs.add(new TxIn(txId, index)); return this; }
        public Builder input(TxIn in) { this.inputs.add(in); return this; }
        public Builder output(String address, long amountMinor) { this.outputs.add(new TxOut(address, amountMinor)); return this; }
        public Builder output(TxOut out) { this.outputs.add(out); return this; }
        public Builder timestamp(long ts) { this.timestamp = ts; return this; }

        public Transaction build() {
            return new Transaction(inputs, outputs, timestamp);
        }
    }

    public List<TxIn> inputs() { return inputs; }
    public List<TxOut> outputs() { return outputs; }
    public long timestamp() { return timestamp; }
    public Hash id() { return id; }

    /** Reference to output {@code index} of this transaction. */
    public TxIn outRef(int index) {
        if (index < 0 || index >= outputs.size()) {
            throw new IndexOutOfBoundsException("No output " + index + " in tx " + id);
        }
        return new TxIn(id, index);
    }

    public byte[] serialize() {
        int size = 8 + 4 + 4;
        for (TxIn in : inputs) size += Hash.LENGTH + 4;
        for (TxOut out : outputs) size += 4 + out.address().getBytes(StandardCharsets.UTF_8).length + 8;

        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.putLong(timestamp);
        buf.putInt(inputs.size());
        for (TxIn in : inputs) {
            buf.put(in.txId().bytes());
            buf.putInt(in.index());
        }
        buf.putInt(outputs.size());
        for (TxOut out : outputs) {
            byte[] addr = out.address().getBytes(StandardCharsets.UTF_8);
            buf.putInt(addr.length);
            buf.put(addr);
            buf.putLong(out.amountMinor());
        }
        buf.flip();
        byte[] bytes = new byte[buf.remaining()];
        buf.get(bytes);
        return bytes;
    }

    public void basicValidate() {
        if (outputs.isEmpty()) throw new IllegalArgumentException("Transaction has no outputs");
        if (timestamp <= 0) throw new IllegalArgumentException("timestamp must be > 0");
        if (inputs.stream().distinct().count() != inputs.size()) {
            throw new IllegalArgumentException("Duplicate input");
        }
    }

    @Override public boolean equals(Object o) {
        return o instanceof Transaction && id.equals(((Transaction) o).id);
    }

    @Override public int hashCode() { return id.hashCode(); }

    @Override public String toString() {
        return "Transaction{id=" + id + ", in=" + inputs.size() + ", out=" + outputs.size() + "}";
    }
}
