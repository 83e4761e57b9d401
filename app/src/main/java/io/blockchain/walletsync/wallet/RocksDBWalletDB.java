package io.blockchain.walletsync.wallet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.protocol.TxIn;
import io.blockchain.walletsync.protocol.TxOut;
import io.blockchain.walletsync.slotting.SlotId;
import io.blockchain.walletsync.tracking.TxHistoryEntry;
import io.blockchain.walletsync.tracking.WalletModifier;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent WalletDB using RocksDB.
 *
 * Layout (column families):
 *  - "wallets" : key = walletId,                         val = {"addresses":[..], "syncTip":{..}}
 *  - "utxo"    : key = walletId 0x00 txId(32) index(4),  val = {"address":..,"amountMinor":..}
 *  - "history" : key = walletId 0x00 txId(32),           val = history entry JSON
 */
public final class RocksDBWalletDB implements WalletDB, AutoCloseable {

    static {
        RocksDB.loadLibrary();
    }

    private static final byte SEPARATOR = 0x00;

    private final ObjectMapper mapper = new ObjectMapper();
    private final RocksDB db;
    private final DBOptions dbOptions;
    private final ColumnFamilyHandle cfDefault;
    private final ColumnFamilyHandle cfWallets;
    private final ColumnFamilyHandle cfUtxo;
    private final ColumnFamilyHandle cfHistory;

    private RocksDBWalletDB(RocksDB db,
                            DBOptions dbOptions,
                            ColumnFamilyHandle cfDefault,
                            ColumnFamilyHandle cfWallets,
                            ColumnFamilyHandle cfUtxo,
                            ColumnFamilyHandle cfHistory) {
        this.db = db;
        this.dbOptions = dbOptions;
        this.cfDefault = cfDefault;
        this.cfWallets = cfWallets;
        this.cfUtxo = cfUtxo;
        this.cfHistory = cfHistory;
    }

    /** Open or create a wallet database in the given directory. */
    public static RocksDBWalletDB open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor("wallets".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("utxo".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("history".getBytes(StandardCharsets.UTF_8))
        );
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
        try {
            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            return new RocksDBWalletDB(db, dbOpts, cfHandles.get(0), cfHandles.get(1), cfHandles.get(2), cfHandles.get(3));
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new RuntimeException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    // -------------- WalletDB API ----------------

    @Override
    public synchronized List<WalletId> getWalletIds() {
        List<WalletId> out = new ArrayList<>();
        try (RocksIterator it = db.newIterator(cfWallets)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                out.add(WalletId.of(new String(it.key(), StandardCharsets.UTF_8)));
            }
        }
        Collections.sort(out);
        return out;
    }

    @Override
    public synchronized Optional<SyncTip> getWalletSyncTip(WalletId id) {
        ObjectNode record = readWallet(id);
        if (record == null || !record.hasNonNull("syncTip")) {
            return Optional.empty();
        }
        JsonNode tip = record.get("syncTip");
        return Optional.of(tip.path("synced").asBoolean(false)
                ? SyncTip.syncedWith(Hash.fromHex(tip.path("tip").asText()))
                : SyncTip.notSynced());
    }

    @Override
    public synchronized Set<String> getWalletAddresses(WalletId id) {
        Set<String> out = new LinkedHashSet<>();
        for (JsonNode address : requireWallet(id).path("addresses")) {
            out.add(address.asText());
        }
        return Collections.unmodifiableSet(out);
    }

    @Override
    public synchronized void createWallet(WalletId id, Set<String> addresses) {
        Objects.requireNonNull(id, "id");
        if (readWallet(id) != null) {
            throw new IllegalArgumentException("Wallet already exists: " + id);
        }
        ObjectNode record = mapper.createObjectNode();
        ArrayNode array = record.putArray("addresses");
        addresses.forEach(array::add);
        record.set("syncTip", syncTipNode(SyncTip.notSynced()));
        writeWallet(id, record);
    }

    @Override
    public synchronized void addWalletAddress(WalletId id, String address) {
        ObjectNode record = requireWallet(id);
        JsonNode existingArray = record.get("addresses");
        ArrayNode array = existingArray instanceof ArrayNode ? (ArrayNode) existingArray : record.putArray("addresses");
        for (JsonNode existing : array) {
            if (existing.asText().equals(address)) {
                return;
            }
        }
        array.add(address);
        writeWallet(id, record);
    }

    @Override
    public synchronized void setWalletSyncTip(WalletId id, SyncTip tip) {
        Objects.requireNonNull(tip, "tip");
        ObjectNode record = requireWallet(id);
        record.set("syncTip", syncTipNode(tip));
        writeWallet(id, record);
    }

    /** Drop the recorded sync tip, leaving the wallet without one. */
    public synchronized void removeWalletSyncTip(WalletId id) {
        ObjectNode record = requireWallet(id);
        record.remove("syncTip");
        writeWallet(id, record);
    }

    @Override
    public synchronized void applyModifier(WalletId id, WalletModifier modifier) {
        requireWallet(id);
        try (WriteOptions wo = new WriteOptions().setSync(false);
             WriteBatch batch = new WriteBatch()) {
            for (TxIn spent : modifier.utxo().deletions().keySet()) {
                batch.delete(cfUtxo, utxoKey(id, spent));
            }
            for (Map.Entry<TxIn, TxOut> e : modifier.utxo().insertions().entrySet()) {
                batch.put(cfUtxo, utxoKey(id, e.getKey()), toJson(txOutNode(e.getValue())));
            }
            for (Hash removed : modifier.history().deletions().keySet()) {
                batch.delete(cfHistory, historyKey(id, removed));
            }
            for (Map.Entry<Hash, TxHistoryEntry> e : modifier.history().insertions().entrySet()) {
                batch.put(cfHistory, historyKey(id, e.getKey()), toJson(historyNode(e.getValue())));
            }
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new RuntimeException("applyModifier failed for wallet " + id, e);
        }
    }

    @Override
    public synchronized Map<TxIn, TxOut> getWalletUtxo(WalletId id) {
        requireWallet(id);
        Map<TxIn, TxOut> out = new LinkedHashMap<>();
        byte[] prefix = walletPrefix(id);
        try (RocksIterator it = db.newIterator(cfUtxo)) {
            for (it.seek(prefix); it.isValid() && startsWith(it.key(), prefix); it.next()) {
                ByteBuffer key = ByteBuffer.wrap(it.key(), prefix.length, Hash.LENGTH + Integer.BYTES);
                byte[] txId = new byte[Hash.LENGTH];
                key.get(txId);
                TxIn in = new TxIn(new Hash(txId), key.getInt());
                out.put(in, txOutFrom(fromJson(it.value())));
            }
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public synchronized Map<Hash, TxHistoryEntry> getWalletHistory(WalletId id) {
        requireWallet(id);
        Map<Hash, TxHistoryEntry> out = new LinkedHashMap<>();
        byte[] prefix = walletPrefix(id);
        try (RocksIterator it = db.newIterator(cfHistory)) {
            for (it.seek(prefix); it.isValid() && startsWith(it.key(), prefix); it.next()) {
                TxHistoryEntry entry = historyFrom(fromJson(it.value()));
                out.put(entry.txId(), entry);
            }
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public void close() {
        // handles first, then the DB and its options
        cfWallets.close();
        cfUtxo.close();
        cfHistory.close();
        cfDefault.close();
        db.close();
        dbOptions.close();
    }

    // -------------- records ----------------

    private ObjectNode readWallet(WalletId id) {
        try {
            byte[] raw = db.get(cfWallets, walletKey(id));
            return raw == null ? null : (ObjectNode) fromJson(raw);
        } catch (RocksDBException e) {
            throw new RuntimeException("Failed to read wallet " + id, e);
        }
    }

    private ObjectNode requireWallet(WalletId id) {
        ObjectNode record = readWallet(id);
        if (record == null) {
            throw new IllegalArgumentException("Unknown wallet: " + id);
        }
        return record;
    }

    private void writeWallet(WalletId id, ObjectNode record) {
        try {
            db.put(cfWallets, walletKey(id), toJson(record));
        } catch (RocksDBException e) {
            throw new RuntimeException("Failed to write wallet " + id, e);
        }
    }

    private ObjectNode syncTipNode(SyncTip tip) {
        ObjectNode node = mapper.createObjectNode().put("synced", tip.isSynced());
        tip.tip().ifPresent(h -> node.put("tip", h.hex()));
        return node;
    }

    private ObjectNode txOutNode(TxOut out) {
        return mapper.createObjectNode()
                .put("address", out.address())
                .put("amountMinor", out.amountMinor());
    }

    private static TxOut txOutFrom(JsonNode node) {
        return new TxOut(node.path("address").asText(), node.path("amountMinor").asLong());
    }

    private ObjectNode historyNode(TxHistoryEntry entry) {
        ObjectNode node = mapper.createObjectNode().put("txId", entry.txId().hex());
        ArrayNode inputs = node.putArray("inputs");
        entry.inputs().forEach(out -> inputs.add(txOutNode(out)));
        ArrayNode outputs = node.putArray("outputs");
        entry.outputs().forEach(out -> outputs.add(txOutNode(out)));
        entry.difficulty().ifPresent(d -> node.put("difficulty", d));
        entry.timestamp().ifPresent(ts -> node.put("timestampMillis", ts.toEpochMilli()));
        node.putObject("slot")
                .put("epoch", entry.slot().epoch())
                .put("index", entry.slot().index());
        return node;
    }

    private static TxHistoryEntry historyFrom(JsonNode node) {
        List<TxOut> inputs = new ArrayList<>();
        node.path("inputs").forEach(n -> inputs.add(txOutFrom(n)));
        List<TxOut> outputs = new ArrayList<>();
        node.path("outputs").forEach(n -> outputs.add(txOutFrom(n)));
        Optional<Long> difficulty = node.hasNonNull("difficulty")
                ? Optional.of(node.get("difficulty").asLong())
                : Optional.empty();
        Optional<Instant> timestamp = node.hasNonNull("timestampMillis")
                ? Optional.of(Instant.ofEpochMilli(node.get("timestampMillis").asLong()))
                : Optional.empty();
        JsonNode slot = node.path("slot");
        return new TxHistoryEntry(
                Hash.fromHex(node.path("txId").asText()),
                inputs,
                outputs,
                difficulty,
                timestamp,
                new SlotId(slot.path("epoch").asLong(), slot.path("index").asInt()));
    }

    private byte[] toJson(JsonNode node) {
        try {
            return mapper.writeValueAsBytes(node);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode wallet record", e);
        }
    }

    private JsonNode fromJson(byte[] raw) {
        try {
            return mapper.readTree(raw);
        } catch (IOException e) {
            throw new IllegalStateException("Corrupt wallet record", e);
        }
    }

    // -------------- keys ----------------

    private static byte[] walletKey(WalletId id) {
        return id.value().getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] walletPrefix(WalletId id) {
        byte[] wid = walletKey(id);
        byte[] prefix = Arrays.copyOf(wid, wid.length + 1);
        prefix[wid.length] = SEPARATOR;
        return prefix;
    }

    private static byte[] utxoKey(WalletId id, TxIn in) {
        byte[] prefix = walletPrefix(id);
        return ByteBuffer.allocate(prefix.length + Hash.LENGTH + Integer.BYTES)
                .put(prefix)
                .put(in.txId().bytes())
                .putInt(in.index())
                .array();
    }

    private static byte[] historyKey(WalletId id, Hash txId) {
        byte[] prefix = walletPrefix(id);
        return ByteBuffer.allocate(prefix.length + Hash.LENGTH)
                .put(prefix)
                .put(txId.bytes())
                .array();
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
