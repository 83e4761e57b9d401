package io.blockchain.walletsync;

import io.blockchain.walletsync.blistener.BlocksStorageModifier;
import io.blockchain.walletsync.blistener.LoggingReporter;
import io.blockchain.walletsync.blistener.ModifierAggregator;
import io.blockchain.walletsync.blistener.TimeoutWatchdog;
import io.blockchain.walletsync.blistener.WalletBListener;
import io.blockchain.walletsync.chain.ChainPipeline;
import io.blockchain.walletsync.chain.ChainStore;
import io.blockchain.walletsync.chain.InMemoryChainStore;
import io.blockchain.walletsync.chrono.OldestFirst;
import io.blockchain.walletsync.config.WalletSyncConfig;
import io.blockchain.walletsync.metrics.WalletSyncMetrics;
import io.blockchain.walletsync.protocol.Block;
import io.blockchain.walletsync.protocol.BlockHeader;
import io.blockchain.walletsync.protocol.BlockUndo;
import io.blockchain.walletsync.protocol.Blund;
import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.protocol.Transaction;
import io.blockchain.walletsync.protocol.TxIn;
import io.blockchain.walletsync.protocol.TxOut;
import io.blockchain.walletsync.protocol.TxUndo;
import io.blockchain.walletsync.slotting.EpochSlottingData;
import io.blockchain.walletsync.slotting.SlotId;
import io.blockchain.walletsync.slotting.SlottingData;
import io.blockchain.walletsync.slotting.SystemSlotClock;
import io.blockchain.walletsync.tracking.UtxoTxTracker;
import io.blockchain.walletsync.wallet.InMemoryWalletDB;
import io.blockchain.walletsync.wallet.RocksDBWalletDB;
import io.blockchain.walletsync.wallet.SyncTip;
import io.blockchain.walletsync.wallet.WalletDB;
import io.blockchain.walletsync.wallet.WalletId;
import io.blockchain.walletsync.wallet.WalletKeyStore;
import io.blockchain.walletsync.wallet.WalletKeys;
import io.blockchain.walletsync.wallet.WalletStorageFlusher;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        loadLoggingConfig();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        WalletSyncConfig config = options.configPath() != null
                ? WalletSyncConfig.load(options.configPath())
                : WalletSyncConfig.defaultLocal();
        Path dataPath = options.dataDir().toAbsolutePath().normalize();
        Files.createDirectories(dataPath);

        ChainStore chain = new InMemoryChainStore(
                SlottingData.uniform(config.slotDuration(), config.epochSlots, config.lastEpoch));
        SystemSlotClock slots = new SystemSlotClock(config.systemStart, config.epochSlots, chain, Clock.systemUTC());
        ChainPipeline pipeline = new ChainPipeline(chain);
        Blund genesis = new Blund(
                Block.genesis(new BlockHeader(Hash.ZERO, Hash.ZERO, SlotId.genesisOf(0), 0L, true)),
                BlockUndo.empty());
        Hash genesisTip = pipeline.initGenesis(genesis);

        WalletKeyStore keyStore = new WalletKeyStore(dataPath.resolve("keys"));
        WalletDB walletDb = options.rocksdb()
                ? RocksDBWalletDB.open(dataPath.resolve("walletdb").toString())
                : new InMemoryWalletDB();
        BlocksStorageModifier buffer = new BlocksStorageModifier();
        TimeoutWatchdog watchdog = new TimeoutWatchdog();
        try {
            List<WalletId> wallets = ensureWallets(keyStore, walletDb, options.wallets(), genesisTip);

            ModifierAggregator aggregator = new ModifierAggregator(
                    chain, slots, walletDb, keyStore, new UtxoTxTracker(), buffer);
            pipeline.addListener(new WalletBListener(
                    chain, slots, walletDb, aggregator, new LoggingReporter(), watchdog));
            pipeline.addPostBatchHook(new WalletStorageFlusher(buffer, walletDb));

            runDemoFlow(pipeline, chain, config, keyStore, wallets, options.blocks(), options.rollback());

            for (WalletId wid : wallets) {
                LOG.info("Wallet " + wid + " balance=" + walletDb.getBalance(wid)
                        + " history=" + walletDb.getWalletHistory(wid).size()
                        + " syncTip=" + walletDb.getWalletSyncTip(wid).orElse(null));
            }
            LOG.info("=== Metrics ===\n" + WalletSyncMetrics.scrapeMetrics());
        } finally {
            watchdog.close();
            if (walletDb instanceof RocksDBWalletDB) {
                ((RocksDBWalletDB) walletDb).close();
            }
        }
    }

    private static void loadLoggingConfig() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.warning("Could not load logging.properties: " + e.getMessage());
        }
    }

    /**
     * Wallets created in this run start synced with the fresh genesis block.
     * Wallets persisted by an earlier run keep their old tip and are skipped
     * by the listener until resynced.
     */
    private static List<WalletId> ensureWallets(WalletKeyStore keyStore, WalletDB walletDb, int count, Hash genesisTip)
            throws Exception {
        List<WalletId> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            WalletId wid = WalletId.of("wallet-" + i);
            WalletKeys keys = keyStore.walletIds().contains(wid)
                    ? keyStore.keysFor(wid)
                    : keyStore.createKeys(wid, null);
            if (!walletDb.getWalletIds().contains(wid)) {
                walletDb.createWallet(wid, Set.of(keys.rootAddress()));
                walletDb.setWalletSyncTip(wid, SyncTip.syncedWith(genesisTip));
            }
            LOG.info(wid + " addr=" + keys.rootAddress());
            out.add(wid);
        }
        return out;
    }

    private static void runDemoFlow(ChainPipeline pipeline,
                                    ChainStore chain,
                                    WalletSyncConfig config,
                                    WalletKeyStore keyStore,
                                    List<WalletId> wallets,
                                    int blocks,
                                    int rollback) {
        DemoChain demo = new DemoChain(chain, config);

        Transaction.Builder issuance = Transaction.builder();
        for (WalletId wid : wallets) {
            issuance.output(keyStore.keysFor(wid).rootAddress(), config.issuanceMinor);
        }
        List<Blund> batch = new ArrayList<>();
        batch.add(demo.nextBlock(issuance.build()));
        pipeline.applyBlocks(OldestFirst.of(batch));

        batch = new ArrayList<>();
        for (int b = 1; b < blocks; b++) {
            String from = keyStore.keysFor(wallets.get(b % wallets.size())).rootAddress();
            String to = keyStore.keysFor(wallets.get((b + 1) % wallets.size())).rootAddress();
            batch.add(demo.nextBlock(demo.transfer(from, to, config.transferMinor)));
        }
        if (!batch.isEmpty()) {
            pipeline.applyBlocks(OldestFirst.of(batch));
        }

        if (rollback > 0) {
            LOG.info("Rolling back " + rollback + " block(s)");
            pipeline.rollbackLatest(rollback);
        }
    }

    /** Builds blocks on top of the current tip and tracks the chain-wide UTXO set for undo data. */
    static final class DemoChain {
        private final ChainStore chain;
        private final WalletSyncConfig config;
        private final Map<TxIn, TxOut> utxo = new LinkedHashMap<>();
        private final Map<TxIn, TxOut> pendingSpent = new LinkedHashMap<>();
        private Hash tip;
        private SlotId slot;
        private long difficulty;
        private long txClock;

        DemoChain(ChainStore chain, WalletSyncConfig config) {
            this.chain = chain;
            this.config = config;
            this.tip = chain.getTip();
            BlockHeader head = chain.getBlock(tip).orElseThrow().header();
            this.slot = head.slot();
            this.difficulty = head.difficulty();
            this.txClock = config.systemStart.toEpochMilli();
        }

        Transaction transfer(String from, String to, long amount) {
            for (Map.Entry<TxIn, TxOut> e : utxo.entrySet()) {
                TxOut out = e.getValue();
                if (out.address().equals(from) && out.amountMinor() >= amount) {
                    Transaction.Builder tx = Transaction.builder()
                            .input(e.getKey())
                            .output(to, amount)
                            .timestamp(++txClock);
                    if (out.amountMinor() > amount) {
                        tx.output(from, out.amountMinor() - amount);
                    }
                    pendingSpent.put(e.getKey(), out);
                    utxo.remove(e.getKey());
                    return tx.build();
                }
            }
            throw new IllegalStateException("No spendable output of " + amount + " for " + from);
        }

        Blund nextBlock(Transaction tx) {
            List<TxOut> spent = new ArrayList<>();
            for (TxIn in : tx.inputs()) {
                spent.add(pendingSpent.remove(in));
            }
            for (int i = 0; i < tx.outputs().size(); i++) {
                utxo.put(tx.outRef(i), tx.outputs().get(i));
            }
            slot = nextSlot(slot);
            difficulty++;
            List<Transaction> txs = List.of(tx);
            BlockHeader header = new BlockHeader(tip, Block.merkleRootOf(txs), slot, difficulty, false);
            Blund blund = new Blund(new Block(header, txs), new BlockUndo(List.of(new TxUndo(spent))));
            tip = blund.hash();
            return blund;
        }

        private SlotId nextSlot(SlotId current) {
            if (current.index() + 1 < config.epochSlots) {
                return new SlotId(current.epoch(), current.index() + 1);
            }
            SlotId next = SlotId.genesisOf(current.epoch() + 1);
            SlottingData sd = chain.getSlottingData();
            if (sd.epoch(next.epoch()).isEmpty()) {
                chain.setSlottingData(sd.withNextEpoch(new EpochSlottingData(
                        config.slotDuration(),
                        sd.currentEpochData().epochStart().plus(config.slotDuration().multipliedBy(config.epochSlots)))));
            }
            return next;
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            Path configPath,
            int wallets,
            int blocks,
            int rollback,
            boolean rocksdb
    ) {
        static CliOptions parse(String[] args) {
            Path dataDir = envPath("WALLET_SYNC_DATA_DIR", Path.of("./data/wallet-sync"));
            Path configPath = envPath("WALLET_SYNC_CONFIG", null);
            int wallets = 2;
            int blocks = 5;
            int rollback = 2;
            boolean rocksdb = false;
            boolean showHelp = false;
            String error = null;

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    try {
                        if ("--help".equals(arg) || "-h".equals(arg)) {
                            showHelp = true;
                        } else if (arg.startsWith("--data-dir=")) {
                            dataDir = Path.of(arg.substring("--data-dir=".length()));
                        } else if (arg.startsWith("--config=")) {
                            configPath = Path.of(arg.substring("--config=".length()));
                        } else if (arg.startsWith("--wallets=")) {
                            wallets = parsePositiveInt(arg.substring("--wallets=".length()), "--wallets", 1);
                        } else if (arg.startsWith("--blocks=")) {
                            blocks = parsePositiveInt(arg.substring("--blocks=".length()), "--blocks", 1);
                        } else if (arg.startsWith("--rollback=")) {
                            rollback = parsePositiveInt(arg.substring("--rollback=".length()), "--rollback", 0);
                        } else if (arg.equals("--rocksdb")) {
                            rocksdb = true;
                        } else if (arg.equals("--in-memory")) {
                            rocksdb = false;
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unknown option: " + arg;
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        if (error == null) {
                            error = ex.getMessage();
                        }
                    }
                }
            }

            if (error == null && rollback > blocks) {
                showHelp = true;
                error = "--rollback must not exceed --blocks (" + blocks + ")";
            }

            return new CliOptions(showHelp, error, dataDir, configPath, wallets, blocks, rollback, rocksdb);
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: wallet-sync [options]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for keys and wallet data (default ./data/wallet-sync)
  --config=<file>            JSON config (slot timing, demo amounts)
  --wallets=<n>              Number of demo wallets (default 2)
  --blocks=<n>               Number of blocks to apply (default 5)
  --rollback=<n>             Number of newest blocks to roll back afterwards (default 2)
  --rocksdb                  Persist wallet state in RocksDB under the data dir
  --in-memory                Keep wallet state in memory (default)

Environment overrides:
  WALLET_SYNC_DATA_DIR       Override --data-dir
  WALLET_SYNC_CONFIG         Config file used when --config is not supplied
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static int parsePositiveInt(String value, String flag, int min) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed < min) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
