package io.blockchain.walletsync.wallet;

import javax.crypto.Cipher;
import javax.crypto.EncryptedPrivateKeyInfo;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.PBEParameterSpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Wallet key pairs kept as PEM files ({@code <wallet>.key}, {@code <wallet>.pub})
 * in one directory. Private keys may be PBE-encrypted; such wallets stay
 * locked, and {@link #keysFor(WalletId)} fails for them, until unlocked.
 */
public final class WalletKeyStore implements KeyProvider {
    private static final String PRIV_EXT = ".key";
    private static final String PUB_EXT = ".pub";
    private static final String ENCRYPTED = "ENCRYPTED PRIVATE KEY";
    private static final int KEY_SIZE = 256;
    private static final int SALT_BYTES = 16;
    private static final int ITERATIONS = 65_536;
    private static final String PBES2_OID = "1.2.840.113549.1.5.13";
    private static final String[] PBE_ALGORITHMS = {
            "PBEWithHmacSHA256AndAES_256",
            "PBEWithHmacSHA256AndAES_128"
    };

    private final Map<WalletId, KeyEntry> entries = new TreeMap<>();
    private final Path directory;
    private final SecureRandom random = new SecureRandom();

    public WalletKeyStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
        try {
            Files.createDirectories(directory);
            try (var stream = Files.list(directory)) {
                stream.filter(path -> path.getFileName().toString().endsWith(PRIV_EXT))
                        .forEach(this::load);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to open key store at " + directory, e);
        }
    }

    private void load(Path privatePath) {
        String file = privatePath.getFileName().toString();
        WalletId wid = WalletId.of(file.substring(0, file.length() - PRIV_EXT.length()));
        Path publicPath = directory.resolve(wid.value() + PUB_EXT);
        if (!Files.exists(publicPath)) {
            return;
        }
        try {
            PublicKey publicKey = decodePublicKey(Files.readString(publicPath, StandardCharsets.US_ASCII));
            String privPem = Files.readString(privatePath, StandardCharsets.US_ASCII);
            KeyEntry entry = new KeyEntry(publicKey, privatePath, privPem.contains(ENCRYPTED));
            if (!entry.encrypted) {
                entry.keys = new WalletKeys(new KeyPair(publicKey, decodePrivateKey(privPem, null)));
            }
            entries.put(wid, entry);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load keys of wallet '" + wid + "'", e);
        }
    }

    /** Generate and persist a new key pair; encrypted when {@code passphrase} is non-empty. */
    public synchronized WalletKeys createKeys(WalletId wid, char[] passphrase) throws Exception {
        Objects.requireNonNull(wid, "wid");
        validateFileName(wid);
        if (entries.containsKey(wid)) {
            throw new IllegalArgumentException("Keys already exist for wallet: " + wid);
        }
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(KEY_SIZE);
        KeyPair keyPair = generator.generateKeyPair();

        Path privPath = directory.resolve(wid.value() + PRIV_EXT);
        Path pubPath = directory.resolve(wid.value() + PUB_EXT);
        boolean encrypted = passphrase != null && passphrase.length > 0;
        String privatePem = encrypted
                ? toPem(ENCRYPTED, encryptPkcs8(keyPair.getPrivate().getEncoded(), passphrase))
                : toPem("PRIVATE KEY", keyPair.getPrivate().getEncoded());
        Files.writeString(privPath, privatePem, StandardCharsets.US_ASCII);
        Files.writeString(pubPath, toPem("PUBLIC KEY", keyPair.getPublic().getEncoded()), StandardCharsets.US_ASCII);

        WalletKeys keys = new WalletKeys(keyPair);
        KeyEntry entry = new KeyEntry(keyPair.getPublic(), privPath, encrypted);
        entry.keys = encrypted ? null : keys;
        entries.put(wid, entry);
        return keys;
    }

    public synchronized WalletKeys unlock(WalletId wid, char[] passphrase) throws Exception {
        KeyEntry entry = requireEntry(wid);
        if (entry.keys != null) {
            return entry.keys;
        }
        if (passphrase == null || passphrase.length == 0) {
            throw new IllegalArgumentException("Missing passphrase for encrypted wallet: " + wid);
        }
        try {
            String privPem = Files.readString(entry.privatePath, StandardCharsets.US_ASCII);
            entry.keys = new WalletKeys(new KeyPair(entry.publicKey, decodePrivateKey(privPem, passphrase)));
        } finally {
            Arrays.fill(passphrase, '\0');
        }
        return entry.keys;
    }

    /** Forget decrypted keys of an encrypted wallet. */
    public synchronized void lock(WalletId wid) {
        KeyEntry entry = requireEntry(wid);
        if (entry.encrypted) {
            entry.keys = null;
        }
    }

    @Override
    public synchronized WalletKeys keysFor(WalletId wid) {
        KeyEntry entry = requireEntry(wid);
        if (entry.keys == null) {
            throw new IllegalStateException("Keys of wallet '" + wid + "' are encrypted; unlock before use");
        }
        return entry.keys;
    }

    public synchronized List<WalletId> walletIds() {
        return new ArrayList<>(entries.keySet());
    }

    public synchronized boolean isLocked(WalletId wid) {
        return requireEntry(wid).keys == null;
    }

    private KeyEntry requireEntry(WalletId wid) {
        KeyEntry entry = entries.get(wid);
        if (entry == null) {
            throw new IllegalArgumentException("No keys for wallet: " + wid);
        }
        return entry;
    }

    private static void validateFileName(WalletId wid) {
        String v = wid.value();
        if (v.contains("/") || v.contains("\\") || v.contains("..")) {
            throw new IllegalArgumentException("Wallet id not usable as file name: " + wid);
        }
    }

    private static PrivateKey decodePrivateKey(String pem, char[] passphrase) throws Exception {
        KeyFactory factory = KeyFactory.getInstance("EC");
        if (!pem.contains(ENCRYPTED)) {
            return factory.generatePrivate(new PKCS8EncodedKeySpec(fromPem("PRIVATE KEY", pem)));
        }
        if (passphrase == null || passphrase.length == 0) {
            throw new IllegalArgumentException("Passphrase required for encrypted key");
        }
        EncryptedPrivateKeyInfo info = new EncryptedPrivateKeyInfo(fromPem(ENCRYPTED, pem));
        String algorithm = info.getAlgName();
        if ("PBES2".equalsIgnoreCase(algorithm) || algorithm.equals(PBES2_OID)) {
            // PBES2 names the concrete scheme in its parameters
            algorithm = info.getAlgParameters().toString();
        }
        SecretKey secretKey = SecretKeyFactory.getInstance(algorithm).generateSecret(new PBEKeySpec(passphrase));
        Cipher cipher = Cipher.getInstance(algorithm);
        cipher.init(Cipher.DECRYPT_MODE, secretKey, info.getAlgParameters());
        return factory.generatePrivate(new PKCS8EncodedKeySpec(cipher.doFinal(info.getEncryptedData())));
    }

    private static PublicKey decodePublicKey(String pem) throws Exception {
        return KeyFactory.getInstance("EC").generatePublic(new X509EncodedKeySpec(fromPem("PUBLIC KEY", pem)));
    }

    private byte[] encryptPkcs8(byte[] pkcs8, char[] passphrase) throws GeneralSecurityException {
        GeneralSecurityException last = null;
        for (String algorithm : PBE_ALGORITHMS) {
            try {
                byte[] salt = new byte[SALT_BYTES];
                random.nextBytes(salt);
                SecretKey secretKey = SecretKeyFactory.getInstance(algorithm).generateSecret(new PBEKeySpec(passphrase));
                Cipher cipher = Cipher.getInstance(algorithm);
                cipher.init(Cipher.ENCRYPT_MODE, secretKey, new PBEParameterSpec(salt, ITERATIONS));
                EncryptedPrivateKeyInfo info = new EncryptedPrivateKeyInfo(cipher.getParameters(), cipher.doFinal(pkcs8));
                return info.getEncoded();
            } catch (IOException e) {
                throw new GeneralSecurityException("Failed to encode encrypted private key", e);
            } catch (GeneralSecurityException ex) {
                last = ex;
            }
        }
        throw last != null ? last : new GeneralSecurityException("No supported PBE algorithms available");
    }

    private static byte[] fromPem(String type, String pem) {
        String header = "-----BEGIN " + type + "-----";
        String footer = "-----END " + type + "-----";
        String normalized = pem.replace("\r", "").trim();
        int start = normalized.indexOf(header);
        int end = normalized.indexOf(footer);
        if (start < 0 || end < 0) {
            throw new IllegalArgumentException("Invalid PEM encoding for " + type);
        }
        String base64 = normalized.substring(start + header.length(), end).replaceAll("\\s", "");
        return Base64.getDecoder().decode(base64);
    }

    private static String toPem(String type, byte[] der) {
        String newline = System.lineSeparator();
        return "-----BEGIN " + type + "-----" + newline
                + Base64.getMimeEncoder(64, newline.getBytes(StandardCharsets.US_ASCII)).encodeToString(der) + newline
                + "-----END " + type + "-----" + newline;
    }

    private static final class KeyEntry {
        final PublicKey publicKey;
        final Path privatePath;
        final boolean encrypted;
        WalletKeys keys;

        KeyEntry(PublicKey publicKey, Path privatePath, boolean encrypted) {
            this.publicKey = publicKey;
            this.privatePath = privatePath;
            this.encrypted = encrypted;
        }
    }
}
