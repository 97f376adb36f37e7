package com.secretgateway.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Random generation, authenticated encryption (Fernet), salted SHA-256 hashing and
 * PBKDF2 key derivation. Each instance owns one {@link MasterKey}, fixed for its lifetime.
 */
public class CryptoService {

    private static final Logger log = LoggerFactory.getLogger(CryptoService.class);

    public static final int DEFAULT_SECRET_LENGTH = 32;
    public static final int DEFAULT_SALT_LENGTH = 16;
    public static final int PBKDF2_ITERATIONS = 480_000;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final MasterKey masterKey;
    private final Clock clock;

    public CryptoService() {
        this(generateKey());
        log.debug("Generated ephemeral master key");
    }

    public CryptoService(String encodedKey) {
        this(MasterKey.decode(encodedKey));
    }

    public CryptoService(MasterKey masterKey) {
        this(masterKey, Clock.systemUTC());
    }

    public CryptoService(MasterKey masterKey, Clock clock) {
        if (masterKey == null) {
            throw new EncryptionException("Invalid master key: null");
        }
        this.masterKey = masterKey;
        this.clock = clock;
    }

    public MasterKey masterKey() { return masterKey; }

    public static MasterKey generateKey() {
        return MasterKey.generate();
    }

    // --- Random generation ---

    public byte[] generateRandomBytes(int length) {
        if (length <= 0) {
            throw new InvalidParameterException("Secret length must be positive");
        }
        var bytes = new byte[length];
        RANDOM.nextBytes(bytes);
        return bytes;
    }

    public String generateRandomHex(int length) {
        return HexFormat.of().formatHex(generateRandomBytes(length));
    }

    public String generateRandomUrlSafe(int length) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(generateRandomBytes(length));
    }

    // --- Authenticated encryption ---

    public String encrypt(byte[] plaintext) {
        if (plaintext == null) {
            throw new EncryptionException("Encryption failed: plaintext is null");
        }
        var iv = new byte[FernetCodec.IV_LENGTH];
        RANDOM.nextBytes(iv);
        return FernetCodec.encode(masterKey, plaintext, clock.instant(), iv);
    }

    public String encryptString(String plaintext) {
        if (plaintext == null) {
            throw new EncryptionException("Encryption failed: plaintext is null");
        }
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] decrypt(String blob) {
        return decrypt(blob, null);
    }

    /** Fails when the blob is older than {@code maxAge}; a null bound disables the age check. */
    public byte[] decrypt(String blob, Duration maxAge) {
        if (maxAge != null && maxAge.isNegative()) {
            throw new InvalidParameterException("Max age must not be negative");
        }
        return FernetCodec.decode(masterKey, blob, clock.instant(), maxAge);
    }

    public String decryptToString(String blob, Duration maxAge) {
        var plaintext = decrypt(blob, maxAge);
        var decoder = StandardCharsets.UTF_8.newDecoder();
        try {
            return decoder.decode(ByteBuffer.wrap(plaintext)).toString();
        } catch (CharacterCodingException e) {
            throw new DecryptionException("Failed to decode decrypted data", e);
        }
    }

    /** Re-encrypts a blob from {@code oldKey} to {@code newKey}. */
    public static String rotate(MasterKey oldKey, MasterKey newKey, String blob) {
        var plaintext = new CryptoService(oldKey).decrypt(blob);
        return new CryptoService(newKey).encrypt(plaintext);
    }

    // --- Hashing ---

    public SaltedDigest hash(byte[] data) {
        return hash(data, null);
    }

    /** SHA-256 over salt then data. A null salt is replaced by a fresh {@value #DEFAULT_SALT_LENGTH}-byte one. */
    public SaltedDigest hash(byte[] data, byte[] salt) {
        if (data == null) {
            throw new InvalidParameterException("Data to hash must not be null");
        }
        var effectiveSalt = salt != null ? salt : generateRandomBytes(DEFAULT_SALT_LENGTH);
        var sha = sha256();
        sha.update(effectiveSalt);
        sha.update(data);
        return new SaltedDigest(sha.digest(), effectiveSalt);
    }

    public SaltedDigest hashString(String data, byte[] salt) {
        if (data == null) {
            throw new InvalidParameterException("Data to hash must not be null");
        }
        return hash(data.getBytes(StandardCharsets.UTF_8), salt);
    }

    public boolean verify(byte[] data, byte[] expectedDigest, byte[] salt) {
        if (data == null || expectedDigest == null || salt == null) {
            return false;
        }
        var computed = hash(data, salt).digest();
        return MessageDigest.isEqual(computed, expectedDigest);
    }

    // --- Key derivation ---

    public DerivedKey deriveKey(String password) {
        return deriveKey(password, null);
    }

    public DerivedKey deriveKey(String password, byte[] salt) {
        if (password == null || password.isEmpty()) {
            throw new InvalidParameterException("Password must not be empty");
        }
        if (salt != null && salt.length == 0) {
            throw new InvalidParameterException("Salt must not be empty");
        }
        var effectiveSalt = salt != null ? salt : generateRandomBytes(DEFAULT_SALT_LENGTH);
        var spec = new PBEKeySpec(password.toCharArray(), effectiveSalt, PBKDF2_ITERATIONS, MasterKey.LENGTH * 8);
        try {
            var factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            var key = factory.generateSecret(spec).getEncoded();
            return new DerivedKey(MasterKey.of(key), effectiveSalt);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Key derivation failed", e);
        } finally {
            spec.clearPassword();
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
