package com.secretgateway.crypto;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;

/**
 * Fernet token layout:
 * {@code version(1) | timestamp(8) | iv(16) | AES-128-CBC ciphertext | HMAC-SHA256(32)},
 * URL-safe base64 encoded. The tag covers every byte before it.
 */
final class FernetCodec {

    static final byte VERSION = (byte) 0x80;
    static final int IV_LENGTH = 16;
    private static final int TIMESTAMP_LENGTH = 8;
    private static final int TAG_LENGTH = 32;
    private static final int HEADER_LENGTH = 1 + TIMESTAMP_LENGTH + IV_LENGTH;
    private static final int MIN_LENGTH = HEADER_LENGTH + 16 + TAG_LENGTH;
    private static final long MAX_CLOCK_SKEW_SECONDS = 60;
    private static final String INVALID = "Invalid or expired token";

    private FernetCodec() {}

    static String encode(MasterKey key, byte[] plaintext, Instant timestamp, byte[] iv) {
        try {
            var cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key.encryptionKey(), "AES"),
                    new IvParameterSpec(iv));
            var ciphertext = cipher.doFinal(plaintext);

            var body = ByteBuffer.allocate(HEADER_LENGTH + ciphertext.length + TAG_LENGTH);
            body.put(VERSION);
            body.putLong(timestamp.getEpochSecond());
            body.put(iv);
            body.put(ciphertext);
            var tag = sign(key, body.array(), body.position());
            body.put(tag);
            return Base64.getUrlEncoder().encodeToString(body.array());
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Encryption failed: " + e.getMessage(), e);
        }
    }

    static byte[] decode(MasterKey key, String blob, Instant now, Duration maxAge) {
        if (blob == null) {
            throw new DecryptionException(INVALID);
        }
        byte[] data;
        try {
            data = Base64.getUrlDecoder().decode(blob.strip());
        } catch (IllegalArgumentException e) {
            throw new DecryptionException(INVALID, e);
        }
        if (data.length < MIN_LENGTH || data[0] != VERSION
                || (data.length - HEADER_LENGTH - TAG_LENGTH) % 16 != 0) {
            throw new DecryptionException(INVALID);
        }

        int tagOffset = data.length - TAG_LENGTH;
        byte[] expected;
        try {
            expected = sign(key, data, tagOffset);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Decryption failed: " + e.getMessage(), e);
        }
        if (!MessageDigest.isEqual(expected, Arrays.copyOfRange(data, tagOffset, data.length))) {
            throw new DecryptionException(INVALID);
        }

        long issuedAt = ByteBuffer.wrap(data, 1, TIMESTAMP_LENGTH).getLong();
        long current = now.getEpochSecond();
        if (maxAge != null && current - issuedAt > maxAge.getSeconds()) {
            throw new DecryptionException(INVALID);
        }
        if (current + MAX_CLOCK_SKEW_SECONDS < issuedAt) {
            throw new DecryptionException(INVALID);
        }

        try {
            var cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key.encryptionKey(), "AES"),
                    new IvParameterSpec(data, 1 + TIMESTAMP_LENGTH, IV_LENGTH));
            return cipher.doFinal(data, HEADER_LENGTH, tagOffset - HEADER_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Decryption failed", e);
        }
    }

    private static byte[] sign(MasterKey key, byte[] data, int length) throws GeneralSecurityException {
        var mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(key.signingKey(), "HmacSHA256"));
        mac.update(data, 0, length);
        return mac.doFinal();
    }
}
