package com.secretgateway.crypto;

import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * 32 bytes of symmetric key material: the first half signs, the second half encrypts.
 * Exchanged as URL-safe base64 text. {@link #toString()} never reveals the bytes.
 */
public final class MasterKey {

    public static final int LENGTH = 32;
    private static final int HALF = LENGTH / 2;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final byte[] material;

    private MasterKey(byte[] material) {
        this.material = material;
    }

    public static MasterKey generate() {
        var bytes = new byte[LENGTH];
        RANDOM.nextBytes(bytes);
        return new MasterKey(bytes);
    }

    public static MasterKey of(byte[] material) {
        if (material == null || material.length != LENGTH) {
            throw new EncryptionException("Invalid master key: expected " + LENGTH + " bytes");
        }
        return new MasterKey(material.clone());
    }

    public static MasterKey decode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new EncryptionException("Invalid master key: empty");
        }
        byte[] bytes;
        try {
            bytes = Base64.getUrlDecoder().decode(encoded.strip());
        } catch (IllegalArgumentException e) {
            throw new EncryptionException("Invalid master key: not url-safe base64", e);
        }
        return of(bytes);
    }

    public String encoded() {
        return Base64.getUrlEncoder().encodeToString(material);
    }

    byte[] signingKey() {
        return Arrays.copyOfRange(material, 0, HALF);
    }

    byte[] encryptionKey() {
        return Arrays.copyOfRange(material, HALF, LENGTH);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof MasterKey other && MessageDigest.isEqual(material, other.material);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(material);
    }

    @Override
    public String toString() {
        return "MasterKey[redacted]";
    }
}
