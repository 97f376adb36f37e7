package com.secretgateway.crypto;

import java.util.Arrays;
import java.util.HexFormat;

public final class SaltedDigest {

    private final byte[] digest;
    private final byte[] salt;

    public SaltedDigest(byte[] digest, byte[] salt) {
        this.digest = digest.clone();
        this.salt = salt.clone();
    }

    public byte[] digest() { return digest.clone(); }

    public byte[] salt() { return salt.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SaltedDigest other)) return false;
        return Arrays.equals(digest, other.digest) && Arrays.equals(salt, other.salt);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(digest) + Arrays.hashCode(salt);
    }

    @Override
    public String toString() {
        return "SaltedDigest[digest=" + HexFormat.of().formatHex(digest) + "]";
    }
}
