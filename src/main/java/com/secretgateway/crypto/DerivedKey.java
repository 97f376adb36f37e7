package com.secretgateway.crypto;

/** Result of password-based key derivation: the key plus the salt needed to derive it again. */
public record DerivedKey(MasterKey key, byte[] salt) {

    public DerivedKey {
        salt = salt.clone();
    }

    @Override
    public byte[] salt() {
        return salt.clone();
    }
}
