package com.secretgateway.shared.config;

/** {@code masterKey} is URL-safe base64 text; blank means a fresh key per process. */
public record CryptoConfig(String masterKey) {

    public static CryptoConfig defaults() {
        return new CryptoConfig("");
    }

    public boolean hasMasterKey() {
        return masterKey != null && !masterKey.isBlank();
    }

    @Override
    public String toString() {
        return "CryptoConfig[masterKey=" + (hasMasterKey() ? "<set>" : "<generated>") + "]";
    }
}
