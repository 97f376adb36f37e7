package com.secretgateway.crypto;

/**
 * Raised for every decryption failure: wrong key, tampered bytes, malformed input or an
 * expired blob. Callers only ever see this one type.
 */
public class DecryptionException extends CryptoException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
