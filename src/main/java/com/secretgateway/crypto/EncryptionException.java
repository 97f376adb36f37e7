package com.secretgateway.crypto;

public class EncryptionException extends CryptoException {

    public EncryptionException(String message) {
        super(message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
