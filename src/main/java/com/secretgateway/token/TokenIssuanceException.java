package com.secretgateway.token;

/** Issuance rejected; the cause is usually the {@code InvalidParameterException} that triggered it. */
public class TokenIssuanceException extends TokenServiceException {

    public TokenIssuanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
