package com.secretgateway.token;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResult(
    boolean valid,
    @JsonProperty("token_id") String tokenId,
    Scope scope,
    @JsonProperty("expires_at") Instant expiresAt,
    @JsonProperty("ttl_remaining") Double ttlRemaining,
    String reason
) {
    public static ValidationResult valid(Token token, double ttlRemaining) {
        return new ValidationResult(true, token.tokenId(), token.scope(), token.expiresAt(), ttlRemaining, null);
    }

    public static ValidationResult invalid(String reason) {
        return new ValidationResult(false, null, null, null, null, reason);
    }
}
