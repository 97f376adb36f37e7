package com.secretgateway.token;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record IssuedToken(
    @JsonProperty("token_id") String tokenId,
    Scope scope,
    @JsonProperty("expires_at") Instant expiresAt,
    @JsonProperty("ttl_seconds") int ttlSeconds
) {}
