package com.secretgateway.token;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Token(
    String tokenId,
    Scope scope,
    Instant createdAt,
    Instant expiresAt,
    Map<String, Object> metadata
) {
    public Token {
        if (tokenId == null || tokenId.isEmpty()) {
            throw new IllegalArgumentException("tokenId must not be empty");
        }
        if (scope == null || createdAt == null || expiresAt == null) {
            throw new IllegalArgumentException("scope, createdAt and expiresAt are required");
        }
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("expiresAt must be after createdAt");
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /** Seconds left before expiry, never negative. */
    public double ttlRemaining(Instant now) {
        if (isExpired(now)) return 0.0;
        return Duration.between(now, expiresAt).toMillis() / 1000.0;
    }

    /** First characters of the id, for log lines. */
    public static String shortId(String tokenId) {
        if (tokenId == null) return "null";
        return tokenId.length() <= 8 ? tokenId : tokenId.substring(0, 8) + "...";
    }
}
