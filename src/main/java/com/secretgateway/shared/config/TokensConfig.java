package com.secretgateway.shared.config;

public record TokensConfig(
    int defaultTtlSeconds,
    int minTtlSeconds,
    int maxTtlSeconds,
    long cleanupIntervalSeconds
) {
    public TokensConfig {
        if (minTtlSeconds < 1) {
            throw new IllegalArgumentException("tokens.min-ttl must be at least 1");
        }
        if (maxTtlSeconds < minTtlSeconds) {
            throw new IllegalArgumentException("tokens.max-ttl must not be below tokens.min-ttl");
        }
        if (defaultTtlSeconds < minTtlSeconds || defaultTtlSeconds > maxTtlSeconds) {
            throw new IllegalArgumentException("tokens.default-ttl must lie within [min-ttl, max-ttl]");
        }
        if (cleanupIntervalSeconds <= 0) {
            throw new IllegalArgumentException("tokens.cleanup-interval must be positive");
        }
    }

    public static TokensConfig defaults() {
        return new TokensConfig(300, 1, 3600, 60);
    }
}
