package com.secretgateway.token;

import com.secretgateway.crypto.CryptoService;
import com.secretgateway.crypto.InvalidParameterException;
import com.secretgateway.observability.TokenMetrics;
import com.secretgateway.shared.config.TokensConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Issues, validates and revokes ephemeral tokens. Construct one per process and inject it
 * wherever tokens are handled.
 */
public class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    public static final String NOT_FOUND_REASON = "Token not found or has expired";
    private static final int TOKEN_ID_BYTES = 32;

    private final CryptoService crypto;
    private final TokenStore store;
    private final TokensConfig config;
    private final TokenMetrics metrics;
    private final Clock clock;

    public TokenService(CryptoService crypto, TokenStore store) {
        this(crypto, store, TokensConfig.defaults(), new TokenMetrics(), Clock.systemUTC());
    }

    public TokenService(CryptoService crypto, TokenStore store, TokensConfig config,
                        TokenMetrics metrics, Clock clock) {
        this.crypto = crypto;
        this.store = store;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    public IssuedToken issue(Scope scope) {
        return issue(scope, config.defaultTtlSeconds(), Map.of());
    }

    public IssuedToken issue(IssueRequest request) {
        if (request == null) {
            throw new TokenIssuanceException("Invalid token parameters: request is required",
                    new InvalidParameterException("request is required"));
        }
        int ttl = request.ttlSeconds() != null ? request.ttlSeconds() : config.defaultTtlSeconds();
        return issue(request.scope(), ttl, request.metadata());
    }

    public IssuedToken issue(Scope scope, int ttlSeconds, Map<String, Object> metadata) {
        try {
            checkIssueParameters(scope, ttlSeconds);
        } catch (InvalidParameterException e) {
            log.debug("Rejected token issuance: {}", e.getMessage());
            throw new TokenIssuanceException("Invalid token parameters: " + e.getMessage(), e);
        }

        var createdAt = clock.instant();
        var expiresAt = createdAt.plusSeconds(ttlSeconds);
        var token = new Token(crypto.generateRandomUrlSafe(TOKEN_ID_BYTES), scope, createdAt, expiresAt, metadata);
        while (!store.putIfAbsent(token)) {
            log.warn("Token id collision on {}, generating a new id", Token.shortId(token.tokenId()));
            token = new Token(crypto.generateRandomUrlSafe(TOKEN_ID_BYTES), scope, createdAt, expiresAt, metadata);
        }

        metrics.tokenIssued();
        log.info("Issued token {} for resource '{}' with TTL {}s",
                Token.shortId(token.tokenId()), scope.resource(), ttlSeconds);
        return new IssuedToken(token.tokenId(), scope, expiresAt, ttlSeconds);
    }

    /**
     * Unknown, revoked and expired ids all produce the same invalid result.
     *
     * @throws InvalidParameterException if {@code tokenId} is null or blank
     */
    public ValidationResult validate(String tokenId) {
        requireTokenId(tokenId);
        var token = store.get(tokenId);
        if (token.isEmpty()) {
            metrics.tokenValidated(false);
            log.debug("Token validation failed: {} not found or expired", Token.shortId(tokenId));
            return ValidationResult.invalid(NOT_FOUND_REASON);
        }
        metrics.tokenValidated(true);
        log.debug("Token {} validated", Token.shortId(tokenId));
        var found = token.get();
        return ValidationResult.valid(found, found.ttlRemaining(clock.instant()));
    }

    public boolean revoke(String tokenId) {
        requireTokenId(tokenId);
        var revoked = store.remove(tokenId);
        if (revoked) {
            metrics.tokenRevoked();
            log.info("Revoked token {}", Token.shortId(tokenId));
        } else {
            log.debug("Token {} not found for revocation", Token.shortId(tokenId));
        }
        return revoked;
    }

    public Optional<Token> tokenInfo(String tokenId) {
        requireTokenId(tokenId);
        return store.get(tokenId);
    }

    public int cleanup() {
        int removed = store.sweep();
        metrics.tokensSwept(removed);
        log.info("Manual cleanup removed {} expired tokens", removed);
        return removed;
    }

    public int activeCount() {
        return store.count();
    }

    public void clearAll() {
        store.clear();
        log.warn("Cleared all tokens from store");
    }

    /** Stops background cleanup. Tokens already stored are kept. */
    public void shutdown() {
        store.shutdown();
        log.info("Token service shutdown");
    }

    public TokensConfig config() { return config; }

    private void checkIssueParameters(Scope scope, int ttlSeconds) {
        if (scope == null) {
            throw new InvalidParameterException("Scope is required");
        }
        if (ttlSeconds < config.minTtlSeconds()) {
            throw new InvalidParameterException("TTL must be at least " + config.minTtlSeconds() + " second(s)");
        }
        if (ttlSeconds > config.maxTtlSeconds()) {
            throw new InvalidParameterException("TTL cannot exceed " + config.maxTtlSeconds() + " seconds");
        }
    }

    private static void requireTokenId(String tokenId) {
        if (tokenId == null || tokenId.isBlank()) {
            throw new InvalidParameterException("Token id must not be empty");
        }
    }
}
