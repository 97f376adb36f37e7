package com.secretgateway.token;

import com.secretgateway.crypto.CryptoService;
import com.secretgateway.crypto.InvalidParameterException;
import com.secretgateway.observability.TokenMetrics;
import com.secretgateway.shared.config.TokensConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TokenServiceTest {

    private MutableClock clock;
    private InMemoryTokenStore store;
    private TokenMetrics metrics;
    private TokenService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new InMemoryTokenStore(Duration.ofHours(1), clock);
        metrics = new TokenMetrics();
        service = new TokenService(new CryptoService(), store, TokensConfig.defaults(), metrics, clock);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 60, 300, 3599, 3600})
    void issuedTokenValidatesWithFullTtl(int ttl) {
        var issued = service.issue(Scope.of("secrets/db", "read"), ttl, Map.of());

        var result = service.validate(issued.tokenId());

        assertTrue(result.valid());
        assertEquals(issued.tokenId(), result.tokenId());
        assertEquals(issued.scope(), result.scope());
        assertEquals(issued.expiresAt(), result.expiresAt());
        assertEquals(ttl, result.ttlRemaining(), 0.01);
        assertNull(result.reason());
    }

    @Test
    void issueReturnsRequestedTtlAndExpiry() {
        var issued = service.issue(Scope.of("secrets/api", "read", "write"), 120, Map.of("owner", "ci"));

        assertEquals(120, issued.ttlSeconds());
        assertEquals(clock.instant().plusSeconds(120), issued.expiresAt());
        assertEquals(List.of("read", "write"), issued.scope().actions());
        assertEquals(Map.of("owner", "ci"), service.tokenInfo(issued.tokenId()).orElseThrow().metadata());
    }

    @Test
    void tokenIdCarriesAtLeast32BytesOfEntropy() {
        var issued = service.issue(Scope.of("r"));
        // 32 bytes unpadded url-safe base64
        assertEquals(43, issued.tokenId().length());
        assertTrue(issued.tokenId().matches("[A-Za-z0-9_-]+"));
    }

    @Test
    void defaultTtlComesFromConfig() {
        var issued = service.issue(Scope.of("r"));
        assertEquals(300, issued.ttlSeconds());

        var fromRequest = service.issue(new IssueRequest(Scope.of("r"), null, null));
        assertEquals(300, fromRequest.ttlSeconds());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 3601, Integer.MAX_VALUE})
    void ttlOutsideBoundsIsRejected(int ttl) {
        var ex = assertThrows(TokenIssuanceException.class, () -> service.issue(Scope.of("r"), ttl, Map.of()));
        assertInstanceOf(InvalidParameterException.class, ex.getCause());
        assertEquals(0, store.countAll());
    }

    @Test
    void customBoundsAreHonoured() {
        var narrow = new TokenService(new CryptoService(), store, new TokensConfig(30, 10, 60, 60), metrics, clock);
        assertThrows(TokenIssuanceException.class, () -> narrow.issue(Scope.of("r"), 5, Map.of()));
        assertThrows(TokenIssuanceException.class, () -> narrow.issue(Scope.of("r"), 61, Map.of()));
        assertEquals(30, narrow.issue(Scope.of("r")).ttlSeconds());
    }

    @Test
    void missingScopeIsRejected() {
        assertThrows(TokenIssuanceException.class, () -> service.issue(null, 60, Map.of()));
        assertThrows(TokenIssuanceException.class, () -> service.issue((IssueRequest) null));
    }

    @Test
    void unknownTokenIsInvalidWithReason() {
        var result = service.validate("no-such-token");
        assertFalse(result.valid());
        assertEquals(TokenService.NOT_FOUND_REASON, result.reason());
        assertNull(result.tokenId());
        assertNull(result.scope());
    }

    @Test
    void blankTokenIdIsRejected() {
        assertThrows(InvalidParameterException.class, () -> service.validate(""));
        assertThrows(InvalidParameterException.class, () -> service.validate("   "));
        assertThrows(InvalidParameterException.class, () -> service.validate(null));
    }

    @Test
    void tokenIsInvalidAfterTtlElapses() {
        var issued = service.issue(Scope.of("r"), 1, Map.of());
        clock.advance(Duration.ofSeconds(2));

        var result = service.validate(issued.tokenId());

        assertFalse(result.valid());
        assertEquals(TokenService.NOT_FOUND_REASON, result.reason());
        assertEquals(0, store.countAll());
    }

    @Test
    void tokenExpiresInRealTime() throws Exception {
        var realTime = new TokenService(new CryptoService(), new InMemoryTokenStore());
        try {
            var issued = realTime.issue(Scope.of("r"), 1, Map.of());
            Thread.sleep(2000);
            assertFalse(realTime.validate(issued.tokenId()).valid());
        } finally {
            realTime.shutdown();
        }
    }

    @Test
    void ttlRemainingShrinksAsTimePasses() {
        var issued = service.issue(Scope.of("r"), 100, Map.of());
        clock.advance(Duration.ofMillis(40_500));
        assertEquals(59.5, service.validate(issued.tokenId()).ttlRemaining(), 0.001);
    }

    @Test
    void revokedTokenIsIndistinguishableFromUnknown() {
        var issued = service.issue(Scope.of("r"), 60, Map.of());

        assertTrue(service.revoke(issued.tokenId()));
        var afterRevoke = service.validate(issued.tokenId());
        assertFalse(afterRevoke.valid());
        assertEquals(service.validate("never-issued"), afterRevoke);
        assertFalse(service.revoke(issued.tokenId()));
    }

    @Test
    void cleanupRemovesExpiredAndReportsCount() {
        service.issue(Scope.of("r"), 5, Map.of());
        service.issue(Scope.of("r"), 5, Map.of());
        var survivor = service.issue(Scope.of("r"), 600, Map.of());
        clock.advance(Duration.ofSeconds(10));

        assertEquals(2, service.cleanup());
        assertEquals(1, service.activeCount());
        assertTrue(service.validate(survivor.tokenId()).valid());
        assertEquals(2.0, metrics.sweptCount());
    }

    @Test
    void activeCountIgnoresExpiredTokens() {
        service.issue(Scope.of("r"), 5, Map.of());
        service.issue(Scope.of("r"), 50, Map.of());
        assertEquals(2, service.activeCount());
        clock.advance(Duration.ofSeconds(5));
        assertEquals(1, service.activeCount());
    }

    @Test
    void shutdownKeepsStoredTokensAndIsRepeatable() {
        var issued = service.issue(Scope.of("r"), 60, Map.of());
        service.shutdown();
        service.shutdown();
        assertTrue(service.validate(issued.tokenId()).valid());
    }

    @Test
    void clearAllEmptiesStore() {
        service.issue(Scope.of("r"));
        service.clearAll();
        assertEquals(0, service.activeCount());
    }

    @Test
    void concurrentIssuanceProducesUniqueEntries() throws Exception {
        int threads = 8;
        int perThread = 250;
        var pool = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        try {
            var tasks = new ArrayList<Callable<List<String>>>();
            for (int t = 0; t < threads; t++) {
                tasks.add(() -> {
                    start.await();
                    var ids = new ArrayList<String>();
                    for (int i = 0; i < perThread; i++) {
                        ids.add(service.issue(Scope.of("r"), 600, Map.of()).tokenId());
                    }
                    return ids;
                });
            }
            var futures = tasks.stream().map(pool::submit).toList();
            start.countDown();

            var all = new HashSet<String>();
            for (var f : futures) all.addAll(f.get());

            assertEquals(threads * perThread, all.size());
            assertEquals(threads * perThread, service.activeCount());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void collidingIdIsRegenerated() {
        var crypto = mock(CryptoService.class);
        when(crypto.generateRandomUrlSafe(32)).thenReturn("dup", "dup", "fresh");
        var svc = new TokenService(crypto, store, TokensConfig.defaults(), metrics, clock);

        assertEquals("dup", svc.issue(Scope.of("r")).tokenId());
        assertEquals("fresh", svc.issue(Scope.of("r")).tokenId());
        verify(crypto, times(3)).generateRandomUrlSafe(32);
    }

    @Test
    void metricsTrackOutcomes() {
        var issued = service.issue(Scope.of("r"));
        service.validate(issued.tokenId());
        service.validate("missing");
        service.revoke(issued.tokenId());

        assertThat(metrics.issuedCount()).isEqualTo(1.0);
        assertThat(metrics.validatedCount()).isEqualTo(1.0);
        assertThat(metrics.rejectedCount()).isEqualTo(1.0);
        assertThat(metrics.revokedCount()).isEqualTo(1.0);
    }
}
