package com.secretgateway.token;

import com.secretgateway.observability.TokenMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token store backed by a single lock around a {@link HashMap}. A daemon thread sweeps
 * expired entries at a fixed delay until {@link #shutdown()}.
 */
public class InMemoryTokenStore implements TokenStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTokenStore.class);

    public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofSeconds(60);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Map<String, Token> tokens = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final TokenMetrics metrics;
    private final ScheduledExecutorService scheduler;
    private final ScheduledFuture<?> sweepTask;
    private volatile boolean shutdown;

    public InMemoryTokenStore() {
        this(DEFAULT_CLEANUP_INTERVAL, Clock.systemUTC());
    }

    public InMemoryTokenStore(Duration cleanupInterval, Clock clock) {
        this(cleanupInterval, clock, null);
    }

    /** {@code metrics} may be null; when set, background sweeps are counted on it. */
    public InMemoryTokenStore(Duration cleanupInterval, Clock clock, TokenMetrics metrics) {
        if (cleanupInterval == null || cleanupInterval.isNegative() || cleanupInterval.isZero()) {
            throw new IllegalArgumentException("Cleanup interval must be positive");
        }
        this.clock = clock;
        this.metrics = metrics;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "token-sweeper");
            t.setDaemon(true);
            return t;
        });
        long periodMs = cleanupInterval.toMillis();
        this.sweepTask = scheduler.scheduleWithFixedDelay(
                this::scheduledSweep, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void put(Token token) {
        lock.lock();
        try {
            tokens.put(token.tokenId(), token);
            log.debug("Stored token {}, expires at {}", Token.shortId(token.tokenId()), token.expiresAt());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean putIfAbsent(Token token) {
        lock.lock();
        try {
            if (tokens.putIfAbsent(token.tokenId(), token) != null) {
                return false;
            }
            log.debug("Stored token {}, expires at {}", Token.shortId(token.tokenId()), token.expiresAt());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Token> get(String tokenId) {
        lock.lock();
        try {
            var token = tokens.get(tokenId);
            if (token == null) {
                return Optional.empty();
            }
            if (token.isExpired(clock.instant())) {
                tokens.remove(tokenId);
                log.debug("Evicted expired token {}", Token.shortId(tokenId));
                return Optional.empty();
            }
            return Optional.of(token);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(String tokenId) {
        lock.lock();
        try {
            return tokens.remove(tokenId) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int sweep() {
        lock.lock();
        try {
            var now = clock.instant();
            int before = tokens.size();
            tokens.values().removeIf(token -> token.isExpired(now));
            int removed = before - tokens.size();
            if (removed > 0) {
                log.info("Cleaned up {} expired tokens", removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int count() {
        lock.lock();
        try {
            sweep();
            return tokens.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int countAll() {
        lock.lock();
        try {
            return tokens.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            tokens.clear();
            log.info("Cleared all tokens from store");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the background sweep and waits for a running one to finish. Stored tokens stay
     * readable. Safe to call more than once.
     */
    @Override
    public synchronized void shutdown() {
        if (shutdown) return;
        shutdown = true;
        sweepTask.cancel(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Token sweeper did not stop within {}s, interrupting", SHUTDOWN_TIMEOUT_SECONDS);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Token store shutdown");
    }

    public boolean isShutdown() {
        return shutdown;
    }

    private void scheduledSweep() {
        if (shutdown) return;
        try {
            int removed = sweep();
            if (metrics != null) {
                metrics.tokensSwept(removed);
            }
        } catch (RuntimeException e) {
            // a failed cycle must not cancel the schedule
            log.error("Error during token cleanup", e);
        }
    }
}
