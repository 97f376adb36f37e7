package com.secretgateway.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class TokenMetrics {

    private final MeterRegistry registry;
    private final Counter issued;
    private final Counter revoked;
    private final Counter validated;
    private final Counter rejected;
    private final Counter swept;

    public TokenMetrics() {
        this(new SimpleMeterRegistry());
    }

    public TokenMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.issued = Counter.builder("secretgateway.tokens.issued").register(registry);
        this.revoked = Counter.builder("secretgateway.tokens.revoked").register(registry);
        this.validated = Counter.builder("secretgateway.tokens.validated").register(registry);
        this.rejected = Counter.builder("secretgateway.tokens.rejected").register(registry);
        this.swept = Counter.builder("secretgateway.tokens.swept").register(registry);
    }

    public MeterRegistry registry() { return registry; }

    public void tokenIssued() { issued.increment(); }

    public void tokenRevoked() { revoked.increment(); }

    public void tokenValidated(boolean valid) {
        (valid ? validated : rejected).increment();
    }

    public void tokensSwept(int count) {
        if (count > 0) swept.increment(count);
    }

    public double issuedCount() { return issued.count(); }

    public double revokedCount() { return revoked.count(); }

    public double validatedCount() { return validated.count(); }

    public double rejectedCount() { return rejected.count(); }

    public double sweptCount() { return swept.count(); }
}
