package com.secretgateway.gateway;

import com.secretgateway.crypto.CryptoService;
import com.secretgateway.observability.TokenMetrics;
import com.secretgateway.shared.config.GatewayConfig;
import com.secretgateway.shared.config.TokensConfig;
import com.secretgateway.token.Scope;
import com.secretgateway.token.TokenService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = SecretGatewayApp.class, properties = {
        "secretgateway.config-file=target/absent-config.yaml",
        "secretgateway.env-overrides=false"
})
class SecretGatewayAppTest {

    @Autowired
    GatewayConfig gatewayConfig;

    @Autowired
    TokenService tokenService;

    @Autowired
    CryptoService cryptoService;

    @Autowired
    TokenMetrics tokenMetrics;

    @Test
    void usesDefaultsWhenConfigFileIsAbsent() {
        assertEquals(TokensConfig.defaults(), gatewayConfig.tokens());
        assertFalse(gatewayConfig.crypto().hasMasterKey());
    }

    @Test
    void wiresSingleTokenServiceFromConfig() {
        var issued = tokenService.issue(Scope.of("smoke"));
        assertTrue(tokenService.validate(issued.tokenId()).valid());
        assertEquals(tokenService.config().defaultTtlSeconds(), issued.ttlSeconds());
        assertTrue(tokenService.revoke(issued.tokenId()));
        assertTrue(tokenMetrics.issuedCount() >= 1.0);
    }

    @Test
    void cryptoServiceRoundTrips() {
        assertEquals("ping", cryptoService.decryptToString(cryptoService.encryptString("ping"), null));
    }
}
