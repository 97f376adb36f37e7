package com.secretgateway.gateway;

import com.secretgateway.crypto.CryptoService;
import com.secretgateway.crypto.MasterKey;
import com.secretgateway.observability.TokenMetrics;
import com.secretgateway.shared.config.ConfigLoader;
import com.secretgateway.shared.config.GatewayConfig;
import com.secretgateway.token.InMemoryTokenStore;
import com.secretgateway.token.TokenService;
import com.secretgateway.token.TokenStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Function;

/** One crypto service, store and token service per process, built from the YAML config. */
@Configuration
public class TokenCoreConfiguration {

    /**
     * {@code secretgateway.config-file} points at an alternative YAML file;
     * {@code secretgateway.env-overrides=false} ignores the SECRETGATEWAY_* variables.
     */
    @Bean
    public GatewayConfig gatewayConfig(Environment environment) {
        var file = environment.getProperty("secretgateway.config-file");
        if (file == null || file.isBlank()) {
            return ConfigLoader.load();
        }
        boolean envOverrides = environment.getProperty("secretgateway.env-overrides", Boolean.class, true);
        Function<String, String> env = envOverrides ? System::getenv : name -> null;
        return ConfigLoader.load(Path.of(file), env);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CryptoService cryptoService(GatewayConfig config, Clock clock) {
        var crypto = config.crypto();
        return crypto.hasMasterKey()
                ? new CryptoService(MasterKey.decode(crypto.masterKey()), clock)
                : new CryptoService(CryptoService.generateKey(), clock);
    }

    @Bean
    public TokenMetrics tokenMetrics() {
        return new TokenMetrics();
    }

    @Bean
    public TokenStore tokenStore(GatewayConfig config, Clock clock, TokenMetrics metrics) {
        return new InMemoryTokenStore(Duration.ofSeconds(config.tokens().cleanupIntervalSeconds()), clock, metrics);
    }

    @Bean
    public TokenService tokenService(CryptoService cryptoService, TokenStore tokenStore,
                                     GatewayConfig config, TokenMetrics metrics, Clock clock) {
        return new TokenService(cryptoService, tokenStore, config.tokens(), metrics, clock);
    }
}
