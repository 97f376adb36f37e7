package com.secretgateway.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".secretgateway", "config.yaml"
    );

    public static GatewayConfig load() {
        return load(DEFAULT_PATH);
    }

    public static GatewayConfig load(Path path) {
        return load(path, System::getenv);
    }

    @SuppressWarnings("unchecked")
    public static GatewayConfig load(Path path, Function<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = (Map<String, Object>) raw.getOrDefault("server", Map.of());
        var tokens = (Map<String, Object>) raw.getOrDefault("tokens", Map.of());
        var crypto = (Map<String, Object>) raw.getOrDefault("crypto", Map.of());

        return new GatewayConfig(
            Integer.parseInt(envOrDefault(env, "SECRETGATEWAY_PORT",
                String.valueOf(server.getOrDefault("port", 8080)))),
            parseTokensConfig(tokens),
            new CryptoConfig(envOrDefault(env, "SECRETGATEWAY_MASTER_KEY",
                stringOrDefault(crypto.get("master-key"), CryptoConfig.defaults().masterKey())))
        );
    }

    private static TokensConfig parseTokensConfig(Map<String, Object> tokens) {
        var defaults = TokensConfig.defaults();
        return new TokensConfig(
            Integer.parseInt(String.valueOf(tokens.getOrDefault("default-ttl", defaults.defaultTtlSeconds()))),
            Integer.parseInt(String.valueOf(tokens.getOrDefault("min-ttl", defaults.minTtlSeconds()))),
            Integer.parseInt(String.valueOf(tokens.getOrDefault("max-ttl", defaults.maxTtlSeconds()))),
            Long.parseLong(String.valueOf(tokens.getOrDefault("cleanup-interval", defaults.cleanupIntervalSeconds())))
        );
    }

    private static String stringOrDefault(Object value, String fallback) {
        return value != null ? String.valueOf(value) : fallback;
    }

    private static String envOrDefault(Function<String, String> env, String name, String fallback) {
        var val = env.apply(name);
        return val != null ? val : fallback;
    }
}
