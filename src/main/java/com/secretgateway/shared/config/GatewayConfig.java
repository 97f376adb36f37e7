package com.secretgateway.shared.config;

public record GatewayConfig(
    int serverPort,
    TokensConfig tokens,
    CryptoConfig crypto
) {}
