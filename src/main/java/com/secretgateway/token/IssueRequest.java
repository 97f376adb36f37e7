package com.secretgateway.token;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** A null {@code ttlSeconds} means the configured default. */
public record IssueRequest(
    Scope scope,
    @JsonProperty("ttl_seconds") Integer ttlSeconds,
    Map<String, Object> metadata
) {}
