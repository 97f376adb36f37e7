package com.secretgateway.gateway.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ValidateRequest(@JsonProperty("token_id") String tokenId) {}
