package com.secretgateway.token;

import com.secretgateway.crypto.InvalidParameterException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** What a token authorizes: a resource and the ordered actions permitted on it. */
public record Scope(
    String resource,
    List<String> actions,
    Map<String, Object> metadata
) {
    public Scope {
        if (resource == null || resource.isBlank()) {
            throw new InvalidParameterException("Scope resource must not be empty");
        }
        actions = actions == null ? List.of() : List.copyOf(actions);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Scope of(String resource, String... actions) {
        return new Scope(resource, List.of(actions), Map.of());
    }
}
