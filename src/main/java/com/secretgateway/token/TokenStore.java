package com.secretgateway.token;

import java.util.Optional;

/**
 * Active tokens keyed by id. An expired token is never returned: reads evict it.
 * Absent covers never issued, revoked and expired alike.
 */
public interface TokenStore {

    void put(Token token);

    /** Stores the token unless its id is already taken. Returns true if stored. */
    boolean putIfAbsent(Token token);

    Optional<Token> get(String tokenId);

    boolean remove(String tokenId);

    default boolean contains(String tokenId) {
        return get(tokenId).isPresent();
    }

    /** Removes every expired entry and returns how many were removed. */
    int sweep();

    /** Active entries only; sweeps first. */
    int count();

    /** Raw entry count, stale entries included. */
    int countAll();

    void clear();

    void shutdown();
}
