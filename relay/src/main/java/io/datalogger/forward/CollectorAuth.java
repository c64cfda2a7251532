package io.datalogger.forward;

import java.util.Optional;

/**
 * Supplies the bearer token sent with collector requests.
 */
public interface CollectorAuth {
    /** Current token, obtaining one if needed; empty when the collector is unauthenticated. */
    Optional<String> bearerToken() throws ForwardException;

    /** Discards the current token after the collector answered 401. */
    default void invalidate() {}

    /** Whether {@link #invalidate()} followed by {@link #bearerToken()} can yield a different token. */
    default boolean refreshable() { return false; }

    static CollectorAuth none() { return Optional::empty; }

    static CollectorAuth staticToken(String token) {
        Optional<String> t = Optional.of(token);
        return () -> t;
    }
}
