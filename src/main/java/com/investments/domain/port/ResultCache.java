package com.investments.domain.port;

import io.smallrye.mutiny.Uni;

import java.time.Duration;
import java.util.Optional;

/**
 * Keyed store of serialized computation results with a time-to-live
 */
public interface ResultCache {

    /**
     * Emits an empty optional on a miss. Backend read failures are reported as a miss.
     */
    Uni<Optional<String>> get(String key);

    Uni<Void> put(String key, String value, Duration ttl);

    /**
     * Completes once the backend acknowledged the deletion, fails otherwise
     */
    Uni<Void> invalidate(String... keys);
}
