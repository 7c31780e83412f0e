package com.investments.infrastructure.cache;

import com.investments.domain.exception.Errors;
import com.investments.domain.exception.ServiceException;
import com.investments.domain.port.ResultCache;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

/**
 * Redis implementation of ResultCache. Entries expire through SETEX; reads and writes degrade
 * gracefully while invalidations must reach Redis.
 */
@Slf4j
@ApplicationScoped
public class RedisResultCache implements ResultCache {

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;

    public RedisResultCache(ReactiveRedisDataSource redisDataSource) {
        this.valueCommands = redisDataSource.value(String.class);
        this.keyCommands = redisDataSource.key();
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return valueCommands.get(key)
                .map(Optional::ofNullable)
                .onFailure().recoverWithItem(throwable -> {
                    log.warn("Failed to read cache entry {}, treating as miss: {}", key, throwable.getMessage());
                    return Optional.empty();
                });
    }

    @Override
    public Uni<Void> put(String key, String value, Duration ttl) {
        return valueCommands.setex(key, ttl.toSeconds(), value)
                .invoke(() -> log.debug("Cached {} for {}", key, ttl))
                .onFailure().recoverWithItem(throwable -> {
                    log.error("Failed to write cache entry {}", key, throwable);
                    return null;
                });
    }

    @Override
    public Uni<Void> invalidate(String... keys) {
        if (keys == null || keys.length == 0) {
            return Uni.createFrom().voidItem();
        }

        return keyCommands.del(keys)
                .invoke(deleted -> log.debug("Invalidated {} of {} cache entries {}", deleted, keys.length, Arrays.toString(keys)))
                .onFailure().transform(throwable -> {
                    log.error("Failed to invalidate cache entries {}", Arrays.toString(keys), throwable);
                    return new ServiceException(Errors.Cache.INVALIDATION_FAILED,
                            "Failed to invalidate cache entries " + Arrays.toString(keys), throwable);
                })
                .replaceWithVoid();
    }
}
