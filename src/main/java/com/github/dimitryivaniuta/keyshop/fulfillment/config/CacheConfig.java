package com.github.dimitryivaniuta.keyshop.fulfillment.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Cache configuration.
 *
 * <p>Redis only caches terminal ledger statuses; Postgres is the source of truth. With
 * {@code app.cache.redis-enabled=false} Spring Boot falls back to whatever {@code spring.cache.type} says.</p>
 */
@EnableCaching
@Configuration
@ConditionalOnProperty(prefix = "app.cache", name = "redis-enabled", havingValue = "true", matchIfMissing = true)
public class CacheConfig {

    /**
     * Cache name for paid ledger statuses.
     */
    public static final String LEDGER_STATUS_CACHE = "ledgerStatus";

    /**
     * Cache manager using Redis with plain string values.
     *
     * @param factory    redis connection factory
     * @param properties application properties
     * @return cache manager
     */
    @Bean
    public RedisCacheManager cacheManager(RedisConnectionFactory factory, AppProperties properties) {
        var strings = RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer());

        var defaultCfg = RedisCacheConfiguration.defaultCacheConfig()
                .serializeKeysWith(strings);

        var statusCfg = defaultCfg
                .entryTtl(properties.getCache().getStatusTtl())
                .serializeValuesWith(strings);

        return RedisCacheManager.builder(factory)
                .cacheDefaults(defaultCfg)
                .withCacheConfiguration(LEDGER_STATUS_CACHE, statusCfg)
                .build();
    }
}
