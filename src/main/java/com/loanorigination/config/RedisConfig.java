package com.loanorigination.config;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Redis for idempotency keys and the read caches.
 *
 * CACHE REGIONS:
 * ==============
 * - applications:    application header view, 30 minutes,
 *                    evicted on every transition and workflow switch
 * - quality-reports: latest quality report per application, 1 hour,
 *                    evicted when a new report is recorded
 *
 * The cache manager is transaction-aware: evictions inside a
 * {@code @Transactional} method take effect only after commit, so a reader
 * can never repopulate the cache with a state that is about to roll back.
 */
@Configuration
@EnableCaching
@Slf4j
public class RedisConfig {

    public static final String APPLICATIONS_CACHE = "applications";
    public static final String QUALITY_REPORTS_CACHE = "quality-reports";

    /**
     * Application-wide ObjectMapper: Java time support, ISO-8601 dates.
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // Derived accessors such as isCritical() are written but are not record components
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        log.info("Configured ObjectMapper with JavaTimeModule");
        return mapper;
    }

    @Bean
    public RedisTemplate<String, Object> redisTemplate(
            RedisConnectionFactory connectionFactory,
            ObjectMapper objectMapper) {

        RedisTemplate<String, Object> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        StringRedisSerializer stringSerializer = new StringRedisSerializer();
        template.setKeySerializer(stringSerializer);
        template.setHashKeySerializer(stringSerializer);

        GenericJackson2JsonRedisSerializer jsonSerializer = typedJsonSerializer(objectMapper);
        template.setValueSerializer(jsonSerializer);
        template.setHashValueSerializer(jsonSerializer);

        template.afterPropertiesSet();

        log.info("Configured RedisTemplate with JSON serialization");
        return template;
    }

    @Bean
    public CacheManager cacheManager(
            RedisConnectionFactory connectionFactory,
            ObjectMapper objectMapper) {

        RedisCacheConfiguration defaultConfig = RedisCacheConfiguration.defaultCacheConfig()
            .entryTtl(Duration.ofMinutes(30))
            .disableCachingNullValues()
            .serializeKeysWith(
                RedisSerializationContext.SerializationPair.fromSerializer(
                    new StringRedisSerializer()))
            .serializeValuesWith(
                RedisSerializationContext.SerializationPair.fromSerializer(
                    typedJsonSerializer(objectMapper)));

        Map<String, RedisCacheConfiguration> cacheConfigurations = new HashMap<>();
        cacheConfigurations.put(APPLICATIONS_CACHE, defaultConfig
            .entryTtl(Duration.ofMinutes(30))
            .prefixCacheNameWith("los:"));
        cacheConfigurations.put(QUALITY_REPORTS_CACHE, defaultConfig
            .entryTtl(Duration.ofHours(1))
            .prefixCacheNameWith("los:"));

        RedisCacheManager cacheManager = RedisCacheManager.builder(connectionFactory)
            .cacheDefaults(defaultConfig)
            .withInitialCacheConfigurations(cacheConfigurations)
            .transactionAware()
            .build();

        log.info("Configured RedisCacheManager with regions: {} (30m), {} (1h)",
                APPLICATIONS_CACHE, QUALITY_REPORTS_CACHE);
        return cacheManager;
    }

    // Cached values are records; type ids are embedded so they come back as records, not maps.
    private static GenericJackson2JsonRedisSerializer typedJsonSerializer(ObjectMapper objectMapper) {
        ObjectMapper typed = objectMapper.copy();
        typed.activateDefaultTyping(typed.getPolymorphicTypeValidator(),
                ObjectMapper.DefaultTyping.EVERYTHING, JsonTypeInfo.As.PROPERTY);
        return new GenericJackson2JsonRedisSerializer(typed);
    }
}
