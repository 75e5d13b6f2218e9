package com.techStack.sessionGuard.config.integration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Redis Configuration
 *
 * Configures the pooled Lettuce connection, the JSON mapper used for stored
 * records and the reactive string template shared by the ledger, the rate
 * limiter and the session stores.
 */
@Configuration
@Slf4j
public class RedisConfig {

    /* =========================
       Redis Connection Settings
       ========================= */

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Value("${spring.data.redis.password:}")
    private String redisPassword;

    @Value("${spring.data.redis.database:0}")
    private int database;

    /* =========================
       Pool Configuration
       ========================= */

    @Value("${spring.data.redis.lettuce.pool.max-active:16}")
    private int maxTotal;

    @Value("${spring.data.redis.lettuce.pool.max-idle:8}")
    private int maxIdle;

    @Value("${spring.data.redis.lettuce.pool.min-idle:2}")
    private int minIdle;

    /* =========================
       Timeout Configuration
       ========================= */

    @Value("${spring.data.redis.timeout:2000ms}")
    private Duration commandTimeout;

    /* =========================
       Connection Pool
       ========================= */

    @Bean
    public GenericObjectPoolConfig<?> lettucePoolConfig(Clock clock) {
        GenericObjectPoolConfig<?> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(maxTotal);
        poolConfig.setMaxIdle(maxIdle);
        poolConfig.setMinIdle(minIdle);
        poolConfig.setTestOnBorrow(true);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setBlockWhenExhausted(true);

        log.info("Redis pool configured at {} - maxTotal: {}, maxIdle: {}, minIdle: {}",
                clock.instant(), maxTotal, maxIdle, minIdle);

        return poolConfig;
    }

    /* =========================
       Connection Factory
       ========================= */

    @Bean
    @Primary
    public LettuceConnectionFactory lettuceConnectionFactory(
            GenericObjectPoolConfig<?> lettucePoolConfig,
            Clock clock
    ) {
        Instant startTime = clock.instant();

        RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration(redisHost, redisPort);
        redisConfig.setDatabase(database);
        if (!redisPassword.isEmpty()) {
            redisConfig.setPassword(redisPassword);
        }

        LettuceClientConfiguration clientConfig = LettucePoolingClientConfiguration.builder()
                .commandTimeout(commandTimeout)
                .shutdownTimeout(Duration.ZERO)
                .poolConfig(lettucePoolConfig)
                .build();

        LettuceConnectionFactory factory = new LettuceConnectionFactory(redisConfig, clientConfig);
        factory.setValidateConnection(true);

        log.info("Redis connection factory for {}:{} created in {} (command timeout {})",
                redisHost, redisPort, Duration.between(startTime, clock.instant()), commandTimeout);

        return factory;
    }

    /* =========================
       Object Mapper
       ========================= */

    /**
     * Mapper for stored records and HTTP bodies: ISO-8601 instants, lenient on unknown fields.
     */
    @Bean
    @Primary
    public ObjectMapper redisObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    /* =========================
       Reactive Templates
       ========================= */

    @Bean
    public ReactiveRedisTemplate<String, String> reactiveStringRedisTemplate(
            LettuceConnectionFactory lettuceConnectionFactory
    ) {
        RedisSerializationContext<String, String> context = RedisSerializationContext
                .<String, String>newSerializationContext(new StringRedisSerializer())
                .value(new StringRedisSerializer())
                .hashKey(new StringRedisSerializer())
                .hashValue(new StringRedisSerializer())
                .build();

        return new ReactiveRedisTemplate<>(lettuceConnectionFactory, context);
    }
}
