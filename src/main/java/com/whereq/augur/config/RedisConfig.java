package com.whereq.augur.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the job store and queue.
 *
 * Job records are hashes of plain strings (the job document itself is JSON written by the store),
 * so keys, values and hash entries all use the string serializer.
 *
 * @author WhereQ Inc.
 */
@Configuration
public class RedisConfig {

    /**
     * Primary so it wins over Boot's {@code reactiveStringRedisTemplate}, which has the same generic type
     */
    @Bean
    @Primary
    public ReactiveRedisTemplate<String, String> jobRedisTemplate(ReactiveRedisConnectionFactory connectionFactory) {
        StringRedisSerializer serializer = new StringRedisSerializer();

        RedisSerializationContext<String, String> serializationContext = RedisSerializationContext
            .<String, String>newSerializationContext(serializer)
            .hashKey(serializer)
            .hashValue(serializer)
            .build();

        return new ReactiveRedisTemplate<>(connectionFactory, serializationContext);
    }
}
