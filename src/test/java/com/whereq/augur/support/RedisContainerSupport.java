package com.whereq.augur.support;

import com.whereq.augur.config.RedisConfig;
import org.springframework.data.redis.connection.ReactiveRedisConnection;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Throwaway Redis for tests that need the real scripts to run
 */
public final class RedisContainerSupport {

    private static final DockerImageName REDIS_IMAGE = DockerImageName.parse("redis:7.2-alpine");
    private static final int REDIS_PORT = 6379;

    private RedisContainerSupport() {
    }

    public static GenericContainer<?> redisContainer() {
        return new GenericContainer<>(REDIS_IMAGE).withExposedPorts(REDIS_PORT);
    }

    public static LettuceConnectionFactory connectionFactory(GenericContainer<?> redis) {
        LettuceConnectionFactory factory = new LettuceConnectionFactory(
            new RedisStandaloneConfiguration(redis.getHost(), redis.getMappedPort(REDIS_PORT)));
        factory.afterPropertiesSet();
        factory.start();
        return factory;
    }

    public static ReactiveRedisTemplate<String, String> template(LettuceConnectionFactory factory) {
        return new RedisConfig().jobRedisTemplate(factory);
    }

    public static void flush(LettuceConnectionFactory factory) {
        ReactiveRedisConnection connection = factory.getReactiveConnection();
        connection.serverCommands().flushAll().block();
    }
}
