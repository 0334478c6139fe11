package com.demo.groupchat.config;

import com.demo.groupchat.store.DocumentStore;
import com.demo.groupchat.store.RedisDocumentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed document store, enabled with {@code chat.store.type=redis}.
 */
@Configuration
@Slf4j
@ConditionalOnProperty(name = "chat.store.type", havingValue = "redis")
public class RedisConfig {

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    @Bean
    public DocumentStore redisDocumentStore(StringRedisTemplate stringRedisTemplate, ObjectMapper objectMapper) {
        log.info("Using Redis document store");
        return new RedisDocumentStore(stringRedisTemplate, objectMapper);
    }
}
