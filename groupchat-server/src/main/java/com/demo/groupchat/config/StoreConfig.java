package com.demo.groupchat.config;

import com.demo.groupchat.store.DocumentStore;
import com.demo.groupchat.store.InMemoryDocumentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default document store. {@code chat.store.type=redis} switches to {@link RedisConfig}.
 */
@Configuration
@Slf4j
@ConditionalOnProperty(name = "chat.store.type", havingValue = "memory", matchIfMissing = true)
public class StoreConfig {

    @Bean
    public DocumentStore inMemoryDocumentStore(ObjectMapper objectMapper) {
        log.info("Using in-memory document store");
        return new InMemoryDocumentStore(objectMapper);
    }
}
