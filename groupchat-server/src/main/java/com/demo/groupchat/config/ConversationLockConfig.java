package com.demo.groupchat.config;

import com.demo.groupchat.infrastructure.ConversationLock;
import com.demo.groupchat.infrastructure.RedissonConversationLock;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.redisson.config.Config;

import java.time.Duration;

/**
 * Serializes conversation creation per participant set.
 *
 * Off by default: without the lock two concurrent initiations for the same set
 * may both create a conversation.
 */
@Configuration
public class ConversationLockConfig {

    @Bean
    @ConditionalOnProperty(name = "chat.conversation.dedupe-lock.enabled", havingValue = "false", matchIfMissing = true)
    public ConversationLock noopConversationLock() {
        return ConversationLock.NONE;
    }

    @Configuration
    @ConditionalOnProperty(name = "chat.conversation.dedupe-lock.enabled", havingValue = "true")
    static class RedissonLockConfig {

        @Value("${spring.data.redis.host:localhost}")
        private String redisHost;

        @Value("${spring.data.redis.port:6379}")
        private int redisPort;

        /**
         * Redisson client for the conversation dedupe lock
         */
        @Bean(destroyMethod = "shutdown")
        public RedissonClient redissonClient() {
            Config config = new Config();
            config.useSingleServer()
                    .setAddress("redis://" + redisHost + ":" + redisPort)
                    .setConnectionPoolSize(16)
                    .setConnectionMinimumIdleSize(2)
                    .setConnectTimeout(10000)
                    .setTimeout(3000)
                    .setRetryAttempts(3)
                    .setRetryInterval(1500);
            return Redisson.create(config);
        }

        @Bean
        public ConversationLock redissonConversationLock(
                RedissonClient redissonClient,
                @Value("${chat.conversation.dedupe-lock.wait:5s}") Duration waitTime,
                @Value("${chat.conversation.dedupe-lock.lease:30s}") Duration leaseTime) {
            return new RedissonConversationLock(redissonClient, waitTime, leaseTime);
        }
    }
}
