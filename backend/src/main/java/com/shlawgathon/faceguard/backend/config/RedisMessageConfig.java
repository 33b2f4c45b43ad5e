package com.shlawgathon.faceguard.backend.config;

import com.shlawgathon.faceguard.backend.pubsub.RealtimeEventSubscriber;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.adapter.MessageListenerAdapter;

/**
 * Redis Pub/Sub configuration for cross-replica realtime fan-out.
 */
@Configuration
@ConditionalOnProperty(name = "faceguard.realtime.relay.enabled", havingValue = "true", matchIfMissing = true)
public class RedisMessageConfig {

    public static final String REALTIME_EVENTS_CHANNEL = "faceguard:realtime-events";

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(
            RedisConnectionFactory connectionFactory,
            MessageListenerAdapter messageListenerAdapter) {

        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(messageListenerAdapter, new ChannelTopic(REALTIME_EVENTS_CHANNEL));
        return container;
    }

    @Bean
    public MessageListenerAdapter messageListenerAdapter(RealtimeEventSubscriber subscriber) {
        return new MessageListenerAdapter(subscriber, "handleMessage");
    }
}
