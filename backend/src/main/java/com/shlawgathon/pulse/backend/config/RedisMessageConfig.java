package com.shlawgathon.pulse.backend.config;

import com.shlawgathon.pulse.backend.pubsub.InteractionEventSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Subscribes this pod to interaction insert notifications so pushed records
 * reach the incremental updater no matter which pod stored them.
 */
@Configuration
public class RedisMessageConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisMessageConfig.class);

    public static final String INTERACTION_EVENTS_CHANNEL = "pulse:interaction-records";

    @Bean
    public ChannelTopic interactionEventsTopic() {
        return new ChannelTopic(INTERACTION_EVENTS_CHANNEL);
    }

    @Bean
    public RedisMessageListenerContainer interactionEventsListenerContainer(
            RedisConnectionFactory connectionFactory,
            InteractionEventSubscriber subscriber,
            ChannelTopic interactionEventsTopic) {

        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(subscriber, interactionEventsTopic);
        container.setErrorHandler(e -> log.error("[PUB/SUB] Listener failure on {}", INTERACTION_EVENTS_CHANNEL, e));
        return container;
    }
}
