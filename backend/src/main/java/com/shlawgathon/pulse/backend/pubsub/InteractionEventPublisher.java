package com.shlawgathon.pulse.backend.pubsub;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.pulse.backend.config.RedisMessageConfig;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes newly stored interaction records so that every backend pod can
 * fold them into its in-memory team state. Delivery is best effort.
 */
@Component
public class InteractionEventPublisher {

    public static final String RECORD_INSERTED = "RECORD_INSERTED";

    private static final Logger log = LoggerFactory.getLogger(InteractionEventPublisher.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public InteractionEventPublisher(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Publish an insert notification. Failures are logged, never thrown: the
     * periodic refresh picks the record up anyway.
     */
    public void publishInserted(InteractionRecord record) {
        try {
            InteractionEventMessage message = new InteractionEventMessage(RECORD_INSERTED, record);
            String json = objectMapper.writeValueAsString(message);

            redisTemplate.convertAndSend(RedisMessageConfig.INTERACTION_EVENTS_CHANNEL, json);
            log.debug("[PUB/SUB] Published {} for user: {} record: {}",
                    RECORD_INSERTED, record.getUserId(), record.getId());
        } catch (Exception e) {
            log.error("[PUB/SUB] Failed to publish record: {}", record.getId(), e);
        }
    }

    /**
     * Message wrapper for Redis Pub/Sub.
     */
    public record InteractionEventMessage(String eventType, InteractionRecord record) {
    }
}
