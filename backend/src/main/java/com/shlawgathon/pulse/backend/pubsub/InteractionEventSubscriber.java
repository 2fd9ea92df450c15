package com.shlawgathon.pulse.backend.pubsub;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.pulse.backend.service.IncrementalUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Receives interaction insert notifications from Redis and hands the records
 * to the incremental updater's channel. Processing happens on the updater's
 * consumer thread, not on the listener thread.
 */
@Component
public class InteractionEventSubscriber implements MessageListener {

    private static final Logger log = LoggerFactory.getLogger(InteractionEventSubscriber.class);

    private final ObjectMapper objectMapper;
    private final IncrementalUpdater incrementalUpdater;

    public InteractionEventSubscriber(ObjectMapper objectMapper, IncrementalUpdater incrementalUpdater) {
        this.objectMapper = objectMapper;
        this.incrementalUpdater = incrementalUpdater;
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        handleMessage(new String(message.getBody(), StandardCharsets.UTF_8));
    }

    /**
     * Decode one notification body and queue its record.
     */
    void handleMessage(String message) {
        try {
            var eventMessage = objectMapper.readValue(message,
                    InteractionEventPublisher.InteractionEventMessage.class);

            if (!InteractionEventPublisher.RECORD_INSERTED.equals(eventMessage.eventType())
                    || eventMessage.record() == null) {
                log.debug("[PUB/SUB] Ignoring event: {}", eventMessage.eventType());
                return;
            }

            log.debug("[PUB/SUB] Received record: {} for user: {}",
                    eventMessage.record().getId(), eventMessage.record().getUserId());

            if (!incrementalUpdater.offer(eventMessage.record())) {
                log.warn("[PUB/SUB] Update channel full, dropped record: {}", eventMessage.record().getId());
            }
        } catch (Exception e) {
            log.error("[PUB/SUB] Failed to process message: {}", message, e);
        }
    }
}
