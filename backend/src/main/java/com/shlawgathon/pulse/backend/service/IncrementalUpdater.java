package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Bounded channel between the Redis listener and the team board.
 * A single consumer thread drains it, so updates are applied in arrival order.
 */
@Service
public class IncrementalUpdater implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(IncrementalUpdater.class);

    private static final long STOP_TIMEOUT_MILLIS = 5000;

    private final TeamStatusService teamStatusService;
    private final BlockingQueue<InteractionRecord> channel;

    private volatile boolean running;
    private Thread consumer;

    public IncrementalUpdater(TeamStatusService teamStatusService, PulseProperties properties) {
        this.teamStatusService = teamStatusService;
        this.channel = new LinkedBlockingQueue<>(properties.getUpdates().getQueueCapacity());
    }

    /**
     * Enqueue a record without blocking.
     *
     * @return false when the channel is full
     */
    public boolean offer(InteractionRecord record) {
        return channel.offer(record);
    }

    public int pending() {
        return channel.size();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        consumer = new Thread(this::drain, "pulse-incremental-updater");
        consumer.setDaemon(true);
        consumer.start();
        log.info("[UPDATER] Started");
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        consumer.interrupt();
        try {
            consumer.join(STOP_TIMEOUT_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[UPDATER] Stopped | pending: {}", channel.size());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void drain() {
        while (running) {
            InteractionRecord record;
            try {
                record = channel.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            try {
                teamStatusService.applyRecord(record);
            } catch (RuntimeException e) {
                log.error("[UPDATER] Failed to apply record: {} for user: {}",
                        record.getId(), record.getUserId(), e);
            }
        }
    }
}
