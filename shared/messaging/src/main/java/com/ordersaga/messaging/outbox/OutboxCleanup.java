package com.ordersaga.messaging.outbox;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Housekeeping for the outbox table. Only rows the relay already published are purged; the
 * unpublished backlog is exported as {@code outbox_pending_events}.
 */
@Component
public class OutboxCleanup {

    private static final Logger log = LoggerFactory.getLogger(OutboxCleanup.class);

    private final OutboxRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Duration retention;
    private final AtomicLong pending = new AtomicLong();

    public OutboxCleanup(OutboxRepository outboxRepository,
                         MeterRegistry meterRegistry,
                         @Value("${outbox.cleanup.retention-days:7}") int retentionDays) {
        if (retentionDays < 1) {
            throw new IllegalArgumentException("outbox.cleanup.retention-days must be at least 1, got " + retentionDays);
        }
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.retention = Duration.ofDays(retentionDays);
        meterRegistry.gauge("outbox_pending_events", pending);
    }

    @Scheduled(fixedDelayString = "${outbox.cleanup.interval-ms:3600000}",
            initialDelayString = "${outbox.cleanup.initial-delay-ms:60000}")
    @Transactional
    public void scheduledCleanup() {
        purge(Instant.now());
    }

    /**
     * Deletes published rows created before {@code now - retention}. Returns the number of rows removed.
     */
    @Transactional
    public int purge(Instant now) {
        Instant cutoff = now.minus(retention);
        int deleted = outboxRepository.deleteByPublishedTrueAndCreatedAtBefore(cutoff);
        long backlog = outboxRepository.countByPublishedFalse();
        pending.set(backlog);
        if (deleted > 0) {
            meterRegistry.counter("outbox_purged_total").increment(deleted);
            log.info("Purged {} published outbox events created before {}", deleted, cutoff);
        }
        if (backlog > 0) {
            log.debug("{} outbox events still waiting for the relay", backlog);
        }
        return deleted;
    }
}
