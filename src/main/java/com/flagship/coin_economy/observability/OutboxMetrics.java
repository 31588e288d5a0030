package com.flagship.coin_economy.observability;

import com.flagship.coin_economy.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox gauges, cached and refreshed by {@link MetricsScheduler} so a scrape
 * never hits the database.
 *
 * The backlog is split by aggregate: a stuck {@code Notification} backlog
 * means users are not told about expired coins, a stuck
 * {@code LedgerTransaction} backlog means downstream ledgers fall behind.
 */
@Component
@Slf4j
public class OutboxMetrics {

    static final List<String> AGGREGATES = List.of("LedgerTransaction", "Notification");

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int maxRetries;

    private final Map<String, AtomicLong> backlogByAggregate = new HashMap<>();
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetterCount = new AtomicLong(0);

    public OutboxMetrics(OutboxEventRepository outboxRepository,
                         MeterRegistry meterRegistry,
                         Clock clock,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.maxRetries = maxRetries;

        for (String aggregate : AGGREGATES) {
            AtomicLong backlog = new AtomicLong(0);
            backlogByAggregate.put(aggregate, backlog);
            Gauge.builder("outbox.backlog.size", backlog, AtomicLong::get)
                    .description("Unpublished outbox events")
                    .tag("aggregate", aggregate)
                    .register(meterRegistry);
        }

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished event")
                .register(meterRegistry);

        Gauge.builder("outbox.dead_letters", deadLetterCount, AtomicLong::get)
                .description("Events left unpublished after the last allowed retry")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            Map<String, Long> counts = new HashMap<>();
            for (Object[] row : outboxRepository.countUnpublishedByAggregateType()) {
                counts.put((String) row[0], ((Number) row[1]).longValue());
            }
            backlogByAggregate.forEach((aggregate, gauge) -> gauge.set(counts.getOrDefault(aggregate, 0L)));

            Instant now = Instant.now(clock);
            oldestEventAgeSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, now).getSeconds()))
                    .orElse(0L));

            deadLetterCount.set(outboxRepository.countDeadLetters(maxRetries));

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, deadLetters={}",
                    counts, oldestEventAgeSeconds.get(), deadLetterCount.get());

        } catch (DataAccessException e) {
            log.warn("Could not refresh outbox metrics: {}", e.getMessage());
        }
    }

    long getBacklog(String aggregate) {
        AtomicLong backlog = backlogByAggregate.get(aggregate);
        return backlog != null ? backlog.get() : 0;
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "failure").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered", "event_type", eventType).increment();
    }
}
