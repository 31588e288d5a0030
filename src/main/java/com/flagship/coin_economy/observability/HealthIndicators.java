package com.flagship.coin_economy.observability;

import com.flagship.coin_economy.outbox.OutboxEventRepository;
import com.flagship.coin_economy.treasury.TreasuryService;
import com.flagship.coin_economy.treasury.TreasuryState;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness checks for the coin economy.
 */
public class HealthIndicators {

    /**
     * Unhealthy when too many ledger events and notices wait to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Warns when the treasury can no longer cover a full day of bot spend.
     * An empty treasury only stops bots, so it never reports DOWN.
     */
    @Component("treasuryHealth")
    public static class TreasuryHealthIndicator implements HealthIndicator {

        private final TreasuryService treasuryService;

        public TreasuryHealthIndicator(TreasuryService treasuryService) {
            this.treasuryService = treasuryService;
        }

        @Override
        public Health health() {
            try {
                TreasuryState state = treasuryService.getState();
                Health.Builder builder = state.getTreasuryBalance() >= state.getDailySpendCap()
                        ? Health.up()
                        : Health.status("WARNING");
                return builder
                        .withDetail("balance", state.getTreasuryBalance())
                        .withDetail("dailySpendCap", state.getDailySpendCap())
                        .withDetail("todaySpent", state.getEffectiveTodaySpent())
                        .withDetail("lastResetDate", state.getLastResetDate().toString())
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Redis only backs the idempotency fast path, so losing it degrades the
     * service without taking it down.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final ObjectProvider<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null || template.getConnectionFactory() == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "Redis not configured")
                        .withDetail("note", "Idempotency lookups fall back to the database")
                        .build();
            }
            try {
                String result = template.getConnectionFactory().getConnection().ping();
                if ("PONG".equals(result)) {
                    return Health.up()
                            .withDetail("response", result)
                            .build();
                }
                return Health.down()
                        .withDetail("response", result != null ? result : "null")
                        .build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", "Idempotency lookups fall back to the database")
                        .build();
            }
        }
    }
}
