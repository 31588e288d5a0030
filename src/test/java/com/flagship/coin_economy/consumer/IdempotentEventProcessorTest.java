package com.flagship.coin_economy.consumer;

import com.flagship.coin_economy.IntegrationTestSupport;
import com.flagship.coin_economy.ledger.OwnerKind;
import com.flagship.coin_economy.ledger.WalletService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.CannotAcquireLockException;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exactly-once handling per consumer group: duplicates are ignored,
 * permanent failures are recorded and rolled back, transient failures are
 * left for redelivery.
 */
@SpringBootTest
class IdempotentEventProcessorTest extends IntegrationTestSupport {

    private static final String CONSUMER_GROUP = "test-consumer";
    private static final String EVENT_TYPE = "TestEvent";
    private static final String AGGREGATE_TYPE = "TestAggregate";

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository repository;

    @Autowired
    private WalletService walletService;

    @Test
    @DisplayName("Duplicate event does not run the handler again")
    void testDuplicateEventSkipsHandler() {
        printTestHeader("Duplicate Event");

        UUID eventId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        boolean first = process(eventId, CONSUMER_GROUP, calls::incrementAndGet);
        boolean second = process(eventId, CONSUMER_GROUP, calls::incrementAndGet);
        boolean third = process(eventId, CONSUMER_GROUP, calls::incrementAndGet);

        assertTrue(first);
        assertFalse(second);
        assertFalse(third);
        assertEquals(1, calls.get());
        assertTrue(repository.existsByEventIdAndConsumerGroup(eventId, CONSUMER_GROUP));
        printSuccess("Handler ran once");
    }

    @Test
    @DisplayName("Each consumer group handles an event independently")
    void testDifferentConsumerGroups() {
        UUID eventId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        assertTrue(process(eventId, "refunds", calls::incrementAndGet));
        assertTrue(process(eventId, "audit", calls::incrementAndGet));
        assertFalse(process(eventId, "audit", calls::incrementAndGet));

        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("Permanent failure is recorded and the handler's writes are rolled back")
    void testPermanentFailureRollsBack() {
        printTestHeader("Permanent Failure");

        UUID eventId = UUID.randomUUID();
        String ownerId = uniqueOwner("rolled-back");

        boolean processed = process(eventId, CONSUMER_GROUP, () -> {
            walletService.createWallet(ownerId, OwnerKind.USER, null);
            throw new IllegalStateException("handler bug");
        });

        assertFalse(processed);
        assertTrue(walletService.findWallet(ownerId, OwnerKind.USER).isEmpty());
        List<ProcessedEventEntity> records = repository.findByEventIdOrderByProcessedAtAsc(eventId);
        assertEquals(1, records.size());
        assertEquals(ProcessingResult.FAILED, records.get(0).getProcessingResult());
        assertEquals("handler bug", records.get(0).getErrorMessage());

        AtomicInteger calls = new AtomicInteger();
        assertFalse(process(eventId, CONSUMER_GROUP, calls::incrementAndGet));
        assertEquals(0, calls.get());
        printSuccess("Failure recorded, redelivery ignored");
    }

    @Test
    @DisplayName("Transient failure is rethrown and nothing is recorded")
    void testTransientFailureIsRedelivered() {
        UUID eventId = UUID.randomUUID();

        assertThrows(CannotAcquireLockException.class, () -> process(eventId, CONSUMER_GROUP, () -> {
            throw new CannotAcquireLockException("lock timeout");
        }));
        assertFalse(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));

        AtomicInteger calls = new AtomicInteger();
        assertTrue(process(eventId, CONSUMER_GROUP, calls::incrementAndGet));
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Skipped event is not handled later")
    void testSkipEvent() {
        UUID eventId = UUID.randomUUID();
        eventProcessor.skipEvent(eventId, "Other", AGGREGATE_TYPE, eventId.toString(), CONSUMER_GROUP, "not relevant");

        AtomicInteger calls = new AtomicInteger();
        assertFalse(process(eventId, CONSUMER_GROUP, calls::incrementAndGet));
        assertEquals(0, calls.get());
        assertEquals(ProcessingResult.SKIPPED,
            repository.findByEventIdOrderByProcessedAtAsc(eventId).get(0).getProcessingResult());
    }

    @Test
    @DisplayName("Concurrent deliveries of one event commit once")
    void testConcurrentDeliveries() throws Exception {
        printTestHeader("Concurrent Deliveries");

        UUID eventId = UUID.randomUUID();
        int threads = 5;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return process(eventId, CONSUMER_GROUP, () -> sleep(100));
            }));
        }
        start.countDown();

        int committed = 0;
        for (Future<Boolean> future : futures) {
            if (future.get(30, TimeUnit.SECONDS)) {
                committed++;
            }
        }
        executor.shutdown();

        assertEquals(1, committed);
        assertEquals(1, repository.findByEventIdOrderByProcessedAtAsc(eventId).size());
        printSuccess("One delivery committed");
    }

    private boolean process(UUID eventId, String consumerGroup, Runnable handler) {
        return eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, eventId.toString(),
            consumerGroup, handler);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
