package com.flagship.coin_economy.outbox;

import com.flagship.coin_economy.IntegrationTestSupport;
import com.flagship.coin_economy.ledger.Counterparty;
import com.flagship.coin_economy.ledger.LedgerService;
import com.flagship.coin_economy.ledger.LedgerTransactionCommittedEvent;
import com.flagship.coin_economy.ledger.OwnerKind;
import com.flagship.coin_economy.ledger.TransactionRequest;
import com.flagship.coin_economy.ledger.TransactionResult;
import com.flagship.coin_economy.ledger.TransactionType;
import com.flagship.coin_economy.ledger.WalletService;
import com.flagship.coin_economy.observability.CorrelationContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox events are written atomically with the change they describe.
 */
@SpringBootTest
class OutboxServiceTest extends IntegrationTestSupport {

    private static final String TEST_AGGREGATE = "TestAggregate";

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository repository;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private WalletService walletService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Test
    @DisplayName("Committed ledger transaction writes exactly one event")
    void testLedgerCommitWritesEvent() {
        printTestHeader("Ledger Commit Event");

        UUID walletId = walletService.createWallet(uniqueOwner("outbox"), OwnerKind.USER, null).getId();
        String key = "outbox-purchase-" + UUID.randomUUID();

        TransactionResult result = ledgerService.commit(TransactionRequest.builder()
            .type(TransactionType.PURCHASE)
            .idempotencyKey(key)
            .entry(TransactionRequest.EntryLine.credit(walletId, 30, "Coin purchase"))
            .counterparty(Counterparty.VOID)
            .build());
        ledgerService.commit(TransactionRequest.builder()
            .type(TransactionType.PURCHASE)
            .idempotencyKey(key)
            .entry(TransactionRequest.EntryLine.credit(walletId, 30, "Coin purchase"))
            .counterparty(Counterparty.VOID)
            .build());

        List<OutboxEvent> events = outboxService.getEventsForAggregate(
            OutboxPublisher.LEDGER_AGGREGATE, result.getTransactionId());
        printOutput("Events", events);

        assertEquals(1, events.size(), "replay must not write a second event");
        OutboxEvent event = events.get(0);
        assertEquals(LedgerTransactionCommittedEvent.EVENT_TYPE, event.getEventType());
        assertTrue(event.getPayload().contains(key));
        assertFalse(event.isPublished());
        assertEquals(0, event.getRetryCount());
        printSuccess("One event per committed transaction");
    }

    @Test
    @DisplayName("Saving an event outside a transaction is rejected")
    void testSaveRequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class,
            () -> outboxService.saveEvent(TEST_AGGREGATE, UUID.randomUUID(), "TestEvent", Map.of("a", 1)));
    }

    @Test
    @DisplayName("Rolled back transaction leaves no event")
    void testRollbackDiscardsEvent() {
        UUID aggregateId = UUID.randomUUID();
        TransactionTemplate template = new TransactionTemplate(transactionManager);

        template.executeWithoutResult(status -> {
            outboxService.saveEvent(TEST_AGGREGATE, aggregateId, "TestEvent", Map.of("value", 42));
            status.setRollbackOnly();
        });

        assertTrue(outboxService.getEventsForAggregate(TEST_AGGREGATE, aggregateId).isEmpty());
    }

    @Test
    @DisplayName("Event remembers the correlation id open when it was written")
    void testCorrelationIdCaptured() {
        UUID aggregateId = UUID.randomUUID();

        try (CorrelationContext.Scope ignored = CorrelationContext.begin("req-outbox-1")) {
            new TransactionTemplate(transactionManager).executeWithoutResult(status ->
                outboxService.saveEvent(TEST_AGGREGATE, aggregateId, "TestEvent", Map.of("value", 7)));
        }

        OutboxEvent event = outboxService.getEventsForAggregate(TEST_AGGREGATE, aggregateId).get(0);
        assertEquals("req-outbox-1", event.getCorrelationId());
        assertNotNull(event.getSequenceNumber());
    }

    @Test
    @DisplayName("Failures count retries until the event becomes a dead letter")
    void testRetryBookkeeping() {
        printTestHeader("Retry Bookkeeping");

        UUID aggregateId = UUID.randomUUID();
        OutboxEvent saved = new TransactionTemplate(transactionManager).execute(status ->
            outboxService.saveEvent(TEST_AGGREGATE, aggregateId, "TestEvent", Map.of("value", 1)));
        long deadLettersBefore = repository.countDeadLetters(2);

        outboxService.markFailed(saved.getId(), "broker down");
        outboxService.markFailed(saved.getId(), "broker still down");

        OutboxEvent failed = outboxService.getEventsForAggregate(TEST_AGGREGATE, aggregateId).get(0);
        assertEquals(2, failed.getRetryCount());
        assertEquals("broker still down", failed.getLastError());
        assertEquals(deadLettersBefore + 1, repository.countDeadLetters(2));

        outboxService.markPublished(saved.getId());

        OutboxEvent published = outboxService.getEventsForAggregate(TEST_AGGREGATE, aggregateId).get(0);
        assertTrue(published.isPublished());
        assertNull(published.getLastError());
        assertEquals(deadLettersBefore, repository.countDeadLetters(2));
        printSuccess("Retry count and dead letters tracked");
    }
}
