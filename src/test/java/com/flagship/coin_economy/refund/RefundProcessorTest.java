package com.flagship.coin_economy.refund;

import com.flagship.coin_economy.IntegrationTestSupport;
import com.flagship.coin_economy.bot.ActionTarget;
import com.flagship.coin_economy.bot.BotActionRecorder;
import com.flagship.coin_economy.bot.BotActionType;
import com.flagship.coin_economy.bot.TargetType;
import com.flagship.coin_economy.jobs.JobRunSummary;
import com.flagship.coin_economy.ledger.LedgerService;
import com.flagship.coin_economy.ledger.OwnerKind;
import com.flagship.coin_economy.ledger.TransactionRequest;
import com.flagship.coin_economy.ledger.TransactionType;
import com.flagship.coin_economy.ledger.Wallet;
import com.flagship.coin_economy.ledger.WalletService;
import com.flagship.coin_economy.treasury.TreasuryService;
import com.flagship.coin_economy.treasury.TreasuryState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Refund runs against a real schema: coins return to the treasury exactly
 * once, and failures are parked without touching the ledger.
 */
@SpringBootTest
class RefundProcessorTest extends IntegrationTestSupport {

    @Autowired
    private RefundProcessor refundProcessor;

    @Autowired
    private BotActionRecorder recorder;

    @Autowired
    private BotRefundRepository refundRepository;

    @Autowired
    private TreasuryService treasuryService;

    @Autowired
    private WalletService walletService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private String botId;

    @BeforeEach
    void setUp() {
        treasuryService.updateLimits(1_000_000L, 1_000L);
        treasuryService.refill(10_000, "test-refill-" + UUID.randomUUID(), "test");
        botId = uniqueOwner("bot");
    }

    @Test
    @DisplayName("Due refund returns coins to the treasury and a second run does nothing")
    void testRefundIsAppliedOnce() {
        printTestHeader("Refund Applied Once");

        // Given: a disqualified download of 5 coins
        UUID actionId = spend(BotActionType.DOWNLOAD, 5);
        recorder.disqualify(actionId, "Listing removed");
        TreasuryState before = treasuryService.getState();
        long botBefore = botBalance();
        printInput("Action", actionId);

        // When
        JobRunSummary summary = refundProcessor.processDueRefunds();
        printOutput("Summary", summary);

        // Then
        TreasuryState after = treasuryService.getState();
        assertTrue(summary.getProcessed() >= 1);
        assertEquals(before.getTreasuryBalance() + 5, after.getTreasuryBalance());
        assertEquals(botBefore - 5, botBalance());
        assertTrue(recorder.getAction(actionId).isWasRefunded());

        BotRefundEntity candidate = refundRepository.findByBotActionId(actionId).orElseThrow();
        assertEquals(RefundStatus.PROCESSED, candidate.getStatus());
        assertNotNull(candidate.getRefundTransactionId());
        assertEquals(1, countRefundTransactions(actionId));

        // When: the job runs again
        refundProcessor.processDueRefunds();

        assertEquals(after.getTreasuryBalance(), treasuryService.getState().getTreasuryBalance());
        assertEquals(1, countRefundTransactions(actionId));
        printSuccess("Refund applied exactly once");
    }

    @Test
    @DisplayName("Automatic purchase refund waits for its scheduled hour")
    void testFutureRefundIsNotProcessed() {
        UUID actionId = spend(BotActionType.PURCHASE, 8);

        refundProcessor.processDueRefunds();

        assertEquals(RefundStatus.PENDING, refundRepository.findByBotActionId(actionId).orElseThrow().getStatus());
        assertFalse(recorder.getAction(actionId).isWasRefunded());
        assertEquals(8, botBalance());
    }

    @Test
    @DisplayName("Refund the bot can no longer cover is parked as FAILED with no ledger effect")
    void testUncoverableRefundFails() {
        printTestHeader("Uncoverable Refund");

        // Given: the bot spent its coins before the refund ran
        UUID actionId = spend(BotActionType.UNLOCK, 10);
        Wallet botWallet = walletService.findWallet(botId, OwnerKind.BOT).orElseThrow();
        Wallet sink = walletService.createWallet(uniqueOwner("sink"), OwnerKind.USER, null);
        ledgerService.commit(TransactionRequest.builder()
            .type(TransactionType.ADJUSTMENT)
            .idempotencyKey("drain-" + UUID.randomUUID())
            .entry(TransactionRequest.EntryLine.debit(botWallet.getId(), 10, "drain"))
            .entry(TransactionRequest.EntryLine.credit(sink.getId(), 10, "drain"))
            .build());
        recorder.disqualify(actionId, "Content rejected");
        long treasuryBefore = treasuryService.getState().getTreasuryBalance();

        // When
        refundProcessor.processDueRefunds();

        // Then
        BotRefundEntity candidate = refundRepository.findByBotActionId(actionId).orElseThrow();
        printOutput("Candidate status", candidate.getStatus());
        printOutput("Failure reason", candidate.getFailureReason());
        assertEquals(RefundStatus.FAILED, candidate.getStatus());
        assertNotNull(candidate.getFailureReason());
        assertFalse(recorder.getAction(actionId).isWasRefunded());
        assertEquals(0, botBalance());
        assertEquals(treasuryBefore, treasuryService.getState().getTreasuryBalance());
        assertEquals(0, countRefundTransactions(actionId));
        printSuccess("Candidate parked, ledger untouched");
    }

    @Test
    @DisplayName("Candidate for an action refunded elsewhere fails instead of refunding twice")
    void testAlreadyRefundedActionFails() {
        UUID actionId = spend(BotActionType.DOWNLOAD, 4);
        recorder.disqualify(actionId, "duplicate listing");
        recorder.markRefunded(actionId);

        refundProcessor.processDueRefunds();

        assertEquals(RefundStatus.FAILED, refundRepository.findByBotActionId(actionId).orElseThrow().getStatus());
        assertEquals(4, botBalance());
        assertEquals(0, countRefundTransactions(actionId));
    }

    @Test
    @DisplayName("Claim abandoned by a crashed run is picked up again")
    void testStaleClaimIsReleased() {
        UUID actionId = spend(BotActionType.DOWNLOAD, 3);
        recorder.disqualify(actionId, "abandoned");
        jdbcTemplate.update("UPDATE bot_refunds SET status = 'PROCESSING', claimed_at = ? WHERE bot_action_id = ?",
            Timestamp.from(Instant.now().minus(Duration.ofHours(2))), actionId);

        refundProcessor.processDueRefunds();

        assertEquals(RefundStatus.PROCESSED, refundRepository.findByBotActionId(actionId).orElseThrow().getStatus());
        assertEquals(0, botBalance());
    }

    @Test
    @DisplayName("Fresh claim held by another run is left alone")
    void testFreshClaimIsSkipped() {
        UUID actionId = spend(BotActionType.DOWNLOAD, 3);
        recorder.disqualify(actionId, "in flight");
        BotRefundEntity candidate = refundRepository.findByBotActionId(actionId).orElseThrow();
        assertEquals(1, refundRepository.claim(candidate.getId(), Instant.now()));

        refundProcessor.processDueRefunds();

        assertEquals(RefundStatus.PROCESSING, refundRepository.findByBotActionId(actionId).orElseThrow().getStatus());
        assertEquals(3, botBalance());
    }

    private UUID spend(BotActionType type, long cost) {
        return recorder.recordSpend(botId, type,
            ActionTarget.of(TargetType.LISTING, "listing-" + UUID.randomUUID()), cost, null, null);
    }

    private long botBalance() {
        return walletService.findWallet(botId, OwnerKind.BOT).orElseThrow().getBalance();
    }

    private int countRefundTransactions(UUID actionId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_transactions WHERE idempotency_key = ? AND status = 'COMMITTED'",
            Integer.class, RefundProcessor.REFUND_KEY_PREFIX + actionId);
        return count != null ? count : 0;
    }
}
