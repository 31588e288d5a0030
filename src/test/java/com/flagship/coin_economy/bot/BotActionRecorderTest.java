package com.flagship.coin_economy.bot;

import com.flagship.coin_economy.IntegrationTestSupport;
import com.flagship.coin_economy.exception.AlreadyRefundedException;
import com.flagship.coin_economy.exception.CapExceededException;
import com.flagship.coin_economy.exception.ResourceNotFoundException;
import com.flagship.coin_economy.ledger.OwnerKind;
import com.flagship.coin_economy.ledger.WalletService;
import com.flagship.coin_economy.refund.BotRefundEntity;
import com.flagship.coin_economy.refund.BotRefundRepository;
import com.flagship.coin_economy.refund.RefundStatus;
import com.flagship.coin_economy.treasury.TreasuryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class BotActionRecorderTest extends IntegrationTestSupport {

    @Autowired
    private BotActionRecorder recorder;

    @Autowired
    private BotRefundRepository refundRepository;

    @Autowired
    private TreasuryService treasuryService;

    @Autowired
    private WalletService walletService;

    private String botId;

    @BeforeEach
    void setUp() {
        treasuryService.updateLimits(1_000_000L, 1_000L);
        treasuryService.refill(10_000, "test-refill-" + UUID.randomUUID(), "test");
        botId = uniqueOwner("bot");
    }

    @Test
    @DisplayName("Engagement spend is recorded as final with no refund candidate")
    void testRecordEngagementSpend() {
        printTestHeader("Record Engagement Spend");

        UUID actionId = recorder.recordSpend(botId, BotActionType.LIKE,
            ActionTarget.of(TargetType.THREAD, "thread-1"), 3, Map.of("source", "test"), null);
        printOutput("Action ID", actionId);

        BotAction action = recorder.getAction(actionId);
        assertEquals(botId, action.getBotId());
        assertEquals(3, action.getCoinCost());
        assertFalse(action.isRefundable());
        assertFalse(action.isWasRefunded());
        assertNotNull(action.getLedgerTransactionId());
        assertEquals(TargetType.THREAD, action.getTarget().getType());
        assertEquals(3, walletService.findWallet(botId, OwnerKind.BOT).orElseThrow().getBalance());
        assertTrue(refundRepository.findByBotActionId(actionId).isEmpty());
        printSuccess("Action recorded");
    }

    @Test
    @DisplayName("Purchase schedules an automatic refund at the next refund hour")
    void testPurchaseSchedulesAutoRefund() {
        UUID actionId = recorder.recordSpend(botId, BotActionType.PURCHASE,
            ActionTarget.of(TargetType.LISTING, "listing-1"), 20, null, null);

        BotRefundEntity candidate = refundRepository.findByBotActionId(actionId).orElseThrow();
        assertEquals(RefundStatus.PENDING, candidate.getStatus());
        assertEquals(20, candidate.getAmount());
        assertTrue(candidate.getScheduledFor().isAfter(Instant.now()));
        assertEquals(recorder.nextRefundTime(), candidate.getScheduledFor());
    }

    @Test
    @DisplayName("Repeated idempotency key returns the first action and spends once")
    void testIdempotentRecordSpend() {
        String key = "bot-action-" + UUID.randomUUID();
        ActionTarget target = ActionTarget.of(TargetType.USER, "user-9");

        UUID first = recorder.recordSpend(botId, BotActionType.FOLLOW, target, 4, null, key);
        UUID second = recorder.recordSpend(botId, BotActionType.FOLLOW, target, 4, null, key);

        assertEquals(first, second);
        assertEquals(1, recorder.getActionsForBot(botId).size());
        assertEquals(4, walletService.findWallet(botId, OwnerKind.BOT).orElseThrow().getBalance());
        assertTrue(recorder.findByIdempotencyKey(key).isPresent());
    }

    @Test
    @DisplayName("Spend rejected by a cap records no action")
    void testCapExceededRecordsNothing() {
        assertThrows(CapExceededException.class, () -> recorder.recordSpend(botId, BotActionType.UNLOCK,
            ActionTarget.of(TargetType.LISTING, "listing-2"), 5_000, null, null));

        assertTrue(recorder.getActionsForBot(botId).isEmpty());
    }

    @Test
    @DisplayName("An action can be marked refunded only once")
    void testMarkRefundedTwice() {
        UUID actionId = recorder.recordSpend(botId, BotActionType.DOWNLOAD,
            ActionTarget.of(TargetType.LISTING, "listing-3"), 6, null, null);

        recorder.markRefunded(actionId);

        assertThrows(AlreadyRefundedException.class, () -> recorder.markRefunded(actionId));
        BotAction action = recorder.getAction(actionId);
        assertTrue(action.isWasRefunded());
        assertNotNull(action.getRefundedAt());
    }

    @Test
    @DisplayName("Marking an unknown action refunded is not found")
    void testMarkRefundedUnknown() {
        assertThrows(ResourceNotFoundException.class, () -> recorder.markRefunded(UUID.randomUUID()));
    }

    @Test
    @DisplayName("Engagement actions cannot be disqualified")
    void testDisqualifyNonRefundable() {
        UUID actionId = recorder.recordSpend(botId, BotActionType.VIEW,
            ActionTarget.of(TargetType.THREAD, "thread-2"), 1, null, null);

        assertThrows(IllegalStateException.class, () -> recorder.disqualify(actionId, "spam"));
        assertTrue(refundRepository.findByBotActionId(actionId).isEmpty());
    }

    @Test
    @DisplayName("Disqualifying a purchase pulls its refund forward to now")
    void testDisqualifyPullsRefundForward() {
        UUID actionId = recorder.recordSpend(botId, BotActionType.PURCHASE,
            ActionTarget.of(TargetType.LISTING, "listing-4"), 15, null, null);
        Instant scheduled = refundRepository.findByBotActionId(actionId).orElseThrow().getScheduledFor();

        assertTrue(recorder.disqualify(actionId, "Listing removed"));

        BotRefundEntity candidate = refundRepository.findByBotActionId(actionId).orElseThrow();
        assertTrue(candidate.getScheduledFor().isBefore(scheduled));
        assertFalse(candidate.getScheduledFor().isAfter(Instant.now()));
        assertEquals("Listing removed", candidate.getReason());
        assertEquals(RefundStatus.PENDING, candidate.getStatus());
    }

    @Test
    @DisplayName("Disqualifying an already refunded action is a conflict")
    void testDisqualifyRefunded() {
        UUID actionId = recorder.recordSpend(botId, BotActionType.UNLOCK,
            ActionTarget.of(TargetType.LISTING, "listing-5"), 2, null, null);
        recorder.markRefunded(actionId);

        assertThrows(AlreadyRefundedException.class, () -> recorder.disqualify(actionId, "late"));
    }

    @Test
    @DisplayName("Disqualifying a target schedules refunds for its refundable actions only")
    void testDisqualifyTarget() {
        String listingId = "listing-" + UUID.randomUUID();
        ActionTarget target = ActionTarget.of(TargetType.LISTING, listingId);
        UUID download = recorder.recordSpend(botId, BotActionType.DOWNLOAD, target, 5, null, null);
        UUID unlock = recorder.recordSpend(botId, BotActionType.UNLOCK, target, 7, null, null);
        UUID like = recorder.recordSpend(botId, BotActionType.LIKE, target, 1, null, null);

        int scheduled = recorder.disqualifyTarget(TargetType.LISTING, listingId, "Content rejected");

        assertEquals(2, scheduled);
        assertTrue(refundRepository.findByBotActionId(download).isPresent());
        assertTrue(refundRepository.findByBotActionId(unlock).isPresent());
        assertTrue(refundRepository.findByBotActionId(like).isEmpty());
    }
}
