package com.flagship.coin_economy.ledger;

import com.flagship.coin_economy.exception.InvalidEntrySetException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static com.flagship.coin_economy.ledger.TransactionRequest.EntryLine;
import static org.junit.jupiter.api.Assertions.*;

class TransactionRequestTest {

    private final UUID walletA = UUID.randomUUID();
    private final UUID walletB = UUID.randomUUID();

    @Test
    @DisplayName("Balanced two-leg request validates")
    void testBalanced() {
        TransactionRequest request = TransactionRequest.builder()
            .type(TransactionType.ADJUSTMENT)
            .idempotencyKey("k1")
            .entry(EntryLine.debit(walletA, 30, null))
            .entry(EntryLine.credit(walletB, 30, null))
            .build();

        assertDoesNotThrow(request::validate);
        assertTrue(request.isBalanced());
        assertEquals(2, request.balancedEntries().size());
    }

    @Test
    @DisplayName("Unbalanced request without counterparty is rejected")
    void testUnbalanced() {
        TransactionRequest request = TransactionRequest.builder()
            .type(TransactionType.ADJUSTMENT)
            .idempotencyKey("k2")
            .entry(EntryLine.debit(walletA, 30, null))
            .entry(EntryLine.credit(walletB, 20, null))
            .build();

        InvalidEntrySetException e = assertThrows(InvalidEntrySetException.class, request::validate);
        assertTrue(e.getMessage().contains("debits=30"));
    }

    @Test
    @DisplayName("Counterparty takes the balancing leg of a one-sided credit")
    void testCounterpartyBalancesCredit() {
        TransactionRequest request = TransactionRequest.builder()
            .type(TransactionType.PURCHASE)
            .idempotencyKey("k3")
            .entry(EntryLine.credit(walletA, 500, "Coin pack"))
            .counterparty(Counterparty.VOID)
            .build();

        assertDoesNotThrow(request::validate);
        List<EntryLine> legs = request.balancedEntries();
        assertEquals(2, legs.size());
        EntryLine balancing = legs.get(1);
        assertEquals(SystemWallets.VOID_WALLET_ID, balancing.getWalletId());
        assertEquals(EntryDirection.DEBIT, balancing.getDirection());
        assertEquals(500, balancing.getAmount());
    }

    @Test
    @DisplayName("Counterparty takes the balancing leg of a one-sided debit")
    void testCounterpartyBalancesDebit() {
        TransactionRequest request = TransactionRequest.builder()
            .type(TransactionType.EXPIRATION)
            .idempotencyKey("k4")
            .entry(EntryLine.debit(walletA, 40, "Coins expired"))
            .counterparty(Counterparty.TREASURY)
            .build();

        EntryLine balancing = request.balancedEntries().get(1);
        assertEquals(SystemWallets.TREASURY_WALLET_ID, balancing.getWalletId());
        assertEquals(EntryDirection.CREDIT, balancing.getDirection());
        assertEquals(40, balancing.getAmount());
    }

    @Test
    @DisplayName("Missing key, type or entries are rejected before touching the store")
    void testIncompleteRequests() {
        assertThrows(InvalidEntrySetException.class, () -> TransactionRequest.builder()
            .type(TransactionType.ADJUSTMENT)
            .entry(EntryLine.debit(walletA, 1, null))
            .entry(EntryLine.credit(walletB, 1, null))
            .build().validate());
        assertThrows(InvalidEntrySetException.class, () -> TransactionRequest.builder()
            .idempotencyKey("k5")
            .entry(EntryLine.debit(walletA, 1, null))
            .entry(EntryLine.credit(walletB, 1, null))
            .build().validate());
        assertThrows(InvalidEntrySetException.class, () -> TransactionRequest.builder()
            .type(TransactionType.ADJUSTMENT)
            .idempotencyKey("k6")
            .build().validate());
    }

    @Test
    @DisplayName("Zero and negative amounts are rejected")
    void testNonPositiveAmounts() {
        assertThrows(InvalidEntrySetException.class, () -> TransactionRequest.builder()
            .type(TransactionType.ADJUSTMENT)
            .idempotencyKey("k7")
            .entry(EntryLine.debit(walletA, -5, null))
            .entry(EntryLine.credit(walletB, -5, null))
            .build().validate());
    }
}
