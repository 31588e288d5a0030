package com.flagship.coin_economy.ledger;

import com.flagship.coin_economy.IntegrationTestSupport;
import com.flagship.coin_economy.exception.InsufficientBalanceException;
import com.flagship.coin_economy.exception.InvalidEntrySetException;
import com.flagship.coin_economy.exception.WalletNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.IllegalTransactionStateException;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.flagship.coin_economy.ledger.TransactionRequest.EntryLine;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the ledger: unbalanced sets, overdrafts, replays and
 * concurrent commits against the same wallets.
 */
@SpringBootTest
class LedgerServiceTest extends IntegrationTestSupport {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private WalletService walletService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID aliceWalletId;
    private UUID bobWalletId;

    @BeforeEach
    void setUp() {
        aliceWalletId = walletService.createWallet(uniqueOwner("alice"), OwnerKind.USER, null).getId();
        bobWalletId = walletService.createWallet(uniqueOwner("bob"), OwnerKind.USER, null).getId();
        purchase(aliceWalletId, 100);
    }

    @Test
    @DisplayName("Balanced transfer moves coins and records both legs")
    void testBalancedTransfer() {
        printTestHeader("Balanced Transfer");

        // Given: Alice holds 100
        TransactionRequest request = transfer(aliceWalletId, bobWalletId, 40, key("transfer"));
        printInput("Request", request);

        // When
        TransactionResult result = ledgerService.commit(request);
        printOutput("Result", result);

        // Then
        assertFalse(result.isDuplicate());
        assertEquals(60, result.balanceOf(aliceWalletId));
        assertEquals(40, result.balanceOf(bobWalletId));

        List<LedgerEntry> entries = ledgerService.getEntries(result.getTransactionId());
        assertEquals(2, entries.size());
        assertEquals(60, walletService.getWallet(aliceWalletId).getBalance());
        assertEquals(40, walletService.getWallet(bobWalletId).getBalance());
        assertEquals(60, ledgerService.getDerivedBalance(aliceWalletId));
        assertEquals(40, ledgerService.getDerivedBalance(bobWalletId));
        assertEquals(40, walletService.getWallet(bobWalletId).getLifetimeEarned());
        assertEquals(40, walletService.getWallet(aliceWalletId).getLifetimeSpent());
        printSuccess("Both wallets moved by exactly the transferred amount");
    }

    @Test
    @DisplayName("Replaying a committed key returns the original result without posting again")
    void testIdempotentReplay() {
        printTestHeader("Idempotent Replay");

        String key = key("replay");
        TransactionResult first = ledgerService.commit(transfer(aliceWalletId, bobWalletId, 25, key));
        TransactionResult second = ledgerService.commit(transfer(aliceWalletId, bobWalletId, 25, key));
        printOutput("First", first);
        printOutput("Second", second);

        assertFalse(first.isDuplicate());
        assertTrue(second.isDuplicate());
        assertEquals(first.getTransactionId(), second.getTransactionId());
        assertEquals(75, second.balanceOf(aliceWalletId));
        assertEquals(25, second.balanceOf(bobWalletId));
        assertEquals(75, walletService.getWallet(aliceWalletId).getBalance());
        printSuccess("Second commit was a replay");
    }

    @Test
    @DisplayName("Unbalanced entry set is rejected and leaves no trace in balances")
    void testUnbalancedRejected() {
        printTestHeader("Unbalanced Entry Set");

        String key = key("unbalanced");
        TransactionRequest request = TransactionRequest.builder()
            .type(TransactionType.ADJUSTMENT)
            .idempotencyKey(key)
            .entry(EntryLine.debit(aliceWalletId, 50, "debit"))
            .entry(EntryLine.credit(bobWalletId, 49, "credit"))
            .build();

        assertThrows(InvalidEntrySetException.class, () -> ledgerService.commit(request));

        assertEquals(100, walletService.getWallet(aliceWalletId).getBalance());
        assertEquals(0, walletService.getWallet(bobWalletId).getBalance());
        assertEquals(1, countTransactions(key, "FAILED"));
        assertTrue(ledgerService.findCommitted(key).isEmpty());
        printSuccess("Rejected and audited as FAILED");
    }

    @Test
    @DisplayName("Non-positive amounts are rejected")
    void testNonPositiveAmountRejected() {
        TransactionRequest request = TransactionRequest.builder()
            .type(TransactionType.ADJUSTMENT)
            .idempotencyKey(key("zero"))
            .entry(EntryLine.debit(aliceWalletId, 0, "debit"))
            .entry(EntryLine.credit(bobWalletId, 0, "credit"))
            .build();

        assertThrows(InvalidEntrySetException.class, () -> ledgerService.commit(request));
    }

    @Test
    @DisplayName("Overdraft is rejected and a failed attempt does not consume the key")
    void testInsufficientBalanceKeepsKeyReusable() {
        printTestHeader("Insufficient Balance");

        String key = key("overdraft");
        InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
            () -> ledgerService.commit(transfer(aliceWalletId, bobWalletId, 150, key)));
        printOutput("Exception", e.getMessage());

        assertEquals(aliceWalletId, e.getWalletId());
        assertEquals(100, walletService.getWallet(aliceWalletId).getBalance());
        assertEquals(1, countTransactions(key, "FAILED"));

        // When: Alice is topped up and the same key is retried
        purchase(aliceWalletId, 50);
        TransactionResult retry = ledgerService.commit(transfer(aliceWalletId, bobWalletId, 150, key));

        assertFalse(retry.isDuplicate());
        assertEquals(0, retry.balanceOf(aliceWalletId));
        assertEquals(150, retry.balanceOf(bobWalletId));
        assertEquals(1, countTransactions(key, "COMMITTED"));
        printSuccess("Retry with the same key committed");
    }

    @Test
    @DisplayName("Overdraft flag lets a wallet go negative")
    void testAllowOverdraft() {
        TransactionResult result = ledgerService.commit(TransactionRequest.builder()
            .type(TransactionType.ADJUSTMENT)
            .idempotencyKey(key("allowed-overdraft"))
            .entry(EntryLine.debit(bobWalletId, 10, "correction"))
            .entry(EntryLine.credit(aliceWalletId, 10, "correction"))
            .allowOverdraft(true)
            .build());

        assertEquals(-10, result.balanceOf(bobWalletId));
        assertEquals(-10, ledgerService.getDerivedBalance(bobWalletId));
    }

    @Test
    @DisplayName("Only a bot spend may debit the treasury or credit a bot, overdraft flag or not")
    void testTreasuryAndBotLegsNeedTreasuryType() {
        printTestHeader("Treasury Boundary");

        // Given: a bot wallet capped at 50
        UUID botWalletId = walletService.createWallet(uniqueOwner("bot"), OwnerKind.BOT, 50L).getId();
        long treasuryBefore = walletService.getWallet(SystemWallets.TREASURY_WALLET_ID).getBalance();

        // When: an adjustment tries to move treasury coins straight into the bot
        String key = key("treasury-to-bot");
        InvalidEntrySetException e = assertThrows(InvalidEntrySetException.class,
            () -> ledgerService.commit(TransactionRequest.builder()
                .type(TransactionType.ADJUSTMENT)
                .idempotencyKey(key)
                .entry(EntryLine.debit(SystemWallets.TREASURY_WALLET_ID, 1000, "correction"))
                .entry(EntryLine.credit(botWalletId, 1000, "correction"))
                .allowOverdraft(true)
                .build()));
        printOutput("Exception", e.getMessage());

        // Then
        assertEquals(treasuryBefore, walletService.getWallet(SystemWallets.TREASURY_WALLET_ID).getBalance());
        assertEquals(0, walletService.getWallet(botWalletId).getBalance());
        assertEquals(1, countTransactions(key, "FAILED"));

        // A user cannot fund the bot either
        assertThrows(InvalidEntrySetException.class,
            () -> ledgerService.commit(transfer(aliceWalletId, botWalletId, 10, key("user-to-bot"))));
        assertEquals(100, walletService.getWallet(aliceWalletId).getBalance());
        printSuccess("Both rejected");
    }

    @Test
    @DisplayName("The overdraft flag never lets the treasury go negative")
    void testOverdraftFlagIgnoredForTreasury() {
        UUID botWalletId = walletService.createWallet(uniqueOwner("bot"), OwnerKind.BOT, null).getId();
        long treasuryBalance = walletService.getWallet(SystemWallets.TREASURY_WALLET_ID).getBalance();

        InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
            () -> ledgerService.commit(TransactionRequest.builder()
                .type(TransactionType.BOT_SPEND)
                .idempotencyKey(key("treasury-overdraft"))
                .entry(EntryLine.debit(SystemWallets.TREASURY_WALLET_ID, treasuryBalance + 1, "spend"))
                .entry(EntryLine.credit(botWalletId, treasuryBalance + 1, "spend"))
                .allowOverdraft(true)
                .build()));

        assertEquals(SystemWallets.TREASURY_WALLET_ID, e.getWalletId());
        assertEquals(treasuryBalance, walletService.getWallet(SystemWallets.TREASURY_WALLET_ID).getBalance());
    }

    @Test
    @DisplayName("Expired coins may be credited to the treasury")
    void testExpirationMayCreditTreasury() {
        long treasuryBefore = walletService.getWallet(SystemWallets.TREASURY_WALLET_ID).getBalance();

        TransactionResult result = ledgerService.commit(TransactionRequest.builder()
            .type(TransactionType.EXPIRATION)
            .idempotencyKey(key("expire-to-treasury"))
            .entry(EntryLine.debit(aliceWalletId, 30, "Coins expired"))
            .counterparty(Counterparty.TREASURY)
            .build());

        assertEquals(70, result.balanceOf(aliceWalletId));
        assertEquals(treasuryBefore + 30, result.balanceOf(SystemWallets.TREASURY_WALLET_ID));
    }

    @Test
    @DisplayName("Entries naming an unknown wallet are rejected")
    void testUnknownWallet() {
        UUID unknown = UUID.randomUUID();
        assertThrows(WalletNotFoundException.class,
            () -> ledgerService.commit(transfer(aliceWalletId, unknown, 10, key("unknown"))));
        assertEquals(100, walletService.getWallet(aliceWalletId).getBalance());
    }

    @Test
    @DisplayName("Ledger entries cannot be updated or deleted")
    void testEntriesAreAppendOnly() {
        TransactionResult result = ledgerService.commit(transfer(aliceWalletId, bobWalletId, 5, key("immutable")));

        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "UPDATE ledger_entries SET amount = 1 WHERE transaction_id = ?", result.getTransactionId()));
        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "DELETE FROM ledger_entries WHERE transaction_id = ?", result.getTransactionId()));
        assertEquals(2, ledgerService.getEntries(result.getTransactionId()).size());
    }

    @Test
    @DisplayName("The database rejects an unbalanced set written around the engine")
    void testDatabaseRejectsUnbalancedInsert() {
        UUID txId = UUID.randomUUID();
        assertThrows(DataAccessException.class, () -> jdbcTemplate.execute((Connection connection) -> {
            connection.setAutoCommit(false);
            try (var tx = connection.prepareStatement(
                    "INSERT INTO ledger_transactions (id, transaction_type, idempotency_key, status) " +
                    "VALUES (?, 'ADJUSTMENT', ?, 'COMMITTED')");
                 var entry = connection.prepareStatement(
                    "INSERT INTO ledger_entries (id, transaction_id, wallet_id, direction, amount, balance_before, balance_after) " +
                    "VALUES (?, ?, ?, 'CREDIT', 10, 0, 10)")) {
                tx.setObject(1, txId);
                tx.setString(2, key("raw"));
                tx.executeUpdate();
                entry.setObject(1, UUID.randomUUID());
                entry.setObject(2, txId);
                entry.setObject(3, bobWalletId);
                entry.executeUpdate();
                connection.commit();
            } finally {
                connection.rollback();
                connection.setAutoCommit(true);
            }
            return null;
        }));
        assertTrue(ledgerService.getEntries(txId).isEmpty());
    }

    @Test
    @DisplayName("Locking wallets outside a transaction is refused")
    void testLockWalletsRequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class,
            () -> ledgerService.lockWallets(List.of(aliceWalletId)));
    }

    @Test
    @DisplayName("Concurrent commits with one key post exactly once")
    void testConcurrentSameKey() throws Exception {
        printTestHeader("Concurrent Same Key");

        String key = key("concurrent");
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<TransactionResult>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return ledgerService.commit(transfer(aliceWalletId, bobWalletId, 30, key));
            }));
        }
        start.countDown();

        Set<UUID> transactionIds = new HashSet<>();
        int firstCommits = 0;
        for (Future<TransactionResult> future : futures) {
            TransactionResult result = future.get(30, TimeUnit.SECONDS);
            transactionIds.add(result.getTransactionId());
            if (!result.isDuplicate()) {
                firstCommits++;
            }
        }
        executor.shutdown();
        printOutput("Distinct transaction ids", transactionIds.size());

        assertEquals(1, firstCommits);
        assertEquals(1, transactionIds.size());
        assertEquals(70, walletService.getWallet(aliceWalletId).getBalance());
        assertEquals(30, walletService.getWallet(bobWalletId).getBalance());
        printSuccess("Exactly one commit applied");
    }

    @Test
    @DisplayName("Opposite transfers between the same wallets do not deadlock")
    void testOppositeTransfersConserveCoins() throws Exception {
        purchase(bobWalletId, 100);
        int rounds = 20;
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger committed = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < rounds; i++) {
            boolean forward = i % 2 == 0;
            String key = key("pingpong-" + i);
            futures.add(executor.submit(() -> {
                start.await();
                ledgerService.commit(forward
                    ? transfer(aliceWalletId, bobWalletId, 3, key)
                    : transfer(bobWalletId, aliceWalletId, 3, key));
                committed.incrementAndGet();
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(rounds, committed.get());
        long alice = walletService.getWallet(aliceWalletId).getBalance();
        long bob = walletService.getWallet(bobWalletId).getBalance();
        assertEquals(200, alice + bob);
        assertEquals(alice, ledgerService.getDerivedBalance(aliceWalletId));
        assertEquals(bob, ledgerService.getDerivedBalance(bobWalletId));
    }

    private void purchase(UUID walletId, long amount) {
        ledgerService.commit(TransactionRequest.builder()
            .type(TransactionType.PURCHASE)
            .idempotencyKey(key("purchase"))
            .entry(EntryLine.credit(walletId, amount, "Coin purchase"))
            .counterparty(Counterparty.VOID)
            .build());
    }

    private static TransactionRequest transfer(UUID from, UUID to, long amount, String key) {
        return TransactionRequest.builder()
            .type(TransactionType.ADJUSTMENT)
            .idempotencyKey(key)
            .entry(EntryLine.debit(from, amount, "Transfer out"))
            .entry(EntryLine.credit(to, amount, "Transfer in"))
            .build();
    }

    private int countTransactions(String key, String status) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_transactions WHERE idempotency_key = ? AND status = ?",
            Integer.class, key, status);
        return count != null ? count : 0;
    }

    private static String key(String prefix) {
        return "test-" + prefix + "-" + UUID.randomUUID();
    }
}
