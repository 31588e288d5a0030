package com.flagship.coin_economy.ledger;

import com.flagship.coin_economy.exception.EconomyException;
import com.flagship.coin_economy.exception.InsufficientBalanceException;
import com.flagship.coin_economy.exception.InvalidEntrySetException;
import com.flagship.coin_economy.exception.ResourceNotFoundException;
import com.flagship.coin_economy.exception.StoreUnavailableException;
import com.flagship.coin_economy.exception.WalletNotFoundException;
import com.flagship.coin_economy.observability.CorrelationContext;
import com.flagship.coin_economy.observability.EconomyMetrics;
import com.flagship.coin_economy.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;

/**
 * The ledger engine: the only writer of wallet balances.
 *
 * Every commit:
 * 1. Validates the entry set (debits equal credits, positive amounts)
 * 2. Claims the idempotency key with a conditional insert, replaying the prior
 *    result if another commit already owns it
 * 3. Locks every touched wallet in ascending id order
 * 4. Rejects treasury and bot legs the transaction type does not permit
 * 5. Rejects the transaction if a wallet would go negative without overdraft
 * 6. Appends entries, updates cached balances and writes an outbox event
 *
 * A commit joins the caller's transaction when there is one, so the treasury and
 * the batch jobs can combine it with their own bookkeeping atomically.
 * The database re-checks the balance of every transaction at commit time.
 *
 * Only the treasury may take coins out of the treasury wallet or put coins in
 * a bot wallet, and only with a {@link TransactionType#isTreasuryManaged()} type,
 * so its daily and per-bot caps see every such movement. A transaction touching
 * the treasury wallet takes the treasury_state lock before its wallet locks.
 */
@Service
@Slf4j
public class LedgerService {

    private static final String AGGREGATE_TYPE = "LedgerTransaction";

    private final LedgerStore ledgerStore;
    private final IdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final EconomyMetrics metrics;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate failureTemplate;

    public LedgerService(LedgerStore ledgerStore,
                         IdempotencyService idempotencyService,
                         OutboxService outboxService,
                         EconomyMetrics metrics,
                         PlatformTransactionManager transactionManager) {
        this.ledgerStore = ledgerStore;
        this.idempotencyService = idempotencyService;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.failureTemplate = new TransactionTemplate(transactionManager);
        this.failureTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Commits a transaction exactly once per idempotency key.
     *
     * @param request the entries to post
     * @return the committed result, or the prior result with {@code duplicate = true}
     * @throws InvalidEntrySetException if the request is malformed
     * @throws InsufficientBalanceException if a wallet would go negative
     * @throws WalletNotFoundException if an entry names an unknown wallet
     * @throws StoreUnavailableException if the store failed transiently; safe to retry
     */
    public TransactionResult commit(TransactionRequest request) {
        try {
            request.validate();
        } catch (InvalidEntrySetException e) {
            recordFailedAttempt(request, e);
            throw e;
        }

        String key = request.getIdempotencyKey();
        try {
            Optional<TransactionResult> prior = idempotencyService.findCommittedTransaction(key)
                .flatMap(this::replayById);
            if (prior.isPresent()) {
                metrics.recordIdempotentReplay(request.getType());
                log.info("Idempotency key already committed, returning prior result: key={}, transactionId={}",
                        key, prior.get().getTransactionId());
                return prior.get();
            }

            TransactionResult result = metrics.timeCommit(() -> transactionTemplate.execute(status -> doCommit(request)));

            if (result.isDuplicate()) {
                metrics.recordIdempotentReplay(request.getType());
            } else {
                metrics.recordTransactionCommitted(request.getType());
            }
            return result;

        } catch (InsufficientBalanceException | InvalidEntrySetException e) {
            recordFailedAttempt(request, e);
            throw e;
        } catch (TransientDataAccessException | DataAccessResourceFailureException e) {
            metrics.recordTransactionFailed(request.getType(), "STORE_UNAVAILABLE");
            throw new StoreUnavailableException("Ledger store unavailable while committing " + key, e);
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private TransactionResult doCommit(TransactionRequest request) {
        String key = request.getIdempotencyKey();
        UUID transactionId = UUID.randomUUID();
        List<TransactionRequest.EntryLine> lines = request.balancedEntries();

        boolean claimed = ledgerStore.insertCommittedTransaction(
            transactionId, request.getType(), key, request.getMetadata());
        if (!claimed) {
            LedgerTransaction existing = ledgerStore.findCommittedByKey(key)
                .orElseThrow(() -> new IllegalStateException("Idempotency key conflict without committed row: " + key));
            log.info("Concurrent commit already owns key, replaying: key={}, transactionId={}", key, existing.getId());
            return replay(existing);
        }
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId.toString());

        Map<UUID, Wallet> wallets = lockWallets(lines.stream().map(TransactionRequest.EntryLine::getWalletId).toList());
        checkTreasuryBoundary(request.getType(), lines, wallets);

        Map<UUID, Long> balances = new LinkedHashMap<>();
        Map<UUID, Long> earned = new HashMap<>();
        Map<UUID, Long> spent = new HashMap<>();
        wallets.forEach((id, wallet) -> {
            balances.put(id, wallet.getBalance());
            earned.put(id, wallet.getLifetimeEarned());
            spent.put(id, wallet.getLifetimeSpent());
        });

        List<LedgerEntry> entries = new ArrayList<>(lines.size());
        for (TransactionRequest.EntryLine line : lines) {
            UUID walletId = line.getWalletId();
            long before = balances.get(walletId);
            long after = Math.addExact(before, line.getDirection().signed(line.getAmount()));
            balances.put(walletId, after);
            if (line.getDirection() == EntryDirection.CREDIT) {
                earned.merge(walletId, line.getAmount(), Math::addExact);
            } else {
                spent.merge(walletId, line.getAmount(), Math::addExact);
            }
            entries.add(new LedgerEntry(UUID.randomUUID(), transactionId, walletId, line.getDirection(),
                line.getAmount(), before, after, line.getMemo(), null, null));
        }

        for (Wallet wallet : wallets.values()) {
            long finalBalance = balances.get(wallet.getId());
            boolean overdraftAllowed = wallet.isOverdraftAllowed()
                || (request.isAllowOverdraft() && !wallet.isSystemWallet());
            if (finalBalance < 0 && !overdraftAllowed) {
                throw new InsufficientBalanceException(wallet.getId(), wallet.getBalance(),
                    wallet.getBalance() - finalBalance);
            }
        }

        for (LedgerEntry entry : entries) {
            ledgerStore.insertEntry(entry);
        }
        for (Wallet wallet : wallets.values()) {
            ledgerStore.updateWalletBalance(wallet, balances.get(wallet.getId()),
                earned.get(wallet.getId()), spent.get(wallet.getId()));
        }

        outboxService.saveEvent(AGGREGATE_TYPE, transactionId, LedgerTransactionCommittedEvent.EVENT_TYPE,
            LedgerTransactionCommittedEvent.of(transactionId, request.getType(), key, entries));

        idempotencyService.rememberAfterCommit(key, transactionId);

        log.info("Committed ledger transaction: type={}, key={}, entries={}, wallets={}",
                request.getType(), key, entries.size(), wallets.size());

        return new TransactionResult(transactionId, request.getType(), key, Map.copyOf(balances), false);
    }

    /**
     * Treasury debits are bot spends; treasury credits are refunds, refills,
     * platform fees and expirations; bot credits are bot spends.
     */
    private static void checkTreasuryBoundary(TransactionType type, List<TransactionRequest.EntryLine> lines,
                                              Map<UUID, Wallet> wallets) {
        for (TransactionRequest.EntryLine line : lines) {
            Wallet wallet = wallets.get(line.getWalletId());
            boolean credit = line.getDirection() == EntryDirection.CREDIT;
            boolean permitted;
            if (wallet.getOwnerKind() == OwnerKind.TREASURY) {
                permitted = credit
                    ? type == TransactionType.EXPIRATION || (type.isTreasuryManaged() && type != TransactionType.BOT_SPEND)
                    : type == TransactionType.BOT_SPEND;
            } else if (wallet.getOwnerKind() == OwnerKind.BOT && credit) {
                permitted = type == TransactionType.BOT_SPEND;
            } else {
                permitted = true;
            }
            if (!permitted) {
                throw new InvalidEntrySetException(String.format("%s transaction may not %s %s wallet %s",
                    type, credit ? "credit" : "debit", wallet.getOwnerKind(), wallet.getId()));
            }
        }
    }

    /**
     * Locks wallets in ascending id order and returns them in that order.
     *
     * Any code path that needs several wallet locks in one transaction must go
     * through here so that all lockers agree on the order. A set containing the
     * treasury wallet takes the treasury_state lock before any wallet.
     * Locks are held until the caller's transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Map<UUID, Wallet> lockWallets(Collection<UUID> walletIds) {
        if (walletIds.contains(SystemWallets.TREASURY_WALLET_ID)) {
            ledgerStore.lockTreasuryState();
        }
        Map<UUID, Wallet> locked = new LinkedHashMap<>();
        for (UUID walletId : new TreeSet<>(walletIds)) {
            locked.put(walletId, ledgerStore.lockWallet(walletId));
        }
        return locked;
    }

    /**
     * Looks up the committed transaction that owns a key, if any.
     */
    @Transactional(readOnly = true)
    public Optional<TransactionResult> findCommitted(String idempotencyKey) {
        return ledgerStore.findCommittedByKey(idempotencyKey).map(this::replay);
    }

    @Transactional(readOnly = true)
    public LedgerTransaction getTransaction(UUID transactionId) {
        return ledgerStore.findTransaction(transactionId)
            .orElseThrow(() -> new ResourceNotFoundException("Ledger transaction", transactionId));
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getEntries(UUID transactionId) {
        return ledgerStore.findEntries(transactionId);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getRecentEntries(UUID walletId, int limit) {
        return ledgerStore.findEntriesForWallet(walletId, limit);
    }

    /**
     * Balance recomputed from entries, for audits.
     */
    @Transactional(readOnly = true)
    public long getDerivedBalance(UUID walletId) {
        return ledgerStore.deriveBalance(walletId);
    }

    private Optional<TransactionResult> replayById(UUID transactionId) {
        return ledgerStore.findTransaction(transactionId)
            .filter(tx -> tx.getStatus() == TransactionStatus.COMMITTED)
            .map(this::replay);
    }

    private TransactionResult replay(LedgerTransaction existing) {
        return new TransactionResult(
            existing.getId(),
            existing.getType(),
            existing.getIdempotencyKey(),
            ledgerStore.findBalancesAfter(existing.getId()),
            true
        );
    }

    /**
     * Keeps an audit row for a rejected attempt. Written in its own transaction
     * because the caller's transaction is about to roll back.
     */
    private void recordFailedAttempt(TransactionRequest request, EconomyException cause) {
        metrics.recordTransactionFailed(request.getType(), cause.getErrorCode());

        String key = request.getIdempotencyKey();
        if (request.getType() == null || key == null || key.isBlank()) {
            return;
        }
        try {
            failureTemplate.executeWithoutResult(status -> ledgerStore.insertFailedTransaction(
                UUID.randomUUID(), request.getType(), key, request.getMetadata(), cause.getMessage()));
            log.warn("Rejected ledger transaction: type={}, key={}, reason={}",
                    request.getType(), key, cause.getMessage());
        } catch (DataAccessException e) {
            log.error("Could not record failed attempt: key={}, reason={}, error={}",
                    key, cause.getMessage(), e.getMessage());
        }
    }
}
