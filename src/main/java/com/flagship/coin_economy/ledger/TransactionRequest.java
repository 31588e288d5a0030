package com.flagship.coin_economy.ledger;

import com.flagship.coin_economy.exception.InvalidEntrySetException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Request object for committing a ledger transaction.
 *
 * Invariant: sum of debits equals sum of credits. A request that names a
 * {@link Counterparty} may be one-sided; the engine adds the balancing leg
 * against the counterparty wallet before posting.
 */
@Value
@Builder
public class TransactionRequest {
    TransactionType type;
    String idempotencyKey;
    @Singular("entry")
    List<EntryLine> entries;
    @Builder.Default
    Map<String, Object> metadata = Collections.emptyMap();
    boolean allowOverdraft;
    Counterparty counterparty;

    /**
     * Checks everything that can be checked without touching the store.
     *
     * @throws InvalidEntrySetException if the request can never be posted
     */
    public void validate() {
        if (type == null) {
            throw new InvalidEntrySetException("Transaction type is required");
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new InvalidEntrySetException("Idempotency key is required");
        }
        if (entries == null || entries.isEmpty()) {
            throw new InvalidEntrySetException("Transaction must have at least one entry");
        }
        for (EntryLine entry : entries) {
            if (entry.getAmount() <= 0) {
                throw new InvalidEntrySetException(String.format(
                    "Entry amount must be positive: wallet=%s, amount=%d", entry.getWalletId(), entry.getAmount()));
            }
        }
        if (counterparty == null && !isBalanced()) {
            throw new InvalidEntrySetException(String.format(
                "Transaction is not balanced: debits=%d, credits=%d", getDebitTotal(), getCreditTotal()));
        }
    }

    public boolean isBalanced() {
        return getDebitTotal() == getCreditTotal();
    }

    public long getDebitTotal() {
        return total(EntryDirection.DEBIT);
    }

    public long getCreditTotal() {
        return total(EntryDirection.CREDIT);
    }

    /**
     * The legs that will actually be posted: the requested entries plus, when a
     * counterparty is named and the entries do not net to zero, one balancing leg.
     */
    public List<EntryLine> balancedEntries() {
        long net = getCreditTotal() - getDebitTotal();
        if (counterparty == null || net == 0) {
            return entries;
        }
        List<EntryLine> lines = new ArrayList<>(entries);
        if (net > 0) {
            lines.add(EntryLine.debit(counterparty.walletId(), net, "Balancing leg: " + counterparty));
        } else {
            lines.add(EntryLine.credit(counterparty.walletId(), -net, "Balancing leg: " + counterparty));
        }
        return lines;
    }

    private long total(EntryDirection direction) {
        return entries.stream()
            .filter(e -> e.getDirection() == direction)
            .mapToLong(EntryLine::getAmount)
            .reduce(0L, Math::addExact);
    }

    /**
     * A single requested debit or credit.
     */
    @Value
    public static class EntryLine {
        UUID walletId;
        EntryDirection direction;
        long amount;
        String memo;

        private EntryLine(UUID walletId, EntryDirection direction, long amount, String memo) {
            this.walletId = Objects.requireNonNull(walletId, "walletId");
            this.direction = Objects.requireNonNull(direction, "direction");
            this.amount = amount;
            this.memo = memo;
        }

        public static EntryLine of(UUID walletId, EntryDirection direction, long amount, String memo) {
            return new EntryLine(walletId, direction, amount, memo);
        }

        public static EntryLine debit(UUID walletId, long amount, String memo) {
            return new EntryLine(walletId, EntryDirection.DEBIT, amount, memo);
        }

        public static EntryLine credit(UUID walletId, long amount, String memo) {
            return new EntryLine(walletId, EntryDirection.CREDIT, amount, memo);
        }
    }
}
