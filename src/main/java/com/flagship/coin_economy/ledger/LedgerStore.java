package com.flagship.coin_economy.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.coin_economy.exception.WalletNotFoundException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to wallets, ledger transactions and ledger entries.
 *
 * Explicit SQL rather than JPA: the engine needs row locks, conditional inserts
 * and the exact statement order that the deferred balance trigger checks.
 * Every method expects to run inside the caller's transaction.
 */
@Repository
public class LedgerStore {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private static final String WALLET_COLUMNS =
        "id, owner_id, owner_kind, balance, lifetime_earned, lifetime_spent, spend_cap, " +
        "overdraft_allowed, version, created_at, updated_at";

    private static final String TRANSACTION_COLUMNS =
        "id, transaction_type, idempotency_key, status, metadata, failure_reason, created_at";

    private static final String ENTRY_COLUMNS =
        "id, transaction_id, wallet_id, direction, amount, balance_before, balance_after, memo, sequence_number, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public LedgerStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    // ==================== Wallets ====================

    public void insertWallet(Wallet wallet) {
        jdbcTemplate.update(
            "INSERT INTO wallets (id, owner_id, owner_kind, balance, spend_cap, overdraft_allowed) " +
            "VALUES (?, ?, ?, 0, ?, ?)",
            wallet.getId(),
            wallet.getOwnerId(),
            wallet.getOwnerKind().name(),
            wallet.getSpendCap(),
            wallet.isOverdraftAllowed()
        );
    }

    /**
     * Inserts the wallet unless one already exists for the same owner.
     *
     * @return true if a new row was written
     */
    public boolean insertWalletIfAbsent(Wallet wallet) {
        int rows = jdbcTemplate.update(
            "INSERT INTO wallets (id, owner_id, owner_kind, balance, spend_cap, overdraft_allowed) " +
            "VALUES (?, ?, ?, 0, ?, ?) ON CONFLICT (owner_id, owner_kind) DO NOTHING",
            wallet.getId(),
            wallet.getOwnerId(),
            wallet.getOwnerKind().name(),
            wallet.getSpendCap(),
            wallet.isOverdraftAllowed()
        );
        return rows == 1;
    }

    public Optional<Wallet> findWallet(UUID walletId) {
        List<Wallet> wallets = jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE id = ?",
            walletRowMapper(),
            walletId
        );
        return wallets.stream().findFirst();
    }

    public Optional<Wallet> findWalletByOwner(String ownerId, OwnerKind ownerKind) {
        List<Wallet> wallets = jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE owner_id = ? AND owner_kind = ?",
            walletRowMapper(),
            ownerId,
            ownerKind.name()
        );
        return wallets.stream().findFirst();
    }

    /**
     * Locks a wallet row for the rest of the transaction.
     * Callers locking several wallets must do so in ascending id order.
     */
    public Wallet lockWallet(UUID walletId) {
        List<Wallet> wallets = jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE id = ? FOR UPDATE",
            walletRowMapper(),
            walletId
        );
        return wallets.stream().findFirst().orElseThrow(() -> new WalletNotFoundException(walletId));
    }

    /**
     * Locks the singleton treasury_state row. Taken before any wallet lock, the
     * same order the treasury uses; re-locking inside the same transaction is a no-op.
     */
    public void lockTreasuryState() {
        jdbcTemplate.queryForObject("SELECT id FROM treasury_state WHERE id = 1 FOR UPDATE", Integer.class);
    }

    /**
     * Writes the new cached balance and lifetime counters.
     * The version check cannot fail while the row is locked; a mismatch means
     * the wallet was written outside the engine.
     */
    public void updateWalletBalance(Wallet wallet, long balance, long lifetimeEarned, long lifetimeSpent) {
        int rows = jdbcTemplate.update(
            "UPDATE wallets SET balance = ?, lifetime_earned = ?, lifetime_spent = ?, " +
            "version = version + 1, updated_at = CURRENT_TIMESTAMP WHERE id = ? AND version = ?",
            balance,
            lifetimeEarned,
            lifetimeSpent,
            wallet.getId(),
            wallet.getVersion()
        );
        if (rows != 1) {
            throw new IllegalStateException("Concurrent modification of wallet " + wallet.getId());
        }
    }

    public int updateSpendCap(UUID walletId, Long spendCap) {
        return jdbcTemplate.update(
            "UPDATE wallets SET spend_cap = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            spendCap,
            walletId
        );
    }

    // ==================== Transactions ====================

    /**
     * Inserts a COMMITTED transaction header unless the key is already committed.
     *
     * A concurrent insert of the same key blocks here until the other transaction
     * ends; if it committed, this returns false and the caller replays it.
     *
     * @return true if this call owns the key
     */
    public boolean insertCommittedTransaction(UUID transactionId, TransactionType type,
                                              String idempotencyKey, Map<String, Object> metadata) {
        int rows = jdbcTemplate.update(
            "INSERT INTO ledger_transactions (id, transaction_type, idempotency_key, status, metadata, created_at) " +
            "VALUES (?, ?, ?, 'COMMITTED', CAST(? AS jsonb), CURRENT_TIMESTAMP) " +
            "ON CONFLICT (idempotency_key) WHERE status = 'COMMITTED' DO NOTHING",
            transactionId,
            type.name(),
            idempotencyKey,
            toJson(metadata)
        );
        return rows == 1;
    }

    public void insertFailedTransaction(UUID transactionId, TransactionType type, String idempotencyKey,
                                        Map<String, Object> metadata, String failureReason) {
        jdbcTemplate.update(
            "INSERT INTO ledger_transactions (id, transaction_type, idempotency_key, status, metadata, failure_reason, created_at) " +
            "VALUES (?, ?, ?, 'FAILED', CAST(? AS jsonb), ?, CURRENT_TIMESTAMP)",
            transactionId,
            type.name(),
            idempotencyKey,
            toJson(metadata),
            failureReason
        );
    }

    public Optional<LedgerTransaction> findTransaction(UUID transactionId) {
        List<LedgerTransaction> transactions = jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM ledger_transactions WHERE id = ?",
            transactionRowMapper(),
            transactionId
        );
        return transactions.stream().findFirst();
    }

    public Optional<LedgerTransaction> findCommittedByKey(String idempotencyKey) {
        List<LedgerTransaction> transactions = jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM ledger_transactions " +
            "WHERE idempotency_key = ? AND status = 'COMMITTED'",
            transactionRowMapper(),
            idempotencyKey
        );
        return transactions.stream().findFirst();
    }

    // ==================== Entries ====================

    public void insertEntry(LedgerEntry entry) {
        jdbcTemplate.update(
            "INSERT INTO ledger_entries (id, transaction_id, wallet_id, direction, amount, balance_before, balance_after, memo, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            entry.getId(),
            entry.getTransactionId(),
            entry.getWalletId(),
            entry.getDirection().name(),
            entry.getAmount(),
            entry.getBalanceBefore(),
            entry.getBalanceAfter(),
            entry.getMemo()
        );
    }

    public List<LedgerEntry> findEntries(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE transaction_id = ? ORDER BY sequence_number",
            entryRowMapper(),
            transactionId
        );
    }

    public List<LedgerEntry> findEntriesForWallet(UUID walletId, int limit) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE wallet_id = ? " +
            "ORDER BY sequence_number DESC LIMIT ?",
            entryRowMapper(),
            walletId,
            limit
        );
    }

    /**
     * Balance of each wallet right after the given transaction, taken from the
     * last entry the transaction wrote for that wallet.
     */
    public Map<UUID, Long> findBalancesAfter(UUID transactionId) {
        Map<UUID, Long> balances = new LinkedHashMap<>();
        for (LedgerEntry entry : findEntries(transactionId)) {
            balances.put(entry.getWalletId(), entry.getBalanceAfter());
        }
        return balances;
    }

    /**
     * Balance derived from the entries alone, independent of the cached column.
     */
    public long deriveBalance(UUID walletId) {
        Long balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN direction = 'CREDIT' THEN amount ELSE -amount END), 0) " +
            "FROM ledger_entries WHERE wallet_id = ?",
            Long.class,
            walletId
        );
        return balance != null ? balance : 0L;
    }

    // ==================== Row mappers ====================

    private RowMapper<Wallet> walletRowMapper() {
        return (rs, rowNum) -> Wallet.builder()
            .id(rs.getObject("id", UUID.class))
            .ownerId(rs.getString("owner_id"))
            .ownerKind(OwnerKind.valueOf(rs.getString("owner_kind")))
            .balance(rs.getLong("balance"))
            .lifetimeEarned(rs.getLong("lifetime_earned"))
            .lifetimeSpent(rs.getLong("lifetime_spent"))
            .spendCap(rs.getObject("spend_cap") != null ? rs.getLong("spend_cap") : null)
            .overdraftAllowed(rs.getBoolean("overdraft_allowed"))
            .version(rs.getLong("version"))
            .createdAt(toInstant(rs, "created_at"))
            .updatedAt(toInstant(rs, "updated_at"))
            .build();
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new LedgerTransaction(
            rs.getObject("id", UUID.class),
            TransactionType.valueOf(rs.getString("transaction_type")),
            rs.getString("idempotency_key"),
            TransactionStatus.valueOf(rs.getString("status")),
            fromJson(rs.getString("metadata")),
            rs.getString("failure_reason"),
            toInstant(rs, "created_at")
        );
    }

    private RowMapper<LedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getObject("id", UUID.class),
            rs.getObject("transaction_id", UUID.class),
            rs.getObject("wallet_id", UUID.class),
            EntryDirection.valueOf(rs.getString("direction")),
            rs.getLong("amount"),
            rs.getLong("balance_before"),
            rs.getLong("balance_after"),
            rs.getString("memo"),
            rs.getLong("sequence_number"),
            toInstant(rs, "created_at")
        );
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata != null ? metadata : Collections.emptyMap());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Transaction metadata is not serializable", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored transaction metadata is not valid JSON", e);
        }
    }
}
