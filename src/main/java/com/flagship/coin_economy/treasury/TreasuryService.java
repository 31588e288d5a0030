package com.flagship.coin_economy.treasury;

import com.flagship.coin_economy.exception.CapExceededException;
import com.flagship.coin_economy.exception.InvalidEntrySetException;
import com.flagship.coin_economy.exception.WalletNotFoundException;
import com.flagship.coin_economy.ledger.Counterparty;
import com.flagship.coin_economy.ledger.EntryDirection;
import com.flagship.coin_economy.ledger.LedgerEntry;
import com.flagship.coin_economy.ledger.LedgerService;
import com.flagship.coin_economy.ledger.OwnerKind;
import com.flagship.coin_economy.ledger.TransactionRequest;
import com.flagship.coin_economy.ledger.TransactionResult;
import com.flagship.coin_economy.ledger.TransactionType;
import com.flagship.coin_economy.ledger.Wallet;
import com.flagship.coin_economy.ledger.WalletService;
import com.flagship.coin_economy.observability.EconomyMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.flagship.coin_economy.ledger.TransactionRequest.EntryLine;

/**
 * Central pool that funds bot activity and absorbs refunds.
 *
 * Every operation that changes treasury money or counters first locks the
 * singleton treasury_state row, then lets the ledger engine lock wallets. That
 * fixed order (state, then wallets by id) keeps treasury operations from
 * deadlocking each other and makes cap checks and counter updates atomic.
 *
 * The daily cap is date based: a counter last reset on an earlier day counts as
 * zero even if the reset job has not run yet.
 *
 * Admin refills and wallet drains are written to the treasury audit log in the
 * same transaction as the ledger posting.
 */
@Service
@Slf4j
public class TreasuryService {

    private static final String STATE_COLUMNS =
        "s.treasury_wallet_id, w.balance AS treasury_balance, s.daily_spend_cap, s.today_spent, " +
        "s.last_reset_date, s.bot_wallet_cap, s.total_spent, s.total_refunded, s.total_refilled, s.updated_at";

    static final int MAX_AUDIT_LOG_LIMIT = 500;

    private final JdbcTemplate jdbcTemplate;
    private final LedgerService ledgerService;
    private final WalletService walletService;
    private final TreasuryAuditRepository auditRepository;
    private final EconomyMetrics metrics;
    private final Clock clock;

    public TreasuryService(JdbcTemplate jdbcTemplate,
                           LedgerService ledgerService,
                           WalletService walletService,
                           TreasuryAuditRepository auditRepository,
                           EconomyMetrics metrics,
                           Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.ledgerService = ledgerService;
        this.walletService = walletService;
        this.auditRepository = auditRepository;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public TreasuryState getState() {
        return jdbcTemplate.queryForObject(
            "SELECT " + STATE_COLUMNS + " FROM treasury_state s " +
            "JOIN wallets w ON w.id = s.treasury_wallet_id WHERE s.id = 1",
            stateRowMapper()
        );
    }

    /**
     * Read-only pre-check for a bot spend. {@link #debitForBotSpend} re-checks
     * under the treasury lock, so a true answer is advisory.
     */
    @Transactional(readOnly = true)
    public boolean canAfford(String botId, long amount) {
        if (amount <= 0) {
            return false;
        }
        TreasuryState state = getState();
        if (state.getTreasuryBalance() < amount) {
            log.debug("Treasury cannot afford {} for bot {}: balance={}", amount, botId, state.getTreasuryBalance());
            return false;
        }
        long todaySpent = state.effectiveTodaySpent(today());
        if (todaySpent + amount > state.getDailySpendCap()) {
            log.debug("Daily cap would be exceeded for bot {}: spent={}, cap={}, amount={}",
                    botId, todaySpent, state.getDailySpendCap(), amount);
            return false;
        }
        Optional<Wallet> botWallet = walletService.findWallet(botId, OwnerKind.BOT);
        long botBalance = botWallet.map(Wallet::getBalance).orElse(0L);
        long botCap = botWallet.map(Wallet::getSpendCap).orElse(state.getBotWalletCap());
        return botBalance + amount <= botCap;
    }

    /**
     * Moves coins from the treasury to a bot wallet, enforcing both caps.
     *
     * @param idempotencyKey ledger key; a key already committed returns the
     *                       prior result and leaves the counters alone
     * @throws CapExceededException if the daily or bot-wallet cap would be exceeded
     * @throws com.flagship.coin_economy.exception.InsufficientBalanceException if the treasury is short
     */
    @Transactional
    public TransactionResult debitForBotSpend(String botId, long amount, String reason,
                                              String idempotencyKey, Map<String, Object> metadata) {
        requirePositive(amount);
        TreasuryState state = lockState();

        Optional<TransactionResult> prior = ledgerService.findCommitted(idempotencyKey);
        if (prior.isPresent()) {
            log.info("Bot spend already committed: botId={}, key={}", botId, idempotencyKey);
            metrics.recordBotSpend("replayed", 0);
            return prior.get();
        }

        LocalDate today = today();
        long todaySpent = rollDailyCounter(state, today);
        if (todaySpent + amount > state.getDailySpendCap()) {
            metrics.recordBotSpend("daily_cap_exceeded", amount);
            throw new CapExceededException(CapExceededException.Cap.DAILY_SPEND,
                state.getDailySpendCap(), todaySpent, amount);
        }

        Wallet botWallet = walletService.ensureWallet(botId, OwnerKind.BOT);
        long botCap = botWallet.getSpendCap() != null ? botWallet.getSpendCap() : state.getBotWalletCap();
        if (botWallet.getBalance() + amount > botCap) {
            metrics.recordBotSpend("bot_cap_exceeded", amount);
            throw new CapExceededException(CapExceededException.Cap.BOT_WALLET,
                botCap, botWallet.getBalance(), amount);
        }

        Map<String, Object> txMetadata = new HashMap<>(metadata != null ? metadata : Map.of());
        txMetadata.put("botId", botId);
        txMetadata.put("reason", reason);

        TransactionResult result = ledgerService.commit(TransactionRequest.builder()
            .type(TransactionType.BOT_SPEND)
            .idempotencyKey(idempotencyKey)
            .entry(EntryLine.debit(state.getTreasuryWalletId(), amount, "Bot spend: " + reason))
            .entry(EntryLine.credit(botWallet.getId(), amount, "Bot spend: " + reason))
            .metadata(txMetadata)
            .build());

        if (!result.isDuplicate()) {
            jdbcTemplate.update(
                "UPDATE treasury_state SET today_spent = today_spent + ?, total_spent = total_spent + ?, " +
                "updated_at = CURRENT_TIMESTAMP WHERE id = 1",
                amount, amount);
            metrics.recordBotSpend("committed", amount);
            log.info("Bot spend committed: botId={}, amount={}, reason={}, todaySpent={}",
                    botId, amount, reason, todaySpent + amount);
        }
        return result;
    }

    /**
     * Reverses a bot spend: debits the bot wallet and credits the treasury.
     * Does not give back daily budget; the cap counts gross spend for the day.
     */
    @Transactional
    public TransactionResult creditRefund(String botId, long amount, UUID actionId, String idempotencyKey) {
        requirePositive(amount);
        TreasuryState state = lockState();

        Wallet botWallet = walletService.findWallet(botId, OwnerKind.BOT)
            .orElseThrow(() -> new WalletNotFoundException(botId, OwnerKind.BOT));

        TransactionResult result = ledgerService.commit(TransactionRequest.builder()
            .type(TransactionType.REFUND)
            .idempotencyKey(idempotencyKey)
            .entry(EntryLine.debit(botWallet.getId(), amount, "Refund of bot action " + actionId))
            .entry(EntryLine.credit(state.getTreasuryWalletId(), amount, "Refund of bot action " + actionId))
            .metadata(Map.of("botId", botId, "actionId", actionId.toString()))
            .build());

        if (!result.isDuplicate()) {
            jdbcTemplate.update(
                "UPDATE treasury_state SET total_refunded = total_refunded + ?, updated_at = CURRENT_TIMESTAMP WHERE id = 1",
                amount);
            log.info("Refund credited to treasury: botId={}, actionId={}, amount={}", botId, actionId, amount);
        }
        return result;
    }

    /**
     * Mints coins into the treasury. The void wallet takes the balancing debit.
     */
    @Transactional
    public TransactionResult refill(long amount, String idempotencyKey, String actor) {
        requirePositive(amount);
        TreasuryState state = lockState();

        TransactionResult result = ledgerService.commit(TransactionRequest.builder()
            .type(TransactionType.TREASURY_REFILL)
            .idempotencyKey(idempotencyKey)
            .entry(EntryLine.credit(state.getTreasuryWalletId(), amount, "Treasury refill by " + actor))
            .counterparty(Counterparty.VOID)
            .metadata(Map.of("actor", actor))
            .build());

        if (!result.isDuplicate()) {
            jdbcTemplate.update(
                "UPDATE treasury_state SET total_refilled = total_refilled + ?, updated_at = CURRENT_TIMESTAMP WHERE id = 1",
                amount);
            long newBalance = result.balanceOf(state.getTreasuryWalletId());
            audit(actor, TreasuryAuditAction.TREASURY_REFILL, "treasury", state.getTreasuryWalletId().toString(),
                amount, state.getTreasuryBalance(), newBalance, "Manual treasury refill", result.getTransactionId());
            log.info("Treasury refilled: amount={}, actor={}, newBalance={}", amount, actor, newBalance);
        }
        return result;
    }

    /**
     * Takes a platform fee of {@code floor(balance * percentage / 100)} coins from
     * a user wallet into the treasury.
     *
     * @param percentage 0 to 100 inclusive
     * @return the drain outcome; a replayed key returns the original amounts
     * @throws IllegalArgumentException if the percentage is out of range
     * @throws WalletNotFoundException if the user has no wallet
     */
    @Transactional
    public DrainResult drainUserWallet(String userId, int percentage, String actor, String idempotencyKey) {
        if (percentage < 0 || percentage > 100) {
            throw new IllegalArgumentException("Percentage must be between 0 and 100: " + percentage);
        }
        TreasuryState state = lockState();
        Wallet wallet = walletService.findWallet(userId, OwnerKind.USER)
            .orElseThrow(() -> new WalletNotFoundException(userId, OwnerKind.USER));

        Optional<TransactionResult> prior = ledgerService.findCommitted(idempotencyKey);
        if (prior.isPresent()) {
            log.info("Wallet drain already committed: userId={}, key={}", userId, idempotencyKey);
            return replayedDrain(userId, percentage, wallet.getId(), prior.get());
        }

        long balance = ledgerService.lockWallets(List.of(state.getTreasuryWalletId(), wallet.getId()))
            .get(wallet.getId()).getBalance();
        long drainAmount = Math.multiplyExact(Math.max(balance, 0), (long) percentage) / 100;
        if (drainAmount <= 0) {
            log.info("Nothing to drain: userId={}, balance={}, percentage={}", userId, balance, percentage);
            return new DrainResult(userId, percentage, balance, 0, balance, null, false);
        }

        String reason = "Platform fee (" + percentage + "%)";
        TransactionResult result = ledgerService.commit(TransactionRequest.builder()
            .type(TransactionType.PLATFORM_FEE)
            .idempotencyKey(idempotencyKey)
            .entry(EntryLine.debit(wallet.getId(), drainAmount, reason))
            .counterparty(Counterparty.TREASURY)
            .metadata(Map.of("userId", userId, "percentage", percentage, "actor", actor))
            .build());

        long newBalance = result.balanceOf(wallet.getId());
        audit(actor, TreasuryAuditAction.WALLET_DRAIN, "user", userId, drainAmount, balance, newBalance,
            "Drained " + percentage + "% of wallet", result.getTransactionId());
        metrics.recordWalletDrain(drainAmount);
        log.info("Drained {} coins ({}%) from user {} by {}", drainAmount, percentage, userId, actor);
        return new DrainResult(userId, percentage, balance, drainAmount, newBalance, result.getTransactionId(), false);
    }

    /**
     * Admin actions, newest first.
     */
    @Transactional(readOnly = true)
    public List<TreasuryAuditEntry> getAuditLog(int limit) {
        int pageSize = Math.max(1, Math.min(limit, MAX_AUDIT_LOG_LIMIT));
        return auditRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, pageSize)).stream()
            .map(TreasuryAuditEntity::toDomain)
            .toList();
    }

    /**
     * Zeroes today's spend once per calendar day.
     *
     * @return true if this call reset the counter, false if it was already reset today
     */
    @Transactional
    public boolean resetDailySpend() {
        LocalDate today = today();
        int rows = jdbcTemplate.update(
            "UPDATE treasury_state SET today_spent = 0, last_reset_date = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = 1 AND last_reset_date < ?",
            Date.valueOf(today), Date.valueOf(today));
        boolean reset = rows == 1;
        metrics.recordDailyReset(reset);
        if (reset) {
            log.info("Daily bot spend reset for {}", today);
        } else {
            log.debug("Daily bot spend already reset for {}", today);
        }
        return reset;
    }

    @Transactional
    public TreasuryState updateLimits(Long dailySpendCap, Long botWalletCap) {
        if ((dailySpendCap != null && dailySpendCap < 0) || (botWalletCap != null && botWalletCap < 0)) {
            throw new IllegalArgumentException("Treasury limits cannot be negative");
        }
        TreasuryState state = lockState();
        jdbcTemplate.update(
            "UPDATE treasury_state SET daily_spend_cap = ?, bot_wallet_cap = ?, updated_at = CURRENT_TIMESTAMP WHERE id = 1",
            dailySpendCap != null ? dailySpendCap : state.getDailySpendCap(),
            botWalletCap != null ? botWalletCap : state.getBotWalletCap());
        log.info("Treasury limits updated: dailySpendCap={}, botWalletCap={}", dailySpendCap, botWalletCap);
        return getState();
    }

    private void audit(String actor, TreasuryAuditAction action, String targetType, String targetId, long amount,
                       long previousBalance, long newBalance, String reason, UUID transactionId) {
        auditRepository.save(TreasuryAuditEntity.fromDomain(TreasuryAuditEntry.builder()
            .id(UUID.randomUUID())
            .actorId(actor)
            .action(action)
            .targetType(targetType)
            .targetId(targetId)
            .amount(amount)
            .previousValue(Map.of("balance", previousBalance))
            .newValue(Map.of("balance", newBalance))
            .reason(reason)
            .ledgerTransactionId(transactionId)
            .createdAt(Instant.now(clock))
            .build()));
    }

    private DrainResult replayedDrain(String userId, int percentage, UUID walletId, TransactionResult prior) {
        long drained = ledgerService.getEntries(prior.getTransactionId()).stream()
            .filter(entry -> entry.getWalletId().equals(walletId) && entry.getDirection() == EntryDirection.DEBIT)
            .mapToLong(LedgerEntry::getAmount)
            .sum();
        long newBalance = prior.balanceOf(walletId);
        return new DrainResult(userId, percentage, newBalance + drained, drained, newBalance,
            prior.getTransactionId(), true);
    }

    private TreasuryState lockState() {
        return jdbcTemplate.queryForObject(
            "SELECT " + STATE_COLUMNS + " FROM treasury_state s " +
            "JOIN wallets w ON w.id = s.treasury_wallet_id WHERE s.id = 1 FOR UPDATE OF s",
            stateRowMapper()
        );
    }

    /**
     * Applies a missed daily reset while holding the treasury lock.
     */
    private long rollDailyCounter(TreasuryState state, LocalDate today) {
        if (state.getLastResetDate().isBefore(today)) {
            jdbcTemplate.update(
                "UPDATE treasury_state SET today_spent = 0, last_reset_date = ?, updated_at = CURRENT_TIMESTAMP WHERE id = 1",
                Date.valueOf(today));
            log.info("Daily bot spend rolled over lazily for {}", today);
            return 0;
        }
        return state.getTodaySpent();
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new InvalidEntrySetException("Amount must be positive: " + amount);
        }
    }

    private RowMapper<TreasuryState> stateRowMapper() {
        return (rs, rowNum) -> TreasuryState.builder()
            .treasuryWalletId(rs.getObject("treasury_wallet_id", UUID.class))
            .treasuryBalance(rs.getLong("treasury_balance"))
            .dailySpendCap(rs.getLong("daily_spend_cap"))
            .todaySpent(rs.getLong("today_spent"))
            .lastResetDate(rs.getDate("last_reset_date").toLocalDate())
            .botWalletCap(rs.getLong("bot_wallet_cap"))
            .totalSpent(rs.getLong("total_spent"))
            .totalRefunded(rs.getLong("total_refunded"))
            .totalRefilled(rs.getLong("total_refilled"))
            .updatedAt(rs.getTimestamp("updated_at").toInstant())
            .asOf(today())
            .build();
    }
}
