package com.flagship.coin_economy.reconciliation;

import com.flagship.coin_economy.ledger.OwnerKind;
import com.flagship.coin_economy.observability.CorrelationContext;
import com.flagship.coin_economy.observability.EconomyMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Audits every wallet's cached balance against its ledger entries and checks
 * that all balances sum to zero. Read-only: drifts are reported, never repaired.
 */
@Service
@Slf4j
public class BalanceReconciliationJob {

    static final String JOB_NAME = "balance-reconciliation";
    private static final int TOP_DRIFTS = 20;

    private static final String WALLET_BALANCES_SQL = """
        SELECT w.id, w.owner_id, w.owner_kind, w.balance,
               COALESCE(SUM(CASE WHEN e.direction = 'CREDIT' THEN e.amount ELSE -e.amount END), 0) AS derived
        FROM wallets w
        LEFT JOIN ledger_entries e ON e.wallet_id = w.id
        GROUP BY w.id, w.owner_id, w.owner_kind, w.balance
        """;

    private final JdbcTemplate jdbcTemplate;
    private final EconomyMetrics metrics;
    private final Clock clock;

    public BalanceReconciliationJob(JdbcTemplate jdbcTemplate, EconomyMetrics metrics, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public ReconciliationReport run() {
        long started = System.currentTimeMillis();
        try (CorrelationContext.Scope ignored = CorrelationContext.beginJob(JOB_NAME)) {
            List<WalletDrift> drifts = new ArrayList<>();
            long[] totals = new long[2];    // wallets checked, sum of cached balances

            jdbcTemplate.query(WALLET_BALANCES_SQL, (RowCallbackHandler) rs -> {
                long cached = rs.getLong("balance");
                long derived = rs.getLong("derived");
                totals[0]++;
                totals[1] = Math.addExact(totals[1], cached);
                if (cached != derived) {
                    WalletDrift drift = new WalletDrift(
                        rs.getObject("id", UUID.class),
                        rs.getString("owner_id"),
                        OwnerKind.valueOf(rs.getString("owner_kind")),
                        cached,
                        derived);
                    drifts.add(drift);
                    log.warn("Balance drift: walletId={}, owner={}:{}, cached={}, derived={}",
                            drift.getWalletId(), drift.getOwnerKind(), drift.getOwnerId(), cached, derived);
                }
            });

            long totalDrift = drifts.stream().mapToLong(WalletDrift::getDrift).sum();
            drifts.sort(Comparator.comparingLong(WalletDrift::getDrift).reversed());

            ReconciliationReport report = ReconciliationReport.builder()
                .checkedAt(Instant.now(clock))
                .walletsChecked((int) totals[0])
                .discrepanciesFound(drifts.size())
                .totalDrift(totalDrift)
                .globalBalanceSum(totals[1])
                .topDrifts(List.copyOf(drifts.subList(0, Math.min(TOP_DRIFTS, drifts.size()))))
                .status(ReconciliationStatus.of(drifts.size(), totals[1]))
                .durationMs(System.currentTimeMillis() - started)
                .build();

            metrics.recordReconciliation(report);
            if (report.getStatus() == ReconciliationStatus.CLEAN) {
                log.info("Balance reconciliation clean: wallets={}, duration={}ms",
                        report.getWalletsChecked(), report.getDurationMs());
            } else {
                log.warn("Balance reconciliation {}: wallets={}, discrepancies={}, totalDrift={}, globalSum={}",
                        report.getStatus(), report.getWalletsChecked(), report.getDiscrepanciesFound(),
                        totalDrift, report.getGlobalBalanceSum());
            }
            return report;
        }
    }
}
