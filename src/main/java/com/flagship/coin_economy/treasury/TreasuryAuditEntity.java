package com.flagship.coin_economy.treasury;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity for treasury_audit_log. Rows are written once and never updated.
 */
@Entity
@Table(name = "treasury_audit_log")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TreasuryAuditEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "actor_id", nullable = false, updatable = false, length = 100)
    private String actorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, updatable = false, length = 30)
    private TreasuryAuditAction actionType;

    @Column(name = "target_type", nullable = false, updatable = false, length = 30)
    private String targetType;

    @Column(name = "target_id", nullable = false, updatable = false, length = 100)
    private String targetId;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Column(name = "previous_value", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> previousValue;

    @Column(name = "new_value", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> newValue;

    @Column(updatable = false, columnDefinition = "TEXT")
    private String reason;

    @Column(name = "ledger_transaction_id", nullable = false, updatable = false)
    private UUID ledgerTransactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static TreasuryAuditEntity fromDomain(TreasuryAuditEntry entry) {
        return new TreasuryAuditEntity(
            entry.getId(),
            entry.getActorId(),
            entry.getAction(),
            entry.getTargetType(),
            entry.getTargetId(),
            entry.getAmount(),
            new HashMap<>(entry.getPreviousValue()),
            new HashMap<>(entry.getNewValue()),
            entry.getReason(),
            entry.getLedgerTransactionId(),
            entry.getCreatedAt()
        );
    }

    TreasuryAuditEntry toDomain() {
        return TreasuryAuditEntry.builder()
            .id(id)
            .actorId(actorId)
            .action(actionType)
            .targetType(targetType)
            .targetId(targetId)
            .amount(amount)
            .previousValue(previousValue)
            .newValue(newValue)
            .reason(reason)
            .ledgerTransactionId(ledgerTransactionId)
            .createdAt(createdAt)
            .build();
    }
}
