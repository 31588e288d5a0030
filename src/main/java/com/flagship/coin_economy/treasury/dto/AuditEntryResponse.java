package com.flagship.coin_economy.treasury.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_economy.treasury.TreasuryAuditAction;
import com.flagship.coin_economy.treasury.TreasuryAuditEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class AuditEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("actor_id")
    String actorId;

    @JsonProperty("action_type")
    TreasuryAuditAction actionType;

    @JsonProperty("target_type")
    String targetType;

    @JsonProperty("target_id")
    String targetId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("previous_value")
    Map<String, Object> previousValue;

    @JsonProperty("new_value")
    Map<String, Object> newValue;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AuditEntryResponse from(TreasuryAuditEntry entry) {
        return AuditEntryResponse.builder()
            .id(entry.getId())
            .actorId(entry.getActorId())
            .actionType(entry.getAction())
            .targetType(entry.getTargetType())
            .targetId(entry.getTargetId())
            .amount(entry.getAmount())
            .previousValue(entry.getPreviousValue())
            .newValue(entry.getNewValue())
            .reason(entry.getReason())
            .transactionId(entry.getLedgerTransactionId())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
