package com.flagship.coin_economy.treasury;

import com.flagship.coin_economy.ledger.TransactionResult;
import com.flagship.coin_economy.ledger.dto.TransactionResponse;
import com.flagship.coin_economy.treasury.dto.AuditEntryResponse;
import com.flagship.coin_economy.treasury.dto.DrainRequest;
import com.flagship.coin_economy.treasury.dto.DrainResponse;
import com.flagship.coin_economy.treasury.dto.RefillRequest;
import com.flagship.coin_economy.treasury.dto.TreasuryResponse;
import com.flagship.coin_economy.treasury.dto.UpdateLimitsRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Admin endpoints for the treasury.
 */
@RestController
@RequestMapping("/api/v1/treasury")
@RequiredArgsConstructor
@Slf4j
public class TreasuryController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final TreasuryService treasuryService;

    @GetMapping
    public ResponseEntity<TreasuryResponse> getTreasury() {
        return ResponseEntity.ok(TreasuryResponse.from(treasuryService.getState()));
    }

    /**
     * Mints coins into the treasury. Replaying the same Idempotency-Key returns
     * the original transaction with 200 instead of 201.
     */
    @PostMapping("/refill")
    public ResponseEntity<TransactionResponse> refill(
            @Valid @RequestBody RefillRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        log.info("Received treasury refill request: amount={}, actor={}, idempotencyKey={}",
                request.getAmount(), request.getActor(), idempotencyKey);

        TransactionResult result = treasuryService.refill(request.getAmount(), idempotencyKey, request.getActor());
        HttpStatus status = result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(TransactionResponse.from(result));
    }

    /**
     * Takes a platform fee from a user wallet. 201 when coins moved, 200 for a
     * replay or when the percentage yields nothing.
     */
    @PostMapping("/drain")
    public ResponseEntity<DrainResponse> drain(
            @Valid @RequestBody DrainRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        log.info("Received wallet drain request: userId={}, percentage={}, actor={}, idempotencyKey={}",
                request.getUserId(), request.getPercentage(), request.getActor(), idempotencyKey);

        DrainResult result = treasuryService.drainUserWallet(
            request.getUserId(), request.getPercentage(), request.getActor(), idempotencyKey);
        HttpStatus status = result.isDuplicate() || result.getTransactionId() == null
            ? HttpStatus.OK
            : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(DrainResponse.from(result));
    }

    @GetMapping("/audit")
    public ResponseEntity<List<AuditEntryResponse>> getAuditLog(
            @RequestParam(name = "limit", defaultValue = "100") int limit) {
        return ResponseEntity.ok(treasuryService.getAuditLog(limit).stream()
            .map(AuditEntryResponse::from)
            .toList());
    }

    @PutMapping("/limits")
    public ResponseEntity<TreasuryResponse> updateLimits(@Valid @RequestBody UpdateLimitsRequest request) {
        TreasuryState state = treasuryService.updateLimits(request.getDailySpendCap(), request.getBotWalletCap());
        return ResponseEntity.ok(TreasuryResponse.from(state));
    }
}
