package com.flagship.coin_economy.ledger;

import com.flagship.coin_economy.exception.InvalidEntrySetException;
import com.flagship.coin_economy.ledger.dto.CommitTransactionRequest;
import com.flagship.coin_economy.ledger.dto.CreateWalletRequest;
import com.flagship.coin_economy.ledger.dto.LedgerTransactionResponse;
import com.flagship.coin_economy.ledger.dto.TransactionResponse;
import com.flagship.coin_economy.ledger.dto.WalletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for the ledger engine and wallets.
 *
 * Posting requires an Idempotency-Key header. A replayed key answers 200 with
 * the original result; a first commit answers 201. Treasury-managed types are
 * refused here; they go through the treasury endpoints.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    private static final int RECENT_ENTRIES_LIMIT = 20;

    private final LedgerService ledgerService;
    private final WalletService walletService;

    @PostMapping("/api/v1/ledger/transactions")
    public ResponseEntity<TransactionResponse> commitTransaction(
            @Valid @RequestBody CommitTransactionRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        log.info("Received ledger transaction: type={}, entries={}, idempotencyKey={}",
                request.getType(), request.getEntries().size(), idempotencyKey);

        if (request.getType().isTreasuryManaged()) {
            throw new InvalidEntrySetException(request.getType() + " transactions are posted by the treasury only");
        }
        TransactionResult result = ledgerService.commit(request.toTransactionRequest(idempotencyKey));
        HttpStatus status = result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(TransactionResponse.from(result));
    }

    @GetMapping("/api/v1/ledger/transactions/{id}")
    public ResponseEntity<LedgerTransactionResponse> getTransaction(@PathVariable("id") UUID id) {
        LedgerTransaction transaction = ledgerService.getTransaction(id);
        return ResponseEntity.ok(LedgerTransactionResponse.from(transaction, ledgerService.getEntries(id)));
    }

    @GetMapping("/api/v1/ledger/wallets/{id}")
    public ResponseEntity<WalletResponse> getWallet(@PathVariable("id") UUID id) {
        Wallet wallet = walletService.getWallet(id);
        return ResponseEntity.ok(WalletResponse.from(wallet, ledgerService.getRecentEntries(id, RECENT_ENTRIES_LIMIT)));
    }

    @PostMapping("/api/v1/wallets")
    public ResponseEntity<WalletResponse> createWallet(@Valid @RequestBody CreateWalletRequest request) {
        Wallet wallet = walletService.createWallet(request.getOwnerId(), request.getOwnerKind(), request.getSpendCap());
        return ResponseEntity.status(HttpStatus.CREATED).body(WalletResponse.from(wallet, List.of()));
    }
}
