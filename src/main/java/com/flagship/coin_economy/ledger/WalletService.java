package com.flagship.coin_economy.ledger;

import com.flagship.coin_economy.exception.WalletNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Wallet lifecycle. Balances are never written here; only the ledger engine moves coins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletService {

    private final LedgerStore ledgerStore;

    /**
     * Creates a wallet for an owner.
     *
     * @throws org.springframework.dao.DuplicateKeyException if the owner already has one
     */
    @Transactional
    public Wallet createWallet(String ownerId, OwnerKind ownerKind, Long spendCap) {
        requireCreatable(ownerKind);
        Wallet wallet = newWallet(ownerId, ownerKind, spendCap);
        ledgerStore.insertWallet(wallet);
        log.info("Created wallet: walletId={}, owner={}:{}", wallet.getId(), ownerKind, ownerId);
        return getWallet(wallet.getId());
    }

    /**
     * Returns the owner's wallet, creating an empty one on first use.
     * Safe under concurrent first use by the same owner.
     */
    @Transactional
    public Wallet ensureWallet(String ownerId, OwnerKind ownerKind) {
        Optional<Wallet> existing = ledgerStore.findWalletByOwner(ownerId, ownerKind);
        if (existing.isPresent()) {
            return existing.get();
        }
        requireCreatable(ownerKind);
        if (ledgerStore.insertWalletIfAbsent(newWallet(ownerId, ownerKind, null))) {
            log.info("Created wallet on first use: owner={}:{}", ownerKind, ownerId);
        }
        return ledgerStore.findWalletByOwner(ownerId, ownerKind)
            .orElseThrow(() -> new WalletNotFoundException(ownerId, ownerKind));
    }

    @Transactional(readOnly = true)
    public Optional<Wallet> findWallet(String ownerId, OwnerKind ownerKind) {
        return ledgerStore.findWalletByOwner(ownerId, ownerKind);
    }

    @Transactional(readOnly = true)
    public Wallet getWallet(UUID walletId) {
        return ledgerStore.findWallet(walletId)
            .orElseThrow(() -> new WalletNotFoundException(walletId));
    }

    @Transactional
    public Wallet updateSpendCap(UUID walletId, Long spendCap) {
        if (spendCap != null && spendCap < 0) {
            throw new IllegalArgumentException("Spend cap cannot be negative");
        }
        if (ledgerStore.updateSpendCap(walletId, spendCap) == 0) {
            throw new WalletNotFoundException(walletId);
        }
        return getWallet(walletId);
    }

    private static Wallet newWallet(String ownerId, OwnerKind ownerKind, Long spendCap) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner id is required");
        }
        return Wallet.builder()
            .id(UUID.randomUUID())
            .ownerId(ownerId)
            .ownerKind(ownerKind)
            .spendCap(spendCap)
            .overdraftAllowed(false)
            .build();
    }

    private static void requireCreatable(OwnerKind ownerKind) {
        if (ownerKind == OwnerKind.TREASURY || ownerKind == OwnerKind.SYSTEM) {
            throw new IllegalArgumentException(ownerKind + " wallets are provisioned by migration");
        }
    }
}
