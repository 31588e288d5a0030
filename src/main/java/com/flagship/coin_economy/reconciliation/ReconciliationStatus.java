package com.flagship.coin_economy.reconciliation;

public enum ReconciliationStatus {
    CLEAN,
    ACCEPTABLE,
    REQUIRES_ATTENTION;

    private static final int ACCEPTABLE_DISCREPANCIES = 10;

    /**
     * Money created or destroyed outside the ledger always needs attention,
     * however few wallets drifted.
     */
    public static ReconciliationStatus of(int discrepancies, long globalBalanceSum) {
        if (globalBalanceSum != 0) {
            return REQUIRES_ATTENTION;
        }
        if (discrepancies == 0) {
            return CLEAN;
        }
        return discrepancies < ACCEPTABLE_DISCREPANCIES ? ACCEPTABLE : REQUIRES_ATTENTION;
    }
}
