package com.flagship.coin_economy.treasury;

import com.flagship.coin_economy.ledger.TransactionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Funds the treasury once on first startup. The fixed idempotency key makes
 * every later startup a replay.
 */
@Component
@Slf4j
public class TreasuryInitializer implements ApplicationRunner {

    static final String INITIAL_FUNDING_KEY = "treasury-initial-funding";

    private final TreasuryService treasuryService;
    private final long initialFunding;

    public TreasuryInitializer(TreasuryService treasuryService,
                               @Value("${economy.treasury.initial-funding:0}") long initialFunding) {
        this.treasuryService = treasuryService;
        this.initialFunding = initialFunding;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (initialFunding <= 0) {
            log.info("Initial treasury funding disabled");
            return;
        }
        TransactionResult result = treasuryService.refill(initialFunding, INITIAL_FUNDING_KEY, "system");
        if (result.isDuplicate()) {
            log.info("Treasury already funded by transaction {}", result.getTransactionId());
        } else {
            log.info("Treasury funded with {} coins", initialFunding);
        }
    }
}
