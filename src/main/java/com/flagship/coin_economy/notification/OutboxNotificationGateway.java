package com.flagship.coin_economy.notification;

import com.flagship.coin_economy.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Enqueues notifications as outbox events; the outbox publisher forwards them
 * to the notifications topic.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxNotificationGateway implements NotificationGateway {

    static final String AGGREGATE_TYPE = "Notification";

    private final OutboxService outboxService;

    @Override
    @Transactional
    public void sendCoinExpiration(CoinExpirationNotice notice) {
        outboxService.saveEvent(AGGREGATE_TYPE, notice.getExpirationId(), CoinExpirationNotice.EVENT_TYPE, notice);
        log.info("Enqueued coin expiration notice: userId={}, amount={}, expirationId={}",
                notice.getUserId(), notice.getAmount(), notice.getExpirationId());
    }
}
