package com.flagship.escort_market.order;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "marketplace.reminder.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class StaleOrderReminderJob {

    private final StaleOrderReminderService reminderService;

    @Scheduled(fixedDelayString = "${marketplace.reminder.interval-ms:600000}")
    public void run() {
        try {
            reminderService.remindStaleOrders();
        } catch (Exception e) {
            log.error("Stale order reminder run failed", e);
        }
    }
}
