package com.tradeledger.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default channel: writes alerts to the application log at a level matching their severity.
 */
@Component
@Slf4j
public class LoggingAlertNotifier implements AlertNotifier {

    @Override
    public void notify(Alert alert) {
        switch (alert.getSeverity()) {
            case CRITICAL -> log.error("[ALERT {}] {}: {}", alert.getType(), alert.getTitle(), alert.getMessage());
            case WARNING -> log.warn("[ALERT {}] {}: {}", alert.getType(), alert.getTitle(), alert.getMessage());
            default -> log.info("[ALERT {}] {}: {}", alert.getType(), alert.getTitle(), alert.getMessage());
        }
    }
}
