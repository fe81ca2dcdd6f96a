package com.tradeledger.notification;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Operator-facing alert raised by the ledger or the runners.
 */
@Data
@Builder
public class Alert {

    private AlertType type;
    private AlertSeverity severity;
    private String title;
    private String message;

    @Builder.Default
    private Instant timestamp = Instant.now();
}
