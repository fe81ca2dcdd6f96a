package com.tradeledger.notification;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
