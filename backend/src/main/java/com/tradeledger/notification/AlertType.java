package com.tradeledger.notification;

public enum AlertType {
    PNL_DIVERGENCE,
    INGESTION_STALLED
}
