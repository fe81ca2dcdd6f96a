package com.tradeledger.notification;

/**
 * Outbound alerting channel. Delivery must not throw back into the ledger path.
 */
public interface AlertNotifier {

    void notify(Alert alert);
}
