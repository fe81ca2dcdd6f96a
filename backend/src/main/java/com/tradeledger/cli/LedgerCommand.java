package com.tradeledger.cli;

import java.util.Locale;
import java.util.Optional;

/**
 * Commands accepted on the command line.
 */
public enum LedgerCommand {
    /** Backfill all available history once, then exit. */
    ONCE,
    /** Poll the newest page until stopped. */
    TAIL;

    public static Optional<LedgerCommand> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (LedgerCommand command : values()) {
            if (command.name().equals(value.strip().toUpperCase(Locale.ROOT))) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }
}
