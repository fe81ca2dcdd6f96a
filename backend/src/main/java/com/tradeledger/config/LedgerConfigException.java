package com.tradeledger.config;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Missing or invalid startup setting. Fatal: never retried, the process exits with {@link #EXIT_CODE}.
 */
public class LedgerConfigException extends RuntimeException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 2;

    public LedgerConfigException(String message) {
        super(message);
    }

    public LedgerConfigException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
