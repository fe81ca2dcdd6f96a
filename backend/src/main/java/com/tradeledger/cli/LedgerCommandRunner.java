package com.tradeledger.cli;

import com.tradeledger.config.LedgerConfigException;
import com.tradeledger.config.LedgerProperties;
import com.tradeledger.ingestion.config.TailProperties;
import com.tradeledger.ingestion.job.BackfillAbortedException;
import com.tradeledger.ingestion.job.BackfillRunner;
import com.tradeledger.ingestion.job.BackfillSummary;
import com.tradeledger.ingestion.job.TailRunner;
import com.tradeledger.ingestion.source.ContractNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for {@code once} and {@code tail [--interval=SECONDS]}.
 * Exit codes: 0 success, 1 backfill aborted, 2 usage or configuration error.
 */
@Component
@ConditionalOnProperty(prefix = "tradeledger.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LedgerCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_ABORTED = 1;
    static final int EXIT_USAGE = LedgerConfigException.EXIT_CODE;

    static final String USAGE = "usage: trade-ledger once | tail [--interval=SECONDS]";

    private final LedgerProperties ledgerProperties;
    private final TailProperties tailProperties;
    private final BackfillRunner backfillRunner;
    private final TailRunner tailRunner;

    private volatile int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        Optional<LedgerCommand> command = commands.size() == 1 ? LedgerCommand.parse(commands.get(0)) : Optional.empty();
        if (command.isEmpty()) {
            log.error("Unrecognized arguments {}. {}", commands, USAGE);
            return EXIT_USAGE;
        }
        try {
            ledgerProperties.validate();
            switch (command.get()) {
                case ONCE -> {
                    BackfillSummary summary = backfillRunner.run();
                    System.out.println(summary.describe());
                }
                case TAIL -> tailRunner.run(pollInterval(args));
            }
            return EXIT_OK;
        } catch (LedgerConfigException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_USAGE;
        } catch (ContractNotFoundException e) {
            log.error("Contract {} not found at the event source; check tradeledger.contract and the base URL",
                    e.getContract());
            return EXIT_USAGE;
        } catch (BackfillAbortedException e) {
            log.error("Backfill aborted after {} page(s): {}", e.getPagesCompleted(), e.getMessage(), e);
            return EXIT_ABORTED;
        }
    }

    private Duration pollInterval(ApplicationArguments args) {
        List<String> values = args.getOptionValues("interval");
        if (values == null || values.isEmpty()) {
            return Duration.ofMillis(tailProperties.getPollIntervalMs());
        }
        String value = values.get(values.size() - 1);
        try {
            long seconds = Long.parseLong(value.strip());
            if (seconds < 1) {
                throw new LedgerConfigException("--interval must be at least 1 second, got " + value);
            }
            return Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            throw new LedgerConfigException("--interval must be a whole number of seconds, got " + value, e);
        }
    }
}
