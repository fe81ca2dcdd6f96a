package com.tradeledger.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tradeledger.ingestion.tail")
@NoArgsConstructor
@Getter
@Setter
public class TailProperties {

    /** Delay between polls in ms when no --interval is given. */
    private long pollIntervalMs = 5_000L;

    /** Event uids remembered between polls; oldest are evicted first. */
    private long seenCapacity = 10_000L;
}
