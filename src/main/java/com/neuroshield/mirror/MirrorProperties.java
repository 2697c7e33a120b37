package com.neuroshield.mirror;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Ledger mirror cache settings (neuroshield.mirror).
 */
@ConfigurationProperties(prefix = "neuroshield.mirror")
@Getter
@Setter
public class MirrorProperties {

    /**
     * Longest time a mirrored entry is served without a fresh ledger read. Bounds how long a
     * confirmed scam can be reported clean if settlement events are lost.
     */
    private Duration stalenessWindow = Duration.ofMinutes(2);

    private long maximumSize = 100_000L;
}
