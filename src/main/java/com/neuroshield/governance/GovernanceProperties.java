package com.neuroshield.governance;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Governance parameters. Documented in application.yml under neuroshield.governance.
 */
@ConfigurationProperties(prefix = "neuroshield.governance")
@Getter
@Setter
public class GovernanceProperties {

    /**
     * Voting window from proposal creation to deadline. 3 days in production; test profiles shorten it.
     */
    private Duration votingPeriod = Duration.ofDays(3);

    /**
     * Minimum share of total power (percent, integer division) on the for-side for a proposal to pass.
     */
    private int passThresholdPercent = 60;

    /**
     * Scam score added to the target's trust record per passed proposal. Saturates at 100.
     */
    private int scoreStep = 25;

    /**
     * Only address allowed to credit (mint) governance tokens. Unset means crediting is disabled.
     */
    private String tokenAdmin;

    private Keeper keeper = new Keeper();

    @Getter
    @Setter
    public static class Keeper {
        /** When false, expired proposals are only settled by explicit execute calls. */
        private boolean enabled = true;
        /** Poll interval for expired proposals. */
        private long intervalMs = 60_000L;
    }
}
