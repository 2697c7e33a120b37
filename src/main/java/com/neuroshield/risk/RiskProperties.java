package com.neuroshield.risk;

import com.neuroshield.risk.fusion.FusionPolicyType;
import com.neuroshield.risk.fusion.MlLabel;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Risk assessment settings (neuroshield.risk).
 */
@ConfigurationProperties(prefix = "neuroshield.risk")
@Getter
@Setter
public class RiskProperties {

    /**
     * Label used when the classifier is unavailable and the caller supplied no fallback.
     */
    private MlLabel fallbackLabel = MlLabel.SUSPICIOUS;

    private FusionPolicyType fusionPolicy = FusionPolicyType.ADDITIVE;

    private Ml ml = new Ml();

    @Getter
    @Setter
    public static class Ml {
        private String url = "https://ml-fraud-transaction-detection.onrender.com/predict";
        private Duration timeout = Duration.ofSeconds(10);
        /** Local cap on classifier calls; calls over the cap use the fallback label. */
        private int maxRequestsPerSecond = 5;
    }
}
