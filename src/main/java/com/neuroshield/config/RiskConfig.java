package com.neuroshield.config;

import com.neuroshield.risk.RiskProperties;
import com.neuroshield.risk.fusion.RiskFusionEngine;
import com.neuroshield.risk.ml.FraudClassifierClient;
import com.neuroshield.risk.ml.WebClientFraudClassifierClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the fusion policy chosen by neuroshield.risk.fusion-policy and the HTTP classifier client.
 */
@Configuration
@Slf4j
public class RiskConfig {

    @Bean
    public RiskFusionEngine riskFusionEngine(RiskProperties properties) {
        log.info("Risk fusion policy: {}", properties.getFusionPolicy());
        return new RiskFusionEngine(properties.getFusionPolicy().create());
    }

    public static final String ML_RATE_LIMITER = "mlClassifierRateLimiter";

    /** Never waits for a permit: the caller is on an event loop. */
    @Bean(name = ML_RATE_LIMITER)
    public RateLimiter mlClassifierRateLimiter(RiskProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMl().getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ZERO)
                .build();
        return RateLimiter.of("ml-classifier", config);
    }

    @Bean
    public FraudClassifierClient fraudClassifierClient(WebClient.Builder webClientBuilder, RiskProperties properties,
                                                       @Qualifier(ML_RATE_LIMITER) RateLimiter mlClassifierRateLimiter) {
        return new WebClientFraudClassifierClient(webClientBuilder,
                properties.getMl().getUrl(), properties.getMl().getTimeout(), mlClassifierRateLimiter);
    }
}
