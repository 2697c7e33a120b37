package com.neuroshield.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.neuroshield.mirror.LedgerReadExpiry;
import com.neuroshield.mirror.MirrorProperties;
import com.neuroshield.mirror.MirroredTrust;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Ledger mirror cache: entries expire one staleness window after their ledger read, however many
 * events were merged since, and are then read through again.
 */
@Configuration
public class MirrorConfig {

    @Bean
    public Ticker mirrorTicker() {
        return Ticker.systemTicker();
    }

    @Bean
    public Cache<String, MirroredTrust> ledgerMirrorCache(MirrorProperties properties, Ticker mirrorTicker) {
        return Caffeine.newBuilder()
                .expireAfter(new LedgerReadExpiry(properties.getStalenessWindow()))
                .maximumSize(properties.getMaximumSize())
                .ticker(mirrorTicker)
                .build();
    }
}
