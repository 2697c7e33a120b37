package com.neuroshield.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.neuroshield.governance.proposal.ProposalQueryService;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Spring-managed Caffeine caches. Settlement evicts the per-address DAO confidence entry.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(ProposalQueryService.DAO_CONFIDENCE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(1, TimeUnit.MINUTES)
                .maximumSize(10_000)
                .build());
        return manager;
    }
}
