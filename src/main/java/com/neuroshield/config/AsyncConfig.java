package com.neuroshield.config;

import com.neuroshield.mirror.MirrorEventListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named executors. The mirror consumer is a single thread so events are applied in publication order.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = MirrorEventListener.MIRROR_EXECUTOR)
    public Executor mirrorExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("mirror-");
        e.initialize();
        return e;
    }
}
