package com.ifip.fundamentals.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
public class FundamentalsConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("fundamentalsBatchExecutor")
    ExecutorService fundamentalsBatchExecutor(FundamentalsProperties properties) {
        int threads = Math.max(1, properties.getBatchConcurrency());
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("fundamentals-batch-"));
    }
}
