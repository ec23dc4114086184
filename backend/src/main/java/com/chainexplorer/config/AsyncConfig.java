package com.chainexplorer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools. The indexer worker has exactly one thread: it is the only writer of the chain store.
 */
@Configuration
public class AsyncConfig {

    public static final String INDEXER_EXECUTOR = "indexer-executor";

    @Bean(name = INDEXER_EXECUTOR)
    public ThreadPoolTaskExecutor indexerExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("indexer-");
        // the running cycle finishes its store transaction before shutdown
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }
}
