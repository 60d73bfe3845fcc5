package com.vaultledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named executors: ledger-executor runs every mutating operation one at a time, in submission order;
 * notification-executor delivers committed ledger events to observers.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String LEDGER_EXECUTOR = "ledger-executor";
    public static final String NOTIFICATION_EXECUTOR = "notification-executor";

    @Bean(name = LEDGER_EXECUTOR)
    public Executor ledgerExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("ledger-");
        e.initialize();
        return e;
    }

    @Bean(name = NOTIFICATION_EXECUTOR)
    public Executor notificationExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setThreadNamePrefix("notify-");
        e.initialize();
        return e;
    }
}
