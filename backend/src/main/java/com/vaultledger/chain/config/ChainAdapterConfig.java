package com.vaultledger.chain.config;

import com.vaultledger.chain.EvmRpcClient;
import com.vaultledger.chain.RpcEndpointRotator;
import com.vaultledger.chain.WebClientEvmRpcClient;
import com.vaultledger.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(ChainRpcProperties.class)
public class ChainAdapterConfig {

    @Bean
    public RpcEndpointRotator chainRpcEndpointRotator(ChainRpcProperties properties) {
        ChainRpcProperties.Retry retry = properties.getRetry();
        RetryPolicy policy = new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
        return new RpcEndpointRotator(properties.getUrls(), policy);
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "chainRpcRateLimiter")
    public RateLimiter chainRpcRateLimiter(ChainRpcProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getRateLimitTimeoutMs())))
                .build();
        return RateLimiter.of("chain-rpc", config);
    }
}
