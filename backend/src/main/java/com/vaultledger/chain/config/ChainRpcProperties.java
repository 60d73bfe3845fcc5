package com.vaultledger.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * EVM JSON-RPC settings for price feeds and token metadata. Documented in application.yml under vaultledger.chain.
 */
@ConfigurationProperties(prefix = "vaultledger.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainRpcProperties {

    /** RPC endpoints, used round-robin. */
    private List<String> urls = new ArrayList<>(List.of("https://eth.llamarpc.com"));

    /** Local budget for RPC requests per second. */
    private int maxRequestsPerSecond = 20;

    /** How long a call may wait for a local rate-limit permit. */
    private long rateLimitTimeoutMs = 1_000;

    /** Timeout for a single RPC call. */
    private long callTimeoutMs = 5_000;

    private Retry retry = new Retry();

    @Getter
    @Setter
    public static class Retry {
        /** Base delay before the first retry; doubles each attempt. */
        private long baseDelayMs = 500L;
        /** Jitter factor 0..1 (0.2 = ±20%). */
        private double jitterFactor = 0.2;
        /** Total attempts including the first call. */
        private int maxAttempts = 3;
    }
}
