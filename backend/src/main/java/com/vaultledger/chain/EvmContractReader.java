package com.vaultledger.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultledger.chain.config.ChainRpcProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Read-only contract calls (eth_call at "latest") with endpoint rotation, backoff and a local rate limit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EvmContractReader {

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    @Qualifier("chainRpcRateLimiter")
    private final RateLimiter chainRpcRateLimiter;
    private final ChainRpcProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Call a view function and return the raw hex result.
     *
     * @param contract contract address
     * @param data     4-byte selector plus encoded arguments
     * @throws RpcException after the last attempt failed
     */
    public String call(String contract, String data) {
        List<Object> params = List.of(Map.of("to", contract, "data", data), "latest");
        Exception lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleep(rotator.retryDelayMs(attempt - 1));
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                acquirePermit();
                String json = rpcClient.call(endpoint, "eth_call", params)
                        .block(Duration.ofMillis(properties.getCallTimeoutMs()));
                return extractResult(json);
            } catch (Exception e) {
                lastException = e;
                log.debug("eth_call {} {} via {} failed (attempt {}): {}",
                        contract, data, endpoint, attempt + 1, e.getMessage());
            }
        }
        throw new RpcException("eth_call to " + contract + " failed after " + rotator.getMaxAttempts()
                + " attempts: " + messageOf(lastException), lastException);
    }

    private void acquirePermit() {
        if (!chainRpcRateLimiter.acquirePermission()) {
            throw new RpcException("Local RPC rate limit exceeded");
        }
    }

    private String extractResult(String json) throws Exception {
        if (json == null || json.isBlank()) {
            throw new RpcException("Empty RPC response");
        }
        JsonNode root = objectMapper.readTree(json);
        if (root.has("error")) {
            throw new RpcException("RPC error: " + root.get("error"));
        }
        JsonNode result = root.get("result");
        if (result == null || result.isNull() || !result.asText().startsWith("0x") || result.asText().length() <= 2) {
            throw new RpcException("RPC result is empty");
        }
        return result.asText();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during RPC retry", e);
        }
    }

    private static String messageOf(Exception e) {
        if (e == null) {
            return "unknown";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
