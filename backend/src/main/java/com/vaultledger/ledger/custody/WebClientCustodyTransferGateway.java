package com.vaultledger.ledger.custody;

import com.fasterxml.jackson.databind.JsonNode;
import com.vaultledger.ledger.AssetTransferGateway;
import com.vaultledger.ledger.config.CustodyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Map;

/**
 * Custody service client: POST {baseUrl}/transfers/pull|push with {userId, assetId, amount}; the transfer
 * happened only when the response is {"success": true}. Not retried, since transfers are not idempotent.
 */
@Slf4j
public class WebClientCustodyTransferGateway implements AssetTransferGateway {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientCustodyTransferGateway(WebClient.Builder builder, CustodyProperties properties) {
        this.webClient = builder.baseUrl(properties.getBaseUrl()).build();
        this.timeout = Duration.ofMillis(properties.getTimeoutMs());
    }

    @Override
    public boolean pullFrom(String userId, String assetId, BigInteger amount) {
        return transfer("pull", userId, assetId, amount);
    }

    @Override
    public boolean pushTo(String userId, String assetId, BigInteger amount) {
        return transfer("push", userId, assetId, amount);
    }

    private boolean transfer(String direction, String userId, String assetId, BigInteger amount) {
        Map<String, Object> body = Map.of(
                "userId", userId,
                "assetId", assetId,
                "amount", amount.toString()
        );
        try {
            JsonNode response = webClient.post()
                    .uri("/transfers/{direction}", direction)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(timeout);
            boolean success = response != null && response.path("success").asBoolean(false);
            if (!success) {
                log.warn("Custody {} of {} {} for {} rejected: {}", direction, amount, assetId, userId, response);
            }
            return success;
        } catch (WebClientResponseException e) {
            log.warn("Custody {} of {} {} for {} failed with HTTP {}", direction, amount, assetId, userId,
                    e.getStatusCode().value());
            return false;
        }
    }
}
