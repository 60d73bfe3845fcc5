package com.vaultledger.ledger.config;

import com.vaultledger.ledger.AssetTransferGateway;
import com.vaultledger.ledger.custody.WebClientCustodyTransferGateway;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties({LedgerProperties.class, CustodyProperties.class})
public class LedgerConfig {

    @Bean
    public AssetTransferGateway assetTransferGateway(WebClient.Builder webClientBuilder,
                                                     CustodyProperties custodyProperties) {
        return new WebClientCustodyTransferGateway(webClientBuilder, custodyProperties);
    }
}
