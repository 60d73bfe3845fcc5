package com.vaultledger.ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "vaultledger.custody")
@Getter
@Setter
public class CustodyProperties {

    /** Base URL of the custody service moving assets in and out of the ledger's wallets. */
    private String baseUrl = "http://localhost:8090";

    private long timeoutMs = 10_000;
}
