package com.vaultledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VaultLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(VaultLedgerApplication.class, args);
    }
}
