package com.vaultledger.registry.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "vaultledger.registry")
@NoArgsConstructor
@Getter
@Setter
public class RegistryProperties {

    /** Upper bound for the number of registered assets; the capacity check iterates at most this many. */
    public static final int HARD_MAX_ASSETS = 64;

    /** Maximum number of registered assets (1..64). */
    private int maxAssets = 10;
}
