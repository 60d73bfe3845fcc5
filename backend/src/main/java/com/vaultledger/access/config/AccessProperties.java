package com.vaultledger.access.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "vaultledger.access")
@NoArgsConstructor
@Getter
@Setter
public class AccessProperties {

    /**
     * Principal granted both ADMINISTRATOR and OPERATOR on first start, when no administrator exists yet.
     * Blank disables the bootstrap.
     */
    private String bootstrapPrincipal = "";
}
