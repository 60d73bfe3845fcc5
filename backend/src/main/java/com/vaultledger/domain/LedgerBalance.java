package com.vaultledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Balance of one user in one asset, in the asset's base units (integral). Never negative.
 */
@Document(collection = "ledger_balances")
@CompoundIndex(name = "user_asset", def = "{'userId': 1, 'assetId': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LedgerBalance {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private String assetId;
    private BigDecimal amount;
    private Instant updatedAt;
}
