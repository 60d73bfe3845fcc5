package com.vaultledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Singleton limits document. capacityLimit is in common-denomination units; withdrawLimit in the withdrawn
 * asset's base units. Changes apply to every later operation.
 */
@Document(collection = "ledger_limits")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LedgerLimits {

    public static final String SINGLETON_ID = "ledger-limits";

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private BigDecimal capacityLimit;
    private BigDecimal withdrawLimit;
    private String updatedBy;
    private Instant updatedAt;
}
