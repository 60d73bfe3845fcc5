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
 * Append-only journal line for one credit or debit. sequence is the user's operation count after the entry,
 * so entries of a user are totally ordered.
 */
@Document(collection = "ledger_entries")
@CompoundIndex(name = "user_asset_sequence", def = "{'userId': 1, 'assetId': 1, 'sequence': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LedgerEntry {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private String assetId;
    private LedgerEntryType type;
    private BigDecimal amount;
    private BigDecimal balanceAfter;
    private long sequence;
    private Instant recordedAt;
}
