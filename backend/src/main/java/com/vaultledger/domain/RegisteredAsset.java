package com.vaultledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Registry entry: asset -> price source, plus its slot in the registration order. Never removed; re-registration
 * only replaces priceSourceId.
 */
@Document(collection = "registered_assets")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class RegisteredAsset {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String assetId;
    private String priceSourceId;
    @Indexed(unique = true)
    private int position;
    private String configuredBy;
    private Instant registeredAt;
    private Instant updatedAt;
}
