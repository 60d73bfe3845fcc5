package com.vaultledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for registered_assets. Used by AssetRegistryService only.
 */
public interface RegisteredAssetRepository extends MongoRepository<RegisteredAsset, String> {

    Optional<RegisteredAsset> findByAssetId(String assetId);

    List<RegisteredAsset> findAllByOrderByPositionAsc();
}
