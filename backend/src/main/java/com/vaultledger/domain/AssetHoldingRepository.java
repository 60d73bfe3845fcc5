package com.vaultledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface AssetHoldingRepository extends MongoRepository<AssetHolding, String> {

    Optional<AssetHolding> findByAssetId(String assetId);
}
