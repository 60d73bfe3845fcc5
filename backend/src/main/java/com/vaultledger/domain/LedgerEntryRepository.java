package com.vaultledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface LedgerEntryRepository extends MongoRepository<LedgerEntry, String> {

    List<LedgerEntry> findByUserIdAndAssetIdOrderBySequenceAsc(String userId, String assetId);
}
