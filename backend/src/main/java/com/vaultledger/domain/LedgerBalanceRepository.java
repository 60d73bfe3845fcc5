package com.vaultledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface LedgerBalanceRepository extends MongoRepository<LedgerBalance, String> {

    Optional<LedgerBalance> findByUserIdAndAssetId(String userId, String assetId);

    List<LedgerBalance> findByUserId(String userId);
}
