package com.vaultledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for the single ledger_limits document (id {@link LedgerLimits#SINGLETON_ID}).
 */
public interface LedgerLimitsRepository extends MongoRepository<LedgerLimits, String> {
}
