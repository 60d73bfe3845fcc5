package com.vaultledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface AccountActivityRepository extends MongoRepository<AccountActivity, String> {

    Optional<AccountActivity> findByUserId(String userId);
}
