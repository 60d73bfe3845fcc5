package com.vaultledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface RoleAssignmentRepository extends MongoRepository<RoleAssignment, String> {

    boolean existsByPrincipalAndRole(String principal, LedgerRole role);

    boolean existsByRole(LedgerRole role);

    List<RoleAssignment> findByRole(LedgerRole role);

    long deleteByPrincipalAndRole(String principal, LedgerRole role);
}
