package com.vaultledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "role_assignments")
@CompoundIndex(name = "principal_role", def = "{'principal': 1, 'role': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class RoleAssignment {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String principal;
    private LedgerRole role;
    private String grantedBy;
    private Instant grantedAt;
}
