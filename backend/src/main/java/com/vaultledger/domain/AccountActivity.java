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
 * Per-user operation counters. Each successful deposit or withdrawal increments its counter exactly once;
 * counters are never decremented.
 */
@Document(collection = "account_activity")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AccountActivity {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String userId;
    private long depositCount;
    private long withdrawCount;
    private Instant lastActivityAt;

    public long operationCount() {
        return depositCount + withdrawCount;
    }
}
