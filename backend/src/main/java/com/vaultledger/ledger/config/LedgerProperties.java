package com.vaultledger.ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;

/**
 * Ledger settings. Initial limits apply until an operator stores new values.
 */
@ConfigurationProperties(prefix = "vaultledger.ledger")
@Getter
@Setter
public class LedgerProperties {

    /** Aggregate value ceiling in common-denomination units (default 50,000 USD at 6 decimals). */
    private BigInteger initialCapacityLimit = BigInteger.valueOf(50_000_000_000L);

    /** Per-withdrawal ceiling in the withdrawn asset's base units (default 1,000 units at 18 decimals). */
    private BigInteger initialWithdrawLimit = new BigInteger("1000000000000000000000");

    /** Busy flag rejecting nested deposit/withdraw calls made from inside a transfer. */
    private boolean reentrancyGuardEnabled = true;
}
