package com.vaultledger.ledger;

import com.vaultledger.common.LedgerErrorCode;
import com.vaultledger.common.LedgerException;
import com.vaultledger.pricing.ValuationService;
import com.vaultledger.registry.AssetRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Mark-to-market capacity check and flat withdraw ceiling. Aggregation visits at most the registry bound of
 * assets, one holdings lookup and one valuation each, and is recomputed from current prices on every call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CapacityGuard {

    private final AssetRegistryService assetRegistryService;
    private final ValuationService valuationService;
    private final LedgerStore ledgerStore;
    private final LedgerLimitsService ledgerLimitsService;

    /**
     * @throws LedgerException CAPACITY_EXCEEDED if current value plus the incoming value exceeds the capacity limit;
     *                         valuation errors of any held or incoming asset propagate
     */
    public void checkCapacity(String incomingAssetId, BigInteger incomingAmount) {
        BigInteger current = currentTotalValue();
        BigInteger incoming = valuationService.valueOf(incomingAssetId, incomingAmount);
        BigInteger total = current.add(incoming);
        BigInteger limit = ledgerLimitsService.capacityLimit();
        if (total.compareTo(limit) > 0) {
            log.info("Capacity check failed for {} {}: {} + {} > {}", incomingAmount, incomingAssetId,
                    current, incoming, limit);
            throw new LedgerException(LedgerErrorCode.CAPACITY_EXCEEDED,
                    "Total value " + total + " would exceed capacity limit " + limit);
        }
    }

    /**
     * Value of everything held, in common-denomination units. Assets with zero holdings are skipped.
     */
    public BigInteger currentTotalValue() {
        BigInteger total = BigInteger.ZERO;
        for (String assetId : assetRegistryService.listRegistered()) {
            BigInteger held = ledgerStore.heldAmount(assetId);
            if (held.signum() > 0) {
                total = total.add(valuationService.valueOf(assetId, held));
            }
        }
        return total;
    }

    /**
     * @throws LedgerException WITHDRAW_LIMIT_EXCEEDED if amount is above the withdraw limit
     */
    public void checkWithdrawLimit(BigInteger amount) {
        BigInteger limit = ledgerLimitsService.withdrawLimit();
        if (amount.compareTo(limit) > 0) {
            throw new LedgerException(LedgerErrorCode.WITHDRAW_LIMIT_EXCEEDED,
                    "Withdrawal " + amount + " exceeds limit " + limit);
        }
    }
}
