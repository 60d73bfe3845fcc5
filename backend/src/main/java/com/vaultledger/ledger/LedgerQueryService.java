package com.vaultledger.ledger;

import com.vaultledger.domain.AccountActivity;
import com.vaultledger.domain.LedgerEntry;
import com.vaultledger.domain.RegisteredAsset;
import com.vaultledger.pricing.ValuationService;
import com.vaultledger.registry.AssetRegistryService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Read-only facade used by the REST layer.
 */
@Service
@RequiredArgsConstructor
public class LedgerQueryService {

    private final LedgerStore ledgerStore;
    private final LedgerLimitsService ledgerLimitsService;
    private final CapacityGuard capacityGuard;
    private final ValuationService valuationService;
    private final AssetRegistryService assetRegistryService;

    public BigInteger balanceOf(String userId, String assetId) {
        return ledgerStore.balanceOf(userId, assetId);
    }

    public Map<String, BigInteger> balancesOf(String userId) {
        return ledgerStore.balancesOf(userId);
    }

    public AccountActivity activityOf(String userId) {
        return ledgerStore.activityOf(userId);
    }

    public List<LedgerEntry> entries(String userId, String assetId) {
        return ledgerStore.entries(userId, assetId);
    }

    public List<RegisteredAsset> registeredAssets() {
        return assetRegistryService.listEntries();
    }

    public int maxAssets() {
        return assetRegistryService.getMaxAssets();
    }

    public BigInteger capacityLimit() {
        return ledgerLimitsService.capacityLimit();
    }

    public BigInteger withdrawLimit() {
        return ledgerLimitsService.withdrawLimit();
    }

    public BigInteger valueOf(String assetId, BigInteger amount) {
        return valuationService.valueOf(assetId, amount);
    }

    public BigInteger totalValue() {
        return capacityGuard.currentTotalValue();
    }

    public int commonDecimals() {
        return valuationService.commonDecimals();
    }
}
