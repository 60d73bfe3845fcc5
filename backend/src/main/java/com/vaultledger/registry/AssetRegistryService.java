package com.vaultledger.registry;

import com.vaultledger.access.PermissionGate;
import com.vaultledger.common.AssetIds;
import com.vaultledger.common.LedgerErrorCode;
import com.vaultledger.common.LedgerException;
import com.vaultledger.domain.AssetConfiguredEvent;
import com.vaultledger.domain.LedgerRole;
import com.vaultledger.domain.RegisteredAsset;
import com.vaultledger.domain.RegisteredAssetRepository;
import com.vaultledger.registry.config.RegistryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Bounded, append-only registry of assets and their price sources. Order is registration order; an asset
 * appears once. The bound keeps the capacity aggregation cost constant.
 */
@Service
@Slf4j
public class AssetRegistryService {

    private final RegisteredAssetRepository registeredAssetRepository;
    private final PermissionGate permissionGate;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final int maxAssets;

    public AssetRegistryService(RegisteredAssetRepository registeredAssetRepository,
                                PermissionGate permissionGate,
                                ApplicationEventPublisher applicationEventPublisher,
                                RegistryProperties registryProperties) {
        int configured = registryProperties.getMaxAssets();
        if (configured < 1 || configured > RegistryProperties.HARD_MAX_ASSETS) {
            throw new IllegalStateException("vaultledger.registry.max-assets must be within 1.."
                    + RegistryProperties.HARD_MAX_ASSETS + ", got " + configured);
        }
        this.registeredAssetRepository = registeredAssetRepository;
        this.permissionGate = permissionGate;
        this.applicationEventPublisher = applicationEventPublisher;
        this.maxAssets = configured;
    }

    /**
     * Register assetId with priceSourceId, or replace the price source of an already registered asset.
     *
     * @return true if the asset was newly appended
     * @throws LedgerException UNAUTHORIZED without OPERATOR; CAPACITY_EXCEEDED if a new asset would exceed the bound
     */
    @Transactional
    public boolean register(String principal, String assetId, String priceSourceId) {
        permissionGate.require(principal, LedgerRole.OPERATOR);
        String asset = AssetIds.normalize(assetId);
        if (priceSourceId == null || priceSourceId.isBlank()) {
            throw new IllegalArgumentException("priceSourceId must not be blank");
        }
        String source = priceSourceId.strip();
        Instant now = Instant.now();

        Optional<RegisteredAsset> existing = registeredAssetRepository.findByAssetId(asset);
        RegisteredAsset entry;
        if (existing.isPresent()) {
            entry = existing.get();
        } else {
            long registered = registeredAssetRepository.count();
            if (registered >= maxAssets) {
                throw new LedgerException(LedgerErrorCode.CAPACITY_EXCEEDED,
                        "Asset registry is full (" + maxAssets + " assets)");
            }
            entry = new RegisteredAsset();
            entry.setAssetId(asset);
            entry.setPosition((int) registered);
            entry.setRegisteredAt(now);
        }
        entry.setPriceSourceId(source);
        entry.setConfiguredBy(principal);
        entry.setUpdatedAt(now);
        registeredAssetRepository.save(entry);

        boolean added = existing.isEmpty();
        applicationEventPublisher.publishEvent(new AssetConfiguredEvent(principal, asset, source, added));
        log.info("Asset {} {} with price source {} by {}", asset, added ? "registered" : "reconfigured", source, principal);
        return added;
    }

    /**
     * @throws LedgerException ASSET_NOT_REGISTERED if absent
     */
    public String lookup(String assetId) {
        return find(assetId)
                .map(RegisteredAsset::getPriceSourceId)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.ASSET_NOT_REGISTERED,
                        "Asset not registered: " + assetId));
    }

    public boolean isRegistered(String assetId) {
        return find(assetId).isPresent();
    }

    /**
     * Registered asset ids in registration order, never more than the configured bound.
     */
    public List<String> listRegistered() {
        return listEntries().stream()
                .map(RegisteredAsset::getAssetId)
                .toList();
    }

    public List<RegisteredAsset> listEntries() {
        return registeredAssetRepository.findAllByOrderByPositionAsc().stream()
                .limit(maxAssets)
                .toList();
    }

    public int getMaxAssets() {
        return maxAssets;
    }

    private Optional<RegisteredAsset> find(String assetId) {
        if (assetId == null || assetId.isBlank()) {
            return Optional.empty();
        }
        return registeredAssetRepository.findByAssetId(AssetIds.normalize(assetId));
    }
}
