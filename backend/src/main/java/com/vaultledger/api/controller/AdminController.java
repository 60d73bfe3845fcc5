package com.vaultledger.api.controller;

import com.vaultledger.access.PermissionGate;
import com.vaultledger.api.dto.ConfigureAssetRequest;
import com.vaultledger.api.dto.ConfigureAssetResponse;
import com.vaultledger.api.dto.LimitUpdateRequest;
import com.vaultledger.api.dto.LimitsResponse;
import com.vaultledger.common.AssetIds;
import com.vaultledger.domain.LedgerRole;
import com.vaultledger.ledger.LedgerLimitsService;
import com.vaultledger.ledger.LedgerOperationExecutor;
import com.vaultledger.ledger.LedgerQueryService;
import com.vaultledger.registry.AssetRegistryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Locale;

import static com.vaultledger.api.controller.LedgerController.PRINCIPAL_HEADER;

/**
 * Permissioned mutations: asset registration, limits (OPERATOR) and role membership (ADMINISTRATOR).
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    private final AssetRegistryService assetRegistryService;
    private final LedgerLimitsService ledgerLimitsService;
    private final LedgerQueryService ledgerQueryService;
    private final PermissionGate permissionGate;
    private final LedgerOperationExecutor ledgerOperationExecutor;

    @PutMapping("/assets/{assetId}")
    public Mono<ConfigureAssetResponse> configureAsset(
            @RequestHeader(name = PRINCIPAL_HEADER, required = false) String principal,
            @PathVariable String assetId,
            @RequestBody @Valid ConfigureAssetRequest request) {
        return ledgerOperationExecutor.mutate(() -> {
            boolean added = assetRegistryService.register(principal, assetId, request.priceSourceId());
            return new ConfigureAssetResponse(AssetIds.normalize(assetId), request.priceSourceId().strip(), added);
        });
    }

    @PutMapping("/limits/capacity")
    public Mono<LimitsResponse> setCapacityLimit(
            @RequestHeader(name = PRINCIPAL_HEADER, required = false) String principal,
            @RequestBody @Valid LimitUpdateRequest request) {
        return ledgerOperationExecutor.mutate(() -> {
            ledgerLimitsService.setCapacityLimit(principal, request.value());
            return currentLimits();
        });
    }

    @PutMapping("/limits/withdraw")
    public Mono<LimitsResponse> setWithdrawLimit(
            @RequestHeader(name = PRINCIPAL_HEADER, required = false) String principal,
            @RequestBody @Valid LimitUpdateRequest request) {
        return ledgerOperationExecutor.mutate(() -> {
            ledgerLimitsService.setWithdrawLimit(principal, request.value());
            return currentLimits();
        });
    }

    @PutMapping("/roles/{role}/members/{member}")
    public Mono<ResponseEntity<Void>> grantRole(
            @RequestHeader(name = PRINCIPAL_HEADER, required = false) String principal,
            @PathVariable String role,
            @PathVariable String member) {
        return ledgerOperationExecutor.mutate(() -> {
            permissionGate.grantRole(principal, member, parseRole(role));
            return ResponseEntity.noContent().<Void>build();
        });
    }

    @DeleteMapping("/roles/{role}/members/{member}")
    public Mono<ResponseEntity<Void>> revokeRole(
            @RequestHeader(name = PRINCIPAL_HEADER, required = false) String principal,
            @PathVariable String role,
            @PathVariable String member) {
        return ledgerOperationExecutor.mutate(() -> {
            permissionGate.revokeRole(principal, member, parseRole(role));
            return ResponseEntity.noContent().<Void>build();
        });
    }

    private LimitsResponse currentLimits() {
        return new LimitsResponse(
                ledgerLimitsService.capacityLimit(),
                ledgerLimitsService.withdrawLimit(),
                ledgerQueryService.commonDecimals());
    }

    private static LedgerRole parseRole(String role) {
        try {
            return LedgerRole.valueOf(role.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown role: " + role, e);
        }
    }
}
