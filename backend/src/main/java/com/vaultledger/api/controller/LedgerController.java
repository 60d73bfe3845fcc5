package com.vaultledger.api.controller;

import com.vaultledger.api.dto.ActivityResponse;
import com.vaultledger.api.dto.BalanceResponse;
import com.vaultledger.api.dto.BalancesResponse;
import com.vaultledger.api.dto.LedgerEntryResponse;
import com.vaultledger.api.dto.LedgerOperationRequest;
import com.vaultledger.api.dto.LimitsResponse;
import com.vaultledger.api.dto.ReceiptResponse;
import com.vaultledger.api.dto.RegisteredAssetsResponse;
import com.vaultledger.api.dto.TotalValueResponse;
import com.vaultledger.api.dto.ValuationResponse;
import com.vaultledger.common.Amounts;
import com.vaultledger.common.AssetIds;
import com.vaultledger.domain.AccountActivity;
import com.vaultledger.ledger.LedgerOperationExecutor;
import com.vaultledger.ledger.LedgerQueryService;
import com.vaultledger.ledger.LedgerReceipt;
import com.vaultledger.ledger.LedgerTransactionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.util.List;

/**
 * Deposits, withdrawals and read-only ledger queries. The acting user is the X-Ledger-Principal header.
 */
@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
public class LedgerController {

    public static final String PRINCIPAL_HEADER = "X-Ledger-Principal";

    private final LedgerTransactionService ledgerTransactionService;
    private final LedgerQueryService ledgerQueryService;
    private final LedgerOperationExecutor ledgerOperationExecutor;

    @PostMapping("/deposits")
    public Mono<ReceiptResponse> deposit(@RequestHeader(name = PRINCIPAL_HEADER, required = false) String principal,
                                         @RequestBody @Valid LedgerOperationRequest request) {
        return ledgerOperationExecutor.mutate(
                        () -> ledgerTransactionService.deposit(principal, request.assetId(), request.amount()))
                .map(LedgerController::toResponse);
    }

    @PostMapping("/withdrawals")
    public Mono<ReceiptResponse> withdraw(@RequestHeader(name = PRINCIPAL_HEADER, required = false) String principal,
                                          @RequestBody @Valid LedgerOperationRequest request) {
        return ledgerOperationExecutor.mutate(
                        () -> ledgerTransactionService.withdraw(principal, request.assetId(), request.amount()))
                .map(LedgerController::toResponse);
    }

    @GetMapping("/accounts/{userId}/balances")
    public Mono<BalancesResponse> balances(@PathVariable String userId) {
        return ledgerOperationExecutor.read(() -> {
            List<BalanceResponse> balances = ledgerQueryService.balancesOf(userId).entrySet().stream()
                    .map(e -> new BalanceResponse(userId, e.getKey(), e.getValue()))
                    .toList();
            return new BalancesResponse(userId, balances);
        });
    }

    @GetMapping("/accounts/{userId}/balances/{assetId}")
    public Mono<BalanceResponse> balance(@PathVariable String userId, @PathVariable String assetId) {
        return ledgerOperationExecutor.read(() -> new BalanceResponse(userId, AssetIds.normalize(assetId),
                ledgerQueryService.balanceOf(userId, assetId)));
    }

    @GetMapping("/accounts/{userId}/activity")
    public Mono<ActivityResponse> activity(@PathVariable String userId) {
        return ledgerOperationExecutor.read(() -> {
            AccountActivity a = ledgerQueryService.activityOf(userId);
            return new ActivityResponse(a.getUserId(), a.getDepositCount(), a.getWithdrawCount(), a.getLastActivityAt());
        });
    }

    @GetMapping("/accounts/{userId}/entries")
    public Mono<List<LedgerEntryResponse>> entries(@PathVariable String userId, @RequestParam String assetId) {
        return ledgerOperationExecutor.read(() -> ledgerQueryService.entries(userId, assetId).stream()
                .map(e -> new LedgerEntryResponse(
                        e.getSequence(),
                        e.getAssetId(),
                        e.getType().name(),
                        Amounts.fromStored(e.getAmount()),
                        Amounts.fromStored(e.getBalanceAfter()),
                        e.getRecordedAt()))
                .toList());
    }

    @GetMapping("/assets")
    public Mono<RegisteredAssetsResponse> assets() {
        return ledgerOperationExecutor.read(() -> new RegisteredAssetsResponse(
                ledgerQueryService.maxAssets(),
                ledgerQueryService.registeredAssets().stream()
                        .map(a -> new RegisteredAssetsResponse.AssetEntry(
                                a.getPosition(), a.getAssetId(), a.getPriceSourceId(), a.getRegisteredAt()))
                        .toList()));
    }

    @GetMapping("/limits")
    public Mono<LimitsResponse> limits() {
        return ledgerOperationExecutor.read(() -> new LimitsResponse(
                ledgerQueryService.capacityLimit(),
                ledgerQueryService.withdrawLimit(),
                ledgerQueryService.commonDecimals()));
    }

    @GetMapping("/valuation")
    public Mono<ValuationResponse> valuation(@RequestParam String assetId, @RequestParam BigInteger amount) {
        return ledgerOperationExecutor.read(() -> new ValuationResponse(
                AssetIds.normalize(assetId),
                amount,
                ledgerQueryService.valueOf(assetId, amount),
                ledgerQueryService.commonDecimals()));
    }

    @GetMapping("/valuation/total")
    public Mono<TotalValueResponse> totalValue() {
        return ledgerOperationExecutor.read(() -> new TotalValueResponse(
                ledgerQueryService.totalValue(),
                ledgerQueryService.capacityLimit(),
                ledgerQueryService.commonDecimals()));
    }

    private static ReceiptResponse toResponse(LedgerReceipt r) {
        return new ReceiptResponse(r.userId(), r.assetId(), r.type().name(), r.amount(), r.balanceAfter());
    }
}
