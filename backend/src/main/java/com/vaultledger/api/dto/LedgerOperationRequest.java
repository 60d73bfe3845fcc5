package com.vaultledger.api.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;

/**
 * Body of POST /deposits and /withdrawals. amount is in the asset's base units; zero is passed through so the
 * ledger reports NOTHING_TO_DEPOSIT / NOTHING_TO_WITHDRAW.
 */
public record LedgerOperationRequest(
        @NotBlank(message = "INVALID_ASSET")
        String assetId,

        @NotNull(message = "INVALID_AMOUNT")
        @PositiveOrZero(message = "INVALID_AMOUNT")
        @Digits(integer = 34, fraction = 0, message = "INVALID_AMOUNT")
        BigInteger amount
) {
}
