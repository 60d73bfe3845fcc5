package com.vaultledger.api.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;

public record LimitUpdateRequest(
        @NotNull(message = "INVALID_LIMIT")
        @PositiveOrZero(message = "INVALID_LIMIT")
        @Digits(integer = 34, fraction = 0, message = "INVALID_LIMIT")
        BigInteger value
) {
}
