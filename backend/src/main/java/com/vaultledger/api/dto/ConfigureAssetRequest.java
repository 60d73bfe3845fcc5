package com.vaultledger.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ConfigureAssetRequest(
        @NotBlank(message = "INVALID_PRICE_SOURCE")
        String priceSourceId
) {
}
