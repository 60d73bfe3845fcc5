package com.vaultledger.api.dto;

import java.time.Instant;

public record ActivityResponse(String userId, long depositCount, long withdrawCount, Instant lastActivityAt) {
}
