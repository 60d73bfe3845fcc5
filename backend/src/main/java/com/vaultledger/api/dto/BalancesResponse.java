package com.vaultledger.api.dto;

import java.util.List;

/**
 * Non-zero balances of one user.
 */
public record BalancesResponse(String userId, List<BalanceResponse> balances) {
}
