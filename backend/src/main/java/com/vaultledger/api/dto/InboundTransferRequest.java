package com.vaultledger.api.dto;

import java.math.BigInteger;

/**
 * Custody callback for value that arrived without a deposit call.
 */
public record InboundTransferRequest(String sender, String assetId, BigInteger amount) {
}
