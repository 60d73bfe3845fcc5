package com.vaultledger.ledger;

import java.math.BigInteger;

/**
 * Moves value between a user and the ledger's custody. Implementations may call back into the ledger before
 * returning; false or an exception means the transfer did not happen.
 */
public interface AssetTransferGateway {

    boolean pullFrom(String userId, String assetId, BigInteger amount);

    boolean pushTo(String userId, String assetId, BigInteger amount);
}
