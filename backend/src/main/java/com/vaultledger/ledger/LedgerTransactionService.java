package com.vaultledger.ledger;

import com.vaultledger.common.Amounts;
import com.vaultledger.common.AssetIds;
import com.vaultledger.common.LedgerErrorCode;
import com.vaultledger.common.LedgerException;
import com.vaultledger.domain.DepositedEvent;
import com.vaultledger.domain.LedgerEntryType;
import com.vaultledger.domain.WithdrewEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;

/**
 * Deposit and withdrawal. Each runs in one transaction: checks, then the ledger mutation, then the external
 * transfer. Any failure, including a failed transfer, aborts the transaction so no partial effect survives.
 * The balance is already updated when the transfer runs, so a nested withdrawal from inside the transfer
 * sees the decremented balance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerTransactionService {

    private final LedgerStore ledgerStore;
    private final CapacityGuard capacityGuard;
    private final AssetTransferGateway assetTransferGateway;
    private final ReentrancyGuard reentrancyGuard;
    private final ApplicationEventPublisher applicationEventPublisher;

    /**
     * @throws LedgerException NOTHING_TO_DEPOSIT, ASSET_NOT_REGISTERED, INVALID_PRICE, METADATA_UNAVAILABLE,
     *                         CAPACITY_EXCEEDED, FAILED_TRANSFER, REENTRANT_CALL
     */
    @Transactional
    public LedgerReceipt deposit(String userId, String assetId, BigInteger amount) {
        reentrancyGuard.enter();
        try {
            String user = LedgerStore.requireUser(userId);
            Amounts.requireNonNegative(amount, "amount");
            String asset = AssetIds.normalize(assetId);
            if (amount.signum() == 0) {
                throw new LedgerException(LedgerErrorCode.NOTHING_TO_DEPOSIT, "Deposit amount must be positive");
            }
            capacityGuard.checkCapacity(asset, amount);
            BigInteger balanceAfter = ledgerStore.credit(user, asset, amount);
            transfer(true, user, asset, amount);

            applicationEventPublisher.publishEvent(new DepositedEvent(user, asset, amount, balanceAfter));
            log.info("Deposit {} {} for {} -> balance {}", amount, asset, user, balanceAfter);
            return new LedgerReceipt(user, asset, amount, balanceAfter, LedgerEntryType.DEPOSIT);
        } finally {
            reentrancyGuard.exit();
        }
    }

    /**
     * @throws LedgerException NOTHING_TO_WITHDRAW, INSUFFICIENT_BALANCE, WITHDRAW_LIMIT_EXCEEDED, FAILED_TRANSFER,
     *                         REENTRANT_CALL
     */
    @Transactional
    public LedgerReceipt withdraw(String userId, String assetId, BigInteger amount) {
        reentrancyGuard.enter();
        try {
            String user = LedgerStore.requireUser(userId);
            Amounts.requireNonNegative(amount, "amount");
            String asset = AssetIds.normalize(assetId);
            if (amount.signum() == 0) {
                throw new LedgerException(LedgerErrorCode.NOTHING_TO_WITHDRAW, "Withdrawal amount must be positive");
            }
            BigInteger balance = ledgerStore.balanceOf(user, asset);
            if (amount.compareTo(balance) > 0) {
                throw new LedgerException(LedgerErrorCode.INSUFFICIENT_BALANCE,
                        "Balance " + balance + " of " + asset + " is below " + amount);
            }
            capacityGuard.checkWithdrawLimit(amount);
            BigInteger balanceAfter = ledgerStore.debit(user, asset, amount);
            transfer(false, user, asset, amount);

            applicationEventPublisher.publishEvent(new WithdrewEvent(user, asset, amount, balanceAfter));
            log.info("Withdrawal {} {} for {} -> balance {}", amount, asset, user, balanceAfter);
            return new LedgerReceipt(user, asset, amount, balanceAfter, LedgerEntryType.WITHDRAWAL);
        } finally {
            reentrancyGuard.exit();
        }
    }

    /**
     * Value arriving outside deposit() is never accepted.
     *
     * @throws LedgerException INVALID_DIRECT_TRANSFER, always
     */
    public void rejectDirectTransfer(String sender, String assetId, BigInteger amount) {
        log.warn("Rejected direct transfer of {} {} from {}", amount, assetId, sender);
        throw new LedgerException(LedgerErrorCode.INVALID_DIRECT_TRANSFER,
                "Direct transfers are not accepted; use deposit");
    }

    private void transfer(boolean inbound, String userId, String assetId, BigInteger amount) {
        boolean success;
        try {
            success = inbound
                    ? assetTransferGateway.pullFrom(userId, assetId, amount)
                    : assetTransferGateway.pushTo(userId, assetId, amount);
        } catch (RuntimeException e) {
            log.warn("Transfer {} {} {} for {} threw: {}", inbound ? "in" : "out", amount, assetId, userId,
                    e.getMessage());
            throw new LedgerException(LedgerErrorCode.FAILED_TRANSFER,
                    "Transfer of " + amount + " " + assetId + " failed", e);
        }
        if (!success) {
            log.warn("Transfer {} {} {} for {} failed", inbound ? "in" : "out", amount, assetId, userId);
            throw new LedgerException(LedgerErrorCode.FAILED_TRANSFER,
                    "Transfer of " + amount + " " + assetId + " failed");
        }
    }
}
