package com.vaultledger.ledger;

import com.vaultledger.common.Amounts;
import com.vaultledger.common.AssetIds;
import com.vaultledger.common.LedgerErrorCode;
import com.vaultledger.common.LedgerException;
import com.vaultledger.domain.AccountActivity;
import com.vaultledger.domain.AccountActivityRepository;
import com.vaultledger.domain.AssetHolding;
import com.vaultledger.domain.AssetHoldingRepository;
import com.vaultledger.domain.LedgerBalance;
import com.vaultledger.domain.LedgerBalanceRepository;
import com.vaultledger.domain.LedgerEntry;
import com.vaultledger.domain.LedgerEntryRepository;
import com.vaultledger.domain.LedgerEntryType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-user, per-asset balances with per-asset holdings, operation counters and the journal kept in step.
 * Pure state: no valuation and no external effects. Callers run credit/debit inside their own transaction.
 */
@Service
@RequiredArgsConstructor
public class LedgerStore {

    private final LedgerBalanceRepository ledgerBalanceRepository;
    private final AssetHoldingRepository assetHoldingRepository;
    private final AccountActivityRepository accountActivityRepository;
    private final LedgerEntryRepository ledgerEntryRepository;

    /**
     * @return balance after the credit
     * @throws LedgerException NOTHING_TO_DEPOSIT if amount is zero
     */
    @Transactional
    public BigInteger credit(String userId, String assetId, BigInteger amount) {
        Amounts.requireNonNegative(amount, "amount");
        if (amount.signum() == 0) {
            throw new LedgerException(LedgerErrorCode.NOTHING_TO_DEPOSIT, "Deposit amount must be positive");
        }
        return apply(requireUser(userId), AssetIds.normalize(assetId), amount, LedgerEntryType.DEPOSIT);
    }

    /**
     * @return balance after the debit
     * @throws LedgerException NOTHING_TO_WITHDRAW if amount is zero; INSUFFICIENT_BALANCE if amount exceeds the balance
     */
    @Transactional
    public BigInteger debit(String userId, String assetId, BigInteger amount) {
        Amounts.requireNonNegative(amount, "amount");
        if (amount.signum() == 0) {
            throw new LedgerException(LedgerErrorCode.NOTHING_TO_WITHDRAW, "Withdrawal amount must be positive");
        }
        String user = requireUser(userId);
        String asset = AssetIds.normalize(assetId);
        BigInteger balance = balanceOf(user, asset);
        if (amount.compareTo(balance) > 0) {
            throw new LedgerException(LedgerErrorCode.INSUFFICIENT_BALANCE,
                    "Balance " + balance + " of " + asset + " is below " + amount);
        }
        return apply(user, asset, amount.negate(), LedgerEntryType.WITHDRAWAL);
    }

    public BigInteger balanceOf(String userId, String assetId) {
        return ledgerBalanceRepository.findByUserIdAndAssetId(requireUser(userId), AssetIds.normalize(assetId))
                .map(b -> Amounts.fromStored(b.getAmount()))
                .orElse(BigInteger.ZERO);
    }

    /**
     * Non-zero balances of a user, ordered by asset id.
     */
    public Map<String, BigInteger> balancesOf(String userId) {
        Map<String, BigInteger> balances = new LinkedHashMap<>();
        ledgerBalanceRepository.findByUserId(requireUser(userId)).stream()
                .sorted(Comparator.comparing(LedgerBalance::getAssetId))
                .forEach(b -> {
                    BigInteger amount = Amounts.fromStored(b.getAmount());
                    if (amount.signum() > 0) {
                        balances.put(b.getAssetId(), amount);
                    }
                });
        return balances;
    }

    /**
     * Total of assetId held for all users.
     */
    public BigInteger heldAmount(String assetId) {
        return assetHoldingRepository.findByAssetId(AssetIds.normalize(assetId))
                .map(h -> Amounts.fromStored(h.getAmount()))
                .orElse(BigInteger.ZERO);
    }

    /**
     * Counters of a user; a user without operations gets zeroed counters.
     */
    public AccountActivity activityOf(String userId) {
        String user = requireUser(userId);
        return accountActivityRepository.findByUserId(user).orElseGet(() -> {
            AccountActivity empty = new AccountActivity();
            empty.setUserId(user);
            return empty;
        });
    }

    public List<LedgerEntry> entries(String userId, String assetId) {
        return ledgerEntryRepository.findByUserIdAndAssetIdOrderBySequenceAsc(requireUser(userId),
                AssetIds.normalize(assetId));
    }

    private BigInteger apply(String user, String asset, BigInteger delta, LedgerEntryType type) {
        Instant now = Instant.now();

        LedgerBalance balance = ledgerBalanceRepository.findByUserIdAndAssetId(user, asset).orElseGet(() -> {
            LedgerBalance created = new LedgerBalance();
            created.setUserId(user);
            created.setAssetId(asset);
            return created;
        });
        BigInteger balanceAfter = Amounts.fromStored(balance.getAmount()).add(delta);
        balance.setAmount(Amounts.toStored(balanceAfter));
        balance.setUpdatedAt(now);
        ledgerBalanceRepository.save(balance);

        AssetHolding holding = assetHoldingRepository.findByAssetId(asset).orElseGet(() -> {
            AssetHolding created = new AssetHolding();
            created.setAssetId(asset);
            return created;
        });
        holding.setAmount(Amounts.toStored(Amounts.fromStored(holding.getAmount()).add(delta)));
        holding.setUpdatedAt(now);
        assetHoldingRepository.save(holding);

        AccountActivity activity = accountActivityRepository.findByUserId(user).orElseGet(() -> {
            AccountActivity created = new AccountActivity();
            created.setUserId(user);
            return created;
        });
        if (type == LedgerEntryType.DEPOSIT) {
            activity.setDepositCount(activity.getDepositCount() + 1);
        } else {
            activity.setWithdrawCount(activity.getWithdrawCount() + 1);
        }
        activity.setLastActivityAt(now);
        accountActivityRepository.save(activity);

        LedgerEntry entry = new LedgerEntry();
        entry.setUserId(user);
        entry.setAssetId(asset);
        entry.setType(type);
        entry.setAmount(Amounts.toStored(delta.abs()));
        entry.setBalanceAfter(Amounts.toStored(balanceAfter));
        entry.setSequence(activity.operationCount());
        entry.setRecordedAt(now);
        ledgerEntryRepository.save(entry);

        return balanceAfter;
    }

    static String requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        return userId.strip();
    }
}
