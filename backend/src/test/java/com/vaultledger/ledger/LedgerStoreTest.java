package com.vaultledger.ledger;

import com.vaultledger.common.Amounts;
import com.vaultledger.common.AssetIds;
import com.vaultledger.common.LedgerErrorCode;
import com.vaultledger.common.LedgerException;
import com.vaultledger.domain.LedgerEntry;
import com.vaultledger.domain.LedgerEntryType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class LedgerStoreTest {

    private static final String USER = "user-1";
    private static final String USDC = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";

    InMemoryLedgerRepositories repositories;
    LedgerStore store;

    @BeforeEach
    void setUp() {
        repositories = new InMemoryLedgerRepositories();
        store = repositories.store();
    }

    @Test
    @DisplayName("credit increases balance, holdings and the deposit counter")
    void credit() {
        BigInteger after = store.credit(USER, AssetIds.NATIVE, BigInteger.valueOf(100));

        assertThat(after).isEqualTo(100);
        assertThat(store.balanceOf(USER, AssetIds.NATIVE)).isEqualTo(100);
        assertThat(store.heldAmount(AssetIds.NATIVE)).isEqualTo(100);
        assertThat(store.activityOf(USER).getDepositCount()).isEqualTo(1);
        assertThat(store.activityOf(USER).getWithdrawCount()).isZero();
    }

    @Test
    @DisplayName("a credit that would take the balance past 34 digits is rejected and the balance kept")
    void credit_beyondStoredPrecision() {
        BigInteger widest = BigInteger.TEN.pow(Amounts.MAX_STORED_DIGITS).subtract(BigInteger.ONE);
        store.credit(USER, AssetIds.NATIVE, widest);

        assertThatThrownBy(() -> store.credit(USER, AssetIds.NATIVE, BigInteger.ONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.balanceOf(USER, AssetIds.NATIVE)).isEqualTo(widest);
        assertThat(store.activityOf(USER).getDepositCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("debit decreases balance and holdings and counts a withdrawal")
    void debit() {
        store.credit(USER, AssetIds.NATIVE, BigInteger.valueOf(100));
        store.credit("user-2", AssetIds.NATIVE, BigInteger.valueOf(50));

        BigInteger after = store.debit(USER, AssetIds.NATIVE, BigInteger.valueOf(40));

        assertThat(after).isEqualTo(60);
        assertThat(store.heldAmount(AssetIds.NATIVE)).isEqualTo(110);
        assertThat(store.activityOf(USER).getWithdrawCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("debit above the balance fails INSUFFICIENT_BALANCE and changes nothing")
    void debit_insufficient() {
        store.credit(USER, AssetIds.NATIVE, BigInteger.valueOf(10));

        assertThatThrownBy(() -> store.debit(USER, AssetIds.NATIVE, BigInteger.valueOf(11)))
                .isInstanceOf(LedgerException.class)
                .satisfies(e -> assertThat(((LedgerException) e).getErrorCode()).isEqualTo(LedgerErrorCode.INSUFFICIENT_BALANCE));
        assertThat(store.balanceOf(USER, AssetIds.NATIVE)).isEqualTo(10);
        assertThat(store.activityOf(USER).getWithdrawCount()).isZero();
    }

    @Test
    @DisplayName("zero amounts fail NOTHING_TO_DEPOSIT / NOTHING_TO_WITHDRAW")
    void zeroAmounts() {
        assertThatThrownBy(() -> store.credit(USER, USDC, BigInteger.ZERO))
                .satisfies(e -> assertThat(((LedgerException) e).getErrorCode()).isEqualTo(LedgerErrorCode.NOTHING_TO_DEPOSIT));
        assertThatThrownBy(() -> store.debit(USER, USDC, BigInteger.ZERO))
                .satisfies(e -> assertThat(((LedgerException) e).getErrorCode()).isEqualTo(LedgerErrorCode.NOTHING_TO_WITHDRAW));
        assertThat(repositories.entries).isEmpty();
    }

    @Test
    void negativeAmount_throws() {
        assertThatThrownBy(() -> store.credit(USER, USDC, BigInteger.valueOf(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("journal is ordered and deposits minus withdrawals equal the balance")
    void journalMatchesBalance() {
        store.credit(USER, USDC, BigInteger.valueOf(500));
        store.debit(USER, USDC, BigInteger.valueOf(120));
        store.credit(USER, AssetIds.NATIVE, BigInteger.valueOf(7));
        store.credit(USER, USDC, BigInteger.valueOf(30));
        store.debit(USER, USDC, BigInteger.valueOf(410));

        List<LedgerEntry> entries = store.entries(USER, USDC);
        assertThat(entries).extracting(LedgerEntry::getSequence).containsExactly(1L, 2L, 4L, 5L);
        assertThat(entries).extracting(LedgerEntry::getType).containsExactly(
                LedgerEntryType.DEPOSIT, LedgerEntryType.WITHDRAWAL, LedgerEntryType.DEPOSIT, LedgerEntryType.WITHDRAWAL);

        BigInteger net = entries.stream()
                .map(e -> e.getType() == LedgerEntryType.DEPOSIT
                        ? Amounts.fromStored(e.getAmount())
                        : Amounts.fromStored(e.getAmount()).negate())
                .reduce(BigInteger.ZERO, BigInteger::add);
        assertThat(net).isEqualTo(store.balanceOf(USER, USDC)).isZero();
        assertThat(Amounts.fromStored(entries.get(entries.size() - 1).getBalanceAfter())).isZero();
        assertThat(store.activityOf(USER).operationCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("balancesOf lists non-zero balances ordered by asset")
    void balancesOf() {
        store.credit(USER, USDC, BigInteger.valueOf(5));
        store.credit(USER, AssetIds.NATIVE, BigInteger.valueOf(9));
        store.credit(USER, "0xdac17f958d2ee523a2206206994597c13d831ec7", BigInteger.valueOf(3));
        store.debit(USER, "0xdac17f958d2ee523a2206206994597c13d831ec7", BigInteger.valueOf(3));

        assertThat(store.balancesOf(USER)).containsExactly(
                entry(AssetIds.NATIVE, BigInteger.valueOf(9)),
                entry(USDC, BigInteger.valueOf(5)));
    }

    @Test
    void activityOf_unknownUser_isZero() {
        assertThat(store.activityOf("nobody").operationCount()).isZero();
        assertThat(store.balanceOf("nobody", USDC)).isZero();
    }

    @Test
    void assetIdsAreNormalized() {
        store.credit(USER, "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48", BigInteger.ONE);

        assertThat(store.balanceOf(USER, USDC)).isEqualTo(1);
    }
}
