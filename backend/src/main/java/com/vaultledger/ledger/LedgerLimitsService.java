package com.vaultledger.ledger;

import com.vaultledger.access.PermissionGate;
import com.vaultledger.common.Amounts;
import com.vaultledger.domain.CapacityLimitChangedEvent;
import com.vaultledger.domain.LedgerLimits;
import com.vaultledger.domain.LedgerLimitsRepository;
import com.vaultledger.domain.LedgerRole;
import com.vaultledger.domain.WithdrawLimitChangedEvent;
import com.vaultledger.ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Capacity and withdraw limits. Until an operator stores a value the configured initial limits apply. New
 * values take effect for every later operation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerLimitsService {

    private final LedgerLimitsRepository ledgerLimitsRepository;
    private final LedgerProperties ledgerProperties;
    private final PermissionGate permissionGate;
    private final ApplicationEventPublisher applicationEventPublisher;

    /** Aggregate value ceiling, common-denomination units. */
    public BigInteger capacityLimit() {
        return ledgerLimitsRepository.findById(LedgerLimits.SINGLETON_ID)
                .map(LedgerLimits::getCapacityLimit)
                .map(Amounts::fromStored)
                .orElseGet(ledgerProperties::getInitialCapacityLimit);
    }

    /** Per-withdrawal ceiling, base units of the withdrawn asset. */
    public BigInteger withdrawLimit() {
        return ledgerLimitsRepository.findById(LedgerLimits.SINGLETON_ID)
                .map(LedgerLimits::getWithdrawLimit)
                .map(Amounts::fromStored)
                .orElseGet(ledgerProperties::getInitialWithdrawLimit);
    }

    @Transactional
    public void setCapacityLimit(String principal, BigInteger value) {
        permissionGate.require(principal, LedgerRole.OPERATOR);
        Amounts.requireNonNegative(value, "capacityLimit");
        BigInteger previous = capacityLimit();
        LedgerLimits limits = loadOrInitial();
        limits.setCapacityLimit(Amounts.toStored(value));
        save(limits, principal);
        applicationEventPublisher.publishEvent(new CapacityLimitChangedEvent(principal, previous, value));
        log.info("Capacity limit changed from {} to {} by {}", previous, value, principal);
    }

    @Transactional
    public void setWithdrawLimit(String principal, BigInteger value) {
        permissionGate.require(principal, LedgerRole.OPERATOR);
        Amounts.requireNonNegative(value, "withdrawLimit");
        BigInteger previous = withdrawLimit();
        LedgerLimits limits = loadOrInitial();
        limits.setWithdrawLimit(Amounts.toStored(value));
        save(limits, principal);
        applicationEventPublisher.publishEvent(new WithdrawLimitChangedEvent(principal, previous, value));
        log.info("Withdraw limit changed from {} to {} by {}", previous, value, principal);
    }

    private LedgerLimits loadOrInitial() {
        return ledgerLimitsRepository.findById(LedgerLimits.SINGLETON_ID).orElseGet(() -> {
            LedgerLimits limits = new LedgerLimits();
            limits.setId(LedgerLimits.SINGLETON_ID);
            limits.setCapacityLimit(Amounts.toStored(ledgerProperties.getInitialCapacityLimit()));
            limits.setWithdrawLimit(Amounts.toStored(ledgerProperties.getInitialWithdrawLimit()));
            return limits;
        });
    }

    private void save(LedgerLimits limits, String principal) {
        limits.setUpdatedBy(principal);
        limits.setUpdatedAt(Instant.now());
        ledgerLimitsRepository.save(limits);
    }
}
