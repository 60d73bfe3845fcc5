package com.vaultledger.ledger;

import com.vaultledger.config.AsyncConfig;
import com.vaultledger.domain.AssetConfiguredEvent;
import com.vaultledger.domain.CapacityLimitChangedEvent;
import com.vaultledger.domain.DepositedEvent;
import com.vaultledger.domain.RoleChangedEvent;
import com.vaultledger.domain.WithdrawLimitChangedEvent;
import com.vaultledger.domain.WithdrewEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Notification sink. Events arrive after the publishing transaction commits, so rolled-back operations are
 * never announced.
 */
@Component
@Slf4j
public class LedgerNotificationListener {

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(fallbackExecution = true)
    public void onDeposited(DepositedEvent event) {
        log.info("Deposited user={} asset={} amount={} balance={}",
                event.userId(), event.assetId(), event.amount(), event.balanceAfter());
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(fallbackExecution = true)
    public void onWithdrew(WithdrewEvent event) {
        log.info("Withdrew user={} asset={} amount={} balance={}",
                event.userId(), event.assetId(), event.amount(), event.balanceAfter());
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(fallbackExecution = true)
    public void onAssetConfigured(AssetConfiguredEvent event) {
        log.info("AssetConfigured principal={} asset={} priceSource={} new={}",
                event.principal(), event.assetId(), event.priceSourceId(), event.newlyRegistered());
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(fallbackExecution = true)
    public void onCapacityLimitChanged(CapacityLimitChangedEvent event) {
        log.info("CapacityLimitChanged principal={} from={} to={}",
                event.principal(), event.previousLimit(), event.newLimit());
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(fallbackExecution = true)
    public void onWithdrawLimitChanged(WithdrawLimitChangedEvent event) {
        log.info("WithdrawLimitChanged principal={} from={} to={}",
                event.principal(), event.previousLimit(), event.newLimit());
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(fallbackExecution = true)
    public void onRoleChanged(RoleChangedEvent event) {
        log.info("RoleChanged actor={} principal={} role={} granted={}",
                event.actor(), event.principal(), event.role(), event.granted());
    }
}
