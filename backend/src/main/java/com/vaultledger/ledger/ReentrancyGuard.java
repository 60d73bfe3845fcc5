package com.vaultledger.ledger;

import com.vaultledger.common.LedgerErrorCode;
import com.vaultledger.common.LedgerException;
import com.vaultledger.ledger.config.LedgerProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Busy flag held for the duration of a deposit or withdrawal. A second entry while the flag is held fails
 * immediately rather than waiting, so a stuck transfer cannot queue further operations behind a lock.
 */
@Component
public class ReentrancyGuard {

    private final AtomicBoolean busy = new AtomicBoolean(false);
    private final boolean enabled;

    public ReentrancyGuard(LedgerProperties ledgerProperties) {
        this.enabled = ledgerProperties.isReentrancyGuardEnabled();
    }

    /**
     * @throws LedgerException REENTRANT_CALL if an operation is already in flight
     */
    public void enter() {
        if (enabled && !busy.compareAndSet(false, true)) {
            throw new LedgerException(LedgerErrorCode.REENTRANT_CALL, "Ledger operation already in progress");
        }
    }

    public void exit() {
        if (enabled) {
            busy.set(false);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }
}
