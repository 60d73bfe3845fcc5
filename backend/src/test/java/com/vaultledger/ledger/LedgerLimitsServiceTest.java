package com.vaultledger.ledger;

import com.vaultledger.access.PermissionGate;
import com.vaultledger.common.LedgerErrorCode;
import com.vaultledger.common.LedgerException;
import com.vaultledger.domain.CapacityLimitChangedEvent;
import com.vaultledger.domain.LedgerLimits;
import com.vaultledger.domain.LedgerLimitsRepository;
import com.vaultledger.domain.LedgerRole;
import com.vaultledger.domain.WithdrawLimitChangedEvent;
import com.vaultledger.ledger.config.LedgerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerLimitsServiceTest {

    private static final String OPERATOR = "bob";

    @Mock
    LedgerLimitsRepository ledgerLimitsRepository;
    @Mock
    PermissionGate permissionGate;
    @Mock
    ApplicationEventPublisher applicationEventPublisher;

    LedgerProperties properties;
    LedgerLimitsService limitsService;

    @BeforeEach
    void setUp() {
        properties = new LedgerProperties();
        properties.setInitialWithdrawLimit(BigInteger.TEN);
        limitsService = new LedgerLimitsService(ledgerLimitsRepository, properties, permissionGate, applicationEventPublisher);
    }

    @Test
    @DisplayName("configured initial limits apply until a value is stored")
    void initialLimits() {
        when(ledgerLimitsRepository.findById(LedgerLimits.SINGLETON_ID)).thenReturn(Optional.empty());

        assertThat(limitsService.capacityLimit()).isEqualTo(50_000_000_000L);
        assertThat(limitsService.withdrawLimit()).isEqualTo(10);
    }

    @Test
    @DisplayName("setCapacityLimit stores the value, keeps the withdraw limit and publishes the change")
    void setCapacityLimit() {
        when(ledgerLimitsRepository.findById(LedgerLimits.SINGLETON_ID)).thenReturn(Optional.empty());

        limitsService.setCapacityLimit(OPERATOR, BigInteger.valueOf(80_000_000_000L));

        ArgumentCaptor<LedgerLimits> captor = ArgumentCaptor.forClass(LedgerLimits.class);
        verify(ledgerLimitsRepository).save(captor.capture());
        assertThat(captor.getValue().getId()).isEqualTo(LedgerLimits.SINGLETON_ID);
        assertThat(captor.getValue().getCapacityLimit()).isEqualByComparingTo("80000000000");
        assertThat(captor.getValue().getWithdrawLimit()).isEqualByComparingTo("10");
        assertThat(captor.getValue().getUpdatedBy()).isEqualTo(OPERATOR);
        verify(applicationEventPublisher).publishEvent(new CapacityLimitChangedEvent(OPERATOR,
                BigInteger.valueOf(50_000_000_000L), BigInteger.valueOf(80_000_000_000L)));
    }

    @Test
    @DisplayName("setWithdrawLimit reports the previously stored value")
    void setWithdrawLimit() {
        LedgerLimits stored = new LedgerLimits();
        stored.setId(LedgerLimits.SINGLETON_ID);
        stored.setCapacityLimit(new BigDecimal("1000"));
        stored.setWithdrawLimit(new BigDecimal("25"));
        when(ledgerLimitsRepository.findById(LedgerLimits.SINGLETON_ID)).thenReturn(Optional.of(stored));

        limitsService.setWithdrawLimit(OPERATOR, BigInteger.valueOf(15));

        assertThat(stored.getWithdrawLimit()).isEqualByComparingTo("15");
        verify(applicationEventPublisher).publishEvent(
                new WithdrawLimitChangedEvent(OPERATOR, BigInteger.valueOf(25), BigInteger.valueOf(15)));
    }

    @Test
    @DisplayName("limits require OPERATOR")
    void requiresOperator() {
        doThrow(new LedgerException(LedgerErrorCode.UNAUTHORIZED, "no"))
                .when(permissionGate).require("mallory", LedgerRole.OPERATOR);

        assertThatThrownBy(() -> limitsService.setWithdrawLimit("mallory", BigInteger.ONE))
                .isInstanceOf(LedgerException.class);
        verify(ledgerLimitsRepository, never()).save(any());
        verify(applicationEventPublisher, never()).publishEvent(any());
    }

    @Test
    void negativeLimit_rejected() {
        assertThatThrownBy(() -> limitsService.setCapacityLimit(OPERATOR, BigInteger.valueOf(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        verify(ledgerLimitsRepository, never()).save(any());
    }
}
