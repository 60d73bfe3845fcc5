package com.vaultledger.pricing;

import com.vaultledger.common.AssetIds;
import com.vaultledger.common.LedgerErrorCode;
import com.vaultledger.common.LedgerException;
import com.vaultledger.pricing.config.ValuationProperties;
import com.vaultledger.registry.AssetRegistryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ValuationServiceTest {

    private static final String ETH_FEED = "0x5f4ec3df9cbd43714fe2740f5e3616155c5b8419";
    private static final String USDC = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";
    private static final String USDC_FEED = "0x8fffffd4afb6115b954bd326cbe7b4ba576818f6";
    private static final BigInteger ONE_ETHER = BigInteger.TEN.pow(18);

    @Mock
    AssetRegistryService assetRegistryService;
    @Mock
    PriceOracle priceOracle;
    @Mock
    AssetMetadata assetMetadata;

    ValuationProperties properties;
    ValuationService valuationService;

    @BeforeEach
    void setUp() {
        properties = new ValuationProperties();
        valuationService = new ValuationService(assetRegistryService, priceOracle, assetMetadata, properties);
    }

    private static OraclePrice price(long answer, int decimals) {
        return new OraclePrice(BigInteger.valueOf(answer), decimals, Instant.now());
    }

    @Test
    @DisplayName("20 ETH at 2,000 (8 feed decimals) is 40,000 USD at 6 decimals")
    void valueOf_native() {
        when(assetRegistryService.lookup(AssetIds.NATIVE)).thenReturn(ETH_FEED);
        when(priceOracle.latestPrice(ETH_FEED)).thenReturn(price(2_000_00000000L, 8));

        BigInteger value = valuationService.valueOf(AssetIds.NATIVE, ONE_ETHER.multiply(BigInteger.valueOf(20)));

        assertThat(value).isEqualTo(BigInteger.valueOf(40_000_000_000L));
        verify(assetMetadata, never()).decimals(any());
    }

    @Test
    @DisplayName("6-decimal token uses its own precision from metadata")
    void valueOf_token() {
        when(assetRegistryService.lookup(USDC)).thenReturn(USDC_FEED);
        when(priceOracle.latestPrice(USDC_FEED)).thenReturn(price(99_990_000L, 8));
        when(assetMetadata.decimals(USDC)).thenReturn(6);

        // 1,500 USDC at 0.9999
        BigInteger value = valuationService.valueOf(USDC, BigInteger.valueOf(1_500_000_000L));

        assertThat(value).isEqualTo(BigInteger.valueOf(1_499_850_000L));
    }

    @Test
    @DisplayName("configured decimals override skips the metadata source")
    void valueOf_decimalsOverride() {
        properties.getDecimalsOverrides().put(USDC, 6);
        when(assetRegistryService.lookup(USDC)).thenReturn(USDC_FEED);
        when(priceOracle.latestPrice(USDC_FEED)).thenReturn(price(100_000_000L, 8));

        assertThat(valuationService.valueOf(USDC, BigInteger.valueOf(2_000_000L))).isEqualTo(2_000_000L);
        verify(assetMetadata, never()).decimals(any());
    }

    @Test
    @DisplayName("valueOf(asset, 0) is 0 for a registered asset with a valid feed")
    void valueOf_zero() {
        when(assetRegistryService.lookup(AssetIds.NATIVE)).thenReturn(ETH_FEED);
        when(priceOracle.latestPrice(ETH_FEED)).thenReturn(price(2_000_00000000L, 8));

        assertThat(valuationService.valueOf(AssetIds.NATIVE, BigInteger.ZERO)).isZero();
    }

    @Test
    @DisplayName("multiplication happens before division so small amounts keep precision")
    void normalize_multipliesFirst() {
        // 1 wei at 2,000 with 8 feed decimals, 24 common decimals: exactly 2000 * 10^6
        assertThat(ValuationService.normalize(BigInteger.ONE, BigInteger.valueOf(2_000_00000000L), 8, 18, 24))
                .isEqualTo(BigInteger.valueOf(2_000_000_000L));
        // truncates toward zero
        assertThat(ValuationService.normalize(BigInteger.ONE, BigInteger.valueOf(2_000_00000000L), 8, 18, 6))
                .isZero();
    }

    @Test
    @DisplayName("huge amount x price products do not overflow")
    void normalize_wideIntermediate() {
        BigInteger amount = BigInteger.TWO.pow(200);
        BigInteger price = BigInteger.TWO.pow(200);

        assertThat(ValuationService.normalize(amount, price, 0, 0, 0)).isEqualTo(BigInteger.TWO.pow(400));
    }

    @Nested
    @DisplayName("invalid prices")
    class InvalidPrices {

        @BeforeEach
        void registered() {
            when(assetRegistryService.lookup(AssetIds.NATIVE)).thenReturn(ETH_FEED);
        }

        @Test
        @DisplayName("price 0 fails INVALID_PRICE")
        void zeroPrice() {
            when(priceOracle.latestPrice(ETH_FEED)).thenReturn(price(0, 8));

            assertInvalidPrice(() -> valuationService.valueOf(AssetIds.NATIVE, ONE_ETHER));
        }

        @Test
        @DisplayName("negative price fails INVALID_PRICE, never clamps to zero")
        void negativePrice() {
            when(priceOracle.latestPrice(ETH_FEED)).thenReturn(price(-1, 8));

            assertInvalidPrice(() -> valuationService.valueOf(AssetIds.NATIVE, BigInteger.ZERO));
        }

        @Test
        @DisplayName("stale answer fails INVALID_PRICE")
        void stalePrice() {
            when(priceOracle.latestPrice(ETH_FEED)).thenReturn(new OraclePrice(
                    BigInteger.valueOf(2_000_00000000L), 8, Instant.now().minus(Duration.ofHours(2))));

            assertInvalidPrice(() -> valuationService.valueOf(AssetIds.NATIVE, ONE_ETHER));
        }

        @Test
        @DisplayName("zero max-price-age disables the staleness check")
        void stalenessDisabled() {
            properties.setMaxPriceAge(Duration.ZERO);
            when(priceOracle.latestPrice(ETH_FEED)).thenReturn(new OraclePrice(
                    BigInteger.valueOf(2_000_00000000L), 8, Instant.EPOCH));

            assertThat(valuationService.valueOf(AssetIds.NATIVE, ONE_ETHER)).isEqualTo(2_000_000_000L);
        }

        @Test
        @DisplayName("oracle failure fails INVALID_PRICE")
        void oracleThrows() {
            when(priceOracle.latestPrice(ETH_FEED)).thenThrow(new IllegalStateException("feed down"));

            assertInvalidPrice(() -> valuationService.valueOf(AssetIds.NATIVE, ONE_ETHER));
        }

        private void assertInvalidPrice(Runnable call) {
            assertThatThrownBy(call::run)
                    .isInstanceOf(LedgerException.class)
                    .satisfies(e -> assertThat(((LedgerException) e).getErrorCode()).isEqualTo(LedgerErrorCode.INVALID_PRICE));
        }
    }

    @Test
    @DisplayName("unregistered asset fails before the oracle is queried")
    void valueOf_unregistered() {
        when(assetRegistryService.lookup("0xdead"))
                .thenThrow(new LedgerException(LedgerErrorCode.ASSET_NOT_REGISTERED, "Asset not registered: 0xdead"));

        assertThatThrownBy(() -> valuationService.valueOf("0xdead", ONE_ETHER))
                .isInstanceOf(LedgerException.class)
                .satisfies(e -> assertThat(((LedgerException) e).getErrorCode()).isEqualTo(LedgerErrorCode.ASSET_NOT_REGISTERED));
        verify(priceOracle, never()).latestPrice(any());
    }

    @Test
    @DisplayName("metadata failure fails METADATA_UNAVAILABLE")
    void valueOf_metadataUnavailable() {
        when(assetRegistryService.lookup(USDC)).thenReturn(USDC_FEED);
        when(priceOracle.latestPrice(USDC_FEED)).thenReturn(price(100_000_000L, 8));
        when(assetMetadata.decimals(USDC)).thenThrow(new IllegalStateException("rpc down"));

        assertThatThrownBy(() -> valuationService.valueOf(USDC, BigInteger.ONE))
                .isInstanceOf(LedgerException.class)
                .satisfies(e -> assertThat(((LedgerException) e).getErrorCode()).isEqualTo(LedgerErrorCode.METADATA_UNAVAILABLE));
    }

    @Test
    void valueOf_negativeAmount_throws() {
        assertThatThrownBy(() -> valuationService.valueOf(USDC, BigInteger.valueOf(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
