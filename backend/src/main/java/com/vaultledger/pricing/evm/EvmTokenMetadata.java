package com.vaultledger.pricing.evm;

import com.vaultledger.chain.AbiWords;
import com.vaultledger.chain.EvmContractReader;
import com.vaultledger.config.CaffeineConfig;
import com.vaultledger.pricing.AssetMetadata;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * ERC-20 decimals via eth_call decimals(). Cached in tokenDecimalsCache; failures propagate instead of
 * defaulting, since a wrong precision misvalues holdings by orders of magnitude.
 */
@Component
@RequiredArgsConstructor
public class EvmTokenMetadata implements AssetMetadata {

    /** keccak256("decimals()") first 4 bytes. */
    static final String DECIMALS_SELECTOR = "0x313ce567";

    private static final Map<String, Integer> KNOWN_DECIMALS = Map.of(
            "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48", 6,   // USDC
            "0xdac17f958d2ee523a2206206994597c13d831ec7", 6,   // USDT
            "0x2260fac5e5542a773aa44fbcfedf7c193bc2c599", 8,   // WBTC
            "0x6b175474e89094c44da98b954eedeac495271d0f", 18   // DAI
    );

    private final EvmContractReader contractReader;
    private final CacheManager cacheManager;

    @Override
    public int decimals(String assetId) {
        String token = assetId.strip().toLowerCase(Locale.ROOT);
        Integer known = KNOWN_DECIMALS.get(token);
        if (known != null) {
            return known;
        }
        Cache cache = cacheManager.getCache(CaffeineConfig.TOKEN_DECIMALS_CACHE);
        if (cache == null) {
            return fetch(token);
        }
        Integer decimals = cache.get(token, () -> fetch(token));
        return decimals != null ? decimals : fetch(token);
    }

    private int fetch(String token) {
        // decimals is uint8, returned as a full 32-byte word
        return AbiWords.uintWord(contractReader.call(token, DECIMALS_SELECTOR), 0).intValueExact();
    }
}
