package com.vaultledger.pricing.evm;

import com.vaultledger.chain.AbiWords;
import com.vaultledger.chain.EvmContractReader;
import com.vaultledger.chain.RpcException;
import com.vaultledger.config.CaffeineConfig;
import com.vaultledger.pricing.OraclePrice;
import com.vaultledger.pricing.PriceOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Locale;

/**
 * Reads Chainlink-style aggregator feeds: the price source id is the feed contract address. The answer is read
 * fresh on every call; feed decimals are cached in feedDecimalsCache.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EvmPriceFeedOracle implements PriceOracle {

    /** latestRoundData() returns (roundId, answer, startedAt, updatedAt, answeredInRound). */
    static final String LATEST_ROUND_DATA_SELECTOR = "0xfeaf968c";
    static final String DECIMALS_SELECTOR = "0x313ce567";

    private static final int ANSWER_WORD = 1;
    private static final int UPDATED_AT_WORD = 3;

    private final EvmContractReader contractReader;
    private final CacheManager cacheManager;

    @Override
    public OraclePrice latestPrice(String priceSourceId) {
        String feed = priceSourceId.strip().toLowerCase(Locale.ROOT);
        String roundData = contractReader.call(feed, LATEST_ROUND_DATA_SELECTOR);
        if (AbiWords.wordCount(roundData) < 5) {
            throw new RpcException("latestRoundData() of " + feed + " returned " + AbiWords.wordCount(roundData) + " words");
        }
        BigInteger answer = AbiWords.intWord(roundData, ANSWER_WORD);
        long updatedAt = AbiWords.uintWord(roundData, UPDATED_AT_WORD).longValueExact();
        int decimals = feedDecimals(feed);
        log.debug("Feed {} answer {} (decimals {}) updated at {}", feed, answer, decimals, updatedAt);
        return new OraclePrice(answer, decimals, Instant.ofEpochSecond(updatedAt));
    }

    private int feedDecimals(String feed) {
        Cache cache = cacheManager.getCache(CaffeineConfig.FEED_DECIMALS_CACHE);
        if (cache == null) {
            return fetchDecimals(feed);
        }
        Integer decimals = cache.get(feed, () -> fetchDecimals(feed));
        return decimals != null ? decimals : fetchDecimals(feed);
    }

    private int fetchDecimals(String feed) {
        return AbiWords.uintWord(contractReader.call(feed, DECIMALS_SELECTOR), 0).intValueExact();
    }
}
