package com.jay.valuation.layer2_methods;

import com.jay.valuation.ValuationFixtures;
import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.layer1_input.MarketDataProvider;
import com.jay.valuation.model.PublicComparable;
import com.jay.valuation.model.TransactionComparable;
import com.jay.valuation.model.enums.IndustryType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MarketSampleFetcherTest {

    @Mock
    private MarketDataProvider provider;

    private ExecutorService executor;
    private ValuationConfig config;
    private MarketSampleFetcher fetcher;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        config = new ValuationConfig();
        fetcher = new MarketSampleFetcher(provider, config, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void returnsProviderSample() {
        when(provider.getComparables(IndustryType.SAAS)).thenReturn(ValuationFixtures.publicPeers());

        MarketSampleFetcher.Sample<PublicComparable> sample = fetcher.comparables(IndustryType.SAAS);

        assertThat(sample.items()).hasSize(3);
        assertThat(sample.warning()).isNull();
    }

    @Test
    void providerFailureFallsBackToEmptySample() {
        when(provider.getTransactions(IndustryType.SAAS)).thenThrow(new IllegalStateException("feed down"));

        MarketSampleFetcher.Sample<TransactionComparable> sample = fetcher.transactions(IndustryType.SAAS);

        assertThat(sample.items()).isEmpty();
        assertThat(sample.warning()).contains("failed").contains("feed down");
    }

    @Test
    void slowProviderTimesOut() {
        config.marketData().setTimeoutMs(50);
        when(provider.getComparables(IndustryType.SAAS)).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return ValuationFixtures.publicPeers();
        });

        MarketSampleFetcher.Sample<PublicComparable> sample = fetcher.comparables(IndustryType.SAAS);

        assertThat(sample.items()).isEmpty();
        assertThat(sample.warning()).contains("timed out");
    }

    @Test
    void nullSampleIsTreatedAsEmpty() {
        when(provider.getComparables(IndustryType.RETAIL)).thenReturn(null);

        MarketSampleFetcher.Sample<PublicComparable> sample = fetcher.comparables(IndustryType.RETAIL);

        assertThat(sample.items()).isEmpty();
        assertThat(sample.warning()).isNull();
    }
}
