package com.jay.valuation.layer2_methods;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.layer1_input.MarketDataProvider;
import com.jay.valuation.model.PublicComparable;
import com.jay.valuation.model.TransactionComparable;
import com.jay.valuation.model.enums.IndustryType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Calls the MarketDataProvider on its own executor with a timeout.
 * A timeout or provider failure yields an empty sample plus a warning; it never
 * propagates, so a broken data source only degrades the market-based methods.
 */
@Slf4j
@Component
public class MarketSampleFetcher {

    private final MarketDataProvider provider;
    private final ValuationConfig config;
    private final ExecutorService executor;

    public MarketSampleFetcher(MarketDataProvider provider, ValuationConfig config,
                               @Qualifier("marketDataExecutor") ExecutorService executor) {
        this.provider = provider;
        this.config = config;
        this.executor = executor;
    }

    /** warning is null when the fetch succeeded. */
    public record Sample<T>(List<T> items, String warning) {}

    public Sample<PublicComparable> comparables(IndustryType industry) {
        return fetch(() -> provider.getComparables(industry), "comparables", industry);
    }

    public Sample<TransactionComparable> transactions(IndustryType industry) {
        return fetch(() -> provider.getTransactions(industry), "transactions", industry);
    }

    private <T> Sample<T> fetch(Supplier<List<T>> call, String kind, IndustryType industry) {
        long timeoutMs = config.marketData().getTimeoutMs();
        CompletableFuture<List<T>> future = CompletableFuture.supplyAsync(call, executor);
        try {
            List<T> items = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return new Sample<>(items != null ? items : List.of(), null);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Market data: {} fetch for {} timed out after {} ms — using empty sample",
                kind, industry.label(), timeoutMs);
            return new Sample<>(List.of(),
                String.format("Market %s fetch timed out after %d ms; empty sample used", kind, timeoutMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return new Sample<>(List.of(), "Market " + kind + " fetch interrupted; empty sample used");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Market data: {} fetch for {} failed — using empty sample: {}",
                kind, industry.label(), cause.getMessage());
            return new Sample<>(List.of(),
                "Market " + kind + " fetch failed (" + cause.getMessage() + "); empty sample used");
        }
    }
}
