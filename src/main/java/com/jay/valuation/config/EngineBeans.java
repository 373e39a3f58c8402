package com.jay.valuation.config;

import com.jay.valuation.layer1_input.CompanyDirectory;
import com.jay.valuation.layer1_input.ConfiguredCompanyDirectory;
import com.jay.valuation.layer1_input.HttpCompanyDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Executors and collaborators that depend on configuration.
 * Method calculators and market-data fetches run on separate pools so a calculator
 * waiting on its sample never starves the pool it is running on.
 */
@Slf4j
@Configuration
public class EngineBeans {

    @Bean(name = "valuationExecutor", destroyMethod = "shutdown")
    public ExecutorService valuationExecutor(ValuationConfig config) {
        int threads = Math.max(1, config.engine().getWorkerThreads());
        log.info("Valuation executor: {} worker thread(s)", threads);
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("valuation-"));
    }

    /**
     * Bounded: a fetch abandoned after its timeout keeps its thread until the provider
     * returns, so hung providers exhaust this pool instead of growing it.
     */
    @Bean(name = "marketDataExecutor", destroyMethod = "shutdown")
    public ExecutorService marketDataExecutor(ValuationConfig config) {
        int threads = Math.max(1, config.engine().getMarketDataThreads());
        CustomizableThreadFactory factory = new CustomizableThreadFactory("market-data-");
        factory.setDaemon(true);
        log.info("Market data executor: {} thread(s)", threads);
        return Executors.newFixedThreadPool(threads, factory);
    }

    @Bean
    public CompanyDirectory companyDirectory(ValuationConfig config) {
        String baseUrl = config.companyDirectory().getBaseUrl();
        if (baseUrl != null && !baseUrl.isBlank()) {
            log.info("Company directory: HTTP at {}", baseUrl);
            return new HttpCompanyDirectory(config);
        }
        log.info("Company directory: {} configured compan(ies), allow_unknown={}",
            config.companyDirectory().getCompanies().size(), config.companyDirectory().isAllowUnknown());
        return new ConfiguredCompanyDirectory(config);
    }
}
