package com.jay.valuation.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jay.valuation.model.PublicComparable;
import com.jay.valuation.model.TransactionComparable;
import com.jay.valuation.model.ValueRange;
import com.jay.valuation.model.enums.IndustryType;
import com.jay.valuation.model.enums.QuantileMethod;
import com.jay.valuation.model.enums.ScenarioSource;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads and exposes the engine configuration from valuation.yaml.
 * Industry multiple tables, method weights, DCF assumptions and market-data fixtures
 * all live here so every calculator is a pure function of (inputs, config, data source).
 * Values are read once at startup. A freshly constructed instance carries the built-in
 * defaults, which is what the calculators see when no file is loaded.
 */
@Slf4j
@Component
public class ValuationConfig {

    @Value("${valuation.config-file:valuation.yaml}")
    private String configFile;

    @Autowired(required = false)
    private Environment env;

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    /** Resolves ${VAR:default} placeholders using the Spring Environment (env vars / system props). */
    private String resolve(String value) {
        if (value == null) return null;
        Environment source = env != null ? env : new StandardEnvironment();
        return PLACEHOLDER_HELPER.replacePlaceholders(value, source::getProperty);
    }

    // ── Sections ──────────────────────────────────────────────────────────────
    private Defaults defaults = new Defaults();
    private RevenueMultiple revenueMultiple = new RevenueMultiple();
    private EbitdaMultiple ebitdaMultiple = new EbitdaMultiple();
    private Dcf dcf = new Dcf();
    private AssetBased assetBased = new AssetBased();
    private MarketMethod comparableCompany = MarketMethod.comparableCompanyDefaults();
    private MarketMethod precedentTransaction = MarketMethod.precedentTransactionDefaults();
    private Statistics statistics = new Statistics();
    private Sensitivity sensitivity = new Sensitivity();
    private Risk risk = new Risk();
    private MarketData marketData = new MarketData();
    private CompanyDirectory companyDirectory = new CompanyDirectory();
    private Engine engine = new Engine();

    @PostConstruct
    public void load() {
        load(configFile != null ? configFile : "valuation.yaml");
    }

    public void load(String resource) {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            mapper.registerModule(new JavaTimeModule());
            InputStream is = getClass().getClassLoader().getResourceAsStream(resource);
            if (is == null) {
                log.warn("Config file '{}' not found on classpath — using defaults", resource);
                return;
            }
            ConfigRoot root;
            try (is) {
                root = mapper.readValue(is, ConfigRoot.class);
            }
            this.defaults             = root.getDefaults();
            this.revenueMultiple      = root.getRevenueMultiple();
            this.ebitdaMultiple       = root.getEbitdaMultiple();
            this.dcf                  = root.getDcf();
            this.assetBased           = root.getAssetBased();
            this.comparableCompany    = root.getComparableCompany();
            this.precedentTransaction = root.getPrecedentTransaction();
            this.statistics           = root.getStatistics();
            this.sensitivity          = root.getSensitivity();
            this.risk                 = root.getRisk();
            this.marketData           = root.getMarketData();
            this.companyDirectory     = root.getCompanyDirectory();
            this.engine               = root.getEngine();

            // Resolve ${VAR:default} placeholders that Jackson reads as literal strings
            this.companyDirectory.setBaseUrl(resolve(this.companyDirectory.getBaseUrl()));
            log.info("ValuationConfig loaded from '{}'. Quantiles: {}, scenario source: {}",
                resource, statistics.getQuantileMethod(), sensitivity.getScenarioSource());
        } catch (Exception e) {
            log.error("Failed to load {} — engine will use defaults: {}", resource, e.getMessage());
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Defaults defaults()                   { return defaults; }
    public RevenueMultiple revenueMultiple()     { return revenueMultiple; }
    public EbitdaMultiple ebitdaMultiple()       { return ebitdaMultiple; }
    public Dcf dcf()                             { return dcf; }
    public AssetBased assetBased()               { return assetBased; }
    public MarketMethod comparableCompany()      { return comparableCompany; }
    public MarketMethod precedentTransaction()   { return precedentTransaction; }
    public Statistics statistics()               { return statistics; }
    public Sensitivity sensitivity()             { return sensitivity; }
    public Risk risk()                           { return risk; }
    public MarketData marketData()               { return marketData; }
    public CompanyDirectory companyDirectory()   { return companyDirectory; }
    public Engine engine()                       { return engine; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Defaults defaults = new Defaults();
        private RevenueMultiple revenueMultiple = new RevenueMultiple();
        private EbitdaMultiple ebitdaMultiple = new EbitdaMultiple();
        private Dcf dcf = new Dcf();
        private AssetBased assetBased = new AssetBased();
        private MarketMethod comparableCompany = MarketMethod.comparableCompanyDefaults();
        private MarketMethod precedentTransaction = MarketMethod.precedentTransactionDefaults();
        private Statistics statistics = new Statistics();
        private Sensitivity sensitivity = new Sensitivity();
        private Risk risk = new Risk();
        private MarketData marketData = new MarketData();
        private CompanyDirectory companyDirectory = new CompanyDirectory();
        private Engine engine = new Engine();
    }

    /** Fallbacks for absent input fields; ratios are % of revenue. */
    @Data public static class Defaults {
        private double revenueGrowthRate = 25;
        private double grossMargin = 75;
        private double ebitdaMargin = 20;
        private double netIncomePctOfRevenue = 15;
        private double totalAssetsPctOfRevenue = 150;
        private double totalLiabilitiesPctOfRevenue = 30;
        private double shareholdersEquityPctOfRevenue = 120;
        private double operatingCashFlowPctOfRevenue = 18;
        private double freeCashFlowPctOfRevenue = 15;
        private String industryType = "SaaS";
        private String businessModel = "B2B SaaS";
        private String marketPosition = "Strong Competitor";
    }

    @Data @NoArgsConstructor @AllArgsConstructor
    public static class Band {
        private double low;
        private double median;
        private double high;

        public ValueRange toRange() {
            return new ValueRange(low, median, high);
        }
    }

    @Data public static class RevenueMultiple {
        private Map<String, Band> industryMultiples = bands(
            "SaaS", new Band(4, 8, 15),
            "Technology", new Band(2, 5, 10),
            "Manufacturing", new Band(0.5, 1.5, 3),
            "Retail", new Band(0.3, 1, 2),
            "Healthcare", new Band(1, 3, 6));
        private String fallbackIndustry = "Technology";
        private double smallCompanyRevenue = 10_000_000;
        private double sizeDiscountPct = -15;
        private double highGrowthPct = 30;
        private double growthPremiumPct = 20;
        private double lowGrowthPct = 10;
        private double growthDiscountPct = -10;
        private double highGrossMarginPct = 80;
        private double marginPremiumPct = 15;
        private double confidence = 7;
        private double weight = 0.2;
        private Map<String, Double> industryWeights = new LinkedHashMap<>(Map.of("SaaS", 0.3));

        public ValueRange multiplesFor(IndustryType industry) {
            return lookup(industryMultiples, industry, fallbackIndustry);
        }

        public double weightFor(IndustryType industry) {
            return industryWeights.getOrDefault(industry.label(), weight);
        }
    }

    @Data public static class EbitdaMultiple {
        private Map<String, Band> industryMultiples = bands(
            "SaaS", new Band(15, 25, 40),
            "Technology", new Band(10, 18, 30),
            "Manufacturing", new Band(5, 10, 15),
            "Retail", new Band(4, 8, 12),
            "Healthcare", new Band(8, 15, 25));
        private String fallbackIndustry = "Technology";
        private double highMarginPct = 25;
        private double marginPremiumPct = 10;
        private double confidence = 8;
        private double weight = 0.25;
        private double unprofitableConfidence = 3;
        private double unprofitableWeight = 0.05;

        public ValueRange multiplesFor(IndustryType industry) {
            return lookup(industryMultiples, industry, fallbackIndustry);
        }
    }

    @Data public static class Dcf {
        private int projectionYears = 5;
        private double growthDecay = 0.85;
        private double taxRatePct = 25;
        private double capexPctOfRevenue = 3;
        private double workingCapitalPctOfGrowth = 5;
        private double riskFreeRatePct = 3;
        private double marketRiskPremiumPct = 8;
        private double defaultBeta = 1.0;
        private Map<String, Double> industryBetas = new LinkedHashMap<>(Map.of("SaaS", 1.3));
        private double terminalGrowthCapPct = 3;
        private double terminalGrowthFactor = 0.3;
        private double rangeLowFactor = 0.8;
        private double rangeHighFactor = 1.2;
        private double confidence = 6;
        private double weight = 0.2;

        public double betaFor(IndustryType industry) {
            return industryBetas.getOrDefault(industry.label(), defaultBeta);
        }
    }

    @Data public static class AssetBased {
        private double tangibleShare = 0.7;
        private double intangibleMarkupPct = 20;
        private double rangeLowFactor = 0.8;
        private double rangeHighFactor = 1.2;
        private double confidence = 5;
        private double weight = 0.1;
        private Map<String, Double> industryWeights = new LinkedHashMap<>(Map.of("Manufacturing", 0.2));

        public double weightFor(IndustryType industry) {
            return industryWeights.getOrDefault(industry.label(), weight);
        }
    }

    /** Shared by comparable-company (liquidity discount) and precedent-transaction (control premium). */
    @Data public static class MarketMethod {
        private double adjustmentPct;
        private double rangeLowFactor = 0.8;
        private double rangeHighFactor = 1.2;
        private double confidence;
        private double weight;
        private double singleLegConfidencePenalty = 2;
        private double noDataConfidence = 1;

        static MarketMethod comparableCompanyDefaults() {
            MarketMethod m = new MarketMethod();
            m.setAdjustmentPct(-25);
            m.setConfidence(7);
            m.setWeight(0.15);
            return m;
        }

        static MarketMethod precedentTransactionDefaults() {
            MarketMethod m = new MarketMethod();
            m.setAdjustmentPct(25);
            m.setConfidence(6);
            m.setWeight(0.1);
            return m;
        }
    }

    @Data public static class Statistics {
        private QuantileMethod quantileMethod = QuantileMethod.NEAREST_RANK;
    }

    @Data public static class Sensitivity {
        private ScenarioSource scenarioSource = ScenarioSource.REVENUE_MULTIPLE;
        private double growthSwing = 10;
        private double marginSwing = 5;
        private double multipleSwingPct = 20;
        private double growthImpactLowPct = -15;
        private double growthImpactHighPct = 20;
        private double marginImpactLowPct = -12;
        private double marginImpactHighPct = 15;
        private double multipleImpactLowPct = -25;
        private double multipleImpactHighPct = 30;
        private double optimisticProbability = 0.2;
        private double baseProbability = 0.6;
        private double pessimisticProbability = 0.2;
    }

    @Data public static class Risk {
        private double lowEbitdaMarginPct = 10;
        private double lowProfitabilityDiscountPct = -15;
        private double slowGrowthPct = 5;
        private int smallTeamEmployees = 50;
    }

    @Data public static class MarketData {
        private long timeoutMs = 5000;
        private Map<String, List<PublicComparable>> comparables = new LinkedHashMap<>();
        private Map<String, List<TransactionComparable>> transactions = new LinkedHashMap<>();
    }

    @Data public static class CompanyDirectory {
        private String baseUrl = "";
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 10000;
        private String defaultCurrency = "USD";
        private boolean allowUnknown = true;
        private Map<String, Company> companies = new LinkedHashMap<>();
    }

    @Data @NoArgsConstructor @AllArgsConstructor
    public static class Company {
        private String name;
        private String currency;
    }

    @Data public static class Engine {
        private int workerThreads = 6;
        private int marketDataThreads = 4;
        private long timeoutSeconds = 30;
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static Map<String, Band> bands(Object... labelAndBand) {
        Map<String, Band> map = new LinkedHashMap<>();
        for (int i = 0; i < labelAndBand.length; i += 2) {
            map.put((String) labelAndBand[i], (Band) labelAndBand[i + 1]);
        }
        return map;
    }

    private static ValueRange lookup(Map<String, Band> table, IndustryType industry, String fallback) {
        Band band = table.get(industry.label());
        if (band == null) band = table.get(fallback);
        if (band == null) {
            throw new IllegalStateException("No multiple band for " + industry.label()
                + " and no fallback band '" + fallback + "' configured");
        }
        return band.toRange();
    }
}
