package com.jay.valuation.layer5_orchestration;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.exception.InvalidInputException;
import com.jay.valuation.exception.MethodUnavailableException;
import com.jay.valuation.layer1_input.CompanyDirectory;
import com.jay.valuation.layer1_input.FinancialInputsNormalizer;
import com.jay.valuation.layer2_methods.MarketSampleFetcher;
import com.jay.valuation.layer2_methods.MethodCalculator;
import com.jay.valuation.layer3_summary.ValuationSummaryAggregator;
import com.jay.valuation.layer4_risk.RiskFactorIdentifier;
import com.jay.valuation.layer4_risk.SensitivityAnalyzer;
import com.jay.valuation.model.CompanyIdentity;
import com.jay.valuation.model.CompanyValuation;
import com.jay.valuation.model.FinancialInputs;
import com.jay.valuation.model.MarketComparable;
import com.jay.valuation.model.PublicComparable;
import com.jay.valuation.model.RawFinancialData;
import com.jay.valuation.model.SensitivityAnalysis;
import com.jay.valuation.model.ValuationOptions;
import com.jay.valuation.model.ValuationSummary;
import com.jay.valuation.model.enums.ValuationMethod;
import com.jay.valuation.model.methods.ComparableCompanyResult;
import com.jay.valuation.model.methods.MethodOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Layer 5 — Valuation Orchestrator.
 * Entry point for one valuation request:
 *   1. Resolve the company and normalise the raw figures
 *   2. Run every selected method concurrently (methods share no state)
 *   3. Aggregate the successes into the weighted summary
 *   4. Sensitivity (on request) and risk factors over the aggregate
 *   5. Assemble the immutable CompanyValuation report
 *
 * A method that fails, or does not finish within the engine timeout, is reported as
 * unavailable; it never aborts the request.
 */
@Slf4j
@Service
public class ValuationOrchestrator {

    private final CompanyDirectory companyDirectory;
    private final FinancialInputsNormalizer normalizer;
    private final List<MethodCalculator> calculators;
    private final ValuationSummaryAggregator aggregator;
    private final SensitivityAnalyzer sensitivityAnalyzer;
    private final RiskFactorIdentifier riskFactorIdentifier;
    private final MarketSampleFetcher marketSampleFetcher;
    private final ValuationConfig config;
    private final ExecutorService executor;

    public ValuationOrchestrator(CompanyDirectory companyDirectory,
                                 FinancialInputsNormalizer normalizer,
                                 List<MethodCalculator> calculators,
                                 ValuationSummaryAggregator aggregator,
                                 SensitivityAnalyzer sensitivityAnalyzer,
                                 RiskFactorIdentifier riskFactorIdentifier,
                                 MarketSampleFetcher marketSampleFetcher,
                                 ValuationConfig config,
                                 @Qualifier("valuationExecutor") ExecutorService executor) {
        this.companyDirectory = companyDirectory;
        this.normalizer = normalizer;
        this.calculators = calculators.stream()
            .sorted(Comparator.comparing(MethodCalculator::method))
            .toList();
        this.aggregator = aggregator;
        this.sensitivityAnalyzer = sensitivityAnalyzer;
        this.riskFactorIdentifier = riskFactorIdentifier;
        this.marketSampleFetcher = marketSampleFetcher;
        this.config = config;
        this.executor = executor;
    }

    public CompanyValuation calculateCompanyValuation(String companyId, RawFinancialData data,
                                                      ValuationOptions options) {
        if (companyId == null || companyId.isBlank()) {
            throw new InvalidInputException("companyId", "company id is required");
        }
        ValuationOptions opts = options != null ? options : ValuationOptions.defaults();
        log.info("Valuation requested for {} (comparables={}, sensitivity={})",
            companyId, opts.isIncludeComparables(), opts.isIncludeSensitivity());

        CompanyIdentity company = companyDirectory.getCompany(companyId);
        FinancialInputsNormalizer.NormalizationResult normalized = normalizer.normalize(data);
        FinancialInputs inputs = normalized.inputs();
        List<String> warnings = new ArrayList<>(normalized.warnings());

        // ── Methods + summary ─────────────────────────────────────────────────
        List<MethodOutcome> outcomes = runMethods(inputs, opts);
        for (MethodOutcome outcome : outcomes) {
            if (outcome.available()) {
                warnings.addAll(outcome.result().getWarnings());
            } else {
                warnings.add(outcome.method().label() + " unavailable: " + outcome.unavailableReason());
            }
        }
        ValuationSummary summary = aggregator.aggregate(outcomes, inputs);
        if (summary.getWeightedValuation() == 0 && summary.getOverallConfidence() == 0) {
            warnings.add("No valuation method produced a weighted result");
        }

        // ── Comparables, sensitivity, risk ────────────────────────────────────
        List<MarketComparable> comparables = opts.isIncludeComparables()
            ? comparables(inputs, outcomes, warnings)
            : List.of();

        SensitivityAnalysis sensitivity = SensitivityAnalysis.empty();
        if (opts.isIncludeSensitivity()) {
            SensitivityAnalyzer.Result result = sensitivityAnalyzer.analyze(inputs, outcomes, summary,
                shifted -> aggregator.aggregate(runMethods(shifted, opts), shifted));
            sensitivity = result.analysis();
            warnings.addAll(result.warnings());
        }

        CompanyValuation valuation = CompanyValuation.builder()
            .companyId(company.id())
            .companyName(company.name())
            .currency(company.currency())
            .valuationDate(LocalDate.now())
            .financialInputs(inputs)
            .methods(outcomes)
            .valuationSummary(summary)
            .comparables(comparables)
            .sensitivityAnalysis(sensitivity)
            .riskFactors(riskFactorIdentifier.identify(inputs))
            .warnings(List.copyOf(warnings))
            .generatedAt(LocalDateTime.now())
            .build();

        log.info("Valuation complete for {}: {} {} from {} method(s), confidence {} ({})",
            companyId, String.format("%.0f", summary.getWeightedValuation()), company.currency(),
            summary.getMethodCount(), String.format("%.1f", summary.getOverallConfidence()),
            summary.getDataQuality().label());
        return valuation;
    }

    // ── Method fan-out ─────────────────────────────────────────────────────────

    List<MethodOutcome> runMethods(FinancialInputs inputs, ValuationOptions options) {
        List<MethodCalculator> selected = calculators.stream()
            .filter(c -> options.selects(c.method()))
            .toList();
        List<CompletableFuture<MethodOutcome>> futures = selected.stream()
            .map(c -> CompletableFuture.supplyAsync(() -> runOne(c, inputs), executor))
            .toList();

        long timeoutSeconds = config.engine().getTimeoutSeconds();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Valuation methods did not all finish within {}s", timeoutSeconds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for valuation methods");
        } catch (ExecutionException e) {
            // runOne never completes exceptionally
            log.error("Unexpected method failure: {}", e.getMessage());
        }

        List<MethodOutcome> outcomes = new ArrayList<>(selected.size());
        for (int i = 0; i < selected.size(); i++) {
            CompletableFuture<MethodOutcome> future = futures.get(i);
            if (future.isDone() && !future.isCompletedExceptionally()) {
                outcomes.add(future.join());
            } else {
                future.cancel(true);
                outcomes.add(MethodOutcome.unavailable(selected.get(i).method(),
                    "timed out after " + timeoutSeconds + "s"));
            }
        }
        return List.copyOf(outcomes);
    }

    private MethodOutcome runOne(MethodCalculator calculator, FinancialInputs inputs) {
        ValuationMethod method = calculator.method();
        try {
            MethodOutcome outcome = MethodOutcome.success(calculator.calculate(inputs));
            log.debug("{}: {} (confidence {}, weight {})", method.label(),
                outcome.result().getValuationRange(), outcome.result().getConfidence(),
                outcome.result().getWeight());
            return outcome;
        } catch (MethodUnavailableException e) {
            log.warn("{} unavailable: {}", method.label(), e.getMessage());
            return MethodOutcome.unavailable(method, e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} failed: {}", method.label(), e.getMessage(), e);
            return MethodOutcome.unavailable(method, "calculation failed: " + e.getMessage());
        }
    }

    private List<MarketComparable> comparables(FinancialInputs inputs, List<MethodOutcome> outcomes,
                                               List<String> warnings) {
        String industry = inputs.getIndustryType().label();
        List<PublicComparable> peers = outcomes.stream()
            .filter(o -> o.method() == ValuationMethod.COMPARABLE_COMPANY && o.available())
            .map(MethodOutcome::result)
            .filter(ComparableCompanyResult.class::isInstance)
            .map(r -> ((ComparableCompanyResult) r).getComparables())
            .findFirst()
            .orElseGet(() -> {
                MarketSampleFetcher.Sample<PublicComparable> sample =
                    marketSampleFetcher.comparables(inputs.getIndustryType());
                if (sample.warning() != null) warnings.add(sample.warning());
                return sample.items();
            });
        return peers.stream().map(c -> MarketComparable.of(c, industry)).toList();
    }
}
