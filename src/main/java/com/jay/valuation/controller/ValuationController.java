package com.jay.valuation.controller;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.exception.CompanyNotFoundException;
import com.jay.valuation.exception.InvalidInputException;
import com.jay.valuation.layer5_orchestration.ValuationOrchestrator;
import com.jay.valuation.model.CompanyValuation;
import com.jay.valuation.model.enums.ValuationMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API — Company Valuation.
 *
 * Endpoints:
 *   POST /api/valuations/{companyId}   — Run a full valuation for one company
 *   GET  /api/valuations/industries    — Configured industry multiple bands
 *   GET  /api/status                   — Engine status and configuration summary
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ValuationController {

    private final ValuationOrchestrator orchestrator;
    private final ValuationConfig config;

    // ── POST /api/valuations/{companyId} ───────────────────────────────────────

    @PostMapping("/valuations/{companyId}")
    public ResponseEntity<CompanyValuation> valuate(@PathVariable String companyId,
                                                    @RequestBody ValuationRequest request) {
        CompanyValuation valuation = orchestrator.calculateCompanyValuation(
            companyId, request.getFinancialData(), request.toOptions());
        return ResponseEntity.ok(valuation);
    }

    // ── GET /api/valuations/industries ─────────────────────────────────────────

    @GetMapping("/valuations/industries")
    public ResponseEntity<Map<String, Object>> industries() {
        return ResponseEntity.ok(Map.of(
            "revenueMultiples", config.revenueMultiple().getIndustryMultiples(),
            "ebitdaMultiples", config.ebitdaMultiple().getIndustryMultiples(),
            "revenueFallbackIndustry", config.revenueMultiple().getFallbackIndustry(),
            "ebitdaFallbackIndustry", config.ebitdaMultiple().getFallbackIndustry()
        ));
    }

    // ── GET /api/status ────────────────────────────────────────────────────────

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        List<String> methods = Arrays.stream(ValuationMethod.values()).map(ValuationMethod::label).toList();
        String baseUrl = config.companyDirectory().getBaseUrl();
        return ResponseEntity.ok(Map.of(
            "status", "RUNNING",
            "timestamp", LocalDateTime.now().toString(),
            "methods", methods,
            "quantileMethod", config.statistics().getQuantileMethod().name(),
            "scenarioSource", config.sensitivity().getScenarioSource().name(),
            "workerThreads", config.engine().getWorkerThreads(),
            "methodTimeoutSeconds", config.engine().getTimeoutSeconds(),
            "companyDirectory", baseUrl == null || baseUrl.isBlank() ? "CONFIGURED" : "HTTP"
        ));
    }

    // ── Error mapping ──────────────────────────────────────────────────────────

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<Map<String, String>> invalidInput(InvalidInputException e) {
        log.warn("Rejected valuation request: {}", e.getMessage());
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("field", e.getField());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable valuation request: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", "Malformed request body"));
    }

    @ExceptionHandler(CompanyNotFoundException.class)
    public ResponseEntity<Map<String, String>> companyNotFound(CompanyNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }
}
