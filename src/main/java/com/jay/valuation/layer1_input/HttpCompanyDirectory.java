package com.jay.valuation.layer1_input;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.exception.CompanyNotFoundException;
import com.jay.valuation.model.CompanyIdentity;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Company lookup against the records service over HTTP.
 * GET {base_url}/companies/{id} → {"name": "...", "currency": "EUR"}
 */
@Slf4j
public class HttpCompanyDirectory implements CompanyDirectory {

    private final ValuationConfig config;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final OkHttpClient http;

    public HttpCompanyDirectory(ValuationConfig config) {
        this.config = config;
        ValuationConfig.CompanyDirectory cfg = config.companyDirectory();
        this.http = new OkHttpClient.Builder()
            .connectTimeout(cfg.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
            .readTimeout(cfg.getReadTimeoutMs(), TimeUnit.MILLISECONDS)
            .build();
    }

    @Override
    public CompanyIdentity getCompany(String companyId) {
        ValuationConfig.CompanyDirectory cfg = config.companyDirectory();
        HttpUrl base = HttpUrl.parse(cfg.getBaseUrl());
        if (base == null) {
            throw new IllegalStateException("Invalid company directory URL: " + cfg.getBaseUrl());
        }
        HttpUrl url = base.newBuilder()
            .addPathSegment("companies")
            .addPathSegment(companyId)
            .build();
        Request request = new Request.Builder()
            .url(url)
            .get()
            .addHeader("Accept", "application/json")
            .build();

        try (Response response = http.newCall(request).execute()) {
            if (response.code() == 404) {
                throw new CompanyNotFoundException(companyId);
            }
            if (!response.isSuccessful() || response.body() == null) {
                throw new IllegalStateException("Company directory returned HTTP " + response.code()
                    + " for " + companyId);
            }
            JsonNode root = objectMapper.readTree(response.body().string());
            String name = root.path("name").asText("");
            if (name.isBlank()) {
                throw new IllegalStateException("Company directory returned no name for " + companyId);
            }
            String currency = root.path("currency").asText(cfg.getDefaultCurrency());
            log.debug("Resolved company {} → {} ({})", companyId, name, currency);
            return new CompanyIdentity(companyId, name, currency);
        } catch (IOException e) {
            throw new IllegalStateException("Company directory lookup failed for " + companyId
                + ": " + e.getMessage(), e);
        }
    }
}
