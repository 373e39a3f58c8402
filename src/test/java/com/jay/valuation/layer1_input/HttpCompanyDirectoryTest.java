package com.jay.valuation.layer1_input;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.exception.CompanyNotFoundException;
import com.jay.valuation.model.CompanyIdentity;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpCompanyDirectoryTest {

    private MockWebServer server;
    private HttpCompanyDirectory directory;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        ValuationConfig config = new ValuationConfig();
        config.companyDirectory().setBaseUrl(server.url("/api").toString());
        config.companyDirectory().setReadTimeoutMs(2000);
        directory = new HttpCompanyDirectory(config);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void resolvesCompanyFromJson() throws InterruptedException {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"name\":\"Acme Analytics\",\"currency\":\"EUR\"}"));

        CompanyIdentity identity = directory.getCompany("acme");

        assertThat(identity).isEqualTo(new CompanyIdentity("acme", "Acme Analytics", "EUR"));
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/api/companies/acme");
        assertThat(request.getHeader("Accept")).isEqualTo("application/json");
    }

    @Test
    void missingCurrencyUsesDefault() {
        server.enqueue(new MockResponse().setBody("{\"name\":\"Acme Analytics\"}"));

        assertThat(directory.getCompany("acme").currency()).isEqualTo("USD");
    }

    @Test
    void notFoundMapsToCompanyNotFound() {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThatThrownBy(() -> directory.getCompany("ghost"))
            .isInstanceOf(CompanyNotFoundException.class);
    }

    @Test
    void serverErrorIsReportedAsIllegalState() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> directory.getCompany("acme"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("503");
    }

    @Test
    void blankNameIsRejected() {
        server.enqueue(new MockResponse().setBody("{\"currency\":\"EUR\"}"));

        assertThatThrownBy(() -> directory.getCompany("acme"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("no name");
    }
}
