package com.salesadvisor.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "security.api-key.enabled=true",
        "security.api-key.values=test-key"
    })
@ActiveProfiles("test")
class PipelineNotReadyIntegrationTest {

    @Autowired TestRestTemplate restTemplate;

    private static final Map<String, Object> BODY = Map.of("storeId", 1, "date", "2015-08-03", "promo", 1);

    @Test
    void health_isExemptFromApiKeyAndReportsNotReady() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/health", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(resp.getBody().get("serviceReady")).isEqualTo(false);
        assertThat(resp.getBody().get("modelDegraded")).isEqualTo(true);
    }

    @Test
    void predict_withoutApiKey_returns401() {
        // the guard runs before request mapping, so any method is rejected
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/predict", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(resp.getBody().get("message")).isEqualTo("Missing or invalid API key");
        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isNotBlank();
    }

    @Test
    void predict_beforeReadiness_returns503() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-API-Key", "test-key");
        ResponseEntity<Map> resp = restTemplate.exchange("/api/v1/predict", HttpMethod.POST,
            new HttpEntity<>(BODY, headers), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("SERVICE_NOT_READY");
    }
}
