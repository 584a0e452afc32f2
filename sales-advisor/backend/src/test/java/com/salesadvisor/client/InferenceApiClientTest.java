package com.salesadvisor.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.salesadvisor.exception.InferenceApiException;
import com.salesadvisor.exception.InferenceApiUnavailableException;
import org.junit.jupiter.api.*;
import reactor.test.StepVerifier;

import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

class InferenceApiClientTest {

    private static WireMockServer wireMock;

    private InferenceApiClient client;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().dynamicPort());
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @BeforeEach
    void setUp() {
        client = new InferenceApiClient(wireMock.baseUrl(), 5, new ObjectMapper());
    }

    @AfterEach
    void resetStubs() { wireMock.resetAll(); }

    @Test
    void predict_postsFeaturesAndReturnsPrediction() {
        wireMock.stubFor(post(urlEqualTo("/predict"))
            .withHeader("X-Request-ID", equalTo("req-1"))
            .withRequestBody(equalToJson("{\"features\":[1.0,0.5],\"feature_names\":[\"DayOfWeek\",\"Promo\"]}"))
            .willReturn(aResponse()
                .withHeader("Content-Type", "application/json")
                .withBody("{\"prediction\": 7321.5}")));

        StepVerifier.create(client.predict(new double[]{1.0, 0.5}, List.of("DayOfWeek", "Promo"), "req-1"))
            .assertNext(prediction -> assertThat(prediction).isEqualTo(7321.5))
            .verifyComplete();
    }

    @Test
    void predict_clientError_mapsToInferenceApiException() {
        wireMock.stubFor(post(urlEqualTo("/predict"))
            .willReturn(aResponse().withStatus(422).withBody("bad features")));

        StepVerifier.create(client.predict(new double[]{1.0}, List.of("Promo"), "req-2"))
            .expectErrorSatisfies(ex -> assertThat(ex)
                .isInstanceOf(InferenceApiException.class)
                .hasMessageContaining("bad features"))
            .verify();
        wireMock.verify(1, postRequestedFor(urlEqualTo("/predict")));
    }

    @Test
    void predict_serverError_mapsToUnavailable() {
        wireMock.stubFor(post(urlEqualTo("/predict"))
            .willReturn(aResponse().withStatus(500)));

        StepVerifier.create(client.predict(new double[]{1.0}, List.of("Promo"), "req-3"))
            .expectError(InferenceApiUnavailableException.class)
            .verify();
    }

    @Test
    void predict_missingPrediction_mapsToInferenceApiException() {
        wireMock.stubFor(post(urlEqualTo("/predict"))
            .willReturn(aResponse()
                .withHeader("Content-Type", "application/json")
                .withBody("{\"status\": \"ok\"}")));

        StepVerifier.create(client.predict(new double[]{1.0}, List.of("Promo"), "req-4"))
            .expectError(InferenceApiException.class)
            .verify();
    }

    @Test
    void predict_connectionRefused_mapsToUnavailableAfterRetries() {
        InferenceApiClient offline = new InferenceApiClient("http://localhost:1", 1, new ObjectMapper());

        StepVerifier.create(offline.predict(new double[]{1.0}, List.of("Promo"), "req-5"))
            .expectError(InferenceApiUnavailableException.class)
            .verify();
    }
}
