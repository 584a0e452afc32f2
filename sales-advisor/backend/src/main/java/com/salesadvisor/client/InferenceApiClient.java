package com.salesadvisor.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.salesadvisor.exception.InferenceApiException;
import com.salesadvisor.exception.InferenceApiUnavailableException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Slf4j
public class InferenceApiClient {

    private final String baseUrl;
    private final WebClient webClient;
    private final ObjectMapper mapper;

    public InferenceApiClient(String baseUrl, int timeoutSeconds, ObjectMapper mapper) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.baseUrl = baseUrl;
        this.mapper = mapper;
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .build();
        log.info("InferenceApiClient initialised → {}", baseUrl);
    }

    public String baseUrl() {
        return baseUrl;
    }

    public Mono<Double> predict(double[] features, List<String> featureNames, String requestId) {
        return webClient.post().uri("/predict")
            .header("X-Request-ID", requestId)
            .bodyValue(buildBody(features, featureNames))
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new InferenceApiException("Inference API rejected request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new InferenceApiUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .map(this::toPrediction)
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((retrySpec, signal) -> new InferenceApiUnavailableException(signal.failure())))
            .onErrorMap(WebClientRequestException.class, InferenceApiUnavailableException::new);
    }

    private double toPrediction(JsonNode json) {
        if (json == null || !json.hasNonNull("prediction") || !json.get("prediction").isNumber()) {
            throw new InferenceApiException("Inference API response missing 'prediction': " + json);
        }
        return json.get("prediction").asDouble();
    }

    private ObjectNode buildBody(double[] features, List<String> featureNames) {
        ObjectNode node = mapper.createObjectNode();
        ArrayNode values = node.putArray("features");
        for (double value : features) {
            values.add(value);
        }
        ArrayNode names = node.putArray("feature_names");
        featureNames.forEach(names::add);
        return node;
    }
}
