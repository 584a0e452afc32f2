package com.salesadvisor.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesadvisor.client.InferenceApiClient;
import com.salesadvisor.config.PipelineProperties;
import com.salesadvisor.exception.ModelArtifactException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

@Slf4j
@Component
@RequiredArgsConstructor
public class ModelArtifactLoader {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;

    public Forecaster load() {
        return load(properties.getModel().getArtifactLocation());
    }

    /**
     * Never throws: any problem with the artifact yields a degraded placeholder forecaster.
     */
    public Forecaster load(String location) {
        if (location == null || location.isBlank()) {
            log.warn("No model artifact configured | using placeholder model");
            return Forecaster.placeholder();
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("No trained model found | location={} | using placeholder model", location);
            return Forecaster.placeholder();
        }
        try (InputStream in = resource.getInputStream()) {
            SalesModel model = toModel(objectMapper.readValue(in, ModelArtifact.class));
            log.info("Loaded trained model | type={} | location={} | declaredFeatures={}",
                     model.type(), location, model.featureNames().size());
            return Forecaster.trained(model);
        } catch (IOException | ModelArtifactException | IllegalArgumentException ex) {
            log.warn("Error loading model | location={} | reason={} | using placeholder model",
                     location, ex.getMessage());
            return Forecaster.placeholder();
        }
    }

    private SalesModel toModel(ModelArtifact artifact) {
        if (artifact == null || artifact.type() == null) {
            throw new ModelArtifactException("Model artifact has no 'type'");
        }
        List<String> featureNames = artifact.featureNames() != null ? artifact.featureNames() : List.of();
        switch (artifact.type().toLowerCase(Locale.ROOT)) {
            case "linear" -> {
                if (artifact.intercept() == null || artifact.coefficients() == null
                        || artifact.coefficients().isEmpty()) {
                    throw new ModelArtifactException("Linear model artifact needs 'intercept' and 'coefficients'");
                }
                double[] coefficients = artifact.coefficients().stream()
                    .mapToDouble(c -> {
                        if (c == null || !Double.isFinite(c)) {
                            throw new ModelArtifactException("Linear model artifact has a missing or non-finite coefficient");
                        }
                        return c;
                    })
                    .toArray();
                return new LinearSalesModel(artifact.intercept(), coefficients, featureNames);
            }
            case "remote" -> {
                if (artifact.baseUrl() == null || artifact.baseUrl().isBlank()) {
                    throw new ModelArtifactException("Remote model artifact needs 'baseUrl'");
                }
                int timeoutSeconds = artifact.timeoutSeconds() != null && artifact.timeoutSeconds() > 0
                    ? artifact.timeoutSeconds()
                    : properties.getModel().getRemoteTimeoutSeconds();
                InferenceApiClient client = new InferenceApiClient(artifact.baseUrl(), timeoutSeconds, objectMapper);
                // three attempts plus backoff
                return new RemoteSalesModel(client, featureNames, Duration.ofSeconds(timeoutSeconds * 3L + 2));
            }
            default -> throw new ModelArtifactException("Unsupported model type: " + artifact.type());
        }
    }
}
