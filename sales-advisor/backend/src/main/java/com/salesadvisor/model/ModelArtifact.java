package com.salesadvisor.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelArtifact(
    String type,
    Double intercept,
    List<Double> coefficients,
    @JsonAlias("feature_names") List<String> featureNames,
    @JsonAlias("base_url") String baseUrl,
    @JsonAlias("timeout_seconds") Integer timeoutSeconds
) {}
