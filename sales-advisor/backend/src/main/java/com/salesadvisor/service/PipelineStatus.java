package com.salesadvisor.service;

import java.time.Instant;

public record PipelineStatus(
    boolean ready,
    int observationCount,
    int featureCount,
    String modelType,
    boolean modelDegraded,
    Instant fittedAt
) {}
