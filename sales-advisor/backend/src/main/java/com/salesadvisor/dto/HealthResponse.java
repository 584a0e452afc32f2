package com.salesadvisor.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.salesadvisor.service.PipelineStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class HealthResponse {
    String  status;
    boolean serviceReady;
    String  modelType;
    boolean modelDegraded;
    int     observationCount;
    int     featureCount;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant fittedAt;

    public static HealthResponse from(PipelineStatus status) {
        return HealthResponse.builder()
            .status(status.ready() ? "healthy" : "initializing")
            .serviceReady(status.ready())
            .modelType(status.modelType())
            .modelDegraded(status.modelDegraded())
            .observationCount(status.observationCount())
            .featureCount(status.featureCount())
            .fittedAt(status.fittedAt())
            .build();
    }
}
