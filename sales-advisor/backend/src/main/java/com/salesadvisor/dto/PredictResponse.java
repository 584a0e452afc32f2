package com.salesadvisor.dto;

import com.salesadvisor.service.RecommendationResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PredictResponse {
    double       forecastSales;
    double       benchmarkSales;
    List<String> recommendations;
    boolean      modelDegraded;

    public static PredictResponse from(RecommendationResult result) {
        return PredictResponse.builder()
            .forecastSales(result.forecast())
            .benchmarkSales(result.benchmark())
            .recommendations(result.messages())
            .modelDegraded(result.modelDegraded())
            .build();
    }
}
