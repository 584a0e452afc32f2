package com.salesadvisor.service;

import com.salesadvisor.rules.Recommendation;

import java.util.List;

public record RecommendationResult(
    double forecast,
    double benchmark,
    List<Recommendation> recommendations,
    List<Double> cohortTargets,
    StoreInfo storeInfo,
    String modelType,
    boolean modelDegraded
) {

    public List<String> messages() {
        return recommendations.stream().map(Recommendation::message).toList();
    }
}
