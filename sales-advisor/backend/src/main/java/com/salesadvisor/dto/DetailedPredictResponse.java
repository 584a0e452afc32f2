package com.salesadvisor.dto;

import com.salesadvisor.rules.BenchmarkComparison;
import com.salesadvisor.rules.PerformanceCategory;
import com.salesadvisor.rules.PromoImpact;
import com.salesadvisor.rules.RecommendationCategory;
import com.salesadvisor.service.DetailedRecommendationResult;
import com.salesadvisor.service.RecommendationResult;
import com.salesadvisor.similarity.CohortSummary;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DetailedPredictResponse {
    double                     forecast;
    double                     benchmark;
    List<String>               recommendations;
    List<RecommendationDetail> recommendationDetails;
    List<Double>               similarStores;
    StoreInfo                  storeInfo;
    String                     modelType;
    boolean                    modelDegraded;
    SimilarityStatistics       similarityStatistics;
    PerformanceComparison      performanceComparison;
    PromoImpactSummary         promoImpact;

    @Value
    @Builder
    public static class RecommendationDetail {
        RecommendationCategory category;
        String message;
    }

    @Value
    @Builder
    public static class StoreInfo {
        int    storeId;
        String storeType;
        String assortment;
    }

    @Value
    @Builder
    public static class SimilarityStatistics {
        double       meanSales;
        double       medianSales;
        double       minSales;
        double       maxSales;
        double       stdSales;
        double       meanDistance;
        List<Double> distances;
    }

    @Value
    @Builder
    public static class PerformanceComparison {
        double              prediction;
        double              benchmarkMean;
        double              benchmarkMedian;
        double              differenceMean;
        Double              differencePctMean;
        double              differenceMedian;
        Double              differencePctMedian;
        PerformanceCategory performanceCategory;
    }

    @Value
    @Builder
    public static class PromoImpactSummary {
        double threshold;
        int    highPerformerCount;
        double highPerformerRatio;
        double highPerformerMean;
    }

    public static DetailedPredictResponse from(DetailedRecommendationResult detailed) {
        RecommendationResult result = detailed.result();
        CohortSummary summary = detailed.cohortSummary();
        BenchmarkComparison comparison = detailed.comparison();
        PromoImpact impact = detailed.promoImpact();
        return DetailedPredictResponse.builder()
            .forecast(result.forecast())
            .benchmark(result.benchmark())
            .recommendations(result.messages())
            .recommendationDetails(result.recommendations().stream()
                .map(r -> RecommendationDetail.builder().category(r.category()).message(r.message()).build())
                .toList())
            .similarStores(result.cohortTargets())
            .storeInfo(StoreInfo.builder()
                .storeId(result.storeInfo().storeId())
                .storeType(result.storeInfo().storeType())
                .assortment(result.storeInfo().assortment())
                .build())
            .modelType(result.modelType())
            .modelDegraded(result.modelDegraded())
            .similarityStatistics(SimilarityStatistics.builder()
                .meanSales(summary.meanSales())
                .medianSales(summary.medianSales())
                .minSales(summary.minSales())
                .maxSales(summary.maxSales())
                .stdSales(summary.stdSales())
                .meanDistance(summary.meanDistance())
                .distances(summary.distances())
                .build())
            .performanceComparison(PerformanceComparison.builder()
                .prediction(comparison.prediction())
                .benchmarkMean(comparison.benchmarkMean())
                .benchmarkMedian(comparison.benchmarkMedian())
                .differenceMean(comparison.differenceMean())
                .differencePctMean(comparison.differencePctMean())
                .differenceMedian(comparison.differenceMedian())
                .differencePctMedian(comparison.differencePctMedian())
                .performanceCategory(comparison.performanceCategory())
                .build())
            .promoImpact(PromoImpactSummary.builder()
                .threshold(impact.threshold())
                .highPerformerCount(impact.highPerformerCount())
                .highPerformerRatio(impact.highPerformerRatio())
                .highPerformerMean(impact.highPerformerMean())
                .build())
            .build();
    }
}
