package com.salesadvisor.service;

import com.salesadvisor.rules.BenchmarkComparison;
import com.salesadvisor.rules.PromoImpact;
import com.salesadvisor.similarity.CohortSummary;

public record DetailedRecommendationResult(
    RecommendationResult result,
    CohortSummary cohortSummary,
    BenchmarkComparison comparison,
    PromoImpact promoImpact
) {}
