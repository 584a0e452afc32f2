package com.salesadvisor.rules;

public enum RecommendationCategory {
    UNDERPERFORMANCE,
    PROMO_OPPORTUNITY,
    COMPETITIVE_PRESSURE,
    WEEKEND_READINESS,
    STRONG_PERFORMANCE,
    ON_TRACK
}
