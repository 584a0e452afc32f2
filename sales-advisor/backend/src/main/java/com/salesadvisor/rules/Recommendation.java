package com.salesadvisor.rules;

public record Recommendation(RecommendationCategory category, String message) {}
