package com.salesadvisor.rules;

public record PromoImpact(
    double threshold,
    int highPerformerCount,
    double highPerformerRatio,
    double highPerformerMean
) {}
