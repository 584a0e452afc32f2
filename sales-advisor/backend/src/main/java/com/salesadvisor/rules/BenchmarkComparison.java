package com.salesadvisor.rules;

public record BenchmarkComparison(
    double prediction,
    double benchmarkMean,
    double benchmarkMedian,
    double differenceMean,
    Double differencePctMean,
    double differenceMedian,
    Double differencePctMedian,
    PerformanceCategory performanceCategory
) {}
