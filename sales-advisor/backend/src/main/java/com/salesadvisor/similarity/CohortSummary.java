package com.salesadvisor.similarity;

import java.util.List;

public record CohortSummary(
    double meanSales,
    double medianSales,
    double minSales,
    double maxSales,
    double stdSales,
    double meanDistance,
    List<Double> salesValues,
    List<Double> distances
) {

    public static CohortSummary of(CohortResult cohort) {
        double[] targets = cohort.targets();
        double[] distances = cohort.distances();
        if (targets.length == 0) {
            throw new IllegalArgumentException("Cannot summarize an empty cohort");
        }
        return new CohortSummary(
            SampleStatistics.mean(targets),
            SampleStatistics.median(targets),
            SampleStatistics.min(targets),
            SampleStatistics.max(targets),
            SampleStatistics.std(targets),
            SampleStatistics.mean(distances),
            SampleStatistics.boxed(targets),
            SampleStatistics.boxed(distances));
    }
}
