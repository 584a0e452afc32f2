package com.salesadvisor.rules;

import com.salesadvisor.similarity.CohortNeighbor;
import com.salesadvisor.similarity.CohortResult;
import com.salesadvisor.similarity.SampleStatistics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@Component
public class RecommendationRules {

    static final double UNDERPERFORMANCE_RATIO = 0.85;
    static final double COMPETITION_PRESSURE_RATIO = 0.90;
    static final double WEEKEND_READINESS_RATIO = 0.95;
    static final double STRONG_PERFORMANCE_RATIO = 1.15;
    static final double CLOSE_COMPETITION_DISTANCE = 1000.0;
    static final double HIGH_PERFORMER_PERCENTILE = 75.0;
    static final double PROMO_MAJORITY = 0.5;

    // used only when the cohort carries no promo flags
    static final double PLACEHOLDER_HIGH_PERFORMER_PROMO_RATIO = 0.75;

    public List<Recommendation> generate(double forecast, double[] cohortTargets, ScenarioAttributes scenario) {
        return evaluate(forecast, cohortTargets, null, scenario);
    }

    public List<Recommendation> generate(double forecast, CohortResult cohort, ScenarioAttributes scenario) {
        boolean[] promoFlags = null;
        if (cohort.hasPromoFlags()) {
            List<CohortNeighbor> neighbors = cohort.neighbors();
            promoFlags = new boolean[neighbors.size()];
            for (int i = 0; i < promoFlags.length; i++) {
                promoFlags[i] = neighbors.get(i).promoActive();
            }
        }
        return evaluate(forecast, cohort.targets(), promoFlags, scenario);
    }

    public BenchmarkComparison compareToBenchmark(double forecast, double[] cohortTargets) {
        requireCohort(cohortTargets);
        double mean = SampleStatistics.mean(cohortTargets);
        double median = SampleStatistics.median(cohortTargets);
        return new BenchmarkComparison(
            forecast,
            mean,
            median,
            forecast - mean,
            percentDifference(forecast, mean),
            forecast - median,
            percentDifference(forecast, median),
            PerformanceCategory.of(forecast, mean));
    }

    public PromoImpact analyzePromoImpact(double[] cohortTargets, double percentile) {
        requireCohort(cohortTargets);
        double threshold = SampleStatistics.percentile(cohortTargets, percentile);
        double[] high = Arrays.stream(cohortTargets).filter(v -> v > threshold).toArray();
        return new PromoImpact(
            threshold,
            high.length,
            (double) high.length / cohortTargets.length,
            high.length > 0 ? SampleStatistics.mean(high) : 0.0);
    }

    private List<Recommendation> evaluate(double forecast, double[] targets, boolean[] promoFlags,
                                          ScenarioAttributes scenario) {
        requireCohort(targets);
        double meanSimilar = SampleStatistics.mean(targets);
        double percentile75 = SampleStatistics.percentile(targets, HIGH_PERFORMER_PERCENTILE);
        List<Recommendation> recommendations = new ArrayList<>();

        if (forecast < meanSimilar * UNDERPERFORMANCE_RATIO) {
            recommendations.add(new Recommendation(RecommendationCategory.UNDERPERFORMANCE, format(
                "Revenue is below typical (%.0f vs %.0f). Explore practices of the best stores.",
                forecast, meanSimilar)));
        }

        if (!scenario.promoActive()) {
            int highPerformers = 0;
            int highPerformersWithPromo = 0;
            for (int i = 0; i < targets.length; i++) {
                if (targets[i] > percentile75) {
                    highPerformers++;
                    if (promoFlags != null && promoFlags[i]) {
                        highPerformersWithPromo++;
                    }
                }
            }
            if (highPerformers > 0) {
                double promoRatio = promoFlags != null
                    ? (double) highPerformersWithPromo / highPerformers
                    : PLACEHOLDER_HIGH_PERFORMER_PROMO_RATIO;
                if (promoRatio > PROMO_MAJORITY) {
                    recommendations.add(new Recommendation(RecommendationCategory.PROMO_OPPORTUNITY, format(
                        "%.0f%% of successful cases included a promotion. Consider launching a promotion.",
                        promoRatio * 100)));
                }
            }
        }

        Double distance = scenario.competitionDistance();
        if (distance != null && distance > 0 && distance < CLOSE_COMPETITION_DISTANCE
                && forecast < meanSimilar * COMPETITION_PRESSURE_RATIO) {
            recommendations.add(new Recommendation(RecommendationCategory.COMPETITIVE_PRESSURE, format(
                "Operating in competitive environment (competitor at %.0fm). "
                    + "Review pricing and assortment strategies.",
                distance)));
        }

        if (scenario.weekend() && forecast < meanSimilar * WEEKEND_READINESS_RATIO) {
            recommendations.add(new Recommendation(RecommendationCategory.WEEKEND_READINESS,
                "Weekend sales forecast is below typical. Ensure adequate staffing and inventory."));
        }

        if (forecast > meanSimilar * STRONG_PERFORMANCE_RATIO) {
            recommendations.add(new Recommendation(RecommendationCategory.STRONG_PERFORMANCE, format(
                "Forecast shows strong performance (%.0f vs %.0f). Prepare for increased customer flow.",
                forecast, meanSimilar)));
        }

        if (recommendations.isEmpty()) {
            recommendations.add(new Recommendation(RecommendationCategory.ON_TRACK, format(
                "Forecast aligns with similar stores (%.0f vs %.0f). Continue current practices.",
                forecast, meanSimilar)));
        }
        return List.copyOf(recommendations);
    }

    private static Double percentDifference(double value, double reference) {
        if (!(reference > 0) || !Double.isFinite(reference)) {
            return null;
        }
        return (value / reference - 1) * 100;
    }

    private static void requireCohort(double[] targets) {
        if (targets == null || targets.length == 0) {
            throw new IllegalArgumentException("Cohort must contain at least one target");
        }
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }
}
