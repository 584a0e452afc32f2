package com.salesadvisor.feature;

import java.util.List;
import java.util.function.ToDoubleFunction;

public record FeatureColumn(String name, ToDoubleFunction<DerivedFeatures> extractor) {

    public static final List<FeatureColumn> NUMERIC = List.of(
        new FeatureColumn("DayOfWeek",             DerivedFeatures::dayOfWeek),
        new FeatureColumn("Promo",                 DerivedFeatures::promo),
        new FeatureColumn("SchoolHoliday",         DerivedFeatures::schoolHoliday),
        new FeatureColumn("CompetitionDistance",   DerivedFeatures::competitionDistance),
        new FeatureColumn("Promo2",                DerivedFeatures::promo2),
        new FeatureColumn("Month",                 DerivedFeatures::month),
        new FeatureColumn("Day",                   DerivedFeatures::day),
        new FeatureColumn("IsWeekend",             DerivedFeatures::isWeekend),
        new FeatureColumn("HasCompetition",        DerivedFeatures::hasCompetition),
        new FeatureColumn("CompetitionMonthsOpen", DerivedFeatures::competitionMonthsOpen),
        new FeatureColumn("HasCompetitionData",    DerivedFeatures::hasCompetitionData),
        new FeatureColumn("Promo2LastsForNWeeks",  DerivedFeatures::promo2LastsForNWeeks)
    );

    public static FeatureColumn oneHot(CategoricalAttribute attribute, String level) {
        return new FeatureColumn(attribute.columnName(level),
            features -> level.equals(attribute.valueOf(features)) ? 1.0 : 0.0);
    }

    public double valueOf(DerivedFeatures features) {
        return extractor.applyAsDouble(features);
    }
}
