package com.salesadvisor.rules;

import com.salesadvisor.entity.StoreProfile;
import com.salesadvisor.feature.FeatureDerivation;

import java.time.LocalDate;

public record ScenarioAttributes(
    boolean promoActive,
    Double competitionDistance,
    int dayOfWeek,
    boolean weekend,
    String storeType,
    String assortment
) {

    public static ScenarioAttributes of(LocalDate date, boolean promoActive, StoreProfile profile) {
        int dayOfWeek = FeatureDerivation.dayOfWeek(date);
        return new ScenarioAttributes(
            promoActive,
            profile.getCompetitionDistance(),
            dayOfWeek,
            FeatureDerivation.isWeekend(dayOfWeek),
            profile.getStoreType(),
            profile.getAssortment());
    }
}
