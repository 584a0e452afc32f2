package com.salesadvisor.feature;

public record DerivedFeatures(
    int dayOfWeek,
    int promo,
    int schoolHoliday,
    double competitionDistance,
    int promo2,
    int month,
    int day,
    int isWeekend,
    int hasCompetition,
    int competitionMonthsOpen,
    int hasCompetitionData,
    int promo2LastsForNWeeks,
    String storeType,
    String assortment,
    String stateHoliday
) {}
