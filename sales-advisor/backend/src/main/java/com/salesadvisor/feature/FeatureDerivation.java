package com.salesadvisor.feature;

import java.time.LocalDate;
import java.time.temporal.IsoFields;

public final class FeatureDerivation {

    private FeatureDerivation() {
    }

    public static int dayOfWeek(LocalDate date) {
        return date.getDayOfWeek().getValue();
    }

    public static boolean isWeekend(int dayOfWeek) {
        return dayOfWeek >= 5;
    }

    public static DerivedFeatures derive(FeatureRecord r) {
        LocalDate date = r.date();
        int year = date.getYear();
        int month = date.getMonthValue();
        int isoWeek = date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);

        boolean hasDistance = r.competitionDistance() != null && !r.competitionDistance().isNaN();
        boolean hasCompetitionData = known(r.competitionOpenSinceYear()) && known(r.competitionOpenSinceMonth());

        return new DerivedFeatures(
            r.dayOfWeek(),
            flag(r.promo()),
            flag(r.schoolHoliday()),
            hasDistance ? r.competitionDistance() : 0.0,
            flag(r.promo2()),
            month,
            date.getDayOfMonth(),
            flag(isWeekend(r.dayOfWeek())),
            flag(hasDistance),
            hasCompetitionData
                ? competitionMonthsOpen(year, month, r.competitionOpenSinceYear(), r.competitionOpenSinceMonth())
                : 0,
            flag(hasCompetitionData),
            promo2LastsForNWeeks(r.promo2(), year, isoWeek, r.promo2SinceYear(), r.promo2SinceWeek()),
            category(r.storeType()),
            category(r.assortment()),
            stateHoliday(r.stateHoliday()));
    }

    static int competitionMonthsOpen(int year, int month, int openYear, int openMonth) {
        return Math.max(0, (year - openYear) * 12 + (month - openMonth));
    }

    static int promo2LastsForNWeeks(boolean promo2, int year, int isoWeek, Integer sinceYear, Integer sinceWeek) {
        if (!promo2 || !known(sinceYear) || !known(sinceWeek)) {
            return 0;
        }
        return Math.max(0, (year - sinceYear) * 52 + (isoWeek - sinceWeek));
    }

    // the bulk loader writes 0 for missing calendar anchors
    private static boolean known(Integer value) {
        return value != null && value > 0;
    }

    private static int flag(boolean value) {
        return value ? 1 : 0;
    }

    private static String category(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static String stateHoliday(String value) {
        String code = category(value);
        return code != null ? code : FeatureRecord.NO_STATE_HOLIDAY;
    }
}
