package com.salesadvisor.feature;

import com.salesadvisor.entity.SalesObservation;
import com.salesadvisor.entity.StoreProfile;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One day at one store, joined with the store's profile: everything the encoder reads.
 * The sales target, customer count and open flag are deliberately absent.
 */
public record FeatureRecord(
    int storeId,
    LocalDate date,
    int dayOfWeek,
    boolean promo,
    String stateHoliday,
    boolean schoolHoliday,
    String storeType,
    String assortment,
    Double competitionDistance,
    Integer competitionOpenSinceMonth,
    Integer competitionOpenSinceYear,
    boolean promo2,
    Integer promo2SinceWeek,
    Integer promo2SinceYear
) {

    public static final String NO_STATE_HOLIDAY = "0";

    public FeatureRecord {
        Objects.requireNonNull(date, "date");
    }

    public static FeatureRecord of(SalesObservation observation, StoreProfile store) {
        return new FeatureRecord(
            observation.getStoreId(), observation.getDate(), observation.getDayOfWeek(),
            observation.isPromo(), observation.getStateHoliday(), observation.isSchoolHoliday(),
            store.getStoreType(), store.getAssortment(), store.getCompetitionDistance(),
            store.getCompetitionOpenSinceMonth(), store.getCompetitionOpenSinceYear(),
            store.isPromo2(), store.getPromo2SinceWeek(), store.getPromo2SinceYear());
    }

    /**
     * Synthetic open day with no state or school holiday. Day-of-week comes from the date.
     */
    public static FeatureRecord scenario(int storeId, LocalDate date, boolean promo, StoreProfile store) {
        return new FeatureRecord(
            storeId, date, FeatureDerivation.dayOfWeek(date),
            promo, NO_STATE_HOLIDAY, false,
            store.getStoreType(), store.getAssortment(), store.getCompetitionDistance(),
            store.getCompetitionOpenSinceMonth(), store.getCompetitionOpenSinceYear(),
            store.isPromo2(), store.getPromo2SinceWeek(), store.getPromo2SinceYear());
    }
}
