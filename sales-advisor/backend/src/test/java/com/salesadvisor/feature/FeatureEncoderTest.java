package com.salesadvisor.feature;

import com.salesadvisor.entity.StoreProfile;
import com.salesadvisor.exception.NotFittedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FeatureEncoderTest {

    private static final LocalDate FRIDAY   = LocalDate.of(2015, 7, 31);
    private static final LocalDate SATURDAY = LocalDate.of(2015, 8, 1);
    private static final LocalDate MONDAY   = LocalDate.of(2015, 7, 27);

    private FeatureEncoder encoder;
    private StoreProfile storeA;
    private StoreProfile storeC;

    @BeforeEach
    void setUp() {
        encoder = new FeatureEncoder();
        storeA = store(1, "c", "a", 1270.0, 9, 2008, false, null, null);
        storeC = store(2, "a", "c", 570.0, 11, 2007, true, 13, 2010);
    }

    private static StoreProfile store(int id, String type, String assortment, Double distance,
                                      Integer openMonth, Integer openYear,
                                      boolean promo2, Integer sinceWeek, Integer sinceYear) {
        return StoreProfile.builder().storeId(id).storeType(type).assortment(assortment)
            .competitionDistance(distance).competitionOpenSinceMonth(openMonth).competitionOpenSinceYear(openYear)
            .promo2(promo2).promo2SinceWeek(sinceWeek).promo2SinceYear(sinceYear).build();
    }

    private static FeatureRecord record(StoreProfile store, LocalDate date, boolean promo, String stateHoliday) {
        return new FeatureRecord(store.getStoreId(), date, FeatureDerivation.dayOfWeek(date), promo,
            stateHoliday, false, store.getStoreType(), store.getAssortment(), store.getCompetitionDistance(),
            store.getCompetitionOpenSinceMonth(), store.getCompetitionOpenSinceYear(),
            store.isPromo2(), store.getPromo2SinceWeek(), store.getPromo2SinceYear());
    }

    private List<FeatureRecord> corpus() {
        List<FeatureRecord> records = new ArrayList<>();
        records.add(record(storeA, MONDAY, true, "0"));
        records.add(record(storeA, FRIDAY, false, "0"));
        records.add(record(storeC, SATURDAY, true, "a"));
        records.add(record(storeC, MONDAY, false, "0"));
        return records;
    }

    private double unscaled(FeatureRecord record, String column) {
        return encoder.encodeUnscaled(record)[encoder.state().indexOf(column)];
    }

    @Test
    void fitTransform_ordersNumericColumnsBeforeSortedOneHotBlocks() {
        encoder.fitTransform(corpus());

        List<String> expected = new ArrayList<>(FeatureColumn.NUMERIC.stream().map(FeatureColumn::name).toList());
        expected.addAll(List.of("StoreType_a", "StoreType_c", "Assortment_a", "Assortment_c",
                                "StateHoliday_0", "StateHoliday_a"));
        assertThat(encoder.featureNames()).containsExactlyElementsOf(expected);
        assertThat(encoder.state().levels(CategoricalAttribute.STORE_TYPE)).containsExactly("a", "c");
    }

    @Test
    void fitTransform_neverEmitsIdentifierOrLeakageColumns() {
        encoder.fitTransform(corpus());

        assertThat(encoder.featureNames())
            .noneMatch(name -> name.equalsIgnoreCase("Store") || name.equalsIgnoreCase("Sales")
                || name.equalsIgnoreCase("Customers") || name.equalsIgnoreCase("Open")
                || name.equalsIgnoreCase("Date") || name.equalsIgnoreCase("PromoInterval"));
    }

    @Test
    void transform_reproducesFitTimeVector() {
        List<FeatureRecord> records = corpus();
        double[][] matrix = encoder.fitTransform(records);

        for (int i = 0; i < records.size(); i++) {
            assertThat(encoder.transform(records.get(i))).containsExactly(matrix[i]);
        }
        assertThat(encoder.transform(records)).isDeepEqualTo(matrix);
    }

    @Test
    void fitTransform_standardisesEachColumn() {
        double[][] matrix = encoder.fitTransform(corpus());
        int dayOfWeek = encoder.state().indexOf("DayOfWeek");

        double mean = 0.0;
        double sumSq = 0.0;
        for (double[] row : matrix) {
            mean += row[dayOfWeek] / matrix.length;
        }
        for (double[] row : matrix) {
            sumSq += (row[dayOfWeek] - mean) * (row[dayOfWeek] - mean);
        }
        assertThat(mean).isCloseTo(0.0, within(1e-9));
        assertThat(Math.sqrt(sumSq / matrix.length)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void zeroVarianceColumn_usesUnitScaleAndCentresToZero() {
        List<FeatureRecord> records = List.of(
            record(storeA, MONDAY, true, "0"),
            record(storeA, FRIDAY, false, "0"));

        double[][] matrix = encoder.fitTransform(records);
        int promo2 = encoder.state().indexOf("Promo2");

        assertThat(encoder.state().scale(promo2)).isEqualTo(1.0);
        assertThat(matrix[0][promo2]).isEqualTo(0.0);
        for (double[] row : matrix) {
            for (double value : row) {
                assertThat(value).isNotNaN();
            }
        }
    }

    @Test
    void unseenCategoricalLevel_producesAllZeroBlockWithSameWidth() {
        encoder.fitTransform(corpus());
        StoreProfile unseen = store(9, "d", "b", 100.0, 1, 2010, false, null, null);

        double[] row = encoder.encodeUnscaled(record(unseen, MONDAY, false, "c"));

        assertThat(row).hasSize(encoder.state().width());
        for (String column : List.of("StoreType_a", "StoreType_c", "Assortment_a", "Assortment_c",
                                     "StateHoliday_0", "StateHoliday_a")) {
            assertThat(row[encoder.state().indexOf(column)]).as(column).isEqualTo(0.0);
        }
        assertThat(encoder.transform(record(unseen, MONDAY, false, "c"))).hasSize(encoder.state().width());
    }

    @Test
    void unknownCompetitionAnchors_yieldNoCompetitionData() {
        encoder.fitTransform(corpus());
        StoreProfile noAnchors = store(5, "a", "a", 500.0, 0, null, false, null, null);
        FeatureRecord r = record(noAnchors, FRIDAY, false, "0");

        assertThat(unscaled(r, "HasCompetition")).isEqualTo(1.0);
        assertThat(unscaled(r, "HasCompetitionData")).isEqualTo(0.0);
        assertThat(unscaled(r, "CompetitionMonthsOpen")).isEqualTo(0.0);
    }

    @Test
    void unknownCompetitionDistance_encodesZeroDistance() {
        encoder.fitTransform(corpus());
        StoreProfile noCompetitor = store(6, "a", "a", null, null, null, false, null, null);
        FeatureRecord r = record(noCompetitor, FRIDAY, false, "0");

        assertThat(unscaled(r, "CompetitionDistance")).isEqualTo(0.0);
        assertThat(unscaled(r, "HasCompetition")).isEqualTo(0.0);
    }

    @Test
    void knownCompetitionAnchors_countMonthsOpen() {
        encoder.fitTransform(corpus());
        StoreProfile opened = store(7, "a", "a", 800.0, 9, 2013, false, null, null);

        assertThat(unscaled(record(opened, FRIDAY, false, "0"), "CompetitionMonthsOpen")).isEqualTo(22.0);
    }

    @Test
    void competitorOpeningAfterDate_isClippedToZero() {
        encoder.fitTransform(corpus());
        StoreProfile future = store(8, "a", "a", 800.0, 12, 2015, false, null, null);

        assertThat(unscaled(record(future, FRIDAY, false, "0"), "CompetitionMonthsOpen")).isEqualTo(0.0);
        assertThat(unscaled(record(future, FRIDAY, false, "0"), "HasCompetitionData")).isEqualTo(1.0);
    }

    @Test
    void inactivePromo2_yieldsZeroWeeks() {
        encoder.fitTransform(corpus());
        StoreProfile inactive = store(10, "a", "a", 800.0, 1, 2010, false, 10, 2014);

        assertThat(unscaled(record(inactive, FRIDAY, false, "0"), "Promo2LastsForNWeeks")).isEqualTo(0.0);
    }

    @Test
    void activePromo2_countsWeeksSinceStart() {
        encoder.fitTransform(corpus());
        StoreProfile active = store(11, "a", "a", 800.0, 1, 2010, true, 10, 2014);

        // 2015-07-31 falls in ISO week 31
        assertThat(unscaled(record(active, FRIDAY, false, "0"), "Promo2LastsForNWeeks")).isEqualTo(73.0);
    }

    @Test
    void weekendFlag_followsDayOfWeekNotDayOfMonth() {
        encoder.fitTransform(corpus());

        assertThat(unscaled(record(storeA, FRIDAY, false, "0"), "IsWeekend")).isEqualTo(1.0);
        assertThat(unscaled(record(storeA, SATURDAY, false, "0"), "IsWeekend")).isEqualTo(1.0);
        assertThat(unscaled(record(storeA, MONDAY, false, "0"), "IsWeekend")).isEqualTo(0.0);
        assertThat(unscaled(record(storeA, SATURDAY, false, "0"), "Day")).isEqualTo(1.0);
        assertThat(unscaled(record(storeA, SATURDAY, false, "0"), "Month")).isEqualTo(8.0);
    }

    @Test
    void buildScenarioVector_synthesisesOpenNonHolidayDay() {
        encoder.fitTransform(corpus());

        double[] scenario = encoder.buildScenarioVector(2, SATURDAY, true, storeC);
        FeatureRecord expected = FeatureRecord.scenario(2, SATURDAY, true, storeC);

        assertThat(scenario).containsExactly(encoder.transform(expected));
        assertThat(unscaled(expected, "DayOfWeek")).isEqualTo(6.0);
        assertThat(unscaled(expected, "Promo")).isEqualTo(1.0);
        assertThat(unscaled(expected, "SchoolHoliday")).isEqualTo(0.0);
        assertThat(unscaled(expected, "StateHoliday_0")).isEqualTo(1.0);
        assertThat(unscaled(expected, "StateHoliday_a")).isEqualTo(0.0);
        assertThat(unscaled(expected, "StoreType_a")).isEqualTo(1.0);
    }

    @Test
    void fitTransform_calledTwice_fails() {
        encoder.fitTransform(corpus());

        assertThatThrownBy(() -> encoder.fitTransform(corpus()))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void fitTransform_emptyCorpus_fails() {
        assertThatThrownBy(() -> encoder.fitTransform(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(encoder.isFitted()).isFalse();
    }

    @Test
    void transform_beforeFit_throwsNotFitted() {
        assertThatThrownBy(() -> encoder.transform(record(storeA, MONDAY, false, "0")))
            .isInstanceOf(NotFittedException.class)
            .hasMessageContaining("FeatureEncoder");
        assertThatThrownBy(() -> encoder.featureNames()).isInstanceOf(NotFittedException.class);
    }
}
