package com.salesadvisor.feature;

import com.salesadvisor.entity.StoreProfile;
import com.salesadvisor.exception.NotFittedException;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns joined sales records into fixed-width, standardised feature vectors.
 *
 * <p>{@link #fitTransform} runs once per instance and freezes the column schema
 * (numeric columns first, then one-hot blocks over the categorical levels seen in the
 * corpus) together with per-column mean and scale. Every later {@link #transform} call
 * reuses that schema verbatim: levels unseen at fit time produce an all-zero block and
 * never add columns.
 */
@Slf4j
public class FeatureEncoder {

    private static final double ZERO_VARIANCE_TOLERANCE = 1e-12;

    private volatile FittedEncoderState state;

    public synchronized double[][] fitTransform(List<FeatureRecord> records) {
        if (state != null) {
            throw new IllegalStateException("FeatureEncoder is already fitted; create a new instance to refit");
        }
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit FeatureEncoder on an empty corpus");
        }

        List<DerivedFeatures> derived = records.stream().map(FeatureDerivation::derive).toList();

        List<FeatureColumn> columns = new ArrayList<>(FeatureColumn.NUMERIC);
        Map<CategoricalAttribute, List<String>> levels = new EnumMap<>(CategoricalAttribute.class);
        for (CategoricalAttribute attribute : CategoricalAttribute.values()) {
            List<String> observed = derived.stream()
                .map(attribute::valueOf)
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();
            levels.put(attribute, observed);
            observed.forEach(level -> columns.add(FeatureColumn.oneHot(attribute, level)));
        }

        int width = columns.size();
        double[][] raw = new double[derived.size()][];
        for (int i = 0; i < raw.length; i++) {
            double[] row = new double[width];
            for (int c = 0; c < width; c++) {
                row[c] = columns.get(c).valueOf(derived.get(i));
            }
            raw[i] = row;
        }

        double[] means = new double[width];
        double[] scales = new double[width];
        for (int c = 0; c < width; c++) {
            means[c] = columnMean(raw, c);
            double std = columnStd(raw, c, means[c]);
            scales[c] = std > ZERO_VARIANCE_TOLERANCE * Math.max(1.0, Math.abs(means[c])) ? std : 1.0;
        }

        FittedEncoderState fitted = new FittedEncoderState(columns, means, scales, levels);
        double[][] matrix = new double[raw.length][];
        for (int i = 0; i < raw.length; i++) {
            matrix[i] = fitted.normalize(raw[i]);
        }
        state = fitted;

        log.info("FeatureEncoder fitted | rows={} | features={} | storeTypes={} | assortments={} | stateHolidays={}",
                 raw.length, width, levels.get(CategoricalAttribute.STORE_TYPE),
                 levels.get(CategoricalAttribute.ASSORTMENT), levels.get(CategoricalAttribute.STATE_HOLIDAY));
        return matrix;
    }

    public double[][] transform(List<FeatureRecord> records) {
        FittedEncoderState fitted = requireState();
        double[][] matrix = new double[records.size()][];
        for (int i = 0; i < matrix.length; i++) {
            matrix[i] = fitted.normalize(fitted.encode(FeatureDerivation.derive(records.get(i))));
        }
        return matrix;
    }

    public double[] transform(FeatureRecord record) {
        FittedEncoderState fitted = requireState();
        return fitted.normalize(fitted.encode(FeatureDerivation.derive(record)));
    }

    public double[] encodeUnscaled(FeatureRecord record) {
        return requireState().encode(FeatureDerivation.derive(record));
    }

    public double[] buildScenarioVector(int storeId, LocalDate date, boolean promo, StoreProfile profile) {
        return transform(FeatureRecord.scenario(storeId, date, promo, profile));
    }

    public List<String> featureNames() {
        return requireState().featureNames();
    }

    public FittedEncoderState state() {
        return requireState();
    }

    public boolean isFitted() {
        return state != null;
    }

    private FittedEncoderState requireState() {
        FittedEncoderState fitted = state;
        if (fitted == null) {
            throw new NotFittedException("FeatureEncoder");
        }
        return fitted;
    }

    private static double columnMean(double[][] rows, int column) {
        double sum = 0.0;
        for (double[] row : rows) {
            sum += row[column];
        }
        return sum / rows.length;
    }

    private static double columnStd(double[][] rows, int column, double mean) {
        double sumSq = 0.0;
        for (double[] row : rows) {
            double d = row[column] - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / rows.length);
    }
}
