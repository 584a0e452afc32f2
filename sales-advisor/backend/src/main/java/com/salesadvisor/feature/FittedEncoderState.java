package com.salesadvisor.feature;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Column schema and normalisation parameters frozen by {@link FeatureEncoder#fitTransform}.
 * Instances are immutable and safe to share between request threads.
 */
public final class FittedEncoderState {

    private final List<FeatureColumn> columns;
    private final List<String> featureNames;
    private final double[] means;
    private final double[] scales;
    private final Map<CategoricalAttribute, List<String>> levels;

    FittedEncoderState(List<FeatureColumn> columns, double[] means, double[] scales,
                       Map<CategoricalAttribute, List<String>> levels) {
        if (columns.size() != means.length || columns.size() != scales.length) {
            throw new IllegalArgumentException("Normalisation parameters do not match the column schema");
        }
        this.columns = List.copyOf(columns);
        this.featureNames = this.columns.stream().map(FeatureColumn::name).toList();
        this.means = means.clone();
        this.scales = scales.clone();
        Map<CategoricalAttribute, List<String>> copy = new EnumMap<>(CategoricalAttribute.class);
        levels.forEach((attribute, observed) -> copy.put(attribute, List.copyOf(observed)));
        this.levels = Collections.unmodifiableMap(copy);
    }

    public int width() {
        return columns.size();
    }

    public List<String> featureNames() {
        return featureNames;
    }

    public int indexOf(String featureName) {
        return featureNames.indexOf(featureName);
    }

    public double mean(int column) {
        return means[column];
    }

    public double scale(int column) {
        return scales[column];
    }

    public List<String> levels(CategoricalAttribute attribute) {
        return levels.getOrDefault(attribute, List.of());
    }

    double[] encode(DerivedFeatures features) {
        double[] row = new double[columns.size()];
        for (int c = 0; c < row.length; c++) {
            row[c] = columns.get(c).valueOf(features);
        }
        return row;
    }

    double[] normalize(double[] raw) {
        double[] scaled = new double[raw.length];
        for (int c = 0; c < raw.length; c++) {
            scaled[c] = (raw[c] - means[c]) / scales[c];
        }
        return scaled;
    }
}
