package com.salesadvisor.model;

import java.util.List;

public class LinearSalesModel implements SalesModel {

    private final double intercept;
    private final double[] coefficients;
    private final List<String> featureNames;

    public LinearSalesModel(double intercept, double[] coefficients, List<String> featureNames) {
        if (coefficients.length == 0) {
            throw new IllegalArgumentException("Linear model needs at least one coefficient");
        }
        if (!featureNames.isEmpty() && featureNames.size() != coefficients.length) {
            throw new IllegalArgumentException("Linear model declares " + featureNames.size()
                + " feature names but " + coefficients.length + " coefficients");
        }
        this.intercept = intercept;
        this.coefficients = coefficients.clone();
        this.featureNames = List.copyOf(featureNames);
    }

    @Override
    public double predict(double[] features) {
        if (features.length != coefficients.length) {
            throw new IllegalArgumentException("Expected " + coefficients.length + " features, got " + features.length);
        }
        double prediction = intercept;
        for (int i = 0; i < features.length; i++) {
            prediction += coefficients[i] * features[i];
        }
        return prediction;
    }

    @Override
    public String type() {
        return "linear";
    }

    @Override
    public List<String> featureNames() {
        return featureNames;
    }

    @Override
    public int inputWidth() {
        return coefficients.length;
    }
}
