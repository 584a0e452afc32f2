package com.salesadvisor.model;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Wraps a {@link SalesModel} and guarantees a non-negative, finite forecast.
 * A forecaster backed by the placeholder model is reported as degraded.
 */
@Slf4j
public final class Forecaster {

    private final SalesModel model;
    private final boolean degraded;

    private Forecaster(SalesModel model, boolean degraded) {
        this.model = model;
        this.degraded = degraded;
    }

    public static Forecaster trained(SalesModel model) {
        return new Forecaster(model, false);
    }

    public static Forecaster placeholder() {
        return new Forecaster(new PlaceholderSalesModel(), true);
    }

    public double predict(double[] features) {
        double prediction = model.predict(features);
        if (!Double.isFinite(prediction)) {
            throw new IllegalStateException("Model " + model.type() + " produced a non-finite prediction: " + prediction);
        }
        return Math.max(0.0, prediction);
    }

    public Forecaster compatibleWith(List<String> featureNames) {
        List<String> declared = model.featureNames();
        if (!declared.isEmpty() && !declared.equals(featureNames)) {
            log.warn("Model schema mismatch | model={} | declaredFeatures={} | encoderFeatures={} | using placeholder model",
                     model.type(), declared.size(), featureNames.size());
            return placeholder();
        }
        int width = model.inputWidth();
        if (width >= 0 && width != featureNames.size()) {
            log.warn("Model width mismatch | model={} | expected={} | encoderFeatures={} | using placeholder model",
                     model.type(), width, featureNames.size());
            return placeholder();
        }
        return this;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public String modelType() {
        return model.type();
    }

    public SalesModel model() {
        return model;
    }
}
