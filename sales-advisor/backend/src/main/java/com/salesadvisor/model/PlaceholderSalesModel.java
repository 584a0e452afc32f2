package com.salesadvisor.model;

public class PlaceholderSalesModel implements SalesModel {

    static final double BASE_SALES = 6000.0;
    static final double FEATURE_WEIGHT = 100.0;
    static final double MIN_SALES = 1000.0;

    @Override
    public double predict(double[] features) {
        double sum = 0.0;
        for (double value : features) {
            sum += value;
        }
        return Math.max(BASE_SALES + sum * FEATURE_WEIGHT, MIN_SALES);
    }

    @Override
    public String type() {
        return "placeholder";
    }
}
