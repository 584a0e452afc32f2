package com.salesadvisor.model;

import java.util.List;

public interface SalesModel {

    double predict(double[] features);

    String type();

    /**
     * Column names the model was trained on, in order. Empty when the model does not declare them.
     */
    default List<String> featureNames() {
        return List.of();
    }

    /**
     * Expected vector width, or -1 when any width is accepted.
     */
    default int inputWidth() {
        return featureNames().isEmpty() ? -1 : featureNames().size();
    }
}
