package com.salesadvisor.service;

import com.salesadvisor.feature.FeatureRecord;

import java.util.List;

/**
 * Validated training rows with targets and promo flags aligned by index.
 */
public record TrainingCorpus(
    List<FeatureRecord> records,
    double[] targets,
    boolean[] promoFlags,
    int rawCount,
    int droppedCount
) {

    public int size() {
        return records.size();
    }
}
