package com.salesadvisor.service;

import com.salesadvisor.entity.SalesObservation;
import com.salesadvisor.entity.StoreProfile;
import com.salesadvisor.exception.PipelineInitializationException;
import com.salesadvisor.feature.FeatureRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins observations with store profiles and keeps open days with positive sales.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CorpusLoader {

    private final HistoricalCorpusProvider provider;

    public TrainingCorpus load() {
        List<SalesObservation> observations = provider.loadObservations();
        Map<Integer, StoreProfile> stores = new HashMap<>();
        for (StoreProfile store : provider.loadStoreProfiles()) {
            stores.put(store.getStoreId(), store);
        }

        List<FeatureRecord> records = new ArrayList<>(observations.size());
        List<SalesObservation> kept = new ArrayList<>(observations.size());
        int missingStore = 0;
        int closed = 0;
        int nonPositiveSales = 0;
        for (SalesObservation observation : observations) {
            StoreProfile store = stores.get(observation.getStoreId());
            if (store == null) {
                missingStore++;
            } else if (!observation.isOpen()) {
                closed++;
            } else if (!(observation.getSales() > 0)) {
                nonPositiveSales++;
            } else {
                records.add(FeatureRecord.of(observation, store));
                kept.add(observation);
            }
        }

        int dropped = missingStore + closed + nonPositiveSales;
        if (dropped > 0) {
            log.warn("Corpus rows skipped | missingStore={} | closed={} | nonPositiveSales={}",
                     missingStore, closed, nonPositiveSales);
        }
        if (records.isEmpty()) {
            throw new PipelineInitializationException(
                "No valid observations in corpus (raw=" + observations.size() + ", stores=" + stores.size() + ")");
        }

        double[] targets = new double[kept.size()];
        boolean[] promoFlags = new boolean[kept.size()];
        for (int i = 0; i < targets.length; i++) {
            targets[i] = kept.get(i).getSales();
            promoFlags[i] = kept.get(i).isPromo();
        }
        log.info("Corpus loaded | observations={} | stores={} | valid={} | dropped={}",
                 observations.size(), stores.size(), records.size(), dropped);
        return new TrainingCorpus(List.copyOf(records), targets, promoFlags, observations.size(), dropped);
    }
}
